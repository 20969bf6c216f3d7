package com.demoBank.advisor.router.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Clarification round counter kept per customer in the session.
 * Only the router advances it; the round never decreases while a clarification is pending.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClarificationState {

    /**
     * Whether the last turn ended with a clarifying question.
     */
    private boolean pending;

    /**
     * Number of clarifying questions asked in a row.
     */
    private int round;

    /**
     * Upper bound on consecutive clarifying questions.
     */
    private int maxQuestions;

    /**
     * The last question asked, null when none is pending.
     */
    private ClarifyingQuestion question;

    /**
     * When the last question was asked.
     */
    private Instant askedAt;

    public static ClarificationState initial(int maxQuestions) {
        return ClarificationState.builder()
                .pending(false)
                .round(0)
                .maxQuestions(Math.max(1, maxQuestions))
                .build();
    }

    public boolean isExhausted() {
        return round >= maxQuestions;
    }
}
