package com.demoBank.advisor.gateway.model;

import com.demoBank.advisor.router.model.ClarificationState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Advisory session - conversation state kept per customer.
 *
 * Scoped to the customer id; expires after 30 minutes idle.
 * Stores derived state only, never the raw chat history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdvisorySession {

    private String sessionId;

    private String customerId;

    /**
     * Language of the first turn ("vi" or "en"), kept for audit.
     */
    private String languageCode;

    /**
     * Clarification round counter. Only the router writes it; clients cannot set it.
     */
    private ClarificationState clarificationState;

    private Instant createdAt;

    private Instant lastAccessedAt;

    public void touch() {
        this.lastAccessedAt = Instant.now();
    }

    public boolean isLanguageEstablished() {
        return languageCode != null;
    }
}
