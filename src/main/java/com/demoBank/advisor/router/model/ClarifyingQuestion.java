package com.demoBank.advisor.router.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single clarifying question with a closed list of at most three options.
 */
public record ClarifyingQuestion(
        @JsonProperty("question_id") String questionId,
        @JsonProperty("question_text") String questionText,
        @JsonProperty("options") List<String> options,
        @JsonProperty("max_questions") int maxQuestions) {

    public ClarifyingQuestion {
        options = options == null ? List.of() : List.copyOf(options);
        if (options.size() > 3) {
            throw new IllegalArgumentException("A clarifying question offers at most three options");
        }
    }
}
