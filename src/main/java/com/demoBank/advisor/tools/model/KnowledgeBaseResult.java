package com.demoBank.advisor.tools.model;

import java.util.List;

/**
 * Knowledge-base retrieval result. Failures are represented as no matches plus a note.
 */
public record KnowledgeBaseResult(List<KnowledgeMatch> matches, String note) {

    public KnowledgeBaseResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
        note = note == null ? "" : note;
    }

    public static KnowledgeBaseResult empty(String note) {
        return new KnowledgeBaseResult(List.of(), note);
    }

    /**
     * Distinct non-blank citations in match order.
     */
    public List<String> citations() {
        return matches.stream()
                .map(KnowledgeMatch::citation)
                .filter(citation -> citation != null && !citation.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }
}
