package com.demoBank.advisor.tools.model;

/**
 * One knowledge-base passage.
 */
public record KnowledgeMatch(String id, String snippet, String citation, double score) {
}
