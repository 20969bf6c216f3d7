package com.demoBank.advisor.response.model;

import com.demoBank.advisor.router.model.IntentName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything an answer may draw on: facts, insights, actions, citations and policy flags.
 */
public record AdvisoryContext(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("intent") IntentName intent,
        @JsonProperty("language") String language,
        @JsonProperty("facts") List<Fact> facts,
        @JsonProperty("insights") List<Insight> insights,
        @JsonProperty("actions") List<ActionCandidate> actions,
        @JsonProperty("citations") List<String> citations,
        @JsonProperty("policy_flags") Map<String, Object> policyFlags) {

    public static final String SCHEMA_VERSION = "advisory_context_v1";

    public AdvisoryContext {
        schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        intent = intent == null ? IntentName.OUT_OF_SCOPE : intent;
        facts = facts == null ? List.of() : List.copyOf(facts);
        insights = insights == null ? List.of() : List.copyOf(insights);
        actions = actions == null ? List.of() : List.copyOf(actions);
        citations = citations == null ? List.of() : List.copyOf(citations);
        policyFlags = policyFlags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(policyFlags));
    }

    public Optional<Fact> fact(String factId) {
        return facts.stream().filter(fact -> fact.factId().equals(factId)).findFirst();
    }

    @JsonIgnore
    public boolean isVietnamese() {
        return "vi".equals(language);
    }

    @JsonIgnore
    public boolean isEducationOnly() {
        return Boolean.TRUE.equals(policyFlags.get("education_only"));
    }
}
