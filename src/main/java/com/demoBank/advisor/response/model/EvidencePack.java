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
 * Facts and citations gathered for one turn.
 */
public record EvidencePack(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("intent") IntentName intent,
        @JsonProperty("language") String language,
        @JsonProperty("facts") List<Fact> facts,
        @JsonProperty("citations") List<String> citations,
        @JsonProperty("policy_flags") Map<String, Object> policyFlags) {

    public static final String SCHEMA_VERSION = "evidence_pack_v1";

    public EvidencePack {
        schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        intent = intent == null ? IntentName.OUT_OF_SCOPE : intent;
        facts = facts == null ? List.of() : List.copyOf(facts);
        citations = citations == null ? List.of() : List.copyOf(citations);
        policyFlags = policyFlags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(policyFlags));
    }

    public Optional<Fact> fact(String factId) {
        return facts.stream().filter(fact -> fact.factId().equals(factId)).findFirst();
    }

    /**
     * First fact whose id starts with the prefix.
     */
    public Optional<Fact> firstWithPrefix(String prefix) {
        return facts.stream().filter(fact -> fact.factId().startsWith(prefix)).findFirst();
    }

    /**
     * Numeric value of the first fact with the prefix, or null.
     */
    public Double number(String prefix) {
        return firstWithPrefix(prefix).map(Fact::numericValue).orElse(null);
    }

    @JsonIgnore
    public boolean isVietnamese() {
        return "vi".equals(language);
    }
}
