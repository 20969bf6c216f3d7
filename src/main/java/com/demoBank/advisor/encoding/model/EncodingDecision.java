package com.demoBank.advisor.encoding.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What the encoding gate decided about one prompt.
 *
 * @param decision         pass, repair or fail_fast
 * @param mojibakeScore    score of the text that leaves the gate, in [0, 1]
 * @param repairApplied    whether a repair strategy replaced the text
 * @param encodingGuess    name of the applied strategy, empty when none
 * @param reasonCodes      sorted, distinct reason codes
 * @param inputFingerprint first 16 hex chars of the SHA-256 of the raw input
 */
public record EncodingDecision(
        @JsonProperty("decision") GateDecision decision,
        @JsonProperty("mojibake_score") double mojibakeScore,
        @JsonProperty("repair_applied") boolean repairApplied,
        @JsonProperty("encoding_guess") String encodingGuess,
        @JsonProperty("reason_codes") List<String> reasonCodes,
        @JsonProperty("input_fingerprint") String inputFingerprint) {

    public EncodingDecision {
        reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
        encodingGuess = encodingGuess == null ? "" : encodingGuess;
    }

    public boolean isFailFast() {
        return decision == GateDecision.FAIL_FAST;
    }
}
