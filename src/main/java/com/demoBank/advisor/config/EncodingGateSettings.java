package com.demoBank.advisor.config;

/**
 * Thresholds for the admission encoding gate.
 *
 * @param enabled            when false the gate only normalizes and always passes
 * @param repairEnabled      whether reverse-encoding repairs are attempted
 * @param repairScoreMin     minimum mojibake score before a repair is tried
 * @param failfastScoreMin   score at or above which the request is rejected
 * @param repairMinDelta     minimum score improvement for a repair candidate to be accepted
 * @param normalizationForm  NFC, NFD, NFKC or NFKD; anything else falls back to NFC
 */
public record EncodingGateSettings(
        boolean enabled,
        boolean repairEnabled,
        double repairScoreMin,
        double failfastScoreMin,
        double repairMinDelta,
        String normalizationForm) {

    public static EncodingGateSettings defaults() {
        return new EncodingGateSettings(true, true, 0.12, 0.45, 0.10, "NFC");
    }
}
