package com.demoBank.advisor.language.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of language detection.
 * Indicates whether the prompt is Vietnamese or English.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LanguageDetectionResult {

    public static final String VIETNAMESE = "vi";
    public static final String ENGLISH = "en";

    /**
     * Detected language code: "vi" for Vietnamese, "en" for English.
     */
    private String languageCode;

    /**
     * Confidence score (0.0 to 1.0) indicating detection confidence.
     */
    private double confidence;

    public boolean isVietnamese() {
        return VIETNAMESE.equals(languageCode);
    }

    public boolean isEnglish() {
        return ENGLISH.equals(languageCode);
    }
}
