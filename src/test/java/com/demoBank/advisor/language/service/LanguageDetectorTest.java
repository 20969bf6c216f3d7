package com.demoBank.advisor.language.service;

import com.demoBank.advisor.language.model.LanguageDetectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LanguageDetector")
class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @Test
    @DisplayName("detects accented Vietnamese")
    void accentedVietnamese() {
        LanguageDetectionResult result = detector.detectLanguage("Tháng này tôi chi tiêu bao nhiêu?");

        assertTrue(result.isVietnamese());
        assertTrue(result.getConfidence() > 0.5);
    }

    @Test
    @DisplayName("detects unaccented Vietnamese from finance words")
    void unaccentedVietnamese() {
        assertTrue(detector.detectLanguage("chi tieu thang nay cua toi the nao").isVietnamese());
    }

    @Test
    @DisplayName("defaults to English")
    void english() {
        assertTrue(detector.detectLanguage("Should I buy stocks this week?").isEnglish());
        assertEquals("en", detector.detectLanguage("   ").getLanguageCode());
    }
}
