package com.demoBank.advisor.language.service;

import com.demoBank.advisor.language.model.LanguageDetectionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Language Detector service.
 *
 * Responsibilities:
 * - Detect if the incoming prompt is Vietnamese or English
 * - Pick the language of every fixed message (refusal, clarification, fallback)
 *
 * Detection strategy:
 * - Vietnamese-only letters (đ, ơ, ư, ă and the tone-marked vowels) classify the prompt as Vietnamese
 * - Unaccented prompts are classified Vietnamese when they contain common Vietnamese finance words
 * - Otherwise, default to English
 */
@Slf4j
@Service
public class LanguageDetector {

    /**
     * Letters that only occur in Vietnamese among the Latin scripts we serve.
     */
    private static final Pattern VIETNAMESE_PATTERN = Pattern.compile(
            "[ăâđêôơưĂÂĐÊÔƠƯ\\u1EA0-\\u1EF9]"
    );

    private static final Pattern WORD_SPLIT = Pattern.compile("[^a-z]+");

    private static final List<String> UNACCENTED_MARKERS = List.of(
            "toi", "cua", "thang", "chi tieu", "tiet kiem", "dong tien", "thu nhap", "giao dich",
            "bao nhieu", "co the", "khong", "nhu the nao", "tai chinh", "ngan hang"
    );

    /**
     * Detects the language of the given prompt.
     *
     * @param text The prompt text to analyze
     * @return LanguageDetectionResult indicating Vietnamese or English
     */
    public LanguageDetectionResult detectLanguage(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Empty prompt provided for language detection");
            return LanguageDetectionResult.builder()
                    .languageCode(LanguageDetectionResult.ENGLISH)
                    .confidence(0.0)
                    .build();
        }

        String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        long letters = composed.codePoints().filter(Character::isLetter).count();
        long vietnameseLetters = composed.codePoints()
                .filter(cp -> VIETNAMESE_PATTERN.matcher(new String(Character.toChars(cp))).matches())
                .count();

        if (vietnameseLetters > 0) {
            double confidence = letters == 0 ? 0.5 : Math.min(1.0, 0.6 + (double) vietnameseLetters / letters);
            return result(LanguageDetectionResult.VIETNAMESE, confidence);
        }

        String padded = " " + String.join(" ", WORD_SPLIT.split(composed.toLowerCase(Locale.ROOT))) + " ";
        long markerHits = UNACCENTED_MARKERS.stream()
                .filter(marker -> padded.contains(" " + marker + " "))
                .count();
        if (markerHits >= 2) {
            return result(LanguageDetectionResult.VIETNAMESE, Math.min(1.0, 0.5 + 0.1 * markerHits));
        }

        double confidence = letters == 0 ? 0.5 : 1.0 - Math.min(0.5, 0.1 * markerHits);
        return result(LanguageDetectionResult.ENGLISH, confidence);
    }

    private LanguageDetectionResult result(String languageCode, double confidence) {
        log.debug("Language detection - detected: {}, confidence: {}",
                languageCode, String.format("%.2f", confidence));
        return LanguageDetectionResult.builder()
                .languageCode(languageCode)
                .confidence(confidence)
                .build();
    }
}
