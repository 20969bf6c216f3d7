package com.demoBank.advisor.encoding.service;

import com.demoBank.advisor.config.EncodingGateSettings;
import com.demoBank.advisor.encoding.model.EncodingDecision;
import com.demoBank.advisor.encoding.model.GateDecision;
import com.demoBank.advisor.encoding.model.GateOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Encoding gate - admission control for malformed prompts.
 *
 * Responsibilities:
 * - Normalize the prompt to the configured Unicode form
 * - Score mojibake signatures (replacement chars, double-encoding patterns, control chars)
 * - Try deterministic re-decoding repairs when the score is high enough
 * - Fail fast when the text is still unreadable
 *
 * The gate is a pure function of (text, settings): applying it twice to a clean prompt yields the same
 * text and decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EncodingGate {

    private static final List<String> MOJIBAKE_PATTERNS = List.of("Ã", "Â", "á»", "â€", "Æ");
    private static final List<String> REPAIR_STRATEGIES = List.of("latin1_to_utf8", "cp1252_to_utf8");
    private static final List<String> SUPPORTED_FORMS = List.of("NFC", "NFD", "NFKC", "NFKD");

    private final EncodingGateSettings settings;

    /**
     * Runs the gate over a raw prompt.
     *
     * @param prompt raw user prompt, may be null
     * @return the text to continue with and the gate decision
     */
    public GateOutcome apply(String prompt) {
        String original = prompt == null ? "" : prompt;
        Normalizer.Form form = resolveForm(settings.normalizationForm());
        String normalized = Normalizer.normalize(original, form);
        String fingerprint = fingerprint(original);
        Score score = score(normalized);
        List<String> reasonCodes = new ArrayList<>(score.reasons());
        String normalizedReason = "normalized_" + form.name().toLowerCase(Locale.ROOT);

        if (!settings.enabled()) {
            reasonCodes.add("encoding_gate_disabled");
            reasonCodes.add(normalizedReason);
            return new GateOutcome(normalized, new EncodingDecision(GateDecision.PASS, score.value(), false, "",
                    sortedDistinct(reasonCodes), fingerprint));
        }

        String selectedText = normalized;
        double selectedScore = score.value();
        String selectedGuess = "";
        boolean repairApplied = false;

        if (settings.repairEnabled() && score.value() >= Math.max(0.0, settings.repairScoreMin())) {
            Optional<Candidate> best = REPAIR_STRATEGIES.stream()
                    .map(strategy -> repairCandidate(normalized, strategy, form, score.value()))
                    .flatMap(Optional::stream)
                    .min(Comparator.comparingDouble(Candidate::score).thenComparing(Candidate::strategy));
            if (best.isPresent()) {
                selectedText = best.get().text();
                selectedScore = best.get().score();
                selectedGuess = best.get().strategy();
                repairApplied = true;
                reasonCodes.add("repair_applied_" + selectedGuess);
            } else {
                reasonCodes.add("repair_not_improved");
            }
        }

        GateDecision decision = repairApplied ? GateDecision.REPAIR : GateDecision.PASS;
        if (selectedScore >= settings.failfastScoreMin()) {
            decision = GateDecision.FAIL_FAST;
            reasonCodes.add("encoding_fail_fast_threshold_exceeded");
        }
        reasonCodes.add(normalizedReason);

        EncodingDecision result = new EncodingDecision(decision, clamp01(selectedScore), repairApplied, selectedGuess,
                sortedDistinct(reasonCodes), fingerprint);
        if (decision != GateDecision.PASS) {
            log.info("Encoding gate - decision: {}, score: {}, guess: {}, fingerprint: {}",
                    decision.code(), String.format("%.3f", result.mojibakeScore()), selectedGuess, fingerprint);
        }
        return new GateOutcome(selectedText, result);
    }

    /**
     * Mojibake score of an already normalized text, in [0, 1].
     */
    double scoreOf(String text) {
        return score(text).value();
    }

    private Optional<Candidate> repairCandidate(String text, String strategy, Normalizer.Form form, double baseScore) {
        return attemptRepair(text, strategy)
                .map(repaired -> Normalizer.normalize(repaired, form))
                .map(repaired -> new Candidate(strategy, repaired, score(repaired).value()))
                .filter(candidate -> baseScore - candidate.score() >= settings.repairMinDelta());
    }

    private Optional<String> attemptRepair(String text, String strategy) {
        Charset source = switch (strategy) {
            case "latin1_to_utf8" -> StandardCharsets.ISO_8859_1;
            case "cp1252_to_utf8" -> Charset.forName("windows-1252");
            default -> null;
        };
        if (source == null) {
            return Optional.empty();
        }
        try {
            ByteBuffer bytes = source.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));
            String decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(bytes)
                    .toString();
            return Optional.of(decoded);
        } catch (CharacterCodingException e) {
            log.debug("Repair strategy not applicable - strategy: {}, reason: {}", strategy, e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    private Score score(String text) {
        if (text.isEmpty()) {
            return new Score(0.0, List.of("clean_utf8"));
        }
        int length = Math.max(1, text.codePointCount(0, text.length()));
        long replacements = text.codePoints().filter(cp -> cp == 0xFFFD).count();
        long patternHits = MOJIBAKE_PATTERNS.stream().mapToLong(pattern -> occurrences(text, pattern)).sum();
        long controls = text.codePoints()
                .filter(cp -> cp != '\n' && cp != '\r' && cp != '\t')
                .filter(EncodingGate::isOtherCategory)
                .count();

        double replacementRatio = (double) replacements / length;
        double patternRatio = (double) patternHits / length;
        double controlRatio = (double) controls / length;

        List<String> reasons = new ArrayList<>();
        if (replacementRatio > 0) {
            reasons.add("replacement_char_detected");
        }
        if (patternRatio > 0) {
            reasons.add("mojibake_pattern_detected");
        }
        if (controlRatio > 0) {
            reasons.add("control_char_detected");
        }
        if (reasons.isEmpty()) {
            reasons.add("clean_utf8");
        }
        double value = replacementRatio * 0.65 + patternRatio * 2.5 + controlRatio * 1.8;
        return new Score(clamp01(value), reasons);
    }

    // Unicode general category C*: Cc, Cf, Co, Cs, Cn
    private static boolean isOtherCategory(int codePoint) {
        int type = Character.getType(codePoint);
        return type == Character.CONTROL
                || type == Character.FORMAT
                || type == Character.PRIVATE_USE
                || type == Character.SURROGATE
                || type == Character.UNASSIGNED;
    }

    private static long occurrences(String text, String pattern) {
        long count = 0;
        int from = 0;
        int index;
        while ((index = text.indexOf(pattern, from)) >= 0) {
            count++;
            from = index + pattern.length();
        }
        return count;
    }

    private static Normalizer.Form resolveForm(String configured) {
        String form = configured == null ? "NFC" : configured.trim().toUpperCase(Locale.ROOT);
        return SUPPORTED_FORMS.contains(form) ? Normalizer.Form.valueOf(form) : Normalizer.Form.NFC;
    }

    private static String fingerprint(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static List<String> sortedDistinct(List<String> codes) {
        return List.copyOf(new TreeSet<>(codes));
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private record Score(double value, List<String> reasons) {
    }

    private record Candidate(String strategy, String text, double score) {
    }
}
