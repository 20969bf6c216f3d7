package com.demoBank.advisor.router.util;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical helpers over accent-stripped, lower-cased prompts.
 */
public class PromptText {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");

    private PromptText() {}

    /**
     * Removes diacritics (including the Vietnamese đ) and lower-cases the text.
     */
    public static String fold(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return stripped.replace('đ', 'd').replace('Đ', 'D').toLowerCase(Locale.ROOT);
    }

    public static boolean containsAny(String foldedText, Collection<String> terms) {
        for (String term : terms) {
            if (foldedText.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
