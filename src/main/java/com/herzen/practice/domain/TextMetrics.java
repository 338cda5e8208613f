package com.herzen.practice.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextMetrics {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("\\W+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private TextMetrics() {}

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    /** Whitespace-delimited non-empty tokens. */
    public static int wordCount(String text) {
        if (isBlank(text)) return 0;
        return (int) Arrays.stream(WHITESPACE.split(text.trim())).filter(w -> !w.isEmpty()).count();
    }

    /** Lowercased word tokens, punctuation dropped. */
    public static List<String> tokens(String text) {
        if (isBlank(text)) return List.of();
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    public static long sentenceCount(String text) {
        if (isBlank(text)) return 0;
        return Arrays.stream(SENTENCE_END.split(text)).filter(s -> !s.isBlank()).count();
    }
}
