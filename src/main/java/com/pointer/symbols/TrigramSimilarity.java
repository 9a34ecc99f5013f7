package com.pointer.symbols;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public final class TrigramSimilarity {
    private TrigramSimilarity() {
    }

    public static double similarity(String left, String right) {
        Set<String> a = trigrams(left);
        Set<String> b = trigrams(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String trigram : a) {
            if (b.contains(trigram)) {
                shared++;
            }
        }
        return (double) shared / (a.size() + b.size() - shared);
    }

    /**
     * Best similarity of {@code query} against any window of {@code text} holding the same number
     * of words, so a short query can match a long line.
     */
    public static double bestWindowSimilarity(String query, String text) {
        String[] queryWords = words(query);
        String[] textWords = words(text);
        if (queryWords.length == 0 || textWords.length == 0) {
            return 0.0;
        }
        if (textWords.length <= queryWords.length) {
            return similarity(query, text);
        }
        String joinedQuery = String.join(" ", queryWords);
        double best = 0.0;
        for (int i = 0; i + queryWords.length <= textWords.length; i++) {
            String window = String.join(" ", Arrays.copyOfRange(textWords, i, i + queryWords.length));
            best = Math.max(best, similarity(joinedQuery, window));
            if (best == 1.0) {
                break;
            }
        }
        return best;
    }

    public static Set<String> trigrams(String value) {
        Set<String> trigrams = new HashSet<>();
        if (value == null) {
            return trigrams;
        }
        for (String word : words(value)) {
            String padded = "  " + word + " ";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                trigrams.add(padded.substring(i, i + 3));
            }
        }
        return trigrams;
    }

    private static String[] words(String value) {
        if (value == null) {
            return new String[0];
        }
        return Arrays.stream(value.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(word -> !word.isEmpty())
                .toArray(String[]::new);
    }
}
