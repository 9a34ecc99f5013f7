package com.pointer.search;

import java.util.Comparator;
import java.util.Locale;

import com.pointer.symbols.SymbolKind;
import com.pointer.symbols.TrigramSimilarity;

public class RankingScorer {
    public static final int DEFINITION_BONUS = 120;
    public static final int DECLARATION_BONUS = 90;
    public static final int REFERENCE_BONUS = 50;
    public static final int EXACT_NAME_BONUS = 40;
    public static final int EXACT_FULLY_QUALIFIED_BONUS = 50;
    public static final int NO_NAMESPACE_BONUS = 70;
    public static final int NAMESPACE_PENALTY = -15;
    public static final int NAMESPACE_EXACT_BONUS = 100;
    public static final int NAMESPACE_CHILD_BONUS = 60;
    public static final int NAMESPACE_PARENT_BONUS = 30;
    public static final int NAMESPACE_UNRELATED_PENALTY = -40;
    public static final int PATH_EXACT_BONUS = 60;
    public static final int PATH_HINT_PREFIX_BONUS = 40;
    public static final int PATH_PREFIX_OF_HINT_BONUS = 20;
    public static final int PATH_SIMILARITY_SCALE = 30;
    public static final int PATH_SIMILARITY_OFFSET = -10;
    public static final int PATH_FLOOR = -10;
    public static final int NGRAM_SCALE = 100;

    public static final Comparator<SearchHit> ORDER = Comparator.comparingInt(SearchHit::score).reversed()
            .thenComparing(SearchHit::repository)
            .thenComparing(SearchHit::commit)
            .thenComparing(SearchHit::path)
            .thenComparingInt(SearchHit::line)
            .thenComparingInt(SearchHit::column)
            .thenComparing(SearchHit::name, Comparator.nullsFirst(Comparator.naturalOrder()));

    public int kindScore(SymbolKind kind) {
        if (kind == SymbolKind.DEFINITION) {
            return DEFINITION_BONUS;
        }
        if (kind == SymbolKind.DECLARATION) {
            return DECLARATION_BONUS;
        }
        return REFERENCE_BONUS;
    }

    public int nameScore(String query, String name, String fullyQualified) {
        int score = 0;
        if (name != null && name.equalsIgnoreCase(query)) {
            score += EXACT_NAME_BONUS;
        }
        if (fullyQualified != null && fullyQualified.equalsIgnoreCase(query)) {
            score += EXACT_FULLY_QUALIFIED_BONUS;
        }
        return score;
    }

    public int namespaceScore(String filter, String namespace) {
        boolean hasNamespace = namespace != null && !namespace.isBlank();
        if (filter == null || filter.isBlank()) {
            return hasNamespace ? NAMESPACE_PENALTY : NO_NAMESPACE_BONUS;
        }
        if (!hasNamespace) {
            return NAMESPACE_UNRELATED_PENALTY;
        }
        String wanted = normalizeNamespace(filter);
        String actual = normalizeNamespace(namespace);
        if (actual.equals(wanted)) {
            return NAMESPACE_EXACT_BONUS;
        }
        if (isWithin(actual, wanted)) {
            return NAMESPACE_CHILD_BONUS;
        }
        if (isWithin(wanted, actual)) {
            return NAMESPACE_PARENT_BONUS;
        }
        return NAMESPACE_UNRELATED_PENALTY;
    }

    public int pathScore(String hint, String path) {
        if (hint == null || hint.isBlank()) {
            return 0;
        }
        if (path.equals(hint)) {
            return PATH_EXACT_BONUS;
        }
        if (path.startsWith(hint)) {
            return PATH_HINT_PREFIX_BONUS;
        }
        if (hint.startsWith(path)) {
            return PATH_PREFIX_OF_HINT_BONUS;
        }
        double similarity = TrigramSimilarity.similarity(hint, path);
        return Math.max(PATH_FLOOR, (int) Math.round(PATH_SIMILARITY_SCALE * similarity) + PATH_SIMILARITY_OFFSET);
    }

    public int textScore(TextMatchMode mode, double similarity) {
        return mode == TextMatchMode.NGRAM ? (int) Math.round(NGRAM_SCALE * similarity) : 0;
    }

    public int symbolScore(String query, String namespaceFilter, String pathHint, SymbolKind kind, String name,
                           String namespace, String fullyQualified, String path) {
        return kindScore(kind)
                + nameScore(query, name, fullyQualified)
                + namespaceScore(namespaceFilter, namespace)
                + pathScore(pathHint, path);
    }

    private static boolean isWithin(String child, String parent) {
        return child.startsWith(parent + "::");
    }

    private static String normalizeNamespace(String namespace) {
        String trimmed = namespace.trim().toLowerCase(Locale.ROOT).replace(".", "::");
        while (trimmed.endsWith("::")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        }
        return trimmed;
    }
}
