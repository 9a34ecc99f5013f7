package com.pointer.symbols;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrigramSimilarityTest {

    @Test
    void shouldScoreIdenticalWordsAsOne() {
        assertEquals(1.0, TrigramSimilarity.similarity("Vector", "vector"), 1e-9);
        assertEquals(0.0, TrigramSimilarity.similarity("", "vector"), 1e-9);
    }

    @Test
    void shouldPadWordsLikeTrigramIndexes() {
        assertEquals(4, TrigramSimilarity.trigrams("cat").size());
        assertTrue(TrigramSimilarity.trigrams("cat").contains("  c"));
        assertTrue(TrigramSimilarity.trigrams("cat").contains("at "));
    }

    @Test
    void shouldFindShortQueryInsideLongLine() {
        double window = TrigramSimilarity.bestWindowSimilarity("open socket",
                "if (ok) { open socket(host, port); log(); }");
        double whole = TrigramSimilarity.similarity("open socket", "if (ok) { open socket(host, port); log(); }");

        assertEquals(1.0, window, 1e-9);
        assertTrue(whole < window);
    }
}
