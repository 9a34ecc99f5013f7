package com.pointer.search;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.pointer.symbols.SymbolKind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RankingScorerTest {

    private final RankingScorer scorer = new RankingScorer();

    @Test
    void shouldRankGlobalDefinitionAboveNamespacedReference() {
        int definition = scorer.symbolScore("foo", null, null, SymbolKind.DEFINITION, "foo", null, "foo", "src/foo.cpp");
        int reference = scorer.symbolScore("foo", null, null, SymbolKind.REFERENCE, "foo", "ns::a", "ns::a::foo", "src/bar.cpp");

        assertEquals(120 + 70 + 40 + 50, definition);
        assertEquals(50 - 15 + 40, reference);
        assertTrue(definition > reference);
    }

    @Test
    void shouldScoreNamespaceRelations() {
        assertEquals(100, scorer.namespaceScore("ns::a", "ns::a"));
        assertEquals(100, scorer.namespaceScore("ns.a", "ns::a"));
        assertEquals(60, scorer.namespaceScore("ns", "ns::a"));
        assertEquals(30, scorer.namespaceScore("ns::a::b", "ns::a"));
        assertEquals(-40, scorer.namespaceScore("ns::a", "other"));
        assertEquals(-40, scorer.namespaceScore("ns::a", null));
        assertEquals(-40, scorer.namespaceScore("ns", "nsx::a"));
    }

    @Test
    void shouldScorePathHints() {
        assertEquals(0, scorer.pathScore(null, "src/a.cpp"));
        assertEquals(60, scorer.pathScore("src/a.cpp", "src/a.cpp"));
        assertEquals(40, scorer.pathScore("src/", "src/a.cpp"));
        assertEquals(20, scorer.pathScore("src/a.cpp.bak", "src/a.cpp"));
        assertTrue(scorer.pathScore("zzz/qqq", "src/a.cpp") >= -10);
    }

    @Test
    void shouldScoreKindsAndNames() {
        assertEquals(120, scorer.kindScore(SymbolKind.DEFINITION));
        assertEquals(90, scorer.kindScore(SymbolKind.DECLARATION));
        assertEquals(50, scorer.kindScore(SymbolKind.REFERENCE));
        assertEquals(40, scorer.nameScore("FOO", "foo", "ns::foo"));
        assertEquals(50, scorer.nameScore("ns::foo", "foo", "ns::foo"));
        assertEquals(75, scorer.textScore(TextMatchMode.NGRAM, 0.75));
        assertEquals(0, scorer.textScore(TextMatchMode.SUBSTRING, 0.75));
    }

    @Test
    void shouldBreakTiesDeterministically() {
        List<SearchHit> hits = new ArrayList<>(List.of(
                hit("core", "c1", "b.cpp", 3, 10),
                hit("core", "c1", "a.cpp", 9, 10),
                hit("core", "c1", "a.cpp", 2, 10),
                hit("app", "c9", "z.cpp", 1, 10),
                hit("core", "c1", "a.cpp", 1, 20)));

        hits.sort(RankingScorer.ORDER);

        assertEquals(List.of("a.cpp:1", "z.cpp:1", "a.cpp:2", "a.cpp:9", "b.cpp:3"),
                hits.stream().map(hit -> hit.path() + ":" + hit.line()).toList());
    }

    private static SearchHit hit(String repository, String commit, String path, int line, int score) {
        return new SearchHit(repository, commit, path, "h", line, 1, "foo", null, SymbolKind.REFERENCE, score, "");
    }
}
