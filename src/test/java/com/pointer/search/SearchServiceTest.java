package com.pointer.search;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pointer.ingest.ExtractedFile;
import com.pointer.ingest.ExtractedSymbol;
import com.pointer.runtime.AppConfig;
import com.pointer.store.PointerIndex;
import com.pointer.symbols.SymbolKind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchServiceTest {

    @TempDir
    Path tempDir;

    private PointerIndex index;

    @BeforeEach
    void setUp() {
        AppConfig config = new AppConfig();
        config.getStorage().setIndexPath(tempDir.resolve("index.json").toString());
        config.getSearch().setMaxPageSize(3);
        index = new PointerIndex(config, Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));

        index.ingest(ExtractedFile.text("core", "c1", "src/foo.cpp", "cpp",
                "// global helper\nint foo() {\n  return 1;\n}\n",
                List.of(new ExtractedSymbol(null, "foo", "foo", SymbolKind.DEFINITION, 2, 5))));
        index.ingest(ExtractedFile.text("core", "c1", "src/ns/bar.cpp", "cpp",
                "namespace ns { namespace a {\nvoid bar() { foo(); }\n} }\n",
                List.of(new ExtractedSymbol("ns::a", "bar", "ns::a::bar", SymbolKind.DEFINITION, 2, 6),
                        new ExtractedSymbol("ns::a", "foo", "ns::a::foo", SymbolKind.REFERENCE, 2, 14))));
        index.ingest(ExtractedFile.text("docs", "d1", "README.md", "markdown",
                "Call foo to get one.\nSomeone else handles the rest.\n", List.of()));
        index.flushNameCache();
    }

    @AfterEach
    void tearDown() {
        index.close();
    }

    @Test
    void shouldRankDefinitionFirstForSymbolQuery() {
        SearchPage page = index.search(SearchRequest.builder("foo").build());

        assertEquals(2, page.total());
        SearchHit first = page.hits().get(0);
        assertEquals("src/foo.cpp", first.path());
        assertEquals(SymbolKind.DEFINITION, first.kind());
        assertEquals(2, first.line());
        assertEquals(280, first.score());
        assertTrue(first.snippet().contains("int <mark>foo</mark>() {"));
        assertEquals(SymbolKind.REFERENCE, page.hits().get(1).kind());
    }

    @Test
    void shouldFilterSymbolsByKindAndRepository() {
        SearchPage definitions = index.search(SearchRequest.builder("FOO").kinds(Set.of(SymbolKind.REFERENCE)).build());
        SearchPage docs = index.search(SearchRequest.builder("foo").repository("docs").build());

        assertEquals(1, definitions.total());
        assertEquals("src/ns/bar.cpp", definitions.hits().get(0).path());
        assertEquals(0, docs.total());
    }

    @Test
    void shouldBoostMatchingNamespace() {
        SearchPage page = index.search(SearchRequest.builder("foo").namespace("ns::a").build());

        assertEquals("src/ns/bar.cpp", page.hits().get(0).path());
    }

    @Test
    void shouldFilterSymbolsByNamespacePrefix() {
        SearchPage nested = index.search(SearchRequest.builder("foo").namespacePrefix("ns").build());
        SearchPage unrelated = index.search(SearchRequest.builder("foo").namespacePrefix("other").build());

        assertEquals(1, nested.total());
        assertEquals("ns::a", nested.hits().get(0).namespace());
        assertEquals(0, unrelated.total());
    }

    @Test
    void shouldFilterSymbolsByLanguage() {
        index.ingest(ExtractedFile.text("core", "c1", "tools/foo.py", "python",
                "def foo():\n    return 1\n",
                List.of(new ExtractedSymbol(null, "foo", "foo", SymbolKind.DEFINITION, 1, 5))));
        index.flushNameCache();

        SearchPage python = index.search(SearchRequest.builder("foo").languages(Set.of("PYTHON")).build());
        SearchPage everything = index.search(SearchRequest.builder("foo").build());

        assertEquals(1, python.total());
        assertEquals("tools/foo.py", python.hits().get(0).path());
        assertEquals(3, everything.total());
    }

    @Test
    void shouldFilterSymbolsByPath() {
        SearchPage page = index.search(SearchRequest.builder("foo").pathFilter("SRC/NS").build());

        assertEquals(1, page.total());
        assertEquals("src/ns/bar.cpp", page.hits().get(0).path());
    }

    @Test
    void shouldSplitEachBlobIntoLinesOnce() {
        index.ingest(ExtractedFile.text("core", "c2", "src/calls.cpp", "cpp",
                "void a() { foo(); }\nvoid b() { foo(); }\nvoid c() { foo(); }\n",
                List.of(new ExtractedSymbol(null, "foo", "foo", SymbolKind.REFERENCE, 1, 12),
                        new ExtractedSymbol(null, "foo", "foo", SymbolKind.REFERENCE, 2, 12),
                        new ExtractedSymbol(null, "foo", "foo", SymbolKind.REFERENCE, 3, 12))));
        index.flushNameCache();
        AtomicInteger splits = new AtomicInteger();
        ContextExtractor counting = new ContextExtractor() {
            @Override
            public String[] lines(String text) {
                splits.incrementAndGet();
                return super.lines(text);
            }
        };
        SearchService service = new SearchService(index.contentStore(), index.fileTable(), index.symbolStore(),
                index.nameCache(), new RankingScorer(), counting, new QueryParser(),
                new SearchService.Limits(50, 0.3, 0.3, 50));

        SearchPage page = service.search(SearchRequest.builder("foo").commit("c2").build());

        assertEquals(3, page.total());
        assertEquals(1, splits.get());
    }

    @Test
    void shouldMatchNamePrefixes() {
        SearchPage page = index.search(SearchRequest.builder("ba").nameMode(NameMatchMode.PREFIX).build());

        assertEquals(1, page.total());
        assertEquals("bar", page.hits().get(0).name());
    }

    @Test
    void shouldSearchTextWithFilters() {
        SearchPage all = index.search(SearchRequest.builder("foo").surface(SearchSurface.TEXT).contextLines(0).build());
        SearchPage cppOnly = index.search(SearchRequest.builder("foo lang:cpp").surface(SearchSurface.TEXT).build());
        SearchPage excluded = index.search(SearchRequest.builder("foo -global").surface(SearchSurface.TEXT).build());

        assertEquals(3, all.total());
        assertTrue(all.hits().stream().anyMatch(hit -> hit.snippet().equals("Call <mark>foo</mark> to get one.")));
        assertEquals(2, cppOnly.total());
        assertTrue(excluded.hits().stream().noneMatch(hit -> hit.path().equals("src/foo.cpp")));
    }

    @Test
    void shouldMatchWholeWordsInFullTextMode() {
        SearchPage substring = index.search(SearchRequest.builder("one").surface(SearchSurface.TEXT).build());
        SearchPage words = index.search(SearchRequest.builder("one").surface(SearchSurface.TEXT)
                .textMode(TextMatchMode.FULL_TEXT).build());

        assertEquals(2, substring.total());
        assertEquals(1, words.total());
        assertEquals(1, words.hits().get(0).line());
    }

    @Test
    void shouldScoreSimilarLinesInNgramMode() {
        SearchPage page = index.search(SearchRequest.builder("global helpr").surface(SearchSurface.TEXT)
                .textMode(TextMatchMode.NGRAM).build());

        assertFalse(page.hits().isEmpty());
        SearchHit best = page.hits().get(0);
        assertEquals("src/foo.cpp", best.path());
        assertEquals(1, best.line());
        assertTrue(best.score() > 30);
    }

    @Test
    void shouldPaginateAndClampPageSize() {
        SearchRequest.Builder request = SearchRequest.builder("o").surface(SearchSurface.TEXT).pageSize(50);

        SearchPage first = index.search(request.build());
        SearchPage second = index.search(request.page(2).build());

        assertEquals(3, first.pageSize());
        assertEquals(3, first.hits().size());
        assertTrue(first.hasMore());
        assertEquals(first.total(), second.total());
        assertFalse(second.hits().contains(first.hits().get(0)));
    }

    @Test
    void shouldRejectQueryWithoutTerms() {
        assertThrows(QueryParseException.class,
                () -> index.search(SearchRequest.builder("repo:core").surface(SearchSurface.TEXT).build()));
    }

    @Test
    void shouldNotReturnContentOnceFilesAreGone() {
        index.fileTable().removeCommit("docs", "d1");
        index.runGc();

        SearchPage page = index.search(SearchRequest.builder("foo").surface(SearchSurface.ALL).build());

        assertTrue(page.hits().stream().noneMatch(hit -> hit.repository().equals("docs")));
    }
}
