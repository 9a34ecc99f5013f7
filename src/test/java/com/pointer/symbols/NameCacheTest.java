package com.pointer.symbols;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameCacheTest {

    private final NameCache cache = new NameCache();

    @Test
    void shouldMatchNamesCaseInsensitively() {
        cache.attach("ReadFile", "h1");
        cache.attach("readfile", "h2");

        NameMatch match = cache.exact("READFILE").orElseThrow();

        assertEquals("ReadFile", match.displayName());
        assertEquals(2, match.contentHashes().size());
        assertEquals(1, cache.nameCount());
        assertEquals(2, cache.refCount());
    }

    @Test
    void shouldDropNameWithItsLastReference() {
        cache.attach("Widget", "h1");
        cache.attach("Widget", "h2");

        assertFalse(cache.detach("widget", "h1"));
        assertTrue(cache.contains("widget"));
        assertTrue(cache.detach("widget", "h2"));
        assertFalse(cache.contains("widget"));
        assertFalse(cache.detach("widget", "h2"));
    }

    @Test
    void shouldOrderPrefixMatchesByLength() {
        cache.attach("parseHeaderLine", "h1");
        cache.attach("parse", "h1");
        cache.attach("parseHeader", "h2");
        cache.attach("render", "h3");

        List<NameMatch> matches = cache.prefix("Parse", 2);

        assertEquals(List.of("parse", "parseheader"), matches.stream().map(NameMatch::nameLowercase).toList());
    }

    @Test
    void shouldFindSimilarNames() {
        cache.attach("connection_pool", "h1");
        cache.attach("conection_pool", "h2");
        cache.attach("thread_pool", "h3");
        cache.attach("unrelated", "h4");

        List<NameMatch> matches = cache.fuzzy("connection_pool", 0.3, 10);

        assertEquals("connection_pool", matches.get(0).nameLowercase());
        assertTrue(matches.stream().anyMatch(match -> match.nameLowercase().equals("conection_pool")));
        assertTrue(matches.stream().noneMatch(match -> match.nameLowercase().equals("unrelated")));
    }

    @Test
    void shouldRestoreOnlyReferencedNames() {
        cache.restore(List.of(new SymbolName("a", "A"), new SymbolName("b", "B")), List.of(new SymbolNameRef("a", "h1")));

        assertTrue(cache.hasRef("a", "h1"));
        assertFalse(cache.contains("b"));
        assertEquals(List.of(new SymbolName("a", "A")), cache.names());
    }
}
