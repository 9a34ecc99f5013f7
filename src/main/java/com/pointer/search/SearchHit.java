package com.pointer.search;

import com.pointer.symbols.SymbolKind;

public record SearchHit(
        String repository,
        String commit,
        String path,
        String contentHash,
        int line,
        int column,
        String name,
        String namespace,
        SymbolKind kind,
        int score,
        String snippet) {
}
