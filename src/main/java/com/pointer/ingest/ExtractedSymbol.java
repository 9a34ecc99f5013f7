package com.pointer.ingest;

import com.pointer.symbols.SymbolKind;

public record ExtractedSymbol(String namespace, String name, String fullyQualified, SymbolKind kind, int line, int column) {
    public ExtractedSymbol {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("symbol name must not be blank");
        }
        if (kind == null) {
            kind = SymbolKind.REFERENCE;
        }
    }
}
