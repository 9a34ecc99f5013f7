package com.pointer.symbols;

public record SymbolReference(
        String contentHash,
        String namespace,
        String name,
        String fullyQualified,
        SymbolKind kind,
        int line,
        int column) {

    public Symbol toSymbol() {
        return new Symbol(contentHash, namespace, name, fullyQualified, kind);
    }
}
