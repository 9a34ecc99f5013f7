package com.pointer.symbols;

public record Symbol(String contentHash, String namespace, String name, String fullyQualified, SymbolKind kind) {
}
