package com.pointer.symbols;

public record SymbolNameRef(String nameLowercase, String contentHash) {
}
