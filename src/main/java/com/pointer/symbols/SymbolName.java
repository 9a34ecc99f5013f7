package com.pointer.symbols;

public record SymbolName(String nameLowercase, String displayName) {
}
