package com.pointer.search;

public enum SearchSurface {
    SYMBOL,
    TEXT,
    ALL;

    boolean includesSymbols() {
        return this != TEXT;
    }

    boolean includesText() {
        return this != SYMBOL;
    }
}
