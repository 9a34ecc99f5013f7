package com.pointer.symbols;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SymbolKind {
    DEFINITION("definition"),
    DECLARATION("declaration"),
    REFERENCE("reference");

    private final String label;

    SymbolKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static SymbolKind parse(String value) {
        if (value == null || value.isBlank()) {
            return REFERENCE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("def") || normalized.contains("definition")) {
            return DEFINITION;
        }
        if (normalized.equals("decl") || normalized.contains("declaration")) {
            return DECLARATION;
        }
        return REFERENCE;
    }
}
