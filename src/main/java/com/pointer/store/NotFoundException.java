package com.pointer.store;

public class NotFoundException extends RuntimeException {
    private final String kind;
    private final String key;

    public NotFoundException(String kind, String key) {
        super(kind + " not found: " + key);
        this.kind = kind;
        this.key = key;
    }

    public String kind() {
        return kind;
    }

    public String key() {
        return key;
    }
}
