package com.pointer.search;

public class QueryParseException extends IllegalArgumentException {
    private final int position;

    public QueryParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
