package com.pointer.search;

public record MatchSpan(int start, int end) {
    public MatchSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span " + start + ".." + end);
        }
    }
}
