package com.pointer.search;

import java.util.List;

public record ContextSnippet(int lineNumber, int startLine, int endLine, String line, List<MatchSpan> spans, String snippet) {
    public int column() {
        return spans.isEmpty() ? 1 : spans.get(0).start() + 1;
    }
}
