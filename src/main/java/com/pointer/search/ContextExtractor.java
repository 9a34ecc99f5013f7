package com.pointer.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ContextExtractor {
    private final String highlightOpen;
    private final String highlightClose;

    public ContextExtractor(String highlightOpen, String highlightClose) {
        this.highlightOpen = highlightOpen;
        this.highlightClose = highlightClose;
    }

    public ContextExtractor() {
        this("<mark>", "</mark>");
    }

    @FunctionalInterface
    public interface LineMatcher {
        Optional<List<MatchSpan>> match(String line);
    }

    public List<ContextSnippet> extract(String text, String needle, boolean caseSensitive, int window) {
        return extract(text, line -> {
            List<MatchSpan> spans = findAll(line, needle, caseSensitive);
            return spans.isEmpty() ? Optional.empty() : Optional.of(spans);
        }, window);
    }

    public List<ContextSnippet> extract(String text, LineMatcher matcher, int window) {
        return extract(lines(text), matcher, window);
    }

    public List<ContextSnippet> extract(String[] lines, LineMatcher matcher, int window) {
        List<ContextSnippet> snippets = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            Optional<List<MatchSpan>> spans = matcher.match(lines[i]);
            if (spans.isPresent()) {
                snippets.add(window(lines, i, spans.get(), window));
            }
        }
        return snippets;
    }

    public Optional<ContextSnippet> around(String text, int lineNumber, String needle, boolean caseSensitive, int window) {
        return around(lines(text), lineNumber, needle, caseSensitive, window);
    }

    public Optional<ContextSnippet> around(String[] lines, int lineNumber, String needle, boolean caseSensitive, int window) {
        if (lineNumber < 1 || lineNumber > lines.length) {
            return Optional.empty();
        }
        int index = lineNumber - 1;
        return Optional.of(window(lines, index, findAll(lines[index], needle, caseSensitive), window));
    }

    public static List<MatchSpan> findAll(String line, String needle, boolean caseSensitive) {
        List<MatchSpan> spans = new ArrayList<>();
        if (needle == null || needle.isEmpty()) {
            return spans;
        }
        int from = 0;
        while (from + needle.length() <= line.length()) {
            int found = indexOf(line, needle, from, caseSensitive);
            if (found < 0) {
                break;
            }
            spans.add(new MatchSpan(found, found + needle.length()));
            from = found + needle.length();
        }
        return spans;
    }

    String highlight(String line, List<MatchSpan> spans) {
        if (spans.isEmpty()) {
            return line;
        }
        List<MatchSpan> ordered = new ArrayList<>(spans);
        ordered.sort((left, right) -> Integer.compare(left.start(), right.start()));
        StringBuilder out = new StringBuilder(line.length() + ordered.size() * (highlightOpen.length() + highlightClose.length()));
        int cursor = 0;
        for (MatchSpan span : ordered) {
            if (span.start() < cursor || span.end() > line.length()) {
                continue;
            }
            out.append(line, cursor, span.start())
                    .append(highlightOpen)
                    .append(line, span.start(), span.end())
                    .append(highlightClose);
            cursor = span.end();
        }
        return out.append(line.substring(cursor)).toString();
    }

    private ContextSnippet window(String[] lines, int index, List<MatchSpan> spans, int window) {
        int start = Math.max(0, index - window);
        int end = Math.min(lines.length - 1, index + window);
        StringBuilder snippet = new StringBuilder();
        for (int i = start; i <= end; i++) {
            if (i > start) {
                snippet.append('\n');
            }
            snippet.append(i == index ? highlight(lines[i], spans) : lines[i]);
        }
        return new ContextSnippet(index + 1, start + 1, end + 1, lines[index], List.copyOf(spans), snippet.toString());
    }

    public String[] lines(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].endsWith("\r")) {
                lines[i] = lines[i].substring(0, lines[i].length() - 1);
            }
        }
        return lines;
    }

    private static int indexOf(String line, String needle, int from, boolean caseSensitive) {
        if (caseSensitive) {
            return line.indexOf(needle, from);
        }
        for (int i = from; i + needle.length() <= line.length(); i++) {
            if (line.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }
}
