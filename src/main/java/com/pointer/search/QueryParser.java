package com.pointer.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses text queries such as {@code foo -bar repo:core file:src/** lang:java case:yes "two words"}.
 *
 * <p>Tokens are separated by whitespace; double quotes group a token. A leading {@code -} negates a
 * term or filter. {@code key:value} is a filter only for the known keys below, so
 * {@code std::vector} stays a plain term.
 */
public class QueryParser {

    public ParsedQuery parse(String query) {
        if (query == null || query.isBlank()) {
            throw new QueryParseException("query is empty", 0);
        }
        List<String> terms = new ArrayList<>();
        List<String> excludedTerms = new ArrayList<>();
        List<String> repositories = new ArrayList<>();
        List<String> excludedRepositories = new ArrayList<>();
        List<String> fileGlobs = new ArrayList<>();
        List<String> excludedFileGlobs = new ArrayList<>();
        List<String> languages = new ArrayList<>();
        List<String> excludedLanguages = new ArrayList<>();
        ParsedQuery.CaseMode caseMode = ParsedQuery.CaseMode.AUTO;

        for (Token token : tokenize(query)) {
            String text = token.text();
            boolean negated = !token.quoted() && text.startsWith("-") && text.length() > 1;
            if (negated) {
                text = text.substring(1);
            }
            int colon = token.quoted() ? -1 : text.indexOf(':');
            String key = colon > 0 ? text.substring(0, colon).toLowerCase(Locale.ROOT) : "";
            String value = colon > 0 ? unquote(text.substring(colon + 1)) : text;
            switch (key) {
                case "content", "c" -> (negated ? excludedTerms : terms).add(requireValue(key, value, token));
                case "repo", "r" -> (negated ? excludedRepositories : repositories).add(requireValue(key, value, token));
                case "file", "f", "path" -> (negated ? excludedFileGlobs : fileGlobs).add(requireValue(key, value, token));
                case "lang", "l" -> (negated ? excludedLanguages : languages).add(requireValue(key, value, token));
                case "case" -> {
                    if (negated) {
                        throw new QueryParseException("case: cannot be negated", token.position());
                    }
                    caseMode = caseMode(requireValue(key, value, token), token);
                }
                default -> (negated ? excludedTerms : terms).add(unquote(text));
            }
        }
        return new ParsedQuery(List.copyOf(terms), List.copyOf(excludedTerms), List.copyOf(repositories),
                List.copyOf(excludedRepositories), List.copyOf(fileGlobs), List.copyOf(excludedFileGlobs),
                List.copyOf(languages), List.copyOf(excludedLanguages), caseMode);
    }

    List<Token> tokenize(String query) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean quoted = false;
        int start = -1;
        int quoteStart = -1;
        for (int i = 0; i < query.length(); i++) {
            char c = query.charAt(i);
            if (c == '"') {
                if (!inQuotes && start < 0) {
                    start = i;
                    quoted = true;
                }
                inQuotes = !inQuotes;
                quoteStart = inQuotes ? i : quoteStart;
                current.append(c);
            } else if (Character.isWhitespace(c) && !inQuotes) {
                if (start >= 0) {
                    tokens.add(token(current, quoted, start));
                    current.setLength(0);
                    start = -1;
                    quoted = false;
                }
            } else {
                if (start < 0) {
                    start = i;
                }
                current.append(c);
            }
        }
        if (inQuotes) {
            throw new QueryParseException("unterminated quote", quoteStart);
        }
        if (start >= 0) {
            tokens.add(token(current, quoted, start));
        }
        return tokens;
    }

    private static Token token(StringBuilder raw, boolean quoted, int position) {
        String text = raw.toString();
        if (quoted && text.startsWith("\"") && text.endsWith("\"")) {
            String inner = text.substring(1, text.length() - 1);
            if (inner.isEmpty()) {
                throw new QueryParseException("empty quoted term", position);
            }
            return new Token(inner, true, position);
        }
        return new Token(text, false, position);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static String requireValue(String key, String value, Token token) {
        if (value.isBlank()) {
            throw new QueryParseException(key + ": needs a value", token.position());
        }
        return value;
    }

    private static ParsedQuery.CaseMode caseMode(String value, Token token) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "yes", "y", "true" -> ParsedQuery.CaseMode.YES;
            case "no", "n", "false" -> ParsedQuery.CaseMode.NO;
            case "auto" -> ParsedQuery.CaseMode.AUTO;
            default -> throw new QueryParseException("case: expects yes, no or auto, got '" + value + "'", token.position());
        };
    }

    record Token(String text, boolean quoted, int position) {
    }
}
