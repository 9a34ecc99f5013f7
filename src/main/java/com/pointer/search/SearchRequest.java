package com.pointer.search;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.pointer.symbols.SymbolKind;

public record SearchRequest(
        String query,
        SearchSurface surface,
        NameMatchMode nameMode,
        TextMatchMode textMode,
        String namespace,
        String pathHint,
        Set<SymbolKind> kinds,
        String fullyQualified,
        String repository,
        String commit,
        String namespacePrefix,
        Set<String> languages,
        String pathFilter,
        boolean caseSensitive,
        int contextLines,
        int page,
        int pageSize) {

    public SearchRequest {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        surface = surface == null ? SearchSurface.SYMBOL : surface;
        nameMode = nameMode == null ? NameMatchMode.EXACT : nameMode;
        textMode = textMode == null ? TextMatchMode.SUBSTRING : textMode;
        kinds = kinds == null || kinds.isEmpty() ? Set.of() : Set.copyOf(kinds);
        languages = languages == null || languages.isEmpty()
                ? Set.of()
                : languages.stream().map(language -> language.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        namespacePrefix = namespacePrefix == null || namespacePrefix.isEmpty() ? null : namespacePrefix;
        pathFilter = pathFilter == null || pathFilter.isEmpty() ? null : pathFilter;
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be >= 0");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
    }

    public static Builder builder(String query) {
        return new Builder(query);
    }

    public static final class Builder {
        private final String query;
        private SearchSurface surface = SearchSurface.SYMBOL;
        private NameMatchMode nameMode = NameMatchMode.EXACT;
        private TextMatchMode textMode = TextMatchMode.SUBSTRING;
        private String namespace;
        private String pathHint;
        private Set<SymbolKind> kinds = EnumSet.noneOf(SymbolKind.class);
        private String fullyQualified;
        private String repository;
        private String commit;
        private String namespacePrefix;
        private Set<String> languages = Set.of();
        private String pathFilter;
        private boolean caseSensitive;
        private int contextLines = 2;
        private int page = 1;
        private int pageSize = 20;

        private Builder(String query) {
            this.query = query;
        }

        public Builder surface(SearchSurface surface) {
            this.surface = surface;
            return this;
        }

        public Builder nameMode(NameMatchMode nameMode) {
            this.nameMode = nameMode;
            return this;
        }

        public Builder textMode(TextMatchMode textMode) {
            this.textMode = textMode;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder pathHint(String pathHint) {
            this.pathHint = pathHint;
            return this;
        }

        public Builder kinds(Set<SymbolKind> kinds) {
            this.kinds = kinds;
            return this;
        }

        public Builder fullyQualified(String fullyQualified) {
            this.fullyQualified = fullyQualified;
            return this;
        }

        public Builder repository(String repository) {
            this.repository = repository;
            return this;
        }

        public Builder commit(String commit) {
            this.commit = commit;
            return this;
        }

        public Builder namespacePrefix(String namespacePrefix) {
            this.namespacePrefix = namespacePrefix;
            return this;
        }

        public Builder languages(Set<String> languages) {
            this.languages = languages;
            return this;
        }

        public Builder pathFilter(String pathFilter) {
            this.pathFilter = pathFilter;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder contextLines(int contextLines) {
            this.contextLines = contextLines;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public SearchRequest build() {
            return new SearchRequest(query, surface, nameMode, textMode, namespace, pathHint, kinds, fullyQualified,
                    repository, commit, namespacePrefix, languages, pathFilter, caseSensitive, contextLines, page, pageSize);
        }
    }
}
