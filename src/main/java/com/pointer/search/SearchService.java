package com.pointer.search;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.content.ContentBlob;
import com.pointer.content.ContentStore;
import com.pointer.ingest.FileRecord;
import com.pointer.ingest.FileTable;
import com.pointer.store.NotFoundException;
import com.pointer.symbols.NameCache;
import com.pointer.symbols.NameMatch;
import com.pointer.symbols.SymbolReference;
import com.pointer.symbols.SymbolStore;
import com.pointer.symbols.TrigramSimilarity;

public class SearchService {
    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final ContentStore contentStore;
    private final FileTable fileTable;
    private final SymbolStore symbolStore;
    private final NameCache nameCache;
    private final RankingScorer scorer;
    private final ContextExtractor contextExtractor;
    private final QueryParser queryParser;
    private final Limits limits;

    public SearchService(ContentStore contentStore, FileTable fileTable, SymbolStore symbolStore, NameCache nameCache,
                         RankingScorer scorer, ContextExtractor contextExtractor, QueryParser queryParser, Limits limits) {
        this.contentStore = contentStore;
        this.fileTable = fileTable;
        this.symbolStore = symbolStore;
        this.nameCache = nameCache;
        this.scorer = scorer;
        this.contextExtractor = contextExtractor;
        this.queryParser = queryParser;
        this.limits = limits;
    }

    public SearchPage search(SearchRequest request) {
        long started = System.currentTimeMillis();
        Map<String, Optional<String>> texts = new HashMap<>();
        Map<String, Optional<String[]>> lines = new HashMap<>();
        List<SearchHit> hits = new ArrayList<>();
        if (request.surface().includesSymbols()) {
            hits.addAll(symbolHits(request, texts, lines));
        }
        if (request.surface().includesText()) {
            hits.addAll(textHits(request, texts, lines));
        }
        hits.sort(RankingScorer.ORDER);

        int pageSize = Math.min(request.pageSize(), limits.maxPageSize());
        int from = (int) Math.min(hits.size(), (long) (request.page() - 1) * pageSize);
        int to = Math.min(hits.size(), from + pageSize);
        SearchPage page = new SearchPage(List.copyOf(hits.subList(from, to)), request.page(), pageSize, hits.size(), to < hits.size());
        log.debug("search.completed surface={} query='{}' total={} page={} durationMs={}",
                request.surface(), request.query(), hits.size(), request.page(), System.currentTimeMillis() - started);
        return page;
    }

    private List<SearchHit> symbolHits(SearchRequest request, Map<String, Optional<String>> texts,
                                       Map<String, Optional<String[]>> lines) {
        List<NameMatch> matches = switch (request.nameMode()) {
            case EXACT -> nameCache.exact(request.query()).map(List::of).orElse(List.of());
            case PREFIX -> nameCache.prefix(request.query(), limits.nameCandidateLimit());
            case FUZZY -> nameCache.fuzzy(request.query(), limits.fuzzyThreshold(), limits.nameCandidateLimit());
        };
        List<SearchHit> hits = new ArrayList<>();
        for (NameMatch match : matches) {
            for (String hash : match.contentHashes().stream().sorted().toList()) {
                List<FileRecord> files = liveFiles(hash, request);
                if (files.isEmpty() || !acceptsLanguage(hash, request)) {
                    continue;
                }
                for (SymbolReference reference : symbolStore.references(hash)) {
                    if (!accepts(reference, match, request)) {
                        continue;
                    }
                    String snippet = linesOf(hash, texts, lines)
                            .flatMap(split -> contextExtractor.around(split, reference.line(), reference.name(), true, request.contextLines()))
                            .map(ContextSnippet::snippet)
                            .orElse("");
                    for (FileRecord file : files) {
                        int score = scorer.symbolScore(request.query(), request.namespace(), request.pathHint(), reference.kind(),
                                reference.name(), reference.namespace(), reference.fullyQualified(), file.path());
                        hits.add(new SearchHit(file.repository(), file.commit(), file.path(), hash, reference.line(),
                                reference.column(), reference.name(), reference.namespace(), reference.kind(), score, snippet));
                    }
                }
            }
        }
        return hits;
    }

    private List<SearchHit> textHits(SearchRequest request, Map<String, Optional<String>> texts,
                                     Map<String, Optional<String[]>> lines) {
        ParsedQuery query = queryParser.parse(request.query());
        if (query.terms().isEmpty()) {
            throw new QueryParseException("query needs at least one search term", 0);
        }
        boolean caseSensitive = query.caseSensitive(request.caseSensitive());
        ContextExtractor.LineMatcher matcher = lineMatcher(request.textMode(), query.terms(), caseSensitive);
        List<SearchHit> hits = new ArrayList<>();
        for (String hash : fileTable.liveContentHashes().stream().sorted().toList()) {
            Optional<ContentBlob> blob = contentStore.findBlob(hash);
            if (blob.isEmpty() || blob.get().binary() || !query.acceptsLanguage(blob.get().language())
                    || !acceptsLanguage(blob.get(), request)) {
                continue;
            }
            List<FileRecord> files = liveFiles(hash, request).stream()
                    .filter(file -> query.acceptsRepository(file.repository()) && query.acceptsPath(file.path()))
                    .toList();
            if (files.isEmpty()) {
                continue;
            }
            Optional<String> text = textOf(hash, texts);
            if (text.isEmpty() || !containsAll(text.get(), request.textMode(), query.terms(), caseSensitive)
                    || containsAny(text.get(), query.excludedTerms(), caseSensitive)) {
                continue;
            }
            String[] split = linesOf(hash, texts, lines).orElseThrow();
            for (ContextSnippet snippet : contextExtractor.extract(split, matcher, request.contextLines())) {
                double similarity = request.textMode() == TextMatchMode.NGRAM
                        ? TrigramSimilarity.bestWindowSimilarity(String.join(" ", query.terms()), snippet.line())
                        : 0.0;
                for (FileRecord file : files) {
                    int score = scorer.textScore(request.textMode(), similarity) + scorer.pathScore(request.pathHint(), file.path());
                    hits.add(new SearchHit(file.repository(), file.commit(), file.path(), hash, snippet.lineNumber(),
                            snippet.column(), null, null, null, score, snippet.snippet()));
                }
            }
        }
        return hits;
    }

    private ContextExtractor.LineMatcher lineMatcher(TextMatchMode mode, List<String> terms, boolean caseSensitive) {
        return switch (mode) {
            case SUBSTRING -> line -> {
                List<MatchSpan> spans = spansOf(line, terms, caseSensitive);
                return spans.isEmpty() ? Optional.empty() : Optional.of(spans);
            };
            case FULL_TEXT -> {
                List<String> words = words(terms);
                yield line -> {
                    List<MatchSpan> spans = new ArrayList<>();
                    for (String word : words) {
                        List<MatchSpan> found = wordSpans(line, word, caseSensitive);
                        if (found.isEmpty()) {
                            return Optional.empty();
                        }
                        spans.addAll(found);
                    }
                    return Optional.of(spans);
                };
            }
            case NGRAM -> {
                String joined = String.join(" ", terms);
                yield line -> TrigramSimilarity.bestWindowSimilarity(joined, line) >= limits.ngramThreshold()
                        ? Optional.of(spansOf(line, terms, false))
                        : Optional.empty();
            }
        };
    }

    private boolean accepts(SymbolReference reference, NameMatch match, SearchRequest request) {
        if (!reference.name().toLowerCase(Locale.ROOT).equals(match.nameLowercase())) {
            return false;
        }
        if (!request.kinds().isEmpty() && !request.kinds().contains(reference.kind())) {
            return false;
        }
        if (request.namespacePrefix() != null
                && (reference.namespace() == null || !reference.namespace().startsWith(request.namespacePrefix()))) {
            return false;
        }
        return request.fullyQualified() == null || request.fullyQualified().equals(reference.fullyQualified());
    }

    private boolean acceptsLanguage(String hash, SearchRequest request) {
        return request.languages().isEmpty() || contentStore.findBlob(hash).map(blob -> acceptsLanguage(blob, request)).orElse(false);
    }

    private static boolean acceptsLanguage(ContentBlob blob, SearchRequest request) {
        return request.languages().isEmpty()
                || (blob.language() != null && request.languages().contains(blob.language().toLowerCase(Locale.ROOT)));
    }

    private List<FileRecord> liveFiles(String hash, SearchRequest request) {
        return fileTable.filesFor(hash).stream()
                .filter(file -> request.repository() == null || request.repository().equals(file.repository()))
                .filter(file -> request.commit() == null || request.commit().equals(file.commit()))
                .filter(file -> request.pathFilter() == null
                        || file.path().toLowerCase(Locale.ROOT).contains(request.pathFilter().toLowerCase(Locale.ROOT)))
                .toList();
    }

    private Optional<String> textOf(String hash, Map<String, Optional<String>> texts) {
        return texts.computeIfAbsent(hash, key -> {
            try {
                return contentStore.text(key);
            } catch (NotFoundException e) {
                log.debug("search.content.gone hash={}", key);
                return Optional.empty();
            }
        });
    }

    private Optional<String[]> linesOf(String hash, Map<String, Optional<String>> texts, Map<String, Optional<String[]>> lines) {
        Optional<String[]> cached = lines.get(hash);
        if (cached == null) {
            cached = textOf(hash, texts).map(contextExtractor::lines);
            lines.put(hash, cached);
        }
        return cached;
    }

    private static boolean containsAll(String text, TextMatchMode mode, List<String> terms, boolean caseSensitive) {
        if (mode == TextMatchMode.NGRAM) {
            return true;
        }
        for (String term : mode == TextMatchMode.FULL_TEXT ? words(terms) : terms) {
            if (ContextExtractor.findAll(text, term, caseSensitive).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsAny(String text, List<String> terms, boolean caseSensitive) {
        return terms.stream().anyMatch(term -> !ContextExtractor.findAll(text, term, caseSensitive).isEmpty());
    }

    private static List<MatchSpan> spansOf(String line, List<String> terms, boolean caseSensitive) {
        List<MatchSpan> spans = new ArrayList<>();
        for (String term : terms) {
            spans.addAll(ContextExtractor.findAll(line, term, caseSensitive));
        }
        return spans;
    }

    private static List<MatchSpan> wordSpans(String line, String word, boolean caseSensitive) {
        List<MatchSpan> spans = new ArrayList<>();
        for (MatchSpan span : ContextExtractor.findAll(line, word, caseSensitive)) {
            boolean startsWord = span.start() == 0 || !isWordChar(line.charAt(span.start() - 1));
            boolean endsWord = span.end() == line.length() || !isWordChar(line.charAt(span.end()));
            if (startsWord && endsWord) {
                spans.add(span);
            }
        }
        return spans;
    }

    private static List<String> words(List<String> terms) {
        List<String> words = new ArrayList<>();
        for (String term : terms) {
            for (String word : term.split("[^\\p{L}\\p{N}_]+")) {
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
        }
        return words;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    public record Limits(int maxPageSize, double fuzzyThreshold, double ngramThreshold, int nameCandidateLimit) {
        public Limits {
            if (maxPageSize <= 0 || nameCandidateLimit <= 0) {
                throw new IllegalArgumentException("maxPageSize and nameCandidateLimit must be > 0");
            }
        }
    }
}
