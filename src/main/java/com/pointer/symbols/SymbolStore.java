package com.pointer.symbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class SymbolStore {
    private final Map<String, HashSymbols> byHash = new ConcurrentHashMap<>();

    public int insertIfAbsent(String contentHash, List<SymbolReference> references) {
        if (references.isEmpty()) {
            return 0;
        }
        HashSymbols candidate = HashSymbols.of(contentHash, references);
        HashSymbols existing = byHash.putIfAbsent(contentHash, candidate);
        return existing == null ? candidate.symbols().size() : 0;
    }

    public Optional<HashSymbols> deleteByHash(String contentHash) {
        return Optional.ofNullable(byHash.remove(contentHash));
    }

    public boolean hasSymbols(String contentHash) {
        return byHash.containsKey(contentHash);
    }

    public boolean hasName(String contentHash, String nameLowercase) {
        HashSymbols symbols = byHash.get(contentHash);
        return symbols != null && symbols.names().containsKey(nameLowercase);
    }

    public Map<String, String> names(String contentHash) {
        HashSymbols symbols = byHash.get(contentHash);
        return symbols == null ? Map.of() : symbols.names();
    }

    public List<Symbol> symbols(String contentHash) {
        HashSymbols symbols = byHash.get(contentHash);
        return symbols == null ? List.of() : symbols.symbols();
    }

    public List<SymbolReference> references(String contentHash) {
        HashSymbols symbols = byHash.get(contentHash);
        return symbols == null ? List.of() : symbols.references();
    }

    public Set<String> contentHashes() {
        return Set.copyOf(byHash.keySet());
    }

    public int symbolCount() {
        return byHash.values().stream().mapToInt(symbols -> symbols.symbols().size()).sum();
    }

    public List<SymbolReference> exportReferences() {
        return byHash.keySet().stream()
                .sorted()
                .flatMap(hash -> byHash.getOrDefault(hash, HashSymbols.EMPTY).references().stream())
                .toList();
    }

    public void restore(List<SymbolReference> references) {
        byHash.clear();
        Map<String, List<SymbolReference>> grouped = new LinkedHashMap<>();
        for (SymbolReference reference : references) {
            grouped.computeIfAbsent(reference.contentHash(), unused -> new ArrayList<>()).add(reference);
        }
        grouped.forEach(this::insertIfAbsent);
    }

    static String lowercase(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public record HashSymbols(List<Symbol> symbols, List<SymbolReference> references, Map<String, String> names) {
        static final HashSymbols EMPTY = new HashSymbols(List.of(), List.of(), Map.of());

        static HashSymbols of(String contentHash, List<SymbolReference> references) {
            Map<SymbolKey, Symbol> unique = new LinkedHashMap<>();
            Map<String, String> names = new LinkedHashMap<>();
            List<SymbolReference> sorted = new ArrayList<>(references.size());
            for (SymbolReference reference : references) {
                if (!contentHash.equals(reference.contentHash())) {
                    throw new IllegalArgumentException("reference belongs to " + reference.contentHash() + ", not " + contentHash);
                }
                unique.putIfAbsent(new SymbolKey(reference.namespace(), reference.name(), reference.kind()), reference.toSymbol());
                names.putIfAbsent(lowercase(reference.name()), reference.name());
                sorted.add(reference);
            }
            sorted.sort(Comparator.comparingInt(SymbolReference::line).thenComparingInt(SymbolReference::column));
            return new HashSymbols(List.copyOf(unique.values()), List.copyOf(sorted), Collections.unmodifiableMap(names));
        }
    }

    private record SymbolKey(String namespace, String name, SymbolKind kind) {
    }
}
