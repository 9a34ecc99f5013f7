package com.pointer.symbols;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class NameCache {
    private volatile ConcurrentHashMap<String, NameEntry> entries = new ConcurrentHashMap<>();

    public void attach(String name, String contentHash) {
        entries.compute(SymbolStore.lowercase(name), (key, entry) -> {
            NameEntry next = entry == null ? new NameEntry(name) : entry;
            next.contentHashes.add(contentHash);
            return next;
        });
    }

    public boolean detach(String nameLowercase, String contentHash) {
        AtomicBoolean dropped = new AtomicBoolean();
        entries.computeIfPresent(nameLowercase, (key, entry) -> {
            entry.contentHashes.remove(contentHash);
            if (entry.contentHashes.isEmpty()) {
                dropped.set(true);
                return null;
            }
            return entry;
        });
        return dropped.get();
    }

    public Optional<NameMatch> exact(String query) {
        String key = SymbolStore.lowercase(query);
        NameEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new NameMatch(key, entry.displayName, Set.copyOf(entry.contentHashes), 1.0));
    }

    public List<NameMatch> prefix(String query, int limit) {
        String prefix = SymbolStore.lowercase(query);
        List<NameMatch> matches = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (key.startsWith(prefix)) {
                matches.add(new NameMatch(key, entry.displayName, Set.copyOf(entry.contentHashes),
                        TrigramSimilarity.similarity(prefix, key)));
            }
        });
        matches.sort(Comparator.comparingInt((NameMatch match) -> match.nameLowercase().length())
                .thenComparing(NameMatch::nameLowercase));
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
    }

    public List<NameMatch> fuzzy(String query, double threshold, int limit) {
        String needle = SymbolStore.lowercase(query);
        List<NameMatch> matches = new ArrayList<>();
        entries.forEach((key, entry) -> {
            double similarity = TrigramSimilarity.similarity(needle, key);
            if (key.contains(needle) || similarity >= threshold) {
                matches.add(new NameMatch(key, entry.displayName, Set.copyOf(entry.contentHashes), similarity));
            }
        });
        matches.sort(Comparator.comparingDouble(NameMatch::similarity).reversed()
                .thenComparing(NameMatch::nameLowercase));
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
    }

    public boolean contains(String nameLowercase) {
        return entries.containsKey(nameLowercase);
    }

    public boolean hasRef(String nameLowercase, String contentHash) {
        NameEntry entry = entries.get(nameLowercase);
        return entry != null && entry.contentHashes.contains(contentHash);
    }

    public int nameCount() {
        return entries.size();
    }

    public int refCount() {
        return entries.values().stream().mapToInt(entry -> entry.contentHashes.size()).sum();
    }

    public List<SymbolName> names() {
        return entries.entrySet().stream()
                .map(entry -> new SymbolName(entry.getKey(), entry.getValue().displayName))
                .sorted(Comparator.comparing(SymbolName::nameLowercase))
                .toList();
    }

    public List<SymbolNameRef> refs() {
        List<SymbolNameRef> refs = new ArrayList<>();
        entries.forEach((key, entry) -> entry.contentHashes.forEach(hash -> refs.add(new SymbolNameRef(key, hash))));
        refs.sort(Comparator.comparing(SymbolNameRef::nameLowercase).thenComparing(SymbolNameRef::contentHash));
        return refs;
    }

    public void replaceAll(Map<String, NameEntry> rebuilt) {
        entries = new ConcurrentHashMap<>(rebuilt);
    }

    public void restore(List<SymbolName> names, List<SymbolNameRef> refs) {
        ConcurrentHashMap<String, NameEntry> restored = new ConcurrentHashMap<>();
        for (SymbolName name : names) {
            restored.put(name.nameLowercase(), new NameEntry(name.displayName()));
        }
        for (SymbolNameRef ref : refs) {
            NameEntry entry = restored.get(ref.nameLowercase());
            if (entry != null) {
                entry.contentHashes.add(ref.contentHash());
            }
        }
        restored.values().removeIf(entry -> entry.contentHashes.isEmpty());
        entries = restored;
    }

    public static final class NameEntry {
        private final String displayName;
        private final Set<String> contentHashes = ConcurrentHashMap.newKeySet();

        public NameEntry(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }

        public Set<String> contentHashes() {
            return contentHashes;
        }
    }
}
