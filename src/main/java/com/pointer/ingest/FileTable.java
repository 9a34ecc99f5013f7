package com.pointer.ingest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class FileTable {
    private static final Comparator<FileRecord> ORDER = Comparator.comparing(FileRecord::repository)
            .thenComparing(FileRecord::commit)
            .thenComparing(FileRecord::path);

    private final Map<FileKey, FileRecord> files = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<FileKey>> byHash = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CommitKey, Set<FileKey>> byCommit = new ConcurrentHashMap<>();

    public Optional<FileRecord> upsert(FileRecord record) {
        FileKey key = record.key();
        FileRecord previous = files.put(key, record);
        link(byHash, record.contentHash(), key);
        link(byCommit, new CommitKey(record.repository(), record.commit()), key);
        if (previous != null && !previous.contentHash().equals(record.contentHash())) {
            unlink(byHash, previous.contentHash(), key);
        }
        return Optional.ofNullable(previous);
    }

    public Optional<FileRecord> get(String repository, String commit, String path) {
        return Optional.ofNullable(files.get(new FileKey(repository, commit, path)));
    }

    public Optional<FileRecord> remove(FileKey key) {
        FileRecord removed = files.remove(key);
        if (removed == null) {
            return Optional.empty();
        }
        unlink(byHash, removed.contentHash(), key);
        unlink(byCommit, new CommitKey(key.repository(), key.commit()), key);
        return Optional.of(removed);
    }

    public int removeCommit(String repository, String commit) {
        Set<FileKey> keys = byCommit.get(new CommitKey(repository, commit));
        if (keys == null) {
            return 0;
        }
        int removed = 0;
        for (FileKey key : List.copyOf(keys)) {
            if (remove(key).isPresent()) {
                removed++;
            }
        }
        return removed;
    }

    public int removeRepositoryBatch(String repository, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        int removed = 0;
        for (CommitKey commitKey : List.copyOf(byCommit.keySet())) {
            if (!commitKey.repository().equals(repository)) {
                continue;
            }
            Set<FileKey> keys = byCommit.get(commitKey);
            if (keys == null) {
                continue;
            }
            for (FileKey key : List.copyOf(keys)) {
                if (removed >= limit) {
                    return removed;
                }
                if (remove(key).isPresent()) {
                    removed++;
                }
            }
        }
        return removed;
    }

    public boolean hasFiles(String contentHash) {
        return byHash.containsKey(contentHash);
    }

    public int fileCount(String contentHash) {
        Set<FileKey> keys = byHash.get(contentHash);
        return keys == null ? 0 : keys.size();
    }

    public List<FileRecord> filesFor(String contentHash) {
        Set<FileKey> keys = byHash.get(contentHash);
        if (keys == null) {
            return List.of();
        }
        List<FileRecord> result = new ArrayList<>();
        for (FileKey key : keys) {
            FileRecord record = files.get(key);
            if (record != null && record.contentHash().equals(contentHash)) {
                result.add(record);
            }
        }
        result.sort(ORDER);
        return result;
    }

    public List<FileRecord> filesForCommit(String repository, String commit) {
        Set<FileKey> keys = byCommit.get(new CommitKey(repository, commit));
        if (keys == null) {
            return List.of();
        }
        return keys.stream().map(files::get).filter(record -> record != null).sorted(ORDER).toList();
    }

    public boolean hasCommit(String repository, String commit) {
        return byCommit.containsKey(new CommitKey(repository, commit));
    }

    public boolean hasRepository(String repository) {
        return byCommit.keySet().stream().anyMatch(key -> key.repository().equals(repository));
    }

    public Set<String> liveContentHashes() {
        return Set.copyOf(byHash.keySet());
    }

    public int size() {
        return files.size();
    }

    public List<FileRecord> all() {
        return files.values().stream().sorted(ORDER).toList();
    }

    public void restore(List<FileRecord> records) {
        files.clear();
        byHash.clear();
        byCommit.clear();
        records.forEach(this::upsert);
    }

    private static <K> void link(ConcurrentHashMap<K, Set<FileKey>> index, K indexKey, FileKey key) {
        index.compute(indexKey, (unused, keys) -> {
            Set<FileKey> next = keys == null ? ConcurrentHashMap.newKeySet() : keys;
            next.add(key);
            return next;
        });
    }

    private static <K> void unlink(ConcurrentHashMap<K, Set<FileKey>> index, K indexKey, FileKey key) {
        index.computeIfPresent(indexKey, (unused, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }

    private record CommitKey(String repository, String commit) {
    }
}
