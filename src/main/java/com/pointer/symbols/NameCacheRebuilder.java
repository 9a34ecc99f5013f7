package com.pointer.symbols;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.store.HashLocks;

public class NameCacheRebuilder {
    private static final Logger log = LoggerFactory.getLogger(NameCacheRebuilder.class);

    private final SymbolStore symbolStore;
    private final NameCache nameCache;
    private final NameCacheMaintainer maintainer;
    private final HashLocks locks;

    public NameCacheRebuilder(SymbolStore symbolStore, NameCache nameCache, NameCacheMaintainer maintainer, HashLocks locks) {
        this.symbolStore = symbolStore;
        this.nameCache = nameCache;
        this.maintainer = maintainer;
        this.locks = locks;
    }

    /**
     * Rebuilds the cache from the symbol table. Lowercase names are partitioned into
     * {@code shardCount} shards by hash, the shards are built in parallel, and the merged result
     * replaces the cache while the maintainer is paused. The display spelling of a rebuilt name is
     * its lexicographically smallest spelling.
     */
    public RebuildReport rebuild(int shardCount) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be > 0");
        }
        long started = System.currentTimeMillis();
        return maintainer.runExclusive(() -> {
            int previousNames = nameCache.nameCount();
            int previousRefs = nameCache.refCount();
            Set<String> hashes = symbolStore.contentHashes();
            Map<String, NameCache.NameEntry> merged = new HashMap<>();
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(shardCount, Runtime.getRuntime().availableProcessors()));
            try {
                List<Future<Map<String, NameCache.NameEntry>>> shards = new ArrayList<>();
                for (int shard = 0; shard < shardCount; shard++) {
                    int current = shard;
                    shards.add(pool.submit(() -> buildShard(hashes, current, shardCount)));
                }
                for (Future<Map<String, NameCache.NameEntry>> shard : shards) {
                    merged.putAll(shard.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("name cache rebuild interrupted", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("name cache shard failed: " + e.getCause().getMessage(), e.getCause());
            } finally {
                pool.shutdownNow();
            }
            nameCache.replaceAll(merged);
            RebuildReport report = new RebuildReport(shardCount, previousNames, previousRefs,
                    nameCache.nameCount(), nameCache.refCount(), System.currentTimeMillis() - started);
            log.info("name-cache.rebuild.completed shards={} names={} refs={} previousNames={} previousRefs={} durationMs={}",
                    report.shards(), report.names(), report.refs(), report.previousNames(), report.previousRefs(), report.durationMs());
            return report;
        });
    }

    public CleanupReport cleanup(int batchSize, int maxBatches) {
        if (batchSize <= 0 || maxBatches <= 0) {
            throw new IllegalArgumentException("batchSize and maxBatches must be > 0");
        }
        return maintainer.runExclusive(() -> {
            List<SymbolNameRef> orphans = nameCache.refs().stream()
                    .filter(ref -> !symbolStore.hasName(ref.contentHash(), ref.nameLowercase()))
                    .toList();
            int batches = 0;
            int refsRemoved = 0;
            int namesRemoved = 0;
            int offset = 0;
            while (offset < orphans.size() && batches < maxBatches) {
                List<SymbolNameRef> batch = orphans.subList(offset, Math.min(orphans.size(), offset + batchSize));
                for (SymbolNameRef ref : batch) {
                    boolean[] dropped = new boolean[2];
                    locks.runWithLock(ref.contentHash(), () -> {
                        if (!symbolStore.hasName(ref.contentHash(), ref.nameLowercase())
                                && nameCache.hasRef(ref.nameLowercase(), ref.contentHash())) {
                            dropped[0] = true;
                            dropped[1] = nameCache.detach(ref.nameLowercase(), ref.contentHash());
                        }
                    });
                    refsRemoved += dropped[0] ? 1 : 0;
                    namesRemoved += dropped[1] ? 1 : 0;
                }
                offset += batch.size();
                batches++;
            }
            CleanupReport report = new CleanupReport(batches, refsRemoved, namesRemoved, orphans.size() - offset);
            log.info("name-cache.cleanup.completed batches={} refsRemoved={} namesRemoved={} remaining={}",
                    report.batches(), report.refsRemoved(), report.namesRemoved(), report.remaining());
            return report;
        });
    }

    private Map<String, NameCache.NameEntry> buildShard(Set<String> hashes, int shard, int shardCount) {
        Map<String, String> display = new HashMap<>();
        Map<String, NameCache.NameEntry> entries = new HashMap<>();
        Map<String, List<String>> refs = new HashMap<>();
        for (String hash : hashes) {
            for (Map.Entry<String, String> name : symbolStore.names(hash).entrySet()) {
                String lowercase = name.getKey();
                if (Math.floorMod(lowercase.hashCode(), shardCount) != shard) {
                    continue;
                }
                display.merge(lowercase, name.getValue(), (left, right) -> left.compareTo(right) <= 0 ? left : right);
                refs.computeIfAbsent(lowercase, unused -> new ArrayList<>()).add(hash);
            }
        }
        refs.forEach((lowercase, contentHashes) -> {
            NameCache.NameEntry entry = new NameCache.NameEntry(display.get(lowercase));
            entry.contentHashes().addAll(contentHashes);
            entries.put(lowercase, entry);
        });
        return entries;
    }

    public record RebuildReport(int shards, int previousNames, int previousRefs, int names, int refs, long durationMs) {
    }

    public record CleanupReport(int batches, int refsRemoved, int namesRemoved, int remaining) {
    }
}
