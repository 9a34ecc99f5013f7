package com.pointer.gc;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.content.ContentStore;
import com.pointer.ingest.FileTable;
import com.pointer.store.HashLocks;
import com.pointer.symbols.NameCache;
import com.pointer.symbols.SymbolStore;

/**
 * Reclaims content that no file row references any more.
 *
 * <p>A blob is a candidate when it has no file rows. Each candidate is re-checked and deleted while
 * holding its content hash's lock, which ingestion also holds between storing content and writing
 * the file row, so a blob an in-flight ingest is about to reference is never collected. Deletion
 * order: symbols, name-cache refs, manifest and chunk counts, blob. A pass can stop or fail at
 * any candidate and the next pass picks up where it left off.
 */
public class GarbageCollector {
    private static final Logger log = LoggerFactory.getLogger(GarbageCollector.class);

    private final ContentStore contentStore;
    private final FileTable fileTable;
    private final SymbolStore symbolStore;
    private final NameCache nameCache;
    private final HashLocks locks;
    private final Lock maintenanceLock;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public GarbageCollector(ContentStore contentStore, FileTable fileTable, SymbolStore symbolStore,
                            NameCache nameCache, HashLocks locks, Lock maintenanceLock) {
        this.contentStore = contentStore;
        this.fileTable = fileTable;
        this.symbolStore = symbolStore;
        this.nameCache = nameCache;
        this.locks = locks;
        this.maintenanceLock = maintenanceLock;
    }

    public GcReport runOnce() {
        maintenanceLock.lock();
        try {
            return sweep();
        } finally {
            maintenanceLock.unlock();
        }
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    private GcReport sweep() {
        stopRequested.set(false);
        long started = System.currentTimeMillis();
        List<String> candidates = contentStore.blobHashes().stream()
                .filter(hash -> !fileTable.hasFiles(hash))
                .sorted()
                .toList();
        Tally tally = new Tally();
        boolean stopped = false;
        for (String hash : candidates) {
            if (stopRequested.get()) {
                stopped = true;
                log.info("gc.stop reason=requested processed={} candidates={}", tally.blobs + tally.failures, candidates.size());
                break;
            }
            try {
                locks.runWithLock(hash, () -> collect(hash, tally));
            } catch (RuntimeException e) {
                tally.failures++;
                log.warn("gc.candidate.failed hash={} reason={}", hash, e.getMessage(), e);
            }
        }
        if (!stopped) {
            sweepOrphanSymbols(tally);
        }
        tally.chunks += contentStore.deleteUnreferencedChunks();
        GcReport report = new GcReport(candidates.size(), tally.blobs, tally.symbols, tally.refs, tally.names,
                tally.chunks, tally.failures, stopped);
        log.info("gc.sweep.completed candidates={} blobs={} symbols={} nameRefs={} names={} chunks={} failures={} durationMs={}",
                report.candidates(), report.blobsDeleted(), report.symbolsDeleted(), report.nameRefsDetached(),
                report.namesRemoved(), report.chunksDeleted(), report.failures(), System.currentTimeMillis() - started);
        return report;
    }

    private void collect(String hash, Tally tally) {
        if (fileTable.hasFiles(hash) || !contentStore.contains(hash)) {
            return;
        }
        dropSymbols(hash, tally);
        ContentStore.DeleteOutcome outcome = contentStore.delete(hash);
        if (outcome.deleted()) {
            tally.blobs++;
            tally.chunks += outcome.chunksDeleted();
        }
    }

    private void dropSymbols(String hash, Tally tally) {
        symbolStore.deleteByHash(hash).ifPresent(removed -> {
            tally.symbols += removed.symbols().size();
            for (Map.Entry<String, String> name : removed.names().entrySet()) {
                if (nameCache.hasRef(name.getKey(), hash)) {
                    tally.refs++;
                }
                if (nameCache.detach(name.getKey(), hash)) {
                    tally.names++;
                }
            }
        });
    }

    private void sweepOrphanSymbols(Tally tally) {
        for (String hash : symbolStore.contentHashes()) {
            if (contentStore.contains(hash)) {
                continue;
            }
            try {
                locks.runWithLock(hash, () -> {
                    if (!contentStore.contains(hash)) {
                        log.error("gc.orphan.symbols hash={}", hash);
                        dropSymbols(hash, tally);
                    }
                });
            } catch (RuntimeException e) {
                tally.failures++;
                log.warn("gc.orphan.failed hash={} reason={}", hash, e.getMessage(), e);
            }
        }
    }

    private static final class Tally {
        private int blobs;
        private int symbols;
        private int refs;
        private int names;
        private int chunks;
        private int failures;
    }
}
