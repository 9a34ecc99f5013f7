package com.pointer.symbols;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.store.HashLocks;

/**
 * Applies name-cache changes off the ingest path.
 *
 * <p>Ingestion only enqueues; a background worker drains the queue in batches. Each operation is
 * applied under the content hash's lock after re-reading the symbol table, so an operation that was
 * overtaken by a later change (the hash was collected, or re-ingested) applies the current truth
 * rather than its own stale view.
 */
public class NameCacheMaintainer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NameCacheMaintainer.class);

    private final NameCache nameCache;
    private final SymbolStore symbolStore;
    private final HashLocks locks;
    private final int batchSize;
    private final BlockingQueue<NameCacheOp> queue = new LinkedBlockingQueue<>();
    private final ReentrantLock applyLock = new ReentrantLock();
    private ScheduledExecutorService worker;

    public NameCacheMaintainer(NameCache nameCache, SymbolStore symbolStore, HashLocks locks, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.nameCache = nameCache;
        this.symbolStore = symbolStore;
        this.locks = locks;
        this.batchSize = batchSize;
    }

    public void enqueueAttach(String contentHash, Collection<String> names) {
        if (!names.isEmpty()) {
            queue.add(new NameCacheOp(NameCacheOp.Type.ATTACH, contentHash, List.copyOf(names)));
        }
    }

    public void enqueueDetach(String contentHash, Collection<String> names) {
        if (!names.isEmpty()) {
            queue.add(new NameCacheOp(NameCacheOp.Type.DETACH, contentHash, List.copyOf(names)));
        }
    }

    public synchronized void start(long intervalMs) {
        if (worker != null) {
            return;
        }
        worker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "name-cache-maintainer");
            thread.setDaemon(true);
            return thread;
        });
        worker.scheduleWithFixedDelay(this::drainQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("name-cache.maintainer.started intervalMs={} batchSize={}", intervalMs, batchSize);
    }

    public int drainPending(int max) {
        applyLock.lock();
        try {
            List<NameCacheOp> batch = new ArrayList<>();
            queue.drainTo(batch, max);
            for (NameCacheOp op : batch) {
                try {
                    locks.runWithLock(op.contentHash(), () -> apply(op));
                } catch (RuntimeException e) {
                    log.error("name-cache.op.failed type={} hash={} reason={}", op.type(), op.contentHash(), e.getMessage(), e);
                }
            }
            return batch.size();
        } finally {
            applyLock.unlock();
        }
    }

    public int flush() {
        int applied = 0;
        int drained;
        do {
            drained = drainPending(batchSize);
            applied += drained;
        } while (drained > 0);
        return applied;
    }

    public int pending() {
        return queue.size();
    }

    public <T> T runExclusive(Supplier<T> action) {
        applyLock.lock();
        try {
            return action.get();
        } finally {
            applyLock.unlock();
        }
    }

    @Override
    public synchronized void close() {
        if (worker != null) {
            worker.shutdown();
            try {
                if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                    worker.shutdownNow();
                }
            } catch (InterruptedException e) {
                worker.shutdownNow();
                Thread.currentThread().interrupt();
            }
            worker = null;
        }
        int applied = flush();
        log.info("name-cache.maintainer.stopped flushed={}", applied);
    }

    private void apply(NameCacheOp op) {
        for (String name : op.names()) {
            String lowercase = SymbolStore.lowercase(name);
            boolean present = symbolStore.hasName(op.contentHash(), lowercase);
            if (present) {
                nameCache.attach(symbolStore.names(op.contentHash()).getOrDefault(lowercase, name), op.contentHash());
            } else if (nameCache.detach(lowercase, op.contentHash())) {
                log.debug("name-cache.name.removed name={} hash={}", lowercase, op.contentHash());
            }
        }
    }

    private void drainQuietly() {
        try {
            int applied = drainPending(batchSize);
            if (applied > 0) {
                log.debug("name-cache.drain applied={} pending={}", applied, queue.size());
            }
        } catch (RuntimeException e) {
            log.error("name-cache.drain.failed reason={}", e.getMessage(), e);
        }
    }
}
