package com.pointer.gc;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pointer.content.ContentDefinedChunker;
import com.pointer.content.ContentStore;
import com.pointer.ingest.ExtractedFile;
import com.pointer.ingest.ExtractedSymbol;
import com.pointer.ingest.FileRecord;
import com.pointer.ingest.FileTable;
import com.pointer.ingest.IngestResult;
import com.pointer.ingest.IngestionService;
import com.pointer.runtime.AppConfig;
import com.pointer.store.HashLocks;
import com.pointer.store.PointerIndex;
import com.pointer.symbols.NameCache;
import com.pointer.symbols.NameCacheMaintainer;
import com.pointer.symbols.SymbolKind;
import com.pointer.symbols.SymbolReference;
import com.pointer.symbols.SymbolStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GarbageCollectorTest {

    private final HashLocks locks = new HashLocks(16);
    private final ContentStore contentStore = new ContentStore(locks, new ContentDefinedChunker(64, 256, 1024));
    private final FileTable fileTable = new FileTable();
    private final SymbolStore symbolStore = new SymbolStore();
    private final NameCache nameCache = new NameCache();
    private final NameCacheMaintainer maintainer = new NameCacheMaintainer(nameCache, symbolStore, locks, 64);
    private final IngestionService ingestion = new IngestionService(contentStore, fileTable, symbolStore, maintainer, locks);
    private final GarbageCollector gc = new GarbageCollector(contentStore, fileTable, symbolStore, nameCache, locks, new ReentrantLock());
    private GarbageCollector stopper;

    @Test
    void shouldCollectContentWithoutFileRows() {
        IngestResult kept = ingest("c1", "kept.cpp", "void keep();\n", "keep");
        IngestResult dropped = ingest("c2", "gone.cpp", "void gone();\n", "gone");
        maintainer.flush();
        fileTable.removeCommit("core", "c2");

        GcReport report = gc.runOnce();

        assertEquals(1, report.candidates());
        assertEquals(1, report.blobsDeleted());
        assertEquals(1, report.symbolsDeleted());
        assertEquals(1, report.namesRemoved());
        assertFalse(contentStore.contains(dropped.contentHash()));
        assertFalse(symbolStore.hasSymbols(dropped.contentHash()));
        assertFalse(nameCache.contains("gone"));
        assertTrue(contentStore.contains(kept.contentHash()));
        assertTrue(nameCache.hasRef("keep", kept.contentHash()));
        assertTrue(contentStore.refCountMismatches().isEmpty());
    }

    @Test
    void shouldKeepSharedNameWhileAnotherHashStillHasIt() {
        IngestResult first = ingest("c1", "a.cpp", "void shared();\n", "shared");
        IngestResult second = ingest("c2", "b.cpp", "void shared() {}\n", "shared");
        maintainer.flush();
        fileTable.removeCommit("core", "c1");

        GcReport report = gc.runOnce();

        assertEquals(1, report.nameRefsDetached());
        assertEquals(0, report.namesRemoved());
        assertFalse(nameCache.hasRef("shared", first.contentHash()));
        assertTrue(nameCache.hasRef("shared", second.contentHash()));
    }

    @Test
    void shouldDoNothingOnSecondRun() {
        ingest("c1", "a.cpp", "void a();\n", "a");
        fileTable.removeCommit("core", "c1");
        maintainer.flush();
        gc.runOnce();

        GcReport second = gc.runOnce();

        assertEquals(0, second.candidates());
        assertEquals(0, second.blobsDeleted());
        assertEquals(0, second.chunksDeleted());
        assertEquals(0, contentStore.blobCount());
        assertEquals(0, contentStore.chunkCount());
    }

    @Test
    void shouldRemoveSymbolsWhoseContentIsGone() {
        symbolStore.insertIfAbsent("orphan", List.of(new SymbolReference("orphan", null, "lost", "lost", SymbolKind.DEFINITION, 1, 1)));
        nameCache.attach("lost", "orphan");

        GcReport report = gc.runOnce();

        assertEquals(1, report.symbolsDeleted());
        assertFalse(symbolStore.hasSymbols("orphan"));
        assertFalse(nameCache.contains("lost"));
    }

    @Test
    void shouldStopBeforeFirstCandidateWhenRequested() {
        ingest("c1", "a.cpp", "void a();\n", "a");
        fileTable.removeCommit("core", "c1");
        GarbageCollector stopping = new GarbageCollector(contentStore, new FileTable() {
            @Override
            public boolean hasFiles(String contentHash) {
                gcStop();
                return super.hasFiles(contentHash);
            }
        }, symbolStore, nameCache, locks, new ReentrantLock());
        stopper = stopping;

        GcReport report = stopping.runOnce();

        assertTrue(report.stopped());
        assertEquals(0, report.blobsDeleted());
        assertEquals(1, contentStore.blobCount());
    }

    @Test
    void shouldFinishCollectionOnNextRunAfterCandidateFails() {
        AtomicBoolean failNext = new AtomicBoolean(true);
        ContentStore flaky = new ContentStore(locks, new ContentDefinedChunker(64, 256, 1024)) {
            @Override
            public DeleteOutcome delete(String hash) {
                if (failNext.getAndSet(false)) {
                    throw new IllegalStateException("chunk table unavailable");
                }
                return super.delete(hash);
            }
        };
        IngestionService flakyIngestion = new IngestionService(flaky, fileTable, symbolStore, maintainer, locks);
        GarbageCollector flakyGc = new GarbageCollector(flaky, fileTable, symbolStore, nameCache, locks, new ReentrantLock());
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 80; i++) {
            text.append("int value").append(i).append(" = ").append(i).append(";\n");
        }
        String hash = flakyIngestion.ingest(ExtractedFile.text("core", "c1", "values.cpp", "cpp", text.toString(),
                List.of(new ExtractedSymbol(null, "value0", "value0", SymbolKind.DEFINITION, 1, 5)))).contentHash();
        maintainer.flush();
        fileTable.removeCommit("core", "c1");

        GcReport failed = flakyGc.runOnce();

        assertEquals(1, failed.failures());
        assertEquals(0, failed.blobsDeleted());
        assertTrue(flaky.contains(hash));
        assertFalse(symbolStore.hasSymbols(hash));
        assertTrue(flaky.refCountMismatches().isEmpty());

        GcReport retried = flakyGc.runOnce();

        assertEquals(0, retried.failures());
        assertEquals(1, retried.blobsDeleted());
        assertEquals(0, flaky.blobCount());
        assertEquals(0, flaky.chunkCount());
        assertFalse(nameCache.contains("value0"));
        assertTrue(flaky.refCountMismatches().isEmpty());
    }

    @Test
    void shouldNeverCollectContentWhileItIsBeingIngested(@TempDir Path tempDir) throws Exception {
        AppConfig config = new AppConfig();
        config.getStorage().setIndexPath(tempDir.resolve("index.json").toString());
        String text = "void busy();\n";
        try (PointerIndex index = new PointerIndex(config, Clock.systemUTC())) {
            AtomicBoolean done = new AtomicBoolean(false);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<?> collector = pool.submit(() -> {
                    while (!done.get()) {
                        index.runGc();
                    }
                });
                Future<?> writer = pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        index.ingest(ExtractedFile.text("core", "c" + i, "busy.cpp", "cpp", text,
                                List.of(new ExtractedSymbol(null, "busy", "busy", SymbolKind.DECLARATION, 1, 6))));
                        if (i > 0) {
                            index.fileTable().removeCommit("core", "c" + (i - 1));
                        }
                    }
                    return null;
                });
                writer.get(30, TimeUnit.SECONDS);
                done.set(true);
                collector.get(30, TimeUnit.SECONDS);
            } finally {
                done.set(true);
                pool.shutdownNow();
            }

            index.runGc();

            for (FileRecord file : index.fileTable().all()) {
                assertEquals(text, new String(index.contentStore().get(file.contentHash()), StandardCharsets.UTF_8));
            }
            assertEquals(1, index.fileTable().size());
            assertEquals(1, index.contentStore().blobCount());
            assertTrue(index.verify().consistent());
        }
    }

    private void gcStop() {
        if (stopper != null) {
            stopper.requestStop();
        }
    }

    private IngestResult ingest(String commit, String path, String text, String symbol) {
        return ingestion.ingest(ExtractedFile.text("core", commit, path, "cpp", text,
                List.of(new ExtractedSymbol(null, symbol, symbol, SymbolKind.DECLARATION, 1, 6))));
    }
}
