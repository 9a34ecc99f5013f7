package com.pointer.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.content.ContentHasher;
import com.pointer.content.ContentStore;
import com.pointer.content.PutResult;
import com.pointer.store.HashLocks;
import com.pointer.symbols.NameCacheMaintainer;
import com.pointer.symbols.SymbolReference;
import com.pointer.symbols.SymbolStore;

public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final ContentStore contentStore;
    private final FileTable fileTable;
    private final SymbolStore symbolStore;
    private final NameCacheMaintainer nameCacheMaintainer;
    private final HashLocks locks;

    public IngestionService(ContentStore contentStore, FileTable fileTable, SymbolStore symbolStore,
                            NameCacheMaintainer nameCacheMaintainer, HashLocks locks) {
        this.contentStore = contentStore;
        this.fileTable = fileTable;
        this.symbolStore = symbolStore;
        this.nameCacheMaintainer = nameCacheMaintainer;
        this.locks = locks;
    }

    /**
     * Stores the file's content, records its file row and, for a content hash seen for the first
     * time, its symbols. All three happen under the content hash's lock so a concurrent GC pass
     * cannot collect the blob between the put and the file row.
     */
    public IngestResult ingest(ExtractedFile file) {
        String hash = ContentHasher.sha256(file.content());
        IngestResult result = locks.withLock(hash, () -> {
            PutResult put = contentStore.put(hash, file.content(), file.language());
            fileTable.upsert(new FileRecord(file.repository(), file.commit(), file.path(), hash));
            int indexed = 0;
            if (put.created() && !put.binary()) {
                indexed = symbolStore.insertIfAbsent(hash, toReferences(hash, file.symbols()));
            }
            return new IngestResult(hash, put.created(), put.binary(), indexed);
        });
        if (result.symbolsIndexed() > 0) {
            nameCacheMaintainer.enqueueAttach(hash, symbolStore.names(hash).values());
        }
        log.debug("ingest.file repo={} commit={} path={} hash={} created={} binary={} symbols={}",
                file.repository(), file.commit(), file.path(), hash, result.created(), result.binary(), result.symbolsIndexed());
        return result;
    }

    public IngestionReport ingestAll(List<ExtractedFile> files, int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, files.size())));
        List<Future<IngestResult>> futures = new ArrayList<>();
        try {
            for (ExtractedFile file : files) {
                futures.add(pool.submit(() -> ingest(file)));
            }
            int created = 0;
            int deduped = 0;
            int binary = 0;
            int symbols = 0;
            int failed = 0;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    IngestResult result = futures.get(i).get();
                    if (result.created()) {
                        created++;
                    } else {
                        deduped++;
                    }
                    binary += result.binary() ? 1 : 0;
                    symbols += result.symbolsIndexed();
                } catch (ExecutionException e) {
                    failed++;
                    ExtractedFile file = files.get(i);
                    log.warn("ingest.file.failed repo={} commit={} path={} reason={}",
                            file.repository(), file.commit(), file.path(), e.getCause().getMessage(), e.getCause());
                }
            }
            IngestionReport report = new IngestionReport(files.size(), created, deduped, binary, symbols, failed);
            log.info("ingest.batch.completed files={} newBlobs={} deduped={} binary={} symbols={} failed={}",
                    report.files(), report.newBlobs(), report.dedupedBlobs(), report.binaryFiles(), report.symbolsIndexed(), report.failed());
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("ingestion interrupted", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static List<SymbolReference> toReferences(String hash, List<ExtractedSymbol> symbols) {
        List<SymbolReference> references = new ArrayList<>(symbols.size());
        for (ExtractedSymbol symbol : symbols) {
            references.add(new SymbolReference(hash, emptyToNull(symbol.namespace()), symbol.name(),
                    symbol.fullyQualified() == null ? symbol.name() : symbol.fullyQualified(),
                    symbol.kind(), symbol.line(), symbol.column()));
        }
        return references;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
