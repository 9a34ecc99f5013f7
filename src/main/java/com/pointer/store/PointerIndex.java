package com.pointer.store;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.content.ContentDefinedChunker;
import com.pointer.content.ContentStore;
import com.pointer.gc.GarbageCollector;
import com.pointer.gc.GcReport;
import com.pointer.ingest.ExtractedFile;
import com.pointer.ingest.FileTable;
import com.pointer.ingest.IngestResult;
import com.pointer.ingest.IngestionReport;
import com.pointer.ingest.IngestionService;
import com.pointer.retention.CommitPruner;
import com.pointer.retention.KeepSetCalculator;
import com.pointer.retention.LiveBranchRegistry;
import com.pointer.retention.RetentionEngine;
import com.pointer.retention.RetentionReport;
import com.pointer.retention.RetentionStore;
import com.pointer.runtime.AppConfig;
import com.pointer.search.ContextExtractor;
import com.pointer.search.QueryParser;
import com.pointer.search.RankingScorer;
import com.pointer.search.SearchPage;
import com.pointer.search.SearchRequest;
import com.pointer.search.SearchService;
import com.pointer.symbols.NameCache;
import com.pointer.symbols.NameCacheMaintainer;
import com.pointer.symbols.NameCacheRebuilder;
import com.pointer.symbols.SymbolNameRef;
import com.pointer.symbols.SymbolStore;

public class PointerIndex implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PointerIndex.class);

    private final AppConfig config;
    private final Clock clock;
    private final HashLocks locks;
    private final ContentStore contentStore;
    private final FileTable fileTable;
    private final SymbolStore symbolStore;
    private final NameCache nameCache;
    private final NameCacheMaintainer nameCacheMaintainer;
    private final NameCacheRebuilder nameCacheRebuilder;
    private final LiveBranchRegistry liveBranches;
    private final RetentionStore retentionStore;
    private final CommitPruner commitPruner;
    private final RetentionEngine retentionEngine;
    private final GarbageCollector garbageCollector;
    private final IngestionService ingestionService;
    private final SearchService searchService;
    private final ReentrantLock maintenanceLock = new ReentrantLock();
    private final IndexSnapshotStore snapshotStore = new IndexSnapshotStore();

    public PointerIndex(AppConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        AppConfig.IngestConfig ingest = config.getIngest();
        AppConfig.SearchConfig search = config.getSearch();
        this.locks = new HashLocks(config.getStorage().getLockStripes());
        this.contentStore = new ContentStore(locks,
                new ContentDefinedChunker(ingest.getChunkMinBytes(), ingest.getChunkAvgBytes(), ingest.getChunkMaxBytes()));
        this.fileTable = new FileTable();
        this.symbolStore = new SymbolStore();
        this.nameCache = new NameCache();
        this.nameCacheMaintainer = new NameCacheMaintainer(nameCache, symbolStore, locks, config.getNameCache().getBatchSize());
        this.nameCacheRebuilder = new NameCacheRebuilder(symbolStore, nameCache, nameCacheMaintainer, locks);
        this.liveBranches = new LiveBranchRegistry();
        this.retentionStore = new RetentionStore(config.getRetention().getDefaultLatestKeepCount(), liveBranches);
        this.commitPruner = new CommitPruner(retentionStore, fileTable);
        this.retentionEngine = new RetentionEngine(retentionStore, new KeepSetCalculator(clock), commitPruner);
        this.garbageCollector = new GarbageCollector(contentStore, fileTable, symbolStore, nameCache, locks, maintenanceLock);
        this.ingestionService = new IngestionService(contentStore, fileTable, symbolStore, nameCacheMaintainer, locks);
        this.searchService = new SearchService(contentStore, fileTable, symbolStore, nameCache, new RankingScorer(),
                new ContextExtractor(search.getHighlightOpen(), search.getHighlightClose()), new QueryParser(),
                new SearchService.Limits(search.getMaxPageSize(), search.getFuzzyThreshold(), search.getNgramThreshold(),
                        search.getNameCandidateLimit()));
    }

    public static PointerIndex open(AppConfig config, Clock clock) throws IOException {
        PointerIndex index = new PointerIndex(config, clock);
        index.restore(index.snapshotStore.load(index.indexPath()));
        return index;
    }

    public IngestResult ingest(ExtractedFile file) {
        return ingestionService.ingest(file);
    }

    public IngestionReport ingestAll(List<ExtractedFile> files) {
        return ingestionService.ingestAll(files, config.getIngest().getParallelism());
    }

    public boolean completeCommit(String repository, String branch, String commit) {
        return completeCommit(repository, branch, commit, clock.instant());
    }

    public boolean completeCommit(String repository, String branch, String commit, Instant indexedAt) {
        boolean recorded = retentionStore.recordSnapshot(repository, branch, commit, indexedAt);
        log.info("ingest.commit.completed repo={} branch={} commit={} recorded={}", repository, branch, commit, recorded);
        return recorded;
    }

    public SearchPage search(SearchRequest request) {
        return searchService.search(request);
    }

    public GcReport runGc() {
        return garbageCollector.runOnce();
    }

    public RetentionReport runRetention() {
        return retentionEngine.runOnce();
    }

    public NameCacheRebuilder.RebuildReport rebuildNameCache(int shardCount) {
        return exclusive(() -> nameCacheRebuilder.rebuild(shardCount));
    }

    public NameCacheRebuilder.CleanupReport cleanupNameCache(int batchSize, int maxBatches) {
        return exclusive(() -> nameCacheRebuilder.cleanup(batchSize, maxBatches));
    }

    public int flushNameCache() {
        return nameCacheMaintainer.flush();
    }

    public void startBackgroundMaintenance() {
        nameCacheMaintainer.start(config.getNameCache().getMaintainerIntervalMs());
    }

    public void requestStop() {
        garbageCollector.requestStop();
        retentionEngine.requestStop();
    }

    public ConsistencyReport verify() {
        nameCacheMaintainer.flush();
        return exclusive(() -> {
            List<SymbolNameRef> orphanRefs = new ArrayList<>();
            for (SymbolNameRef ref : nameCache.refs()) {
                if (!symbolStore.hasName(ref.contentHash(), ref.nameLowercase())) {
                    orphanRefs.add(ref);
                }
            }
            List<SymbolNameRef> missingRefs = new ArrayList<>();
            List<String> orphanSymbols = new ArrayList<>();
            for (String hash : symbolStore.contentHashes().stream().sorted().toList()) {
                if (!contentStore.contains(hash)) {
                    orphanSymbols.add(hash);
                }
                for (String name : symbolStore.names(hash).keySet()) {
                    if (!nameCache.hasRef(name, hash)) {
                        missingRefs.add(new SymbolNameRef(name, hash));
                    }
                }
            }
            int awaitingGc = (int) contentStore.blobHashes().stream().filter(hash -> !fileTable.hasFiles(hash)).count();
            ConsistencyReport report = new ConsistencyReport(contentStore.refCountMismatches(), orphanRefs, missingRefs,
                    orphanSymbols, awaitingGc);
            if (!report.consistent()) {
                log.error("index.inconsistent refCounts={} orphanNameRefs={} missingNameRefs={} orphanSymbols={}",
                        report.refCountMismatches().size(), orphanRefs.size(), missingRefs.size(), orphanSymbols.size());
            }
            return report;
        });
    }

    public IndexState exportState() {
        return exclusive(() -> new IndexState(IndexState.CURRENT_VERSION, clock.instant(), contentStore.exportBlobs(),
                contentStore.exportManifest(), contentStore.exportChunks(), fileTable.all(), symbolStore.exportReferences(),
                nameCache.names(), nameCache.refs(), retentionStore.export()));
    }

    public void restore(IndexState state) {
        exclusive(() -> {
            contentStore.restore(state.blobs(), state.manifest(), state.chunks());
            fileTable.restore(state.files());
            symbolStore.restore(state.symbolReferences());
            nameCache.restore(state.symbolNames(), state.symbolNameRefs());
            retentionStore.restore(state.retention());
            return null;
        });
    }

    public void save() throws IOException {
        nameCacheMaintainer.flush();
        snapshotStore.save(indexPath(), exportState());
    }

    public Path indexPath() {
        return Path.of(config.getStorage().getIndexPath());
    }

    public AppConfig config() {
        return config;
    }

    public ContentStore contentStore() {
        return contentStore;
    }

    public FileTable fileTable() {
        return fileTable;
    }

    public SymbolStore symbolStore() {
        return symbolStore;
    }

    public NameCache nameCache() {
        return nameCache;
    }

    public NameCacheMaintainer nameCacheMaintainer() {
        return nameCacheMaintainer;
    }

    public RetentionStore retentionStore() {
        return retentionStore;
    }

    public CommitPruner commitPruner() {
        return commitPruner;
    }

    @Override
    public void close() {
        nameCacheMaintainer.close();
    }

    private <T> T exclusive(Supplier<T> action) {
        maintenanceLock.lock();
        try {
            return nameCacheMaintainer.runExclusive(action);
        } finally {
            maintenanceLock.unlock();
        }
    }
}
