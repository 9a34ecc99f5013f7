package com.pointer.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private IngestConfig ingest = new IngestConfig();
    private NameCacheConfig nameCache = new NameCacheConfig();
    private RetentionConfig retention = new RetentionConfig();
    private GcConfig gc = new GcConfig();
    private SearchConfig search = new SearchConfig();
    private MaintenanceConfig maintenance = new MaintenanceConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public IngestConfig getIngest() {
        return ingest;
    }

    public void setIngest(IngestConfig ingest) {
        this.ingest = ingest == null ? new IngestConfig() : ingest;
    }

    public NameCacheConfig getNameCache() {
        return nameCache;
    }

    public void setNameCache(NameCacheConfig nameCache) {
        this.nameCache = nameCache == null ? new NameCacheConfig() : nameCache;
    }

    public RetentionConfig getRetention() {
        return retention;
    }

    public void setRetention(RetentionConfig retention) {
        this.retention = retention == null ? new RetentionConfig() : retention;
    }

    public GcConfig getGc() {
        return gc;
    }

    public void setGc(GcConfig gc) {
        this.gc = gc == null ? new GcConfig() : gc;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public MaintenanceConfig getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(MaintenanceConfig maintenance) {
        this.maintenance = maintenance == null ? new MaintenanceConfig() : maintenance;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String indexPath = ".pointer/index.json";
        private int lockStripes = 256;

        public String getIndexPath() {
            return indexPath;
        }

        public void setIndexPath(String indexPath) {
            this.indexPath = indexPath;
        }

        public int getLockStripes() {
            return lockStripes;
        }

        public void setLockStripes(int lockStripes) {
            this.lockStripes = lockStripes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestConfig {
        private int parallelism = 4;
        private int chunkMinBytes = 64 * 1024;
        private int chunkAvgBytes = 256 * 1024;
        private int chunkMaxBytes = 1024 * 1024;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public int getChunkMinBytes() {
            return chunkMinBytes;
        }

        public void setChunkMinBytes(int chunkMinBytes) {
            this.chunkMinBytes = chunkMinBytes;
        }

        public int getChunkAvgBytes() {
            return chunkAvgBytes;
        }

        public void setChunkAvgBytes(int chunkAvgBytes) {
            this.chunkAvgBytes = chunkAvgBytes;
        }

        public int getChunkMaxBytes() {
            return chunkMaxBytes;
        }

        public void setChunkMaxBytes(int chunkMaxBytes) {
            this.chunkMaxBytes = chunkMaxBytes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NameCacheConfig {
        private long maintainerIntervalMs = 500;
        private int batchSize = 512;
        private int rebuildShards = 8;
        private int cleanupBatchSize = 1000;
        private int cleanupMaxBatches = 10;

        public long getMaintainerIntervalMs() {
            return maintainerIntervalMs;
        }

        public void setMaintainerIntervalMs(long maintainerIntervalMs) {
            this.maintainerIntervalMs = maintainerIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getRebuildShards() {
            return rebuildShards;
        }

        public void setRebuildShards(int rebuildShards) {
            this.rebuildShards = rebuildShards;
        }

        public int getCleanupBatchSize() {
            return cleanupBatchSize;
        }

        public void setCleanupBatchSize(int cleanupBatchSize) {
            this.cleanupBatchSize = cleanupBatchSize;
        }

        public int getCleanupMaxBatches() {
            return cleanupMaxBatches;
        }

        public void setCleanupMaxBatches(int cleanupMaxBatches) {
            this.cleanupMaxBatches = cleanupMaxBatches;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetentionConfig {
        private int defaultLatestKeepCount = 1;
        private long intervalMs = 3600000;

        public int getDefaultLatestKeepCount() {
            return defaultLatestKeepCount;
        }

        public void setDefaultLatestKeepCount(int defaultLatestKeepCount) {
            this.defaultLatestKeepCount = defaultLatestKeepCount;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GcConfig {
        private boolean enabled = true;
        private long intervalMs = 600000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
        private int contextLines = 2;
        private double fuzzyThreshold = 0.3;
        private double ngramThreshold = 0.3;
        private int nameCandidateLimit = 200;
        private String highlightOpen = "<mark>";
        private String highlightClose = "</mark>";

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getContextLines() {
            return contextLines;
        }

        public void setContextLines(int contextLines) {
            this.contextLines = contextLines;
        }

        public double getFuzzyThreshold() {
            return fuzzyThreshold;
        }

        public void setFuzzyThreshold(double fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
        }

        public double getNgramThreshold() {
            return ngramThreshold;
        }

        public void setNgramThreshold(double ngramThreshold) {
            this.ngramThreshold = ngramThreshold;
        }

        public int getNameCandidateLimit() {
            return nameCandidateLimit;
        }

        public void setNameCandidateLimit(int nameCandidateLimit) {
            this.nameCandidateLimit = nameCandidateLimit;
        }

        public String getHighlightOpen() {
            return highlightOpen;
        }

        public void setHighlightOpen(String highlightOpen) {
            this.highlightOpen = highlightOpen;
        }

        public String getHighlightClose() {
            return highlightClose;
        }

        public void setHighlightClose(String highlightClose) {
            this.highlightClose = highlightClose;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MaintenanceConfig {
        private int maxRetries = 3;
        private long retryBackoffMs = 5000;
        private long maxCycles = 0;
        private long maxRuntimeMs = 0;
        private String statePath = ".pointer/maintenance-state.json";

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getMaxCycles() {
            return maxCycles;
        }

        public void setMaxCycles(long maxCycles) {
            this.maxCycles = maxCycles;
        }

        public long getMaxRuntimeMs() {
            return maxRuntimeMs;
        }

        public void setMaxRuntimeMs(long maxRuntimeMs) {
            this.maxRuntimeMs = maxRuntimeMs;
        }

        public String getStatePath() {
            return statePath;
        }

        public void setStatePath(String statePath) {
            this.statePath = statePath;
        }
    }
}
