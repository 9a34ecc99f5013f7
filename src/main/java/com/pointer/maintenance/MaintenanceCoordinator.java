package com.pointer.maintenance;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pointer.gc.GcReport;
import com.pointer.retention.RetentionReport;
import com.pointer.runtime.AppConfig;
import com.pointer.store.PointerIndex;

/**
 * Periodic retention and garbage collection. Each job runs when its interval has elapsed, is
 * retried with linear backoff, and its outcome is written to a JSON state file after every cycle.
 * A failed cycle is recorded and the loop carries on; the next due cycle retries the work.
 */
public class MaintenanceCoordinator {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceCoordinator.class);

    private final PointerIndex index;
    private final AppConfig.RetentionConfig retentionConfig;
    private final AppConfig.GcConfig gcConfig;
    private final AppConfig.MaintenanceConfig maintenanceConfig;
    private final Path statePath;
    private final LongSupplier clockMillis;
    private final Sleeper sleeper;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final ObjectMapper mapper = new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public MaintenanceCoordinator(PointerIndex index) {
        this(index, System::currentTimeMillis, Thread::sleep);
    }

    MaintenanceCoordinator(PointerIndex index, LongSupplier clockMillis, Sleeper sleeper) {
        this.index = index;
        this.retentionConfig = index.config().getRetention();
        this.gcConfig = index.config().getGc();
        this.maintenanceConfig = index.config().getMaintenance();
        this.statePath = Path.of(maintenanceConfig.getStatePath());
        this.clockMillis = clockMillis;
        this.sleeper = sleeper;
    }

    public void requestStop() {
        stopRequested.set(true);
        index.requestStop();
    }

    public MaintenanceState runLoop() throws IOException, InterruptedException {
        validateConfig();
        MaintenanceState state = loadState();
        long processStart = clockMillis.getAsLong();
        if (state.startedAtEpochMs <= 0) {
            state.startedAtEpochMs = processStart;
        }
        persistState(state);

        while (!stopRequested.get()) {
            long now = clockMillis.getAsLong();
            if (shouldStop(state, processStart, now)) {
                break;
            }
            runCycle(state, now);
            long sleepMs = computeSleepMillis(state, clockMillis.getAsLong());
            if (sleepMs > 0 && !stopRequested.get()) {
                sleeper.sleep(sleepMs);
            }
        }

        if (stopRequested.get()) {
            state.lastCycleStatus = "stopped";
        } else if (state.lastCycleStatus == null || "running".equals(state.lastCycleStatus)) {
            state.lastCycleStatus = "completed";
        }
        state.lastUpdatedAtEpochMs = clockMillis.getAsLong();
        persistState(state);
        return state;
    }

    void runCycle(MaintenanceState state, long now) throws IOException {
        state.totalCycles++;
        state.lastCycleStartedAtEpochMs = now;
        state.lastCycleStatus = "running";
        state.lastUpdatedAtEpochMs = now;
        persistState(state);

        boolean didWork = false;
        try {
            int flushed = index.flushNameCache();
            if (flushed > 0) {
                log.debug("maintenance.name-cache.flushed ops={}", flushed);
            }
            if (isDue(state.lastRetentionAtEpochMs, retentionConfig.getIntervalMs(), now)) {
                RetentionReport report = runWithRetries(index::runRetention);
                state.lastRetentionAtEpochMs = clockMillis.getAsLong();
                state.lastRetentionSnapshotsRemoved = report.snapshotsRemoved();
                state.lastRetentionCommitsPruned = report.commitsPruned();
                state.lastRetentionFilesRemoved = report.filesRemoved();
                state.lastRetentionFailures = report.failures();
                didWork = true;
            }
            if (gcConfig.isEnabled() && isDue(state.lastGcAtEpochMs, gcConfig.getIntervalMs(), now)) {
                GcReport report = runWithRetries(index::runGc);
                state.lastGcAtEpochMs = clockMillis.getAsLong();
                state.lastGcBlobsDeleted = report.blobsDeleted();
                state.lastGcChunksDeleted = report.chunksDeleted();
                state.lastGcFailures = report.failures();
                didWork = true;
            }
            if (didWork) {
                index.save();
                state.successfulCycles++;
                state.lastCycleStatus = "success";
                state.lastError = null;
            } else {
                state.lastCycleStatus = "idle";
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            state.failedCycles++;
            state.lastCycleStatus = "failed";
            state.lastError = e.getMessage();
            log.error("maintenance.cycle.failed cycle={} reason={}", state.totalCycles, e.getMessage(), e);
        }

        state.lastCycleCompletedAtEpochMs = clockMillis.getAsLong();
        state.lastUpdatedAtEpochMs = state.lastCycleCompletedAtEpochMs;
        persistState(state);
    }

    private void validateConfig() {
        if (retentionConfig.getIntervalMs() < 0 || gcConfig.getIntervalMs() < 0) {
            throw new IllegalArgumentException("maintenance intervals must be >= 0");
        }
        if (maintenanceConfig.getMaxRetries() < 0 || maintenanceConfig.getRetryBackoffMs() < 0) {
            throw new IllegalArgumentException("maintenance retry settings must be >= 0");
        }
    }

    private boolean shouldStop(MaintenanceState state, long processStart, long now) {
        if (maintenanceConfig.getMaxCycles() > 0 && state.totalCycles >= maintenanceConfig.getMaxCycles()) {
            log.info("maintenance.stop reason=max-cycles cycles={}", state.totalCycles);
            return true;
        }
        if (maintenanceConfig.getMaxRuntimeMs() > 0 && (now - processStart) >= maintenanceConfig.getMaxRuntimeMs()) {
            log.info("maintenance.stop reason=max-runtime runtimeMs={}", now - processStart);
            return true;
        }
        return false;
    }

    private boolean isDue(long lastRunAtEpochMs, long intervalMs, long now) {
        if (lastRunAtEpochMs <= 0) {
            return true;
        }
        return now - lastRunAtEpochMs >= intervalMs;
    }

    private long computeSleepMillis(MaintenanceState state, long now) {
        long retentionSleep = remaining(state.lastRetentionAtEpochMs, retentionConfig.getIntervalMs(), now);
        long gcSleep = gcConfig.isEnabled() ? remaining(state.lastGcAtEpochMs, gcConfig.getIntervalMs(), now) : Long.MAX_VALUE;
        long nextDue = Math.min(retentionSleep, gcSleep);
        return nextDue == Long.MAX_VALUE ? 1000L : Math.max(200L, Math.min(nextDue, 1000L));
    }

    private long remaining(long lastRunAtEpochMs, long intervalMs, long now) {
        if (lastRunAtEpochMs <= 0 || intervalMs == 0) {
            return 0;
        }
        long elapsed = now - lastRunAtEpochMs;
        return elapsed >= intervalMs ? 0 : intervalMs - elapsed;
    }

    private <T> T runWithRetries(ThrowingSupplier<T> supplier) throws Exception {
        Exception last = null;
        int maxAttempts = Math.max(1, maintenanceConfig.getMaxRetries() + 1);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return supplier.get();
            } catch (Exception e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long backoff = maintenanceConfig.getRetryBackoffMs() * attempt;
                log.warn("maintenance.retry attempt={} maxAttempts={} backoffMs={} reason={}", attempt, maxAttempts, backoff, e.getMessage());
                sleeper.sleep(backoff);
            }
        }
        throw last;
    }

    MaintenanceState loadState() throws IOException {
        if (!Files.exists(statePath)) {
            return new MaintenanceState();
        }
        return mapper.readValue(statePath.toFile(), MaintenanceState.class);
    }

    private void persistState(MaintenanceState state) throws IOException {
        Path parent = statePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(statePath.toFile(), state);
    }

    @FunctionalInterface
    private interface ThrowingSupplier<T> {
        T get() throws Exception;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    public static class MaintenanceState {
        public long startedAtEpochMs;
        public long totalCycles;
        public long successfulCycles;
        public long failedCycles;
        public long lastCycleStartedAtEpochMs;
        public long lastCycleCompletedAtEpochMs;
        public String lastCycleStatus;
        public String lastError;
        public long lastRetentionAtEpochMs;
        public long lastGcAtEpochMs;
        public long lastUpdatedAtEpochMs;
        public int lastRetentionSnapshotsRemoved;
        public int lastRetentionCommitsPruned;
        public int lastRetentionFilesRemoved;
        public int lastRetentionFailures;
        public int lastGcBlobsDeleted;
        public int lastGcChunksDeleted;
        public int lastGcFailures;
    }
}
