package com.pointer.maintenance;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pointer.ingest.ExtractedFile;
import com.pointer.retention.RetentionReport;
import com.pointer.runtime.AppConfig;
import com.pointer.store.PointerIndex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MaintenanceCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-05-01T00:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldRunRetentionAndGcUntilMaxCycles() throws Exception {
        AppConfig config = config(2);
        AtomicLong millis = new AtomicLong(NOW.toEpochMilli());
        List<Long> sleeps = new ArrayList<>();
        try (PointerIndex index = new PointerIndex(config, Clock.fixed(NOW, ZoneOffset.UTC))) {
            index.ingest(ExtractedFile.text("core", "old", "a.txt", "text", "old\n", List.of()));
            index.completeCommit("core", "main", "old", NOW.minusSeconds(120));
            index.ingest(ExtractedFile.text("core", "new", "a.txt", "text", "new\n", List.of()));
            index.completeCommit("core", "main", "new", NOW.minusSeconds(60));

            MaintenanceCoordinator coordinator = new MaintenanceCoordinator(index, millis::get, sleep -> {
                sleeps.add(sleep);
                millis.addAndGet(sleep);
            });
            MaintenanceCoordinator.MaintenanceState state = coordinator.runLoop();

            assertEquals(2, state.totalCycles);
            assertEquals("idle", state.lastCycleStatus);
            assertEquals(1, state.successfulCycles);
            assertEquals(1, state.lastRetentionCommitsPruned);
            assertEquals(1, state.lastGcBlobsDeleted);
            assertEquals(1, index.contentStore().blobCount());
            assertFalse(sleeps.isEmpty());
            assertTrue(Files.exists(tempDir.resolve("index.json")));
        }

        MaintenanceCoordinator.MaintenanceState persisted = new ObjectMapper()
                .readValue(tempDir.resolve("maintenance-state.json").toFile(), MaintenanceCoordinator.MaintenanceState.class);
        assertEquals(2, persisted.totalCycles);
    }

    @Test
    void shouldRecordFailedCycleAndContinue() throws Exception {
        AppConfig config = config(1);
        config.getMaintenance().setMaxRetries(1);
        AtomicLong millis = new AtomicLong(NOW.toEpochMilli());
        List<Long> sleeps = new ArrayList<>();
        try (PointerIndex index = new PointerIndex(config, Clock.fixed(NOW, ZoneOffset.UTC)) {
            @Override
            public RetentionReport runRetention() {
                throw new IllegalStateException("retention store unavailable");
            }
        }) {
            MaintenanceCoordinator coordinator = new MaintenanceCoordinator(index, millis::get, sleep -> {
                sleeps.add(sleep);
                millis.addAndGet(sleep);
            });

            MaintenanceCoordinator.MaintenanceState state = coordinator.runLoop();

            assertEquals(1, state.failedCycles);
            assertEquals("retention store unavailable", state.lastError);
            assertEquals(10L, sleeps.get(0));
        }
    }

    @Test
    void shouldGrowRetryBackoffLinearly() throws Exception {
        AppConfig config = config(1);
        config.getMaintenance().setMaxRetries(3);
        AtomicLong millis = new AtomicLong(NOW.toEpochMilli());
        List<Long> sleeps = new ArrayList<>();
        try (PointerIndex index = new PointerIndex(config, Clock.fixed(NOW, ZoneOffset.UTC)) {
            @Override
            public RetentionReport runRetention() {
                throw new IllegalStateException("retention store unavailable");
            }
        }) {
            MaintenanceCoordinator coordinator = new MaintenanceCoordinator(index, millis::get, sleep -> {
                sleeps.add(sleep);
                millis.addAndGet(sleep);
            });

            coordinator.runLoop();

            assertEquals(List.of(10L, 20L, 30L), sleeps.subList(0, 3));
        }
    }

    private AppConfig config(long maxCycles) {
        AppConfig config = new AppConfig();
        config.getStorage().setIndexPath(tempDir.resolve("index.json").toString());
        config.getMaintenance().setStatePath(tempDir.resolve("maintenance-state.json").toString());
        config.getMaintenance().setMaxCycles(maxCycles);
        config.getMaintenance().setRetryBackoffMs(10);
        config.getRetention().setIntervalMs(60_000);
        config.getGc().setIntervalMs(60_000);
        return config;
    }
}
