package com.pointer.ingest;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileTableTest {

    private final FileTable table = new FileTable();

    @Test
    void shouldTrackFilesByContentHash() {
        table.upsert(new FileRecord("core", "c1", "a.cpp", "h1"));
        table.upsert(new FileRecord("core", "c2", "a.cpp", "h1"));
        table.upsert(new FileRecord("core", "c2", "b.cpp", "h2"));

        assertEquals(2, table.fileCount("h1"));
        assertEquals(List.of("c1", "c2"), table.filesFor("h1").stream().map(FileRecord::commit).toList());
        assertTrue(table.hasCommit("core", "c2"));
        assertTrue(table.hasRepository("core"));
    }

    @Test
    void shouldMoveHashIndexWhenPathChangesContent() {
        table.upsert(new FileRecord("core", "c1", "a.cpp", "h1"));

        table.upsert(new FileRecord("core", "c1", "a.cpp", "h2"));

        assertFalse(table.hasFiles("h1"));
        assertEquals(1, table.fileCount("h2"));
        assertEquals(1, table.size());
    }

    @Test
    void shouldRemoveWholeCommit() {
        table.upsert(new FileRecord("core", "c1", "a.cpp", "h1"));
        table.upsert(new FileRecord("core", "c1", "b.cpp", "h2"));
        table.upsert(new FileRecord("core", "c2", "a.cpp", "h1"));

        assertEquals(2, table.removeCommit("core", "c1"));

        assertFalse(table.hasCommit("core", "c1"));
        assertFalse(table.hasFiles("h2"));
        assertTrue(table.hasFiles("h1"));
        assertEquals(0, table.removeCommit("core", "missing"));
    }

    @Test
    void shouldRemoveRepositoryInBatches() {
        for (int i = 0; i < 5; i++) {
            table.upsert(new FileRecord("core", "c1", "f" + i, "h" + i));
        }
        table.upsert(new FileRecord("other", "c1", "f0", "h0"));

        assertEquals(2, table.removeRepositoryBatch("core", 2));
        assertEquals(2, table.removeRepositoryBatch("core", 2));
        assertEquals(1, table.removeRepositoryBatch("core", 2));
        assertEquals(0, table.removeRepositoryBatch("core", 2));

        assertFalse(table.hasRepository("core"));
        assertTrue(table.hasFiles("h0"));
    }

    @Test
    void shouldRestoreRows() {
        table.upsert(new FileRecord("core", "c1", "a.cpp", "h1"));
        FileTable restored = new FileTable();

        restored.restore(table.all());

        assertEquals(table.all(), restored.all());
        assertTrue(restored.hasFiles("h1"));
    }
}
