package com.pointer.content;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.pointer.store.HashLocks;
import com.pointer.store.NotFoundException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentStoreTest {

    private final ContentStore store = new ContentStore(new HashLocks(16), new ContentDefinedChunker(64, 256, 1024));

    @Test
    void shouldReturnStoredBytesByHash() {
        byte[] bytes = source(200).getBytes(StandardCharsets.UTF_8);

        PutResult put = store.put(bytes, "java");

        assertTrue(put.created());
        assertEquals(ContentHasher.sha256(bytes), put.contentHash());
        assertArrayEquals(bytes, store.get(put.contentHash()));
        assertEquals(source(200), store.text(put.contentHash()).orElseThrow());
        assertEquals(200, store.blob(put.contentHash()).lineCount());
        assertTrue(store.manifest(put.contentHash()).size() > 1);
    }

    @Test
    void shouldNotDuplicateContentOnSecondPut() {
        byte[] bytes = source(100).getBytes(StandardCharsets.UTF_8);
        PutResult first = store.put(bytes, "java");
        int chunks = store.chunkCount();

        PutResult second = store.put(bytes, "java");

        assertFalse(second.created());
        assertEquals(first.contentHash(), second.contentHash());
        assertEquals(1, store.blobCount());
        assertEquals(chunks, store.chunkCount());
        for (ManifestEntry entry : store.manifest(first.contentHash())) {
            assertEquals(1L, store.chunkRefCount(entry.chunkHash()));
        }
    }

    @Test
    void shouldShareChunksAcrossBlobsAndReleaseThemOnDelete() {
        String shared = source(120);
        PutResult left = store.put((shared + "left tail\n").getBytes(StandardCharsets.UTF_8), "java");
        PutResult right = store.put((shared + "right tail\n").getBytes(StandardCharsets.UTF_8), "java");
        String firstChunk = store.manifest(left.contentHash()).get(0).chunkHash();
        assertEquals(firstChunk, store.manifest(right.contentHash()).get(0).chunkHash());
        assertEquals(2L, store.chunkRefCount(firstChunk));

        ContentStore.DeleteOutcome outcome = store.delete(left.contentHash());

        assertTrue(outcome.deleted());
        assertEquals(1L, store.chunkRefCount(firstChunk));
        assertTrue(store.refCountMismatches().isEmpty());
        assertEquals(shared + "right tail\n", store.text(right.contentHash()).orElseThrow());
        assertThrows(NotFoundException.class, () -> store.get(left.contentHash()));
    }

    @Test
    void shouldDropChunksWhenLastBlobIsDeleted() {
        PutResult put = store.put(source(50).getBytes(StandardCharsets.UTF_8), "java");

        store.delete(put.contentHash());

        assertEquals(0, store.blobCount());
        assertEquals(0, store.chunkCount());
        assertFalse(store.delete(put.contentHash()).deleted());
    }

    @Test
    void shouldStoreBinaryContentAsOneOpaqueChunk() {
        byte[] bytes = new byte[4096];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) (i % 7);
        }

        PutResult put = store.put(bytes, null);

        assertTrue(put.binary());
        assertEquals(1, store.manifest(put.contentHash()).size());
        assertTrue(store.text(put.contentHash()).isEmpty());
        assertArrayEquals(bytes, store.get(put.contentHash()));
    }

    @Test
    void shouldStoreEmptyContentWithoutChunks() {
        PutResult put = store.put(new byte[0], "text");

        assertTrue(store.manifest(put.contentHash()).isEmpty());
        assertEquals("", store.text(put.contentHash()).orElseThrow());
        assertEquals(0, store.chunkCount());
    }

    @Test
    void shouldReuseMostChunksAfterSmallEdit() {
        ContentStore locality = new ContentStore(new HashLocks(4), new ContentDefinedChunker(64, 256, 1024));
        String original = source(2000);
        String[] lines = original.split("\n", -1);
        StringBuilder edited = new StringBuilder();
        for (int i = 0; i < lines.length - 1; i++) {
            if (i == 1000) {
                edited.append("inserted line that shifts every later byte\n");
            }
            edited.append(lines[i]).append('\n');
        }

        PutResult before = locality.put(original.getBytes(StandardCharsets.UTF_8), "java");
        PutResult after = locality.put(edited.toString().getBytes(StandardCharsets.UTF_8), "java");

        Set<String> beforeChunks = chunkHashes(locality.manifest(before.contentHash()));
        Set<String> afterChunks = chunkHashes(locality.manifest(after.contentHash()));
        long reused = beforeChunks.stream().filter(afterChunks::contains).count();
        assertTrue(reused >= 0.7 * beforeChunks.size(), "reused " + reused + " of " + beforeChunks.size());
        assertEquals(edited.toString(), locality.text(after.contentHash()).orElseThrow());
    }

    @Test
    void shouldKeepChunksOnCharacterBoundaries() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 3000; i++) {
            text.append("é€");
        }
        byte[] bytes = text.toString().getBytes(StandardCharsets.UTF_8);

        PutResult put = store.put(bytes, "text");

        assertFalse(put.binary());
        assertTrue(store.manifest(put.contentHash()).size() > 1);
        assertEquals(text.toString(), store.text(put.contentHash()).orElseThrow());
    }

    @Test
    void shouldRestoreExportedRows() {
        PutResult put = store.put(source(80).getBytes(StandardCharsets.UTF_8), "java");
        ContentStore restored = new ContentStore(new HashLocks(4), new ContentDefinedChunker(64, 256, 1024));

        restored.restore(store.exportBlobs(), store.exportManifest(), store.exportChunks());

        assertEquals(source(80), restored.text(put.contentHash()).orElseThrow());
        assertTrue(restored.refCountMismatches().isEmpty());
    }

    private static Set<String> chunkHashes(List<ManifestEntry> manifest) {
        Set<String> hashes = new HashSet<>();
        for (ManifestEntry entry : manifest) {
            hashes.add(entry.chunkHash());
        }
        return hashes;
    }

    static String source(int lines) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < lines; i++) {
            text.append("int value").append(i).append(" = compute(").append((i * 7919) % 1009).append(", \"row ")
                    .append(i).append("\");\n");
        }
        return text.toString();
    }
}
