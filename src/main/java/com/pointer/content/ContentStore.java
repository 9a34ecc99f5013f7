package com.pointer.content;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.store.HashLocks;
import com.pointer.store.NotFoundException;

public class ContentStore {
    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);

    private final HashLocks locks;
    private final ContentDefinedChunker chunker;
    private final Map<String, ContentBlob> blobs = new ConcurrentHashMap<>();
    private final Map<String, List<ManifestEntry>> manifests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, StoredChunk> chunks = new ConcurrentHashMap<>();

    public ContentStore(HashLocks locks, ContentDefinedChunker chunker) {
        this.locks = locks;
        this.chunker = chunker;
    }

    public PutResult put(byte[] bytes, String language) {
        return put(ContentHasher.sha256(bytes), bytes, language);
    }

    public PutResult put(String hash, byte[] bytes, String language) {
        return locks.withLock(hash, () -> {
            ContentBlob existing = blobs.get(hash);
            if (existing != null) {
                return new PutResult(hash, false, existing.binary());
            }
            ContentClassifier.Classification classification = ContentClassifier.classify(bytes);
            List<ManifestEntry> entries = classification.binary()
                    ? storeOpaque(hash, bytes)
                    : storeChunked(hash, bytes);
            manifests.put(hash, List.copyOf(entries));
            blobs.put(hash, new ContentBlob(hash, language, classification.binary(), bytes.length, classification.lineCount()));
            log.debug("content.put hash={} bytes={} chunks={} binary={}", hash, bytes.length, entries.size(), classification.binary());
            return new PutResult(hash, true, classification.binary());
        });
    }

    public byte[] get(String hash) {
        ContentBlob blob = blob(hash);
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(Integer.MAX_VALUE, blob.byteLength()));
        for (ManifestEntry entry : manifest(hash)) {
            out.writeBytes(chunkFor(hash, entry).bytes());
        }
        return out.toByteArray();
    }

    public Optional<String> text(String hash) {
        ContentBlob blob = blob(hash);
        if (blob.binary()) {
            return Optional.empty();
        }
        StringBuilder text = new StringBuilder();
        for (ManifestEntry entry : manifest(hash)) {
            text.append(chunkFor(hash, entry).text());
        }
        return Optional.of(text.toString());
    }

    public ContentBlob blob(String hash) {
        ContentBlob blob = blobs.get(hash);
        if (blob == null) {
            throw new NotFoundException("content", hash);
        }
        return blob;
    }

    public Optional<ContentBlob> findBlob(String hash) {
        return Optional.ofNullable(blobs.get(hash));
    }

    public boolean contains(String hash) {
        return blobs.containsKey(hash);
    }

    public List<ManifestEntry> manifest(String hash) {
        List<ManifestEntry> entries = manifests.get(hash);
        if (entries == null) {
            throw new NotFoundException("content", hash);
        }
        return entries;
    }

    public long chunkRefCount(String chunkHash) {
        StoredChunk chunk = chunks.get(chunkHash);
        return chunk == null ? 0L : chunk.refCount();
    }

    public Collection<String> blobHashes() {
        return List.copyOf(blobs.keySet());
    }

    public int blobCount() {
        return blobs.size();
    }

    public int chunkCount() {
        return chunks.size();
    }

    /**
     * Removes a blob and releases its manifest. Only the garbage collector calls this, after it has
     * established under the hash lock that nothing references the blob.
     */
    public DeleteOutcome delete(String hash) {
        return locks.withLock(hash, () -> {
            List<ManifestEntry> entries = manifests.remove(hash);
            if (entries == null) {
                blobs.remove(hash);
                return new DeleteOutcome(hash, false, 0, 0);
            }
            int released = 0;
            int deleted = 0;
            for (ManifestEntry entry : entries) {
                released++;
                if (decrement(entry.chunkHash())) {
                    deleted++;
                }
            }
            blobs.remove(hash);
            log.debug("content.delete hash={} chunksReleased={} chunksDeleted={}", hash, released, deleted);
            return new DeleteOutcome(hash, true, released, deleted);
        });
    }

    public int deleteUnreferencedChunks() {
        int removed = 0;
        for (String chunkHash : List.copyOf(chunks.keySet())) {
            AtomicBoolean dropped = new AtomicBoolean();
            chunks.computeIfPresent(chunkHash, (key, chunk) -> {
                if (chunk.refCount() > 0) {
                    return chunk;
                }
                dropped.set(true);
                return null;
            });
            if (dropped.get()) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("content.chunks.swept removed={}", removed);
        }
        return removed;
    }

    public List<RefCountMismatch> refCountMismatches() {
        Map<String, Long> expected = new HashMap<>();
        for (List<ManifestEntry> entries : manifests.values()) {
            for (ManifestEntry entry : entries) {
                expected.merge(entry.chunkHash(), 1L, Long::sum);
            }
        }
        List<RefCountMismatch> mismatches = new ArrayList<>();
        for (StoredChunk chunk : chunks.values()) {
            long want = expected.getOrDefault(chunk.hash(), 0L);
            if (chunk.refCount() != want) {
                mismatches.add(new RefCountMismatch(chunk.hash(), chunk.refCount(), want));
            }
        }
        for (Map.Entry<String, Long> entry : expected.entrySet()) {
            if (!chunks.containsKey(entry.getKey())) {
                mismatches.add(new RefCountMismatch(entry.getKey(), 0L, entry.getValue()));
            }
        }
        return mismatches;
    }

    public List<ContentBlob> exportBlobs() {
        return blobs.values().stream().sorted(Comparator.comparing(ContentBlob::hash)).toList();
    }

    public List<ManifestEntry> exportManifest() {
        return manifests.values().stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparing(ManifestEntry::contentHash).thenComparingInt(ManifestEntry::chunkIndex))
                .toList();
    }

    public List<StoredChunk> exportChunks() {
        return chunks.values().stream().sorted(Comparator.comparing(StoredChunk::hash)).toList();
    }

    public void restore(List<ContentBlob> blobRows, List<ManifestEntry> manifestRows, List<StoredChunk> chunkRows) {
        blobs.clear();
        manifests.clear();
        chunks.clear();
        for (StoredChunk chunk : chunkRows) {
            chunks.put(chunk.hash(), chunk);
        }
        Map<String, List<ManifestEntry>> grouped = new HashMap<>();
        for (ManifestEntry entry : manifestRows) {
            grouped.computeIfAbsent(entry.contentHash(), unused -> new ArrayList<>()).add(entry);
        }
        grouped.forEach((hash, entries) -> {
            entries.sort(Comparator.comparingInt(ManifestEntry::chunkIndex));
            manifests.put(hash, List.copyOf(entries));
        });
        for (ContentBlob blob : blobRows) {
            manifests.putIfAbsent(blob.hash(), List.of());
            blobs.put(blob.hash(), blob);
        }
    }

    private List<ManifestEntry> storeOpaque(String hash, byte[] bytes) {
        if (bytes.length == 0) {
            return List.of();
        }
        String chunkHash = ContentHasher.sha256(bytes);
        increment(chunkHash, bytes, null);
        return List.of(new ManifestEntry(hash, chunkHash, 0, 0L, bytes.length, ContentClassifier.lineCount(bytes, 0, bytes.length)));
    }

    private List<ManifestEntry> storeChunked(String hash, byte[] bytes) {
        List<ManifestEntry> entries = new ArrayList<>();
        int index = 0;
        for (ContentDefinedChunker.ChunkRange range : chunker.ranges(bytes)) {
            byte[] slice = Arrays.copyOfRange(bytes, range.start(), range.end());
            String chunkHash = ContentHasher.sha256(slice);
            String text = ContentClassifier.decodeStrict(slice, 0, slice.length);
            increment(chunkHash, slice, text);
            entries.add(new ManifestEntry(hash, chunkHash, index++, range.start(), slice.length,
                    ContentClassifier.lineCount(slice, 0, slice.length)));
        }
        return entries;
    }

    private void increment(String chunkHash, byte[] bytes, String text) {
        chunks.compute(chunkHash, (key, chunk) -> chunk == null
                ? new StoredChunk(key, bytes, text, 1L)
                : chunk.withRefCount(chunk.refCount() + 1));
    }

    private boolean decrement(String chunkHash) {
        AtomicBoolean deleted = new AtomicBoolean();
        StoredChunk before = chunks.computeIfPresent(chunkHash, (key, chunk) -> {
            long next = chunk.refCount() - 1;
            if (next < 0) {
                log.error("content.refcount.negative chunk={} refCount={}", key, chunk.refCount());
                next = 0;
            }
            if (next == 0) {
                deleted.set(true);
                return null;
            }
            return chunk.withRefCount(next);
        });
        if (before == null && !deleted.get()) {
            log.error("content.chunk.missing chunk={}", chunkHash);
        }
        return deleted.get();
    }

    private StoredChunk chunkFor(String hash, ManifestEntry entry) {
        StoredChunk chunk = chunks.get(entry.chunkHash());
        if (chunk == null) {
            if (!blobs.containsKey(hash)) {
                throw new NotFoundException("content", hash);
            }
            throw new IllegalStateException("chunk " + entry.chunkHash() + " missing for content " + hash);
        }
        return chunk;
    }

    public record DeleteOutcome(String contentHash, boolean deleted, int chunksReleased, int chunksDeleted) {
    }

    public record RefCountMismatch(String chunkHash, long stored, long expected) {
    }
}
