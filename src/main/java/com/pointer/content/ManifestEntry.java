package com.pointer.content;

public record ManifestEntry(
        String contentHash,
        String chunkHash,
        int chunkIndex,
        long byteOffset,
        int byteLength,
        int lineCount) {
}
