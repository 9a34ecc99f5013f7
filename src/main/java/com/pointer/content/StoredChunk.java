package com.pointer.content;

public record StoredChunk(String hash, byte[] bytes, String text, long refCount) {
    public int byteLength() {
        return bytes.length;
    }

    public boolean hasText() {
        return text != null;
    }

    StoredChunk withRefCount(long next) {
        return new StoredChunk(hash, bytes, text, next);
    }
}
