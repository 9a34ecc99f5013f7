package com.pointer.ingest;

public record FileRecord(String repository, String commit, String path, String contentHash) {
    public FileKey key() {
        return new FileKey(repository, commit, path);
    }
}
