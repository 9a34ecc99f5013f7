package com.pointer.retention;

public record SnapshotPolicy(String repository, String branch, long intervalSeconds, int keepCount) {
    public SnapshotPolicy {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        if (keepCount <= 0) {
            throw new IllegalArgumentException("keepCount must be > 0");
        }
    }
}
