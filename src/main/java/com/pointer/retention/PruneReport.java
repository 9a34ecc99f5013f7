package com.pointer.retention;

public record PruneReport(String repository, int snapshotsRemoved, int commitsPruned, int filesRemoved, int batches) {
}
