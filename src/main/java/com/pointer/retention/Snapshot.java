package com.pointer.retention;

import java.time.Instant;
import java.util.Comparator;

public record Snapshot(String repository, String branch, String commit, Instant indexedAt) {
    public static final Comparator<Snapshot> NEWEST_FIRST = Comparator.comparing(Snapshot::indexedAt).reversed()
            .thenComparing(Snapshot::commit);
}
