package com.pointer.retention;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes which snapshots of one branch a retention policy keeps.
 *
 * <p>The keep set is the union of the {@code latestKeepCount} newest snapshots and, per interval
 * tier, the newest snapshot of each populated bucket among the tier's {@code keepCount} most recent
 * buckets. Buckets are {@code intervalSeconds} wide and counted back from now, so a tier never
 * reaches further back than {@code keepCount * intervalSeconds}.
 */
public class KeepSetCalculator {
    private final Clock clock;

    public KeepSetCalculator(Clock clock) {
        this.clock = clock;
    }

    public Set<String> keepSet(List<Snapshot> snapshots, RetentionPolicy policy) {
        List<Snapshot> ordered = new ArrayList<>(snapshots);
        ordered.sort(Snapshot.NEWEST_FIRST);
        Set<String> keep = new LinkedHashSet<>();
        for (int i = 0; i < Math.min(policy.latestKeepCount(), ordered.size()); i++) {
            keep.add(ordered.get(i).commit());
        }
        Instant now = clock.instant();
        for (SnapshotPolicy tier : policy.tiers()) {
            keep.addAll(bucketRepresentatives(ordered, tier, now));
        }
        return keep;
    }

    private static List<String> bucketRepresentatives(List<Snapshot> newestFirst, SnapshotPolicy tier, Instant now) {
        List<String> kept = new ArrayList<>();
        Set<Long> buckets = new HashSet<>();
        for (Snapshot snapshot : newestFirst) {
            long bucket = bucketOf(snapshot.indexedAt(), now, tier.intervalSeconds());
            if (bucket >= tier.keepCount()) {
                continue;
            }
            if (buckets.add(bucket)) {
                kept.add(snapshot.commit());
                if (buckets.size() >= tier.keepCount()) {
                    break;
                }
            }
        }
        return kept;
    }

    static long bucketOf(Instant indexedAt, Instant now, long intervalSeconds) {
        long age = Duration.between(indexedAt, now).getSeconds();
        return age <= 0 ? 0 : age / intervalSeconds;
    }
}
