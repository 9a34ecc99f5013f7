package com.pointer.retention;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.store.NotFoundException;

public class RetentionStore {
    private static final Logger log = LoggerFactory.getLogger(RetentionStore.class);

    private final int defaultLatestKeepCount;
    private final LiveBranchRegistry liveBranches;
    private final Map<BranchKey, BranchPolicy> policies = new HashMap<>();
    private final Map<BranchKey, TreeMap<Long, SnapshotPolicy>> tiers = new HashMap<>();
    private final Map<BranchKey, Map<String, Snapshot>> snapshots = new HashMap<>();
    private final Map<BranchKey, BranchHead> heads = new HashMap<>();

    public RetentionStore(int defaultLatestKeepCount, LiveBranchRegistry liveBranches) {
        if (defaultLatestKeepCount < 1) {
            throw new IllegalArgumentException("defaultLatestKeepCount must be >= 1");
        }
        this.defaultLatestKeepCount = defaultLatestKeepCount;
        this.liveBranches = liveBranches;
    }

    public synchronized BranchPolicy setLatestKeepCount(String repository, String branch, int latestKeepCount) {
        BranchPolicy policy = new BranchPolicy(repository, branch, latestKeepCount);
        policies.put(new BranchKey(repository, branch), policy);
        log.info("retention.policy.set repo={} branch={} latestKeepCount={}", repository, branch, latestKeepCount);
        return policy;
    }

    public synchronized SnapshotPolicy addIntervalTier(String repository, String branch, long intervalSeconds, int keepCount) {
        BranchKey key = requirePolicy(repository, branch);
        SnapshotPolicy tier = new SnapshotPolicy(repository, branch, intervalSeconds, keepCount);
        tiers.computeIfAbsent(key, unused -> new TreeMap<>()).put(intervalSeconds, tier);
        log.info("retention.tier.set repo={} branch={} intervalSeconds={} keepCount={}", repository, branch, intervalSeconds, keepCount);
        return tier;
    }

    public synchronized boolean removeIntervalTier(String repository, String branch, long intervalSeconds) {
        BranchKey key = requirePolicy(repository, branch);
        TreeMap<Long, SnapshotPolicy> branchTiers = tiers.get(key);
        if (branchTiers == null || branchTiers.remove(intervalSeconds) == null) {
            return false;
        }
        if (branchTiers.isEmpty()) {
            tiers.remove(key);
        }
        return true;
    }

    /**
     * Deletes a branch policy with its interval tiers, snapshot history and live-branch pointer.
     * File rows and content are left for the retention sweep and garbage collector.
     */
    public synchronized PolicyDeletion deletePolicy(String repository, String branch) {
        BranchKey key = requirePolicy(repository, branch);
        policies.remove(key);
        TreeMap<Long, SnapshotPolicy> removedTiers = tiers.remove(key);
        Map<String, Snapshot> removedSnapshots = snapshots.remove(key);
        boolean liveCleared = liveBranches.clearIf(repository, branch);
        PolicyDeletion deletion = new PolicyDeletion(repository, branch,
                removedTiers == null ? 0 : removedTiers.size(),
                removedSnapshots == null ? 0 : removedSnapshots.size(),
                liveCleared);
        log.info("retention.policy.deleted repo={} branch={} tiers={} snapshots={} liveCleared={}",
                repository, branch, deletion.tiersRemoved(), deletion.snapshotsRemoved(), liveCleared);
        return deletion;
    }

    public synchronized RetentionPolicy policy(String repository, String branch) {
        BranchKey key = requirePolicy(repository, branch);
        return view(key);
    }

    public synchronized Optional<RetentionPolicy> findPolicy(String repository, String branch) {
        BranchKey key = new BranchKey(repository, branch);
        return policies.containsKey(key) ? Optional.of(view(key)) : Optional.empty();
    }

    public synchronized List<RetentionPolicy> policies() {
        return policies.keySet().stream().sorted(BranchKey.ORDER).map(this::view).toList();
    }

    public synchronized List<String> branches(String repository) {
        Set<String> branches = new LinkedHashSet<>();
        for (BranchKey key : allKeys()) {
            if (key.repository().equals(repository)) {
                branches.add(key.branch());
            }
        }
        return branches.stream().sorted().toList();
    }

    public synchronized boolean recordSnapshot(String repository, String branch, String commit, Instant indexedAt) {
        BranchKey key = new BranchKey(repository, branch);
        if (!policies.containsKey(key)) {
            policies.put(key, new BranchPolicy(repository, branch, defaultLatestKeepCount));
            log.info("retention.policy.default repo={} branch={} latestKeepCount={}", repository, branch, defaultLatestKeepCount);
        }
        BranchHead head = heads.get(key);
        if (head == null || !indexedAt.isBefore(head.indexedAt())) {
            heads.put(key, new BranchHead(repository, branch, commit, indexedAt));
        }
        Map<String, Snapshot> branchSnapshots = snapshots.computeIfAbsent(key, unused -> new HashMap<>());
        if (branchSnapshots.containsKey(commit)) {
            return false;
        }
        branchSnapshots.put(commit, new Snapshot(repository, branch, commit, indexedAt));
        return true;
    }

    public synchronized List<Snapshot> snapshots(String repository, String branch) {
        Map<String, Snapshot> branchSnapshots = snapshots.get(new BranchKey(repository, branch));
        if (branchSnapshots == null) {
            return List.of();
        }
        return branchSnapshots.values().stream().sorted(Snapshot.NEWEST_FIRST).toList();
    }

    public synchronized int removeSnapshots(String repository, String branch, Set<String> commits) {
        BranchKey key = new BranchKey(repository, branch);
        Map<String, Snapshot> branchSnapshots = snapshots.get(key);
        if (branchSnapshots == null) {
            return 0;
        }
        int removed = 0;
        for (String commit : commits) {
            if (branchSnapshots.remove(commit) != null) {
                removed++;
            }
        }
        if (branchSnapshots.isEmpty()) {
            snapshots.remove(key);
        }
        return removed;
    }

    public synchronized int removeCommit(String repository, String commit) {
        int removed = 0;
        for (Map.Entry<BranchKey, Map<String, Snapshot>> entry : List.copyOf(snapshots.entrySet())) {
            if (entry.getKey().repository().equals(repository) && entry.getValue().remove(commit) != null) {
                removed++;
                if (entry.getValue().isEmpty()) {
                    snapshots.remove(entry.getKey());
                }
            }
        }
        heads.values().removeIf(head -> head.repository().equals(repository) && head.commit().equals(commit));
        return removed;
    }

    public synchronized boolean isCommitProtected(String repository, String commit) {
        for (Map.Entry<BranchKey, Map<String, Snapshot>> entry : snapshots.entrySet()) {
            if (entry.getKey().repository().equals(repository) && entry.getValue().containsKey(commit)) {
                return true;
            }
        }
        return heads.values().stream().anyMatch(head -> head.repository().equals(repository) && head.commit().equals(commit));
    }

    public synchronized Optional<BranchHead> head(String repository, String branch) {
        return Optional.ofNullable(heads.get(new BranchKey(repository, branch)));
    }

    public synchronized boolean knowsBranch(String repository, String branch) {
        BranchKey key = new BranchKey(repository, branch);
        return policies.containsKey(key) || snapshots.containsKey(key) || heads.containsKey(key);
    }

    public synchronized boolean knowsRepository(String repository) {
        return allKeys().stream().anyMatch(key -> key.repository().equals(repository))
                || liveBranches.get(repository).isPresent();
    }

    public synchronized Set<String> removeBranch(String repository, String branch) {
        BranchKey key = new BranchKey(repository, branch);
        if (!knowsBranch(repository, branch)) {
            throw new NotFoundException("branch", repository + "/" + branch);
        }
        Set<String> commits = new LinkedHashSet<>();
        Map<String, Snapshot> removed = snapshots.remove(key);
        if (removed != null) {
            commits.addAll(removed.keySet());
        }
        BranchHead head = heads.remove(key);
        if (head != null) {
            commits.add(head.commit());
        }
        policies.remove(key);
        tiers.remove(key);
        liveBranches.clearIf(repository, branch);
        return commits;
    }

    public synchronized int removeRepository(String repository) {
        int removed = 0;
        for (BranchKey key : allKeys()) {
            if (key.repository().equals(repository)) {
                Map<String, Snapshot> branchSnapshots = snapshots.remove(key);
                removed += branchSnapshots == null ? 0 : branchSnapshots.size();
                policies.remove(key);
                tiers.remove(key);
                heads.remove(key);
            }
        }
        liveBranches.clear(repository);
        return removed;
    }

    public synchronized void setLiveBranch(String repository, String branch) {
        requirePolicy(repository, branch);
        liveBranches.set(repository, branch);
    }

    public synchronized boolean compareAndSetLiveBranch(String repository, String expected, String next) {
        if (next != null) {
            requirePolicy(repository, next);
        }
        return liveBranches.compareAndSet(repository, expected, next);
    }

    public Optional<String> liveBranch(String repository) {
        return liveBranches.get(repository);
    }

    public synchronized RetentionRows export() {
        List<BranchPolicy> policyRows = policies.values().stream()
                .sorted(Comparator.comparing(BranchPolicy::repository).thenComparing(BranchPolicy::branch))
                .toList();
        List<SnapshotPolicy> tierRows = tiers.values().stream()
                .flatMap(branchTiers -> branchTiers.values().stream())
                .sorted(Comparator.comparing(SnapshotPolicy::repository).thenComparing(SnapshotPolicy::branch)
                        .thenComparingLong(SnapshotPolicy::intervalSeconds))
                .toList();
        List<Snapshot> snapshotRows = snapshots.values().stream()
                .flatMap(branchSnapshots -> branchSnapshots.values().stream())
                .sorted(Comparator.comparing(Snapshot::repository).thenComparing(Snapshot::branch).thenComparing(Snapshot.NEWEST_FIRST))
                .toList();
        List<BranchHead> headRows = heads.values().stream()
                .sorted(Comparator.comparing(BranchHead::repository).thenComparing(BranchHead::branch))
                .toList();
        return new RetentionRows(policyRows, tierRows, snapshotRows, headRows, liveBranches.all());
    }

    public synchronized void restore(RetentionRows rows) {
        policies.clear();
        tiers.clear();
        snapshots.clear();
        heads.clear();
        for (BranchPolicy policy : rows.policies()) {
            policies.put(new BranchKey(policy.repository(), policy.branch()), policy);
        }
        for (SnapshotPolicy tier : rows.tiers()) {
            tiers.computeIfAbsent(new BranchKey(tier.repository(), tier.branch()), unused -> new TreeMap<>())
                    .put(tier.intervalSeconds(), tier);
        }
        for (Snapshot snapshot : rows.snapshots()) {
            snapshots.computeIfAbsent(new BranchKey(snapshot.repository(), snapshot.branch()), unused -> new HashMap<>())
                    .put(snapshot.commit(), snapshot);
        }
        for (BranchHead head : rows.heads()) {
            heads.put(new BranchKey(head.repository(), head.branch()), head);
        }
        liveBranches.restore(rows.liveBranches());
    }

    private BranchKey requirePolicy(String repository, String branch) {
        BranchKey key = new BranchKey(repository, branch);
        if (!policies.containsKey(key)) {
            throw new NotFoundException("policy", repository + "/" + branch);
        }
        return key;
    }

    private RetentionPolicy view(BranchKey key) {
        TreeMap<Long, SnapshotPolicy> branchTiers = tiers.get(key);
        return new RetentionPolicy(policies.get(key), branchTiers == null ? List.of() : List.copyOf(branchTiers.values()));
    }

    private List<BranchKey> allKeys() {
        Set<BranchKey> keys = new LinkedHashSet<>();
        keys.addAll(policies.keySet());
        keys.addAll(snapshots.keySet());
        keys.addAll(heads.keySet());
        List<BranchKey> sorted = new ArrayList<>(keys);
        sorted.sort(BranchKey.ORDER);
        return sorted;
    }

    public record RetentionRows(
            List<BranchPolicy> policies,
            List<SnapshotPolicy> tiers,
            List<Snapshot> snapshots,
            List<BranchHead> heads,
            Map<String, String> liveBranches) {

        public RetentionRows {
            policies = policies == null ? List.of() : policies;
            tiers = tiers == null ? List.of() : tiers;
            snapshots = snapshots == null ? List.of() : snapshots;
            heads = heads == null ? List.of() : heads;
            liveBranches = liveBranches == null ? Map.of() : liveBranches;
        }

        public static RetentionRows empty() {
            return new RetentionRows(List.of(), List.of(), List.of(), List.of(), Map.of());
        }
    }

    private record BranchKey(String repository, String branch) {
        static final Comparator<BranchKey> ORDER = Comparator.comparing(BranchKey::repository).thenComparing(BranchKey::branch);
    }
}
