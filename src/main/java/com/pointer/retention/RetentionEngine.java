package com.pointer.retention;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetentionEngine {
    private static final Logger log = LoggerFactory.getLogger(RetentionEngine.class);

    private final RetentionStore retentionStore;
    private final KeepSetCalculator keepSetCalculator;
    private final CommitPruner commitPruner;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public RetentionEngine(RetentionStore retentionStore, KeepSetCalculator keepSetCalculator, CommitPruner commitPruner) {
        this.retentionStore = retentionStore;
        this.keepSetCalculator = keepSetCalculator;
        this.commitPruner = commitPruner;
    }

    public RetentionReport runOnce() {
        stopRequested.set(false);
        List<RetentionPolicy> policies = retentionStore.policies();
        int evaluated = 0;
        int snapshotsRemoved = 0;
        int commitsPruned = 0;
        int filesRemoved = 0;
        int failures = 0;
        boolean stopped = false;
        for (RetentionPolicy policy : policies) {
            if (stopRequested.get()) {
                stopped = true;
                log.info("retention.stop reason=requested evaluated={} branches={}", evaluated, policies.size());
                break;
            }
            try {
                BranchOutcome outcome = evaluate(policy);
                evaluated++;
                snapshotsRemoved += outcome.snapshotsRemoved();
                commitsPruned += outcome.commitsPruned();
                filesRemoved += outcome.filesRemoved();
            } catch (RuntimeException e) {
                failures++;
                log.warn("retention.branch.failed repo={} branch={} reason={}", policy.repository(), policy.branch(), e.getMessage(), e);
            }
        }
        RetentionReport report = new RetentionReport(evaluated, snapshotsRemoved, commitsPruned, filesRemoved, failures, stopped);
        log.info("retention.sweep.completed branches={} snapshots={} commits={} files={} failures={}",
                report.branchesEvaluated(), report.snapshotsRemoved(), report.commitsPruned(), report.filesRemoved(), report.failures());
        return report;
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    BranchOutcome evaluate(RetentionPolicy policy) {
        List<Snapshot> snapshots = retentionStore.snapshots(policy.repository(), policy.branch());
        Set<String> keep = keepSetCalculator.keepSet(snapshots, policy);
        Set<String> drop = new LinkedHashSet<>();
        for (Snapshot snapshot : snapshots) {
            if (!keep.contains(snapshot.commit())) {
                drop.add(snapshot.commit());
            }
        }
        if (drop.isEmpty()) {
            return new BranchOutcome(0, 0, 0);
        }
        int removed = retentionStore.removeSnapshots(policy.repository(), policy.branch(), drop);
        int pruned = 0;
        int files = 0;
        for (String commit : drop) {
            int count = commitPruner.pruneIfUnprotected(policy.repository(), commit);
            if (count >= 0) {
                pruned++;
                files += count;
            }
        }
        log.info("retention.branch repo={} branch={} kept={} snapshotsRemoved={} commitsPruned={} files={}",
                policy.repository(), policy.branch(), keep.size(), removed, pruned, files);
        return new BranchOutcome(removed, pruned, files);
    }

    record BranchOutcome(int snapshotsRemoved, int commitsPruned, int filesRemoved) {
    }
}
