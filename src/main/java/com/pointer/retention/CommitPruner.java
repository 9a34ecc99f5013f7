package com.pointer.retention;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pointer.ingest.FileTable;
import com.pointer.store.NotFoundException;

public class CommitPruner {
    private static final Logger log = LoggerFactory.getLogger(CommitPruner.class);

    private final RetentionStore retentionStore;
    private final FileTable fileTable;

    public CommitPruner(RetentionStore retentionStore, FileTable fileTable) {
        this.retentionStore = retentionStore;
        this.fileTable = fileTable;
    }

    public int pruneIfUnprotected(String repository, String commit) {
        if (retentionStore.isCommitProtected(repository, commit)) {
            log.debug("retention.commit.protected repo={} commit={}", repository, commit);
            return -1;
        }
        return fileTable.removeCommit(repository, commit);
    }

    public PruneReport pruneCommit(String repository, String commit) {
        if (!fileTable.hasCommit(repository, commit) && !retentionStore.isCommitProtected(repository, commit)) {
            throw new NotFoundException("commit", repository + "@" + commit);
        }
        int snapshots = retentionStore.removeCommit(repository, commit);
        int files = fileTable.removeCommit(repository, commit);
        log.info("prune.commit repo={} commit={} snapshots={} files={}", repository, commit, snapshots, files);
        return new PruneReport(repository, snapshots, 1, files, 1);
    }

    public PruneReport pruneBranch(String repository, String branch) {
        int snapshots = retentionStore.snapshots(repository, branch).size();
        Set<String> commits = retentionStore.removeBranch(repository, branch);
        int pruned = 0;
        int files = 0;
        for (String commit : commits) {
            int removed = pruneIfUnprotected(repository, commit);
            if (removed >= 0) {
                pruned++;
                files += removed;
            }
        }
        log.info("prune.branch repo={} branch={} snapshots={} commits={} files={}", repository, branch, snapshots, pruned, files);
        return new PruneReport(repository, snapshots, pruned, files, 1);
    }

    public PruneReport pruneRepository(String repository, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (!fileTable.hasRepository(repository) && !retentionStore.knowsRepository(repository)) {
            throw new NotFoundException("repository", repository);
        }
        int snapshots = retentionStore.removeRepository(repository);
        int files = 0;
        int batches = 0;
        int removed;
        while ((removed = fileTable.removeRepositoryBatch(repository, batchSize)) > 0) {
            files += removed;
            batches++;
            log.debug("prune.repository.batch repo={} batch={} removed={}", repository, batches, removed);
        }
        log.info("prune.repository repo={} snapshots={} files={} batches={}", repository, snapshots, files, batches);
        return new PruneReport(repository, snapshots, 0, files, batches);
    }
}
