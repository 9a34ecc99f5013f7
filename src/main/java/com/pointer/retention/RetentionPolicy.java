package com.pointer.retention;

import java.util.List;

public record RetentionPolicy(BranchPolicy branchPolicy, List<SnapshotPolicy> tiers) {
    public String repository() {
        return branchPolicy.repository();
    }

    public String branch() {
        return branchPolicy.branch();
    }

    public int latestKeepCount() {
        return branchPolicy.latestKeepCount();
    }
}
