package com.pointer.retention;

public record RetentionReport(
        int branchesEvaluated,
        int snapshotsRemoved,
        int commitsPruned,
        int filesRemoved,
        int failures,
        boolean stopped) {
}
