package com.pointer.retention;

public record BranchPolicy(String repository, String branch, int latestKeepCount) {
    public BranchPolicy {
        if (latestKeepCount < 1) {
            throw new IllegalArgumentException("latestKeepCount must be >= 1");
        }
    }
}
