package com.pointer.retention;

import java.time.Instant;

public record BranchHead(String repository, String branch, String commit, Instant indexedAt) {
}
