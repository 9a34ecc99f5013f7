package com.pointer.retention;

public record PolicyDeletion(String repository, String branch, int tiersRemoved, int snapshotsRemoved, boolean liveBranchCleared) {
}
