package com.pointer.retention;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class LiveBranchRegistry {
    private final ConcurrentHashMap<String, String> liveBranches = new ConcurrentHashMap<>();

    public Optional<String> get(String repository) {
        return Optional.ofNullable(liveBranches.get(repository));
    }

    public void set(String repository, String branch) {
        liveBranches.put(repository, Objects.requireNonNull(branch, "branch"));
    }

    /**
     * Moves the pointer from {@code expected} to {@code next}; either may be null for "no live
     * branch". Returns false, leaving the pointer untouched, when the current value is not
     * {@code expected}.
     */
    public boolean compareAndSet(String repository, String expected, String next) {
        if (expected == null) {
            return next == null ? !liveBranches.containsKey(repository) : liveBranches.putIfAbsent(repository, next) == null;
        }
        if (next == null) {
            return liveBranches.remove(repository, expected);
        }
        return liveBranches.replace(repository, expected, next);
    }

    public Optional<String> clear(String repository) {
        return Optional.ofNullable(liveBranches.remove(repository));
    }

    public boolean clearIf(String repository, String branch) {
        return liveBranches.remove(repository, branch);
    }

    public Map<String, String> all() {
        return new TreeMap<>(liveBranches);
    }

    public void restore(Map<String, String> rows) {
        liveBranches.clear();
        liveBranches.putAll(rows);
    }
}
