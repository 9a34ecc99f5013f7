package com.pointer.store;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

public class HashLocks {
    // Blob, manifest, file row and symbol writes for one content hash happen under its stripe.
    private final ReentrantLock[] stripes;

    public HashLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be > 0");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String contentHash, Supplier<T> action) {
        ReentrantLock lock = stripeFor(contentHash);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(String contentHash, Runnable action) {
        withLock(contentHash, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String contentHash) {
        return stripeFor(contentHash).isHeldByCurrentThread();
    }

    public int stripeCount() {
        return stripes.length;
    }

    private ReentrantLock stripeFor(String contentHash) {
        return stripes[Math.floorMod(contentHash.hashCode(), stripes.length)];
    }
}
