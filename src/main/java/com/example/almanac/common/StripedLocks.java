package com.example.almanac.common;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed pool of locks shared by hash over an unbounded id space. Writers to the same id are
 * serialized; unrelated ids occasionally share a stripe. Memory stays constant, unlike
 * {@link KeyedLocks}, which suits rows that are never deleted.
 */
public class StripedLocks {

    private final ReentrantLock[] stripes;

    public StripedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(long id, Supplier<T> action) {
        ReentrantLock lock = stripeFor(id);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(long id, Runnable action) {
        withLock(id, () -> {
            action.run();
            return null;
        });
    }

    public int stripeCount() {
        return stripes.length;
    }

    ReentrantLock stripeFor(long id) {
        return stripes[Math.floorMod(Long.hashCode(id), stripes.length)];
    }
}
