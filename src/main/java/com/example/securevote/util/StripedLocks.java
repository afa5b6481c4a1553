package com.example.securevote.util;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of locks indexed by key hash. Serializes work on the same token within this
 * process; the conditional updates in the database remain the cross-process guard.
 */
public final class StripedLocks {

    private final ReentrantLock[] stripes;

    public StripedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }

    public int size() {
        return stripes.length;
    }
}
