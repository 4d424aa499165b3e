package com.portfolioradar.common;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion keyed by asset symbol. Two read-compute-write cycles on the same asset never interleave;
 * different assets proceed in parallel.
 */
public class AssetLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String assetSymbol, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key(assetSymbol), k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String assetSymbol, Runnable action) {
        withLock(assetSymbol, () -> {
            action.run();
            return null;
        });
    }

    int size() {
        return locks.size();
    }

    private static String key(String assetSymbol) {
        String key = Symbols.normalize(assetSymbol);
        if (key == null) {
            throw new IllegalArgumentException("assetSymbol must not be blank");
        }
        return key;
    }
}
