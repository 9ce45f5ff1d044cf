/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * A map of entries that lapse after their time to live. Reads share the lock, population and pruning take it
 * exclusively. Expired entries are invisible to readers but stay in the map until {@link #pruneExpired()}.
 *
 * @author hal.hildebrand
 */
public class ExpiringCache<K, V> {
    private final Map<K, CacheEntry<V>> entries = new HashMap<>();
    private final Clock                 clock;
    private final ReadWriteLock         lock    = new ReentrantReadWriteLock(true);

    public ExpiringCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<V> get(K key) {
        var now = clock.instant();
        return read(() -> {
            var entry = entries.get(key);
            return entry == null || entry.isExpired(now) ? Optional.<V>empty() : Optional.of(entry.value());
        });
    }

    /**
     * @return the number of entries dropped
     */
    public int pruneExpired() {
        var now = clock.instant();
        return write(() -> {
            var before = entries.size();
            entries.values().removeIf(e -> e.isExpired(now));
            return before - entries.size();
        });
    }

    public void put(K key, V value, Duration ttl) {
        var entry = new CacheEntry<>(value, clock.instant().plus(ttl));
        write(() -> entries.put(key, entry));
    }

    public void remove(K key) {
        write(() -> entries.remove(key));
    }

    /**
     * @return the number of entries held, expired or not
     */
    public int size() {
        return read(() -> entries.size());
    }

    private <T> T read(Supplier<T> supplier) {
        final var l = lock.readLock();
        l.lock();
        try {
            return supplier.get();
        } finally {
            l.unlock();
        }
    }

    private <T> T write(Supplier<T> supplier) {
        final var l = lock.writeLock();
        l.lock();
        try {
            return supplier.get();
        } finally {
            l.unlock();
        }
    }
}
