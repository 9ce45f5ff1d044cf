/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key cache held in memory. Remote keys are evicted once their cache lifetime passes; local keys live as long as the
 * store.
 *
 * @author hal.hildebrand
 */
public class InMemoryKeyCacheStore implements KeyCacheStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyCacheStore.class);

    private final Map<String, Map<String, ServerSigningKey>> local = new ConcurrentHashMap<>();
    private final Cache<KeyRef, CachedServerKey>             remote;

    public InMemoryKeyCacheStore(Clock clock) {
        this(clock, 100_000);
    }

    public InMemoryKeyCacheStore(Clock clock, long maximumSize) {
        remote = Caffeine.newBuilder()
                         .maximumSize(maximumSize)
                         .expireAfter(new Expiry<KeyRef, CachedServerKey>() {
                             @Override
                             public long expireAfterCreate(KeyRef key, CachedServerKey value, long currentTime) {
                                 return remaining(clock, value);
                             }

                             @Override
                             public long expireAfterRead(KeyRef key, CachedServerKey value, long currentTime,
                                                         long currentDuration) {
                                 return currentDuration;
                             }

                             @Override
                             public long expireAfterUpdate(KeyRef key, CachedServerKey value, long currentTime,
                                                           long currentDuration) {
                                 return remaining(clock, value);
                             }
                         })
                         .removalListener((KeyRef ref, CachedServerKey key, RemovalCause cause) -> log.trace(
                         "Server key {} was removed ({})", ref, cause))
                         .build();
    }

    private static long remaining(Clock clock, CachedServerKey value) {
        var remaining = Duration.between(clock.instant(), value.expiresAt());
        return remaining.isNegative() ? 0 : remaining.toNanos();
    }

    @Override
    public Optional<CachedServerKey> get(String serverName, String keyId) {
        return Optional.ofNullable(remote.getIfPresent(new KeyRef(serverName, keyId)));
    }

    @Override
    public List<ServerSigningKey> localKeys(String serverName) {
        var keys = local.get(serverName);
        return keys == null ? List.of() : new ArrayList<>(keys.values());
    }

    @Override
    public void put(String serverName, String keyId, CachedServerKey key) {
        remote.put(new KeyRef(serverName, keyId), key);
    }

    @Override
    public void saveLocalKey(ServerSigningKey key) {
        local.computeIfAbsent(key.serverName(), s -> new ConcurrentHashMap<>()).put(key.keyId(), key);
    }

    private record KeyRef(String serverName, String keyId) {
    }
}
