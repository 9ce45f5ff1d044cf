/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exponential backoff per server. After n consecutive failures the server may not be retried for base * 2^min(n, 10);
 * a success forgets the server entirely.
 *
 * @author hal.hildebrand
 */
public class BackoffTracker {
    public static final int MAX_EXPONENT = 10;

    private static final Logger log = LoggerFactory.getLogger(BackoffTracker.class);

    private final Duration                  baseDelay;
    private final Clock                     clock;
    private final ReadWriteLock             lock   = new ReentrantReadWriteLock(true);
    private final Map<String, BackoffState> states = new HashMap<>();

    public BackoffTracker(Duration baseDelay, Clock clock) {
        this.baseDelay = baseDelay;
        this.clock = clock;
    }

    public static Duration delay(Duration base, int failureCount) {
        return base.multipliedBy(1L << Math.min(failureCount, MAX_EXPONENT));
    }

    /**
     * @return the instant the server may next be tried, if that is still in the future
     */
    public Optional<Instant> blockedUntil(String server) {
        var now = clock.instant();
        final var l = lock.readLock();
        l.lock();
        try {
            var state = states.get(server);
            return state == null || !state.nextRetryAt().isAfter(now) ? Optional.empty()
                                                                       : Optional.of(state.nextRetryAt());
        } finally {
            l.unlock();
        }
    }

    public Optional<BackoffState> get(String server) {
        final var l = lock.readLock();
        l.lock();
        try {
            return Optional.ofNullable(states.get(server));
        } finally {
            l.unlock();
        }
    }

    /**
     * Drop the state of servers whose backoff lapsed more than the idle duration ago
     *
     * @return the number of servers forgotten
     */
    public int prune(Duration idle) {
        var horizon = clock.instant().minus(idle);
        final var l = lock.writeLock();
        l.lock();
        try {
            var before = states.size();
            states.values().removeIf(s -> s.nextRetryAt().isBefore(horizon));
            return before - states.size();
        } finally {
            l.unlock();
        }
    }

    /**
     * @return the new state of the server
     */
    public BackoffState recordFailure(String server) {
        var now = clock.instant();
        final var l = lock.writeLock();
        l.lock();
        try {
            var previous = states.get(server);
            var count = previous == null ? 1 : previous.failureCount() + 1;
            var state = new BackoffState(count, now.plus(delay(baseDelay, count)), baseDelay);
            states.put(server, state);
            log.debug("Backing off: {} failures: {} until: {}", server, count, state.nextRetryAt());
            return state;
        } finally {
            l.unlock();
        }
    }

    public void reset(String server) {
        final var l = lock.writeLock();
        l.lock();
        try {
            states.remove(server);
        } finally {
            l.unlock();
        }
    }

    public record BackoffState(int failureCount, Instant nextRetryAt, Duration baseDelay) {
    }
}
