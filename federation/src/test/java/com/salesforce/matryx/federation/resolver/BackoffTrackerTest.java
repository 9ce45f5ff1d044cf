/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import com.salesforce.matryx.federation.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BackoffTrackerTest {

    @Test
    public void delays() {
        var base = Duration.ofSeconds(1);
        assertEquals(Duration.ofSeconds(2), BackoffTracker.delay(base, 1));
        assertEquals(Duration.ofSeconds(8), BackoffTracker.delay(base, 3));
        assertEquals(Duration.ofSeconds(1024), BackoffTracker.delay(base, 10));
        assertEquals(Duration.ofSeconds(1024), BackoffTracker.delay(base, 40));
    }

    @Test
    public void failuresAndReset() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var tracker = new BackoffTracker(Duration.ofSeconds(1), clock);

        assertTrue(tracker.blockedUntil("example.org").isEmpty());
        tracker.recordFailure("example.org");
        tracker.recordFailure("example.org");
        var state = tracker.recordFailure("example.org");
        assertEquals(3, state.failureCount());
        assertEquals(clock.instant().plusSeconds(8), state.nextRetryAt());
        assertEquals(state.nextRetryAt(), tracker.blockedUntil("example.org").get());

        clock.advance(Duration.ofSeconds(8));
        assertTrue(tracker.blockedUntil("example.org").isEmpty());
        assertEquals(3, tracker.get("example.org").get().failureCount());

        tracker.reset("example.org");
        assertTrue(tracker.get("example.org").isEmpty());
        assertEquals(clock.instant().plusSeconds(2), tracker.recordFailure("example.org").nextRetryAt());
    }

    @Test
    public void prune() {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var tracker = new BackoffTracker(Duration.ofSeconds(1), clock);
        tracker.recordFailure("a.example.org");
        clock.advance(Duration.ofHours(12));
        tracker.recordFailure("b.example.org");
        clock.advance(Duration.ofHours(13));

        assertEquals(1, tracker.prune(Duration.ofHours(24)));
        assertTrue(tracker.get("a.example.org").isEmpty());
        assertTrue(tracker.get("b.example.org").isPresent());
    }
}
