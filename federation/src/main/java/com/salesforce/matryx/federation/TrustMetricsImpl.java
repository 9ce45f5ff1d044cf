/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import static com.codahale.metrics.MetricRegistry.name;

/**
 * @author hal.hildebrand
 */
public class TrustMetricsImpl implements TrustMetrics {
    private final Meter backoffRefusals;
    private final Meter eventsSigned;
    private final Meter keyCacheHits;
    private final Timer keyFetch;
    private final Meter keyFetchFailures;
    private final Timer resolution;
    private final Meter resolutionFailures;
    private final Meter signatureFailures;
    private final Meter wellKnownCacheHits;

    public TrustMetricsImpl(String serverName, MetricRegistry registry) {
        resolution = registry.timer(name(serverName, "resolver.resolution.duration"));
        resolutionFailures = registry.meter(name(serverName, "resolver.resolution.failures"));
        backoffRefusals = registry.meter(name(serverName, "resolver.backoff.refusals"));
        wellKnownCacheHits = registry.meter(name(serverName, "resolver.wellknown.cache.hits"));
        keyCacheHits = registry.meter(name(serverName, "keys.cache.hits"));
        keyFetch = registry.timer(name(serverName, "keys.fetch.duration"));
        keyFetchFailures = registry.meter(name(serverName, "keys.fetch.failures"));
        signatureFailures = registry.meter(name(serverName, "signing.verification.failures"));
        eventsSigned = registry.meter(name(serverName, "signing.events.signed"));
    }

    @Override
    public Meter backoffRefusals() {
        return backoffRefusals;
    }

    @Override
    public Meter eventsSigned() {
        return eventsSigned;
    }

    @Override
    public Meter keyCacheHits() {
        return keyCacheHits;
    }

    @Override
    public Timer keyFetch() {
        return keyFetch;
    }

    @Override
    public Meter keyFetchFailures() {
        return keyFetchFailures;
    }

    @Override
    public Timer resolution() {
        return resolution;
    }

    @Override
    public Meter resolutionFailures() {
        return resolutionFailures;
    }

    @Override
    public Meter signatureFailures() {
        return signatureFailures;
    }

    @Override
    public Meter wellKnownCacheHits() {
        return wellKnownCacheHits;
    }
}
