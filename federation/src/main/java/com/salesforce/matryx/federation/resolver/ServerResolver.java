/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import com.google.common.net.InetAddresses;
import com.salesforce.matryx.federation.TrustMetrics;
import com.salesforce.matryx.federation.resolver.BackoffTracker.BackoffState;
import com.salesforce.matryx.federation.resolver.ResolutionException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.function.Supplier;

import static com.salesforce.matryx.federation.resolver.ResolutionMethod.*;

/**
 * Resolves a server name to the endpoint federation traffic for it is sent to. The steps are tried in order, the
 * first to succeed wins:
 * <ol>
 * <li>an IP literal is used as is, on port 8448 unless one is given</li>
 * <li>a hostname with an explicit port is looked up directly</li>
 * <li>the host's <code>/.well-known/matrix/server</code> delegation, itself resolved by the remaining steps. Should the
 * delegated name fail to resolve, the host itself carries on with the SRV step</li>
 * <li>the <code>_matrix-fed._tcp</code> SRV records, then the legacy <code>_matrix._tcp</code> records</li>
 * <li>the hostname on port 8448</li>
 * </ol>
 * Every DNS and HTTP step is bounded by the timeout; a step that times out simply fails and resolution moves on, save
 * for the final fallback. A failed resolution backs the server off exponentially and is remembered for the error time
 * to live; while either applies, resolving the server fails without any network traffic.
 * <p>
 * Concurrent resolutions of the same name are not coalesced; both run and the last to finish populates the caches.
 *
 * @author hal.hildebrand
 */
public class ServerResolver {
    public static final String LEGACY_SRV_PREFIX = "_matrix._tcp.";
    public static final String SRV_PREFIX        = "_matrix-fed._tcp.";

    private static final Logger log = LoggerFactory.getLogger(ServerResolver.class);

    private final BackoffTracker                             backoff;
    private final Duration                                   backoffPrune;
    private final DnsClient                                  dns;
    private final ExpiringCache<String, ResolutionException> errors;
    private final Duration                                   errorTtl;
    private final TrustMetrics                               metrics;
    private final Duration                                   timeout;
    private final WellKnownClient                            wellKnown;
    private final ExpiringCache<String, Optional<String>>    wellKnownCache;
    private final Duration                                   wellKnownTtl;

    public ServerResolver(DnsClient dns, WellKnownClient wellKnown, Clock clock, Duration timeout,
                          Duration wellKnownTtl, Duration errorTtl, Duration backoffBase, Duration backoffPrune,
                          TrustMetrics metrics) {
        this.dns = Objects.requireNonNull(dns);
        this.wellKnown = Objects.requireNonNull(wellKnown);
        this.timeout = timeout;
        this.wellKnownTtl = wellKnownTtl;
        this.errorTtl = errorTtl;
        this.backoffPrune = backoffPrune;
        this.metrics = metrics;
        this.backoff = new BackoffTracker(backoffBase, clock);
        this.errors = new ExpiringCache<>(clock);
        this.wellKnownCache = new ExpiringCache<>(clock);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * @return the step's future, or a failed future if starting the step threw
     */
    private static <T> CompletableFuture<T> guarded(Supplier<CompletableFuture<T>> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    public Optional<BackoffState> backoffState(String serverName) {
        return backoff.get(serverName);
    }

    /**
     * Drop expired well-known and error entries, and the backoff state of servers idle past the prune horizon
     */
    public void cleanup() {
        var wellKnowns = wellKnownCache.pruneExpired();
        var failures = errors.pruneExpired();
        var backoffs = backoff.prune(backoffPrune);
        log.debug("Resolver cleanup dropped well-known: {} errors: {} backoffs: {}", wellKnowns, failures, backoffs);
    }

    /**
     * Resolve the server name.
     *
     * @return the endpoint, or a future failed with a {@link ResolutionException}
     */
    public CompletableFuture<ResolvedServer> resolve(String serverName) {
        final ServerName name;
        try {
            name = ServerName.parse(serverName);
        } catch (ResolutionException e) {
            return CompletableFuture.failedFuture(e);
        }

        var blocked = backoff.blockedUntil(serverName);
        if (blocked.isPresent()) {
            if (metrics != null) {
                metrics.backoffRefusals().mark();
            }
            log.debug("Refusing to resolve: {} backing off until: {}", serverName, blocked.get());
            return CompletableFuture.failedFuture(
            new ResolutionException(Reason.BACKOFF, serverName, "Backing off until: " + blocked.get()));
        }
        var cached = errors.get(serverName);
        if (cached.isPresent()) {
            log.debug("Cached resolution failure for: {}", serverName);
            return CompletableFuture.failedFuture(cached.get());
        }

        var timer = metrics == null ? null : metrics.resolution().time();
        return guarded(() -> discover(name)).<CompletableFuture<ResolvedServer>>handle((resolved, t) -> {
            if (timer != null) {
                timer.stop();
            }
            if (t == null) {
                backoff.reset(serverName);
                log.info("Resolved: {} to: {}", serverName, resolved);
                return CompletableFuture.completedFuture(resolved);
            }
            var error = asResolutionException(serverName, t);
            var state = backoff.recordFailure(serverName);
            errors.put(serverName, error, errorTtl);
            if (metrics != null) {
                metrics.resolutionFailures().mark();
            }
            log.warn("Unable to resolve: {} reason: {} retry after: {}", serverName, error.getReason(),
                     state.nextRetryAt());
            return CompletableFuture.failedFuture(error);
        }).thenCompose(f -> f);
    }

    /**
     * Run {@link #cleanup()} periodically
     */
    public ScheduledFuture<?> scheduleCleanup(ScheduledExecutorService scheduler, Duration interval) {
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                cleanup();
            } catch (Throwable t) {
                log.error("Error during resolver cleanup", t);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private CompletableFuture<InetAddress> address(String hostname) {
        return timed(() -> dns.lookup(hostname)).handle((addresses, t) -> {
            if (t != null) {
                throw new CompletionException(failure(hostname, t));
            }
            if (addresses == null || addresses.isEmpty()) {
                throw new CompletionException(new ResolutionException(Reason.DNS, hostname, "No address"));
            }
            return addresses.get(0);
        });
    }

    private ResolutionException asResolutionException(String serverName, Throwable t) {
        var cause = unwrap(t);
        if (cause instanceof ResolutionException re) {
            return re;
        }
        if (cause instanceof TimeoutException) {
            return new ResolutionException(Reason.TIMEOUT, serverName, "Timed out", cause);
        }
        return new ResolutionException(Reason.NO_SERVER_FOUND, serverName, "Unable to resolve", cause);
    }

    private CompletableFuture<ResolvedServer> delegate(ServerName name, String delegatedName) {
        final ServerName delegated;
        try {
            delegated = ServerName.parse(delegatedName);
        } catch (ResolutionException e) {
            return CompletableFuture.failedFuture(
            new ResolutionException(Reason.WELL_KNOWN, name.original(), "Invalid delegation: " + delegatedName, e));
        }
        log.debug("Server: {} delegated to: {}", name, delegated);

        var ip = delegated.ipLiteral();
        if (ip.isPresent()) {
            return CompletableFuture.completedFuture(
            new ResolvedServer(ip.get(), delegated.portOrDefault(),
                               InetAddresses.toUriString(ip.get()) + ":" + delegated.portOrDefault(),
                               delegated.hostname(), WELL_KNOWN_DELEGATION));
        }
        if (delegated.port().isPresent()) {
            var port = delegated.port().getAsInt();
            return address(delegated.hostname()).thenApply(
            address -> new ResolvedServer(address, port, delegated.original(), delegated.hostname(),
                                          WELL_KNOWN_DELEGATION));
        }
        return srvOrFallback(delegated.hostname()).thenApply(
        endpoint -> new ResolvedServer(endpoint.address(), endpoint.port(), delegated.hostname(), delegated.hostname(),
                                       WELL_KNOWN_DELEGATION));
    }

    private CompletableFuture<ResolvedServer> discover(ServerName name) {
        var ip = name.ipLiteral();
        if (ip.isPresent()) {
            return CompletableFuture.completedFuture(
            new ResolvedServer(ip.get(), name.portOrDefault(), name.original(), name.hostname(), IP_LITERAL));
        }
        if (name.port().isPresent()) {
            var port = name.port().getAsInt();
            return address(name.hostname()).thenApply(
            address -> new ResolvedServer(address, port, name.original(), name.hostname(), EXPLICIT_PORT));
        }
        return wellKnown(name.hostname()).thenCompose(delegated -> {
            if (delegated.isEmpty()) {
                return direct(name);
            }
            return delegate(name, delegated.get()).<CompletableFuture<ResolvedServer>>handle((resolved, t) -> {
                if (t == null) {
                    return CompletableFuture.completedFuture(resolved);
                }
                log.warn("Delegation of: {} to: {} failed, continuing with SRV: {}", name, delegated.get(),
                         unwrap(t).toString());
                return direct(name);
            }).thenCompose(f -> f);
        });
    }

    private CompletableFuture<ResolvedServer> direct(ServerName name) {
        return srvOrFallback(name.hostname()).thenApply(
        endpoint -> new ResolvedServer(endpoint.address(), endpoint.port(), name.hostname(), name.hostname(),
                                       endpoint.method()));
    }

    private ResolutionException failure(String hostname, Throwable t) {
        var cause = unwrap(t);
        if (cause instanceof ResolutionException re) {
            return re;
        }
        if (cause instanceof TimeoutException) {
            return new ResolutionException(Reason.TIMEOUT, hostname, "DNS lookup timed out", cause);
        }
        return new ResolutionException(Reason.DNS, hostname, "DNS lookup failed", cause);
    }

    private CompletableFuture<Endpoint> fallback(String hostname) {
        return address(hostname).handle((address, t) -> {
            if (t != null) {
                var cause = failure(hostname, t);
                throw new CompletionException(cause.getReason() == Reason.TIMEOUT ? cause : new ResolutionException(
                Reason.NO_SERVER_FOUND, hostname, "No server found", cause));
            }
            return new Endpoint(address, ServerName.DEFAULT_PORT, FALLBACK_PORT_8448);
        });
    }

    private CompletableFuture<Optional<Endpoint>> firstReachable(List<SrvRecord> records, int index,
                                                                 ResolutionMethod method) {
        if (index >= records.size()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        var record = records.get(index);
        return address(record.target()).<CompletableFuture<Optional<Endpoint>>>handle((address, t) -> {
            if (t == null) {
                return CompletableFuture.completedFuture(Optional.of(new Endpoint(address, record.port(), method)));
            }
            log.warn("SRV target: {}:{} unreachable: {}", record.target(), record.port(), unwrap(t).getMessage());
            return firstReachable(records, index + 1, method);
        }).thenCompose(f -> f);
    }

    private CompletableFuture<Optional<Endpoint>> srv(String query, ResolutionMethod method) {
        return timed(() -> dns.lookupSrv(query)).handle((records, t) -> {
            if (t != null) {
                log.debug("SRV lookup of: {} failed: {}", query, unwrap(t).toString());
                return List.<SrvRecord>of();
            }
            return records == null ? List.<SrvRecord>of() : records;
        }).thenCompose(records -> {
            var ordered = records.stream().filter(r -> !r.unavailable()).sorted().toList();
            if (!ordered.isEmpty()) {
                log.debug("SRV: {} targets: {}", query, ordered);
            }
            return firstReachable(ordered, 0, method);
        });
    }

    private CompletableFuture<Endpoint> srvOrFallback(String hostname) {
        return srv(SRV_PREFIX + hostname, SRV_MATRIX_FED).thenCompose(fed -> {
            if (fed.isPresent()) {
                return CompletableFuture.completedFuture(fed);
            }
            return srv(LEGACY_SRV_PREFIX + hostname, SRV_MATRIX_LEGACY);
        }).thenCompose(found -> {
            if (found.isPresent()) {
                return CompletableFuture.completedFuture(found.get());
            }
            return fallback(hostname);
        });
    }

    private <T> CompletableFuture<T> timed(Supplier<CompletableFuture<T>> step) {
        return guarded(step).copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private CompletableFuture<Optional<String>> wellKnown(String hostname) {
        var cached = wellKnownCache.get(hostname);
        if (cached.isPresent()) {
            if (metrics != null) {
                metrics.wellKnownCacheHits().mark();
            }
            log.debug("Cached well-known for: {} delegation: {}", hostname, cached.get());
            return CompletableFuture.completedFuture(cached.get());
        }
        return timed(() -> wellKnown.fetch(hostname)).handle((delegated, t) -> {
            Optional<String> result;
            if (t != null) {
                log.debug("No well-known for: {} : {}", hostname, unwrap(t).toString());
                result = Optional.empty();
            } else {
                result = delegated == null ? Optional.empty() : delegated;
            }
            wellKnownCache.put(hostname, result, wellKnownTtl);
            return result;
        });
    }

    private record Endpoint(InetAddress address, int port, ResolutionMethod method) {
    }

    public static class Builder implements Cloneable {
        private Duration        backoffBase  = Duration.ofSeconds(1);
        private Duration        backoffPrune = Duration.ofHours(24);
        private Clock           clock        = Clock.systemUTC();
        private DnsClient       dns;
        private Duration        errorTtl     = Duration.ofHours(1);
        private TrustMetrics    metrics;
        private Duration        timeout      = Duration.ofSeconds(10);
        private WellKnownClient wellKnown;
        private Duration        wellKnownTtl = Duration.ofHours(24);

        public ServerResolver build() {
            return new ServerResolver(dns, wellKnown, clock, timeout, wellKnownTtl, errorTtl, backoffBase,
                                      backoffPrune, metrics);
        }

        @Override
        public Builder clone() {
            try {
                return (Builder) super.clone();
            } catch (CloneNotSupportedException e) {
                throw new IllegalStateException(e);
            }
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public Builder setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Duration getBackoffPrune() {
            return backoffPrune;
        }

        public Builder setBackoffPrune(Duration backoffPrune) {
            this.backoffPrune = backoffPrune;
            return this;
        }

        public Clock getClock() {
            return clock;
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DnsClient getDns() {
            return dns;
        }

        public Builder setDns(DnsClient dns) {
            this.dns = dns;
            return this;
        }

        public Duration getErrorTtl() {
            return errorTtl;
        }

        public Builder setErrorTtl(Duration errorTtl) {
            this.errorTtl = errorTtl;
            return this;
        }

        public TrustMetrics getMetrics() {
            return metrics;
        }

        public Builder setMetrics(TrustMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public Builder setTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public WellKnownClient getWellKnown() {
            return wellKnown;
        }

        public Builder setWellKnown(WellKnownClient wellKnown) {
            this.wellKnown = wellKnown;
            return this;
        }

        public Duration getWellKnownTtl() {
            return wellKnownTtl;
        }

        public Builder setWellKnownTtl(Duration wellKnownTtl) {
            this.wellKnownTtl = wellKnownTtl;
            return this;
        }
    }
}
