/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation;

import com.codahale.metrics.MetricRegistry;
import com.salesforce.matryx.federation.keys.*;
import com.salesforce.matryx.federation.resolver.*;
import com.salesforce.matryx.federation.signing.EventSigner;
import com.salesforce.matryx.federation.signing.EventSigningEngine;
import com.salesforce.matryx.federation.signing.RequestAuthentication;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The federation trust core of one homeserver: server discovery, key trust, and the signing and validation of
 * events and requests, wired from a {@link TrustConfiguration}.
 *
 * @author hal.hildebrand
 */
public class TrustCore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TrustCore.class);

    private final    RequestAuthentication    authentication;
    private final    TrustConfiguration       configuration;
    private final    DnsClient                dns;
    private final    EventSigningEngine       engine;
    private final    EventLoopGroup           group;
    private final    KeyStore                 keyStore;
    private final    ServerResolver           resolver;
    private final    AtomicBoolean            running = new AtomicBoolean();
    private final    EventSigner              signer;
    private final    KeyCacheStore            store;
    private volatile ScheduledFuture<?>       cleanup;
    private volatile ScheduledExecutorService scheduler;

    public TrustCore(TrustConfiguration configuration, MetricRegistry registry) throws SSLException {
        this(configuration, registry, newGroup(configuration));
    }

    /**
     * Wire the core over the supplied collaborators
     */
    public TrustCore(TrustConfiguration configuration, MetricRegistry registry, DnsClient dns,
                     WellKnownClient wellKnown, KeyServerClient client, KeyCacheStore store, Clock clock) {
        this(configuration, registry, dns, wellKnown, client, store, clock, null);
    }

    private TrustCore(TrustConfiguration c, MetricRegistry registry, EventLoopGroup group) throws SSLException {
        this(c, registry, new NettyDnsClient(group.next(), c.resolutionTimeout),
             new HttpWellKnownClient(c.resolutionTimeout, c.userAgent),
             new NettyKeyServerClient(group, c.resolutionTimeout, c.userAgent), openStore(c), Clock.systemUTC(),
             group);
    }

    private TrustCore(TrustConfiguration c, MetricRegistry registry, DnsClient dns, WellKnownClient wellKnown,
                      KeyServerClient client, KeyCacheStore store, Clock clock, EventLoopGroup group) {
        c.validate();
        this.configuration = c;
        this.dns = dns;
        this.store = store;
        this.group = group;
        var metrics = registry == null ? null : new TrustMetricsImpl(c.serverName, registry);
        resolver = ServerResolver.newBuilder()
                                 .setDns(dns)
                                 .setWellKnown(wellKnown)
                                 .setClock(clock)
                                 .setTimeout(c.resolutionTimeout)
                                 .setWellKnownTtl(c.wellKnownTtl)
                                 .setErrorTtl(c.errorTtl)
                                 .setBackoffBase(c.backoffBase)
                                 .setBackoffPrune(c.backoffPrune)
                                 .setMetrics(metrics)
                                 .build();
        keyStore = KeyStore.newBuilder()
                           .setStore(store)
                           .setResolver(resolver)
                           .setClient(client)
                           .setClock(clock)
                           .setMaxKeyValidity(c.maxKeyValidity)
                           .setHalfLifeCap(c.keyCacheHalfLifeCap)
                           .setTrustFailureTtl(c.trustFailureTtl)
                           .setLocalKeyValidity(c.localKeyValidity)
                           .setMetrics(metrics)
                           .build();
        engine = new EventSigningEngine(c.serverName, keyStore, metrics);
        signer = new EventSigner(engine, keyStore, c.defaultKeyId, clock);
        authentication = new RequestAuthentication(engine, keyStore);
    }

    private static NioEventLoopGroup newGroup(TrustConfiguration c) {
        return new NioEventLoopGroup(c.eventLoopThreads, daemon("matryx.io"));
    }

    private static ThreadFactory daemon(String label) {
        var count = new AtomicInteger();
        return r -> {
            var t = new Thread(r, label + " [" + count.getAndIncrement() + "]");
            t.setDaemon(true);
            return t;
        };
    }

    private static KeyCacheStore openStore(TrustConfiguration c) {
        return c.keyStorePath == null ? new InMemoryKeyCacheStore(Clock.systemUTC())
                                      : MVStoreKeyCacheStore.open(Path.of(c.keyStorePath));
    }

    @Override
    public void close() {
        stop();
        if (dns instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing DNS client", e);
            }
        }
        store.close();
        if (group != null) {
            group.shutdownGracefully();
        }
    }

    public RequestAuthentication getAuthentication() {
        return authentication;
    }

    public TrustConfiguration getConfiguration() {
        return configuration;
    }

    public EventSigner getEventSigner() {
        return signer;
    }

    public KeyStore getKeyStore() {
        return keyStore;
    }

    public ServerResolver getResolver() {
        return resolver;
    }

    public EventSigningEngine getSigningEngine() {
        return engine;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the key bundle this server publishes at <code>/_matrix/key/v2/server</code>
     */
    public VerifyKeyBundle localKeyBundle() {
        return keyStore.localKeyBundle(configuration.serverName, configuration.publishedBundleValidity);
    }

    /**
     * Ensure a signing key exists and begin the periodic cleanup of the resolver's caches
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        var key = keyStore.getServerSigningKey(configuration.serverName);
        scheduler = Executors.newSingleThreadScheduledExecutor(daemon("matryx.cleanup"));
        cleanup = resolver.scheduleCleanup(scheduler, configuration.cleanupInterval);
        log.info("Trust core of: {} started, signing with: {}", configuration.serverName, key.keyId());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        var c = cleanup;
        if (c != null) {
            c.cancel(false);
        }
        var s = scheduler;
        if (s != null) {
            s.shutdownNow();
        }
        log.info("Trust core of: {} stopped", configuration.serverName);
    }
}
