/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import com.fasterxml.jackson.databind.JsonNode;
import com.salesforce.matryx.cryptography.InvalidSignatureException;
import com.salesforce.matryx.federation.TrustMetrics;
import com.salesforce.matryx.federation.keys.KeyFetchException.Reason;
import com.salesforce.matryx.federation.keys.VerifyKeyBundle.OldVerifyKey;
import com.salesforce.matryx.federation.resolver.ExpiringCache;
import com.salesforce.matryx.federation.resolver.ServerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides which public keys are trusted for a server. Remote keys come from the server's own self-signed key bundle,
 * fetched through the resolver and held in the {@link KeyCacheStore} for half of their remaining validity. Local keys
 * are minted here, and nowhere else.
 *
 * @author hal.hildebrand
 */
public class KeyStore {
    private static final Logger log = LoggerFactory.getLogger(KeyStore.class);

    private final KeyServerClient                          client;
    private final Clock                                    clock;
    private final Duration                                 halfLifeCap;
    private final Duration                                 localKeyValidity;
    private final Duration                                 maxKeyValidity;
    private final TrustMetrics                             metrics;
    private final Lock                                     minting = new ReentrantLock();
    private final ServerResolver                           resolver;
    private final KeyCacheStore                            store;
    private final ExpiringCache<String, KeyFetchException> trustFailures;
    private final Duration                                 trustFailureTtl;

    public KeyStore(KeyCacheStore store, ServerResolver resolver, KeyServerClient client, Clock clock,
                    Duration maxKeyValidity, Duration halfLifeCap, Duration trustFailureTtl, Duration localKeyValidity,
                    TrustMetrics metrics) {
        this.store = Objects.requireNonNull(store);
        this.resolver = resolver;
        this.client = client;
        this.clock = clock;
        this.maxKeyValidity = maxKeyValidity;
        this.halfLifeCap = halfLifeCap;
        this.trustFailureTtl = trustFailureTtl;
        this.localKeyValidity = localKeyValidity;
        this.metrics = metrics;
        this.trustFailures = new ExpiringCache<>(clock);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Fetch, verify and cache the key bundle of the server
     *
     * @return the verify keys of the server, by key id
     */
    public CompletableFuture<Map<String, String>> fetchServerKeys(String serverName) {
        var negative = trustFailures.get(serverName);
        if (negative.isPresent()) {
            log.debug("Cached trust failure for: {}", serverName);
            return CompletableFuture.failedFuture(negative.get());
        }
        var timer = metrics == null ? null : metrics.keyFetch().time();
        return resolver.resolve(serverName).handle((resolved, t) -> {
            if (t != null) {
                throw new CompletionException(
                new KeyFetchException(Reason.RESOLUTION, serverName, null, "Unable to resolve", unwrap(t)));
            }
            return resolved;
        }).thenCompose(resolved -> client.fetchServerKeys(resolved).handle((json, t) -> {
            if (t != null) {
                throw new CompletionException(
                new KeyFetchException(Reason.TRANSPORT, serverName, null, "Unable to fetch keys from: " + resolved,
                                      unwrap(t)));
            }
            try {
                return accept(serverName, json);
            } catch (KeyFetchException e) {
                throw new CompletionException(e);
            }
        })).whenComplete((keys, t) -> {
            if (timer != null) {
                timer.stop();
            }
            if (t == null) {
                return;
            }
            if (metrics != null) {
                metrics.keyFetchFailures().mark();
            }
            var cause = unwrap(t);
            if (cause instanceof KeyFetchException e && e.isTrustFailure()) {
                trustFailures.put(serverName, e, trustFailureTtl);
            }
            log.warn("Unable to fetch keys of: {} : {}", serverName, cause.toString());
        });
    }

    /**
     * @return the base 64 public key of the server's key, fetching the server's key bundle if the key is not cached
     */
    public CompletableFuture<String> getServerPublicKey(String serverName, String keyId) {
        var local = localKey(serverName, keyId);
        if (local.isPresent()) {
            return CompletableFuture.completedFuture(local.get().publicKey());
        }
        var cached = store.get(serverName, keyId);
        if (cached.isPresent() && !cached.get().isExpired(clock.instant())) {
            if (metrics != null) {
                metrics.keyCacheHits().mark();
            }
            log.debug("Cached key: {} of: {}", keyId, serverName);
            return CompletableFuture.completedFuture(cached.get().publicKey());
        }
        return fetchServerKeys(serverName).thenApply(keys -> {
            var key = keys.get(keyId);
            if (key == null) {
                throw new CompletionException(new KeyFetchException(Reason.KEY_NOT_FOUND, serverName, keyId,
                                                                    "Server does not publish key: " + keyId));
            }
            return key;
        });
    }

    /**
     * @return the named local key, if it exists and is usable for signing
     */
    public Optional<ServerSigningKey> getSigningKey(String serverName, String keyId) {
        var now = clock.instant();
        return store.localKeys(serverName)
                    .stream()
                    .filter(k -> k.keyId().equals(keyId))
                    .filter(k -> k.isUsable(now))
                    .findFirst();
    }

    /**
     * Answer the newest usable signing key of the local server, minting and persisting a new key if there is none.
     * Active keys found expired are deactivated first.
     */
    public ServerSigningKey getServerSigningKey(String serverName) {
        minting.lock();
        try {
            var now = clock.instant();
            ServerSigningKey newest = null;
            for (var key : store.localKeys(serverName)) {
                if (!key.active()) {
                    continue;
                }
                if (!key.isUsable(now)) {
                    store.saveLocalKey(key.deactivate());
                    log.info("Deactivated expired signing key: {}", key);
                    continue;
                }
                if (newest == null || key.createdAt().isAfter(newest.createdAt())) {
                    newest = key;
                }
            }
            if (newest != null) {
                return newest;
            }
            var minted = ServerSigningKey.generate(serverName, now, localKeyValidity);
            store.saveLocalKey(minted);
            log.info("Minted signing key: {}", minted);
            return minted;
        } finally {
            minting.unlock();
        }
    }

    /**
     * @return the key bundle this server publishes, signed by its current signing key. Keys no longer active are
     * listed as old verify keys.
     */
    public VerifyKeyBundle localKeyBundle(String serverName, Duration validity) {
        var current = getServerSigningKey(serverName);
        var now = clock.instant();
        var verifyKeys = new HashMap<String, String>();
        var oldKeys = new HashMap<String, OldVerifyKey>();
        for (var key : store.localKeys(serverName)) {
            if (key.isUsable(now)) {
                verifyKeys.put(key.keyId(), key.publicKey());
            } else {
                oldKeys.put(key.keyId(), new OldVerifyKey(key.publicKey(), key.expiresAt()));
            }
        }
        return VerifyKeyBundle.create(serverName, verifyKeys, oldKeys, now.plus(validity), current.keyId(),
                                      current.signer());
    }

    private VerifyKeyBundle bundle(String serverName, JsonNode json) throws KeyFetchException {
        var bundle = VerifyKeyBundle.from(json);
        if (!serverName.equals(bundle.serverName())) {
            throw new KeyFetchException(Reason.SERVER_NAME_MISMATCH, serverName, null,
                                        "Key bundle names server: " + bundle.serverName());
        }
        try {
            bundle.verifySelfSignature();
        } catch (InvalidSignatureException e) {
            throw new KeyFetchException(Reason.INVALID_SELF_SIGNATURE, serverName, null,
                                        "Key bundle is not signed by its own keys", e);
        }
        return bundle;
    }

    private Map<String, String> accept(String serverName, JsonNode json) throws KeyFetchException {
        var bundle = bundle(serverName, json);
        var now = clock.instant();
        var cap = now.plus(maxKeyValidity);
        var effective = bundle.validUntil().isBefore(cap) ? bundle.validUntil() : cap;
        if (!effective.isAfter(now)) {
            throw new KeyFetchException(Reason.EXPIRED, serverName, null,
                                        "Key bundle expired at: " + bundle.validUntil());
        }
        var expiresAt = cacheExpiry(now, effective);
        bundle.verifyKeys().forEach((keyId, key) -> store.put(serverName, keyId, new CachedServerKey(key, now,
                                                                                                     expiresAt)));
        log.info("Fetched keys: {} of: {} cached until: {}", bundle.verifyKeys().keySet(), serverName, expiresAt);
        return bundle.verifyKeys();
    }

    private Instant cacheExpiry(Instant now, Instant effective) {
        var lifetime = Duration.between(now, effective);
        if (lifetime.compareTo(halfLifeCap) > 0) {
            lifetime = halfLifeCap;
        }
        return now.plus(lifetime.dividedBy(2));
    }

    private Optional<ServerSigningKey> localKey(String serverName, String keyId) {
        return store.localKeys(serverName).stream().filter(k -> k.keyId().equals(keyId)).findFirst();
    }

    public static class Builder implements Cloneable {
        private KeyServerClient client;
        private Clock           clock            = Clock.systemUTC();
        private Duration        halfLifeCap      = Duration.ofHours(24);
        private Duration        localKeyValidity = Duration.ofDays(365);
        private Duration        maxKeyValidity   = Duration.ofDays(7);
        private TrustMetrics    metrics;
        private ServerResolver  resolver;
        private KeyCacheStore   store;
        private Duration        trustFailureTtl  = Duration.ofHours(1);

        public KeyStore build() {
            return new KeyStore(store, resolver, client, clock, maxKeyValidity, halfLifeCap, trustFailureTtl,
                                localKeyValidity, metrics);
        }

        @Override
        public Builder clone() {
            try {
                return (Builder) super.clone();
            } catch (CloneNotSupportedException e) {
                throw new IllegalStateException(e);
            }
        }

        public KeyServerClient getClient() {
            return client;
        }

        public Builder setClient(KeyServerClient client) {
            this.client = client;
            return this;
        }

        public Clock getClock() {
            return clock;
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Duration getHalfLifeCap() {
            return halfLifeCap;
        }

        public Builder setHalfLifeCap(Duration halfLifeCap) {
            this.halfLifeCap = halfLifeCap;
            return this;
        }

        public Duration getLocalKeyValidity() {
            return localKeyValidity;
        }

        public Builder setLocalKeyValidity(Duration localKeyValidity) {
            this.localKeyValidity = localKeyValidity;
            return this;
        }

        public Duration getMaxKeyValidity() {
            return maxKeyValidity;
        }

        public Builder setMaxKeyValidity(Duration maxKeyValidity) {
            this.maxKeyValidity = maxKeyValidity;
            return this;
        }

        public TrustMetrics getMetrics() {
            return metrics;
        }

        public Builder setMetrics(TrustMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ServerResolver getResolver() {
            return resolver;
        }

        public Builder setResolver(ServerResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public KeyCacheStore getStore() {
            return store;
        }

        public Builder setStore(KeyCacheStore store) {
            this.store = store;
            return this;
        }

        public Duration getTrustFailureTtl() {
            return trustFailureTtl;
        }

        public Builder setTrustFailureTtl(Duration trustFailureTtl) {
            this.trustFailureTtl = trustFailureTtl;
            return this;
        }
    }
}
