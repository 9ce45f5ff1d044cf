/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.net.InetAddresses;
import com.salesforce.matryx.federation.MutableClock;
import com.salesforce.matryx.federation.keys.KeyFetchException.Reason;
import com.salesforce.matryx.federation.resolver.ResolutionException;
import com.salesforce.matryx.federation.resolver.ResolutionMethod;
import com.salesforce.matryx.federation.resolver.ResolvedServer;
import com.salesforce.matryx.federation.resolver.ServerResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class KeyStoreTest {
    private static final String REMOTE = "remote.example.org";

    private KeyServerClient       client;
    private MutableClock          clock;
    private ServerSigningKey      remoteKey;
    private ServerResolver        resolver;
    private InMemoryKeyCacheStore store;

    private static KeyFetchException failure(CompletableFuture<?> future) {
        var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof KeyFetchException, "unexpected: " + e.getCause());
        return (KeyFetchException) e.getCause();
    }

    @BeforeEach
    public void before() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        store = new InMemoryKeyCacheStore(clock);
        client = mock(KeyServerClient.class);
        resolver = mock(ServerResolver.class);
        remoteKey = ServerSigningKey.generate(REMOTE, clock.instant(), Duration.ofDays(365));
        var resolved = new ResolvedServer(InetAddresses.forString("10.0.0.1"), 8448, REMOTE, REMOTE,
                                          ResolutionMethod.FALLBACK_PORT_8448);
        when(resolver.resolve(REMOTE)).thenReturn(CompletableFuture.completedFuture(resolved));
    }

    @Test
    public void cachesEveryKeyOfTheBundle() throws Exception {
        var second = ServerSigningKey.generate(REMOTE, clock.instant(), Duration.ofDays(365));
        var bundle = VerifyKeyBundle.create(REMOTE, Map.of(remoteKey.keyId(), remoteKey.publicKey(), second.keyId(),
                                                           second.publicKey()), Map.of(),
                                            clock.instant().plus(Duration.ofHours(10)), remoteKey.keyId(),
                                            remoteKey.signer()).toJson();
        serve(bundle);
        var keyStore = keyStore();

        assertEquals(remoteKey.publicKey(), keyStore.getServerPublicKey(REMOTE, remoteKey.keyId())
                                                    .get(5, TimeUnit.SECONDS));
        assertEquals(second.publicKey(), keyStore.getServerPublicKey(REMOTE, second.keyId()).get(5, TimeUnit.SECONDS));
        verify(client, times(1)).fetchServerKeys(any());
    }

    @Test
    public void expiredBundleIsNegativelyCached() throws Exception {
        serve(bundle(clock.instant().minus(Duration.ofHours(1))));
        var keyStore = keyStore();

        var e = failure(keyStore.getServerPublicKey(REMOTE, remoteKey.keyId()));
        assertEquals(Reason.EXPIRED, e.getReason());
        assertTrue(e.isTrustFailure());

        assertEquals(Reason.EXPIRED, failure(keyStore.getServerPublicKey(REMOTE, remoteKey.keyId())).getReason());
        verify(client, times(1)).fetchServerKeys(any());

        clock.advance(Duration.ofHours(1));
        serve(bundle(clock.instant().plus(Duration.ofHours(10))));
        assertEquals(remoteKey.publicKey(), keyStore.getServerPublicKey(REMOTE, remoteKey.keyId())
                                                    .get(5, TimeUnit.SECONDS));
        verify(client, times(2)).fetchServerKeys(any());
    }

    @Test
    public void halfLife() throws Exception {
        serve(bundle(clock.instant().plus(Duration.ofHours(10))));
        var keyStore = keyStore();
        var start = clock.instant();

        assertEquals(remoteKey.publicKey(), keyStore.getServerPublicKey(REMOTE, remoteKey.keyId())
                                                    .get(5, TimeUnit.SECONDS));
        var cached = store.get(REMOTE, remoteKey.keyId()).get();
        assertEquals(start, cached.fetchedAt());
        assertEquals(start.plus(Duration.ofHours(5)), cached.expiresAt());

        clock.advance(Duration.ofHours(4));
        keyStore.getServerPublicKey(REMOTE, remoteKey.keyId()).get(5, TimeUnit.SECONDS);
        verify(client, times(1)).fetchServerKeys(any());

        clock.advance(Duration.ofHours(1));
        keyStore.getServerPublicKey(REMOTE, remoteKey.keyId()).get(5, TimeUnit.SECONDS);
        verify(client, times(2)).fetchServerKeys(any());
    }

    @Test
    public void invalidSelfSignature() {
        var imposter = ServerSigningKey.generate(REMOTE, clock.instant(), Duration.ofDays(365));
        serve(VerifyKeyBundle.create(REMOTE, Map.of(remoteKey.keyId(), remoteKey.publicKey()), Map.of(),
                                     clock.instant().plus(Duration.ofHours(10)), remoteKey.keyId(),
                                     imposter.signer()).toJson());
        var keyStore = keyStore();

        var e = failure(keyStore.getServerPublicKey(REMOTE, remoteKey.keyId()));
        assertEquals(Reason.INVALID_SELF_SIGNATURE, e.getReason());
        assertTrue(store.get(REMOTE, remoteKey.keyId()).isEmpty());
    }

    @Test
    public void keyNotFoundIsNotATrustFailure() throws Exception {
        serve(bundle(clock.instant().plus(Duration.ofHours(10))));
        var keyStore = keyStore();

        var e = failure(keyStore.getServerPublicKey(REMOTE, "ed25519:missing"));
        assertEquals(Reason.KEY_NOT_FOUND, e.getReason());
        assertEquals("ed25519:missing", e.getKeyId());
        assertFalse(e.isTrustFailure());

        failure(keyStore.getServerPublicKey(REMOTE, "ed25519:missing"));
        verify(client, times(2)).fetchServerKeys(any());
    }

    @Test
    public void localKeys() throws Exception {
        var keyStore = keyStore();
        var minted = keyStore.getServerSigningKey("local.example.org");
        assertTrue(minted.keyId().matches("ed25519:a_[A-Za-z0-9]{4}"), minted.keyId());
        assertTrue(minted.active());
        assertEquals(clock.instant().plus(Duration.ofDays(365)), minted.expiresAt());
        assertEquals(minted, keyStore.getServerSigningKey("local.example.org"));
        assertEquals(minted.publicKey(), keyStore.getServerPublicKey("local.example.org", minted.keyId())
                                                 .get(5, TimeUnit.SECONDS));
        assertTrue(keyStore.getSigningKey("local.example.org", minted.keyId()).isPresent());

        clock.advance(Duration.ofDays(366));
        var next = keyStore.getServerSigningKey("local.example.org");
        assertNotEquals(minted.keyId(), next.keyId());
        assertTrue(keyStore.getSigningKey("local.example.org", minted.keyId()).isEmpty());
        assertEquals(2, store.localKeys("local.example.org").size());
        assertEquals(1, store.localKeys("local.example.org").stream().filter(ServerSigningKey::active).count());

        var bundle = keyStore.localKeyBundle("local.example.org", Duration.ofDays(7));
        bundle.verifySelfSignature();
        assertEquals(Map.of(next.keyId(), next.publicKey()), bundle.verifyKeys());
        assertEquals(minted.expiresAt(), bundle.oldVerifyKeys().get(minted.keyId()).expiredAt());
        assertEquals(clock.instant().plus(Duration.ofDays(7)), bundle.validUntil());
        assertTrue(bundle.toJson().get("old_verify_keys").get(minted.keyId()).has("expired_ts"));
        verifyNoInteractions(client);
    }

    @Test
    public void resolutionFailure() {
        when(resolver.resolve("dead.example.org")).thenReturn(CompletableFuture.failedFuture(
        new ResolutionException(ResolutionException.Reason.BACKOFF, "dead.example.org", "backing off")));
        var keyStore = keyStore();

        var e = failure(keyStore.getServerPublicKey("dead.example.org", "ed25519:a_1"));
        assertEquals(Reason.RESOLUTION, e.getReason());
        assertTrue(e.getCause() instanceof ResolutionException);
        verifyNoInteractions(client);
    }

    @Test
    public void serverNameMismatch() {
        var evil = ServerSigningKey.generate("evil.example.org", clock.instant(), Duration.ofDays(365));
        serve(VerifyKeyBundle.create("evil.example.org", Map.of(evil.keyId(), evil.publicKey()), Map.of(),
                                     clock.instant().plus(Duration.ofHours(10)), evil.keyId(), evil.signer())
                             .toJson());
        var keyStore = keyStore();

        assertEquals(Reason.SERVER_NAME_MISMATCH, failure(keyStore.getServerPublicKey(REMOTE, evil.keyId())).getReason());
        failure(keyStore.getServerPublicKey(REMOTE, evil.keyId()));
        verify(client, times(1)).fetchServerKeys(any());
    }

    @Test
    public void sevenDayCap() throws Exception {
        serve(bundle(clock.instant().plus(Duration.ofDays(30))));
        var start = clock.instant();

        keyStore().getServerPublicKey(REMOTE, remoteKey.keyId()).get(5, TimeUnit.SECONDS);
        assertEquals(start.plus(Duration.ofHours(12)), store.get(REMOTE, remoteKey.keyId()).get().expiresAt());

        var uncapped = KeyStore.newBuilder()
                               .setStore(store)
                               .setResolver(resolver)
                               .setClient(client)
                               .setClock(clock)
                               .setHalfLifeCap(Duration.ofDays(365))
                               .build();
        uncapped.fetchServerKeys(REMOTE).get(5, TimeUnit.SECONDS);
        assertEquals(start.plus(Duration.ofDays(7).dividedBy(2)), store.get(REMOTE, remoteKey.keyId())
                                                                       .get()
                                                                       .expiresAt());
    }

    @Test
    public void transportFailure() {
        when(client.fetchServerKeys(any())).thenReturn(
        CompletableFuture.failedFuture(new IOException("connection refused")));
        var keyStore = keyStore();

        var e = failure(keyStore.getServerPublicKey(REMOTE, remoteKey.keyId()));
        assertEquals(Reason.TRANSPORT, e.getReason());
        assertFalse(e.isTrustFailure());
        failure(keyStore.getServerPublicKey(REMOTE, remoteKey.keyId()));
        verify(client, times(2)).fetchServerKeys(any());
    }

    private JsonNode bundle(Instant validUntil) {
        return VerifyKeyBundle.create(REMOTE, Map.of(remoteKey.keyId(), remoteKey.publicKey()), Map.of(), validUntil,
                                      remoteKey.keyId(), remoteKey.signer()).toJson();
    }

    private KeyStore keyStore() {
        return KeyStore.newBuilder().setStore(store).setResolver(resolver).setClient(client).setClock(clock).build();
    }

    private void serve(JsonNode bundle) {
        when(client.fetchServerKeys(any())).thenReturn(CompletableFuture.completedFuture(bundle));
    }
}
