/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.signing;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.cryptography.InvalidSignatureException;
import com.salesforce.matryx.cryptography.Verifier;
import com.salesforce.matryx.events.ContentHasher;
import com.salesforce.matryx.events.Event;
import com.salesforce.matryx.events.Redactor;
import com.salesforce.matryx.events.RoomVersion;
import com.salesforce.matryx.events.json.CanonicalJson;
import com.salesforce.matryx.federation.MutableClock;
import com.salesforce.matryx.federation.TrustMetricsImpl;
import com.salesforce.matryx.federation.keys.InMemoryKeyCacheStore;
import com.salesforce.matryx.federation.keys.KeyFetchException;
import com.salesforce.matryx.federation.keys.KeyStore;
import com.salesforce.matryx.federation.keys.ServerSigningKey;
import com.salesforce.matryx.federation.signing.EventValidationException.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author hal.hildebrand
 */
public class EventSigningEngineTest {
    private static final String ORIGIN = "example.org";

    private MutableClock       clock;
    private EventSigningEngine engine;
    private ServerSigningKey   key;
    private KeyStore           keyStore;
    private TrustMetricsImpl   metrics;
    private EventSigningEngine receiver;
    private KeyStore           receiverKeys;

    private static Event message() throws Exception {
        return Event.newBuilder()
                    .eventId("$abc:example.org")
                    .roomId("!room:example.org")
                    .sender("@alice:example.org")
                    .type("m.room.message")
                    .originServerTs(1_700_000_000_000L)
                    .depth(3)
                    .prevEvents(List.of("$prev:example.org"))
                    .authEvents(List.of("$create:example.org"))
                    .content(CanonicalJson.parse("{\"body\":\"hi\",\"msgtype\":\"m.text\"}"))
                    .build();
    }

    private static EventValidationException rejection(CompletableFuture<?> future) {
        var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        var cause = e.getCause();
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        assertTrue(cause instanceof EventValidationException, "unexpected: " + cause);
        return (EventValidationException) cause;
    }

    @BeforeEach
    public void before() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        metrics = new TrustMetricsImpl(ORIGIN, new MetricRegistry());
        keyStore = KeyStore.newBuilder().setStore(new InMemoryKeyCacheStore(clock)).setClock(clock).build();
        key = keyStore.getServerSigningKey(ORIGIN);
        engine = new EventSigningEngine(ORIGIN, keyStore, metrics);

        receiverKeys = mock(KeyStore.class);
        when(receiverKeys.getServerPublicKey(anyString(), anyString())).thenReturn(CompletableFuture.failedFuture(
        new KeyFetchException(KeyFetchException.Reason.KEY_NOT_FOUND, ORIGIN, null, "unknown")));
        when(receiverKeys.getServerPublicKey(ORIGIN, key.keyId())).thenReturn(
        CompletableFuture.completedFuture(key.publicKey()));
        receiver = new EventSigningEngine("receiver.org", receiverKeys, metrics);
    }

    @Test
    public void endToEnd() throws Exception {
        var signed = engine.signEvent(message(), key.keyId());

        assertEquals(ContentHasher.contentHash(message()), signed.contentHash().get());
        assertFalse(Redactor.redact(signed, RoomVersion.V10).has("content"));

        var signature = signed.signatures(ORIGIN).get(key.keyId());
        var bytes = CanonicalJson.encode(Redactor.signingView(signed));
        Verifier.verify(signature, bytes, key.publicKey());
        var other = ServerSigningKey.generate(ORIGIN, clock.instant(), Duration.ofDays(1));
        assertThrows(InvalidSignatureException.class, () -> Verifier.verify(signature, bytes, other.publicKey()));

        receiver.validateEventCrypto(signed, List.of(ORIGIN)).get(5, TimeUnit.SECONDS);
        assertEquals(1, metrics.eventsSigned().getCount());
    }

    @Test
    public void keepsOtherSignatures() throws Exception {
        var event = message().withSignature("other.org", "ed25519:o", "c2ln");
        var signed = engine.signEvent(event, key.keyId());
        assertEquals("c2ln", signed.signatures("other.org").get("ed25519:o"));
        assertEquals(2, signed.signingServers().size());
    }

    @Test
    public void keyUnavailable() throws Exception {
        var signed = engine.signEvent(message(), key.keyId());
        when(receiverKeys.getServerPublicKey(ORIGIN, key.keyId())).thenReturn(CompletableFuture.failedFuture(
        new KeyFetchException(KeyFetchException.Reason.TRANSPORT, ORIGIN, key.keyId(), "connection refused")));

        var e = rejection(receiver.validateEventCrypto(signed, List.of(ORIGIN)));
        assertEquals(Reason.SIGNATURE_INVALID, e.getReason());
        assertEquals(ORIGIN, e.getServerName());
    }

    @Test
    public void missingHash() throws Exception {
        var signed = engine.signEvent(message(), key.keyId()).without(Event.HASHES);
        assertEquals(Reason.MISSING_HASH, rejection(receiver.validateEventCrypto(signed, List.of(ORIGIN))).getReason());
    }

    @Test
    public void missingSignature() throws Exception {
        var signed = engine.signEvent(message(), key.keyId());
        var e = rejection(receiver.validateEventCrypto(signed, List.of(ORIGIN, "other.org")));
        assertEquals(Reason.MISSING_SIGNATURE, e.getReason());
        assertEquals("other.org", e.getServerName());
    }

    @Test
    public void noExpectedServers() throws Exception {
        var signed = engine.signEvent(message(), key.keyId());
        var e = rejection(receiver.validateEventCrypto(signed, List.of()));
        assertEquals(Reason.MISSING_SIGNATURE, e.getReason());
        assertEquals("$abc:example.org", e.getEventId());
    }

    @Test
    public void oneValidSignatureSuffices() throws Exception {
        var signed = engine.signEvent(message(), key.keyId()).withSignature(ORIGIN, "ed25519:rotated", "AAAA");
        receiver.validateEventCrypto(signed, List.of(ORIGIN)).get(5, TimeUnit.SECONDS);

        var forged = engine.signEvent(message(), key.keyId())
                           .without(Event.SIGNATURES)
                           .withSignature(ORIGIN, key.keyId(), "AAAA")
                           .withSignature(ORIGIN, "ed25519:rotated", "AAAA");
        assertEquals(Reason.SIGNATURE_INVALID, rejection(receiver.validateEventCrypto(forged, List.of(ORIGIN)))
        .getReason());
        assertTrue(metrics.signatureFailures().getCount() >= 1);
    }

    @Test
    public void outboundErrors() throws Exception {
        assertThrows(IllegalStateException.class, () -> engine.signEvent(message(), "ed25519:unknown"));
        var anonymous = message().without(Event.EVENT_ID);
        assertThrows(IllegalStateException.class, () -> engine.signEvent(anonymous, key.keyId()));
    }

    @Test
    public void tampering() throws Exception {
        var signed = engine.signEvent(message(), key.keyId());

        var json = signed.toJson();
        json.putObject("unsigned").put("age", 1234);
        receiver.validateEventCrypto(Event.from(json), List.of(ORIGIN)).get(5, TimeUnit.SECONDS);

        json = signed.toJson();
        ((ObjectNode) json.get("content")).put("body", "bye");
        assertEquals(Reason.CONTENT_HASH_MISMATCH, rejection(receiver.validateEventCrypto(Event.from(json),
                                                                                          List.of(ORIGIN))).getReason());

        json = signed.toJson();
        json.put("origin", "evil.org");
        assertEquals(Reason.CONTENT_HASH_MISMATCH, rejection(receiver.validateEventCrypto(Event.from(json),
                                                                                          List.of(ORIGIN))).getReason());

        json = signed.toJson();
        json.put("depth", 4);
        json.putObject("hashes").put("sha256", ContentHasher.contentHash(Event.from(json)));
        assertEquals(Reason.SIGNATURE_INVALID, rejection(receiver.validateEventCrypto(Event.from(json),
                                                                                      List.of(ORIGIN))).getReason());
    }
}
