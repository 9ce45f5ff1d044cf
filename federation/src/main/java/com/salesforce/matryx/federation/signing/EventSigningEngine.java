/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.signing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.cryptography.Base64s;
import com.salesforce.matryx.cryptography.InvalidSignatureException;
import com.salesforce.matryx.cryptography.Verifier;
import com.salesforce.matryx.events.ContentHasher;
import com.salesforce.matryx.events.Event;
import com.salesforce.matryx.events.Redactor;
import com.salesforce.matryx.events.json.CanonicalJson;
import com.salesforce.matryx.events.json.CanonicalJsonException;
import com.salesforce.matryx.events.json.JsonSigner;
import com.salesforce.matryx.federation.TrustMetrics;
import com.salesforce.matryx.federation.keys.KeyStore;
import com.salesforce.matryx.federation.keys.ServerSigningKey;
import com.salesforce.matryx.federation.signing.EventValidationException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Signs the events and payloads this server originates, and checks the hashes and signatures of the events it
 * receives.
 * <p>
 * Signing only ever sees data the local server produced, so any failure there is a programming error and is thrown as
 * an {@link IllegalStateException}. Validation sees adversarial input, and reports every failure through the returned
 * future as an {@link EventValidationException}.
 *
 * @author hal.hildebrand
 */
public class EventSigningEngine {
    private static final Logger log = LoggerFactory.getLogger(EventSigningEngine.class);

    private final KeyStore     keyStore;
    private final TrustMetrics metrics;
    private final String       serverName;

    public EventSigningEngine(String serverName, KeyStore keyStore, TrustMetrics metrics) {
        this.serverName = serverName;
        this.keyStore = keyStore;
        this.metrics = metrics;
    }

    private static boolean sameHash(String recorded, String computed) {
        try {
            return MessageDigest.isEqual(Base64s.unbase64(recorded), Base64s.unbase64(computed));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public String getServerName() {
        return serverName;
    }

    /**
     * Hash and sign the event with the named local key. Signatures already present, from this server's other keys or
     * from other servers, are kept.
     *
     * @throws IllegalStateException if the key is not a usable local key, or the event cannot be signed
     */
    public Event signEvent(Event event, String keyId) {
        if (event.eventId() == null || event.eventId().isEmpty()) {
            throw new IllegalStateException("Cannot sign an event without an event_id: " + event.toJson());
        }
        var key = signingKey(keyId);
        final Event signed;
        try {
            var hashed = event.withContentHash(ContentHasher.contentHash(event));
            var bytes = CanonicalJson.encode(Redactor.signingView(hashed));
            signed = hashed.withSignature(serverName, keyId, key.signer().sign(bytes).toBase64());
        } catch (CanonicalJsonException e) {
            throw new IllegalStateException("Cannot sign event: " + event, e);
        }
        if (metrics != null) {
            metrics.eventsSigned().mark();
        }
        log.debug("Signed: {} with: {}", event, keyId);
        return signed;
    }

    /**
     * Sign an arbitrary JSON object with the named local key
     *
     * @throws IllegalStateException if the key is not a usable local key, or the object cannot be signed
     */
    public ObjectNode signJson(JsonNode json, String keyId) {
        var key = signingKey(keyId);
        try {
            return JsonSigner.sign(json, serverName, keyId, key.signer());
        } catch (CanonicalJsonException e) {
            throw new IllegalStateException("Cannot sign: " + json, e);
        }
    }

    /**
     * Check the content hash of the event, and that each of the expected servers signed it. For every server at least
     * one of its signatures must verify with a key obtained through the key store; a key that cannot be obtained counts
     * as a failed signature. An event with no expected servers is never accepted.
     *
     * @return a future completing normally if the event is authentic, or failing with an
     * {@link EventValidationException}
     */
    public CompletableFuture<Void> validateEventCrypto(Event event, Collection<String> expectedServers) {
        var eventId = event.eventId();
        var recorded = event.contentHash();
        if (recorded.isEmpty()) {
            return CompletableFuture.failedFuture(
            new EventValidationException(Reason.MISSING_HASH, eventId, null, "Event has no sha256 content hash"));
        }
        final String computed;
        final byte[] signed;
        try {
            computed = ContentHasher.contentHash(event);
            signed = CanonicalJson.encode(Redactor.signingView(event));
        } catch (CanonicalJsonException e) {
            return CompletableFuture.failedFuture(
            new EventValidationException(Reason.MALFORMED, eventId, null, "Event cannot be canonically encoded", e));
        }
        if (!sameHash(recorded.get(), computed)) {
            log.warn("Content hash mismatch on: {} recorded: {} computed: {}", eventId, recorded.get(), computed);
            return CompletableFuture.failedFuture(
            new EventValidationException(Reason.CONTENT_HASH_MISMATCH, eventId, null, "Content hash mismatch"));
        }

        if (expectedServers == null || expectedServers.isEmpty()) {
            return CompletableFuture.failedFuture(
            new EventValidationException(Reason.MISSING_SIGNATURE, eventId, null, "No servers expected to sign"));
        }

        var checks = new ArrayList<CompletableFuture<Void>>();
        for (var server : expectedServers) {
            checks.add(verifyServer(event, server, signed));
        }
        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]));
    }

    private ServerSigningKey signingKey(String keyId) {
        return keyStore.getSigningKey(serverName, keyId)
                       .orElseThrow(() -> new IllegalStateException(
                       "No usable signing key: " + keyId + " for: " + serverName));
    }

    private CompletableFuture<Boolean> verifyPair(String eventId, String server, String keyId, String signature,
                                                  byte[] signed) {
        return keyStore.getServerPublicKey(server, keyId).thenApply(key -> {
            try {
                Verifier.verify(signature, signed, key);
                log.debug("Verified signature of: {} by: {} key: {}", eventId, server, keyId);
                return true;
            } catch (InvalidSignatureException e) {
                if (metrics != null) {
                    metrics.signatureFailures().mark();
                }
                log.warn("Invalid signature of: {} by: {} key: {} : {}", eventId, server, keyId, e.getMessage());
                return false;
            }
        }).exceptionally(t -> {
            log.warn("No key: {} of: {} to verify: {} : {}", keyId, server, eventId, t.toString());
            return false;
        });
    }

    private CompletableFuture<Void> verifyServer(Event event, String server, byte[] signed) {
        var eventId = event.eventId();
        var signatures = event.signatures(server);
        if (signatures.isEmpty()) {
            return CompletableFuture.failedFuture(
            new EventValidationException(Reason.MISSING_SIGNATURE, eventId, server, "Event is not signed by: " + server));
        }
        List<CompletableFuture<Boolean>> attempts = new ArrayList<>();
        signatures.forEach((keyId, signature) -> attempts.add(verifyPair(eventId, server, keyId, signature, signed)));
        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).thenAccept(v -> {
            if (attempts.stream().noneMatch(CompletableFuture::join)) {
                throw new CompletionException(new EventValidationException(Reason.SIGNATURE_INVALID, eventId, server,
                                                                           "No valid signature by: " + server));
            }
        });
    }
}
