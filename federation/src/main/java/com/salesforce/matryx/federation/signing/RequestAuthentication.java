/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.signing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.cryptography.InvalidSignatureException;
import com.salesforce.matryx.cryptography.Verifier;
import com.salesforce.matryx.events.json.CanonicalJson;
import com.salesforce.matryx.events.json.CanonicalJsonException;
import com.salesforce.matryx.events.json.JsonSigner;
import com.salesforce.matryx.federation.keys.KeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Signs outbound federation requests, and verifies inbound ones, using the <code>X-Matrix</code> authorization
 * scheme. The signed object is <code>{method, uri, origin, destination, content}</code>, with <code>content</code>
 * present only for requests that carry a body.
 *
 * @author hal.hildebrand
 */
public class RequestAuthentication {
    public static final String SCHEME = "X-Matrix";

    private static final Logger log = LoggerFactory.getLogger(RequestAuthentication.class);

    private final EventSigningEngine engine;
    private final KeyStore           keyStore;

    public RequestAuthentication(EventSigningEngine engine, KeyStore keyStore) {
        this.engine = engine;
        this.keyStore = keyStore;
    }

    public static String header(String origin, String destination, String keyId, String signature) {
        return SCHEME + " origin=\"" + origin + "\",destination=\"" + destination + "\",key=\"" + keyId + "\",sig=\""
        + signature + "\"";
    }

    /**
     * @param content - the request body, or null
     */
    public static ObjectNode requestJson(String method, String uri, String origin, String destination,
                                         JsonNode content) {
        var request = CanonicalJson.newObject();
        request.put("method", method);
        request.put("uri", uri);
        request.put("origin", origin);
        request.put("destination", destination);
        if (content != null) {
            request.set("content", content.deepCopy());
        }
        return request;
    }

    /**
     * @return the Authorization header value for the request, signed with the current signing key
     */
    public String authorize(String method, String uri, String destination, JsonNode content) {
        var origin = engine.getServerName();
        var keyId = keyStore.getServerSigningKey(origin).keyId();
        var signed = engine.signJson(requestJson(method, uri, origin, destination, content), keyId);
        var signature = signed.path(JsonSigner.SIGNATURES).path(origin).path(keyId).textValue();
        log.trace("Authorized: {} {} to: {} with: {}", method, uri, destination, keyId);
        return header(origin, destination, keyId, signature);
    }

    /**
     * Verify the signature of an inbound request addressed to this server
     *
     * @param origin    - the origin of the Authorization header
     * @param keyId     - the key of the Authorization header
     * @param signature - the signature of the Authorization header
     * @param content   - the request body, or null
     * @return a future failing with an {@link InvalidSignatureException} if the request is not authentic
     */
    public CompletableFuture<Void> verify(String origin, String keyId, String signature, String method, String uri,
                                          JsonNode content) {
        final byte[] signed;
        try {
            signed = CanonicalJson.encode(requestJson(method, uri, origin, engine.getServerName(), content));
        } catch (CanonicalJsonException e) {
            return CompletableFuture.failedFuture(new InvalidSignatureException("Request cannot be encoded", e));
        }
        return keyStore.getServerPublicKey(origin, keyId).thenAccept(key -> {
            try {
                Verifier.verify(signature, signed, key);
            } catch (InvalidSignatureException e) {
                log.warn("Invalid request signature from: {} key: {} : {} {}", origin, keyId, method, uri);
                throw new CompletionException(e);
            }
        });
    }
}
