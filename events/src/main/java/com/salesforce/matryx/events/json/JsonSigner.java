/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.events.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.cryptography.InvalidSignatureException;
import com.salesforce.matryx.cryptography.Signer;
import com.salesforce.matryx.cryptography.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Signs and verifies JSON objects. The signed bytes are the canonical encoding of the object without its
 * <code>signatures</code> and <code>unsigned</code> members; signatures are merged into
 * <code>signatures[server][keyId]</code> so that those of other servers and keys survive.
 *
 * @author hal.hildebrand
 */
public final class JsonSigner {
    public static final String SIGNATURES = "signatures";
    public static final String UNSIGNED   = "unsigned";

    private static final Logger log = LoggerFactory.getLogger(JsonSigner.class);

    private JsonSigner() {
        throw new IllegalStateException("Do not instantiate.");
    }

    /**
     * @return a copy of the object carrying the new signature of the server's key
     * @throws CanonicalJsonException if the value is not an object or cannot be canonically encoded
     */
    public static ObjectNode sign(JsonNode value, String serverName, String keyId, Signer signer) {
        var signature = signer.sign(signingBytes(value)).toBase64();
        var signed = ((ObjectNode) value).deepCopy();
        var signatures = signed.get(SIGNATURES) instanceof ObjectNode existing ? existing : signed.putObject(
        SIGNATURES);
        var byServer = signatures.get(serverName) instanceof ObjectNode existing ? existing : signatures.putObject(
        serverName);
        byServer.put(keyId, signature);
        return signed;
    }

    /**
     * @return the canonical bytes covered by the signatures of the object
     * @throws CanonicalJsonException if the value is not an object or cannot be canonically encoded
     */
    public static byte[] signingBytes(JsonNode value) {
        if (value == null || !value.isObject()) {
            throw new CanonicalJsonException("Only objects can be signed");
        }
        var stripped = ((ObjectNode) value).deepCopy();
        stripped.remove(SIGNATURES);
        stripped.remove(UNSIGNED);
        return CanonicalJson.encode(stripped);
    }

    /**
     * Verify the server's signatures on the object. At least one signature made by a key in the supplied map must
     * verify; signatures by keys not in the map are ignored.
     *
     * @param verifyKeys - base 64 public keys of the server, by key id
     * @throws InvalidSignatureException if no signature of the server verifies
     */
    public static void verify(JsonNode value, String serverName, Map<String, String> verifyKeys)
    throws InvalidSignatureException {
        var signatures = value.path(SIGNATURES).path(serverName);
        if (!signatures.isObject() || signatures.isEmpty()) {
            throw new InvalidSignatureException("No signatures by: " + serverName);
        }
        final byte[] bytes;
        try {
            bytes = signingBytes(value);
        } catch (CanonicalJsonException e) {
            throw new InvalidSignatureException("Cannot encode signed object", e);
        }
        InvalidSignatureException failure = null;
        var entries = signatures.fields();
        while (entries.hasNext()) {
            var entry = entries.next();
            var key = verifyKeys.get(entry.getKey());
            if (key == null || !entry.getValue().isTextual()) {
                continue;
            }
            try {
                Verifier.verify(entry.getValue().textValue(), bytes, key);
                return;
            } catch (InvalidSignatureException e) {
                log.warn("Signature of: {} by key: {} failed: {}", serverName, entry.getKey(), e.getMessage());
                failure = e;
            }
        }
        throw failure != null ? failure : new InvalidSignatureException("No signature by a known key of: " + serverName);
    }
}
