/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.events.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.cryptography.Base64s;
import com.salesforce.matryx.cryptography.InvalidSignatureException;
import com.salesforce.matryx.cryptography.SignatureAlgorithm;
import com.salesforce.matryx.cryptography.Signer.SignerImpl;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class JsonSignerTest {

    @Test
    public void mergesSignatures() throws Exception {
        var pair = SignatureAlgorithm.DEFAULT.generateKeyPair();
        var signer = new SignerImpl(pair.getPrivate());
        var payload = CanonicalJson.parse(
        "{\"b\":1,\"a\":\"x\",\"unsigned\":{\"age\":5},\"signatures\":{\"other.org\":{\"ed25519:o\":\"sig\"}}}");

        var signed = JsonSigner.sign(payload, "example.org", "ed25519:a_1", signer);
        assertEquals("sig", signed.get("signatures").get("other.org").get("ed25519:o").textValue());
        assertEquals(5, signed.get("unsigned").get("age").intValue());
        var signature = signed.get("signatures").get("example.org").get("ed25519:a_1").textValue();
        assertEquals(86, signature.length());
        assertFalse(signature.endsWith("="));

        var resigned = JsonSigner.sign(signed, "example.org", "ed25519:a_2", signer);
        assertEquals(2, resigned.get("signatures").get("example.org").size());
        assertFalse(payload.has("signatures") && payload.get("signatures").has("example.org"));
    }

    @Test
    public void signingBytes() throws Exception {
        var payload = CanonicalJson.parse("{\"b\":1,\"a\":2,\"unsigned\":{},\"signatures\":{}}");
        assertEquals("{\"a\":2,\"b\":1}", new String(JsonSigner.signingBytes(payload)));
        assertThrows(CanonicalJsonException.class, () -> JsonSigner.signingBytes(CanonicalJson.parse("[1]")));
    }

    @Test
    public void verifyAtLeastOne() throws Exception {
        var pair = SignatureAlgorithm.DEFAULT.generateKeyPair();
        var other = SignatureAlgorithm.DEFAULT.generateKeyPair();
        var key = Base64s.base64Padded(SignatureAlgorithm.DEFAULT.encode(pair.getPublic()));
        var otherKey = Base64s.base64Padded(SignatureAlgorithm.DEFAULT.encode(other.getPublic()));
        var payload = CanonicalJson.parse("{\"method\":\"GET\",\"uri\":\"/_matrix/key/v2/server\"}");

        var signed = JsonSigner.sign(payload, "example.org", "ed25519:good", new SignerImpl(pair.getPrivate()));
        ((ObjectNode) signed.get("signatures").get("example.org")).put("ed25519:bad", "AAAA");

        JsonSigner.verify(signed, "example.org", Map.of("ed25519:good", key, "ed25519:bad", otherKey));
        assertThrows(InvalidSignatureException.class,
                     () -> JsonSigner.verify(signed, "example.org", Map.of("ed25519:good", otherKey)));
        assertThrows(InvalidSignatureException.class,
                     () -> JsonSigner.verify(signed, "example.org", Map.of("ed25519:unknown", key)));
        assertThrows(InvalidSignatureException.class,
                     () -> JsonSigner.verify(signed, "other.org", Map.of("ed25519:good", key)));

        signed.put("uri", "/_matrix/federation/v1/send");
        assertThrows(InvalidSignatureException.class,
                     () -> JsonSigner.verify(signed, "example.org", Map.of("ed25519:good", key)));
    }
}
