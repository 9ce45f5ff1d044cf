/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import java.security.PublicKey;

import static java.util.Objects.requireNonNull;

/**
 * Verifies a signature using a given key
 *
 * @author hal.hildebrand
 */
public interface Verifier {

    /**
     * Verify a wire encoded signature over the bytes, using the wire encoded Ed25519 public key.
     *
     * @param signature - base 64 signature, padded or not
     * @param message   - the signed bytes
     * @param publicKey - base 64 public key, padded or not
     * @throws InvalidSignatureException on any decoding failure, length mismatch or cryptographic mismatch
     */
    static void verify(String signature, byte[] message, String publicKey) throws InvalidSignatureException {
        from(SignatureAlgorithm.ED_25519, publicKey).verify(JohnHancock.from(SignatureAlgorithm.ED_25519, signature),
                                                            message);
    }

    /**
     * @return the verifier for the wire encoded public key
     * @throws InvalidSignatureException if the key is not valid base 64 or not a valid key
     */
    static Verifier from(SignatureAlgorithm algorithm, String publicKey) throws InvalidSignatureException {
        byte[] decoded;
        try {
            decoded = Base64s.unbase64(publicKey);
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureException("Public key is not valid base 64", e);
        }
        if (decoded.length != algorithm.publicKeyLength()) {
            throw new InvalidSignatureException(
            "Invalid public key length. Require: " + algorithm.publicKeyLength() + " found: " + decoded.length);
        }
        try {
            return new DefaultVerifier(algorithm.publicKey(decoded));
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureException("Invalid public key", e);
        }
    }

    void verify(JohnHancock signature, byte[] message) throws InvalidSignatureException;

    class DefaultVerifier implements Verifier {
        private final SignatureAlgorithm algorithm;
        private final PublicKey          key;

        public DefaultVerifier(PublicKey key) {
            this.key = requireNonNull(key);
            this.algorithm = SignatureAlgorithm.lookup(key);
        }

        public PublicKey getKey() {
            return key;
        }

        @Override
        public String toString() {
            return "V[" + Base64s.base64(algorithm.encode(key)) + "]";
        }

        @Override
        public void verify(JohnHancock signature, byte[] message) throws InvalidSignatureException {
            algorithm.verify(key, signature, message);
        }
    }
}
