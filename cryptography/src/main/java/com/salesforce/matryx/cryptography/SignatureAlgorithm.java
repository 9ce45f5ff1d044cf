/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;

/**
 * Ye Enumeration of ye olde thyme Signature alorithms. Federation only speaks Ed25519, identified on the wire by the
 * <code>ed25519</code> key id prefix.
 *
 * @author hal.hildebrand
 */
public enum SignatureAlgorithm {

    ED_25519 {
        private final EdDSAOperations ops = new EdDSAOperations(this);

        @Override
        public String algorithmName() {
            return EdDSAOperations.EDDSA_ALGORITHM_NAME;
        }

        @Override
        public String curveName() {
            return "ed25519";
        }

        @Override
        public byte[] encode(PublicKey publicKey) {
            return ops.encode(publicKey);
        }

        @Override
        public byte[] encode(PrivateKey privateKey) {
            return ops.encode(privateKey);
        }

        @Override
        public KeyPair generateKeyPair() {
            return ops.generateKeyPair();
        }

        @Override
        public KeyPair generateKeyPair(SecureRandom secureRandom) {
            return ops.generateKeyPair(secureRandom);
        }

        @Override
        public String keyIdPrefix() {
            return "ed25519";
        }

        @Override
        public PrivateKey privateKey(byte[] bytes) {
            return ops.privateKey(bytes);
        }

        @Override
        public int privateKeyLength() {
            return 32;
        }

        @Override
        public PublicKey publicKey(byte[] bytes) {
            return ops.publicKey(bytes);
        }

        @Override
        public int publicKeyLength() {
            return 32;
        }

        @Override
        public JohnHancock sign(PrivateKey privateKey, byte[] message) {
            return ops.sign(privateKey, message);
        }

        @Override
        public JohnHancock signature(byte[] signatureBytes) {
            return ops.signature(signatureBytes);
        }

        @Override
        public String signatureInstanceName() {
            return "Ed25519";
        }

        @Override
        public int signatureLength() {
            return 64;
        }

        @Override
        public String toString() {
            return ops.toString();
        }

        @Override
        protected boolean verify(PublicKey publicKey, byte[] signature, byte[] message)
        throws GeneralSecurityException {
            return ops.verify(publicKey, signature, message);
        }
    };

    public static final SignatureAlgorithm DEFAULT = ED_25519;

    /**
     * @return the algorithm named by the prefix of a key id, such as <code>ed25519:a_XXXX</code>
     * @throws IllegalArgumentException if the key id names no supported algorithm
     */
    public static SignatureAlgorithm fromKeyId(String keyId) {
        if (keyId != null) {
            var colon = keyId.indexOf(':');
            if (colon > 0 && colon < keyId.length() - 1) {
                var prefix = keyId.substring(0, colon);
                for (var algorithm : values()) {
                    if (algorithm.keyIdPrefix().equals(prefix)) {
                        return algorithm;
                    }
                }
            }
        }
        throw new IllegalArgumentException("Unsupported key id: " + keyId);
    }

    public static SignatureAlgorithm lookup(PrivateKey privateKey) {
        return switch (privateKey.getAlgorithm()) {
            case "Ed25519" -> ED_25519;
            case "EdDSA" -> ED_25519;
            default -> throw new IllegalArgumentException("Unknown algorithm: " + privateKey.getAlgorithm());
        };
    }

    public static SignatureAlgorithm lookup(PublicKey publicKey) {
        return switch (publicKey.getAlgorithm()) {
            case "Ed25519" -> ED_25519;
            case "EdDSA" -> ED_25519;
            default -> throw new IllegalArgumentException("Unknown algorithm: " + publicKey.getAlgorithm());
        };
    }

    abstract public String algorithmName();

    abstract public String curveName();

    abstract public byte[] encode(PublicKey publicKey);

    abstract public byte[] encode(PrivateKey privateKey);

    abstract public KeyPair generateKeyPair();

    abstract public KeyPair generateKeyPair(SecureRandom secureRandom);

    abstract public String keyIdPrefix();

    abstract public PrivateKey privateKey(byte[] bytes);

    abstract public int privateKeyLength();

    abstract public PublicKey publicKey(byte[] bytes);

    abstract public int publicKeyLength();

    abstract public JohnHancock sign(PrivateKey privateKey, byte[] message);

    abstract public JohnHancock signature(byte[] signatureBytes);

    abstract public String signatureInstanceName();

    abstract public int signatureLength();

    /**
     * Verify the raw signature over the message, failing closed.
     *
     * @throws InvalidSignatureException if the key or signature is malformed, or the signature does not match
     */
    public void verify(PublicKey publicKey, JohnHancock signature, byte[] message) throws InvalidSignatureException {
        if (signature.getAlgorithm() != this) {
            throw new InvalidSignatureException("Signature algorithm: " + signature.getAlgorithm() + " is not: " + this);
        }
        var bytes = signature.getBytes();
        if (bytes.length != signatureLength()) {
            throw new InvalidSignatureException(
            "Invalid signature length. Require: " + signatureLength() + " found: " + bytes.length);
        }
        boolean verified;
        try {
            verified = verify(publicKey, bytes, message);
        } catch (GeneralSecurityException | RuntimeException e) {
            throw new InvalidSignatureException("Unable to verify signature", e);
        }
        if (!verified) {
            throw new InvalidSignatureException("Signature does not match");
        }
    }

    abstract protected boolean verify(PublicKey publicKey, byte[] signature, byte[] message)
    throws GeneralSecurityException;
}
