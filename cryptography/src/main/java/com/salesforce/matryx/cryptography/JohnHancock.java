/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import com.salesforce.matryx.utils.Hex;

import java.util.Arrays;
import java.util.Objects;

/**
 * A signature
 *
 * @author hal.hildebrand
 */
public class JohnHancock {

    private final SignatureAlgorithm algorithm;
    private final byte[]             bytes;

    public JohnHancock(SignatureAlgorithm algorithm, byte[] bytes) {
        this.algorithm = Objects.requireNonNull(algorithm);
        this.bytes = Objects.requireNonNull(bytes);
    }

    /**
     * Decode a signature in its wire form
     *
     * @throws InvalidSignatureException if the text is not base 64 or has the wrong length for the algorithm
     */
    public static JohnHancock from(SignatureAlgorithm algorithm, String base64) throws InvalidSignatureException {
        byte[] decoded;
        try {
            decoded = Base64s.unbase64(base64);
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureException("Signature is not valid base 64", e);
        }
        if (decoded.length != algorithm.signatureLength()) {
            throw new InvalidSignatureException(
            "Invalid signature length. Require: " + algorithm.signatureLength() + " found: " + decoded.length);
        }
        return new JohnHancock(algorithm, decoded);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JohnHancock)) {
            return false;
        }
        JohnHancock other = (JohnHancock) obj;
        return algorithm == other.algorithm && Arrays.equals(bytes, other.bytes);
    }

    public SignatureAlgorithm getAlgorithm() {
        return algorithm;
    }

    public byte[] getBytes() {
        return bytes;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + Arrays.hashCode(bytes);
        result = prime * result + Objects.hash(algorithm);
        return result;
    }

    /**
     * @return the unpadded base 64 wire form of the signature
     */
    public String toBase64() {
        return Base64s.base64(bytes);
    }

    @Override
    public String toString() {
        return "Sig[" + Hex.hexSubString(bytes, 12) + ":" + algorithm.curveName() + "]";
    }
}
