/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import com.salesforce.matryx.utils.Hex;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * A computed digest
 *
 * @author hal.hildebrand
 */
public class Digest {
    private final DigestAlgorithm algorithm;
    private final byte[]          hash;

    public Digest(DigestAlgorithm algorithm, byte[] bytes) {
        assert bytes != null && algorithm != null;

        if (bytes.length != algorithm.digestLength()) {
            throw new IllegalArgumentException(
            "Invalid bytes length.  Require: " + algorithm.digestLength() + " found: " + bytes.length);
        }
        this.algorithm = algorithm;
        this.hash = bytes.clone();
    }

    /**
     * Decode the unpadded base 64 form of a digest
     *
     * @throws IllegalArgumentException if the text is not base 64 or of the wrong length
     */
    public static Digest from(DigestAlgorithm algorithm, String base64) {
        return new Digest(algorithm, Base64s.unbase64(base64));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Digest other)) {
            return false;
        }
        return algorithm == other.algorithm && MessageDigest.isEqual(hash, other.hash);
    }

    public DigestAlgorithm getAlgorithm() {
        return algorithm;
    }

    public byte[] getBytes() {
        return hash.clone();
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(hash);
    }

    /**
     * @return the unpadded base 64 encoding
     */
    public String toBase64() {
        return Base64s.base64(hash);
    }

    @Override
    public String toString() {
        return "[" + Hex.hexSubString(hash, 12) + ":" + algorithm.wireName() + "]";
    }
}
