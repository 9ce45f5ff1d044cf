/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Map;

/**
 * Enumerations of digest algorithms
 *
 * @author hal.hildebrand
 */
public enum DigestAlgorithm {

    SHA2_256 {
        @Override
        public String algorithmName() {
            return "SHA-256";
        }

        @Override
        public int digestLength() {
            return 32;
        }

        @Override
        public String wireName() {
            return "sha256";
        }
    };

    public static final  DigestAlgorithm          DEFAULT        = SHA2_256;
    private static final ThreadLocal<DigestCache> MESSAGE_DIGEST = ThreadLocal.withInitial(() -> new DigestCache());

    abstract public String algorithmName();

    public Digest digest(byte[] bytes) {
        return new Digest(this, hashOf(bytes));
    }

    abstract public int digestLength();

    public byte[] hashOf(byte[] bytes) {
        MessageDigest md = lookupJCA();
        md.reset();
        md.update(bytes);
        return md.digest();
    }

    /**
     * @return the name of the algorithm as a key in an event's <code>hashes</code> object
     */
    abstract public String wireName();

    protected MessageDigest createJCA() {
        try {
            return MessageDigest.getInstance(algorithmName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(
            "Unable to retrieve " + algorithmName() + " Message DigestAlgorithm instance", e);
        }
    }

    private MessageDigest lookupJCA() {
        return MESSAGE_DIGEST.get().lookup(this);
    }

    private static class DigestCache {
        private final Map<DigestAlgorithm, MessageDigest> cache = new HashMap<>();

        public MessageDigest lookup(DigestAlgorithm da) {
            return cache.computeIfAbsent(da, k -> k.createJCA());
        }
    }
}
