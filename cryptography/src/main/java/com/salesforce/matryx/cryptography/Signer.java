/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;

import static java.util.Objects.requireNonNull;

/**
 * Produces signatures using a given key
 *
 * @author hal.hildebrand
 */
public interface Signer {

    SignatureAlgorithm algorithm();

    JohnHancock sign(byte[] message);

    default JohnHancock sign(String msg) {
        return sign(msg.getBytes(StandardCharsets.UTF_8));
    }

    class SignerImpl implements Signer {
        private final SignatureAlgorithm algorithm;
        private final PrivateKey         privateKey;

        public SignerImpl(PrivateKey privateKey) {
            this.privateKey = requireNonNull(privateKey);
            algorithm = SignatureAlgorithm.lookup(privateKey);
        }

        /**
         * @param seed - the raw private key bytes
         */
        public static SignerImpl from(SignatureAlgorithm algorithm, byte[] seed) {
            return new SignerImpl(algorithm.privateKey(seed));
        }

        @Override
        public SignatureAlgorithm algorithm() {
            return algorithm;
        }

        @Override
        public JohnHancock sign(byte[] message) {
            return algorithm.sign(privateKey, message);
        }
    }
}
