/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import java.util.Base64;

/**
 * Base 64 conversions as they appear on the federation wire. Always the standard alphabet; hashes and signatures are
 * emitted without padding, keys with it. Decoding accepts either form.
 *
 * @author hal.hildebrand
 */
public final class Base64s {

    private static final Base64.Decoder DECODER          = Base64.getDecoder();
    private static final Base64.Encoder ENCODER          = Base64.getEncoder();
    private static final Base64.Encoder UNPADDED_ENCODER = Base64.getEncoder().withoutPadding();

    private Base64s() {
        throw new IllegalStateException("Do not instantiate.");
    }

    /**
     * @return the unpadded standard base 64 encoding of the bytes
     */
    public static String base64(byte[] bytes) {
        return UNPADDED_ENCODER.encodeToString(bytes);
    }

    /**
     * @return the padded standard base 64 encoding of the bytes
     */
    public static String base64Padded(byte[] bytes) {
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Decode padded or unpadded standard base 64
     *
     * @throws IllegalArgumentException if the text is not valid base 64
     */
    public static byte[] unbase64(String text) {
        if (text == null) {
            throw new IllegalArgumentException("null base 64 text");
        }
        return DECODER.decode(text);
    }
}
