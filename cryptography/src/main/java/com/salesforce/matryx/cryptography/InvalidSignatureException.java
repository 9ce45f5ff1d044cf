/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

/**
 * The single failure of signature verification. Bad encodings, wrong key or signature lengths and cryptographic
 * mismatches are all reported as this exception; verification never partially succeeds.
 *
 * @author hal.hildebrand
 */
public class InvalidSignatureException extends Exception {

    private static final long serialVersionUID = 1L;

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
