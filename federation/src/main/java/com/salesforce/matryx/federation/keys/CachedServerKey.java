/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import java.time.Instant;

/**
 * A remote server's public key as held in the key cache
 *
 * @param publicKey - base 64 Ed25519 public key
 * @param fetchedAt - when the key bundle was fetched
 * @param expiresAt - when the cache entry stops being trusted
 * @author hal.hildebrand
 */
public record CachedServerKey(String publicKey, Instant fetchedAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
