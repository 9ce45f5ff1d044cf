/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.events;

import com.salesforce.matryx.cryptography.Digest;
import com.salesforce.matryx.cryptography.DigestAlgorithm;
import com.salesforce.matryx.events.json.CanonicalJson;

import static com.salesforce.matryx.events.Event.*;

/**
 * Computes the hashes of an event
 *
 * @author hal.hildebrand
 */
public final class ContentHasher {

    private static final DigestAlgorithm ALGORITHM = DigestAlgorithm.SHA2_256;

    private ContentHasher() {
        throw new IllegalStateException("Do not instantiate.");
    }

    /**
     * @return the unpadded base 64 SHA-256 of the canonical event without <code>unsigned</code>,
     * <code>signatures</code> and <code>hashes</code>
     */
    public static String contentHash(Event event) {
        return contentDigest(event).toBase64();
    }

    public static Digest contentDigest(Event event) {
        var json = event.toJson();
        json.remove(UNSIGNED);
        json.remove(SIGNATURES);
        json.remove(HASHES);
        return ALGORITHM.digest(CanonicalJson.encode(json));
    }

    /**
     * @return the unpadded base 64 SHA-256 of the canonical redacted event without <code>signatures</code> and
     * <code>unsigned</code>
     */
    public static String referenceHash(Event event, RoomVersion version) {
        var redacted = Redactor.redact(event, version);
        redacted.remove(SIGNATURES);
        redacted.remove(UNSIGNED);
        return ALGORITHM.digest(CanonicalJson.encode(redacted)).toBase64();
    }
}
