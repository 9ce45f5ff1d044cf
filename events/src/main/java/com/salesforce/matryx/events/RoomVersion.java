/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The room versions whose redaction rules differ. Identifiers this server does not know are given the newest rules.
 *
 * @author hal.hildebrand
 */
public enum RoomVersion {
    V1(1), V2(2), V3(3), V4(4), V5(5), V6(6), V7(7), V8(8), V9(9), V10(10), V11(11);

    public static final  RoomVersion LATEST = V11;
    private static final Logger      log    = LoggerFactory.getLogger(RoomVersion.class);

    private final int number;

    RoomVersion(int number) {
        this.number = number;
    }

    /**
     * @param identifier - the room version as it appears in <code>m.room.create</code>, such as <code>"10"</code>
     */
    public static RoomVersion of(String identifier) {
        if (identifier != null) {
            for (var version : values()) {
                if (version.identifier().equals(identifier)) {
                    return version;
                }
            }
        }
        log.warn("Unknown room version: {}, applying the rules of: {}", identifier, LATEST.identifier());
        return LATEST;
    }

    public String identifier() {
        return Integer.toString(number);
    }

    public int number() {
        return number;
    }

    public boolean atLeast(int version) {
        return number >= version;
    }
}
