/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

/**
 * Failure to obtain a trusted public key of a server
 *
 * @author hal.hildebrand
 */
public class KeyFetchException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String keyId;
    private final Reason reason;
    private final String serverName;

    public KeyFetchException(Reason reason, String serverName, String keyId, String message) {
        super(message);
        this.reason = reason;
        this.serverName = serverName;
        this.keyId = keyId;
    }

    public KeyFetchException(Reason reason, String serverName, String keyId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.serverName = serverName;
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getServerName() {
        return serverName;
    }

    /**
     * @return true if the server answered, but its answer cannot be trusted
     */
    public boolean isTrustFailure() {
        return switch (reason) {
            case EXPIRED, INVALID_SELF_SIGNATURE, SERVER_NAME_MISMATCH -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return "KeyFetchException[" + reason + ":" + serverName + (keyId == null ? "" : "/" + keyId) + "]: "
        + getMessage();
    }

    public enum Reason {
        EXPIRED, INVALID_SELF_SIGNATURE, KEY_NOT_FOUND, MALFORMED_RESPONSE, RESOLUTION, SERVER_NAME_MISMATCH, TRANSPORT
    }
}
