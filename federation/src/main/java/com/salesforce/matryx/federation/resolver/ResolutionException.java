/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

/**
 * Failure to resolve a server name to an endpoint
 *
 * @author hal.hildebrand
 */
public class ResolutionException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Reason reason;
    private final String serverName;

    public ResolutionException(Reason reason, String serverName, String message) {
        super(message);
        this.reason = reason;
        this.serverName = serverName;
    }

    public ResolutionException(Reason reason, String serverName, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.serverName = serverName;
    }

    public Reason getReason() {
        return reason;
    }

    public String getServerName() {
        return serverName;
    }

    @Override
    public String toString() {
        return "ResolutionException[" + reason + ":" + serverName + "]: " + getMessage();
    }

    public enum Reason {
        /** Resolution was refused as the server is waiting out its backoff */
        BACKOFF,
        DNS,
        INVALID_SERVER_NAME,
        NO_SERVER_FOUND,
        TIMEOUT,
        WELL_KNOWN
    }
}
