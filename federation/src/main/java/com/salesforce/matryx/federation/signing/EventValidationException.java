/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.signing;

/**
 * The verdict that an inbound event cannot be trusted
 *
 * @author hal.hildebrand
 */
public class EventValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String eventId;
    private final Reason reason;
    private final String serverName;

    public EventValidationException(Reason reason, String eventId, String serverName, String message) {
        super(message);
        this.reason = reason;
        this.eventId = eventId;
        this.serverName = serverName;
    }

    public EventValidationException(Reason reason, String eventId, String serverName, String message,
                                    Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.eventId = eventId;
        this.serverName = serverName;
    }

    public String getEventId() {
        return eventId;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the server whose signature failed, or null if the failure is not specific to a server
     */
    public String getServerName() {
        return serverName;
    }

    @Override
    public String toString() {
        return "EventValidationException[" + reason + ":" + eventId + (serverName == null ? "" : " by: " + serverName)
        + "]: " + getMessage();
    }

    public enum Reason {
        CONTENT_HASH_MISMATCH, MALFORMED, MISSING_HASH, MISSING_SIGNATURE, SIGNATURE_INVALID
    }
}
