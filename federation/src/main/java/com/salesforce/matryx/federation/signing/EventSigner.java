/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.signing;

import com.salesforce.matryx.events.Event;
import com.salesforce.matryx.federation.keys.KeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Signs the events this server originates with its default signing key, after checking they are complete and really
 * are this server's to sign.
 *
 * @author hal.hildebrand
 */
public class EventSigner {
    public static final Duration MAX_CLOCK_SKEW = Duration.ofHours(1);

    private static final Logger log = LoggerFactory.getLogger(EventSigner.class);

    private final Clock              clock;
    private final String             defaultKeyId;
    private final EventSigningEngine engine;
    private final KeyStore           keyStore;

    /**
     * @param defaultKeyId - the key to sign with, or null to use the newest usable key
     */
    public EventSigner(EventSigningEngine engine, KeyStore keyStore, String defaultKeyId, Clock clock) {
        this.engine = engine;
        this.keyStore = keyStore;
        this.defaultKeyId = defaultKeyId;
        this.clock = clock;
    }

    private static void require(String value, String field, Event event) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Outbound event has no " + field + ": " + event.toJson());
        }
    }

    /**
     * @throws IllegalArgumentException if the event is incomplete or not sent by a user of this server
     * @throws IllegalStateException    if this server has already signed the event
     */
    public Event sign(Event event) {
        var keyId = keyId();
        check(event);
        return engine.signEvent(event, keyId);
    }

    /**
     * Sign every event with the same key. No event is signed unless all of them pass the outbound checks.
     */
    public List<Event> signAll(List<Event> events) {
        events.forEach(this::check);
        var keyId = keyId();
        var signed = events.stream().map(e -> engine.signEvent(e, keyId)).toList();
        log.debug("Signed: {} events with: {}", signed.size(), keyId);
        return signed;
    }

    void check(Event event) {
        require(event.eventId(), "event_id", event);
        require(event.roomId(), "room_id", event);
        require(event.sender(), "sender", event);
        require(event.type(), "type", event);

        var serverName = engine.getServerName();
        var domain = event.senderDomain();
        if (domain.isEmpty() || !domain.get().equals(serverName)) {
            throw new IllegalArgumentException(
            "Sender: " + event.sender() + " of: " + event.eventId() + " is not a user of: " + serverName);
        }
        if (!event.signatures(serverName).isEmpty()) {
            throw new IllegalStateException("Event: " + event.eventId() + " is already signed by: " + serverName);
        }
        var skew = Duration.between(Instant.ofEpochMilli(event.originServerTs()), clock.instant()).abs();
        if (skew.compareTo(MAX_CLOCK_SKEW) > 0) {
            log.warn("Event: {} origin_server_ts is: {} from now", event.eventId(), skew);
        }
    }

    private String keyId() {
        return defaultKeyId != null ? defaultKeyId : keyStore.getServerSigningKey(engine.getServerName()).keyId();
    }
}
