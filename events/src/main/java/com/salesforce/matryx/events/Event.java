/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.cryptography.DigestAlgorithm;
import com.salesforce.matryx.events.json.CanonicalJson;

import java.util.*;

/**
 * A room event, as an immutable view over its JSON object. Fields this class has no accessor for are carried
 * untouched, as they take part in the content hash. The <code>hashes</code> and <code>signatures</code> are only
 * ever added once every other field is final; changing anything else requires hashing and signing again.
 *
 * @author hal.hildebrand
 */
public final class Event {
    public static final String AUTH_EVENTS      = "auth_events";
    public static final String CONTENT          = "content";
    public static final String DEPTH            = "depth";
    public static final String EVENT_ID         = "event_id";
    public static final String HASHES           = "hashes";
    public static final String ORIGIN_SERVER_TS = "origin_server_ts";
    public static final String PREV_EVENTS      = "prev_events";
    public static final String ROOM_ID          = "room_id";
    public static final String SENDER           = "sender";
    public static final String SIGNATURES       = "signatures";
    public static final String STATE_KEY        = "state_key";
    public static final String TYPE             = "type";
    public static final String UNSIGNED         = "unsigned";

    private final ObjectNode json;

    private Event(ObjectNode json) {
        this.json = json;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * @return the event viewing a copy of the JSON object
     */
    public static Event from(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("An event must be a JSON object");
        }
        return new Event(((ObjectNode) json).deepCopy());
    }

    /**
     * @throws JsonProcessingException if the text is not a JSON object
     */
    public static Event parse(String json) throws JsonProcessingException {
        var node = CanonicalJson.parse(json);
        if (!node.isObject()) {
            throw new IllegalArgumentException("An event must be a JSON object");
        }
        return new Event((ObjectNode) node);
    }

    public JsonNode authEvents() {
        return json.path(AUTH_EVENTS);
    }

    /**
     * @return the content hash recorded in the event, if any
     */
    public Optional<String> contentHash() {
        var hash = json.path(HASHES).path(DigestAlgorithm.SHA2_256.wireName());
        return hash.isTextual() ? Optional.of(hash.textValue()) : Optional.empty();
    }

    /**
     * @return a copy of the content, empty if the event has none
     */
    public ObjectNode content() {
        var content = json.get(CONTENT);
        return content != null && content.isObject() ? ((ObjectNode) content).deepCopy() : CanonicalJson.newObject();
    }

    public long depth() {
        return json.path(DEPTH).asLong();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Event other && json.equals(other.json);
    }

    public String eventId() {
        return text(EVENT_ID);
    }

    public boolean has(String field) {
        return json.has(field);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    public long originServerTs() {
        return json.path(ORIGIN_SERVER_TS).asLong();
    }

    public JsonNode prevEvents() {
        return json.path(PREV_EVENTS);
    }

    public String roomId() {
        return text(ROOM_ID);
    }

    public String sender() {
        return text(SENDER);
    }

    /**
     * @return the server part of the sender's user id, <code>example.org</code> for <code>@alice:example.org</code>
     */
    public Optional<String> senderDomain() {
        var sender = sender();
        if (sender == null) {
            return Optional.empty();
        }
        var colon = sender.indexOf(':');
        return colon < 0 || colon == sender.length() - 1 ? Optional.empty() : Optional.of(sender.substring(colon + 1));
    }

    /**
     * @return the key id to base 64 signature map of the server, empty if it has not signed
     */
    public Map<String, String> signatures(String serverName) {
        var server = json.path(SIGNATURES).path(serverName);
        if (!server.isObject()) {
            return Collections.emptyMap();
        }
        var result = new TreeMap<String, String>();
        server.fields().forEachRemaining(e -> {
            if (e.getValue().isTextual()) {
                result.put(e.getKey(), e.getValue().textValue());
            }
        });
        return result;
    }

    /**
     * @return the names of every server that has signed the event
     */
    public Set<String> signingServers() {
        var servers = new TreeSet<String>();
        json.path(SIGNATURES).fieldNames().forEachRemaining(servers::add);
        return servers;
    }

    public Optional<String> stateKey() {
        var stateKey = json.get(STATE_KEY);
        return stateKey != null && stateKey.isTextual() ? Optional.of(stateKey.textValue()) : Optional.empty();
    }

    /**
     * @return a copy of the event's JSON object
     */
    public ObjectNode toJson() {
        return json.deepCopy();
    }

    @Override
    public String toString() {
        return "Event[" + eventId() + ":" + type() + "]";
    }

    public String type() {
        return text(TYPE);
    }

    public Optional<JsonNode> unsigned() {
        return Optional.ofNullable(json.get(UNSIGNED)).map(JsonNode::deepCopy);
    }

    /**
     * @return this event with the content hash recorded under <code>hashes</code>
     */
    public Event withContentHash(String hash) {
        var copy = json.deepCopy();
        var hashes = copy.get(HASHES);
        var updated = hashes != null && hashes.isObject() ? (ObjectNode) hashes : copy.putObject(HASHES);
        updated.put(DigestAlgorithm.SHA2_256.wireName(), hash);
        copy.set(HASHES, updated);
        return new Event(copy);
    }

    /**
     * @return this event with the signature merged into <code>signatures</code>, keeping every other server's and
     * key's signature
     */
    public Event withSignature(String serverName, String keyId, String signature) {
        var copy = json.deepCopy();
        var signatures = copy.get(SIGNATURES);
        var all = signatures != null && signatures.isObject() ? (ObjectNode) signatures : copy.putObject(SIGNATURES);
        var server = all.get(serverName);
        var byKey = server != null && server.isObject() ? (ObjectNode) server : all.putObject(serverName);
        byKey.put(keyId, signature);
        copy.set(SIGNATURES, all);
        return new Event(copy);
    }

    /**
     * @return this event without the named top level fields
     */
    public Event without(String... fields) {
        var copy = json.deepCopy();
        copy.remove(Arrays.asList(fields));
        return new Event(copy);
    }

    ObjectNode json() {
        return json;
    }

    private String text(String field) {
        var value = json.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    public static class Builder {
        private final ObjectNode json = CanonicalJson.newObject();

        public Builder authEvents(List<String> eventIds) {
            var array = json.putArray(AUTH_EVENTS);
            eventIds.forEach(array::add);
            return this;
        }

        public Event build() {
            for (var required : new String[] { ROOM_ID, SENDER, TYPE }) {
                if (!json.has(required)) {
                    throw new IllegalStateException("Event is missing: " + required);
                }
            }
            if (!json.has(CONTENT)) {
                json.putObject(CONTENT);
            }
            return new Event(json.deepCopy());
        }

        public Builder content(JsonNode content) {
            if (!content.isObject()) {
                throw new IllegalArgumentException("Content must be a JSON object");
            }
            json.set(CONTENT, content.deepCopy());
            return this;
        }

        public Builder depth(long depth) {
            json.put(DEPTH, depth);
            return this;
        }

        public Builder eventId(String eventId) {
            json.put(EVENT_ID, eventId);
            return this;
        }

        /**
         * Set a top level field with no dedicated setter
         */
        public Builder field(String name, JsonNode value) {
            json.set(name, value.deepCopy());
            return this;
        }

        public Builder originServerTs(long timestamp) {
            json.put(ORIGIN_SERVER_TS, timestamp);
            return this;
        }

        public Builder prevEvents(List<String> eventIds) {
            var array = json.putArray(PREV_EVENTS);
            eventIds.forEach(array::add);
            return this;
        }

        public Builder roomId(String roomId) {
            json.put(ROOM_ID, roomId);
            return this;
        }

        public Builder sender(String sender) {
            json.put(SENDER, sender);
            return this;
        }

        public Builder stateKey(String stateKey) {
            json.put(STATE_KEY, stateKey);
            return this;
        }

        public Builder type(String type) {
            json.put(TYPE, type);
            return this;
        }

        public Builder unsigned(JsonNode unsigned) {
            json.set(UNSIGNED, unsigned.deepCopy());
            return this;
        }
    }
}
