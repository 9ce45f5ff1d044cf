/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.events.json.CanonicalJson;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.salesforce.matryx.events.Event.*;

/**
 * Strips an event down to the fields that survive redaction under a room version. The reference hash and the
 * signatures of an event are computed over this form, so the content table here must agree exactly with every other
 * server in the room.
 *
 * @author hal.hildebrand
 */
public final class Redactor {

    /**
     * Top level fields kept by redaction, when present
     */
    public static final List<String> PRESERVED_FIELDS = List.of(EVENT_ID, TYPE, ROOM_ID, SENDER, ORIGIN_SERVER_TS,
                                                                DEPTH, PREV_EVENTS, AUTH_EVENTS, STATE_KEY, HASHES);

    private static final Set<String> POWER_LEVELS = Set.of("ban", "events", "events_default", "kick", "redact",
                                                           "state_default", "users", "users_default");

    private Redactor() {
        throw new IllegalStateException("Do not instantiate.");
    }

    /**
     * @return the content keys that survive redaction of the event type in the room version
     */
    public static ContentPolicy contentPolicy(String type, RoomVersion version) {
        if (type == null) {
            return ContentPolicy.NONE;
        }
        return switch (type) {
            case "m.room.member" -> version.atLeast(9) ? ContentPolicy.of("membership",
                                                                          "join_authorised_via_users_server")
                                                       : ContentPolicy.of("membership");
            case "m.room.create" -> version.atLeast(11) ? ContentPolicy.ALL
                                                        : ContentPolicy.of("creator", "m.federate", "room_version");
            case "m.room.join_rules" -> version.atLeast(9) ? ContentPolicy.of("join_rule", "allow")
                                                           : ContentPolicy.of("join_rule");
            case "m.room.power_levels" -> version.atLeast(11) ? ContentPolicy.of(POWER_LEVELS, "invite")
                                                              : ContentPolicy.of(POWER_LEVELS);
            case "m.room.history_visibility" -> ContentPolicy.of("history_visibility");
            case "m.room.aliases" -> version.atLeast(6) ? ContentPolicy.NONE : ContentPolicy.of("aliases");
            case "m.room.redaction" -> version.atLeast(11) ? ContentPolicy.of("redacts") : ContentPolicy.NONE;
            default -> ContentPolicy.NONE;
        };
    }

    /**
     * Redact the event. The <code>content</code> field is dropped entirely when nothing in it survives, which keeps
     * redaction idempotent.
     */
    public static ObjectNode redact(Event event, RoomVersion version) {
        var source = event.json();
        var redacted = preserved(source);

        var content = source.get(CONTENT);
        if (content != null && content.isObject()) {
            var kept = contentPolicy(event.type(), version).apply((ObjectNode) content);
            if (!kept.isEmpty()) {
                redacted.set(CONTENT, kept);
            }
        }
        return redacted;
    }

    /**
     * The view of an event that is signed: the preserved top level fields and the content verbatim. Neither
     * <code>signatures</code> nor <code>unsigned</code> take part.
     */
    public static ObjectNode signingView(Event event) {
        var source = event.json();
        var view = preserved(source);
        var content = source.get(CONTENT);
        if (content != null) {
            view.set(CONTENT, content.deepCopy());
        }
        return view;
    }

    private static ObjectNode preserved(ObjectNode source) {
        var result = CanonicalJson.newObject();
        for (var field : PRESERVED_FIELDS) {
            JsonNode value = source.get(field);
            if (value != null) {
                result.set(field, value.deepCopy());
            }
        }
        return result;
    }

    /**
     * The content keys that survive redaction
     */
    public record ContentPolicy(boolean all, Set<String> keys) {
        public static final ContentPolicy ALL  = new ContentPolicy(true, Set.of());
        public static final ContentPolicy NONE = new ContentPolicy(false, Set.of());

        public static ContentPolicy of(String... keys) {
            return new ContentPolicy(false, Set.of(keys));
        }

        public static ContentPolicy of(Set<String> keys, String... additional) {
            var union = new HashSet<>(keys);
            union.addAll(List.of(additional));
            return new ContentPolicy(false, Set.copyOf(union));
        }

        public ObjectNode apply(ObjectNode content) {
            if (all) {
                return content.deepCopy();
            }
            var kept = CanonicalJson.newObject();
            for (var key : keys) {
                var value = content.get(key);
                if (value != null) {
                    kept.set(key, value.deepCopy());
                }
            }
            return kept;
        }

        public boolean preserves(String key) {
            return all || keys.contains(key);
        }
    }
}
