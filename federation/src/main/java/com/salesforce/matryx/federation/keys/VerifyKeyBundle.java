/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.cryptography.InvalidSignatureException;
import com.salesforce.matryx.cryptography.SignatureAlgorithm;
import com.salesforce.matryx.cryptography.Signer;
import com.salesforce.matryx.events.json.CanonicalJson;
import com.salesforce.matryx.events.json.JsonSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The signed key bundle a server publishes at <code>/_matrix/key/v2/server</code>. The raw JSON is retained, as the
 * self-signature covers every member of it.
 *
 * @author hal.hildebrand
 */
public class VerifyKeyBundle {
    public static final String EXPIRED_TS      = "expired_ts";
    public static final String KEY             = "key";
    public static final String OLD_VERIFY_KEYS = "old_verify_keys";
    public static final String SERVER_NAME     = "server_name";
    public static final String VALID_UNTIL_TS  = "valid_until_ts";
    public static final String VERIFY_KEYS     = "verify_keys";

    private static final Logger log = LoggerFactory.getLogger(VerifyKeyBundle.class);

    private final ObjectNode                json;
    private final Map<String, OldVerifyKey> oldVerifyKeys;
    private final String                    serverName;
    private final Instant                   validUntil;
    private final Map<String, String>       verifyKeys;

    private VerifyKeyBundle(ObjectNode json, String serverName, Map<String, String> verifyKeys,
                            Map<String, OldVerifyKey> oldVerifyKeys, Instant validUntil) {
        this.json = json;
        this.serverName = serverName;
        this.verifyKeys = Collections.unmodifiableMap(verifyKeys);
        this.oldVerifyKeys = Collections.unmodifiableMap(oldVerifyKeys);
        this.validUntil = validUntil;
    }

    /**
     * @return the bundle signed by the key
     */
    public static VerifyKeyBundle create(String serverName, Map<String, String> verifyKeys,
                                         Map<String, OldVerifyKey> oldVerifyKeys, Instant validUntil, String keyId,
                                         Signer signer) {
        var json = CanonicalJson.newObject();
        json.put(SERVER_NAME, serverName);
        var verify = json.putObject(VERIFY_KEYS);
        verifyKeys.forEach((id, key) -> verify.putObject(id).put(KEY, key));
        var old = json.putObject(OLD_VERIFY_KEYS);
        oldVerifyKeys.forEach((id, key) -> old.putObject(id).put(KEY, key.key()).put(EXPIRED_TS, key.expiredAt()
                                                                                                    .toEpochMilli()));
        json.put(VALID_UNTIL_TS, validUntil.toEpochMilli());
        var signed = JsonSigner.sign(json, serverName, keyId, signer);
        return new VerifyKeyBundle(signed, serverName, new LinkedHashMap<>(verifyKeys),
                                   new LinkedHashMap<>(oldVerifyKeys), Instant.ofEpochMilli(validUntil.toEpochMilli()));
    }

    /**
     * @throws KeyFetchException if the JSON is not a well formed key bundle
     */
    public static VerifyKeyBundle from(JsonNode json) throws KeyFetchException {
        if (json == null || !json.isObject()) {
            throw malformed(null, "Key bundle is not an object");
        }
        var name = json.path(SERVER_NAME);
        if (!name.isTextual() || name.textValue().isEmpty()) {
            throw malformed(null, "Key bundle has no server name");
        }
        var serverName = name.textValue();
        var validUntil = json.path(VALID_UNTIL_TS);
        if (!validUntil.isIntegralNumber()) {
            throw malformed(serverName, "Key bundle has no valid_until_ts");
        }

        var verifyKeys = new LinkedHashMap<String, String>();
        var verify = json.path(VERIFY_KEYS);
        if (!verify.isObject()) {
            throw malformed(serverName, "Key bundle has no verify_keys");
        }
        var entries = verify.fields();
        while (entries.hasNext()) {
            var entry = entries.next();
            var key = entry.getValue().path(KEY);
            if (!key.isTextual()) {
                throw malformed(serverName, "Verify key: " + entry.getKey() + " has no key");
            }
            if (!supported(entry.getKey())) {
                log.debug("Ignoring verify key: {} of: {}", entry.getKey(), serverName);
                continue;
            }
            verifyKeys.put(entry.getKey(), key.textValue());
        }

        var oldVerifyKeys = new LinkedHashMap<String, OldVerifyKey>();
        var old = json.path(OLD_VERIFY_KEYS);
        var oldEntries = old.isObject() ? old.fields() : Collections.<Map.Entry<String, JsonNode>>emptyIterator();
        while (oldEntries.hasNext()) {
            var entry = oldEntries.next();
            var key = entry.getValue().path(KEY);
            var expired = entry.getValue().path(EXPIRED_TS);
            if (key.isTextual() && expired.isIntegralNumber() && supported(entry.getKey())) {
                oldVerifyKeys.put(entry.getKey(),
                                  new OldVerifyKey(key.textValue(), Instant.ofEpochMilli(expired.longValue())));
            }
        }

        return new VerifyKeyBundle(((ObjectNode) json).deepCopy(), serverName, verifyKeys, oldVerifyKeys,
                                   Instant.ofEpochMilli(validUntil.longValue()));
    }

    private static KeyFetchException malformed(String serverName, String message) {
        return new KeyFetchException(KeyFetchException.Reason.MALFORMED_RESPONSE, serverName, null, message);
    }

    private static boolean supported(String keyId) {
        try {
            SignatureAlgorithm.fromKeyId(keyId);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public Map<String, OldVerifyKey> oldVerifyKeys() {
        return oldVerifyKeys;
    }

    public String serverName() {
        return serverName;
    }

    public ObjectNode toJson() {
        return json.deepCopy();
    }

    @Override
    public String toString() {
        return "VerifyKeyBundle[" + serverName + " keys: " + verifyKeys.keySet() + " valid until: " + validUntil + "]";
    }

    public Instant validUntil() {
        return validUntil;
    }

    public Map<String, String> verifyKeys() {
        return verifyKeys;
    }

    /**
     * Verify the bundle is signed by at least one of its own verify keys
     */
    public void verifySelfSignature() throws InvalidSignatureException {
        JsonSigner.verify(json, serverName, verifyKeys);
    }

    public record OldVerifyKey(String key, Instant expiredAt) {
    }
}
