/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import com.salesforce.matryx.cryptography.Base64s;
import com.salesforce.matryx.cryptography.SignatureAlgorithm;
import com.salesforce.matryx.cryptography.Signer;
import com.salesforce.matryx.cryptography.Signer.SignerImpl;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;

/**
 * One of this server's own signing keys. Only local keys carry their private half.
 *
 * @author hal.hildebrand
 */
public record ServerSigningKey(String keyId, String serverName, String privateKey, String publicKey,
                               Instant createdAt, Instant expiresAt, boolean active) {

    private static final String       ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom ENTROPY  = new SecureRandom();

    /**
     * Mint a new key with an identifier of the form <code>ed25519:a_XXXX</code>
     */
    public static ServerSigningKey generate(String serverName, Instant now, Duration validity) {
        var algorithm = SignatureAlgorithm.DEFAULT;
        var pair = algorithm.generateKeyPair(ENTROPY);
        var version = new StringBuilder("a_");
        for (int i = 0; i < 4; i++) {
            version.append(ALPHABET.charAt(ENTROPY.nextInt(ALPHABET.length())));
        }
        return new ServerSigningKey(algorithm.keyIdPrefix() + ":" + version, serverName,
                                    Base64s.base64Padded(algorithm.encode(pair.getPrivate())),
                                    Base64s.base64Padded(algorithm.encode(pair.getPublic())), now, now.plus(validity),
                                    true);
    }

    public ServerSigningKey deactivate() {
        return new ServerSigningKey(keyId, serverName, privateKey, publicKey, createdAt, expiresAt, false);
    }

    /**
     * @return true if the key is active and not yet expired
     */
    public boolean isUsable(Instant now) {
        return active && now.isBefore(expiresAt);
    }

    public Signer signer() {
        return SignerImpl.from(SignatureAlgorithm.fromKeyId(keyId), Base64s.unbase64(privateKey));
    }

    @Override
    public String toString() {
        return "SigningKey[" + serverName + "/" + keyId + " expires: " + expiresAt + (active ? "" : " inactive") + "]";
    }
}
