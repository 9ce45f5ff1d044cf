/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import java.util.List;
import java.util.Optional;

/**
 * The persisted state of the key store: the public keys of remote servers, by server and key id, and this server's
 * own signing keys.
 *
 * @author hal.hildebrand
 */
public interface KeyCacheStore extends AutoCloseable {

    @Override
    default void close() {
    }

    /**
     * @return the cached key, expired or not
     */
    Optional<CachedServerKey> get(String serverName, String keyId);

    /**
     * @return the signing keys of the local server, active or not
     */
    List<ServerSigningKey> localKeys(String serverName);

    void put(String serverName, String keyId, CachedServerKey key);

    /**
     * Insert or replace the local signing key
     */
    void saveLocalKey(ServerSigningKey key);
}
