/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Key cache persisted in an H2 MVStore. Entries are stored as JSON under <code>serverName + ' ' + keyId</code>, a
 * separator no server name may contain.
 *
 * @author hal.hildebrand
 */
public class MVStoreKeyCacheStore implements KeyCacheStore {
    public static final String LOCAL_KEYS  = "matryx.keys.local";
    public static final String REMOTE_KEYS = "matryx.keys.remote";

    private static final Logger       log    = LoggerFactory.getLogger(MVStoreKeyCacheStore.class);
    private static final ObjectMapper MAPPER = JsonMapper.builder()
                                                         .addModule(new JavaTimeModule())
                                                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                                         .build();

    private final MVMap<String, byte[]> local;
    private final MVMap<String, byte[]> remote;
    private final MVStore               store;

    public MVStoreKeyCacheStore(MVStore store) {
        this.store = store;
        local = store.openMap(LOCAL_KEYS);
        remote = store.openMap(REMOTE_KEYS);
    }

    public static MVStoreKeyCacheStore open(Path file) {
        log.info("Opening key store: {}", file);
        return new MVStoreKeyCacheStore(new MVStore.Builder().fileName(file.toString()).open());
    }

    private static String key(String serverName, String keyId) {
        return serverName + ' ' + keyId;
    }

    private static <T> T read(byte[] bytes, Class<T> type) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read stored " + type.getSimpleName(), e);
        }
    }

    private static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to store " + value.getClass().getSimpleName(), e);
        }
    }

    @Override
    public void close() {
        if (!store.isClosed()) {
            store.close();
        }
    }

    @Override
    public Optional<CachedServerKey> get(String serverName, String keyId) {
        var bytes = remote.get(key(serverName, keyId));
        return bytes == null ? Optional.empty() : Optional.of(read(bytes, CachedServerKey.class));
    }

    @Override
    public List<ServerSigningKey> localKeys(String serverName) {
        var prefix = serverName + ' ';
        var keys = new ArrayList<ServerSigningKey>();
        var cursor = local.cursor(prefix);
        while (cursor.hasNext()) {
            var k = cursor.next();
            if (!k.startsWith(prefix)) {
                break;
            }
            keys.add(read(cursor.getValue(), ServerSigningKey.class));
        }
        return keys;
    }

    @Override
    public void put(String serverName, String keyId, CachedServerKey key) {
        remote.put(key(serverName, keyId), write(key));
        store.commit();
    }

    @Override
    public void saveLocalKey(ServerSigningKey key) {
        local.put(key(key.serverName(), key.keyId()), write(key));
        store.commit();
        log.debug("Stored local key: {}", key);
    }
}
