/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.signing;

import com.salesforce.matryx.cryptography.InvalidSignatureException;
import com.salesforce.matryx.events.json.CanonicalJson;
import com.salesforce.matryx.federation.MutableClock;
import com.salesforce.matryx.federation.keys.InMemoryKeyCacheStore;
import com.salesforce.matryx.federation.keys.KeyStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author hal.hildebrand
 */
public class RequestAuthenticationTest {
    private static final Pattern HEADER = Pattern.compile(
    "X-Matrix origin=\"([^\"]+)\",destination=\"([^\"]+)\",key=\"([^\"]+)\",sig=\"([^\"]+)\"");

    @Test
    public void signAndVerify() throws Exception {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var senderKeys = KeyStore.newBuilder().setStore(new InMemoryKeyCacheStore(clock)).setClock(clock).build();
        var sender = new RequestAuthentication(new EventSigningEngine("origin.org", senderKeys, null), senderKeys);
        var key = senderKeys.getServerSigningKey("origin.org");

        var body = CanonicalJson.parse("{\"pdus\":[],\"edus\":[]}");
        var header = sender.authorize("PUT", "/_matrix/federation/v1/send/1", "destination.org", body);
        var matcher = HEADER.matcher(header);
        assertTrue(matcher.matches(), header);
        assertEquals("origin.org", matcher.group(1));
        assertEquals("destination.org", matcher.group(2));
        assertEquals(key.keyId(), matcher.group(3));
        var signature = matcher.group(4);

        var receiverKeys = mock(KeyStore.class);
        when(receiverKeys.getServerPublicKey("origin.org", key.keyId())).thenReturn(
        CompletableFuture.completedFuture(key.publicKey()));
        var receiver = new RequestAuthentication(new EventSigningEngine("destination.org", receiverKeys, null),
                                                 receiverKeys);

        receiver.verify("origin.org", key.keyId(), signature, "PUT", "/_matrix/federation/v1/send/1", body)
                .get(5, TimeUnit.SECONDS);

        var tampered = receiver.verify("origin.org", key.keyId(), signature, "PUT", "/_matrix/federation/v1/send/2",
                                       body);
        var e = assertThrows(ExecutionException.class, () -> tampered.get(5, TimeUnit.SECONDS));
        assertThat(e.getCause(), instanceOf(InvalidSignatureException.class));

        var bodiless = receiver.verify("origin.org", key.keyId(), signature, "PUT", "/_matrix/federation/v1/send/1",
                                       null);
        assertThrows(ExecutionException.class, () -> bodiless.get(5, TimeUnit.SECONDS));
    }

    @Test
    public void requestJson() {
        var request = RequestAuthentication.requestJson("GET", "/_matrix/key/v2/server", "a.org", "b.org", null);
        assertEquals("{\"destination\":\"b.org\",\"method\":\"GET\",\"origin\":\"a.org\",\"uri\":\"/_matrix/key/v2/server\"}",
                     CanonicalJson.encodeToString(request));
    }
}
