/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * @author hal.hildebrand
 */
public class FakeDnsClient implements DnsClient {
    public final Map<String, List<InetAddress>> addresses = new ConcurrentHashMap<>();
    public final Set<String>                     hung      = ConcurrentHashMap.newKeySet();
    public final List<String>                   queries   = new CopyOnWriteArrayList<>();
    public final Map<String, List<SrvRecord>>   srv       = new ConcurrentHashMap<>();

    public FakeDnsClient address(String hostname, String... ips) {
        addresses.put(hostname, List.of(ips).stream().map(InetAddresses::forString).toList());
        return this;
    }

    /**
     * Queries of the name, address or SRV, never complete
     */
    public FakeDnsClient hang(String name) {
        hung.add(name);
        return this;
    }

    @Override
    public CompletableFuture<List<InetAddress>> lookup(String hostname) {
        queries.add(hostname);
        if (hung.contains(hostname)) {
            return new CompletableFuture<>();
        }
        var found = addresses.get(hostname);
        if (found == null) {
            return CompletableFuture.failedFuture(new UnknownHostException(hostname));
        }
        return CompletableFuture.completedFuture(found);
    }

    @Override
    public CompletableFuture<List<SrvRecord>> lookupSrv(String name) {
        queries.add(name);
        if (hung.contains(name)) {
            return new CompletableFuture<>();
        }
        return CompletableFuture.completedFuture(srv.getOrDefault(name, List.of()));
    }

    public FakeDnsClient srv(String name, SrvRecord... records) {
        srv.put(name, List.of(records));
        return this;
    }
}
