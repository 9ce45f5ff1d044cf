/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The DNS queries server resolution needs
 *
 * @author hal.hildebrand
 */
public interface DnsClient {

    /**
     * A and AAAA lookup. Completes exceptionally if the name has no address.
     */
    CompletableFuture<List<InetAddress>> lookup(String hostname);

    /**
     * SRV lookup. Completes with an empty list if the name has no SRV records.
     */
    CompletableFuture<List<SrvRecord>> lookupSrv(String name);
}
