/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Where to connect for a server name, and the identity to present once connected.
 *
 * @param ipAddress        - the address connected to
 * @param port             - the port connected to
 * @param hostHeader       - sent as the HTTP Host header
 * @param tlsHostname      - the name the TLS certificate is validated against, and sent as SNI
 * @param resolutionMethod - how the endpoint was found
 * @author hal.hildebrand
 */
public record ResolvedServer(InetAddress ipAddress, int port, String hostHeader, String tlsHostname,
                             ResolutionMethod resolutionMethod) {

    public InetSocketAddress socketAddress() {
        return new InetSocketAddress(ipAddress, port);
    }

    @Override
    public String toString() {
        return "Resolved[" + ipAddress.getHostAddress() + ":" + port + " host: " + hostHeader + " tls: " + tlsHostname
        + " via: " + resolutionMethod + "]";
    }
}
