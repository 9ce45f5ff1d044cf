/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A server name split into its hostname and optional port. IPv6 literals carry a port only in their bracketed form;
 * a bare hostname holding more than one colon is taken whole, with no port.
 *
 * @author hal.hildebrand
 */
public record ServerName(String original, String hostname, OptionalInt port) {

    public static final int DEFAULT_PORT = 8448;
    public static final int MAX_HOSTNAME = 255;
    public static final int MAX_LABEL    = 63;

    /**
     * @throws ResolutionException with reason INVALID_SERVER_NAME if the name cannot be a server name
     */
    public static ServerName parse(String serverName) throws ResolutionException {
        if (serverName == null || serverName.isEmpty()) {
            throw invalid(serverName, "empty server name");
        }
        if (serverName.contains("://")) {
            throw invalid(serverName, "server name must not carry a scheme");
        }
        if (serverName.startsWith(".") || serverName.endsWith(".")) {
            throw invalid(serverName, "server name must not start or end with a dot");
        }

        if (serverName.startsWith("[")) {
            var close = serverName.indexOf(']');
            if (close < 0) {
                throw invalid(serverName, "unterminated IPv6 literal");
            }
            var host = serverName.substring(1, close);
            if (!InetAddresses.isInetAddress(host) || !host.contains(":")) {
                throw invalid(serverName, "not an IPv6 literal: " + host);
            }
            var rest = serverName.substring(close + 1);
            if (rest.isEmpty()) {
                return new ServerName(serverName, host, OptionalInt.empty());
            }
            if (!rest.startsWith(":")) {
                throw invalid(serverName, "unexpected text after IPv6 literal");
            }
            return new ServerName(serverName, host, OptionalInt.of(port(serverName, rest.substring(1))));
        }

        var first = serverName.indexOf(':');
        if (first < 0) {
            return new ServerName(serverName, hostname(serverName, serverName), OptionalInt.empty());
        }
        if (first != serverName.lastIndexOf(':')) {
            // bare IPv6
            if (!InetAddresses.isInetAddress(serverName)) {
                throw invalid(serverName, "not an IPv6 literal");
            }
            return new ServerName(serverName, serverName, OptionalInt.empty());
        }
        var host = serverName.substring(0, first);
        if (host.isEmpty()) {
            throw invalid(serverName, "empty hostname");
        }
        return new ServerName(serverName, hostname(serverName, host),
                              OptionalInt.of(port(serverName, serverName.substring(first + 1))));
    }

    /**
     * A hostname is an IPv4 literal or a DNS name of letters, digits, hyphens and dots, with no empty label
     */
    private static String hostname(String serverName, String host) throws ResolutionException {
        if (host.length() > MAX_HOSTNAME) {
            throw invalid(serverName, "hostname too long");
        }
        var label = 0;
        for (int i = 0; i < host.length(); i++) {
            var c = host.charAt(i);
            if (c == '.') {
                if (label == 0) {
                    throw invalid(serverName, "empty label");
                }
                label = 0;
                continue;
            }
            if (!(c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9' || c == '-')) {
                throw invalid(serverName, "illegal character: '" + c + "'");
            }
            if (++label > MAX_LABEL) {
                throw invalid(serverName, "label too long");
            }
        }
        if (label == 0) {
            throw invalid(serverName, "empty label");
        }
        return host;
    }

    private static ResolutionException invalid(String serverName, String message) {
        return new ResolutionException(ResolutionException.Reason.INVALID_SERVER_NAME, serverName, message);
    }

    private static int port(String serverName, String text) throws ResolutionException {
        if (text.isEmpty() || text.length() > 5 || !text.chars().allMatch(Character::isDigit)) {
            throw invalid(serverName, "invalid port: " + text);
        }
        var port = Integer.parseInt(text);
        if (port < 1 || port > 65535) {
            throw invalid(serverName, "port out of range: " + port);
        }
        return port;
    }

    /**
     * @return the address, if the hostname is an IP literal
     */
    public Optional<InetAddress> ipLiteral() {
        return InetAddresses.isInetAddress(hostname) ? Optional.of(InetAddresses.forString(hostname))
                                                     : Optional.empty();
    }

    public int portOrDefault() {
        return port.orElse(DEFAULT_PORT);
    }

    @Override
    public String toString() {
        return original;
    }
}
