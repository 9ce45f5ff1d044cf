/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import com.salesforce.matryx.events.json.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Well-known lookup over the JDK HTTP client. Redirects are followed, up to the client's limit of five. Any non 2xx
 * status is a confirmed absence of delegation.
 *
 * @author hal.hildebrand
 */
public class HttpWellKnownClient implements WellKnownClient {
    public static final String PATH = "/.well-known/matrix/server";

    private static final Logger log = LoggerFactory.getLogger(HttpWellKnownClient.class);

    private final HttpClient client;
    private final Duration   timeout;
    private final String     userAgent;

    public HttpWellKnownClient(Duration timeout, String userAgent) {
        this(HttpClient.newBuilder()
                       .followRedirects(HttpClient.Redirect.NORMAL)
                       .connectTimeout(timeout)
                       .build(), timeout, userAgent);
    }

    public HttpWellKnownClient(HttpClient client, Duration timeout, String userAgent) {
        this.client = client;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    /**
     * @return the delegated server named by the document
     * @throws IOException if the body is not JSON, or names no server
     */
    public static String parse(String hostname, byte[] body) throws IOException {
        var document = CanonicalJson.parse(body);
        var server = document.path("m.server");
        if (!server.isTextual() || server.textValue().isBlank()) {
            throw new IOException("Well-known of: " + hostname + " has no m.server");
        }
        return server.textValue().trim();
    }

    @Override
    public CompletableFuture<Optional<String>> fetch(String hostname) {
        final HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create("https://" + hostname + PATH))
                                 .timeout(timeout)
                                 .header("User-Agent", userAgent)
                                 .header("Accept", "application/json")
                                 .GET()
                                 .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new IOException("Invalid well-known host: " + hostname, e));
        }
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()).thenApply(response -> {
            if (response.statusCode() / 100 != 2) {
                log.debug("Well-known of: {} status: {}", hostname, response.statusCode());
                return Optional.empty();
            }
            try {
                return Optional.of(parse(hostname, response.body()));
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        });
    }
}
