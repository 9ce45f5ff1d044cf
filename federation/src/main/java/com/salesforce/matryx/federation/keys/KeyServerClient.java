/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import com.fasterxml.jackson.databind.JsonNode;
import com.salesforce.matryx.federation.resolver.ResolvedServer;

import java.util.concurrent.CompletableFuture;

/**
 * Fetches the key bundle a server publishes
 *
 * @author hal.hildebrand
 */
public interface KeyServerClient {
    String PATH = "/_matrix/key/v2/server";

    /**
     * GET the key bundle from the resolved endpoint
     *
     * @return the JSON body of a 200 response, or a future failed on any transport error or other status
     */
    CompletableFuture<JsonNode> fetchServerKeys(ResolvedServer server);
}
