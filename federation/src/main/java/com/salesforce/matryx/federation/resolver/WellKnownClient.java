/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches <code>https://{hostname}/.well-known/matrix/server</code>
 *
 * @author hal.hildebrand
 */
public interface WellKnownClient {

    /**
     * @return the delegated server, or empty if the host confirms it has no delegation. Completes exceptionally if
     * the document cannot be fetched or is malformed.
     */
    CompletableFuture<Optional<String>> fetch(String hostname);
}
