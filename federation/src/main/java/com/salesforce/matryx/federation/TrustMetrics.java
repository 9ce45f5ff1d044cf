/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;

/**
 * @author hal.hildebrand
 */
public interface TrustMetrics {

    Meter backoffRefusals();

    Meter eventsSigned();

    Meter keyCacheHits();

    Timer keyFetch();

    Meter keyFetchFailures();

    Timer resolution();

    Meter resolutionFailures();

    Meter signatureFailures();

    Meter wellKnownCacheHits();
}
