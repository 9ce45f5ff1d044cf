/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

/**
 * How a server name was turned into an endpoint
 *
 * @author hal.hildebrand
 */
public enum ResolutionMethod {
    IP_LITERAL, EXPLICIT_PORT, WELL_KNOWN_DELEGATION, SRV_MATRIX_FED, SRV_MATRIX_LEGACY, FALLBACK_PORT_8448;
}
