/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.Provider;
import java.security.Security;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The generic sacrifice to the JCE provider gods
 *
 * @author hal.hildebrand
 */
public class ProviderUtils {

    static final String PROVIDER_NAME_BC = BouncyCastleProvider.PROVIDER_NAME;

    private static final AtomicBoolean initialized = new AtomicBoolean(false);
    private static final Provider      PROVIDER_BC;

    static {
        setup();
        PROVIDER_BC = Security.getProvider(PROVIDER_NAME_BC);
    }

    public static Provider getProviderBC() {
        if (!initialized.get()) {
            throw new IllegalStateException("Provider has not been initialized");
        }
        return PROVIDER_BC;
    }

    static boolean isProviderBC(Provider p) {
        return p instanceof BouncyCastleProvider;
    }

    private static void setup() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        if (isProviderBC(Security.getProvider(PROVIDER_NAME_BC))) {
            return;
        }
        // Appended, not inserted: the JDK providers keep serving TLS and the default algorithms
        Security.addProvider(new BouncyCastleProvider());
    }
}
