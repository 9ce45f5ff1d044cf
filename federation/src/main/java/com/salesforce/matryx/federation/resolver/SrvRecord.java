/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import java.util.Comparator;

/**
 * A DNS SRV answer. Records order by priority ascending, then weight descending.
 *
 * @author hal.hildebrand
 */
public record SrvRecord(int priority, int weight, int port, String target) implements Comparable<SrvRecord> {

    private static final Comparator<SrvRecord> ORDER = Comparator.comparingInt(SrvRecord::priority)
                                                                 .thenComparing(Comparator.comparingInt(
                                                                 SrvRecord::weight).reversed())
                                                                 .thenComparing(SrvRecord::target)
                                                                 .thenComparingInt(SrvRecord::port);

    public SrvRecord {
        if (target.endsWith(".")) {
            target = target.substring(0, target.length() - 1);
        }
    }

    @Override
    public int compareTo(SrvRecord o) {
        return ORDER.compare(this, o);
    }

    /**
     * @return true if the record states the service is not offered at all
     */
    public boolean unavailable() {
        return target.isEmpty();
    }
}
