/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SrvRecordTest {

    @Test
    public void ordering() {
        var low = new SrvRecord(10, 100, 8448, "c.example.org.");
        var heavy = new SrvRecord(0, 50, 8448, "a.example.org.");
        var light = new SrvRecord(0, 20, 8448, "b.example.org.");
        var sorted = List.of(low, light, heavy).stream().sorted().toList();
        assertEquals(List.of(heavy, light, low), sorted);
    }

    @Test
    public void targets() {
        assertEquals("matrix.example.org", new SrvRecord(0, 0, 443, "matrix.example.org.").target());
        assertTrue(new SrvRecord(0, 0, 0, ".").unavailable());
        assertFalse(new SrvRecord(0, 0, 443, "matrix.example.org").unavailable());
    }
}
