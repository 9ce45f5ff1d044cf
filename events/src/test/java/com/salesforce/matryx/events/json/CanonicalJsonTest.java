/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.events.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalJsonTest {

    @Test
    public void sortsKeys() throws Exception {
        assertEquals("{}", canonical("{}"));
        assertEquals("{\"a\":2,\"b\":1}", canonical("{\"b\":1,\"a\":2}"));
        assertEquals("{\"one\":1,\"two\":\"Two\"}", canonical("{ \"one\" : 1 , \"two\" : \"Two\" }"));
    }

    @Test
    public void nestedObjects() throws Exception {
        var input = """
                    {
                        "auth": {
                            "success": true,
                            "mxid": "@john.doe:example.com",
                            "profile": {
                                "display_name": "John Doe",
                                "three_pids": [
                                    {"medium": "email", "address": "john.doe@example.org"},
                                    {"medium": "msisdn", "address": "123456789"}
                                ]
                            }
                        }
                    }
                    """;
        assertEquals("{\"auth\":{\"mxid\":\"@john.doe:example.com\",\"profile\":{\"display_name\":\"John Doe\","
                     + "\"three_pids\":[{\"address\":\"john.doe@example.org\",\"medium\":\"email\"},"
                     + "{\"address\":\"123456789\",\"medium\":\"msisdn\"}]},\"success\":true}}", canonical(input));
    }

    @Test
    public void unicodeIsRawUtf8() throws Exception {
        var encoded = CanonicalJson.encode(CanonicalJson.parse("{\"a\": \"\\u65E5\\u672C\\u8A9E\"}"));
        assertArrayEquals("{\"a\":\"日本語\"}".getBytes(StandardCharsets.UTF_8), encoded);
        assertEquals("{\"日\":1,\"本\":2}", canonical("{\"本\": 2, \"日\": 1}"));
    }

    @Test
    public void codePointOrder() {
        var node = CanonicalJson.newObject();
        node.put("😀", 2);
        node.put("ﬁ", 1);
        // UTF-16 unit order would place the surrogate pair first
        assertEquals("{\"ﬁ\":1,\"😀\":2}", CanonicalJson.encodeToString(node));
    }

    @Test
    public void escaping() {
        var node = CanonicalJson.newObject();
        node.put("a", "\"\\\b\f\n\r\t/\u0000\u001f\u007f");
        assertEquals("{\"a\":\"\\\"\\\\\\b\\f\\n\\r\\t/\\u0000\\u001f\u007f\"}", CanonicalJson.encodeToString(node));
    }

    @Test
    public void literals() throws Exception {
        assertEquals("{\"a\":null,\"b\":true,\"c\":false,\"d\":[]}",
                     canonical("{\"d\": [], \"c\": false, \"b\": true, \"a\": null}"));
    }

    @Test
    public void numbers() throws Exception {
        assertEquals("[0,-1,9007199254740993,1,1.5,1e+21,100000000000000000000,1e-7,0.000001,1.25e-10,-2.5]",
                     canonical("[-0, -1, 9007199254740993, 1.0, 1.5, 1e21, 1E20, 1e-7, 0.000001, 1.25e-10, -2.50]"));

        var node = JsonNodeFactory.instance.arrayNode();
        node.add(0.1d);
        node.add(100.0d);
        node.add(1.5f);
        assertEquals("[0.1,100,1.5]", CanonicalJson.encodeToString(node));
    }

    @Test
    public void formatsDecimalsLikeNumberToString() {
        assertEquals("123", CanonicalJson.formatDecimal(new BigDecimal("123.000")));
        assertEquals("1.23", CanonicalJson.formatDecimal(new BigDecimal("1.23")));
        assertEquals("1.2e+22", CanonicalJson.formatDecimal(new BigDecimal("1.2e22")));
        assertEquals("0.0000012", CanonicalJson.formatDecimal(new BigDecimal("1.2e-6")));
        assertEquals("-5e-7", CanonicalJson.formatDecimal(new BigDecimal("-5e-7")));
    }

    @Test
    public void rejectsValuesOutsideTheDataModel() {
        var node = JsonNodeFactory.instance.arrayNode();
        node.add(Double.NaN);
        assertThrows(CanonicalJsonException.class, () -> CanonicalJson.encode(node));

        var infinite = JsonNodeFactory.instance.objectNode();
        infinite.put("x", Double.POSITIVE_INFINITY);
        assertThrows(CanonicalJsonException.class, () -> CanonicalJson.encode(infinite));

        var binary = JsonNodeFactory.instance.objectNode();
        binary.set("x", JsonNodeFactory.instance.binaryNode(new byte[] { 1 }));
        assertThrows(CanonicalJsonException.class, () -> CanonicalJson.encode(binary));

        var pojo = JsonNodeFactory.instance.objectNode();
        pojo.set("x", JsonNodeFactory.instance.pojoNode(new Object()));
        assertThrows(CanonicalJsonException.class, () -> CanonicalJson.encode(pojo));

        var surrogate = JsonNodeFactory.instance.objectNode();
        surrogate.put("x", "\uD83D");
        assertThrows(CanonicalJsonException.class, () -> CanonicalJson.encode(surrogate));
    }

    @Test
    public void deepNesting() {
        JsonNode node = JsonNodeFactory.instance.textNode("leaf");
        for (int i = 0; i < 128; i++) {
            var wrapper = JsonNodeFactory.instance.arrayNode();
            wrapper.add(node);
            node = wrapper;
        }
        var encoded = CanonicalJson.encodeToString(node);
        assertTrue(encoded.startsWith("[[[["));
        assertEquals(128 * 2 + "\"leaf\"".length(), encoded.length());

        for (int i = 0; i < CanonicalJson.MAX_DEPTH; i++) {
            var wrapper = JsonNodeFactory.instance.objectNode();
            wrapper.set("n", node);
            node = wrapper;
        }
        var tooDeep = node;
        assertThrows(CanonicalJsonException.class, () -> CanonicalJson.encode(tooDeep));
    }

    @Test
    public void insertionOrderDoesNotMatter() {
        var keys = new ArrayList<>(List.of("z", "a", "m", "aa", "A", "_", "0", "é"));
        var expected = CanonicalJson.encodeToString(objectOf(keys));
        var random = new Random(0x1638);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(keys, random);
            var node = objectOf(keys);
            assertEquals(expected, CanonicalJson.encodeToString(node));
            assertArrayEquals(CanonicalJson.encode(node), CanonicalJson.encode(node));
        }
        assertEquals("{\"0\":0,\"A\":0,\"_\":0,\"a\":0,\"aa\":0,\"m\":0,\"z\":0,\"é\":0}", expected);
    }

    @Test
    public void rejectsDuplicateKeys() {
        assertThrows(Exception.class, () -> CanonicalJson.parse("{\"a\":1,\"a\":2}"));
    }

    private static String canonical(String json) throws Exception {
        return CanonicalJson.encodeToString(CanonicalJson.parse(json));
    }

    private static JsonNode objectOf(List<String> keys) {
        var node = JsonNodeFactory.instance.objectNode();
        keys.forEach(k -> node.put(k, 0));
        return node;
    }
}
