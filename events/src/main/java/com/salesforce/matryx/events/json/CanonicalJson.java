/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.events.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.matryx.utils.Hex;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;

/**
 * The canonical JSON encoding that every hash and signature in federation is computed over. Object keys are sorted by
 * Unicode code point, no insignificant whitespace is emitted, strings are escaped minimally and emitted as UTF-8, and
 * numbers are written in their shortest round tripping form. Two encoders given the same value must produce identical
 * bytes.
 *
 * @author hal.hildebrand
 */
public final class CanonicalJson {

    /**
     * Orders strings by Unicode code point rather than by UTF-16 code unit
     */
    public static final Comparator<String> CODE_POINT_ORDER = (a, b) -> {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    };

    public static final int MAX_DEPTH = 512;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
                                                         .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                                                         .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                                                         .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                                                         .build();

    private CanonicalJson() {
        throw new IllegalStateException("Do not instantiate.");
    }

    /**
     * @return the canonical UTF-8 bytes of the value
     * @throws CanonicalJsonException if the value holds anything outside the JSON data model
     */
    public static byte[] encode(JsonNode value) {
        return encodeToString(value).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return the canonical encoding of the value
     * @throws CanonicalJsonException if the value holds anything outside the JSON data model
     */
    public static String encodeToString(JsonNode value) {
        var builder = new StringBuilder();
        write(value, builder, 0);
        return builder.toString();
    }

    /**
     * The shared mapper, rejecting duplicate keys and keeping decimals exact
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @return a new, empty object node
     */
    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    /**
     * Parse JSON text into a value tree
     *
     * @throws IOException if the text is not a single well formed JSON value
     */
    public static JsonNode parse(byte[] json) throws IOException {
        return MAPPER.readTree(json);
    }

    /**
     * Parse JSON text into a value tree
     *
     * @throws JsonProcessingException if the text is not a single well formed JSON value
     */
    public static JsonNode parse(String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }

    static String formatDecimal(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        if (value.signum() < 0) {
            return "-" + formatDecimal(value.negate());
        }
        var stripped = value.stripTrailingZeros();
        var digits = stripped.unscaledValue().toString();
        int k = digits.length();
        // value = 0.digits * 10^n
        int n = k - stripped.scale();

        var builder = new StringBuilder();
        if (k <= n && n <= 21) {
            builder.append(digits);
            for (int i = 0; i < n - k; i++) {
                builder.append('0');
            }
        } else if (0 < n && n <= 21) {
            builder.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (-6 < n && n <= 0) {
            builder.append("0.");
            for (int i = 0; i < -n; i++) {
                builder.append('0');
            }
            builder.append(digits);
        } else {
            int exponent = n - 1;
            builder.append(digits.charAt(0));
            if (k > 1) {
                builder.append('.').append(digits, 1, k);
            }
            builder.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
        }
        return builder.toString();
    }

    private static void write(JsonNode node, StringBuilder builder, int depth) {
        if (depth > MAX_DEPTH) {
            throw new CanonicalJsonException("Value nested deeper than " + MAX_DEPTH);
        }
        if (node == null) {
            throw new CanonicalJsonException("Absent value");
        }
        switch (node.getNodeType()) {
            case NULL -> builder.append("null");
            case BOOLEAN -> builder.append(node.booleanValue() ? "true" : "false");
            case NUMBER -> writeNumber(node, builder);
            case STRING -> writeString(node.textValue(), builder);
            case ARRAY -> {
                builder.append('[');
                var first = true;
                for (var element : node) {
                    if (!first) {
                        builder.append(',');
                    }
                    first = false;
                    write(element, builder, depth + 1);
                }
                builder.append(']');
            }
            case OBJECT -> {
                var keys = new ArrayList<String>(node.size());
                for (Iterator<String> names = node.fieldNames(); names.hasNext(); ) {
                    keys.add(names.next());
                }
                keys.sort(CODE_POINT_ORDER);
                builder.append('{');
                var first = true;
                for (var key : keys) {
                    if (!first) {
                        builder.append(',');
                    }
                    first = false;
                    writeString(key, builder);
                    builder.append(':');
                    write(node.get(key), builder, depth + 1);
                }
                builder.append('}');
            }
            case BINARY, POJO, MISSING -> throw new CanonicalJsonException(
            "Not a JSON data model value: " + node.getNodeType());
        }
    }

    private static void writeNumber(JsonNode node, StringBuilder builder) {
        if (node.isIntegralNumber()) {
            builder.append(node.bigIntegerValue().toString());
            return;
        }
        if (node.isBigDecimal()) {
            builder.append(formatDecimal(node.decimalValue()));
            return;
        }
        var d = node.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new CanonicalJsonException("Non finite number: " + d);
        }
        var text = node.isFloat() ? Float.toString(node.floatValue()) : Double.toString(d);
        builder.append(formatDecimal(new BigDecimal(text)));
    }

    private static void writeString(String value, StringBuilder builder) {
        builder.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\b' -> builder.append("\\b");
                case '\f' -> builder.append("\\f");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (c < 0x20) {
                        builder.append("\\u00");
                        Hex.appendByte(builder, c);
                    } else if (Character.isHighSurrogate(c)) {
                        if (i + 1 >= value.length() || !Character.isLowSurrogate(value.charAt(i + 1))) {
                            throw new CanonicalJsonException("Unpaired surrogate in string");
                        }
                        builder.append(c).append(value.charAt(++i));
                    } else if (Character.isLowSurrogate(c)) {
                        throw new CanonicalJsonException("Unpaired surrogate in string");
                    } else {
                        builder.append(c);
                    }
                }
            }
        }
        builder.append('"');
    }
}
