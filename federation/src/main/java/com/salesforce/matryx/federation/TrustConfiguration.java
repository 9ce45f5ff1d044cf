/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Configuration of the trust core, bound from YAML. Durations are written in ISO-8601 form, <code>PT10S</code>.
 *
 * @author hal.hildebrand
 */
public class TrustConfiguration {
    public static final String DEFAULT_USER_AGENT = "matryx/0.0.1";

    public Duration backoffBase             = Duration.ofSeconds(1);
    public Duration backoffPrune            = Duration.ofHours(24);
    public Duration cleanupInterval         = Duration.ofMinutes(10);
    /**
     * The key outbound events are signed with; the newest usable key if absent
     */
    public String   defaultKeyId;
    public Duration errorTtl                = Duration.ofHours(1);
    public int      eventLoopThreads        = 2;
    public Duration keyCacheHalfLifeCap     = Duration.ofHours(24);
    /**
     * The MVStore file holding keys; keys are held in memory if absent
     */
    public String   keyStorePath;
    public Duration localKeyValidity        = Duration.ofDays(365);
    public Duration maxKeyValidity          = Duration.ofDays(7);
    public Duration publishedBundleValidity = Duration.ofDays(7);
    public Duration resolutionTimeout       = Duration.ofSeconds(10);
    public String   serverName;
    public Duration trustFailureTtl         = Duration.ofHours(1);
    public String   userAgent               = DEFAULT_USER_AGENT;
    public Duration wellKnownTtl            = Duration.ofHours(24);

    public static TrustConfiguration load(InputStream yaml) throws IOException {
        return mapper().readValue(yaml, TrustConfiguration.class);
    }

    public static TrustConfiguration load(URL yaml) throws IOException {
        try (var is = yaml.openStream()) {
            return load(is);
        }
    }

    private static ObjectMapper mapper() {
        var mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    /**
     * @throws IllegalArgumentException if the configuration cannot describe a working server
     */
    public void validate() {
        if (serverName == null || serverName.isBlank()) {
            throw new IllegalArgumentException("serverName is required");
        }
        if (defaultKeyId != null && !defaultKeyId.startsWith("ed25519:")) {
            throw new IllegalArgumentException("Unsupported default key: " + defaultKeyId);
        }
        if (eventLoopThreads < 1) {
            throw new IllegalArgumentException("eventLoopThreads must be positive");
        }
    }
}
