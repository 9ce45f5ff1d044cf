/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.resolver;

import io.netty.buffer.ByteBuf;
import io.netty.channel.EventLoop;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.handler.codec.dns.*;
import io.netty.resolver.ResolvedAddressTypes;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.DnsNameResolverBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * DNS over the Netty asynchronous resolver, using the system's name servers
 *
 * @author hal.hildebrand
 */
public class NettyDnsClient implements DnsClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NettyDnsClient.class);

    private final DnsNameResolver resolver;

    public NettyDnsClient(EventLoop eventLoop, Duration queryTimeout) {
        resolver = new DnsNameResolverBuilder(eventLoop).channelType(NioDatagramChannel.class)
                                                        .queryTimeoutMillis(queryTimeout.toMillis())
                                                        .resolvedAddressTypes(ResolvedAddressTypes.IPV4_PREFERRED)
                                                        .build();
    }

    static SrvRecord decode(ByteBuf content) {
        var buf = content.duplicate();
        var priority = buf.readUnsignedShort();
        var weight = buf.readUnsignedShort();
        var port = buf.readUnsignedShort();
        var target = DefaultDnsRecordDecoder.decodeName(buf);
        return new SrvRecord(priority, weight, port, target);
    }

    @Override
    public void close() {
        resolver.close();
    }

    @Override
    public CompletableFuture<List<InetAddress>> lookup(String hostname) {
        var result = new CompletableFuture<List<InetAddress>>();
        var future = resolver.resolveAll(hostname);
        future.addListener(f -> {
            if (future.isSuccess()) {
                result.complete(future.getNow());
            } else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<List<SrvRecord>> lookupSrv(String name) {
        var result = new CompletableFuture<List<SrvRecord>>();
        var future = resolver.query(new DefaultDnsQuestion(name, DnsRecordType.SRV));
        future.addListener(f -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(future.cause());
                return;
            }
            var envelope = future.getNow();
            try {
                var response = envelope.content();
                if (response.code() == DnsResponseCode.NXDOMAIN) {
                    result.complete(List.of());
                    return;
                }
                if (response.code() != DnsResponseCode.NOERROR) {
                    result.completeExceptionally(new IOException("SRV query: " + name + " failed: " + response.code()));
                    return;
                }
                var records = new ArrayList<SrvRecord>();
                for (int i = 0; i < response.count(DnsSection.ANSWER); i++) {
                    DnsRecord record = response.recordAt(DnsSection.ANSWER, i);
                    if (record.type() == DnsRecordType.SRV && record instanceof DnsRawRecord raw) {
                        records.add(decode(raw.content()));
                    }
                }
                log.trace("SRV query: {} answers: {}", name, records);
                result.complete(records);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } finally {
                envelope.release();
            }
        });
        return result;
    }
}
