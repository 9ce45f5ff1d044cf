/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.federation.keys;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.net.InetAddresses;
import com.salesforce.matryx.events.json.CanonicalJson;
import com.salesforce.matryx.federation.resolver.ResolvedServer;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Key bundle fetch over Netty HTTPS. The connection goes to the resolved address, while SNI and certificate
 * verification use the resolved TLS hostname and the request carries the resolved Host header.
 *
 * @author hal.hildebrand
 */
public class NettyKeyServerClient implements KeyServerClient {
    public static final int MAX_CONTENT_LENGTH = 1 << 20;

    private static final Logger log = LoggerFactory.getLogger(NettyKeyServerClient.class);

    private final EventLoopGroup group;
    private final SslContext     sslContext;
    private final Duration       timeout;
    private final String         userAgent;

    public NettyKeyServerClient(EventLoopGroup group, Duration timeout, String userAgent) throws SSLException {
        this(group, SslContextBuilder.forClient().build(), timeout, userAgent);
    }

    public NettyKeyServerClient(EventLoopGroup group, SslContext sslContext, Duration timeout, String userAgent) {
        this.group = group;
        this.sslContext = sslContext;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public CompletableFuture<JsonNode> fetchServerKeys(ResolvedServer server) {
        var result = new CompletableFuture<JsonNode>();
        var bootstrap = new Bootstrap().group(group)
                                       .channel(NioSocketChannel.class)
                                       .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                                       .handler(new ChannelInitializer<SocketChannel>() {
                                           @Override
                                           protected void initChannel(SocketChannel ch) {
                                               ch.pipeline()
                                                 .addLast(new ReadTimeoutHandler(timeout.toMillis(),
                                                                                 TimeUnit.MILLISECONDS))
                                                 .addLast(tls(ch, server))
                                                 .addLast(new HttpClientCodec())
                                                 .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                                                 .addLast(new ResponseHandler(server, result));
                                           }
                                       });
        log.debug("Fetching server keys from: {}", server);
        bootstrap.connect(server.socketAddress()).addListener((ChannelFutureListener) connected -> {
            if (!connected.isSuccess()) {
                result.completeExceptionally(connected.cause());
                return;
            }
            var request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, PATH,
                                                     Unpooled.EMPTY_BUFFER);
            request.headers()
                   .set(HttpHeaderNames.HOST, server.hostHeader())
                   .set(HttpHeaderNames.USER_AGENT, userAgent)
                   .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)
                   .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            connected.channel().writeAndFlush(request).addListener((ChannelFutureListener) written -> {
                if (!written.isSuccess()) {
                    result.completeExceptionally(written.cause());
                    written.channel().close();
                }
            });
        });
        return result;
    }

    private SslHandler tls(SocketChannel ch, ResolvedServer server) {
        var engine = sslContext.newEngine(ch.alloc(), server.tlsHostname(), server.port());
        var parameters = engine.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm("HTTPS");
        if (!InetAddresses.isInetAddress(server.tlsHostname())) {
            parameters.setServerNames(List.of(new SNIHostName(server.tlsHostname())));
        }
        engine.setSSLParameters(parameters);
        return new SslHandler(engine);
    }

    private static class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<JsonNode> result;
        private final ResolvedServer              server;

        private ResponseHandler(ResolvedServer server, CompletableFuture<JsonNode> result) {
            this.server = server;
            this.result = result;
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            result.completeExceptionally(new IOException("Connection to: " + server + " closed without a response"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Error fetching server keys from: {}", server, cause);
            result.completeExceptionally(cause);
            ctx.close();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            try {
                if (!HttpResponseStatus.OK.equals(response.status())) {
                    result.completeExceptionally(
                    new IOException("Key server: " + server + " responded: " + response.status()));
                    return;
                }
                result.complete(CanonicalJson.parse(ByteBufUtil.getBytes(response.content())));
            } catch (IOException e) {
                result.completeExceptionally(e);
            } finally {
                ctx.close();
            }
        }
    }
}
