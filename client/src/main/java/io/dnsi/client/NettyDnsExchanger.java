/*
 * Copyright 2026 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.dnsi.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.dns.DatagramDnsResponseDecoder;
import io.netty.handler.codec.dns.DefaultDnsQuery;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.TcpDnsResponseDecoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.internal.PlatformDependent;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.util.concurrent.TimeUnit;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A {@link DnsExchanger} which opens a new channel of the given {@link EventLoopGroup} for every exchange.
 * <p>
 * Stream connections are driven by the event loop their channel is registered with for as long as they are open;
 * TLS connections verify the server certificate against the JDK's default trust roots and the
 * {@link Server#tlsHostname()}.
 */
public final class NettyDnsExchanger implements DnsExchanger {

    private static final String ENDPOINT_IDENTIFICATION_ALGORITHM = "HTTPS";

    private final EventLoopGroup group;
    private final Class<? extends DatagramChannel> datagramChannelType;
    private final Class<? extends SocketChannel> socketChannelType;
    private final SslContext sslContext;

    /**
     * Creates a new instance using NIO channels of the given group.
     */
    public NettyDnsExchanger(EventLoopGroup group) {
        this(group, NioDatagramChannel.class, NioSocketChannel.class, newClientSslContext());
    }

    public NettyDnsExchanger(EventLoopGroup group, Class<? extends DatagramChannel> datagramChannelType,
                             Class<? extends SocketChannel> socketChannelType, SslContext sslContext) {
        this.group = checkNotNull(group, "group");
        this.datagramChannelType = checkNotNull(datagramChannelType, "datagramChannelType");
        this.socketChannelType = checkNotNull(socketChannelType, "socketChannelType");
        this.sslContext = checkNotNull(sslContext, "sslContext");
        if (!sslContext.isClient()) {
            throw new IllegalArgumentException("sslContext must be a client context");
        }
    }

    /**
     * Returns a client {@link SslContext} trusting the JDK's default trust roots.
     */
    public static SslContext newClientSslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("failed to create the TLS client context", e);
        }
    }

    @Override
    public Future<DnsResponse> datagram(final Server server, RequestMessage request) {
        final Promise<DnsResponse> promise = group.next().newPromise();
        final DatagramExchangeHandler handler = new DatagramExchangeHandler(server, request, nextId(), promise);

        Bootstrap b = new Bootstrap();
        b.group(group)
         .channel(datagramChannelType)
         .handler(new ChannelInitializer<DatagramChannel>() {
             @Override
             protected void initChannel(DatagramChannel ch) {
                 ch.pipeline().addLast(new DatagramQueryEncoder(), new DatagramDnsResponseDecoder(), handler);
             }
         });

        b.bind(0).addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (future.isSuccess()) {
                    handler.send(future.channel());
                } else {
                    promise.tryFailure(DnsExchangeException.wrap(server.address(), future.cause()));
                }
            }
        });
        return promise;
    }

    @Override
    public Future<DnsStream> stream(final Server server, final RequestMessage request, final boolean tls) {
        final Promise<DnsStream> promise = group.next().newPromise();
        final int id = nextId();
        final long timeoutMillis = server.timeout().toMillis();
        final DnsStreamHandler handler =
                new DnsStreamHandler(server.address(), id, XfrResponseTracker.newTracker(request));

        Bootstrap b = new Bootstrap();
        b.group(group)
         .channel(socketChannelType)
         .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE))
         .handler(new ChannelInitializer<SocketChannel>() {
             @Override
             protected void initChannel(SocketChannel ch) {
                 ChannelPipeline p = ch.pipeline();
                 if (tls) {
                     p.addLast(newSslHandler(ch, server));
                 }
                 p.addLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS));
                 p.addLast(new TcpDnsResponseDecoder());
                 p.addLast(new StreamQueryEncoder());
                 p.addLast(handler);
             }
         });

        b.connect(server.address()).addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(DnsExchangeException.wrap(server.address(), future.cause()));
                    return;
                }
                final Channel ch = future.channel();
                if (!tls) {
                    write(ch, request, id, handler, promise);
                    return;
                }
                ch.pipeline().get(SslHandler.class).handshakeFuture().addListener(
                        new FutureListener<Channel>() {
                            @Override
                            public void operationComplete(Future<Channel> handshake) {
                                if (handshake.isSuccess()) {
                                    write(ch, request, id, handler, promise);
                                } else {
                                    promise.tryFailure(DnsExchangeException.wrap(server.address(),
                                                                                 handshake.cause()));
                                    ch.close();
                                }
                            }
                        });
            }
        });
        return promise;
    }

    private static void write(final Channel ch, RequestMessage request, int id, final DnsStreamHandler handler,
                              final Promise<DnsStream> promise) {
        ch.writeAndFlush(request.populate(new DefaultDnsQuery(id), 0)).addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (future.isSuccess()) {
                    if (!promise.trySuccess(handler)) {
                        ch.close();
                    }
                } else {
                    promise.tryFailure(DnsExchangeException.wrap(handler.remoteAddress(), future.cause()));
                    ch.close();
                }
            }
        });
    }

    private SslHandler newSslHandler(SocketChannel ch, Server server) {
        String hostname = server.tlsHostname();
        if (hostname == null) {
            throw new DnsClientConfigurationException("no TLS hostname configured for " + server.address());
        }
        SslHandler sslHandler = sslContext.newHandler(ch.alloc(), hostname, server.address().getPort());
        SSLEngine engine = sslHandler.engine();
        SSLParameters parameters = engine.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm(ENDPOINT_IDENTIFICATION_ALGORITHM);
        engine.setSSLParameters(parameters);
        sslHandler.setHandshakeTimeoutMillis(server.timeout().toMillis());
        return sslHandler;
    }

    private static int nextId() {
        return PlatformDependent.threadLocalRandom().nextInt(0x10000);
    }
}
