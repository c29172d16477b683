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
package io.dnsi.verify;

import io.netty.channel.AddressedEnvelope;
import io.netty.channel.EventLoop;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.resolver.ResolvedAddressTypes;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.DnsNameResolverBuilder;
import io.netty.resolver.dns.DnsServerAddressStreamProviders;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;

import java.io.Closeable;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A {@link StubResolver} backed by a {@link DnsNameResolver} using the name servers of the platform's resolver
 * configuration.
 */
public final class NettyStubResolver implements StubResolver, Closeable {

    private final EventLoop eventLoop;
    private final DnsNameResolver resolver;

    public NettyStubResolver(EventLoop eventLoop, Duration timeout) {
        this.eventLoop = checkNotNull(eventLoop, "eventLoop");
        resolver = new DnsNameResolverBuilder(eventLoop)
                .channelType(NioDatagramChannel.class)
                .socketChannelType(NioSocketChannel.class)
                .queryTimeoutMillis(checkNotNull(timeout, "timeout").toMillis())
                .resolvedAddressTypes(ResolvedAddressTypes.IPV4_PREFERRED)
                .nameServerProvider(DnsServerAddressStreamProviders.platformDefault())
                .build();
    }

    @Override
    public Future<DnsResponse> query(final String name, DnsRecordType type) {
        final Promise<DnsResponse> promise = eventLoop.newPromise();
        resolver.query(new DefaultDnsQuestion(name, type)).addListener(
                new FutureListener<AddressedEnvelope<DnsResponse, InetSocketAddress>>() {
                    @Override
                    public void operationComplete(Future<AddressedEnvelope<DnsResponse, InetSocketAddress>> future) {
                        if (!future.isSuccess()) {
                            promise.tryFailure(future.cause());
                            return;
                        }
                        // The response is handed over; releasing it releases the envelope.
                        DnsResponse response = future.getNow().content();
                        if (!promise.trySuccess(response)) {
                            response.release();
                        }
                    }
                });
        return promise;
    }

    @Override
    public Future<List<InetAddress>> lookupHost(String name) {
        return resolver.resolveAll(name);
    }

    @Override
    public void close() {
        resolver.close();
    }
}
