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

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.dns.DatagramDnsQuery;
import io.netty.handler.codec.dns.DatagramDnsResponse;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.concurrent.TimeUnit;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Performs a single datagram exchange on its own channel: sends the query, retransmits it when the server does not
 * answer within the timeout, and completes the promise with the first response carrying the query ID.
 */
final class DatagramExchangeHandler extends ChannelInboundHandlerAdapter {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DatagramExchangeHandler.class);

    private final Server server;
    private final RequestMessage request;
    private final int id;
    private final Promise<DnsResponse> promise;
    private int retriesLeft;
    private ScheduledFuture<?> timeoutFuture;

    DatagramExchangeHandler(Server server, RequestMessage request, int id, Promise<DnsResponse> promise) {
        this.server = checkNotNull(server, "server");
        this.request = checkNotNull(request, "request");
        this.id = id;
        this.promise = checkNotNull(promise, "promise");
        retriesLeft = server.retries();
    }

    /**
     * Sends the query. Must be called from the channel's event loop.
     */
    void send(final Channel channel) {
        DatagramDnsQuery query = request.populate(
                new DatagramDnsQuery(null, server.address(), id), server.udpPayloadSize());
        channel.writeAndFlush(query).addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (!future.isSuccess()) {
                    fail(channel, future.cause());
                }
            }
        });
        timeoutFuture = channel.eventLoop().schedule(new Runnable() {
            @Override
            public void run() {
                onTimeout(channel);
            }
        }, server.timeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onTimeout(Channel channel) {
        if (promise.isDone()) {
            return;
        }
        if (retriesLeft > 0) {
            retriesLeft--;
            logger.debug("{} No response from {}, retransmitting ({} retries left)",
                         channel, server.address(), retriesLeft);
            send(channel);
            return;
        }
        fail(channel, new DnsExchangeTimeoutException(
                server.address(), "no response from " + server.address() + " after " +
                                  (server.retries() + 1) + " attempt(s) of " + server.timeout().toMillis() + "ms"));
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof DnsResponse)) {
            ReferenceCountUtil.release(msg);
            return;
        }
        DnsResponse response = (DnsResponse) msg;
        if (msg instanceof DatagramDnsResponse && !server.address().equals(((DatagramDnsResponse) msg).sender())) {
            logger.debug("{} Ignoring response from unexpected sender: {} (expected: {})",
                         ctx.channel(), ((DatagramDnsResponse) msg).sender(), server.address());
            response.release();
            return;
        }
        if (response.id() != id) {
            logger.debug("{} Ignoring response with unexpected ID: {} (expected: {})",
                         ctx.channel(), response.id(), id);
            response.release();
            return;
        }
        cancelTimeout();
        if (!promise.trySuccess(response)) {
            response.release();
        }
        ctx.close();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        fail(ctx.channel(), cause);
    }

    private void fail(Channel channel, Throwable cause) {
        cancelTimeout();
        promise.tryFailure(DnsExchangeException.wrap(server.address(), cause));
        channel.close();
    }

    private void cancelTimeout() {
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
            timeoutFuture = null;
        }
    }
}
