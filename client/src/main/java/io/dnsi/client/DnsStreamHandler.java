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
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoop;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayDeque;
import java.util.Queue;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * The last handler of a stream connection's pipeline and the {@link DnsStream} handed to the requester.
 * <p>
 * Responses are queued until they are received. All state is only touched from the channel's event loop;
 * {@link #receive()} hands over to it when called from elsewhere.
 */
final class DnsStreamHandler extends ChannelInboundHandlerAdapter implements DnsStream {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DnsStreamHandler.class);

    private final InetSocketAddress remoteAddress;
    private final int id;
    private final XfrResponseTracker tracker;
    private final Queue<DnsResponse> received = new ArrayDeque<DnsResponse>(4);
    private Channel channel;
    private Promise<DnsResponse> pending;
    private DnsExchangeException failure;
    private boolean closed;
    private volatile boolean complete;

    DnsStreamHandler(InetSocketAddress remoteAddress, int id, XfrResponseTracker tracker) {
        this.remoteAddress = checkNotNull(remoteAddress, "remoteAddress");
        this.id = id;
        this.tracker = checkNotNull(tracker, "tracker");
    }

    @Override
    public InetSocketAddress remoteAddress() {
        return remoteAddress;
    }

    @Override
    public boolean isComplete() {
        return complete;
    }

    @Override
    public Future<DnsResponse> receive() {
        final EventLoop eventLoop = channel().eventLoop();
        final Promise<DnsResponse> promise = eventLoop.newPromise();
        if (eventLoop.inEventLoop()) {
            receive0(promise);
        } else {
            eventLoop.execute(new Runnable() {
                @Override
                public void run() {
                    receive0(promise);
                }
            });
        }
        return promise;
    }

    private void receive0(Promise<DnsResponse> promise) {
        DnsResponse response = received.poll();
        if (response != null) {
            if (!promise.trySuccess(response)) {
                response.release();
            }
        } else if (complete) {
            promise.trySuccess(null);
        } else if (failure != null) {
            promise.tryFailure(failure);
        } else if (pending != null) {
            promise.tryFailure(new IllegalStateException("a receive is already pending"));
        } else {
            pending = promise;
        }
    }

    @Override
    public Future<Void> close() {
        final Channel ch = channel();
        if (ch.eventLoop().inEventLoop()) {
            releaseReceived();
        } else {
            ch.eventLoop().execute(new Runnable() {
                @Override
                public void run() {
                    releaseReceived();
                }
            });
        }
        return ch.close();
    }

    private void releaseReceived() {
        closed = true;
        for (;;) {
            DnsResponse response = received.poll();
            if (response == null) {
                break;
            }
            response.release();
        }
    }

    private Channel channel() {
        if (channel == null) {
            throw new IllegalStateException("stream not connected");
        }
        return channel;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        channel = ctx.channel();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof DnsResponse)) {
            ReferenceCountUtil.release(msg);
            return;
        }
        DnsResponse response = (DnsResponse) msg;
        if (closed || complete || failure != null) {
            response.release();
            return;
        }
        if (response.id() != id) {
            logger.debug("{} Ignoring response with unexpected ID: {} (expected: {})",
                         ctx.channel(), response.id(), id);
            response.release();
            return;
        }

        boolean last;
        try {
            last = tracker.isLast(response);
        } catch (Exception e) {
            response.release();
            fail(ctx, e);
            return;
        }
        if (last) {
            complete = true;
        }
        Promise<DnsResponse> promise = pending;
        if (promise != null) {
            pending = null;
            if (!promise.trySuccess(response)) {
                response.release();
            }
        } else {
            received.add(response);
        }
        if (last) {
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ReadTimeoutException) {
            fail(ctx, new DnsExchangeTimeoutException(remoteAddress, "no response from " + remoteAddress +
                                                                     " within the timeout"));
        } else {
            fail(ctx, cause);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!complete && failure == null) {
            failure = new DnsExchangeException(remoteAddress, "connection to " + remoteAddress +
                                                              " closed before the last response");
            Promise<DnsResponse> promise = pending;
            if (promise != null) {
                pending = null;
                promise.tryFailure(failure);
            }
        }
        super.channelInactive(ctx);
    }

    private void fail(ChannelHandlerContext ctx, Throwable cause) {
        if (complete || failure != null) {
            logger.debug("{} Exception after the stream ended:", ctx.channel(), cause);
            return;
        }
        failure = DnsExchangeException.wrap(remoteAddress, cause);
        Promise<DnsResponse> promise = pending;
        if (promise != null) {
            pending = null;
            promise.tryFailure(failure);
        }
        ctx.close();
    }
}
