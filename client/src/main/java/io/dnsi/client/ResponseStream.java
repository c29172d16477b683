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

import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A handle on the responses to a request which may be answered by several messages, as returned by
 * {@link Client#requestMulti(java.util.List, RequestMessage)}.
 * <p>
 * Messages are pulled one at a time through {@link #next()}; the connection stays open until the server has sent
 * the last message or {@link #close()} is called.
 */
public final class ResponseStream {

    private final EventExecutor executor;
    private final DnsStream stream;
    private final Stats stats;

    ResponseStream(EventExecutor executor, DnsStream stream, Stats stats) {
        this.executor = checkNotNull(executor, "executor");
        this.stream = checkNotNull(stream, "stream");
        this.stats = checkNotNull(stats, "stats");
    }

    /**
     * Returns a future completed with the next message wrapped in an {@link Answer}, or with {@code null} once the
     * stream is complete. All answers share the {@link Stats} of the stream, which is finished when the first
     * message arrives.
     */
    public Future<Answer> next() {
        final Promise<Answer> promise = executor.newPromise();
        stream.receive().addListener(new FutureListener<DnsResponse>() {
            @Override
            public void operationComplete(Future<DnsResponse> future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(future.cause());
                    return;
                }
                DnsResponse response = future.getNow();
                if (response == null) {
                    promise.trySuccess(null);
                    return;
                }
                if (!stats.isFinished()) {
                    stats.finish();
                }
                if (!promise.trySuccess(new Answer(response, stats))) {
                    response.release();
                }
            }
        });
        return promise;
    }

    /**
     * Returns {@code true} once the server has sent the last message.
     */
    public boolean isComplete() {
        return stream.isComplete();
    }

    public Stats stats() {
        return stats;
    }

    public Future<Void> close() {
        return stream.close();
    }
}
