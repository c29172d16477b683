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

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.ZonedDateTime;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Timing and addressing information about the exchange that produced an {@link Answer}.
 * <p>
 * A {@link Stats} is started when an attempt begins and is finished exactly once, when the attempt succeeds.
 * It must be treated as read-only after that.
 */
public final class Stats {

    private final ZonedDateTime start;
    private final long startNanos;
    private final InetSocketAddress serverAddress;
    private final Protocol protocol;
    private volatile Duration duration = Duration.ZERO;
    private volatile boolean finished;

    Stats(InetSocketAddress serverAddress, Protocol protocol) {
        this.serverAddress = checkNotNull(serverAddress, "serverAddress");
        this.protocol = checkNotNull(protocol, "protocol");
        start = ZonedDateTime.now();
        startNanos = System.nanoTime();
    }

    /**
     * Records the elapsed time of the attempt.
     *
     * @throws IllegalStateException if this method was called before
     */
    void finish() {
        if (finished) {
            throw new IllegalStateException("stats already finished");
        }
        duration = Duration.ofNanos(System.nanoTime() - startNanos);
        finished = true;
    }

    boolean isFinished() {
        return finished;
    }

    /**
     * Returns the wall-clock time the attempt was started at.
     */
    public ZonedDateTime start() {
        return start;
    }

    /**
     * Returns how long the attempt took, or {@link Duration#ZERO} if it has not finished.
     */
    public Duration duration() {
        return duration;
    }

    /**
     * Returns the address of the server that was contacted.
     */
    public InetSocketAddress serverAddress() {
        return serverAddress;
    }

    /**
     * Returns the protocol the exchange was carried over.
     */
    public Protocol protocol() {
        return protocol;
    }

    @Override
    public String toString() {
        return "Stats(start: " + start + ", duration: " + duration + ", server: " + serverAddress +
               ", protocol: " + protocol + ')';
    }
}
