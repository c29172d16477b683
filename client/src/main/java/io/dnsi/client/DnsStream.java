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
import io.netty.util.concurrent.Future;

import java.net.InetSocketAddress;

/**
 * The receiving end of a request sent over a stream transport.
 * <p>
 * The connection is serviced by its own event loop for as long as it is open. Responses are pulled one at a time
 * with {@link #receive()}; the connection is closed once the last response of the request has arrived.
 */
public interface DnsStream {

    /**
     * Returns the address of the server this stream is connected to.
     */
    InetSocketAddress remoteAddress();

    /**
     * Returns a future completed with the next response, or with {@code null} if the stream is complete. The
     * caller becomes the owner of the returned response. At most one receive may be outstanding at a time.
     */
    Future<DnsResponse> receive();

    /**
     * Returns {@code true} once the last response of the request has arrived. Responses which arrived before it
     * may still be waiting for {@link #receive()}, which returns {@code null} only after all of them were taken.
     */
    boolean isComplete();

    /**
     * Closes the connection and releases responses which have not been received yet.
     */
    Future<Void> close();
}
