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

/**
 * The transport primitives a {@link Client} dispatches requests over.
 * <p>
 * Implementations enforce the per-attempt settings of the {@link Server}: the timeout, and for datagrams the
 * retransmissions and the advertised payload size.
 */
public interface DnsExchanger {

    /**
     * Sends the request to the server in a datagram and returns the future response. Truncated responses are
     * returned as they are.
     */
    Future<DnsResponse> datagram(Server server, RequestMessage request);

    /**
     * Connects to the server, with a TLS handshake if {@code tls} is {@code true}, sends the request and returns
     * the future stream of responses once the request has been written.
     */
    Future<DnsStream> stream(Server server, RequestMessage request, boolean tls);
}
