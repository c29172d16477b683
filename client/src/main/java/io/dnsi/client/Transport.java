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

/**
 * The transport a {@link Server} is contacted over.
 */
public enum Transport {
    /**
     * A single datagram exchange, truncated responses are returned as they are.
     */
    UDP,
    /**
     * A datagram exchange which is repeated over TCP if the response is truncated.
     */
    UDP_TCP,
    /**
     * A length-prefixed exchange over a TCP connection.
     */
    TCP,
    /**
     * A length-prefixed exchange over a TLS connection (DNS over TLS).
     */
    TLS;

    /**
     * Returns {@code true} if this transport can carry a stream of responses, as needed by zone transfers.
     */
    public boolean isStream() {
        return this == TCP || this == TLS;
    }

    /**
     * Returns the well-known port servers listen on for this transport.
     */
    public int defaultPort() {
        return this == TLS ? Server.DEFAULT_TLS_PORT : Server.DEFAULT_PORT;
    }
}
