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

import io.netty.util.internal.ObjectUtil;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

import static io.netty.util.internal.ObjectUtil.checkInRange;
import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A candidate name server together with how it is to be contacted.
 * <p>
 * Instances are immutable and are created with {@link #builder(InetSocketAddress)}.
 */
public final class Server {

    /**
     * The standard DNS port.
     */
    public static final int DEFAULT_PORT = 53;

    /**
     * The standard DNS over TLS port.
     */
    public static final int DEFAULT_TLS_PORT = 853;

    private final InetSocketAddress address;
    private final Transport transport;
    private final Duration timeout;
    private final int retries;
    private final int udpPayloadSize;
    private final String tlsHostname;

    private Server(Builder builder) {
        address = builder.address;
        transport = builder.transport;
        timeout = builder.timeout;
        retries = builder.retries;
        udpPayloadSize = builder.udpPayloadSize;
        tlsHostname = builder.tlsHostname;
    }

    /**
     * Returns a new builder for a server listening on the given address.
     */
    public static Builder builder(InetSocketAddress address) {
        return new Builder(address);
    }

    /**
     * Returns a new builder for a server listening on the default port of the given transport.
     */
    public static Builder builder(InetAddress address, Transport transport) {
        checkNotNull(transport, "transport");
        return new Builder(new InetSocketAddress(address, transport.defaultPort())).transport(transport);
    }

    public InetSocketAddress address() {
        return address;
    }

    public Transport transport() {
        return transport;
    }

    /**
     * Returns the timeout of a single attempt, enforced by the transport.
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * Returns how often a datagram request is retransmitted before the attempt fails.
     */
    public int retries() {
        return retries;
    }

    public int udpPayloadSize() {
        return udpPayloadSize;
    }

    /**
     * Returns the name used for SNI and certificate verification, or {@code null} if none was configured.
     */
    public String tlsHostname() {
        return tlsHostname;
    }

    /**
     * Returns a builder initialised with the values of this server.
     */
    public Builder toBuilder() {
        return new Builder(address)
                .transport(transport)
                .timeout(timeout)
                .retries(retries)
                .udpPayloadSize(udpPayloadSize)
                .tlsHostname(tlsHostname);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Server)) {
            return false;
        }
        Server that = (Server) o;
        return retries == that.retries &&
               udpPayloadSize == that.udpPayloadSize &&
               address.equals(that.address) &&
               transport == that.transport &&
               timeout.equals(that.timeout) &&
               Objects.equals(tlsHostname, that.tlsHostname);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, transport, timeout, retries, udpPayloadSize, tlsHostname);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(64)
                .append("Server(")
                .append(address)
                .append(", ")
                .append(transport);
        if (tlsHostname != null) {
            buf.append(", tlsHostname: ").append(tlsHostname);
        }
        return buf.append(')').toString();
    }

    /**
     * Builds {@link Server} instances. Values which are not set are taken from {@link ClientDefaults}.
     */
    public static final class Builder {

        private final InetSocketAddress address;
        private Transport transport = Transport.UDP_TCP;
        private Duration timeout = ClientDefaults.DEFAULT_TIMEOUT;
        private int retries = ClientDefaults.DEFAULT_RETRIES;
        private int udpPayloadSize = ClientDefaults.DEFAULT_UDP_PAYLOAD_SIZE;
        private String tlsHostname;

        private Builder(InetSocketAddress address) {
            this.address = checkNotNull(address, "address");
        }

        public Builder transport(Transport transport) {
            this.transport = checkNotNull(transport, "transport");
            return this;
        }

        public Builder timeout(Duration timeout) {
            checkNotNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout: " + timeout + " (expected: > 0)");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = checkInRange(retries, 0, 255, "retries");
            return this;
        }

        public Builder udpPayloadSize(int udpPayloadSize) {
            this.udpPayloadSize = checkInRange(udpPayloadSize, 512, 65535, "udpPayloadSize");
            return this;
        }

        /**
         * Sets the name used for SNI and certificate verification. Required if the transport is
         * {@link Transport#TLS}, ignored otherwise.
         */
        public Builder tlsHostname(String tlsHostname) {
            this.tlsHostname = tlsHostname == null ? null : ObjectUtil.checkNonEmpty(tlsHostname, "tlsHostname");
            return this;
        }

        public Server build() {
            return new Server(this);
        }
    }
}
