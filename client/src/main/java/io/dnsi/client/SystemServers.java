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

import io.netty.resolver.dns.DnsServerAddresses;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Builds the server list from the name servers the platform is configured with (e.g. {@code /etc/resolv.conf}).
 * <p>
 * The configuration is read when {@link #load(Transport)} is called; the returned list is immutable and meant to
 * be passed on rather than reloaded.
 */
public final class SystemServers {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(SystemServers.class);

    /**
     * Returns the system name servers, contacted over the given transport with the default settings.
     */
    public static List<Server> load(Transport transport) {
        return load(transport, ClientDefaults.DEFAULT_TIMEOUT, ClientDefaults.DEFAULT_RETRIES,
                    ClientDefaults.DEFAULT_UDP_PAYLOAD_SIZE);
    }

    /**
     * Returns the system name servers, contacted over the given transport with the given settings.
     */
    public static List<Server> load(Transport transport, Duration timeout, int retries, int udpPayloadSize) {
        checkNotNull(transport, "transport");
        if (transport == Transport.TLS) {
            throw new DnsClientConfigurationException("system name servers cannot be used with TLS transport");
        }
        return toServers(DnsServerAddresses.defaultAddressList(), transport, timeout, retries, udpPayloadSize);
    }

    static List<Server> toServers(List<InetSocketAddress> addresses, Transport transport, Duration timeout,
                                  int retries, int udpPayloadSize) {
        List<Server> servers = new ArrayList<Server>(addresses.size());
        for (InetSocketAddress address : addresses) {
            servers.add(Server.builder(address)
                              .transport(transport)
                              .timeout(timeout)
                              .retries(retries)
                              .udpPayloadSize(udpPayloadSize)
                              .build());
        }
        if (logger.isDebugEnabled()) {
            logger.debug("System name servers: {}", servers);
        }
        return Collections.unmodifiableList(servers);
    }

    private SystemServers() {
        // Unused
    }
}
