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
package io.dnsi.example.util;

import io.dnsi.client.Answer;
import io.dnsi.client.Server;
import io.dnsi.client.SystemServers;
import io.dnsi.client.Transport;
import io.dnsi.verify.RecordKey;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsSection;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Some useful methods for the examples.
 */
public final class ExampleUtil {

    private ExampleUtil() {
    }

    /**
     * Returns the transport named by the system property {@code transport} (udp, udp-tcp, tcp or tls).
     */
    public static Transport transport(Transport defaultTransport) {
        String value = System.getProperty("transport");
        if (value == null) {
            return defaultTransport;
        }
        return Transport.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    /**
     * Returns the server given by the system properties {@code server}, {@code port} and {@code tlsHostname}, or
     * the system name servers if {@code server} is not set.
     */
    public static List<Server> servers(Transport transport) throws UnknownHostException {
        String host = System.getProperty("server");
        if (host == null) {
            return SystemServers.load(transport);
        }
        int port = Integer.parseInt(System.getProperty("port", String.valueOf(transport.defaultPort())));
        return Collections.singletonList(
                Server.builder(new InetSocketAddress(InetAddress.getByName(host), port))
                      .transport(transport)
                      .tlsHostname(System.getProperty("tlsHostname"))
                      .build());
    }

    public static void print(Answer answer) {
        System.out.println(";; " + answer.stats());
        for (DnsResponse message : answer.messages()) {
            print(message);
        }
    }

    public static void print(DnsResponse message) {
        System.out.println(";; " + message.code() + ", id: " + message.id() +
                           (message.isTruncated() ? ", truncated" : ""));
        int count = message.count(DnsSection.ANSWER);
        for (int i = 0; i < count; i++) {
            DnsRecord record = message.recordAt(DnsSection.ANSWER, i);
            try {
                System.out.println(RecordKey.of(record));
            } catch (CorruptedFrameException e) {
                System.out.println("; malformed: " + record);
            }
        }
    }
}
