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

import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.time.Duration;

/**
 * Default values applied to {@link Server}s which are not configured explicitly.
 * <p>
 * The defaults can be overridden with the system properties {@code dnsi.timeoutMillis}, {@code dnsi.retries} and
 * {@code dnsi.udpPayloadSize}.
 */
public final class ClientDefaults {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ClientDefaults.class);

    private static final long DEFAULT_TIMEOUT_MILLIS = 5000;
    private static final int DEFAULT_RETRIES_VALUE = 2;
    private static final int DEFAULT_UDP_PAYLOAD_SIZE_VALUE = 1232;

    /**
     * The per-attempt timeout.
     */
    public static final Duration DEFAULT_TIMEOUT;

    /**
     * The number of datagram retransmissions after the first one times out.
     */
    public static final int DEFAULT_RETRIES;

    /**
     * The UDP payload size advertised in the EDNS OPT record of datagram requests.
     */
    public static final int DEFAULT_UDP_PAYLOAD_SIZE;

    static {
        long timeoutMillis = SystemPropertyUtil.getLong("dnsi.timeoutMillis", DEFAULT_TIMEOUT_MILLIS);
        if (timeoutMillis <= 0) {
            logger.warn("-Ddnsi.timeoutMillis: {} (expected: > 0), using {}", timeoutMillis, DEFAULT_TIMEOUT_MILLIS);
            timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
        }
        int retries = SystemPropertyUtil.getInt("dnsi.retries", DEFAULT_RETRIES_VALUE);
        if (retries < 0 || retries > 255) {
            logger.warn("-Ddnsi.retries: {} (expected: 0-255), using {}", retries, DEFAULT_RETRIES_VALUE);
            retries = DEFAULT_RETRIES_VALUE;
        }
        int udpPayloadSize = SystemPropertyUtil.getInt("dnsi.udpPayloadSize", DEFAULT_UDP_PAYLOAD_SIZE_VALUE);
        if (udpPayloadSize < 512 || udpPayloadSize > 65535) {
            logger.warn("-Ddnsi.udpPayloadSize: {} (expected: 512-65535), using {}",
                        udpPayloadSize, DEFAULT_UDP_PAYLOAD_SIZE_VALUE);
            udpPayloadSize = DEFAULT_UDP_PAYLOAD_SIZE_VALUE;
        }

        DEFAULT_TIMEOUT = Duration.ofMillis(timeoutMillis);
        DEFAULT_RETRIES = retries;
        DEFAULT_UDP_PAYLOAD_SIZE = udpPayloadSize;

        if (logger.isDebugEnabled()) {
            logger.debug("-Ddnsi.timeoutMillis: {}", timeoutMillis);
            logger.debug("-Ddnsi.retries: {}", retries);
            logger.debug("-Ddnsi.udpPayloadSize: {}", udpPayloadSize);
        }
    }

    private ClientDefaults() {
        // Unused
    }
}
