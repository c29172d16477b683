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

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A failed attempt to exchange a request with a single server. Connection failures, timeouts, TLS handshake
 * failures and malformed responses are all reported as this exception.
 */
public class DnsExchangeException extends RuntimeException {

    private static final long serialVersionUID = -4215869210931672583L;

    private final InetSocketAddress remoteAddress;

    public DnsExchangeException(InetSocketAddress remoteAddress, String message) {
        super(message);
        this.remoteAddress = checkNotNull(remoteAddress, "remoteAddress");
    }

    public DnsExchangeException(InetSocketAddress remoteAddress, String message, Throwable cause) {
        super(message, cause);
        this.remoteAddress = checkNotNull(remoteAddress, "remoteAddress");
    }

    /**
     * Returns the address of the server the exchange was attempted with.
     */
    public InetSocketAddress remoteAddress() {
        return remoteAddress;
    }

    static DnsExchangeException wrap(InetSocketAddress remoteAddress, Throwable cause) {
        if (cause instanceof DnsExchangeException) {
            return (DnsExchangeException) cause;
        }
        return new DnsExchangeException(remoteAddress, "exchange with " + remoteAddress + " failed: " + cause,
                                        cause);
    }
}
