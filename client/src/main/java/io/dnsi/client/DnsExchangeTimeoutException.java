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

/**
 * A {@link DnsExchangeException} raised when a server did not answer in time.
 */
public final class DnsExchangeTimeoutException extends DnsExchangeException {

    private static final long serialVersionUID = 2740166342170735926L;

    public DnsExchangeTimeoutException(InetSocketAddress remoteAddress, String message) {
        super(remoteAddress, message);
    }
}
