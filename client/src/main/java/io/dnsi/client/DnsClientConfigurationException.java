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
 * Signals that a request cannot be dispatched as configured, for example because no server was given or a
 * transport cannot carry the request. It is always raised before any network I/O takes place.
 */
public class DnsClientConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 6391052740812350267L;

    public DnsClientConfigurationException(String message) {
        super(message);
    }
}
