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
package io.dnsi.verify;

import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.concurrent.Future;

import java.net.InetAddress;
import java.util.List;

/**
 * Asks the recursive resolvers configured for this host.
 */
public interface StubResolver {

    /**
     * Asks for the records of the given type at the given name. The caller must release the returned response.
     */
    Future<DnsResponse> query(String name, DnsRecordType type);

    /**
     * Looks up the IPv4 and IPv6 addresses of the given host.
     */
    Future<List<InetAddress>> lookupHost(String name);
}
