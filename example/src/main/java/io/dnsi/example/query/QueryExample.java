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
package io.dnsi.example.query;

import io.dnsi.client.Client;
import io.dnsi.client.RequestMessage;
import io.dnsi.client.Server;
import io.dnsi.client.Transport;
import io.dnsi.example.util.ExampleUtil;
import io.dnsi.verify.AuthoritativeResolver;
import io.dnsi.verify.DiffItem;
import io.dnsi.verify.NettyStubResolver;
import io.dnsi.verify.VerifiedAnswer;
import io.dnsi.verify.VerifyingQuery;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.codec.dns.DnsRecordType;

import java.util.List;

/**
 * Queries a name and optionally compares the answer with the answer of the authoritative name servers.
 * <p>
 * Example: {@code -Dname=example.com -Dtype=A -Dverify=true}. The name servers of the system are asked unless
 * {@code -Dserver=} is given.
 */
public final class QueryExample {

    static final String NAME = System.getProperty("name", "example.com");
    static final String TYPE = System.getProperty("type", "A");
    static final boolean VERIFY = Boolean.getBoolean("verify");
    static final boolean FORCE = Boolean.getBoolean("force");
    static final boolean DNSSEC_OK = Boolean.getBoolean("dnssec");

    public static void main(String[] args) throws Exception {
        Transport transport = ExampleUtil.transport(Transport.UDP_TCP);
        List<Server> servers = ExampleUtil.servers(transport);
        RequestMessage request = RequestMessage.builder(NAME, DnsRecordType.valueOf(TYPE))
                                               .dnssecOk(DNSSEC_OK)
                                               .build();

        EventLoopGroup group = new NioEventLoopGroup(1);
        NettyStubResolver stub = new NettyStubResolver(group.next(), servers.get(0).timeout());
        try {
            Client client = new Client(group);
            AuthoritativeResolver resolver = new AuthoritativeResolver(group.next(), stub);
            VerifyingQuery query = new VerifyingQuery(group.next(), client, resolver);

            VerifiedAnswer result = query.execute(servers, request, VERIFY, FORCE).sync().getNow();
            try {
                ExampleUtil.print(result.answer());
                if (result.verificationCause() != null) {
                    System.err.println(";; verification failed: " + result.verificationCause());
                } else if (result.isVerified()) {
                    if (result.diff().isNoDifference()) {
                        System.out.println(";; authoritative answer matches");
                    } else {
                        System.out.println(";; authoritative answer differs:");
                        for (DiffItem item : result.diff().items()) {
                            System.out.println(item);
                        }
                    }
                }
            } finally {
                result.release();
            }
        } finally {
            stub.close();
            group.shutdownGracefully();
        }
    }
}
