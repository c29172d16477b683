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
package io.dnsi.example.xfr;

import io.dnsi.client.Answer;
import io.dnsi.client.Client;
import io.dnsi.client.RequestMessage;
import io.dnsi.client.ResponseStream;
import io.dnsi.client.Transport;
import io.dnsi.example.util.ExampleUtil;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

/**
 * Transfers a zone and prints every message as it arrives.
 * <p>
 * Example: {@code -Dzone=example.com -Dserver=192.0.2.53}. Set {@code -Dserial=} for an incremental transfer.
 */
public final class XfrExample {

    static final String ZONE = System.getProperty("zone", "example.com");
    static final String SERIAL = System.getProperty("serial");

    public static void main(String[] args) throws Exception {
        if (System.getProperty("server") == null) {
            System.setProperty("server", "127.0.0.1");
        }
        Transport transport = ExampleUtil.transport(Transport.TCP);
        RequestMessage request = SERIAL == null ? RequestMessage.axfr(ZONE)
                                                : RequestMessage.ixfr(ZONE, Long.parseLong(SERIAL));

        EventLoopGroup group = new NioEventLoopGroup(1);
        try {
            Client client = new Client(group);
            ResponseStream stream = client.requestMulti(ExampleUtil.servers(transport), request).sync().getNow();
            int messages = 0;
            for (;;) {
                Answer answer = stream.next().sync().getNow();
                if (answer == null) {
                    break;
                }
                try {
                    ExampleUtil.print(answer.message());
                } finally {
                    answer.release();
                }
                messages++;
            }
            System.out.println(";; " + messages + " message(s), " + stream.stats());
            stream.close();
        } finally {
            group.shutdownGracefully();
        }
    }
}
