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

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.dns.DatagramDnsQuery;
import io.netty.handler.codec.dns.DatagramDnsQueryDecoder;
import io.netty.handler.codec.dns.DatagramDnsResponse;
import io.netty.handler.codec.dns.DatagramDnsResponseEncoder;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DefaultDnsResponse;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsQuestion;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsSection;
import io.netty.handler.codec.dns.TcpDnsQueryDecoder;
import io.netty.handler.codec.dns.TcpDnsResponseEncoder;
import io.netty.util.concurrent.Future;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.dnsi.client.DnsTestMessages.a;
import static io.dnsi.client.DnsTestMessages.soa;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Exchanges with name servers on the loopback interface built from the server side codecs.
 */
public class NettyDnsExchangerTest {

    private static final String ZONE = "example.com.";

    private static EventLoopGroup group;

    private final List<Channel> serverChannels = new ArrayList<Channel>();
    private final AtomicInteger datagrams = new AtomicInteger();

    @BeforeAll
    public static void setUpGroup() {
        group = new NioEventLoopGroup(2);
    }

    @AfterAll
    public static void tearDownGroup() {
        group.shutdownGracefully(0, 0, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @AfterEach
    public void closeServers() {
        for (Channel ch : serverChannels) {
            ch.close().syncUninterruptibly();
        }
    }

    private InetSocketAddress startStreamServer() {
        ServerBootstrap b = new ServerBootstrap();
        b.group(group)
         .channel(NioServerSocketChannel.class)
         .childHandler(new ChannelInitializer<SocketChannel>() {
             @Override
             protected void initChannel(SocketChannel ch) {
                 ch.pipeline().addLast(new TcpDnsQueryDecoder(), new TcpDnsResponseEncoder(),
                                       new StreamServerHandler());
             }
         });
        Channel ch = b.bind(new InetSocketAddress("127.0.0.1", 0)).syncUninterruptibly().channel();
        serverChannels.add(ch);
        return (InetSocketAddress) ch.localAddress();
    }

    private void startDatagramServer(InetSocketAddress address, final boolean answer) {
        Bootstrap b = new Bootstrap();
        b.group(group)
         .channel(NioDatagramChannel.class)
         .handler(new ChannelInitializer<DatagramChannel>() {
             @Override
             protected void initChannel(DatagramChannel ch) {
                 ch.pipeline().addLast(new DatagramDnsQueryDecoder(), new DatagramDnsResponseEncoder(),
                                       new DatagramServerHandler(answer));
             }
         });
        serverChannels.add(b.bind(address).syncUninterruptibly().channel());
    }

    @Test
    public void testTruncatedDatagramResponseIsRetriedOverTcp() {
        InetSocketAddress address = startStreamServer();
        startDatagramServer(address, true);

        Client client = new Client(group);
        Server server = Server.builder(address).transport(Transport.UDP_TCP).build();
        Future<Answer> future = client.query(Collections.singletonList(server), "www.example.com",
                                             DnsRecordType.A).awaitUninterruptibly();

        assertTrue(future.isSuccess(), String.valueOf(future.cause()));
        Answer answer = future.getNow();
        try {
            assertEquals(1, datagrams.get());
            assertEquals(Protocol.TCP, answer.stats().protocol());
            assertEquals(address, answer.stats().serverAddress());
            assertEquals(1, answer.message().count(DnsSection.ANSWER));
            assertEquals(DnsRecordType.A, answer.message().recordAt(DnsSection.ANSWER).type());
        } finally {
            answer.release();
        }
    }

    @Test
    public void testUnansweredDatagramsAreRetransmitted() {
        InetSocketAddress address = startStreamServer();
        startDatagramServer(address, false);

        Client client = new Client(group);
        Server server = Server.builder(address)
                              .transport(Transport.UDP)
                              .timeout(Duration.ofMillis(200))
                              .retries(2)
                              .build();
        Future<Answer> future = client.query(Collections.singletonList(server), "www.example.com",
                                             DnsRecordType.A).awaitUninterruptibly();

        assertInstanceOf(DnsExchangeTimeoutException.class, future.cause());
        assertEquals(3, datagrams.get());
    }

    @Test
    public void testZoneTransferIsStreamed() {
        InetSocketAddress address = startStreamServer();

        Client client = new Client(group);
        Server server = Server.builder(address).transport(Transport.TCP).build();
        ResponseStream stream = client.requestMulti(Collections.singletonList(server), RequestMessage.axfr(ZONE))
                                      .syncUninterruptibly().getNow();

        int records = 0;
        for (;;) {
            Answer answer = stream.next().syncUninterruptibly().getNow();
            if (answer == null) {
                break;
            }
            records += answer.message().count(DnsSection.ANSWER);
            answer.release();
        }
        assertEquals(4, records);
        assertTrue(stream.isComplete());
        assertTrue(stream.stats().isFinished());
        stream.close();
    }

    @Test
    public void testConnectionRefusedFailsOverToNextServer() {
        InetSocketAddress address = startStreamServer();
        Channel closed = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        // Unused
                    }
                })
                .bind(new InetSocketAddress("127.0.0.1", 0)).syncUninterruptibly().channel();
        InetSocketAddress refusing = (InetSocketAddress) closed.localAddress();
        closed.close().syncUninterruptibly();

        Client client = new Client(group);
        List<Server> servers = new ArrayList<Server>();
        servers.add(Server.builder(refusing).transport(Transport.TCP).build());
        servers.add(Server.builder(address).transport(Transport.TCP).build());
        Future<Answer> future = client.query(servers, "www.example.com", DnsRecordType.A).awaitUninterruptibly();

        assertTrue(future.isSuccess(), String.valueOf(future.cause()));
        assertEquals(address, future.getNow().stats().serverAddress());
        future.getNow().release();
    }

    private final class DatagramServerHandler extends SimpleChannelInboundHandler<DatagramDnsQuery> {

        private final boolean answer;

        DatagramServerHandler(boolean answer) {
            this.answer = answer;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramDnsQuery query) {
            datagrams.incrementAndGet();
            if (!answer) {
                return;
            }
            DatagramDnsResponse response = new DatagramDnsResponse(query.recipient(), query.sender(), query.id());
            DnsQuestion question = query.recordAt(DnsSection.QUESTION);
            response.addRecord(DnsSection.QUESTION, new DefaultDnsQuestion(question.name(), question.type()));
            response.setTruncated(true);
            ctx.writeAndFlush(response);
        }
    }

    private static final class StreamServerHandler extends SimpleChannelInboundHandler<DnsQuery> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DnsQuery query) {
            DnsQuestion question = query.recordAt(DnsSection.QUESTION);
            if (DnsRecordType.AXFR.equals(question.type())) {
                DnsResponse first = new DefaultDnsResponse(query.id());
                first.addRecord(DnsSection.ANSWER, soa(ZONE, 7));
                first.addRecord(DnsSection.ANSWER, a("www." + ZONE, "192.0.2.1"));
                ctx.write(first);
                DnsResponse second = new DefaultDnsResponse(query.id());
                second.addRecord(DnsSection.ANSWER, a("mail." + ZONE, "192.0.2.2"));
                second.addRecord(DnsSection.ANSWER, soa(ZONE, 7));
                ctx.writeAndFlush(second);
                return;
            }
            DnsResponse response = new DefaultDnsResponse(query.id());
            response.addRecord(DnsSection.ANSWER, a(question.name(), "192.0.2.80"));
            ctx.writeAndFlush(response);
        }
    }
}
