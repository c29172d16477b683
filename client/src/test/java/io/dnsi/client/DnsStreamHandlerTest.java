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

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.concurrent.Future;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static io.dnsi.client.DnsTestMessages.a;
import static io.dnsi.client.DnsTestMessages.response;
import static io.dnsi.client.DnsTestMessages.soa;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DnsStreamHandlerTest {

    private static final InetSocketAddress SERVER = new InetSocketAddress("192.0.2.53", 53);
    private static final String ZONE = "example.com.";

    private static DnsStreamHandler newHandler(RequestMessage request) {
        return new DnsStreamHandler(SERVER, 42, XfrResponseTracker.newTracker(request));
    }

    @Test
    public void testPendingReceiveCompletedBySingleResponse() {
        DnsStreamHandler handler = newHandler(RequestMessage.builder("www.example.com", DnsRecordType.A).build());
        EmbeddedChannel channel = new EmbeddedChannel(handler);

        Future<DnsResponse> received = handler.receive();
        assertFalse(received.isDone());

        DnsResponse response = response(42, a("www." + ZONE, "192.0.2.1"));
        assertFalse(channel.writeInbound(response));

        assertTrue(received.isSuccess());
        assertSame(response, received.getNow());
        assertTrue(handler.isComplete());
        assertFalse(channel.isOpen());
        assertNull(handler.receive().getNow());
        response.release();
    }

    @Test
    public void testResponsesAreQueuedUntilReceived() {
        DnsStreamHandler handler = newHandler(RequestMessage.axfr(ZONE));
        EmbeddedChannel channel = new EmbeddedChannel(handler);

        DnsResponse first = response(42, soa(ZONE, 1), a("www." + ZONE, "192.0.2.1"));
        DnsResponse second = response(42, soa(ZONE, 1));
        channel.writeInbound(first);
        assertFalse(handler.isComplete());
        channel.writeInbound(second);
        assertTrue(handler.isComplete());

        assertSame(first, handler.receive().getNow());
        assertSame(second, handler.receive().getNow());
        Future<DnsResponse> end = handler.receive();
        assertTrue(end.isSuccess());
        assertNull(end.getNow());
        first.release();
        second.release();
    }

    @Test
    public void testResponseWithOtherIdIsIgnored() {
        DnsStreamHandler handler = newHandler(RequestMessage.builder("www.example.com", DnsRecordType.A).build());
        EmbeddedChannel channel = new EmbeddedChannel(handler);

        DnsResponse other = response(7, a("www." + ZONE, "192.0.2.1"));
        channel.writeInbound(other);
        assertEquals(0, other.refCnt());
        assertFalse(handler.isComplete());
        assertFalse(handler.receive().isDone());
        channel.finishAndReleaseAll();
    }

    @Test
    public void testConnectionClosedBeforeLastResponse() {
        DnsStreamHandler handler = newHandler(RequestMessage.axfr(ZONE));
        EmbeddedChannel channel = new EmbeddedChannel(handler);

        DnsResponse first = response(42, soa(ZONE, 1), a("www." + ZONE, "192.0.2.1"));
        channel.writeInbound(first);
        Future<DnsResponse> received = handler.receive();
        assertSame(first, received.getNow());
        first.release();

        Future<DnsResponse> next = handler.receive();
        channel.close();
        assertFalse(next.isSuccess());
        DnsExchangeException cause = assertInstanceOf(DnsExchangeException.class, next.cause());
        assertEquals(SERVER, cause.remoteAddress());
        assertFalse(handler.isComplete());
    }

    @Test
    public void testReadTimeout() {
        DnsStreamHandler handler = newHandler(RequestMessage.axfr(ZONE));
        EmbeddedChannel channel = new EmbeddedChannel(handler);

        Future<DnsResponse> received = handler.receive();
        channel.pipeline().fireExceptionCaught(ReadTimeoutException.INSTANCE);
        assertInstanceOf(DnsExchangeTimeoutException.class, received.cause());
        assertFalse(channel.isOpen());
    }

    @Test
    public void testMalformedTransferFailsStream() {
        DnsStreamHandler handler = newHandler(RequestMessage.axfr(ZONE));
        EmbeddedChannel channel = new EmbeddedChannel(handler);

        Future<DnsResponse> received = handler.receive();
        DnsResponse response = response(42, a("www." + ZONE, "192.0.2.1"));
        channel.writeInbound(response);
        assertEquals(0, response.refCnt());
        DnsExchangeException cause = assertInstanceOf(DnsExchangeException.class, received.cause());
        assertEquals(SERVER, cause.remoteAddress());
        assertFalse(channel.isOpen());
    }

    @Test
    public void testCloseReleasesQueuedResponses() {
        DnsStreamHandler handler = newHandler(RequestMessage.axfr(ZONE));
        EmbeddedChannel channel = new EmbeddedChannel(handler);

        DnsResponse first = response(42, soa(ZONE, 1), a("www." + ZONE, "192.0.2.1"));
        channel.writeInbound(first);
        assertTrue(handler.close().isSuccess());
        assertEquals(0, first.refCnt());
        assertFalse(channel.isOpen());
    }
}
