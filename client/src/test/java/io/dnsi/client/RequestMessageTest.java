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

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.dns.DefaultDnsQuery;
import io.netty.handler.codec.dns.DefaultDnsRecordDecoder;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RequestMessageTest {

    @Test
    public void testDefaults() {
        RequestMessage request = RequestMessage.builder("example.com", DnsRecordType.MX).build();
        assertEquals(DnsRecord.CLASS_IN, request.dnsClass());
        assertTrue(request.isRecursionDesired());
        assertFalse(request.isCheckingDisabled());
        assertFalse(request.isAuthenticData());
        assertFalse(request.isDnssecOk());
        assertFalse(request.isStreaming());
        assertEquals(-1, request.ixfrSerial());
    }

    @Test
    public void testZoneTransferRequests() {
        RequestMessage axfr = RequestMessage.axfr("example.com");
        assertTrue(axfr.isStreaming());
        assertFalse(axfr.isRecursionDesired());

        RequestMessage ixfr = RequestMessage.ixfr("example.com", 2026101900L);
        assertTrue(ixfr.isStreaming());
        assertEquals(2026101900L, ixfr.ixfrSerial());
    }

    @Test
    public void testIxfrRequiresSerial() {
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                RequestMessage.builder("example.com", DnsRecordType.IXFR).build();
            }
        });
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                RequestMessage.builder("example.com", DnsRecordType.A).ixfrSerial(1).build();
            }
        });
    }

    @Test
    public void testStreamEncodingCarriesFlagsAndAuthoritySection() throws Exception {
        RequestMessage request = RequestMessage.builder("example.com", DnsRecordType.IXFR)
                                               .recursionDesired(false)
                                               .authenticData(true)
                                               .checkingDisabled(true)
                                               .ixfrSerial(0x01020304L)
                                               .build();
        EmbeddedChannel channel = new EmbeddedChannel(new StreamQueryEncoder());
        assertTrue(channel.writeOutbound(request.populate(new DefaultDnsQuery(0x1234), 0)));
        ByteBuf out = channel.readOutbound();
        try {
            assertEquals(out.readableBytes() - 2, out.readUnsignedShort());
            assertEquals(0x1234, out.readUnsignedShort());
            // No RD, AD and CD set.
            assertEquals(0x0030, out.readUnsignedShort());
            assertEquals(1, out.readUnsignedShort());
            assertEquals(0, out.readUnsignedShort());
            assertEquals(1, out.readUnsignedShort());
            assertEquals(0, out.readUnsignedShort());

            assertEquals("example.com.", DefaultDnsRecordDecoder.decodeName(out));
            assertEquals(DnsRecordType.IXFR.intValue(), out.readUnsignedShort());
            assertEquals(DnsRecord.CLASS_IN, out.readUnsignedShort());

            assertEquals("example.com.", DefaultDnsRecordDecoder.decodeName(out));
            assertEquals(DnsRecordType.SOA.intValue(), out.readUnsignedShort());
            assertEquals(DnsRecord.CLASS_IN, out.readUnsignedShort());
            assertEquals(0, out.readInt());
            assertEquals(22, out.readUnsignedShort());
            assertEquals(".", DefaultDnsRecordDecoder.decodeName(out));
            assertEquals(".", DefaultDnsRecordDecoder.decodeName(out));
            assertEquals(0x01020304L, out.readUnsignedInt());
            out.skipBytes(16);
            assertFalse(out.isReadable());
        } finally {
            out.release();
        }
        assertFalse(channel.finish());
    }

    @Test
    public void testDnssecOkAddsOptRecord() throws Exception {
        RequestMessage request = RequestMessage.builder("example.com", DnsRecordType.A).dnssecOk(true).build();
        EmbeddedChannel channel = new EmbeddedChannel(new StreamQueryEncoder());
        assertTrue(channel.writeOutbound(request.populate(new DefaultDnsQuery(1), 0)));
        ByteBuf out = channel.readOutbound();
        try {
            out.skipBytes(2 + 2);
            // RD only.
            assertEquals(0x0100, out.readUnsignedShort());
            out.skipBytes(6);
            assertEquals(1, out.readUnsignedShort());
            DefaultDnsRecordDecoder.decodeName(out);
            out.skipBytes(4);

            assertEquals(".", DefaultDnsRecordDecoder.decodeName(out));
            assertEquals(DnsRecordType.OPT.intValue(), out.readUnsignedShort());
            assertEquals(512, out.readUnsignedShort());
            assertEquals(0x8000, out.readInt());
            assertEquals(0, out.readUnsignedShort());
            assertFalse(out.isReadable());
        } finally {
            out.release();
        }
        assertFalse(channel.finish());
    }
}
