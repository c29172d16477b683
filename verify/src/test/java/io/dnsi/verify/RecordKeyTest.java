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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.dns.DefaultDnsPtrRecord;
import io.netty.handler.codec.dns.DefaultDnsRawRecord;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static io.dnsi.verify.Records.a;
import static io.dnsi.verify.Records.aaaa;
import static io.dnsi.verify.Records.mx;
import static io.dnsi.verify.Records.ns;
import static io.dnsi.verify.Records.raw;
import static io.dnsi.verify.Records.soa;
import static io.dnsi.verify.Records.txt;
import static io.dnsi.verify.Records.writeName;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RecordKeyTest {

    private static RecordKey key(DnsRecord record) {
        try {
            return RecordKey.of(record);
        } finally {
            ReferenceCountUtil.release(record);
        }
    }

    @Test
    public void testPresentationFormat() {
        assertEquals("www.example.com. IN A 192.0.2.1", key(a("www.example.com", "192.0.2.1")).toString());
        assertEquals("www.example.com. IN AAAA 2001:db8::1", key(aaaa("www.example.com", "2001:db8::1")).toString());
        assertEquals("example.com. IN MX 10 mail.example.com.",
                     key(mx("example.com", 10, "mail.example.com")).toString());
        assertEquals("example.com. IN SOA ns1.example.com. hostmaster.example.com. 42 7200 3600 1209600 300",
                     key(soa("example.com", "ns1.example.com", "hostmaster.example.com", 42)).toString());
        assertEquals("example.com. IN TXT \"v=spf1 -all\" \"say \\\"hi\\\"\"",
                     key(txt("example.com", "v=spf1 -all", "say \"hi\"")).toString());
        assertEquals("example.com. IN TYPE65280 \\# 2 abcd",
                     key(raw("example.com", DnsRecordType.valueOf(65280), (byte) 0xAB, (byte) 0xCD)).toString());
    }

    @Test
    public void testTtlIsIgnored() {
        assertEquals(key(a("www.example.com", "192.0.2.1", 60)), key(a("www.example.com", "192.0.2.1", 86400)));
    }

    @Test
    public void testOwnerCaseIsIgnored() {
        RecordKey lower = key(a("www.example.com", "192.0.2.1"));
        RecordKey upper = key(a("WWW.EXAMPLE.COM", "192.0.2.1"));
        assertEquals(lower, upper);
        assertEquals(lower.hashCode(), upper.hashCode());
        assertEquals(0, lower.compareTo(upper));
    }

    @Test
    public void testEmbeddedNamesAreCanonical() {
        // The name is followed through a compression pointer into the rest of the message.
        ByteBuf message = Unpooled.buffer();
        writeName(message, "example.com");
        int offset = message.writerIndex();
        message.writeByte(3).writeBytes(new byte[] { 'n', 's', '1' }).writeShort(0xC000);
        DnsRecord compressed = new DefaultDnsRawRecord(
                "example.com", DnsRecordType.NS, 3600, message.setIndex(offset, message.writerIndex()));

        RecordKey expected = key(ns("example.com", "NS1.Example.COM"));
        RecordKey actual = key(compressed);
        assertEquals(expected, actual);
        assertEquals("example.com. IN NS ns1.example.com.", actual.toString());
    }

    @Test
    public void testPtrRecordsDecodedByTheCodec() {
        RecordKey decoded = key(new DefaultDnsPtrRecord("1.2.0.192.in-addr.arpa", DnsRecord.CLASS_IN, 3600,
                                                        "host.example.com"));
        RecordKey raw = key(ns("1.2.0.192.in-addr.arpa", "host.example.com"));
        assertEquals("1.2.0.192.in-addr.arpa. IN PTR host.example.com.", decoded.toString());
        // Same data but of another type.
        assertNotEquals(raw, decoded);
    }

    @Test
    public void testOrdering() {
        RecordKey a1 = key(a("a.example.com", "192.0.2.2"));
        RecordKey b1 = key(a("b.example.com", "192.0.2.1"));
        RecordKey b2 = key(a("b.example.com", "192.0.2.2"));
        RecordKey bNs = key(ns("b.example.com", "ns.example.com"));
        assertTrue(a1.compareTo(b1) < 0);
        assertTrue(b1.compareTo(b2) < 0);
        // A sorts before NS.
        assertTrue(b2.compareTo(bNs) < 0);
    }

    @Test
    public void testMalformedDataIsRejected() {
        assertThrows(CorruptedFrameException.class, new Executable() {
            @Override
            public void execute() {
                key(raw("www.example.com", DnsRecordType.A, (byte) 192, (byte) 0, (byte) 2));
            }
        });
        assertThrows(CorruptedFrameException.class, new Executable() {
            @Override
            public void execute() {
                key(raw("example.com", DnsRecordType.MX, (byte) 0, (byte) 10, (byte) 4, (byte) 'm'));
            }
        });
        assertThrows(CorruptedFrameException.class, new Executable() {
            @Override
            public void execute() {
                key(raw("example.com", DnsRecordType.TXT, (byte) 5, (byte) 'a'));
            }
        });
    }
}
