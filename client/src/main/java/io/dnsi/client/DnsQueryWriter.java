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
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsQuestion;
import io.netty.handler.codec.dns.DnsRecordEncoder;
import io.netty.handler.codec.dns.DnsSection;

/**
 * Writes a {@link DnsQuery} in wire format.
 * <p>
 * Unlike the query encoders of the codec, every section is written and the Z field of the header carries the AD
 * and CD flags, as needed for IXFR requests and DNSSEC aware queries.
 */
final class DnsQueryWriter {

    private static final DnsSection[] RECORD_SECTIONS = {
            DnsSection.ANSWER, DnsSection.AUTHORITY, DnsSection.ADDITIONAL
    };

    private final DnsRecordEncoder recordEncoder;

    DnsQueryWriter() {
        this(DnsRecordEncoder.DEFAULT);
    }

    DnsQueryWriter(DnsRecordEncoder recordEncoder) {
        this.recordEncoder = recordEncoder;
    }

    void write(DnsQuery query, ByteBuf out) throws Exception {
        writeHeader(query, out);
        int questions = query.count(DnsSection.QUESTION);
        for (int i = 0; i < questions; i++) {
            recordEncoder.encodeQuestion((DnsQuestion) query.recordAt(DnsSection.QUESTION, i), out);
        }
        for (DnsSection section : RECORD_SECTIONS) {
            int count = query.count(section);
            for (int i = 0; i < count; i++) {
                recordEncoder.encodeRecord(query.recordAt(section, i), out);
            }
        }
    }

    private static void writeHeader(DnsQuery query, ByteBuf out) {
        out.writeShort(query.id());
        int flags = (query.opCode().byteValue() & 0xF) << 11;
        if (query.isRecursionDesired()) {
            flags |= 1 << 8;
        }
        flags |= (query.z() & 0x7) << 4;
        out.writeShort(flags);
        out.writeShort(query.count(DnsSection.QUESTION));
        out.writeShort(query.count(DnsSection.ANSWER));
        out.writeShort(query.count(DnsSection.AUTHORITY));
        out.writeShort(query.count(DnsSection.ADDITIONAL));
    }
}
