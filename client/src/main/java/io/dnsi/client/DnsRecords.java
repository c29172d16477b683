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
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.dns.DefaultDnsRecordDecoder;
import io.netty.handler.codec.dns.DnsPtrRecord;
import io.netty.handler.codec.dns.DnsRawRecord;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Accessors for the data of decoded records.
 * <p>
 * The decoder keeps the data of most records as a view into the buffer of the whole message, so names in the data
 * can be followed through compression pointers.
 */
public final class DnsRecords {

    /**
     * Returns {@code true} if the record is of the given type.
     */
    public static boolean isType(DnsRecord record, DnsRecordType type) {
        return type.equals(record.type());
    }

    /**
     * Returns a view of the data of the given record with its own reader index, or {@code null} if the record
     * does not carry raw data.
     */
    public static ByteBuf data(DnsRecord record) {
        checkNotNull(record, "record");
        if (record instanceof DnsRawRecord) {
            return ((DnsRawRecord) record).content().duplicate();
        }
        return null;
    }

    /**
     * Reads a possibly compressed domain name from the given buffer, advancing its reader index past the name.
     *
     * @throws CorruptedFrameException if the name is malformed
     */
    public static String readName(ByteBuf in) {
        try {
            return DefaultDnsRecordDecoder.decodeName(in);
        } catch (IndexOutOfBoundsException e) {
            throw new CorruptedFrameException("truncated domain name", e);
        }
    }

    /**
     * Returns the domain name a record of a type like NS, CNAME or PTR points to.
     *
     * @throws CorruptedFrameException if the record data cannot be decoded
     */
    public static String targetName(DnsRecord record) {
        if (record instanceof DnsPtrRecord) {
            return ((DnsPtrRecord) record).hostname();
        }
        ByteBuf data = data(record);
        if (data == null) {
            throw new CorruptedFrameException("no data in record: " + record);
        }
        return readName(data);
    }

    /**
     * Returns the serial of a SOA record as an unsigned value.
     *
     * @throws CorruptedFrameException if the record is not a SOA record or its data cannot be decoded
     */
    public static long soaSerial(DnsRecord record) {
        if (!isType(record, DnsRecordType.SOA)) {
            throw new CorruptedFrameException("not a SOA record: " + record);
        }
        ByteBuf data = data(record);
        if (data == null) {
            throw new CorruptedFrameException("no data in record: " + record);
        }
        readName(data);
        readName(data);
        if (data.readableBytes() < 4) {
            throw new CorruptedFrameException("truncated SOA record: " + record);
        }
        return data.readUnsignedInt();
    }

    private DnsRecords() {
        // Unused
    }
}
