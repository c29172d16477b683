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

import io.dnsi.client.DnsRecords;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.dns.DnsPtrRecord;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.util.NetUtil;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * The type and data of a resource record in canonical form.
 * <p>
 * Domain names embedded in the data are decompressed and their ASCII letters lower-cased for the record types listed
 * in RFC 4034, section 6.2, so two instances are equal exactly when the records carry the same data, whatever the
 * compression or letter case used on the wire. Instances are ordered by type, then by their canonical data as
 * unsigned octets.
 */
public final class RecordData implements Comparable<RecordData> {

    private enum Layout {
        ADDRESS_V4,
        ADDRESS_V6,
        NAME,
        TWO_NAMES,
        PREFERENCE_NAME,
        SOA,
        SRV,
        TEXT,
        OPAQUE
    }

    private static final Map<DnsRecordType, Layout> LAYOUTS = new HashMap<DnsRecordType, Layout>();

    static {
        LAYOUTS.put(DnsRecordType.A, Layout.ADDRESS_V4);
        LAYOUTS.put(DnsRecordType.AAAA, Layout.ADDRESS_V6);
        LAYOUTS.put(DnsRecordType.NS, Layout.NAME);
        LAYOUTS.put(DnsRecordType.CNAME, Layout.NAME);
        LAYOUTS.put(DnsRecordType.PTR, Layout.NAME);
        LAYOUTS.put(DnsRecordType.DNAME, Layout.NAME);
        // MD, MF, MB, MG, MR
        LAYOUTS.put(DnsRecordType.valueOf(3), Layout.NAME);
        LAYOUTS.put(DnsRecordType.valueOf(4), Layout.NAME);
        LAYOUTS.put(DnsRecordType.valueOf(7), Layout.NAME);
        LAYOUTS.put(DnsRecordType.valueOf(8), Layout.NAME);
        LAYOUTS.put(DnsRecordType.valueOf(9), Layout.NAME);
        // MINFO
        LAYOUTS.put(DnsRecordType.valueOf(14), Layout.TWO_NAMES);
        LAYOUTS.put(DnsRecordType.RP, Layout.TWO_NAMES);
        LAYOUTS.put(DnsRecordType.MX, Layout.PREFERENCE_NAME);
        LAYOUTS.put(DnsRecordType.AFSDB, Layout.PREFERENCE_NAME);
        // RT
        LAYOUTS.put(DnsRecordType.valueOf(21), Layout.PREFERENCE_NAME);
        LAYOUTS.put(DnsRecordType.KX, Layout.PREFERENCE_NAME);
        LAYOUTS.put(DnsRecordType.SOA, Layout.SOA);
        LAYOUTS.put(DnsRecordType.SRV, Layout.SRV);
        LAYOUTS.put(DnsRecordType.TXT, Layout.TEXT);
        LAYOUTS.put(DnsRecordType.SPF, Layout.TEXT);
    }

    private final DnsRecordType type;
    private final byte[] canonical;
    private final String text;

    private RecordData(DnsRecordType type, byte[] canonical, String text) {
        this.type = type;
        this.canonical = canonical;
        this.text = text;
    }

    /**
     * Returns the canonical data of the given record.
     *
     * @throws CorruptedFrameException if the record carries no data or its data is malformed
     */
    public static RecordData of(DnsRecord record) {
        checkNotNull(record, "record");
        DnsRecordType type = record.type();
        if (record instanceof DnsPtrRecord) {
            String hostname = DnsNames.toAbsolute(((DnsPtrRecord) record).hostname());
            return new RecordData(type, DnsNames.toCanonicalWire(hostname), hostname);
        }
        ByteBuf data = DnsRecords.data(record);
        if (data == null) {
            throw new CorruptedFrameException("no data in record: " + record);
        }
        Layout layout = LAYOUTS.get(type);
        if (layout == null) {
            layout = Layout.OPAQUE;
        }
        ByteBuf out = Unpooled.buffer(data.readableBytes() + 16);
        try {
            StringBuilder text = new StringBuilder(32);
            try {
                decode(layout, data, out, text);
            } catch (IndexOutOfBoundsException e) {
                throw new CorruptedFrameException("truncated data in record: " + record, e);
            }
            if (data.isReadable()) {
                throw new CorruptedFrameException("trailing data in record: " + record);
            }
            return new RecordData(type, ByteBufUtil.getBytes(out), text.toString());
        } finally {
            out.release();
        }
    }

    private static void decode(Layout layout, ByteBuf in, ByteBuf out, StringBuilder text) {
        switch (layout) {
            case ADDRESS_V4:
            case ADDRESS_V6:
                int length = layout == Layout.ADDRESS_V4 ? 4 : 16;
                if (in.readableBytes() != length) {
                    throw new CorruptedFrameException("invalid address length: " + in.readableBytes());
                }
                byte[] address = new byte[length];
                in.readBytes(address);
                out.writeBytes(address);
                text.append(NetUtil.bytesToIpAddress(address));
                break;
            case NAME:
                name(in, out, text);
                break;
            case TWO_NAMES:
                name(in, out, text);
                text.append(' ');
                name(in, out, text);
                break;
            case PREFERENCE_NAME:
                unsignedShort(in, out, text);
                text.append(' ');
                name(in, out, text);
                break;
            case SOA:
                name(in, out, text);
                text.append(' ');
                name(in, out, text);
                for (int i = 0; i < 5; i++) {
                    long value = in.readUnsignedInt();
                    out.writeInt((int) value);
                    text.append(' ').append(value);
                }
                break;
            case SRV:
                for (int i = 0; i < 3; i++) {
                    unsignedShort(in, out, text);
                    text.append(' ');
                }
                name(in, out, text);
                break;
            case TEXT:
                characterStrings(in, out, text);
                break;
            case OPAQUE:
                int size = in.readableBytes();
                text.append("\\# ").append(size);
                if (size > 0) {
                    text.append(' ').append(ByteBufUtil.hexDump(in));
                }
                out.writeBytes(in);
                break;
            default:
                throw new Error("unexpected layout: " + layout);
        }
    }

    private static void name(ByteBuf in, ByteBuf out, StringBuilder text) {
        String name = DnsNames.toAbsolute(DnsRecords.readName(in));
        out.writeBytes(DnsNames.toCanonicalWire(name));
        text.append(name);
    }

    private static void unsignedShort(ByteBuf in, ByteBuf out, StringBuilder text) {
        int value = in.readUnsignedShort();
        out.writeShort(value);
        text.append(value);
    }

    private static void characterStrings(ByteBuf in, ByteBuf out, StringBuilder text) {
        boolean first = true;
        while (in.isReadable()) {
            int length = in.readUnsignedByte();
            ByteBuf string = in.readSlice(length);
            out.writeByte(length);
            out.writeBytes(string, string.readerIndex(), length);
            if (!first) {
                text.append(' ');
            }
            first = false;
            text.append('"');
            for (int i = string.readerIndex(); i < string.writerIndex(); i++) {
                int b = string.getUnsignedByte(i);
                if (b == '"' || b == '\\') {
                    text.append('\\').append((char) b);
                } else if (b < 0x20 || b > 0x7E) {
                    text.append('\\');
                    if (b < 100) {
                        text.append('0');
                    }
                    if (b < 10) {
                        text.append('0');
                    }
                    text.append(b);
                } else {
                    text.append((char) b);
                }
            }
            text.append('"');
        }
    }

    public DnsRecordType type() {
        return type;
    }

    /**
     * Returns a copy of the canonical wire form of the data.
     */
    public byte[] canonicalData() {
        return canonical.clone();
    }

    @Override
    public int compareTo(RecordData o) {
        int cmp = Integer.compare(type.intValue(), o.type.intValue());
        if (cmp != 0) {
            return cmp;
        }
        return DnsNames.compareUnsigned(canonical, o.canonical);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordData)) {
            return false;
        }
        RecordData that = (RecordData) o;
        return type.intValue() == that.type.intValue() && Arrays.equals(canonical, that.canonical);
    }

    @Override
    public int hashCode() {
        return 31 * type.intValue() + Arrays.hashCode(canonical);
    }

    /**
     * Returns the type and the data in presentation format, for example {@code "A 192.0.2.1"}.
     */
    @Override
    public String toString() {
        return typeName(type) + ' ' + text;
    }

    // Types the codec has no constant for are all named UNKNOWN.
    static String typeName(DnsRecordType type) {
        DnsRecordType known = DnsRecordType.valueOf(type.intValue());
        return "UNKNOWN".equals(known.name()) ? "TYPE" + type.intValue() : known.name();
    }
}
