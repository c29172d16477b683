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
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DefaultDnsRawRecord;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsSection;
import io.netty.util.internal.StringUtil;

import static io.netty.util.internal.ObjectUtil.checkInRange;
import static io.netty.util.internal.ObjectUtil.checkNonEmpty;
import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A request to be dispatched to one or more servers: a single question plus the query-level flags.
 * <p>
 * A {@link RequestMessage} is immutable. Every attempt obtains its own {@link DnsQuery} through
 * {@link #populate(DnsQuery, int)}, so a failed attempt never consumes the request.
 */
public final class RequestMessage {

    // Bits of the three bit Z field of the header as exposed by DnsMessage.z().
    static final int Z_AUTHENTIC_DATA = 0x2;
    static final int Z_CHECKING_DISABLED = 0x1;

    // DO bit in the TTL field of the OPT pseudo record.
    static final long OPT_DNSSEC_OK = 0x8000L;

    private static final int MIN_UDP_PAYLOAD_SIZE = 512;
    private static final int SOA_FIXED_FIELDS_LENGTH = 20;

    private final String name;
    private final DnsRecordType type;
    private final int dnsClass;
    private final boolean recursionDesired;
    private final boolean checkingDisabled;
    private final boolean authenticData;
    private final boolean dnssecOk;
    private final long ixfrSerial;

    private RequestMessage(Builder builder) {
        name = builder.name;
        type = builder.type;
        dnsClass = builder.dnsClass;
        recursionDesired = builder.recursionDesired;
        checkingDisabled = builder.checkingDisabled;
        authenticData = builder.authenticData;
        dnssecOk = builder.dnssecOk;
        ixfrSerial = builder.ixfrSerial;
    }

    /**
     * Returns a new builder for a request asking for records of the given type at the given name.
     */
    public static Builder builder(String name, DnsRecordType type) {
        return new Builder(name, type);
    }

    /**
     * Returns a request for a full zone transfer of the given zone.
     */
    public static RequestMessage axfr(String zone) {
        return builder(zone, DnsRecordType.AXFR).recursionDesired(false).build();
    }

    /**
     * Returns a request for an incremental zone transfer of the given zone, starting at the given serial.
     */
    public static RequestMessage ixfr(String zone, long serial) {
        return builder(zone, DnsRecordType.IXFR).recursionDesired(false).ixfrSerial(serial).build();
    }

    public String name() {
        return name;
    }

    public DnsRecordType type() {
        return type;
    }

    public int dnsClass() {
        return dnsClass;
    }

    public boolean isRecursionDesired() {
        return recursionDesired;
    }

    public boolean isCheckingDisabled() {
        return checkingDisabled;
    }

    public boolean isAuthenticData() {
        return authenticData;
    }

    public boolean isDnssecOk() {
        return dnssecOk;
    }

    /**
     * Returns the serial the client currently holds for an incremental zone transfer, or {@code -1}.
     */
    public long ixfrSerial() {
        return ixfrSerial;
    }

    /**
     * Returns {@code true} if the request may be answered by a sequence of responses, which is the case for
     * zone transfers.
     */
    public boolean isStreaming() {
        return DnsRecordType.AXFR.equals(type) || DnsRecordType.IXFR.equals(type);
    }

    /**
     * Fills the given empty query with the question, the header flags and the additional records of this
     * request.
     *
     * @param query the query to fill, usually freshly created for a single attempt
     * @param udpPayloadSize the payload size to advertise in an EDNS OPT record, or {@code 0} to only add an OPT
     *                       record if the DO flag is requested
     * @return the given query
     */
    public <T extends DnsQuery> T populate(T query, int udpPayloadSize) {
        checkNotNull(query, "query");
        query.setRecursionDesired(recursionDesired);
        int z = 0;
        if (authenticData) {
            z |= Z_AUTHENTIC_DATA;
        }
        if (checkingDisabled) {
            z |= Z_CHECKING_DISABLED;
        }
        query.setZ(z);
        query.addRecord(DnsSection.QUESTION, new DefaultDnsQuestion(name, type, dnsClass));

        if (ixfrSerial >= 0) {
            query.addRecord(DnsSection.AUTHORITY,
                            new DefaultDnsRawRecord(name, DnsRecordType.SOA, dnsClass, 0, ixfrSoaData()));
        }
        if (udpPayloadSize > 0 || dnssecOk) {
            int payloadSize = Math.max(udpPayloadSize, MIN_UDP_PAYLOAD_SIZE);
            query.addRecord(DnsSection.ADDITIONAL,
                            new DefaultDnsRawRecord(StringUtil.EMPTY_STRING, DnsRecordType.OPT, payloadSize,
                                                    dnssecOk ? OPT_DNSSEC_OK : 0, Unpooled.EMPTY_BUFFER));
        }
        return query;
    }

    // A SOA with root names and all timers zero, only the serial matters to the server.
    private ByteBuf ixfrSoaData() {
        ByteBuf data = Unpooled.buffer(2 + SOA_FIXED_FIELDS_LENGTH);
        data.writeByte(0);
        data.writeByte(0);
        data.writeInt((int) ixfrSerial);
        data.writeZero(SOA_FIXED_FIELDS_LENGTH - 4);
        return data;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(64)
                .append("RequestMessage(")
                .append(name)
                .append(' ')
                .append(DnsRecord.CLASS_IN == dnsClass ? "IN" : "CLASS" + dnsClass)
                .append(' ')
                .append(type.name());
        if (recursionDesired) {
            buf.append(", rd");
        }
        if (checkingDisabled) {
            buf.append(", cd");
        }
        if (authenticData) {
            buf.append(", ad");
        }
        if (dnssecOk) {
            buf.append(", do");
        }
        if (ixfrSerial >= 0) {
            buf.append(", serial: ").append(ixfrSerial);
        }
        return buf.append(')').toString();
    }

    /**
     * Builds {@link RequestMessage}s. Recursion desired is set by default, all other flags are cleared.
     */
    public static final class Builder {

        private final String name;
        private final DnsRecordType type;
        private int dnsClass = DnsRecord.CLASS_IN;
        private boolean recursionDesired = true;
        private boolean checkingDisabled;
        private boolean authenticData;
        private boolean dnssecOk;
        private long ixfrSerial = -1;

        private Builder(String name, DnsRecordType type) {
            this.name = checkNonEmpty(name, "name");
            this.type = checkNotNull(type, "type");
        }

        public Builder dnsClass(int dnsClass) {
            this.dnsClass = checkInRange(dnsClass, 0, 65535, "dnsClass");
            return this;
        }

        public Builder recursionDesired(boolean recursionDesired) {
            this.recursionDesired = recursionDesired;
            return this;
        }

        public Builder checkingDisabled(boolean checkingDisabled) {
            this.checkingDisabled = checkingDisabled;
            return this;
        }

        public Builder authenticData(boolean authenticData) {
            this.authenticData = authenticData;
            return this;
        }

        public Builder dnssecOk(boolean dnssecOk) {
            this.dnssecOk = dnssecOk;
            return this;
        }

        /**
         * Sets the serial of the zone version held by the client. Only meaningful for {@link DnsRecordType#IXFR}.
         */
        public Builder ixfrSerial(long ixfrSerial) {
            if (ixfrSerial < 0 || ixfrSerial > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("ixfrSerial: " + ixfrSerial + " (expected: 0-4294967295)");
            }
            this.ixfrSerial = ixfrSerial;
            return this;
        }

        public RequestMessage build() {
            if (ixfrSerial >= 0 && !DnsRecordType.IXFR.equals(type)) {
                throw new IllegalStateException("ixfrSerial is only valid for IXFR requests, not " + type.name());
            }
            if (DnsRecordType.IXFR.equals(type) && ixfrSerial < 0) {
                throw new IllegalStateException("IXFR requests require ixfrSerial");
            }
            return new RequestMessage(this);
        }
    }
}
