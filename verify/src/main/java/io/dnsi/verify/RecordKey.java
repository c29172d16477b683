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

import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.dns.DnsRecord;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Identifies a resource record by its owner, class and {@link RecordData}; the TTL is not part of the key.
 * <p>
 * Keys are ordered by owner in canonical DNS name order, then by class, then by data.
 */
public final class RecordKey implements Comparable<RecordKey> {

    private final String owner;
    private final int dnsClass;
    private final RecordData data;

    RecordKey(String owner, int dnsClass, RecordData data) {
        this.owner = DnsNames.toAbsolute(checkNotNull(owner, "owner"));
        this.dnsClass = dnsClass;
        this.data = checkNotNull(data, "data");
    }

    /**
     * Returns the key of the given record.
     *
     * @throws CorruptedFrameException if the data of the record is malformed
     */
    public static RecordKey of(DnsRecord record) {
        return new RecordKey(record.name(), record.dnsClass(), RecordData.of(record));
    }

    public String owner() {
        return owner;
    }

    public int dnsClass() {
        return dnsClass;
    }

    public RecordData data() {
        return data;
    }

    @Override
    public int compareTo(RecordKey o) {
        int cmp = DnsNames.compare(owner, o.owner);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(dnsClass, o.dnsClass);
        if (cmp != 0) {
            return cmp;
        }
        return data.compareTo(o.data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordKey)) {
            return false;
        }
        RecordKey that = (RecordKey) o;
        return dnsClass == that.dnsClass && DnsNames.equals(owner, that.owner) && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        int result = DnsNames.hashCode(owner);
        result = 31 * result + dnsClass;
        return 31 * result + data.hashCode();
    }

    /**
     * Returns the key in presentation format, for example {@code "example.com. IN A 192.0.2.1"}.
     */
    @Override
    public String toString() {
        return owner + ' ' + className(dnsClass) + ' ' + data;
    }

    static String className(int dnsClass) {
        switch (dnsClass) {
            case DnsRecord.CLASS_IN:
                return "IN";
            case DnsRecord.CLASS_CHAOS:
                return "CH";
            case DnsRecord.CLASS_HESIOD:
                return "HS";
            case DnsRecord.CLASS_NONE:
                return "NONE";
            case DnsRecord.CLASS_ANY:
                return "ANY";
            default:
                return "CLASS" + dnsClass;
        }
    }
}
