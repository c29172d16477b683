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

import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsResponseCode;
import io.netty.handler.codec.dns.DnsSection;

/**
 * Decides when the last response of a request has arrived on a stream.
 * <p>
 * Ordinary requests are answered by a single response. Zone transfers are answered by a sequence of responses whose
 * answer sections together form the transfer: an AXFR is enclosed by the SOA record of the zone, an IXFR starts
 * with the new SOA record and is either a single SOA (the client is up to date), a full transfer, or a series of
 * deletion and addition blocks each introduced by a SOA record and closed by the new SOA record again.
 */
final class XfrResponseTracker {

    private enum State {
        FIRST,
        SECOND,
        AXFR,
        IXFR_DELETIONS,
        IXFR_ADDITIONS,
        DONE
    }

    private final DnsRecordType type;
    private final long clientSerial;
    private State state = State.FIRST;
    private long newSerial;
    private long additionsSerial;

    private XfrResponseTracker(DnsRecordType type, long clientSerial) {
        this.type = type;
        this.clientSerial = clientSerial;
    }

    static XfrResponseTracker newTracker(RequestMessage request) {
        return new XfrResponseTracker(request.isStreaming() ? request.type() : null, request.ixfrSerial());
    }

    boolean isDone() {
        return state == State.DONE;
    }

    /**
     * Consumes the next response of the stream.
     *
     * @return {@code true} if the response is the last one
     * @throws CorruptedFrameException if the response cannot be part of a valid transfer
     */
    boolean isLast(DnsResponse response) {
        if (state == State.DONE) {
            throw new CorruptedFrameException("response after the end of the stream");
        }
        if (type == null) {
            state = State.DONE;
            return true;
        }
        if (!DnsResponseCode.NOERROR.equals(response.code())) {
            throw new CorruptedFrameException("zone transfer refused: " + response.code());
        }

        int count = response.count(DnsSection.ANSWER);
        for (int i = 0; i < count; i++) {
            if (state == State.DONE) {
                throw new CorruptedFrameException("records after the closing SOA record");
            }
            accept(response.<DnsRecord>recordAt(DnsSection.ANSWER, i));
        }

        if (state == State.SECOND && DnsRecordType.IXFR.equals(type) && !isNewer(newSerial, clientSerial)) {
            // Single SOA reply, the client is up to date.
            state = State.DONE;
        }
        return state == State.DONE;
    }

    private void accept(DnsRecord record) {
        boolean soa = DnsRecords.isType(record, DnsRecordType.SOA);
        switch (state) {
            case FIRST:
                if (!soa) {
                    throw new CorruptedFrameException("zone transfer does not start with a SOA record: " + record);
                }
                newSerial = DnsRecords.soaSerial(record);
                state = State.SECOND;
                break;
            case SECOND:
                if (!soa) {
                    state = State.AXFR;
                } else if (DnsRecordType.AXFR.equals(type) || DnsRecords.soaSerial(record) == newSerial) {
                    // Zone consisting of the SOA record alone.
                    state = State.DONE;
                } else {
                    state = State.IXFR_DELETIONS;
                }
                break;
            case AXFR:
                if (soa) {
                    state = State.DONE;
                }
                break;
            case IXFR_DELETIONS:
                if (soa) {
                    additionsSerial = DnsRecords.soaSerial(record);
                    state = State.IXFR_ADDITIONS;
                }
                break;
            case IXFR_ADDITIONS:
                if (soa) {
                    long serial = DnsRecords.soaSerial(record);
                    if (serial == newSerial && additionsSerial == newSerial) {
                        state = State.DONE;
                    } else {
                        state = State.IXFR_DELETIONS;
                    }
                }
                break;
            default:
                throw new Error();
        }
    }

    // RFC 1982 serial number arithmetic.
    private static boolean isNewer(long serial, long than) {
        long diff = (serial - than) & 0xFFFFFFFFL;
        return diff != 0 && diff < 0x80000000L;
    }
}
