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
import io.netty.handler.codec.dns.DnsMessage;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsSection;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Compares the answer sections of two messages as sets of records.
 * <p>
 * Records are compared by {@link RecordKey}, so neither their TTL nor their order in the message matter. A record
 * whose data cannot be parsed is left out of the comparison.
 */
public final class AnswerDiff {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(AnswerDiff.class);

    /**
     * Compares the answer sections of {@code left} and {@code right}. Records only in {@code left} are
     * {@link DiffAction#REMOVED}, records only in {@code right} are {@link DiffAction#ADDED}.
     */
    public static Result diff(DnsMessage left, DnsMessage right) {
        Set<RecordKey> leftRecords = answerRecords(checkNotNull(left, "left"));
        Set<RecordKey> rightRecords = answerRecords(checkNotNull(right, "right"));

        List<DiffItem> items = new ArrayList<DiffItem>(leftRecords.size() + rightRecords.size());
        int unchanged = 0;
        for (RecordKey record : leftRecords) {
            if (rightRecords.contains(record)) {
                items.add(new DiffItem(DiffAction.UNCHANGED, record));
                unchanged++;
            } else {
                items.add(new DiffItem(DiffAction.REMOVED, record));
            }
        }
        for (RecordKey record : rightRecords) {
            if (!leftRecords.contains(record)) {
                items.add(new DiffItem(DiffAction.ADDED, record));
            }
        }
        if (unchanged == items.size()) {
            return Result.NO_DIFFERENCE;
        }
        Collections.sort(items);
        return new Result(items);
    }

    static Set<RecordKey> answerRecords(DnsMessage message) {
        int count = message.count(DnsSection.ANSWER);
        Set<RecordKey> records = new HashSet<RecordKey>(count * 2);
        for (int i = 0; i < count; i++) {
            DnsRecord record = message.recordAt(DnsSection.ANSWER, i);
            try {
                records.add(RecordKey.of(record));
            } catch (CorruptedFrameException e) {
                logger.debug("Ignoring record {} in comparison", record, e);
            }
        }
        return records;
    }

    /**
     * The outcome of a comparison.
     */
    public static final class Result {

        static final Result NO_DIFFERENCE = new Result(Collections.<DiffItem>emptyList());

        private final List<DiffItem> items;

        private Result(List<DiffItem> items) {
            this.items = Collections.unmodifiableList(items);
        }

        /**
         * Returns {@code true} if both answers hold the same records.
         */
        public boolean isNoDifference() {
            return this == NO_DIFFERENCE;
        }

        /**
         * Returns every record of either answer sorted by record, or an empty list if there is no difference.
         */
        public List<DiffItem> items() {
            return items;
        }

        @Override
        public String toString() {
            if (isNoDifference()) {
                return "NoDifference";
            }
            StringBuilder buf = new StringBuilder(items.size() * 48);
            for (DiffItem item : items) {
                buf.append(item).append('\n');
            }
            return buf.toString();
        }
    }

    private AnswerDiff() {
        // Unused
    }
}
