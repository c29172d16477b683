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

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * One line of a {@link AnswerDiff}.
 */
public final class DiffItem implements Comparable<DiffItem> {

    private final DiffAction action;
    private final RecordKey record;

    public DiffItem(DiffAction action, RecordKey record) {
        this.action = checkNotNull(action, "action");
        this.record = checkNotNull(record, "record");
    }

    public DiffAction action() {
        return action;
    }

    public RecordKey record() {
        return record;
    }

    @Override
    public int compareTo(DiffItem o) {
        int cmp = record.compareTo(o.record);
        return cmp != 0 ? cmp : action.compareTo(o.action);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiffItem)) {
            return false;
        }
        DiffItem that = (DiffItem) o;
        return action == that.action && record.equals(that.record);
    }

    @Override
    public int hashCode() {
        return 31 * action.hashCode() + record.hashCode();
    }

    @Override
    public String toString() {
        return action.prefix() + record;
    }
}
