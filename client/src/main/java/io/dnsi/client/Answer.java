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

import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.AbstractReferenceCounted;
import io.netty.util.ReferenceCountUtil;

import java.util.Collections;
import java.util.List;

import static io.netty.util.internal.ObjectUtil.checkNonEmpty;
import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * The outcome of a successful dispatch: the received messages and the {@link Stats} of the exchange.
 * <p>
 * An ordinary query yields exactly one message, a zone transfer collected into a single answer may yield more.
 * The answer owns its messages; {@link #release()} releases all of them.
 */
public final class Answer extends AbstractReferenceCounted {

    private final List<DnsResponse> messages;
    private final Stats stats;

    Answer(DnsResponse message, Stats stats) {
        this(Collections.singletonList(checkNotNull(message, "message")), stats);
    }

    Answer(List<DnsResponse> messages, Stats stats) {
        this.messages = Collections.unmodifiableList(checkNonEmpty(messages, "messages"));
        this.stats = checkNotNull(stats, "stats");
    }

    /**
     * Returns the first message of this answer.
     */
    public DnsResponse message() {
        return messages.get(0);
    }

    /**
     * Returns all messages of this answer in the order they were received.
     */
    public List<DnsResponse> messages() {
        return messages;
    }

    public Stats stats() {
        return stats;
    }

    @Override
    public Answer retain() {
        super.retain();
        return this;
    }

    @Override
    public Answer retain(int increment) {
        super.retain(increment);
        return this;
    }

    @Override
    public Answer touch() {
        super.touch();
        return this;
    }

    @Override
    public Answer touch(Object hint) {
        for (DnsResponse message : messages) {
            message.touch(hint);
        }
        return this;
    }

    @Override
    protected void deallocate() {
        for (DnsResponse message : messages) {
            ReferenceCountUtil.safeRelease(message);
        }
    }

    @Override
    public String toString() {
        return "Answer(messages: " + messages.size() + ", " + stats + ')';
    }
}
