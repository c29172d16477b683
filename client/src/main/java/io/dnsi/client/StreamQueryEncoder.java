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
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import io.netty.handler.codec.dns.DnsQuery;

/**
 * Encodes a {@link DnsQuery} for stream transports, prefixed with its two byte length.
 */
@ChannelHandler.Sharable
final class StreamQueryEncoder extends MessageToByteEncoder<DnsQuery> {

    private final DnsQueryWriter writer = new DnsQueryWriter();

    @Override
    protected void encode(ChannelHandlerContext ctx, DnsQuery msg, ByteBuf out) throws Exception {
        int lengthIndex = out.writerIndex();
        out.writeShort(0);
        writer.write(msg, out);
        out.setShort(lengthIndex, out.writerIndex() - lengthIndex - 2);
    }

    @Override
    protected ByteBuf allocateBuffer(ChannelHandlerContext ctx, DnsQuery msg, boolean preferDirect) {
        return preferDirect ? ctx.alloc().ioBuffer(1024) : ctx.alloc().heapBuffer(1024);
    }
}
