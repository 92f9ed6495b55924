package com.questrail.meshlink.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Splits the radio byte stream into frames.
 *
 * <p>Frame layout: {@code 0x94 0xC3}, 16-bit big-endian payload length, payload.
 * Bytes before a start marker (radio debug output) are skipped. A header that
 * announces more than {@link #MAX_PAYLOAD} bytes is treated as noise: the
 * decoder drops one byte and looks for the next marker.</p>
 *
 * <p>Emits one {@code byte[]} per frame.</p>
 */
final class StreamFrameDecoder extends ByteToMessageDecoder
{
    private static final Logger log = LoggerFactory.getLogger(StreamFrameDecoder.class);

    static final int START1 = 0x94;
    static final int START2 = 0xC3;
    static final int HEADER_SIZE = 4;
    static final int MAX_PAYLOAD = 512;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.readableBytes() >= HEADER_SIZE) {
            int start = in.readerIndex();

            if (in.getUnsignedByte(start) != START1 || in.getUnsignedByte(start + 1) != START2) {
                in.skipBytes(1);
                continue;
            }

            int length = in.getUnsignedShort(start + 2);
            if (length > MAX_PAYLOAD) {
                log.debug("Dropping header with oversized length {}", length);
                in.skipBytes(1);
                continue;
            }

            if (in.readableBytes() < HEADER_SIZE + length) {
                return;
            }

            in.skipBytes(HEADER_SIZE);
            byte[] payload = new byte[length];
            in.readBytes(payload);
            out.add(payload);
        }
    }
}
