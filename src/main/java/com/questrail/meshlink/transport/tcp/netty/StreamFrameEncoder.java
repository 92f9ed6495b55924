package com.questrail.meshlink.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.EncoderException;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Wraps an outbound {@code byte[]} in the stream frame header read by
 * {@link StreamFrameDecoder}.
 */
final class StreamFrameEncoder extends MessageToByteEncoder<byte[]>
{
    @Override
    protected void encode(ChannelHandlerContext ctx, byte[] payload, ByteBuf out) {
        if (payload.length > StreamFrameDecoder.MAX_PAYLOAD) {
            throw new EncoderException("frame payload of " + payload.length
                    + " bytes exceeds " + StreamFrameDecoder.MAX_PAYLOAD);
        }
        out.writeByte(StreamFrameDecoder.START1);
        out.writeByte(StreamFrameDecoder.START2);
        out.writeShort(payload.length);
        out.writeBytes(payload);
    }
}
