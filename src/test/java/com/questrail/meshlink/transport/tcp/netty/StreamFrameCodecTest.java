package com.questrail.meshlink.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.EncoderException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StreamFrameCodecTest
 * -----------------------------------------------------------------------------
 * Stream framing on an {@link EmbeddedChannel}: resynchronisation on noise,
 * partial frames and the outbound header.
 */
class StreamFrameCodecTest {

    private static ByteBuf bytes(int... values) {
        ByteBuf buf = Unpooled.buffer(values.length);
        for (int v : values) {
            buf.writeByte(v);
        }
        return buf;
    }

    @Test
    void encoderPrefixesMarkerAndLength() {
        EmbeddedChannel channel = new EmbeddedChannel(new StreamFrameEncoder());

        assertTrue(channel.writeOutbound(new byte[] { 0x01, 0x02, 0x03 }));
        ByteBuf out = channel.readOutbound();

        byte[] written = new byte[out.readableBytes()];
        out.readBytes(written);
        out.release();
        assertArrayEquals(new byte[] { (byte) 0x94, (byte) 0xC3, 0x00, 0x03, 0x01, 0x02, 0x03 }, written);
        assertFalse(channel.finish());
    }

    @Test
    void encoderRefusesOversizedPayload() {
        EmbeddedChannel channel = new EmbeddedChannel(new StreamFrameEncoder());

        assertThrows(EncoderException.class, () -> channel.writeOutbound(new byte[StreamFrameDecoder.MAX_PAYLOAD + 1]));
    }

    @Test
    void decoderSkipsDebugOutputBeforeMarker() {
        EmbeddedChannel channel = new EmbeddedChannel(new StreamFrameDecoder());

        channel.writeInbound(bytes('D', 'B', 'G', '\n', 0x94, 0xC3, 0x00, 0x02, 0x0A, 0x0B));

        assertArrayEquals(new byte[] { 0x0A, 0x0B }, (byte[]) channel.readInbound());
        assertNull(channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    void decoderWaitsForSplitFrame() {
        EmbeddedChannel channel = new EmbeddedChannel(new StreamFrameDecoder());

        assertFalse(channel.writeInbound(bytes(0x94, 0xC3, 0x00)));
        assertFalse(channel.writeInbound(bytes(0x04, 0x01, 0x02)));
        assertTrue(channel.writeInbound(bytes(0x03, 0x04, 0x94, 0xC3, 0x00, 0x00)));

        assertArrayEquals(new byte[] { 0x01, 0x02, 0x03, 0x04 }, (byte[]) channel.readInbound());
        assertArrayEquals(new byte[0], (byte[]) channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    void decoderTreatsOversizedLengthAsNoise() {
        EmbeddedChannel channel = new EmbeddedChannel(new StreamFrameDecoder());

        // 0x94 0xC3 0xFF 0xFF announces 65535 bytes; resync finds the real frame.
        channel.writeInbound(bytes(0x94, 0xC3, 0xFF, 0xFF, 0x94, 0xC3, 0x00, 0x01, 0x7F));

        assertArrayEquals(new byte[] { 0x7F }, (byte[]) channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    void encodedFramesDecodeBackToBack() {
        EmbeddedChannel encoder = new EmbeddedChannel(new StreamFrameEncoder());
        encoder.writeOutbound(new byte[] { 1 }, new byte[] { 2, 2 });
        ByteBuf first = encoder.readOutbound();
        ByteBuf second = encoder.readOutbound();

        EmbeddedChannel decoder = new EmbeddedChannel(new StreamFrameDecoder());
        decoder.writeInbound(Unpooled.wrappedBuffer(first, second));

        assertArrayEquals(new byte[] { 1 }, (byte[]) decoder.readInbound());
        assertArrayEquals(new byte[] { 2, 2 }, (byte[]) decoder.readInbound());
    }
}
