package com.questrail.meshlink.codec.impl;

import com.questrail.meshlink.api.PacketId;
import com.questrail.meshlink.api.Topic;
import com.questrail.meshlink.codec.AckFrame;
import com.questrail.meshlink.codec.FrameCodec;
import com.questrail.meshlink.codec.FrameDecodeException;
import com.questrail.meshlink.codec.InboundFrame;
import com.questrail.meshlink.codec.QueueStatusFrame;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultFrameCodec
 * -----------------------------------------------------------------------------
 * Compact binary framing used by the stream transport and by tests.
 *
 * <p>Every frame starts with a one-byte type; multi-byte integers are
 * big-endian.</p>
 *
 * <pre>
 *   outbound
 *     0x01 WANT_CONFIG    nonce:u32
 *     0x02 PACKET         id:u32 flags:u8 port:u16 payload...   (flags bit 0 = want ack)
 *
 *   inbound
 *     0x10 APP_DATA       port:u16 payload...
 *     0x11 ROUTING        requestId:u32 error:u8 fromDestination:u8
 *     0x12 QUEUE_STATUS   result:u8 free:u8 packetId:u32
 *     0x13 CONFIG_COMPLETE nonce:u32
 *     0x14 CONFIG         record bytes...
 * </pre>
 */
public final class DefaultFrameCodec implements FrameCodec
{
    public static final byte WANT_CONFIG = 0x01;
    public static final byte PACKET = 0x02;

    public static final byte APP_DATA = 0x10;
    public static final byte ROUTING = 0x11;
    public static final byte QUEUE_STATUS = 0x12;
    public static final byte CONFIG_COMPLETE = 0x13;
    public static final byte CONFIG = 0x14;

    private static final int FLAG_WANT_ACK = 0x01;

    @Override
    public byte[] encodeWantConfig(int nonce) {
        return ByteBuffer.allocate(5).put(WANT_CONFIG).putInt(nonce).array();
    }

    @Override
    public byte[] encodePacket(PacketId packetId, Topic topic, byte[] payload, boolean wantAck) {
        Objects.requireNonNull(packetId, "packetId");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        int port = topic.portNumber();
        if (port < 0) {
            throw new IllegalArgumentException("only port topics can be sent: " + topic);
        }

        return ByteBuffer.allocate(8 + payload.length)
                .put(PACKET)
                .putInt(packetId.value())
                .put((byte) (wantAck ? FLAG_WANT_ACK : 0))
                .putShort((short) port)
                .put(payload)
                .array();
    }

    @Override
    public InboundFrame decode(byte[] frame) {
        if (frame == null || frame.length == 0) {
            throw new FrameDecodeException("empty frame");
        }

        byte[] body = Arrays.copyOfRange(frame, 1, frame.length);
        return switch (frame[0]) {
            case APP_DATA -> {
                requireLength(body, 2, "app data");
                int port = ((body[0] & 0xFF) << 8) | (body[1] & 0xFF);
                yield new InboundFrame(Topic.port(port), Arrays.copyOfRange(body, 2, body.length));
            }
            case ROUTING -> new InboundFrame(Topic.ROUTING, body);
            case QUEUE_STATUS -> new InboundFrame(Topic.QUEUE_STATUS, body);
            case CONFIG_COMPLETE -> new InboundFrame(Topic.CONFIG_COMPLETE, body);
            case CONFIG -> new InboundFrame(Topic.CONFIG, body);
            default -> throw new FrameDecodeException(String.format("unknown frame type 0x%02X", frame[0] & 0xFF));
        };
    }

    @Override
    public AckFrame decodeAck(byte[] payload) {
        requireLength(payload, 6, "routing");
        ByteBuffer buf = ByteBuffer.wrap(payload);
        int requestId = buf.getInt();
        if (requestId == 0) {
            throw new FrameDecodeException("routing frame without request id");
        }
        int error = buf.get() & 0xFF;
        boolean fromDestination = buf.get() != 0;
        return new AckFrame(new PacketId(requestId), error, fromDestination);
    }

    @Override
    public QueueStatusFrame decodeQueueStatus(byte[] payload) {
        requireLength(payload, 6, "queue status");
        ByteBuffer buf = ByteBuffer.wrap(payload);
        int result = buf.get() & 0xFF;
        int free = buf.get() & 0xFF;
        int packetId = buf.getInt();
        return new QueueStatusFrame(packetId, result, free);
    }

    @Override
    public int decodeConfigComplete(byte[] payload) {
        requireLength(payload, 4, "config complete");
        return ByteBuffer.wrap(payload).getInt();
    }

    // ---------------------------------------------------------------------
    // Inbound encoders, used by simulators and tests to produce radio frames.
    // ---------------------------------------------------------------------

    public static byte[] appData(int port, byte[] payload) {
        return ByteBuffer.allocate(3 + payload.length)
                .put(APP_DATA).putShort((short) port).put(payload).array();
    }

    public static byte[] routing(PacketId requestId, int errorReason, boolean fromDestination) {
        return ByteBuffer.allocate(7)
                .put(ROUTING).putInt(requestId.value())
                .put((byte) errorReason).put((byte) (fromDestination ? 1 : 0)).array();
    }

    public static byte[] queueStatus(int rawPacketId, int result, int free) {
        return ByteBuffer.allocate(7)
                .put(QUEUE_STATUS).put((byte) result).put((byte) free).putInt(rawPacketId).array();
    }

    public static byte[] configComplete(int nonce) {
        return ByteBuffer.allocate(5).put(CONFIG_COMPLETE).putInt(nonce).array();
    }

    public static byte[] config(byte[] record) {
        return ByteBuffer.allocate(1 + record.length).put(CONFIG).put(record).array();
    }

    private static void requireLength(byte[] bytes, int min, String what) {
        if (bytes.length < min) {
            throw new FrameDecodeException(what + " frame too short: " + bytes.length + " < " + min);
        }
    }
}
