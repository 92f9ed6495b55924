package com.questrail.meshlink.codec;

import com.questrail.meshlink.api.PacketId;
import com.questrail.meshlink.api.Topic;

/**
 * FrameCodec
 * -----------------------------------------------------------------------------
 * Seam between the link core and the payload layer's framing.
 *
 * <p>The link core needs exactly these things from the wire format:</p>
 * <ul>
 *   <li>a configuration request carrying a nonce (handshake)</li>
 *   <li>a packet wrapper carrying the packet id, so acknowledgments can be correlated</li>
 *   <li>classification of inbound frames by {@link Topic}</li>
 *   <li>parsing of the reserved control topics (ack, queue status, config complete)</li>
 * </ul>
 *
 * <p>Application payloads pass through untouched. Decode methods throw
 * {@link FrameDecodeException} on malformed input.</p>
 */
public interface FrameCodec
{
    byte[] encodeWantConfig(int nonce);

    byte[] encodePacket(PacketId packetId, Topic topic, byte[] payload, boolean wantAck);

    InboundFrame decode(byte[] frame);

    /** Parses the payload of a {@link Topic#ROUTING} frame. */
    AckFrame decodeAck(byte[] payload);

    /** Parses the payload of a {@link Topic#QUEUE_STATUS} frame. */
    QueueStatusFrame decodeQueueStatus(byte[] payload);

    /** Parses the payload of a {@link Topic#CONFIG_COMPLETE} frame and returns its nonce. */
    int decodeConfigComplete(byte[] payload);
}
