package com.questrail.meshlink.codec;

import com.questrail.meshlink.api.PacketId;

import java.util.Optional;

/**
 * Transmit-queue report from the local radio.
 *
 * @param rawPacketId id of the packet the report refers to; 0 when the radio did not say
 * @param result      0 when the radio accepted the packet
 * @param free        free slots left in the radio's transmit queue
 */
public record QueueStatusFrame(int rawPacketId, int result, int free)
{
    public boolean success() {
        return result == 0;
    }

    public boolean queueFull() {
        return free == 0;
    }

    public Optional<PacketId> packetId() {
        return rawPacketId == 0 ? Optional.empty() : Optional.of(new PacketId(rawPacketId));
    }
}
