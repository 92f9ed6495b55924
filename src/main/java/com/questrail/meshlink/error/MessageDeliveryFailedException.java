package com.questrail.meshlink.error;

import com.questrail.meshlink.api.MessageStatus;
import com.questrail.meshlink.api.PacketId;

/**
 * Terminal failure of a packet: {@link MessageStatus#FAILED} or
 * {@link MessageStatus#ERROR}.
 */
public final class MessageDeliveryFailedException extends MeshLinkException
{
    private final PacketId packetId;
    private final MessageStatus status;

    public MessageDeliveryFailedException(PacketId packetId, MessageStatus status, String message) {
        super("Packet " + packetId + " " + status + ": " + message);
        this.packetId = packetId;
        this.status = status;
    }

    public MessageDeliveryFailedException(PacketId packetId, MessageStatus status, String message, Throwable cause) {
        super("Packet " + packetId + " " + status + ": " + message, cause);
        this.packetId = packetId;
        this.status = status;
    }

    public PacketId packetId() {
        return packetId;
    }

    public MessageStatus status() {
        return status;
    }
}
