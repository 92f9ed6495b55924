package com.questrail.meshlink.api;

/**
 * Receives every accepted packet status transition.
 */
@FunctionalInterface
public interface MessageStatusListener
{
    void onStatusChanged(PacketId packetId, String correlationId, MessageStatus oldStatus, MessageStatus newStatus);
}
