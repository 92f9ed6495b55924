package com.questrail.meshlink.api;

import java.util.concurrent.CompletableFuture;

/**
 * MeshLinkClient
 * -----------------------------------------------------------------------------
 * Upward boundary of the link core, used by the messaging layer that owns
 * payload semantics.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Bringing a radio link up and keeping it up (reconnect, recovery)</li>
 *   <li>Delivering packets in submission order with per-packet status</li>
 *   <li>Routing unsolicited inbound data to registered handlers</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for encoding payloads, encryption,
 * or anything that happens after a packet leaves the local radio.
 *
 * <h2>Threading</h2>
 * Every method is non-blocking and may be called from any thread. Results are
 * delivered through futures and listeners, which run on the link executor.
 */
public interface MeshLinkClient
{
    /**
     * Starts connecting to {@code device}. The future completes once the link
     * is ready for application packets, or exceptionally if the lifecycle ends
     * in a failure.
     */
    CompletableFuture<Void> connect(PeerDevice device);

    /**
     * Local disconnect: tears the link down without scheduling a reconnect.
     * Every pending packet and operation fails.
     */
    void disconnect();

    /**
     * Tears the current link down and reconnects to the last device immediately.
     */
    void forceReconnect();

    /**
     * Submits an application packet.
     *
     * @param topic         application topic (port) of the payload
     * @param payload       encoded application payload
     * @param correlationId caller tag echoed in the result; may be {@code null}
     * @param trackForAck   whether to wait for a mesh acknowledgment
     */
    CompletableFuture<DeliveryResult> submitPacket(Topic topic, byte[] payload, String correlationId, boolean trackForAck);

    /**
     * Registers the handler for {@code topic}, replacing any previous handler.
     *
     * @throws IllegalArgumentException if {@code topic} is reserved
     */
    Registration onNotification(Topic topic, NotificationHandler handler);

    /**
     * Current connection state.
     */
    ConnectionState connectionState();

    Registration addConnectionStateListener(ConnectionStateListener listener);

    Registration addMessageStatusListener(MessageStatusListener listener);
}
