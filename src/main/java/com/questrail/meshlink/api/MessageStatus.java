package com.questrail.meshlink.api;

/**
 * MessageStatus
 * -----------------------------------------------------------------------------
 * Delivery status of a submitted packet.
 *
 * <h2>Allowed transitions</h2>
 * <pre>
 *   SENDING  → SENT | FAILED
 *   SENT     → DELIVERED | RECEIVED | FAILED | ERROR
 *   DELIVERED, RECEIVED, FAILED, ERROR are terminal
 * </pre>
 *
 * Any other update (including a repeat of the current status) is rejected by
 * the delivery queue rather than applied.
 */
public enum MessageStatus
{
    /** Queued or being written to the radio. */
    SENDING,

    /** Accepted by the radio. Untracked packets stop here. */
    SENT,

    /** Acknowledged by some node of the mesh (relay or implicit ack). */
    DELIVERED,

    /** Acknowledged by the intended recipient itself. */
    RECEIVED,

    /** No acknowledgment after the retry budget, or the radio write failed. */
    FAILED,

    /** The mesh answered with a routing error or the radio rejected the packet. */
    ERROR;

    public boolean isTerminal() {
        return this == DELIVERED || this == RECEIVED || this == FAILED || this == ERROR;
    }

    public boolean canTransitionTo(MessageStatus next) {
        return switch (this) {
            case SENDING -> next == SENT || next == FAILED;
            case SENT -> next == DELIVERED || next == RECEIVED || next == FAILED || next == ERROR;
            case DELIVERED, RECEIVED, FAILED, ERROR -> false;
        };
    }
}
