package com.questrail.meshlink.internal.lifecycle;

/**
 * Phases of a link, in the order a successful connect walks through them.
 * {@link #DISCONNECTED} and {@link #FAILED} are reachable from every phase.
 */
public enum LinkPhase
{
    /** Never connected. */
    IDLE,

    /** Pairing (if required) and physical connect in progress. */
    CONNECTING,

    /** Physical link is up; optional cache invalidation runs here. */
    LINK_ESTABLISHED,

    /** Asking the peer for a larger transfer unit. */
    PARAMETER_NEGOTIATION,

    /** Discovering services and checking the required characteristics. */
    SERVICE_RESOLUTION,

    /** Reading buffered inbound frames until the peer reports nothing left. */
    BACKLOG_DRAIN,

    /** Configuration requested; draining until the completion marker arrives. */
    HANDSHAKE_IN_PROGRESS,

    /** Application packets may flow. */
    READY,

    /** Link is down; a reconnect may be pending. */
    DISCONNECTED,

    /** Terminal failure; only a new connect leaves this phase. */
    FAILED;

    /**
     * {@code true} for phases in which the physical link is up.
     */
    public boolean linkUp() {
        return switch (this) {
            case LINK_ESTABLISHED, PARAMETER_NEGOTIATION, SERVICE_RESOLUTION,
                 BACKLOG_DRAIN, HANDSHAKE_IN_PROGRESS, READY -> true;
            default -> false;
        };
    }

    /**
     * {@code true} for phases from which a link failure triggers recovery.
     */
    public boolean active() {
        return this == CONNECTING || linkUp();
    }
}
