package com.questrail.meshlink.config;

/**
 * Classification of a transport disconnect reason code.
 */
public enum DisconnectCategory
{
    /** The platform's cached service table no longer matches the peer. */
    STALE_CACHE("stale service cache"),

    /** The radio link was lost (range, peer reset, supervision timeout). */
    LOST_CONNECTION("connection lost"),

    /** The local radio stack is wedged; only an adapter restart helps. */
    PERSISTENT_STACK_FAULT("radio stack fault");

    private final String description;

    DisconnectCategory(String description) {
        this.description = description;
    }

    /**
     * Human-readable description, suitable for {@code ConnectionState.Failed}.
     */
    public String description() {
        return description;
    }
}
