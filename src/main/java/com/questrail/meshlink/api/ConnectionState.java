package com.questrail.meshlink.api;

import java.util.Objects;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Coarse, caller-facing view of a link.
 *
 * <p>The lifecycle walks through many internal phases (link establishment,
 * negotiation, backlog drain, handshake). Callers only see whether packets can
 * flow: {@link Connected} is published once the link is ready to exchange
 * application packets, every intermediate phase is {@link Connecting}.</p>
 *
 * <p>A state instance is never mutated; each transition publishes a new one.</p>
 */
public sealed interface ConnectionState
        permits ConnectionState.Disconnected, ConnectionState.Connecting,
                ConnectionState.Connected, ConnectionState.Failed
{
    Disconnected DISCONNECTED = new Disconnected();
    Connecting CONNECTING = new Connecting();

    record Disconnected() implements ConnectionState {}

    record Connecting() implements ConnectionState {}

    /**
     * @param endpoint address of the peer device the link is bound to
     */
    record Connected(String endpoint) implements ConnectionState {
        public Connected {
            Objects.requireNonNull(endpoint, "endpoint");
        }
    }

    /**
     * @param reason human-readable failure category, never a raw transport code
     */
    record Failed(String reason) implements ConnectionState {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
