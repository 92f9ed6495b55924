package com.questrail.meshlink.internal.lifecycle;

import com.questrail.meshlink.api.PeerDevice;
import com.questrail.meshlink.transport.CharacteristicId;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * LinkEvent
 * -----------------------------------------------------------------------------
 * Everything that can move a link's lifecycle forward.
 *
 * <p>Events come from three places: public calls (connect, disconnect, force
 * reconnect), transport callbacks and completions, and timers. All of them are
 * marshaled onto the link executor and applied one at a time by
 * {@link LinkLifecycleReducer}. Events carry only what the reducer needs.</p>
 */
public sealed interface LinkEvent
{
    /**
     * Time at which the event was generated. Used for tracing only.
     */
    Instant timestamp();

    // ---------------------------------------------------------------------
    // Local requests
    // ---------------------------------------------------------------------

    record ConnectRequested(Instant timestamp, PeerDevice device) implements LinkEvent {
        public ConnectRequested {
            Objects.requireNonNull(device, "device");
        }
    }

    record DisconnectRequested(Instant timestamp) implements LinkEvent {}

    record ForceReconnectRequested(Instant timestamp) implements LinkEvent {}

    // ---------------------------------------------------------------------
    // Transport callbacks
    // ---------------------------------------------------------------------

    record AuthorizationResult(Instant timestamp, boolean granted) implements LinkEvent {}

    record LinkUp(Instant timestamp) implements LinkEvent {}

    record LinkDown(Instant timestamp, int reasonCode) implements LinkEvent {}

    // ---------------------------------------------------------------------
    // Step completions
    // ---------------------------------------------------------------------

    record CacheInvalidated(Instant timestamp, boolean success) implements LinkEvent {}

    record TransferUnitNegotiated(Instant timestamp, boolean success, int transferUnit) implements LinkEvent {}

    record ServicesResolved(Instant timestamp, Set<CharacteristicId> characteristics) implements LinkEvent {
        public ServicesResolved {
            characteristics = Set.copyOf(characteristics);
        }
    }

    record ServiceDiscoveryFailed(Instant timestamp, String reason) implements LinkEvent {}

    /**
     * A lifecycle read of FromRadio finished.
     *
     * @param empty  the peer had nothing more to send
     * @param failed the read failed; escalation or link-down handles the consequence
     */
    record DrainReadCompleted(Instant timestamp, boolean empty, boolean failed) implements LinkEvent {}

    record ConfigRequestSent(Instant timestamp, boolean success) implements LinkEvent {}

    record ConfigRecordReceived(Instant timestamp) implements LinkEvent {}

    record ConfigComplete(Instant timestamp, int nonce) implements LinkEvent {}

    record NotificationsEnabled(Instant timestamp, boolean success) implements LinkEvent {}

    record AdapterRestarted(Instant timestamp, boolean success) implements LinkEvent {}

    /**
     * A Write or SetNotify failed, or a retryable operation ran out of attempts.
     */
    record OperationEscalated(Instant timestamp, String operation, Throwable cause) implements LinkEvent {}

    // ---------------------------------------------------------------------
    // Timers
    // ---------------------------------------------------------------------

    record HandshakeTimedOut(Instant timestamp, int nonce) implements LinkEvent {}

    record ReconnectDue(Instant timestamp) implements LinkEvent {}
}
