package com.questrail.meshlink.internal.lifecycle;

import com.questrail.meshlink.api.PeerDevice;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * LinkState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one link's lifecycle.
 *
 * <p>Produced and consumed only by {@link LinkLifecycleReducer}. Flags that
 * guard single-instance behavior (a pending reconnect, an adapter restart in
 * progress) live here, so they can only change through a reducer step on the
 * link executor.</p>
 *
 * @param phase                     current phase
 * @param device                    device being connected to; {@code null} before the first connect
 * @param awaitingAuthorization     waiting for the pairing outcome
 * @param invalidateCacheOnNextLink a stale-cache failure asked for a cache drop on the next link-up
 * @param transferUnitAttempts      transfer-unit requests made on this link
 * @param configNonce               nonce of the current (or last) configuration request
 * @param handshakeProgress         configuration handshake progress
 * @param reconnectAttempt          reconnects scheduled since the link was last ready
 * @param reconnectPending          a reconnect timer or adapter restart is outstanding
 * @param restartingAdapter         an adapter restart is outstanding
 * @param failureReason             human-readable reason when {@code phase == FAILED}
 * @param lastTransition            wall-clock time of the last change, for observability
 */
public record LinkState(
        LinkPhase phase,
        PeerDevice device,
        boolean awaitingAuthorization,
        boolean invalidateCacheOnNextLink,
        int transferUnitAttempts,
        int configNonce,
        HandshakeProgress handshakeProgress,
        int reconnectAttempt,
        boolean reconnectPending,
        boolean restartingAdapter,
        String failureReason,
        Instant lastTransition
) {
    public LinkState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(handshakeProgress, "handshakeProgress");
        Objects.requireNonNull(lastTransition, "lastTransition");
    }

    /**
     * State of a link that has never been connected.
     *
     * @param initialNonce starting point for configuration nonces
     */
    public static LinkState idle(int initialNonce, Instant now) {
        return new LinkState(LinkPhase.IDLE, null, false, false, 0, initialNonce,
                HandshakeProgress.NOT_STARTED, 0, false, false, null, now);
    }

    public Optional<PeerDevice> currentDevice() {
        return Optional.ofNullable(device);
    }

    // ---------------------------------------------------------------------
    // Withers
    // ---------------------------------------------------------------------

    public LinkState withPhase(LinkPhase newPhase, Instant now) {
        return new LinkState(newPhase, device, awaitingAuthorization, invalidateCacheOnNextLink,
                transferUnitAttempts, configNonce, handshakeProgress, reconnectAttempt,
                reconnectPending, restartingAdapter, failureReason, now);
    }

    /**
     * Fresh connect to {@code newDevice}: counters and flags reset, nonce kept.
     */
    public LinkState connecting(PeerDevice newDevice, boolean awaitAuthorization, Instant now) {
        return new LinkState(LinkPhase.CONNECTING, newDevice, awaitAuthorization, false,
                0, configNonce, HandshakeProgress.NOT_STARTED, 0, false, false, null, now);
    }

    public LinkState withAwaitingAuthorization(boolean awaiting, Instant now) {
        return new LinkState(phase, device, awaiting, invalidateCacheOnNextLink,
                transferUnitAttempts, configNonce, handshakeProgress, reconnectAttempt,
                reconnectPending, restartingAdapter, failureReason, now);
    }

    public LinkState withInvalidateCacheOnNextLink(boolean invalidate, Instant now) {
        return new LinkState(phase, device, awaitingAuthorization, invalidate,
                transferUnitAttempts, configNonce, handshakeProgress, reconnectAttempt,
                reconnectPending, restartingAdapter, failureReason, now);
    }

    public LinkState withTransferUnitAttempts(int attempts, Instant now) {
        return new LinkState(phase, device, awaitingAuthorization, invalidateCacheOnNextLink,
                attempts, configNonce, handshakeProgress, reconnectAttempt,
                reconnectPending, restartingAdapter, failureReason, now);
    }

    /**
     * Starts a new configuration request with the next nonce.
     */
    public LinkState withNextNonce(Instant now) {
        return new LinkState(phase, device, awaitingAuthorization, invalidateCacheOnNextLink,
                transferUnitAttempts, configNonce + 1, HandshakeProgress.SENDING_HANDSHAKE, reconnectAttempt,
                reconnectPending, restartingAdapter, failureReason, now);
    }

    public LinkState withHandshakeProgress(HandshakeProgress progress, Instant now) {
        return new LinkState(phase, device, awaitingAuthorization, invalidateCacheOnNextLink,
                transferUnitAttempts, configNonce, progress, reconnectAttempt,
                reconnectPending, restartingAdapter, failureReason, now);
    }

    /**
     * Link went down and recovery was scheduled.
     */
    public LinkState reconnectScheduled(int attempt, boolean restarting, Instant now) {
        return new LinkState(LinkPhase.DISCONNECTED, device, false, invalidateCacheOnNextLink,
                0, configNonce, HandshakeProgress.NOT_STARTED, attempt,
                true, restarting, null, now);
    }

    public LinkState withRestartingAdapter(boolean restarting, Instant now) {
        return new LinkState(phase, device, awaitingAuthorization, invalidateCacheOnNextLink,
                transferUnitAttempts, configNonce, handshakeProgress, reconnectAttempt,
                reconnectPending, restarting, failureReason, now);
    }

    /**
     * Reconnect timer fired: back to connecting, attempt counter kept.
     */
    public LinkState reconnecting(Instant now) {
        return new LinkState(LinkPhase.CONNECTING, device, false, invalidateCacheOnNextLink,
                0, configNonce, HandshakeProgress.NOT_STARTED, reconnectAttempt,
                false, false, null, now);
    }

    public LinkState ready(Instant now) {
        return new LinkState(LinkPhase.READY, device, false, false,
                transferUnitAttempts, configNonce, HandshakeProgress.COMPLETE, 0,
                false, false, null, now);
    }

    public LinkState disconnected(Instant now) {
        return new LinkState(LinkPhase.DISCONNECTED, device, false, false,
                0, configNonce, HandshakeProgress.NOT_STARTED, 0, false, false, null, now);
    }

    public LinkState failed(String reason, Instant now) {
        return new LinkState(LinkPhase.FAILED, device, false, false,
                0, configNonce, HandshakeProgress.NOT_STARTED, reconnectAttempt,
                false, false, Objects.requireNonNull(reason, "reason"), now);
    }
}
