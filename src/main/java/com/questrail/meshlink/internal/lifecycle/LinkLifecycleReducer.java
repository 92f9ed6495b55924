package com.questrail.meshlink.internal.lifecycle;

import com.questrail.meshlink.api.PeerDevice;
import com.questrail.meshlink.config.DisconnectCategory;
import com.questrail.meshlink.config.MeshLinkConfig;
import com.questrail.meshlink.error.HandshakeFailedException;
import com.questrail.meshlink.error.LinkResetException;
import com.questrail.meshlink.transport.CharacteristicId;
import com.questrail.meshlink.transport.MeshServiceProfile;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * LinkLifecycleReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state machine for one link.
 *
 * <p>Given the current {@link LinkState} and one {@link LinkEvent} the reducer
 * computes the next state and the {@link LinkIntents} the executor must carry
 * out. It performs no I/O and arms no timers. Configuration (backoff, quirk
 * table, disconnect reason table) is injected as data.</p>
 *
 * <p>Events that do not make sense in the current phase are stale leftovers
 * of an earlier link (a completion racing a tear-down, a timer that fired
 * after recovery started) and are ignored.</p>
 */
public final class LinkLifecycleReducer
{
    /**
     * Result of applying an event to a link state.
     *
     * @param newState the updated state
     * @param intents  actions to be executed by the caller
     */
    public record Result(LinkState newState, LinkIntents intents) {}

    private static final int MAX_TRANSFER_UNIT_REQUESTS = 2;

    private final MeshLinkConfig config;

    public LinkLifecycleReducer(MeshLinkConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public Result apply(LinkState state, LinkEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof LinkEvent.ConnectRequested e) {
            return onConnectRequested(state, e);
        }
        if (event instanceof LinkEvent.DisconnectRequested e) {
            return onDisconnectRequested(state, e);
        }
        if (event instanceof LinkEvent.ForceReconnectRequested e) {
            return onForceReconnect(state, e);
        }
        if (event instanceof LinkEvent.AuthorizationResult e) {
            return onAuthorizationResult(state, e);
        }
        if (event instanceof LinkEvent.LinkUp e) {
            return onLinkUp(state, e);
        }
        if (event instanceof LinkEvent.LinkDown e) {
            return onLinkDown(state, e);
        }
        if (event instanceof LinkEvent.CacheInvalidated e) {
            return onCacheInvalidated(state, e);
        }
        if (event instanceof LinkEvent.TransferUnitNegotiated e) {
            return onTransferUnitNegotiated(state, e);
        }
        if (event instanceof LinkEvent.ServicesResolved e) {
            return onServicesResolved(state, e);
        }
        if (event instanceof LinkEvent.ServiceDiscoveryFailed e) {
            return onServiceDiscoveryFailed(state, e);
        }
        if (event instanceof LinkEvent.DrainReadCompleted e) {
            return onDrainReadCompleted(state, e);
        }
        if (event instanceof LinkEvent.ConfigRequestSent e) {
            return onConfigRequestSent(state, e);
        }
        if (event instanceof LinkEvent.ConfigRecordReceived e) {
            return onConfigRecordReceived(state, e);
        }
        if (event instanceof LinkEvent.ConfigComplete e) {
            return onConfigComplete(state, e);
        }
        if (event instanceof LinkEvent.NotificationsEnabled e) {
            return onNotificationsEnabled(state, e);
        }
        if (event instanceof LinkEvent.HandshakeTimedOut e) {
            return onHandshakeTimedOut(state, e);
        }
        if (event instanceof LinkEvent.ReconnectDue e) {
            return onReconnectDue(state, e);
        }
        if (event instanceof LinkEvent.AdapterRestarted e) {
            return onAdapterRestarted(state, e);
        }
        if (event instanceof LinkEvent.OperationEscalated e) {
            return onOperationEscalated(state, e);
        }

        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Local requests
    // ---------------------------------------------------------------------

    private Result onConnectRequested(LinkState state, LinkEvent.ConnectRequested e) {
        PeerDevice device = e.device();
        Instant now = e.timestamp();

        if (state.phase().active() && device.equals(state.device())) {
            return unchanged(state);
        }
        if (state.reconnectPending() && device.equals(state.device())) {
            // Same peer, so recovery continues now instead of after the backoff.
            // Tracked packets stay queued for replay.
            LinkIntents intents = LinkIntents.builder()
                    .add(LinkIntents.Kind.TEAR_DOWN)
                    .add(LinkIntents.Kind.OPEN_LINK)
                    .build();
            return new Result(state.reconnecting(now), intents);
        }

        LinkIntents.Builder intents = LinkIntents.builder();
        if (state.phase().active() || state.reconnectPending()) {
            // Leaving another device (or a scheduled reconnect) behind.
            intents.add(LinkIntents.Kind.TEAR_DOWN)
                    .add(LinkIntents.Kind.FLUSH_DELIVERY)
                    .failure(new LinkResetException("switching to " + device.address()));
        }

        boolean authorize = !device.bonded();
        intents.add(authorize ? LinkIntents.Kind.REQUEST_AUTHORIZATION : LinkIntents.Kind.OPEN_LINK);

        return new Result(state.connecting(device, authorize, now), intents.build());
    }

    private Result onDisconnectRequested(LinkState state, LinkEvent.DisconnectRequested e) {
        if (!state.phase().active() && !state.reconnectPending()) {
            return unchanged(state);
        }

        LinkIntents intents = LinkIntents.builder()
                .add(LinkIntents.Kind.TEAR_DOWN)
                .add(LinkIntents.Kind.FLUSH_DELIVERY)
                .add(LinkIntents.Kind.FAIL_CONNECT)
                .failure(new LinkResetException("disconnect requested"))
                .build();

        return new Result(state.disconnected(e.timestamp()), intents);
    }

    private Result onForceReconnect(LinkState state, LinkEvent.ForceReconnectRequested e) {
        PeerDevice device = state.device();
        if (device == null) {
            return unchanged(state);
        }

        // Tracked packets survive the tear-down and are replayed once ready.
        LinkIntents.Builder intents = LinkIntents.builder().add(LinkIntents.Kind.TEAR_DOWN);
        boolean authorize = state.awaitingAuthorization();
        intents.add(authorize ? LinkIntents.Kind.REQUEST_AUTHORIZATION : LinkIntents.Kind.OPEN_LINK);

        return new Result(state.connecting(device, authorize, e.timestamp()), intents.build());
    }

    // ---------------------------------------------------------------------
    // Connect sequence
    // ---------------------------------------------------------------------

    private Result onAuthorizationResult(LinkState state, LinkEvent.AuthorizationResult e) {
        if (state.phase() != LinkPhase.CONNECTING || !state.awaitingAuthorization()) {
            return unchanged(state);
        }

        if (e.granted()) {
            return new Result(state.withAwaitingAuthorization(false, e.timestamp()),
                    LinkIntents.of(LinkIntents.Kind.OPEN_LINK));
        }

        return fail(state, "auth declined",
                new HandshakeFailedException(HandshakeFailedException.Stage.AUTHORIZATION, "auth declined"),
                e.timestamp());
    }

    private Result onLinkUp(LinkState state, LinkEvent.LinkUp e) {
        if (state.phase() != LinkPhase.CONNECTING || state.awaitingAuthorization()) {
            return unchanged(state);
        }

        Instant now = e.timestamp();
        LinkState established = state.withPhase(LinkPhase.LINK_ESTABLISHED, now);

        boolean invalidate = state.invalidateCacheOnNextLink()
                || config.deviceQuirks().quirksFor(state.device()).invalidateCacheOnConnect();
        if (invalidate) {
            return new Result(established, LinkIntents.of(LinkIntents.Kind.INVALIDATE_CACHE));
        }

        return beginNegotiation(established, now);
    }

    private Result onCacheInvalidated(LinkState state, LinkEvent.CacheInvalidated e) {
        if (state.phase() != LinkPhase.LINK_ESTABLISHED) {
            return unchanged(state);
        }
        // A failed invalidation is not fatal; the next stale-cache disconnect asks again.
        LinkState cleared = e.success()
                ? state.withInvalidateCacheOnNextLink(false, e.timestamp())
                : state;
        return beginNegotiation(cleared, e.timestamp());
    }

    private Result beginNegotiation(LinkState state, Instant now) {
        LinkState negotiating = state
                .withPhase(LinkPhase.PARAMETER_NEGOTIATION, now)
                .withTransferUnitAttempts(1, now);
        return new Result(negotiating, LinkIntents.of(LinkIntents.Kind.REQUEST_TRANSFER_UNIT));
    }

    private Result onTransferUnitNegotiated(LinkState state, LinkEvent.TransferUnitNegotiated e) {
        if (state.phase() != LinkPhase.PARAMETER_NEGOTIATION) {
            return unchanged(state);
        }

        Instant now = e.timestamp();
        if (!e.success() && state.transferUnitAttempts() < MAX_TRANSFER_UNIT_REQUESTS) {
            return new Result(state.withTransferUnitAttempts(state.transferUnitAttempts() + 1, now),
                    LinkIntents.of(LinkIntents.Kind.REQUEST_TRANSFER_UNIT));
        }

        // Proceed with the default transfer unit if negotiation keeps failing.
        return new Result(state.withPhase(LinkPhase.SERVICE_RESOLUTION, now),
                LinkIntents.of(LinkIntents.Kind.DISCOVER_SERVICES));
    }

    private Result onServicesResolved(LinkState state, LinkEvent.ServicesResolved e) {
        if (state.phase() != LinkPhase.SERVICE_RESOLUTION) {
            return unchanged(state);
        }

        Set<String> missing = new TreeSet<>();
        for (CharacteristicId required : MeshServiceProfile.REQUIRED) {
            if (!e.characteristics().contains(required)) {
                missing.add(required.name());
            }
        }
        if (!missing.isEmpty()) {
            return failServiceResolution(state, "missing characteristics " + missing, e.timestamp());
        }

        return new Result(state.withPhase(LinkPhase.BACKLOG_DRAIN, e.timestamp()),
                LinkIntents.readFromRadioAfter(Duration.ZERO));
    }

    private Result onServiceDiscoveryFailed(LinkState state, LinkEvent.ServiceDiscoveryFailed e) {
        if (state.phase() != LinkPhase.SERVICE_RESOLUTION) {
            return unchanged(state);
        }
        return failServiceResolution(state, e.reason(), e.timestamp());
    }

    private Result failServiceResolution(LinkState state, String detail, Instant now) {
        return fail(state, "service resolution failed: " + detail,
                new HandshakeFailedException(HandshakeFailedException.Stage.SERVICE_RESOLUTION, detail),
                now);
    }

    private Result onDrainReadCompleted(LinkState state, LinkEvent.DrainReadCompleted e) {
        if (e.failed()) {
            // The queue has already escalated, or the link went down.
            return unchanged(state);
        }

        Instant now = e.timestamp();
        switch (state.phase()) {
            case BACKLOG_DRAIN -> {
                if (!e.empty()) {
                    return new Result(state,
                            LinkIntents.readFromRadioAfter(config.handshake().drainInterval()));
                }
                LinkState handshaking = state
                        .withPhase(LinkPhase.HANDSHAKE_IN_PROGRESS, now)
                        .withNextNonce(now);
                return new Result(handshaking, LinkIntents.of(LinkIntents.Kind.SEND_CONFIG_REQUEST));
            }
            case HANDSHAKE_IN_PROGRESS -> {
                if (state.handshakeProgress() == HandshakeProgress.COMPLETE) {
                    return unchanged(state);
                }
                return new Result(state, LinkIntents.readFromRadioAfter(
                        e.empty() ? config.handshake().drainInterval() : Duration.ZERO));
            }
            default -> {
                return unchanged(state);
            }
        }
    }

    private Result onConfigRequestSent(LinkState state, LinkEvent.ConfigRequestSent e) {
        if (state.phase() != LinkPhase.HANDSHAKE_IN_PROGRESS
                || state.handshakeProgress() != HandshakeProgress.SENDING_HANDSHAKE) {
            return unchanged(state);
        }

        if (!e.success()) {
            return fail(state, "handshake failed: configuration request not sent",
                    new HandshakeFailedException(HandshakeFailedException.Stage.CONFIG_REQUEST,
                            "configuration request could not be written"),
                    e.timestamp());
        }

        return new Result(
                state.withHandshakeProgress(HandshakeProgress.WAITING_FOR_CONFIG, e.timestamp()),
                LinkIntents.readFromRadioAfter(Duration.ZERO));
    }

    private Result onConfigRecordReceived(LinkState state, LinkEvent.ConfigRecordReceived e) {
        if (state.phase() != LinkPhase.HANDSHAKE_IN_PROGRESS
                || state.handshakeProgress() == HandshakeProgress.DOWNLOADING_CONFIG
                || state.handshakeProgress() == HandshakeProgress.COMPLETE) {
            return unchanged(state);
        }
        return new Result(state.withHandshakeProgress(HandshakeProgress.DOWNLOADING_CONFIG, e.timestamp()),
                LinkIntents.none());
    }

    private Result onConfigComplete(LinkState state, LinkEvent.ConfigComplete e) {
        if (state.phase() != LinkPhase.HANDSHAKE_IN_PROGRESS
                || state.handshakeProgress() == HandshakeProgress.COMPLETE
                || e.nonce() != state.configNonce()) {
            // Stale marker from an earlier request.
            return unchanged(state);
        }
        return new Result(state.withHandshakeProgress(HandshakeProgress.COMPLETE, e.timestamp()),
                LinkIntents.of(LinkIntents.Kind.ENABLE_NOTIFICATIONS));
    }

    private Result onNotificationsEnabled(LinkState state, LinkEvent.NotificationsEnabled e) {
        if (state.phase() != LinkPhase.HANDSHAKE_IN_PROGRESS
                || state.handshakeProgress() != HandshakeProgress.COMPLETE
                || !e.success()) {
            // A failed SetNotify escalates; recovery runs from there.
            return unchanged(state);
        }
        return new Result(state.ready(e.timestamp()), LinkIntents.of(LinkIntents.Kind.LINK_READY));
    }

    private Result onHandshakeTimedOut(LinkState state, LinkEvent.HandshakeTimedOut e) {
        if (state.phase() != LinkPhase.HANDSHAKE_IN_PROGRESS
                || state.handshakeProgress() == HandshakeProgress.COMPLETE
                || e.nonce() != state.configNonce()) {
            return unchanged(state);
        }
        return fail(state, "handshake timed out",
                new HandshakeFailedException(HandshakeFailedException.Stage.CONFIG_DOWNLOAD,
                        "no configuration complete marker for nonce " + e.nonce()),
                e.timestamp());
    }

    // ---------------------------------------------------------------------
    // Failure and recovery
    // ---------------------------------------------------------------------

    private Result onLinkDown(LinkState state, LinkEvent.LinkDown e) {
        if (!state.phase().active() || state.awaitingAuthorization()) {
            // Either a local disconnect already moved us on, or no link was open.
            return unchanged(state);
        }
        DisconnectCategory category = config.disconnectReasons().classify(e.reasonCode());
        return recover(state, category, e.timestamp());
    }

    private Result onOperationEscalated(LinkState state, LinkEvent.OperationEscalated e) {
        if (!state.phase().linkUp()) {
            return unchanged(state);
        }
        return recover(state, DisconnectCategory.LOST_CONNECTION, e.timestamp());
    }

    private Result recover(LinkState state, DisconnectCategory category, Instant now) {
        if (state.reconnectPending()) {
            return unchanged(state);
        }

        int attempt = state.reconnectAttempt() + 1;
        int maxAttempts = config.reconnect().maxAttempts();
        if (attempt > maxAttempts) {
            String reason = "gave up after " + maxAttempts + " reconnect attempts ("
                    + category.description() + ")";
            LinkIntents intents = LinkIntents.builder()
                    .add(LinkIntents.Kind.TEAR_DOWN)
                    .add(LinkIntents.Kind.FLUSH_DELIVERY)
                    .add(LinkIntents.Kind.FAIL_CONNECT)
                    .failure(new HandshakeFailedException(HandshakeFailedException.Stage.RECONNECT, reason))
                    .recovery(RecoveryAction.GIVE_UP)
                    .build();
            return new Result(state.failed(reason, now), intents);
        }

        LinkIntents.Builder intents = LinkIntents.builder().add(LinkIntents.Kind.TEAR_DOWN);
        LinkState next;
        switch (category) {
            case STALE_CACHE -> {
                next = state.reconnectScheduled(attempt, false, now)
                        .withInvalidateCacheOnNextLink(true, now);
                intents.recovery(RecoveryAction.RECONNECT_WITH_CACHE_REFRESH)
                        .scheduleReconnect(config.reconnect().delayFor(attempt));
            }
            case PERSISTENT_STACK_FAULT -> {
                next = state.reconnectScheduled(attempt, true, now);
                intents.recovery(RecoveryAction.RESTART_STACK)
                        .add(LinkIntents.Kind.RESTART_ADAPTER);
            }
            default -> {
                next = state.reconnectScheduled(attempt, false, now);
                intents.recovery(RecoveryAction.RECONNECT)
                        .scheduleReconnect(config.reconnect().delayFor(attempt));
            }
        }
        return new Result(next, intents.build());
    }

    private Result onAdapterRestarted(LinkState state, LinkEvent.AdapterRestarted e) {
        if (state.phase() != LinkPhase.DISCONNECTED || !state.restartingAdapter()) {
            return unchanged(state);
        }
        // Reconnect either way; a failed restart shows up again as a stack fault.
        return new Result(state.withRestartingAdapter(false, e.timestamp()),
                LinkIntents.builder()
                        .scheduleReconnect(config.reconnect().delayFor(state.reconnectAttempt()))
                        .build());
    }

    private Result onReconnectDue(LinkState state, LinkEvent.ReconnectDue e) {
        if (state.phase() != LinkPhase.DISCONNECTED
                || !state.reconnectPending()
                || state.restartingAdapter()) {
            return unchanged(state);
        }
        return new Result(state.reconnecting(e.timestamp()), LinkIntents.of(LinkIntents.Kind.OPEN_LINK));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Result unchanged(LinkState state) {
        return new Result(state, LinkIntents.none());
    }

    private static Result fail(LinkState state, String reason, Throwable cause, Instant now) {
        LinkIntents intents = LinkIntents.builder()
                .add(LinkIntents.Kind.TEAR_DOWN)
                .add(LinkIntents.Kind.FLUSH_DELIVERY)
                .add(LinkIntents.Kind.FAIL_CONNECT)
                .failure(cause)
                .build();
        return new Result(state.failed(reason, now), intents);
    }
}
