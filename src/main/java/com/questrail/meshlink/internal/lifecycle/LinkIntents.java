package com.questrail.meshlink.internal.lifecycle;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * LinkIntents
 * -----------------------------------------------------------------------------
 * Immutable set of actions emitted by {@link LinkLifecycleReducer} for
 * {@link LinkIntentExecutor} to carry out.
 *
 * <p>Kinds are executed in declaration order, so a tear-down always runs
 * before a reconnect timer is armed and a flush always runs before a new
 * link is opened.</p>
 */
public final class LinkIntents
{
    public enum Kind {
        /** Cancel lifecycle timers, reset the operation queue, hold packets, drop the link. */
        TEAR_DOWN,

        /** Fail every pending packet and stop accepting new ones. */
        FLUSH_DELIVERY,

        /** Fail the caller's pending connect. */
        FAIL_CONNECT,

        /** Report the chosen recovery to observability. */
        REPORT_RECOVERY,

        /** Restart the radio adapter. */
        RESTART_ADAPTER,

        /** Arm the reconnect timer. */
        SCHEDULE_RECONNECT,

        /** Ask the transport to pair with the device. */
        REQUEST_AUTHORIZATION,

        /** Open the physical link. */
        OPEN_LINK,

        /** Drop the transport's service cache. */
        INVALIDATE_CACHE,

        /** Request a larger transfer unit. */
        REQUEST_TRANSFER_UNIT,

        /** Discover services and characteristics. */
        DISCOVER_SERVICES,

        /** Read FromRadio, optionally after a delay. */
        READ_FROM_RADIO,

        /** Write the configuration request and arm the handshake timeout. */
        SEND_CONFIG_REQUEST,

        /** Subscribe to FromNum notifications. */
        ENABLE_NOTIFICATIONS,

        /** Link is usable: release packets and complete the pending connect. */
        LINK_READY
    }

    private final Set<Kind> kinds;
    private final Duration reconnectDelay;
    private final Duration readDelay;
    private final RecoveryAction recoveryAction;
    private final Throwable failure;

    private LinkIntents(Builder b) {
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(b.kinds));
        this.reconnectDelay = b.reconnectDelay;
        this.readDelay = b.readDelay;
        this.recoveryAction = b.recoveryAction;
        this.failure = b.failure;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /** Delay for {@link Kind#SCHEDULE_RECONNECT}. */
    public Duration reconnectDelay() {
        return reconnectDelay;
    }

    /** Delay for {@link Kind#READ_FROM_RADIO}. */
    public Duration readDelay() {
        return readDelay;
    }

    public Optional<RecoveryAction> recoveryAction() {
        return Optional.ofNullable(recoveryAction);
    }

    /** Cause handed to {@link Kind#FAIL_CONNECT} and {@link Kind#FLUSH_DELIVERY}. */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return "LinkIntents" + kinds;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private Duration reconnectDelay = Duration.ZERO;
        private Duration readDelay = Duration.ZERO;
        private RecoveryAction recoveryAction;
        private Throwable failure;

        private Builder() {}

        public Builder add(Kind kind) {
            Objects.requireNonNull(kind, "kind");
            kinds.add(kind);
            return this;
        }

        public Builder scheduleReconnect(Duration delay) {
            this.reconnectDelay = Objects.requireNonNull(delay, "delay");
            return add(Kind.SCHEDULE_RECONNECT);
        }

        public Builder readFromRadio(Duration delay) {
            this.readDelay = Objects.requireNonNull(delay, "delay");
            return add(Kind.READ_FROM_RADIO);
        }

        public Builder recovery(RecoveryAction action) {
            this.recoveryAction = Objects.requireNonNull(action, "action");
            return add(Kind.REPORT_RECOVERY);
        }

        public Builder failure(Throwable cause) {
            this.failure = Objects.requireNonNull(cause, "cause");
            return this;
        }

        public LinkIntents build() {
            return new LinkIntents(this);
        }
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static LinkIntents none() {
        return builder().build();
    }

    public static LinkIntents of(Kind kind) {
        return builder().add(kind).build();
    }

    public static LinkIntents readFromRadioAfter(Duration delay) {
        return builder().readFromRadio(delay).build();
    }
}
