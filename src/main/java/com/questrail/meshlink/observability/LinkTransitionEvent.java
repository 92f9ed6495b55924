package com.questrail.meshlink.observability;

import com.questrail.meshlink.internal.lifecycle.LinkEvent;
import com.questrail.meshlink.internal.lifecycle.LinkIntents;
import com.questrail.meshlink.internal.lifecycle.LinkState;

import java.time.Instant;

/**
 * Record representing one reducer step of a link's lifecycle.
 */
public record LinkTransitionEvent(
    Instant timestamp,
    LinkState oldState,
    LinkState newState,
    LinkEvent triggeringEvent,
    LinkIntents resultingIntents
) {
    /**
     * Checks if the lifecycle phase changed during this step.
     */
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }

    /**
     * Checks if handshake progress changed during this step.
     */
    public boolean isProgressChange() {
        return oldState.handshakeProgress() != newState.handshakeProgress();
    }
}
