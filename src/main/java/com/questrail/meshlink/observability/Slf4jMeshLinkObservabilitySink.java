package com.questrail.meshlink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MeshLinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jMeshLinkObservabilitySink implements MeshLinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMeshLinkObservabilitySink.class);

    @Override
    public void onLinkTransition(LinkTransitionEvent event) {
        if (event.isPhaseChange()) {
            var newState = event.newState();
            if (newState.failureReason() != null) {
                log.warn("Link Phase: {} -> {} ({})",
                    event.oldState().phase(), newState.phase(), newState.failureReason());
            } else {
                log.info("Link Phase: {} -> {}", event.oldState().phase(), newState.phase());
            }
        }

        if (event.isProgressChange()) {
            log.info("Handshake: {} -> {} (nonce {})",
                event.oldState().handshakeProgress(),
                event.newState().handshakeProgress(),
                event.newState().configNonce());
        }

        if (!event.isPhaseChange() && !event.isProgressChange() && event.resultingIntents().isEmpty()) {
            log.debug("Ignored {} in phase {}",
                event.triggeringEvent().getClass().getSimpleName(), event.newState().phase());
        }
    }

    @Override
    public void onOperationEvent(OperationObservabilityEvent event) {
        switch (event.kind()) {
            case FAILED, ESCALATED -> log.warn("Operation {} on {} (attempt {}): {}",
                event.operation(), event.target(), event.attempt(), event.kind(), event.cause());
            case TIMED_OUT, RETRY_SCHEDULED -> log.info("Operation {} on {} (attempt {}): {}",
                event.operation(), event.target(), event.attempt(), event.kind());
            default -> log.debug("Operation Event: {}", event);
        }
    }

    @Override
    public void onPacketEvent(PacketObservabilityEvent event) {
        switch (event.kind()) {
            case TRANSITION_REJECTED -> log.warn("Packet {}: rejected status change {} -> {}",
                event.packetId(), event.fromStatus(), event.toStatus());
            case STATUS_CHANGED -> log.debug("Packet {}: {} -> {}",
                event.packetId(), event.fromStatus(), event.toStatus());
            case UNKNOWN_PACKET, QUEUE_FULL -> log.info("Packet Event: {} {} {}",
                event.kind(), event.packetId(), event.detail());
            default -> log.debug("Packet Event: {}", event);
        }
    }

    @Override
    public void onRecoveryAction(RecoveryObservabilityEvent event) {
        log.warn("Link recovery for {}: {} (attempt {})", event.device(), event.action(), event.attempt());
    }

    @Override
    public void onError(MeshLinkErrorEvent event) {
        log.error("MeshLink Error: {}", event.message(), event.cause());
    }
}
