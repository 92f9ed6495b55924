package com.questrail.meshlink.observability;

/**
 * Main interface for receiving link observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>All callbacks are invoked on the link executor and must not block.</p>
 */
public interface MeshLinkObservabilitySink {
    /**
     * Called after every lifecycle reducer step.
     * @param event the transition details
     */
    void onLinkTransition(LinkTransitionEvent event);

    /**
     * Called when a transport operation is dispatched, completes, times out, retries or fails.
     * @param event the operation event
     */
    void onOperationEvent(OperationObservabilityEvent event);

    /**
     * Called when a packet is submitted or changes (or fails to change) status.
     * @param event the packet event
     */
    void onPacketEvent(PacketObservabilityEvent event);

    /**
     * Called when a recovery action is chosen after a link failure.
     * @param event the recovery event
     */
    void onRecoveryAction(RecoveryObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the link stack.
     * @param event the error event
     */
    void onError(MeshLinkErrorEvent event);
}
