package com.questrail.meshlink.observability;

/**
 * No-op implementation of MeshLinkObservabilitySink.
 */
public final class NullObservabilitySink implements MeshLinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLinkTransition(LinkTransitionEvent event) {}

    @Override
    public void onOperationEvent(OperationObservabilityEvent event) {}

    @Override
    public void onPacketEvent(PacketObservabilityEvent event) {}

    @Override
    public void onRecoveryAction(RecoveryObservabilityEvent event) {}

    @Override
    public void onError(MeshLinkErrorEvent event) {}
}
