package com.questrail.meshlink.internal.lifecycle;

import com.questrail.meshlink.api.PeerDevice;
import com.questrail.meshlink.codec.FrameCodec;
import com.questrail.meshlink.config.MeshLinkConfig;
import com.questrail.meshlink.error.LinkResetException;
import com.questrail.meshlink.internal.delivery.PacketDeliveryQueue;
import com.questrail.meshlink.internal.notify.InboundFrameRouter;
import com.questrail.meshlink.internal.queue.OperationQueue;
import com.questrail.meshlink.internal.queue.TransportOperation;
import com.questrail.meshlink.internal.time.Cancellable;
import com.questrail.meshlink.internal.time.MonotonicClock;
import com.questrail.meshlink.internal.time.MonotonicScheduler;
import com.questrail.meshlink.internal.time.WallClock;
import com.questrail.meshlink.observability.MeshLinkObservabilitySink;
import com.questrail.meshlink.observability.NullObservabilitySink;
import com.questrail.meshlink.observability.RecoveryObservabilityEvent;
import com.questrail.meshlink.transport.MeshServiceProfile;
import com.questrail.meshlink.transport.TransportLink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * LinkIntentExecutor
 * =============================================================================
 * Carries out {@link LinkIntents} against the transport, the operation queue
 * and the delivery queue.
 *
 * <p>This is the impure half of the lifecycle. Every asynchronous step it
 * starts reports back as a {@link LinkEvent} posted to the link executor.
 * Steps belong to a <i>session</i> that ends at each tear-down or new link;
 * results of an ended session are dropped so they cannot advance the next
 * link.</p>
 *
 * <p>Lifecycle timers (drain delay, handshake timeout, reconnect) are held
 * here and cancelled on tear-down.</p>
 */
public final class LinkIntentExecutor
{
    private final TransportLink link;
    private final OperationQueue operationQueue;
    private final PacketDeliveryQueue deliveryQueue;
    private final FrameCodec codec;
    private final InboundFrameRouter router;
    private final InboundDrain inboundDrain;
    private final Executor linkExecutor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MeshLinkConfig config;
    private final Consumer<LinkEvent> eventSink;
    private final MeshLinkObservabilitySink observabilitySink;

    private long session;
    private Cancellable drainTimer = Cancellable.NONE;
    private Cancellable handshakeTimer = Cancellable.NONE;
    private Cancellable reconnectTimer = Cancellable.NONE;
    private CompletableFuture<Void> pendingConnect;

    public LinkIntentExecutor(TransportLink link,
                              OperationQueue operationQueue,
                              PacketDeliveryQueue deliveryQueue,
                              FrameCodec codec,
                              InboundFrameRouter router,
                              Executor linkExecutor,
                              MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              WallClock wallClock,
                              MeshLinkConfig config,
                              Consumer<LinkEvent> eventSink,
                              MeshLinkObservabilitySink observabilitySink)
    {
        this.link = Objects.requireNonNull(link, "link");
        this.operationQueue = Objects.requireNonNull(operationQueue, "operationQueue");
        this.deliveryQueue = Objects.requireNonNull(deliveryQueue, "deliveryQueue");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.linkExecutor = Objects.requireNonNull(linkExecutor, "linkExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.config = Objects.requireNonNull(config, "config");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.router = Objects.requireNonNull(router, "router");
        this.inboundDrain = new InboundDrain(operationQueue, router, linkExecutor);
    }

    /**
     * Executes intents in kind order against {@code state}, the state the
     * reducer just produced.
     */
    public void execute(LinkState state, LinkIntents intents) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(intents, "intents");

        for (LinkIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case TEAR_DOWN -> tearDown();
                case FLUSH_DELIVERY -> deliveryQueue.flush(
                        intents.failure().orElseGet(() -> new LinkResetException("link closed")));
                case FAIL_CONNECT -> failConnect(
                        intents.failure().orElseGet(() -> new LinkResetException("connect abandoned")));
                case REPORT_RECOVERY -> intents.recoveryAction().ifPresent(action ->
                        observabilitySink.onRecoveryAction(new RecoveryObservabilityEvent(
                                wallClock.now(), action, state.reconnectAttempt(),
                                state.currentDevice().map(PeerDevice::address).orElse(null))));
                case RESTART_ADAPTER -> track(link.restartAdapter(),
                        (ignored, error) -> new LinkEvent.AdapterRestarted(wallClock.now(), error == null));
                case SCHEDULE_RECONNECT -> scheduleReconnect(intents.reconnectDelay());
                case REQUEST_AUTHORIZATION -> {
                    newSession();
                    deliveryQueue.onLinkConnecting();
                    link.requestAuthorization(state.device());
                }
                case OPEN_LINK -> {
                    newSession();
                    deliveryQueue.onLinkConnecting();
                    link.connect(state.device());
                }
                case INVALIDATE_CACHE -> track(link.invalidateCache(),
                        (ignored, error) -> new LinkEvent.CacheInvalidated(wallClock.now(), error == null));
                case REQUEST_TRANSFER_UNIT -> track(
                        link.requestTransferUnit(config.handshake().requestedTransferUnit()),
                        (size, error) -> new LinkEvent.TransferUnitNegotiated(
                                wallClock.now(), error == null, error == null ? size : 0));
                case DISCOVER_SERVICES -> track(link.discoverServices(),
                        (found, error) -> error == null
                                ? new LinkEvent.ServicesResolved(wallClock.now(), found)
                                : new LinkEvent.ServiceDiscoveryFailed(wallClock.now(), describe(error)));
                case READ_FROM_RADIO -> readFromRadio(intents.readDelay());
                case SEND_CONFIG_REQUEST -> sendConfigRequest(state.configNonce());
                case ENABLE_NOTIFICATIONS -> track(
                        operationQueue.enqueue(TransportOperation.setNotify(MeshServiceProfile.FROM_NUM, true)),
                        (ignored, error) -> new LinkEvent.NotificationsEnabled(wallClock.now(), error == null));
                case LINK_READY -> linkReady();
            }
        }
    }

    /**
     * Installs the future completed when the link next becomes ready. A
     * previous, still pending, connect future is failed.
     */
    public void replacePendingConnect(CompletableFuture<Void> future) {
        Objects.requireNonNull(future, "future");
        if (pendingConnect != null && pendingConnect != future) {
            pendingConnect.completeExceptionally(new LinkResetException("superseded by a new connect"));
        }
        pendingConnect = future;
    }

    /**
     * FromNum notified new inbound data while the link is ready.
     */
    public void requestInboundDrain() {
        inboundDrain.request();
    }

    // ---------------------------------------------------------------------
    // Steps
    // ---------------------------------------------------------------------

    private void tearDown() {
        newSession();
        cancelTimers();
        inboundDrain.reset();
        operationQueue.reset("link torn down");
        deliveryQueue.onLinkLost();
        link.disconnect();
    }

    private void scheduleReconnect(Duration delay) {
        reconnectTimer.cancel();
        long reconnectSession = session;
        reconnectTimer = scheduler.scheduleAfter(delay, clock,
                () -> post(new LinkEvent.ReconnectDue(wallClock.now()), reconnectSession));
    }

    private void readFromRadio(Duration delay) {
        long readSession = session;
        if (delay.isZero()) {
            issueLifecycleRead(readSession);
            return;
        }
        drainTimer.cancel();
        drainTimer = scheduler.scheduleAfter(delay, clock, () -> linkExecutor.execute(() -> {
            if (readSession == session) {
                issueLifecycleRead(readSession);
            }
        }));
    }

    private void issueLifecycleRead(long readSession) {
        operationQueue.enqueue(TransportOperation.read(MeshServiceProfile.FROM_RADIO))
                .whenComplete((frame, error) -> linkExecutor.execute(() -> {
                    if (readSession != session) {
                        return;
                    }
                    boolean empty = error == null && frame.length == 0;
                    if (error == null && !empty) {
                        router.route(frame);
                    }
                    // Posted behind whatever the routed frame produced.
                    post(new LinkEvent.DrainReadCompleted(wallClock.now(), empty, error != null), readSession);
                }));
    }

    private void sendConfigRequest(int nonce) {
        track(operationQueue.enqueue(TransportOperation.reliableWrite(
                        MeshServiceProfile.TO_RADIO, codec.encodeWantConfig(nonce))),
                (ignored, error) -> new LinkEvent.ConfigRequestSent(wallClock.now(), error == null));

        handshakeTimer.cancel();
        long handshakeSession = session;
        handshakeTimer = scheduler.scheduleAfter(config.handshake().handshakeTimeout(), clock,
                () -> post(new LinkEvent.HandshakeTimedOut(wallClock.now(), nonce), handshakeSession));
    }

    private void linkReady() {
        handshakeTimer.cancel();
        drainTimer.cancel();
        inboundDrain.enable();
        deliveryQueue.onLinkReady();
        if (pendingConnect != null) {
            CompletableFuture<Void> connected = pendingConnect;
            pendingConnect = null;
            connected.complete(null);
        }
    }

    private void failConnect(Throwable cause) {
        if (pendingConnect != null) {
            CompletableFuture<Void> failed = pendingConnect;
            pendingConnect = null;
            failed.completeExceptionally(cause);
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void newSession() {
        session++;
    }

    private void cancelTimers() {
        drainTimer.cancel();
        handshakeTimer.cancel();
        reconnectTimer.cancel();
        drainTimer = Cancellable.NONE;
        handshakeTimer = Cancellable.NONE;
        reconnectTimer = Cancellable.NONE;
    }

    /**
     * Posts the event produced by {@code stage}'s outcome, unless the session
     * has ended by then.
     */
    private <T> void track(CompletionStage<T> stage, StepOutcome<T> outcome) {
        long stepSession = session;
        stage.whenComplete((value, error) -> post(outcome.toEvent(value, error), stepSession));
    }

    @FunctionalInterface
    private interface StepOutcome<T> {
        LinkEvent toEvent(T value, Throwable error);
    }

    private void post(LinkEvent event, long eventSession) {
        linkExecutor.execute(() -> {
            if (eventSession == session) {
                eventSink.accept(event);
            }
        });
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
