package com.questrail.meshlink.internal.lifecycle;

import com.questrail.meshlink.api.ConnectionState;
import com.questrail.meshlink.api.ConnectionStateListener;
import com.questrail.meshlink.api.PeerDevice;
import com.questrail.meshlink.api.Registration;
import com.questrail.meshlink.codec.FrameCodec;
import com.questrail.meshlink.config.MeshLinkConfig;
import com.questrail.meshlink.error.TransportUnavailableException;
import com.questrail.meshlink.internal.delivery.PacketDeliveryQueue;
import com.questrail.meshlink.internal.notify.InboundFrameRouter;
import com.questrail.meshlink.internal.queue.OperationEscalationListener;
import com.questrail.meshlink.internal.queue.OperationQueue;
import com.questrail.meshlink.internal.queue.TransportOperation;
import com.questrail.meshlink.internal.time.MonotonicClock;
import com.questrail.meshlink.internal.time.MonotonicScheduler;
import com.questrail.meshlink.internal.time.WallClock;
import com.questrail.meshlink.observability.LinkTransitionEvent;
import com.questrail.meshlink.observability.MeshLinkErrorEvent;
import com.questrail.meshlink.observability.MeshLinkObservabilitySink;
import com.questrail.meshlink.observability.NullObservabilitySink;
import com.questrail.meshlink.transport.CharacteristicId;
import com.questrail.meshlink.transport.MeshServiceProfile;
import com.questrail.meshlink.transport.TransportLink;
import com.questrail.meshlink.transport.TransportLinkListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * ConnectionLifecycle
 * =============================================================================
 * Drives one link from "device discovered" to "ready for application packets"
 * and keeps it there.
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>{@link LinkLifecycleReducer}: pure phase logic</li>
 *   <li>{@link LinkIntentExecutor}: side effects of each step</li>
 *   <li>this class: owns the current {@link LinkState}, applies events one at
 *       a time and publishes {@link ConnectionState} changes</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Public methods and transport callbacks may be called from any thread; they
 * are marshaled onto the link executor. {@link #state()} and
 * {@link #connectionState()} may be read from any thread.
 */
public final class ConnectionLifecycle implements TransportLinkListener, OperationEscalationListener
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycle.class);

    private final LinkLifecycleReducer reducer;
    private final LinkIntentExecutor intentExecutor;
    private final InboundFrameRouter router;
    private final Executor linkExecutor;
    private final WallClock wallClock;
    private final MeshLinkObservabilitySink observabilitySink;
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();

    private volatile LinkState state;
    private volatile ConnectionState published = ConnectionState.DISCONNECTED;

    public ConnectionLifecycle(MeshLinkConfig config,
                               TransportLink link,
                               OperationQueue operationQueue,
                               PacketDeliveryQueue deliveryQueue,
                               FrameCodec codec,
                               InboundFrameRouter router,
                               Executor linkExecutor,
                               MonotonicScheduler scheduler,
                               MonotonicClock clock,
                               WallClock wallClock,
                               int initialNonce,
                               MeshLinkObservabilitySink observabilitySink)
    {
        Objects.requireNonNull(config, "config");
        this.router = Objects.requireNonNull(router, "router");
        this.linkExecutor = Objects.requireNonNull(linkExecutor, "linkExecutor");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.reducer = new LinkLifecycleReducer(config);
        this.intentExecutor = new LinkIntentExecutor(link, operationQueue, deliveryQueue, codec, router,
                linkExecutor, scheduler, clock, wallClock, config, this::apply, this.observabilitySink);
        this.state = LinkState.idle(initialNonce, wallClock.now());
    }

    // ---------------------------------------------------------------------
    // Local requests
    // ---------------------------------------------------------------------

    /**
     * Connects to {@code device}. The future completes when the link is ready,
     * or exceptionally when the attempt ends in failure, a local disconnect, or
     * a newer connect. It fails with {@link TransportUnavailableException}
     * when the link executor no longer accepts work.
     */
    public CompletableFuture<Void> connect(PeerDevice device) {
        Objects.requireNonNull(device, "device");
        CompletableFuture<Void> ready = new CompletableFuture<>();
        try {
            linkExecutor.execute(() -> {
                if (state.phase() == LinkPhase.READY && device.equals(state.device())) {
                    ready.complete(null);
                    return;
                }
                intentExecutor.replacePendingConnect(ready);
                apply(new LinkEvent.ConnectRequested(wallClock.now(), device));
            });
        } catch (RejectedExecutionException e) {
            ready.completeExceptionally(new TransportUnavailableException("link executor is not running"));
        }
        return ready;
    }

    public void disconnect() {
        post(new LinkEvent.DisconnectRequested(wallClock.now()));
    }

    public void forceReconnect() {
        post(new LinkEvent.ForceReconnectRequested(wallClock.now()));
    }

    /**
     * Posts an event to the link executor.
     */
    public void post(LinkEvent event) {
        Objects.requireNonNull(event, "event");
        submit(() -> apply(event), event);
    }

    // ---------------------------------------------------------------------
    // State
    // ---------------------------------------------------------------------

    public LinkState state() {
        return state;
    }

    public ConnectionState connectionState() {
        return published;
    }

    public Registration addConnectionStateListener(ConnectionStateListener listener) {
        Objects.requireNonNull(listener, "listener");
        stateListeners.add(listener);
        return () -> stateListeners.remove(listener);
    }

    // ---------------------------------------------------------------------
    // TransportLinkListener
    // ---------------------------------------------------------------------

    @Override
    public void onLinkUp() {
        post(new LinkEvent.LinkUp(wallClock.now()));
    }

    @Override
    public void onLinkDown(int reasonCode) {
        post(new LinkEvent.LinkDown(wallClock.now(), reasonCode));
    }

    @Override
    public void onAuthorizationResult(boolean granted) {
        post(new LinkEvent.AuthorizationResult(wallClock.now(), granted));
    }

    @Override
    public void onNotification(CharacteristicId source, byte[] value) {
        Objects.requireNonNull(source, "source");
        byte[] copy = value == null ? new byte[0] : value.clone();
        submit(() -> handleNotification(source, copy), source);
    }

    // ---------------------------------------------------------------------
    // OperationEscalationListener
    // ---------------------------------------------------------------------

    @Override
    public void onEscalation(TransportOperation<?> operation, Throwable cause) {
        post(new LinkEvent.OperationEscalated(wallClock.now(), operation.toString(), cause));
    }

    /**
     * Transport callbacks can still arrive after the executor stopped; there is
     * no link state left to update at that point.
     */
    private void submit(Runnable task, Object what) {
        try {
            linkExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Link executor stopped; {} dropped", what);
        }
    }

    // ---------------------------------------------------------------------
    // Event application (link executor only)
    // ---------------------------------------------------------------------

    private void apply(LinkEvent event) {
        LinkState oldState = state;
        LinkLifecycleReducer.Result result = reducer.apply(oldState, event);
        state = result.newState();

        observabilitySink.onLinkTransition(new LinkTransitionEvent(
                wallClock.now(), oldState, result.newState(), event, result.intents()));

        if (!result.intents().isEmpty()) {
            intentExecutor.execute(result.newState(), result.intents());
        }

        publish(result.newState());
    }

    private void handleNotification(CharacteristicId source, byte[] value) {
        if (state.phase() != LinkPhase.READY) {
            return;
        }
        if (MeshServiceProfile.FROM_NUM.equals(source)) {
            intentExecutor.requestInboundDrain();
        } else if (MeshServiceProfile.FROM_RADIO.equals(source) && value.length > 0) {
            router.route(value);
        }
    }

    private void publish(LinkState current) {
        ConnectionState next = toConnectionState(current);
        if (next.equals(published)) {
            return;
        }
        published = next;
        for (ConnectionStateListener listener : stateListeners) {
            try {
                listener.onConnectionState(next);
            } catch (RuntimeException e) {
                observabilitySink.onError(new MeshLinkErrorEvent(
                        wallClock.now(), "Connection state listener failed", e));
            }
        }
    }

    static ConnectionState toConnectionState(LinkState state) {
        return switch (state.phase()) {
            case IDLE, DISCONNECTED -> ConnectionState.DISCONNECTED;
            case READY -> new ConnectionState.Connected(state.device().address());
            case FAILED -> new ConnectionState.Failed(state.failureReason());
            default -> ConnectionState.CONNECTING;
        };
    }
}
