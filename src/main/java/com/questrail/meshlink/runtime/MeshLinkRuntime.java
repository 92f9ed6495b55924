package com.questrail.meshlink.runtime;

import com.questrail.meshlink.api.ConnectionState;
import com.questrail.meshlink.api.ConnectionStateListener;
import com.questrail.meshlink.api.DeliveryResult;
import com.questrail.meshlink.api.MeshLinkClient;
import com.questrail.meshlink.api.MessageStatusListener;
import com.questrail.meshlink.api.NotificationHandler;
import com.questrail.meshlink.api.PeerDevice;
import com.questrail.meshlink.api.Registration;
import com.questrail.meshlink.api.Topic;
import com.questrail.meshlink.codec.FrameCodec;
import com.questrail.meshlink.codec.impl.DefaultFrameCodec;
import com.questrail.meshlink.config.MeshLinkConfig;
import com.questrail.meshlink.error.TransportUnavailableException;
import com.questrail.meshlink.internal.delivery.PacketDeliveryQueue;
import com.questrail.meshlink.internal.delivery.PacketIdGenerator;
import com.questrail.meshlink.internal.exec.LinkEventLoop;
import com.questrail.meshlink.internal.lifecycle.ConnectionLifecycle;
import com.questrail.meshlink.internal.lifecycle.LinkEvent;
import com.questrail.meshlink.internal.lifecycle.LinkState;
import com.questrail.meshlink.internal.notify.InboundFrameRouter;
import com.questrail.meshlink.internal.notify.NotificationDispatcher;
import com.questrail.meshlink.internal.queue.OperationQueue;
import com.questrail.meshlink.internal.time.MonotonicClock;
import com.questrail.meshlink.internal.time.MonotonicScheduler;
import com.questrail.meshlink.internal.time.ScheduledExecutorScheduler;
import com.questrail.meshlink.internal.time.SystemMonotonicClock;
import com.questrail.meshlink.internal.time.SystemWallClock;
import com.questrail.meshlink.internal.time.WallClock;
import com.questrail.meshlink.observability.MeshLinkObservabilitySink;
import com.questrail.meshlink.observability.NullObservabilitySink;
import com.questrail.meshlink.transport.TransportLink;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MeshLinkRuntime
 * =============================================================================
 * Composition root of one radio link and the {@link MeshLinkClient} handed to
 * the messaging layer.
 *
 * <p>Wires the operation queue, lifecycle, delivery queue and dispatcher
 * around a single serialized link executor, installs the handlers for the
 * reserved link topics, and marshals every public call onto that executor.</p>
 *
 * <pre>
 *   MeshLinkRuntime runtime = MeshLinkRuntime.builder()
 *       .withTransport(transport)
 *       .withObservabilitySink(new Slf4jMeshLinkObservabilitySink())
 *       .build();
 *   runtime.start();
 *   runtime.connect(device).join();
 * </pre>
 *
 * By default the runtime owns a {@link LinkEventLoop} thread and a scheduler
 * thread; {@link #stop()} releases both. When an executor and scheduler are
 * supplied through the builder the caller owns them.
 *
 * <p>{@link #stop()} is final: the link is torn down, a pending connect and
 * every unresolved packet fail, and later connects and submissions fail with
 * {@link TransportUnavailableException}.</p>
 */
public final class MeshLinkRuntime implements MeshLinkClient
{
    private final Executor linkExecutor;
    private final LinkEventLoop ownedLoop;
    private final ScheduledExecutorService ownedSchedulerExecutor;

    private final OperationQueue operationQueue;
    private final PacketDeliveryQueue deliveryQueue;
    private final NotificationDispatcher dispatcher;
    private final ConnectionLifecycle lifecycle;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private MeshLinkRuntime(Builder b) {
        TransportLink transport = b.transport;

        WallClock wallClock = b.wallClock;
        MonotonicClock clock = b.clock;
        MeshLinkObservabilitySink sink = b.observabilitySink;

        if (b.linkExecutor != null) {
            this.linkExecutor = b.linkExecutor;
            this.ownedLoop = null;
        } else {
            this.ownedLoop = new LinkEventLoop("meshlink-link", wallClock, sink);
            this.linkExecutor = ownedLoop;
        }

        MonotonicScheduler scheduler;
        if (b.scheduler != null) {
            scheduler = b.scheduler;
            this.ownedSchedulerExecutor = null;
        } else {
            this.ownedSchedulerExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "meshlink-timers");
                t.setDaemon(true);
                return t;
            });
            scheduler = new ScheduledExecutorScheduler(ownedSchedulerExecutor, clock);
        }

        FrameCodec codec = b.codec;
        MeshLinkConfig config = b.config;

        // 1. Operation queue (escalation target wired below)
        this.operationQueue = new OperationQueue(transport, linkExecutor, scheduler, clock, wallClock,
                config.operationTiming(), sink);

        // 2. Delivery queue
        this.deliveryQueue = new PacketDeliveryQueue(codec, operationQueue, linkExecutor, scheduler, clock,
                wallClock, config.delivery(), new PacketIdGenerator(b.packetIdSeed), sink);

        // 3. Inbound routing
        this.dispatcher = new NotificationDispatcher(wallClock, sink);
        InboundFrameRouter router = new InboundFrameRouter(codec, dispatcher, wallClock, sink);

        // 4. Lifecycle
        this.lifecycle = new ConnectionLifecycle(config, transport, operationQueue, deliveryQueue, codec, router,
                linkExecutor, scheduler, clock, wallClock, b.initialNonce, sink);
        operationQueue.setEscalationListener(lifecycle);
        transport.setListener(lifecycle);

        // 5. Reserved link topics
        dispatcher.register(Topic.ROUTING, (topic, data) -> deliveryQueue.onAck(codec.decodeAck(data)));
        dispatcher.register(Topic.QUEUE_STATUS, (topic, data) -> deliveryQueue.onQueueStatus(codec.decodeQueueStatus(data)));
        dispatcher.register(Topic.CONFIG_COMPLETE, (topic, data) ->
                lifecycle.post(new LinkEvent.ConfigComplete(wallClock.now(), codec.decodeConfigComplete(data))));
        dispatcher.register(Topic.CONFIG, (topic, data) ->
                lifecycle.post(new LinkEvent.ConfigRecordReceived(wallClock.now())));
    }

    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("runtime stopped");
        }
        if (ownedLoop != null) {
            ownedLoop.start();
        }
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        // Queued ahead of the loop shutdown, so it runs before the loop exits.
        lifecycle.disconnect();
        if (ownedLoop != null) {
            ownedLoop.stop();
        }
        if (ownedSchedulerExecutor != null) {
            // Timers only re-post onto the stopped loop.
            ownedSchedulerExecutor.shutdownNow();
            try {
                ownedSchedulerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Lifecycle snapshot, for diagnostics and tests.
     */
    public LinkState linkState() {
        return lifecycle.state();
    }

    // ---------------------------------------------------------------------
    // MeshLinkClient
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> connect(PeerDevice device) {
        if (stopped.get()) {
            return CompletableFuture.failedFuture(new TransportUnavailableException("runtime stopped"));
        }
        return lifecycle.connect(device);
    }

    @Override
    public void disconnect() {
        lifecycle.disconnect();
    }

    @Override
    public void forceReconnect() {
        lifecycle.forceReconnect();
    }

    @Override
    public CompletableFuture<DeliveryResult> submitPacket(Topic topic, byte[] payload, String correlationId, boolean trackForAck) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        if (topic.isReserved() || topic.portNumber() < 0) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("packets can only be sent to port topics: " + topic));
        }

        if (stopped.get()) {
            return CompletableFuture.failedFuture(new TransportUnavailableException("runtime stopped"));
        }

        byte[] copy = payload.clone();
        CompletableFuture<DeliveryResult> result = new CompletableFuture<>();
        try {
            linkExecutor.execute(() -> {
                CompletableFuture<DeliveryResult> queued;
                try {
                    queued = deliveryQueue.submit(topic, copy, correlationId, trackForAck);
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                    return;
                }
                queued.whenComplete((delivered, error) -> {
                    if (error != null) {
                        result.completeExceptionally(error);
                    } else {
                        result.complete(delivered);
                    }
                });
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new TransportUnavailableException("runtime stopped"));
        }
        return result;
    }

    @Override
    public Registration onNotification(Topic topic, NotificationHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(handler, "handler");
        if (topic.isReserved()) {
            throw new IllegalArgumentException("reserved topic: " + topic);
        }
        dispatcher.register(topic, handler);
        return () -> dispatcher.unregister(topic, handler);
    }

    @Override
    public ConnectionState connectionState() {
        return lifecycle.connectionState();
    }

    @Override
    public Registration addConnectionStateListener(ConnectionStateListener listener) {
        return lifecycle.addConnectionStateListener(listener);
    }

    @Override
    public Registration addMessageStatusListener(MessageStatusListener listener) {
        return deliveryQueue.addStatusListener(listener);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TransportLink transport;
        private MeshLinkConfig config = MeshLinkConfig.defaults();
        private FrameCodec codec = new DefaultFrameCodec();
        private MeshLinkObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Executor linkExecutor;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private long packetIdSeed = ThreadLocalRandom.current().nextLong(0, 0xFFFF_FFFFL);
        private int initialNonce = ThreadLocalRandom.current().nextInt(1, Integer.MAX_VALUE / 2);

        public Builder withTransport(TransportLink transport) {
            this.transport = transport;
            return this;
        }

        public Builder withConfig(MeshLinkConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCodec(FrameCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withObservabilitySink(MeshLinkObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Runs link work on {@code executor} instead of an owned event loop.
         * The executor must run tasks one at a time, in submission order.
         */
        public Builder withLinkExecutor(Executor executor) {
            this.linkExecutor = executor;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withPacketIdSeed(long seed) {
            this.packetIdSeed = seed;
            return this;
        }

        public Builder withInitialNonce(int nonce) {
            this.initialNonce = nonce;
            return this;
        }

        public MeshLinkRuntime build() {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(codec, "codec");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            return new MeshLinkRuntime(this);
        }
    }
}
