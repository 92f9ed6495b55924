package com.questrail.meshlink.internal.delivery;

import com.questrail.meshlink.api.DeliveryResult;
import com.questrail.meshlink.api.MessageStatus;
import com.questrail.meshlink.api.MessageStatusListener;
import com.questrail.meshlink.api.PacketId;
import com.questrail.meshlink.api.Registration;
import com.questrail.meshlink.api.Topic;
import com.questrail.meshlink.codec.AckFrame;
import com.questrail.meshlink.codec.FrameCodec;
import com.questrail.meshlink.codec.QueueStatusFrame;
import com.questrail.meshlink.config.DeliveryPolicy;
import com.questrail.meshlink.error.LinkResetException;
import com.questrail.meshlink.error.MessageDeliveryFailedException;
import com.questrail.meshlink.error.OperationTimeoutException;
import com.questrail.meshlink.error.PacketTooLargeException;
import com.questrail.meshlink.error.TransportUnavailableException;
import com.questrail.meshlink.internal.queue.OperationQueue;
import com.questrail.meshlink.internal.queue.TransportOperation;
import com.questrail.meshlink.internal.time.Cancellable;
import com.questrail.meshlink.internal.time.MonotonicClock;
import com.questrail.meshlink.internal.time.MonotonicScheduler;
import com.questrail.meshlink.internal.time.WallClock;
import com.questrail.meshlink.observability.MeshLinkErrorEvent;
import com.questrail.meshlink.observability.MeshLinkObservabilitySink;
import com.questrail.meshlink.observability.NullObservabilitySink;
import com.questrail.meshlink.observability.PacketObservabilityEvent;
import com.questrail.meshlink.transport.MeshServiceProfile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * PacketDeliveryQueue
 * =============================================================================
 * Application packet queue of one link.
 *
 * <h2>Flow</h2>
 * <pre>
 *   submit ─► outbound ─► (one at a time) write to ToRadio ─► SENT
 *                                                  │
 *                           tracked: wait for ack ─┴─► RECEIVED | DELIVERED | ERROR
 *                           no ack in time: re-send with the same id, then FAILED
 * </pre>
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li><b>OFFLINE</b>: no link and none coming; submissions fail with
 *       {@link TransportUnavailableException}.</li>
 *   <li><b>HOLDING</b>: a link is being (re)established; submissions queue up.</li>
 *   <li><b>READY</b>: the queue drains.</li>
 * </ul>
 *
 * <p>Every status change goes through one transition check; a transition the
 * status table forbids is reported and not applied.</p>
 *
 * <h2>Threading Model</h2>
 * All methods must be called on the link executor, except
 * {@link #addStatusListener(MessageStatusListener)}.
 */
public final class PacketDeliveryQueue
{
    public enum Mode {
        OFFLINE,
        HOLDING,
        READY
    }

    private final FrameCodec codec;
    private final OperationQueue operationQueue;
    private final Executor linkExecutor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final DeliveryPolicy policy;
    private final PacketIdGenerator ids;
    private final MeshLinkObservabilitySink observabilitySink;

    private final Deque<PendingPacket> outbound = new ArrayDeque<>();
    private final Map<PacketId, PendingPacket> live = new LinkedHashMap<>();
    private final List<MessageStatusListener> statusListeners = new CopyOnWriteArrayList<>();

    private Mode mode = Mode.OFFLINE;
    private long nextSequence;

    private PendingPacket writing;
    private TransportOperation<Void> writeOperation;
    private long writeToken;
    private Cancellable drainTimer = Cancellable.NONE;

    public PacketDeliveryQueue(FrameCodec codec,
                               OperationQueue operationQueue,
                               Executor linkExecutor,
                               MonotonicScheduler scheduler,
                               MonotonicClock clock,
                               WallClock wallClock,
                               DeliveryPolicy policy,
                               PacketIdGenerator ids,
                               MeshLinkObservabilitySink observabilitySink)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.operationQueue = Objects.requireNonNull(operationQueue, "operationQueue");
        this.linkExecutor = Objects.requireNonNull(linkExecutor, "linkExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    // ---------------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------------

    /**
     * Queues a packet.
     *
     * @return future completed with {@code SENT} (untracked), {@code RECEIVED}
     *         or {@code DELIVERED} (tracked), or failed with
     *         {@link MessageDeliveryFailedException}
     */
    public CompletableFuture<DeliveryResult> submit(Topic topic, byte[] payload, String correlationId, boolean trackForAck) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        if (mode == Mode.OFFLINE) {
            return CompletableFuture.failedFuture(new TransportUnavailableException("link is not connected"));
        }

        PacketId id = nextFreeId();
        byte[] framed = codec.encodePacket(id, topic, payload, trackForAck);
        if (framed.length > policy.maxPacketSize()) {
            return CompletableFuture.failedFuture(new PacketTooLargeException(framed.length, policy.maxPacketSize()));
        }

        PendingPacket packet = new PendingPacket(nextSequence++, id, topic, payload.clone(), framed,
                correlationId, wallClock.now(), trackForAck, new CompletableFuture<>());
        live.put(id, packet);
        outbound.addLast(packet);
        emit(PacketObservabilityEvent.Kind.SUBMITTED, packet, null, MessageStatus.SENDING,
                trackForAck ? "tracked" : "untracked");

        drain();
        return packet.result();
    }

    private PacketId nextFreeId() {
        PacketId id = ids.next();
        while (live.containsKey(id)) {
            id = ids.next();
        }
        return id;
    }

    // ---------------------------------------------------------------------
    // Link signals
    // ---------------------------------------------------------------------

    /** A connect or reconnect is under way: hold submissions. */
    public void onLinkConnecting() {
        if (mode == Mode.OFFLINE) {
            mode = Mode.HOLDING;
        }
    }

    /** The link is ready: start draining, replayed packets first. */
    public void onLinkReady() {
        mode = Mode.READY;
        drain();
    }

    /**
     * The link dropped and recovery is expected. Tracked packets that were
     * written (or being written) go back to the head of the queue with their
     * original id and payload. An untracked packet whose write was in flight
     * fails with {@link LinkResetException}.
     */
    public void onLinkLost() {
        mode = Mode.HOLDING;

        PendingPacket interrupted = writing;
        clearWriting();

        List<PendingPacket> replay = new ArrayList<>();
        for (PendingPacket packet : live.values()) {
            if (packet != interrupted && !outbound.contains(packet)) {
                // Written and waiting for an acknowledgment.
                packet.beginAckWait();
                replay.add(packet);
            }
        }

        if (interrupted != null) {
            if (interrupted.trackedForAck()) {
                replay.add(interrupted);
            } else {
                finish(interrupted, MessageStatus.FAILED, "link lost during write",
                        new LinkResetException("link lost"));
            }
        }

        replay.sort(Comparator.comparingLong(PendingPacket::sequence).reversed());
        for (PendingPacket packet : replay) {
            outbound.addFirst(packet);
            emit(PacketObservabilityEvent.Kind.REPLAY_SCHEDULED, packet, packet.status(), packet.status(), null);
        }
    }

    /**
     * The link is gone for good (local disconnect or terminal failure): every
     * packet fails and new submissions are refused.
     */
    public void flush(Throwable cause) {
        mode = Mode.OFFLINE;
        clearWriting();

        List<PendingPacket> all = new ArrayList<>(live.values());
        all.sort(Comparator.comparingLong(PendingPacket::sequence));
        for (PendingPacket packet : all) {
            finish(packet, MessageStatus.FAILED, "link closed", cause);
        }
        outbound.clear();
    }

    // ---------------------------------------------------------------------
    // Inbound reports
    // ---------------------------------------------------------------------

    /**
     * Mesh routing response: positive from the destination → RECEIVED, positive
     * from elsewhere → DELIVERED, error → ERROR.
     */
    public void onAck(AckFrame ack) {
        Objects.requireNonNull(ack, "ack");

        PendingPacket packet = live.get(ack.requestId());
        if (packet == null) {
            emitUnknown(ack.requestId(), "acknowledgment for unknown packet");
            return;
        }

        if (packet.status() == MessageStatus.SENDING) {
            // The acknowledgment overtook the write completion.
            transition(packet, MessageStatus.SENT);
        }

        if (ack.isAck()) {
            finish(packet, ack.fromDestination() ? MessageStatus.RECEIVED : MessageStatus.DELIVERED,
                    "acknowledged", null);
        } else {
            finish(packet, MessageStatus.ERROR, "routing error " + ack.errorReason(), null);
        }
        drain();
    }

    /**
     * Radio transmit-queue report. A rejection fails the packet: FAILED while
     * it is still being sent, ERROR once it was sent.
     */
    public void onQueueStatus(QueueStatusFrame status) {
        Objects.requireNonNull(status, "status");

        if (status.success() && status.queueFull()) {
            emit(PacketObservabilityEvent.Kind.QUEUE_FULL, writing, null, null, "radio transmit queue full");
        }

        PendingPacket packet;
        if (status.packetId().isPresent()) {
            packet = live.get(status.packetId().get());
            if (packet == null) {
                emitUnknown(status.packetId().get(), "queue status for unknown packet");
                return;
            }
        } else {
            packet = writing;
            if (packet == null) {
                return;
            }
        }

        if (status.success()) {
            if (packet == writing) {
                clearWriting();
                onWritten(packet);
                drain();
            }
            return;
        }

        MessageStatus outcome = packet.status() == MessageStatus.SENDING ? MessageStatus.FAILED : MessageStatus.ERROR;
        finish(packet, outcome, "radio rejected packet (result " + status.result() + ")", null);
        drain();
    }

    /**
     * Applies a status update to a pending packet through the transition table.
     * A terminal update resolves the packet.
     *
     * @return {@code true} if the update was applied
     */
    public boolean updateStatus(PacketId packetId, MessageStatus status) {
        Objects.requireNonNull(packetId, "packetId");
        Objects.requireNonNull(status, "status");

        PendingPacket packet = live.get(packetId);
        if (packet == null) {
            observabilitySink.onPacketEvent(new PacketObservabilityEvent(wallClock.now(),
                    PacketObservabilityEvent.Kind.TRANSITION_REJECTED, packetId, null, status,
                    "packet is no longer pending"));
            return false;
        }

        if (!status.isTerminal()) {
            return transition(packet, status);
        }
        boolean applied = finish(packet, status, "status update", null);
        drain();
        return applied;
    }

    // ---------------------------------------------------------------------
    // Status listeners and queries
    // ---------------------------------------------------------------------

    public Registration addStatusListener(MessageStatusListener listener) {
        Objects.requireNonNull(listener, "listener");
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    public Mode mode() {
        return mode;
    }

    /** Packets submitted and not yet resolved. */
    public int pendingCount() {
        return live.size();
    }

    // ---------------------------------------------------------------------
    // Drain
    // ---------------------------------------------------------------------

    private void drain() {
        if (mode != Mode.READY || writing != null) {
            return;
        }
        PendingPacket packet = outbound.pollFirst();
        if (packet == null) {
            return;
        }

        writing = packet;
        long token = ++writeToken;
        drainTimer = scheduler.scheduleAfter(policy.drainTimeout(), clock,
                () -> linkExecutor.execute(() -> onDrainTimeout(token)));

        TransportOperation<Void> write = policy.reliableWrite()
                ? TransportOperation.reliableWrite(MeshServiceProfile.TO_RADIO, packet.framed())
                : TransportOperation.write(MeshServiceProfile.TO_RADIO, packet.framed());
        writeOperation = write;
        operationQueue.enqueue(write).whenComplete((ignored, error) ->
                linkExecutor.execute(() -> onWriteResult(token, error)));
    }

    private void onWriteResult(long token, Throwable error) {
        if (writing == null || token != writeToken) {
            return;
        }

        PendingPacket packet = writing;
        clearWriting();

        if (error == null) {
            onWritten(packet);
        } else {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            finish(packet, MessageStatus.FAILED, "radio write failed", cause);
        }
        drain();
    }

    private void onDrainTimeout(long token) {
        if (writing == null || token != writeToken) {
            return;
        }

        PendingPacket packet = writing;
        clearWriting();
        finish(packet, MessageStatus.FAILED, "radio write timed out",
                new OperationTimeoutException("packet write", policy.drainTimeout()));
        drain();
    }

    private void onWritten(PendingPacket packet) {
        if (live.get(packet.id()) != packet) {
            return;
        }

        if (packet.status() == MessageStatus.SENDING) {
            transition(packet, MessageStatus.SENT);
        }

        if (!packet.trackedForAck()) {
            release(packet);
            packet.result().complete(resultOf(packet));
            return;
        }

        long token = packet.beginAckWait();
        packet.ackTimer(scheduler.scheduleAfter(policy.ackTimeout(), clock,
                () -> linkExecutor.execute(() -> onAckTimeout(packet, token))));
    }

    private void onAckTimeout(PendingPacket packet, long token) {
        if (live.get(packet.id()) != packet || packet.ackToken() != token) {
            return;
        }

        if (packet.retryCount() < policy.maxAckRetries()) {
            packet.incrementRetryCount();
            packet.beginAckWait();
            emit(PacketObservabilityEvent.Kind.ACK_RETRY, packet, packet.status(), packet.status(),
                    "retry " + packet.retryCount() + " of " + policy.maxAckRetries());
            outbound.addLast(packet);
        } else {
            finish(packet, MessageStatus.FAILED,
                    "no acknowledgment after " + (packet.retryCount() + 1) + " attempt(s)", null);
        }
        drain();
    }

    /**
     * Frees the drain slot. A write still queued or retrying in the operation
     * queue is withdrawn so a resolved packet is never transmitted again.
     */
    private void clearWriting() {
        drainTimer.cancel();
        drainTimer = Cancellable.NONE;
        writing = null;
        writeToken++;

        TransportOperation<Void> abandoned = writeOperation;
        writeOperation = null;
        if (abandoned != null) {
            operationQueue.cancel(abandoned);
        }
    }

    // ---------------------------------------------------------------------
    // Status transitions
    // ---------------------------------------------------------------------

    private boolean transition(PendingPacket packet, MessageStatus next) {
        MessageStatus previous = packet.status();
        if (!previous.canTransitionTo(next)) {
            emit(PacketObservabilityEvent.Kind.TRANSITION_REJECTED, packet, previous, next, null);
            return false;
        }

        packet.status(next);
        emit(PacketObservabilityEvent.Kind.STATUS_CHANGED, packet, previous, next, null);

        for (MessageStatusListener listener : statusListeners) {
            try {
                listener.onStatusChanged(packet.id(), packet.correlationId(), previous, next);
            } catch (RuntimeException e) {
                observabilitySink.onError(new MeshLinkErrorEvent(wallClock.now(),
                        "Message status listener failed for packet " + packet.id(), e));
            }
        }
        return true;
    }

    /**
     * Moves a packet to a terminal status and completes its future.
     */
    private boolean finish(PendingPacket packet, MessageStatus terminal, String message, Throwable cause) {
        if (!transition(packet, terminal)) {
            return false;
        }

        release(packet);
        if (terminal == MessageStatus.DELIVERED || terminal == MessageStatus.RECEIVED) {
            packet.result().complete(resultOf(packet));
        } else {
            packet.result().completeExceptionally(
                    new MessageDeliveryFailedException(packet.id(), terminal, message, cause));
        }
        return true;
    }

    private void release(PendingPacket packet) {
        packet.cancelAckTimer();
        live.remove(packet.id());
        outbound.remove(packet);
        if (writing == packet) {
            clearWriting();
        }
    }

    private static DeliveryResult resultOf(PendingPacket packet) {
        return new DeliveryResult(packet.id(), packet.correlationId(), packet.status());
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    private void emit(PacketObservabilityEvent.Kind kind, PendingPacket packet,
                      MessageStatus from, MessageStatus to, String detail) {
        observabilitySink.onPacketEvent(new PacketObservabilityEvent(
                wallClock.now(), kind, packet == null ? null : packet.id(), from, to, detail));
    }

    private void emitUnknown(PacketId packetId, String detail) {
        observabilitySink.onPacketEvent(new PacketObservabilityEvent(
                wallClock.now(), PacketObservabilityEvent.Kind.UNKNOWN_PACKET, packetId, null, null, detail));
    }
}
