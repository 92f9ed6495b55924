package com.questrail.meshlink.internal.delivery;

import com.questrail.meshlink.api.DeliveryResult;
import com.questrail.meshlink.api.MessageStatus;
import com.questrail.meshlink.api.PacketId;
import com.questrail.meshlink.api.Topic;
import com.questrail.meshlink.codec.AckFrame;
import com.questrail.meshlink.codec.QueueStatusFrame;
import com.questrail.meshlink.codec.impl.DefaultFrameCodec;
import com.questrail.meshlink.config.DeliveryPolicy;
import com.questrail.meshlink.config.OperationTimingPolicy;
import com.questrail.meshlink.error.LinkResetException;
import com.questrail.meshlink.error.MessageDeliveryFailedException;
import com.questrail.meshlink.error.OperationTimeoutException;
import com.questrail.meshlink.error.PacketTooLargeException;
import com.questrail.meshlink.error.TransportUnavailableException;
import com.questrail.meshlink.internal.exec.TrampolineExecutor;
import com.questrail.meshlink.internal.queue.OperationQueue;
import com.questrail.meshlink.internal.time.DeterministicScheduler;
import com.questrail.meshlink.internal.time.ManualMonotonicClock;
import com.questrail.meshlink.observability.MeshLinkErrorEvent;
import com.questrail.meshlink.observability.OperationObservabilityEvent;
import com.questrail.meshlink.observability.PacketObservabilityEvent;
import com.questrail.meshlink.observability.RecordingObservabilitySink;
import com.questrail.meshlink.transport.FakeTransportLink;
import com.questrail.meshlink.transport.FakeTransportLink.CallKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PacketDeliveryQueueTest
 * -----------------------------------------------------------------------------
 * Ordering, status transitions, acknowledgment handling and link-loss replay
 * of the delivery queue, driven through a real operation queue and a fake
 * transport.
 */
class PacketDeliveryQueueTest {

    private static final Topic TEXT = Topic.port(1);
    private static final Duration ACK_TIMEOUT = Duration.ofMinutes(2);

    private FakeTransportLink link;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private TrampolineExecutor executor;
    private ManualMonotonicClock clock;
    private OperationQueue operationQueue;

    private List<String> transitions;

    @BeforeEach
    void setUp() {
        link = new FakeTransportLink();
        link.setLinkUp(true);
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        executor = new TrampolineExecutor();
        transitions = new ArrayList<>();

        operationQueue = new OperationQueue(link, executor, scheduler, clock, () -> Instant.EPOCH,
                new OperationTimingPolicy(Duration.ofSeconds(4), 3, Duration.ofMillis(200)), sink);
    }

    private PacketDeliveryQueue newQueue(DeliveryPolicy policy) {
        PacketDeliveryQueue queue = new PacketDeliveryQueue(new DefaultFrameCodec(), operationQueue, executor,
                scheduler, clock, () -> Instant.EPOCH, policy, new PacketIdGenerator(99), sink);
        queue.addStatusListener((id, correlationId, from, to) -> transitions.add(id + ":" + from + "->" + to));
        return queue;
    }

    private PacketDeliveryQueue readyQueue() {
        PacketDeliveryQueue queue = newQueue(plainWrites());
        queue.onLinkConnecting();
        queue.onLinkReady();
        return queue;
    }

    private static DeliveryPolicy plainWrites() {
        return new DeliveryPolicy(Duration.ofSeconds(5), ACK_TIMEOUT, 1, 252, false);
    }

    // ---------------------------------------------------------------------
    // Readiness gate
    // ---------------------------------------------------------------------

    @Test
    void offlineQueueRejectsSubmissions() {
        PacketDeliveryQueue queue = newQueue(plainWrites());

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), "c1", false);

        assertInstanceOf(TransportUnavailableException.class, failureOf(result));
        assertEquals(0, queue.pendingCount());
        assertTrue(link.calls().isEmpty());
    }

    @Test
    void packetsSubmittedWhileConnectingWaitForReady() {
        link.autoRespond();
        PacketDeliveryQueue queue = newQueue(plainWrites());
        queue.onLinkConnecting();

        CompletableFuture<DeliveryResult> first = queue.submit(TEXT, bytes(1), "c1", false);
        CompletableFuture<DeliveryResult> second = queue.submit(TEXT, bytes(2), "c2", false);

        assertEquals(PacketDeliveryQueue.Mode.HOLDING, queue.mode());
        assertTrue(link.calls().isEmpty());

        queue.onLinkReady();

        assertEquals(List.of(101, 102), writtenIds());
        assertEquals(MessageStatus.SENT, first.join().status());
        assertEquals(MessageStatus.SENT, second.join().status());
    }

    // ---------------------------------------------------------------------
    // Ordering and untracked delivery
    // ---------------------------------------------------------------------

    @Test
    void untrackedPacketsAreWrittenInSubmissionOrderAndResolveSent() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        List<CompletableFuture<DeliveryResult>> results = List.of(
                queue.submit(TEXT, bytes(10), "a", false),
                queue.submit(TEXT, bytes(20), "b", false),
                queue.submit(TEXT, bytes(30), "c", false));

        assertEquals(List.of(101, 102, 103), writtenIds());
        assertEquals(List.of((byte) 10, (byte) 20, (byte) 30), writtenPayloadHeads());
        for (CompletableFuture<DeliveryResult> result : results) {
            assertEquals(MessageStatus.SENT, result.join().status());
        }
        assertEquals("b", results.get(1).join().correlationId());
        assertEquals(0, queue.pendingCount());
        assertTrue(link.calls().stream().allMatch(c -> c.kind() == CallKind.WRITE));
    }

    @Test
    void onlyOnePacketWriteIsOutstanding() {
        PacketDeliveryQueue queue = readyQueue();

        queue.submit(TEXT, bytes(1), null, false);
        queue.submit(TEXT, bytes(2), null, false);

        assertEquals(1, link.calls().size());
        link.lastCall().complete(null);
        assertEquals(2, link.calls().size());
    }

    @Test
    void reliableWritePolicyUsesReliableWrites() {
        link.autoRespond();
        PacketDeliveryQueue queue = newQueue(new DeliveryPolicy(Duration.ofSeconds(5), ACK_TIMEOUT, 1, 252, true));
        queue.onLinkConnecting();
        queue.onLinkReady();

        queue.submit(TEXT, bytes(1), null, false);

        assertEquals(CallKind.RELIABLE_WRITE, link.lastCall().kind());
    }

    @Test
    void oversizedPacketIsRejectedBeforeQueueing() {
        PacketDeliveryQueue queue = readyQueue();

        // 8 bytes of packet framing push 245 payload bytes past 252.
        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, new byte[245], null, true);

        PacketTooLargeException failure = assertInstanceOf(PacketTooLargeException.class, failureOf(result));
        assertEquals(253, failure.actualSize());
        assertEquals(0, queue.pendingCount());
        assertTrue(link.calls().isEmpty());

        CompletableFuture<DeliveryResult> fits = queue.submit(TEXT, new byte[244], null, false);
        assertFalse(fits.isDone());
        assertEquals(1, link.calls().size());
    }

    // ---------------------------------------------------------------------
    // Acknowledgments
    // ---------------------------------------------------------------------

    @Test
    void ackFromDestinationResolvesReceived() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), "msg-1", true);
        assertFalse(result.isDone());

        queue.onAck(new AckFrame(new PacketId(101), AckFrame.NO_ERROR, true));

        assertEquals(new DeliveryResult(new PacketId(101), "msg-1", MessageStatus.RECEIVED), result.join());
        assertEquals(List.of("101:SENDING->SENT", "101:SENT->RECEIVED"), transitions);
    }

    @Test
    void ackFromRelayResolvesDelivered() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);
        queue.onAck(new AckFrame(new PacketId(101), AckFrame.NO_ERROR, false));

        assertEquals(MessageStatus.DELIVERED, result.join().status());
    }

    @Test
    void routingErrorResolvesError() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);
        queue.onAck(new AckFrame(new PacketId(101), 5, false));

        MessageDeliveryFailedException failure = assertInstanceOf(MessageDeliveryFailedException.class, failureOf(result));
        assertEquals(MessageStatus.ERROR, failure.status());
        assertEquals(new PacketId(101), failure.packetId());
        assertTrue(failure.getMessage().contains("routing error 5"));
    }

    @Test
    void ackOvertakingWriteCompletionStillPassesThroughSent() {
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);
        FakeTransportLink.Call write = link.lastCall();

        queue.onAck(new AckFrame(new PacketId(101), AckFrame.NO_ERROR, true));
        write.complete(null);

        assertEquals(MessageStatus.RECEIVED, result.join().status());
        assertEquals(List.of("101:SENDING->SENT", "101:SENT->RECEIVED"), transitions);
    }

    @Test
    void ackForUnknownPacketIsReported() {
        PacketDeliveryQueue queue = readyQueue();

        queue.onAck(new AckFrame(new PacketId(999), AckFrame.NO_ERROR, true));

        assertEquals(1, sink.packetEvents(PacketObservabilityEvent.Kind.UNKNOWN_PACKET).size());
        assertTrue(transitions.isEmpty());
    }

    @Test
    void missingAckIsRetriedWithSameIdThenFails() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(7), null, true);
        assertEquals(1, link.calls().size());

        scheduler.advance(ACK_TIMEOUT);
        assertEquals(2, link.calls().size());
        assertArrayEquals(link.calls().get(0).payload(), link.calls().get(1).payload());
        assertFalse(result.isDone());

        scheduler.advance(ACK_TIMEOUT);

        MessageDeliveryFailedException failure = assertInstanceOf(MessageDeliveryFailedException.class, failureOf(result));
        assertEquals(MessageStatus.FAILED, failure.status());
        assertTrue(failure.getMessage().contains("no acknowledgment after 2 attempt(s)"));
        assertEquals(2, link.calls().size());
        assertEquals(1, sink.packetEvents(PacketObservabilityEvent.Kind.ACK_RETRY).size());
    }

    @Test
    void ackDuringRetryWindowResolvesPacket() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(7), null, true);
        scheduler.advance(ACK_TIMEOUT);
        queue.onAck(new AckFrame(new PacketId(101), AckFrame.NO_ERROR, false));

        assertEquals(MessageStatus.DELIVERED, result.join().status());
        scheduler.advance(ACK_TIMEOUT.multipliedBy(2));
        assertEquals(2, link.calls().size());
    }

    // ---------------------------------------------------------------------
    // Write failures
    // ---------------------------------------------------------------------

    @Test
    void writeFailureFailsTrackedPacketWithoutWaitingForAck() {
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);
        link.lastCall().fail(FakeTransportLink.gattError(133));

        MessageDeliveryFailedException failure = assertInstanceOf(MessageDeliveryFailedException.class, failureOf(result));
        assertEquals(MessageStatus.FAILED, failure.status());
        assertEquals(List.of("101:SENDING->FAILED"), transitions);
        assertEquals(0, queue.pendingCount());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void drainTimeoutFailsPacketAndMovesOn() {
        PacketDeliveryQueue queue = newQueue(new DeliveryPolicy(Duration.ofSeconds(2), ACK_TIMEOUT, 1, 252, false));
        queue.onLinkConnecting();
        queue.onLinkReady();

        CompletableFuture<DeliveryResult> stuck = queue.submit(TEXT, bytes(1), null, false);
        queue.submit(TEXT, bytes(2), null, false);

        scheduler.advance(Duration.ofSeconds(2));

        MessageDeliveryFailedException failure = assertInstanceOf(MessageDeliveryFailedException.class, failureOf(stuck));
        assertInstanceOf(OperationTimeoutException.class, failure.getCause());
        assertEquals(1, queue.pendingCount());
    }

    @Test
    void writeAbandonedByDrainTimeoutIsNotRetried() {
        PacketDeliveryQueue queue = newQueue(new DeliveryPolicy(Duration.ofSeconds(1), ACK_TIMEOUT, 1, 252, true));
        queue.onLinkConnecting();
        queue.onLinkReady();

        CompletableFuture<DeliveryResult> stuck = queue.submit(TEXT, bytes(1), null, true);
        scheduler.advance(Duration.ofMillis(900));
        link.lastCall().fail(new IllegalStateException("verify mismatch"));

        // The drain timeout lands inside the reliable-write backoff.
        scheduler.advance(Duration.ofMillis(100));
        assertInstanceOf(OperationTimeoutException.class, failureOf(stuck).getCause());

        scheduler.advance(Duration.ofSeconds(10));
        assertEquals(1, link.calls(CallKind.RELIABLE_WRITE).size());
        assertEquals(0, operationQueue.queuedCount());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void writeStillInFlightAtDrainTimeoutIsNotRetried() {
        PacketDeliveryQueue queue = newQueue(new DeliveryPolicy(Duration.ofSeconds(1), ACK_TIMEOUT, 1, 252, true));
        queue.onLinkConnecting();
        queue.onLinkReady();

        CompletableFuture<DeliveryResult> stuck = queue.submit(TEXT, bytes(1), null, true);
        scheduler.advance(Duration.ofSeconds(1));
        assertTrue(stuck.isCompletedExceptionally());

        // The operation timeout still frees the slot, without a second attempt.
        scheduler.advance(Duration.ofSeconds(10));
        assertEquals(1, link.calls(CallKind.RELIABLE_WRITE).size());
        assertFalse(operationQueue.isBusy());
        assertTrue(sink.operationEvents(OperationObservabilityEvent.Kind.RETRY_SCHEDULED).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Radio queue status
    // ---------------------------------------------------------------------

    @Test
    void queueRejectionOfPacketBeingSentFailsIt() {
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);
        queue.onQueueStatus(new QueueStatusFrame(101, 3, 4));

        MessageDeliveryFailedException failure = assertInstanceOf(MessageDeliveryFailedException.class, failureOf(result));
        assertEquals(MessageStatus.FAILED, failure.status());
    }

    @Test
    void queueRejectionAfterSendResolvesError() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);
        queue.onQueueStatus(new QueueStatusFrame(101, 3, 4));

        assertEquals(MessageStatus.ERROR,
                assertInstanceOf(MessageDeliveryFailedException.class, failureOf(result)).status());
    }

    @Test
    void queueAcceptanceCountsAsWrittenAndFullQueueIsReported() {
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, false);
        FakeTransportLink.Call write = link.lastCall();
        queue.submit(TEXT, bytes(2), null, false);

        queue.onQueueStatus(new QueueStatusFrame(0, 0, 0));

        assertEquals(MessageStatus.SENT, result.join().status());
        assertEquals(1, sink.packetEvents(PacketObservabilityEvent.Kind.QUEUE_FULL).size());

        // The late write completion does not resolve anything twice.
        write.complete(null);
        assertEquals(1, queue.pendingCount());
    }

    // ---------------------------------------------------------------------
    // Status transition table
    // ---------------------------------------------------------------------

    @Test
    void regressiveUpdateAfterDeliveredIsRejected() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();
        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);
        PacketId id = new PacketId(101);

        assertTrue(queue.updateStatus(id, MessageStatus.DELIVERED));
        assertFalse(queue.updateStatus(id, MessageStatus.SENT));

        assertEquals(MessageStatus.DELIVERED, result.join().status());
        assertEquals(List.of("101:SENDING->SENT", "101:SENT->DELIVERED"), transitions);
        assertEquals(1, sink.packetEvents(PacketObservabilityEvent.Kind.TRANSITION_REJECTED).size());
    }

    @Test
    void skippingSentIsRejected() {
        PacketDeliveryQueue queue = readyQueue();
        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);

        assertFalse(queue.updateStatus(new PacketId(101), MessageStatus.RECEIVED));

        assertFalse(result.isDone());
        assertTrue(transitions.isEmpty());
    }

    @Test
    void failingStatusListenerDoesNotStopDelivery() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();
        queue.addStatusListener((id, correlationId, from, to) -> {
            throw new IllegalStateException("listener bug");
        });

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, false);

        assertEquals(MessageStatus.SENT, result.join().status());
        assertEquals(List.of("101:SENDING->SENT"), transitions);
        assertTrue(sink.hasEventOfType(MeshLinkErrorEvent.class));
    }

    // ---------------------------------------------------------------------
    // Link loss and replay
    // ---------------------------------------------------------------------

    @Test
    void trackedPacketsAwaitingAckAreReplayedOnceWithOriginalIds() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> first = queue.submit(TEXT, bytes(1), "one", true);
        CompletableFuture<DeliveryResult> second = queue.submit(TEXT, bytes(2), "two", true);
        assertEquals(List.of(101, 102), writtenIds());

        queue.onLinkLost();
        assertEquals(PacketDeliveryQueue.Mode.HOLDING, queue.mode());
        assertEquals(2, sink.packetEvents(PacketObservabilityEvent.Kind.REPLAY_SCHEDULED).size());

        // The old ack timers no longer fire.
        scheduler.advance(ACK_TIMEOUT);
        assertEquals(List.of(101, 102), writtenIds());

        queue.onLinkReady();
        assertEquals(List.of(101, 102, 101, 102), writtenIds());

        queue.onAck(new AckFrame(new PacketId(102), AckFrame.NO_ERROR, true));
        queue.onAck(new AckFrame(new PacketId(101), AckFrame.NO_ERROR, false));
        assertEquals(MessageStatus.DELIVERED, first.join().status());
        assertEquals(MessageStatus.RECEIVED, second.join().status());
    }

    @Test
    void replayedPacketsGoAheadOfNewSubmissions() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();

        queue.submit(TEXT, bytes(1), null, true);
        queue.onLinkLost();
        queue.submit(TEXT, bytes(2), null, false);
        queue.onLinkReady();

        assertEquals(List.of(101, 101, 102), writtenIds());
    }

    @Test
    void untrackedPacketInterruptedMidWriteFailsWithLinkReset() {
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> inFlight = queue.submit(TEXT, bytes(1), null, false);
        CompletableFuture<DeliveryResult> queued = queue.submit(TEXT, bytes(2), null, false);

        queue.onLinkLost();
        operationQueue.reset("link torn down");

        MessageDeliveryFailedException failure = assertInstanceOf(MessageDeliveryFailedException.class, failureOf(inFlight));
        assertInstanceOf(LinkResetException.class, failure.getCause());
        assertFalse(queued.isDone());

        link.autoRespond();
        queue.onLinkReady();
        assertEquals(MessageStatus.SENT, queued.join().status());
        assertEquals(List.of(101, 102), writtenIds());
    }

    @Test
    void trackedPacketInterruptedMidWriteIsReplayed() {
        PacketDeliveryQueue queue = readyQueue();

        CompletableFuture<DeliveryResult> result = queue.submit(TEXT, bytes(1), null, true);
        queue.onLinkLost();
        operationQueue.reset("link torn down");
        assertFalse(result.isDone());

        link.autoRespond();
        queue.onLinkReady();
        queue.onAck(new AckFrame(new PacketId(101), AckFrame.NO_ERROR, true));

        assertEquals(MessageStatus.RECEIVED, result.join().status());
        assertEquals(List.of(101, 101), writtenIds());
    }

    @Test
    void flushFailsEverythingAndGoesOffline() {
        link.autoRespond();
        PacketDeliveryQueue queue = readyQueue();
        CompletableFuture<DeliveryResult> awaitingAck = queue.submit(TEXT, bytes(1), null, true);
        queue.onLinkLost();
        CompletableFuture<DeliveryResult> held = queue.submit(TEXT, bytes(2), null, false);

        queue.flush(new LinkResetException("disconnect requested"));

        assertEquals(PacketDeliveryQueue.Mode.OFFLINE, queue.mode());
        assertEquals(0, queue.pendingCount());
        assertInstanceOf(LinkResetException.class, failureOf(awaitingAck).getCause());
        assertInstanceOf(LinkResetException.class, failureOf(held).getCause());
        assertInstanceOf(TransportUnavailableException.class,
                failureOf(queue.submit(TEXT, bytes(3), null, false)));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static byte[] bytes(int first) {
        return new byte[] {(byte) first, 0x20, 0x21};
    }

    private List<Integer> writtenIds() {
        return link.toRadioWrites().stream()
                .map(frame -> ByteBuffer.wrap(frame, 1, 4).getInt())
                .toList();
    }

    private List<Byte> writtenPayloadHeads() {
        return link.toRadioWrites().stream()
                .map(frame -> Arrays.copyOfRange(frame, 8, frame.length)[0])
                .toList();
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        assertTrue(future.isCompletedExceptionally(), "future should have failed");
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return e.getCause();
    }
}
