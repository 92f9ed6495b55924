package com.questrail.meshlink.internal.queue;

import com.questrail.meshlink.config.OperationTimingPolicy;
import com.questrail.meshlink.error.LinkResetException;
import com.questrail.meshlink.error.MeshLinkException;
import com.questrail.meshlink.error.OperationFailedException;
import com.questrail.meshlink.error.OperationTimeoutException;
import com.questrail.meshlink.error.TransportUnavailableException;
import com.questrail.meshlink.internal.time.Cancellable;
import com.questrail.meshlink.internal.time.MonotonicClock;
import com.questrail.meshlink.internal.time.MonotonicScheduler;
import com.questrail.meshlink.internal.time.WallClock;
import com.questrail.meshlink.observability.MeshLinkObservabilitySink;
import com.questrail.meshlink.observability.NullObservabilitySink;
import com.questrail.meshlink.observability.OperationObservabilityEvent;
import com.questrail.meshlink.transport.TransportLink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * OperationQueue
 * =============================================================================
 * Serializes exclusive transport operations for one link.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Operations are dispatched in FIFO order, at most one in flight.</li>
 *   <li>Every dispatch gets a token; its timeout and completion carry the
 *       token, and whichever arrives second finds a different token (or no
 *       in-flight operation) and does nothing.</li>
 *   <li>Read and ReliableWrite are retried at the tail of the queue with
 *       {@code attempt + 1}; ReliableWrite waits a fixed backoff first.</li>
 *   <li>Write and SetNotify failures, and retryable operations that run out
 *       of attempts, fail the caller's future and escalate to the link.</li>
 *   <li>A target the transport does not currently expose fails immediately
 *       with {@link TransportUnavailableException}; no attempt is used and
 *       nothing escalates.</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * All methods must be called on the link executor. Transport completions and
 * timer expiries are marshaled back onto it.
 */
public final class OperationQueue
{
    private final TransportLink link;
    private final Executor linkExecutor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final OperationTimingPolicy timingPolicy;
    private final MeshLinkObservabilitySink observabilitySink;

    private final Deque<TransportOperation<?>> pending = new ArrayDeque<>();
    private final List<Backoff> backoffs = new ArrayList<>();

    private OperationEscalationListener escalationListener = OperationEscalationListener.NONE;

    private InFlight inFlight;
    private long lastToken;

    private record InFlight(TransportOperation<?> operation, long token, Cancellable timeout) {}

    private record Backoff(TransportOperation<?> operation, Cancellable timer) {}

    public OperationQueue(TransportLink link,
                          Executor linkExecutor,
                          MonotonicScheduler scheduler,
                          MonotonicClock clock,
                          WallClock wallClock,
                          OperationTimingPolicy timingPolicy,
                          MeshLinkObservabilitySink observabilitySink)
    {
        this.link = Objects.requireNonNull(link, "link");
        this.linkExecutor = Objects.requireNonNull(linkExecutor, "linkExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public void setEscalationListener(OperationEscalationListener listener) {
        this.escalationListener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Appends an operation and dispatches it if the link is idle.
     *
     * @return the operation's result future
     */
    public <T> CompletableFuture<T> enqueue(TransportOperation<T> operation) {
        Objects.requireNonNull(operation, "operation");
        pending.addLast(operation);
        dispatchNext();
        return operation.result();
    }

    /**
     * Fails every queued, backing-off and in-flight operation with
     * {@link LinkResetException} and clears the in-flight slot. Completions
     * that arrive later for the old in-flight operation are ignored.
     */
    public void reset(String reason) {
        LinkResetException cause = new LinkResetException(reason);

        List<TransportOperation<?>> failed = new ArrayList<>();
        if (inFlight != null) {
            inFlight.timeout().cancel();
            failed.add(inFlight.operation());
            inFlight = null;
        }
        for (Backoff backoff : backoffs) {
            backoff.timer().cancel();
            failed.add(backoff.operation());
        }
        backoffs.clear();
        failed.addAll(pending);
        pending.clear();

        for (TransportOperation<?> operation : failed) {
            emit(OperationObservabilityEvent.Kind.RESET, operation, cause);
            operation.result().completeExceptionally(cause);
        }
    }

    /**
     * Withdraws an operation whose owner no longer wants it. Its future is
     * cancelled, queued and backing-off attempts are dropped, and an attempt
     * already in flight keeps the slot until it completes or times out but is
     * neither retried nor escalated.
     *
     * @return {@code true} if the operation was still unresolved
     */
    public boolean cancel(TransportOperation<?> operation) {
        Objects.requireNonNull(operation, "operation");
        CompletableFuture<?> result = operation.result();
        if (!result.cancel(false)) {
            return false;
        }

        pending.removeIf(queued -> queued.result() == result);
        backoffs.removeIf(backoff -> {
            if (backoff.operation().result() != result) {
                return false;
            }
            backoff.timer().cancel();
            return true;
        });
        emit(OperationObservabilityEvent.Kind.CANCELLED, operation, null);
        return true;
    }

    /** {@code true} while an operation is dispatched and not yet resolved. */
    public boolean isBusy() {
        return inFlight != null;
    }

    /** Operations waiting behind the in-flight one, including those backing off. */
    public int queuedCount() {
        return pending.size() + backoffs.size();
    }

    // ---------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------

    private void dispatchNext() {
        while (inFlight == null && !pending.isEmpty()) {
            TransportOperation<?> operation = pending.pollFirst();
            if (operation.result().isDone()) {
                continue;
            }

            if (!link.isAvailable(operation.target())) {
                TransportUnavailableException cause = new TransportUnavailableException(
                        operation.target() + " is not available");
                emit(OperationObservabilityEvent.Kind.UNAVAILABLE, operation, cause);
                operation.result().completeExceptionally(cause);
                continue;
            }

            dispatch(operation);
        }
    }

    private <T> void dispatch(TransportOperation<T> operation) {
        long token = ++lastToken;
        Cancellable timeout = scheduler.scheduleAfter(timingPolicy.operationTimeout(), clock,
                () -> linkExecutor.execute(() -> onTimeout(token)));
        inFlight = new InFlight(operation, token, timeout);
        emit(OperationObservabilityEvent.Kind.DISPATCHED, operation, null);

        CompletionStage<T> stage;
        try {
            stage = operation.issue(link);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, error) ->
                linkExecutor.execute(() -> onCompletion(operation, token, value, error)));
    }

    private <T> void onCompletion(TransportOperation<T> operation, long token, T value, Throwable error) {
        if (inFlight == null || inFlight.token() != token) {
            // Already timed out or reset.
            return;
        }

        InFlight completed = inFlight;
        inFlight = null;
        completed.timeout().cancel();

        if (error == null) {
            emit(OperationObservabilityEvent.Kind.COMPLETED, operation, null);
            operation.result().complete(value);
        } else {
            onFailure(operation, toFailure(operation, unwrap(error)));
        }

        dispatchNext();
    }

    private void onTimeout(long token) {
        if (inFlight == null || inFlight.token() != token) {
            return;
        }

        TransportOperation<?> operation = inFlight.operation();
        inFlight = null;

        OperationTimeoutException cause = new OperationTimeoutException(
                operation.name() + " " + operation.target(), timingPolicy.operationTimeout());
        emit(OperationObservabilityEvent.Kind.TIMED_OUT, operation, cause);
        onFailure(operation, cause);

        dispatchNext();
    }

    private void onFailure(TransportOperation<?> operation, Throwable cause) {
        if (operation.result().isDone()) {
            // Cancelled by its owner while in flight.
            return;
        }

        if (cause instanceof TransportUnavailableException) {
            // The target vanished mid-flight; link-down handling takes it from here.
            emit(OperationObservabilityEvent.Kind.UNAVAILABLE, operation, cause);
            operation.result().completeExceptionally(cause);
            return;
        }

        if (operation.retryable() && operation.attempt() < timingPolicy.maxAttempts()) {
            scheduleRetry(operation.nextAttempt(), cause);
            return;
        }

        emit(OperationObservabilityEvent.Kind.FAILED, operation, cause);
        operation.result().completeExceptionally(cause);

        emit(OperationObservabilityEvent.Kind.ESCALATED, operation, cause);
        escalationListener.onEscalation(operation, cause);
    }

    private void scheduleRetry(TransportOperation<?> retry, Throwable cause) {
        emit(OperationObservabilityEvent.Kind.RETRY_SCHEDULED, retry, cause);

        if (retry instanceof TransportOperation.ReliableWrite
                && !timingPolicy.reliableWriteBackoff().isZero()) {
            Backoff[] holder = new Backoff[1];
            Cancellable timer = scheduler.scheduleAfter(timingPolicy.reliableWriteBackoff(), clock,
                    () -> linkExecutor.execute(() -> {
                        if (backoffs.remove(holder[0])) {
                            pending.addLast(retry);
                            dispatchNext();
                        }
                    }));
            holder[0] = new Backoff(retry, timer);
            backoffs.add(holder[0]);
            return;
        }

        pending.addLast(retry);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Throwable toFailure(TransportOperation<?> operation, Throwable cause) {
        if (cause instanceof MeshLinkException) {
            return cause;
        }
        return new OperationFailedException(operation.name() + " " + operation.target() + " failed", cause);
    }

    private void emit(OperationObservabilityEvent.Kind kind, TransportOperation<?> operation, Throwable cause) {
        observabilitySink.onOperationEvent(new OperationObservabilityEvent(
                wallClock.now(),
                kind,
                operation.name(),
                operation.target().name(),
                operation.attempt(),
                cause));
    }
}
