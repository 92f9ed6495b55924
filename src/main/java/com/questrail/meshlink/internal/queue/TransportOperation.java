package com.questrail.meshlink.internal.queue;

import com.questrail.meshlink.transport.CharacteristicId;
import com.questrail.meshlink.transport.TransportLink;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * TransportOperation
 * -----------------------------------------------------------------------------
 * One exclusive transport operation waiting in (or dispatched by) the
 * {@link OperationQueue}.
 *
 * <p>The caller's result future is shared by every attempt of the same
 * operation: a retry is a new instance with {@code attempt + 1} that completes
 * the same future.</p>
 *
 * @param <T> result type delivered to the caller
 */
public abstract sealed class TransportOperation<T>
        permits TransportOperation.Write, TransportOperation.Read,
                TransportOperation.SetNotify, TransportOperation.ReliableWrite
{
    private final CharacteristicId target;
    private final CompletableFuture<T> result;
    private final int attempt;

    private TransportOperation(CharacteristicId target, CompletableFuture<T> result, int attempt) {
        this.target = Objects.requireNonNull(target, "target");
        this.result = Objects.requireNonNull(result, "result");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        this.attempt = attempt;
    }

    public CharacteristicId target() {
        return target;
    }

    /**
     * Future completed once the operation finally succeeds or fails.
     */
    public CompletableFuture<T> result() {
        return result;
    }

    public int attempt() {
        return attempt;
    }

    /**
     * Short variant name for logs and observability.
     */
    public abstract String name();

    /**
     * {@code true} if a failed attempt should be re-enqueued rather than escalated.
     */
    public abstract boolean retryable();

    /**
     * Same operation, next attempt, same result future.
     */
    abstract TransportOperation<T> nextAttempt();

    abstract CompletionStage<T> issue(TransportLink link);

    @Override
    public String toString() {
        return name() + "(" + target + ", attempt " + attempt + ")";
    }

    // ---------------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------------

    public static Write write(CharacteristicId target, byte[] payload) {
        return new Write(target, payload, new CompletableFuture<>(), 1);
    }

    public static Read read(CharacteristicId source) {
        return new Read(source, new CompletableFuture<>(), 1);
    }

    public static SetNotify setNotify(CharacteristicId source, boolean enabled) {
        return new SetNotify(source, enabled, new CompletableFuture<>(), 1);
    }

    public static ReliableWrite reliableWrite(CharacteristicId target, byte[] payload) {
        return new ReliableWrite(target, payload, new CompletableFuture<>(), 1);
    }

    /** Unacknowledged write; a failure escalates immediately. */
    public static final class Write extends TransportOperation<Void> {
        private final byte[] payload;

        private Write(CharacteristicId target, byte[] payload, CompletableFuture<Void> result, int attempt) {
            super(target, result, attempt);
            this.payload = Objects.requireNonNull(payload, "payload").clone();
        }

        @Override
        public String name() {
            return "Write";
        }

        @Override
        public boolean retryable() {
            return false;
        }

        @Override
        Write nextAttempt() {
            throw new UnsupportedOperationException("Write is not retried");
        }

        @Override
        CompletionStage<Void> issue(TransportLink link) {
            return link.performWrite(target(), payload);
        }
    }

    /** Read; an empty array means the source had nothing to deliver, and a {@code null} result is reported as one. */
    public static final class Read extends TransportOperation<byte[]> {
        private Read(CharacteristicId source, CompletableFuture<byte[]> result, int attempt) {
            super(source, result, attempt);
        }

        @Override
        public String name() {
            return "Read";
        }

        @Override
        public boolean retryable() {
            return true;
        }

        @Override
        Read nextAttempt() {
            return new Read(target(), result(), attempt() + 1);
        }

        @Override
        CompletionStage<byte[]> issue(TransportLink link) {
            // An absent value is the same as an empty one.
            return link.performRead(target()).thenApply(frame -> frame == null ? new byte[0] : frame);
        }
    }

    /** Notification subscription change; a failure escalates immediately. */
    public static final class SetNotify extends TransportOperation<Void> {
        private final boolean enabled;

        private SetNotify(CharacteristicId source, boolean enabled, CompletableFuture<Void> result, int attempt) {
            super(source, result, attempt);
            this.enabled = enabled;
        }

        public boolean enabled() {
            return enabled;
        }

        @Override
        public String name() {
            return "SetNotify";
        }

        @Override
        public boolean retryable() {
            return false;
        }

        @Override
        SetNotify nextAttempt() {
            throw new UnsupportedOperationException("SetNotify is not retried");
        }

        @Override
        CompletionStage<Void> issue(TransportLink link) {
            return link.setNotify(target(), enabled);
        }
    }

    /** Acknowledged write; retried after a fixed backoff. */
    public static final class ReliableWrite extends TransportOperation<Void> {
        private final byte[] payload;

        private ReliableWrite(CharacteristicId target, byte[] payload, CompletableFuture<Void> result, int attempt) {
            super(target, result, attempt);
            this.payload = Objects.requireNonNull(payload, "payload").clone();
        }

        @Override
        public String name() {
            return "ReliableWrite";
        }

        @Override
        public boolean retryable() {
            return true;
        }

        @Override
        ReliableWrite nextAttempt() {
            return new ReliableWrite(target(), payload, result(), attempt() + 1);
        }

        @Override
        CompletionStage<Void> issue(TransportLink link) {
            return link.performReliableWrite(target(), payload);
        }
    }
}
