package com.questrail.meshlink.internal.delivery;

import com.questrail.meshlink.api.DeliveryResult;
import com.questrail.meshlink.api.MessageStatus;
import com.questrail.meshlink.api.PacketId;
import com.questrail.meshlink.api.Topic;
import com.questrail.meshlink.internal.time.Cancellable;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A submitted packet that has not reached a terminal outcome.
 *
 * <p>Mutable, and touched only by {@link PacketDeliveryQueue} on the link
 * executor. The framed bytes are kept so that a retry or replay re-sends
 * exactly what was sent the first time.</p>
 */
final class PendingPacket
{
    private final long sequence;
    private final PacketId id;
    private final Topic topic;
    private final byte[] payload;
    private final byte[] framed;
    private final String correlationId;
    private final Instant createdAt;
    private final boolean trackedForAck;
    private final CompletableFuture<DeliveryResult> result;

    private MessageStatus status = MessageStatus.SENDING;
    private int retryCount;
    private Cancellable ackTimer = Cancellable.NONE;
    private long ackToken;

    PendingPacket(long sequence,
                  PacketId id,
                  Topic topic,
                  byte[] payload,
                  byte[] framed,
                  String correlationId,
                  Instant createdAt,
                  boolean trackedForAck,
                  CompletableFuture<DeliveryResult> result)
    {
        this.sequence = sequence;
        this.id = Objects.requireNonNull(id, "id");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.framed = Objects.requireNonNull(framed, "framed");
        this.correlationId = correlationId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.trackedForAck = trackedForAck;
        this.result = Objects.requireNonNull(result, "result");
    }

    long sequence() {
        return sequence;
    }

    PacketId id() {
        return id;
    }

    Topic topic() {
        return topic;
    }

    byte[] payload() {
        return payload;
    }

    byte[] framed() {
        return framed;
    }

    String correlationId() {
        return correlationId;
    }

    Instant createdAt() {
        return createdAt;
    }

    boolean trackedForAck() {
        return trackedForAck;
    }

    CompletableFuture<DeliveryResult> result() {
        return result;
    }

    MessageStatus status() {
        return status;
    }

    void status(MessageStatus status) {
        this.status = status;
    }

    int retryCount() {
        return retryCount;
    }

    void incrementRetryCount() {
        retryCount++;
    }

    /**
     * Cancels any running ack timer and starts a new wait.
     *
     * @return token the new timer's expiry must present
     */
    long beginAckWait() {
        ackTimer.cancel();
        ackTimer = Cancellable.NONE;
        return ++ackToken;
    }

    void ackTimer(Cancellable timer) {
        this.ackTimer = Objects.requireNonNull(timer, "timer");
    }

    long ackToken() {
        return ackToken;
    }

    void cancelAckTimer() {
        ackTimer.cancel();
        ackTimer = Cancellable.NONE;
        ackToken++;
    }

    @Override
    public String toString() {
        return "PendingPacket{" + id + " " + topic + " " + status
                + (trackedForAck ? " tracked" : "") + ", retries=" + retryCount + "}";
    }
}
