package com.questrail.meshlink.internal.lifecycle;

import com.questrail.meshlink.internal.notify.InboundFrameRouter;
import com.questrail.meshlink.internal.queue.OperationQueue;
import com.questrail.meshlink.internal.queue.TransportOperation;
import com.questrail.meshlink.transport.MeshServiceProfile;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Drains FromRadio while the link is ready.
 *
 * <p>A FromNum notification starts a drain: reads are issued one after
 * another, each non-empty frame is routed, and the drain stops at the first
 * empty (or failed) read. A request that arrives while a drain is running
 * buys exactly one more pass. Owned by the link executor.</p>
 */
final class InboundDrain
{
    private final OperationQueue operationQueue;
    private final InboundFrameRouter router;
    private final Executor linkExecutor;

    private boolean enabled;
    private boolean draining;
    private boolean passRequested;
    private long generation;

    InboundDrain(OperationQueue operationQueue, InboundFrameRouter router, Executor linkExecutor) {
        this.operationQueue = Objects.requireNonNull(operationQueue, "operationQueue");
        this.router = Objects.requireNonNull(router, "router");
        this.linkExecutor = Objects.requireNonNull(linkExecutor, "linkExecutor");
    }

    void enable() {
        enabled = true;
    }

    /**
     * Stops accepting requests; reads still in flight are ignored when they complete.
     */
    void reset() {
        enabled = false;
        draining = false;
        passRequested = false;
        generation++;
    }

    boolean isDraining() {
        return draining;
    }

    void request() {
        if (!enabled) {
            return;
        }
        if (draining) {
            passRequested = true;
            return;
        }
        draining = true;
        readNext(generation);
    }

    private void readNext(long expectedGeneration) {
        operationQueue.enqueue(TransportOperation.read(MeshServiceProfile.FROM_RADIO))
                .whenComplete((frame, error) ->
                        linkExecutor.execute(() -> onRead(expectedGeneration, frame, error)));
    }

    private void onRead(long expectedGeneration, byte[] frame, Throwable error) {
        if (expectedGeneration != generation) {
            return;
        }

        if (error == null && frame.length > 0) {
            router.route(frame);
            readNext(expectedGeneration);
            return;
        }

        if (error == null && passRequested) {
            passRequested = false;
            readNext(expectedGeneration);
            return;
        }

        // Empty, or failed (the queue escalates failures on its own).
        draining = false;
        passRequested = false;
    }
}
