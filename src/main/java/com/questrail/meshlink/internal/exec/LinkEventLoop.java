package com.questrail.meshlink.internal.exec;

import com.questrail.meshlink.internal.time.WallClock;
import com.questrail.meshlink.observability.MeshLinkErrorEvent;
import com.questrail.meshlink.observability.MeshLinkObservabilitySink;
import com.questrail.meshlink.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LinkEventLoop
 * =============================================================================
 * Single-threaded executor that owns all state of one link.
 *
 * <h2>Threading Model</h2>
 * Every mutation of operation-queue, lifecycle and delivery-queue state runs as
 * a task on this loop. Transport callbacks, timer expiries and public API calls
 * are marshaled here through {@link #execute(Runnable)}. Tasks run one at a
 * time in submission order, so the components need no locks.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()        → starts the loop thread
 *   loop.execute(...)   → enqueues a task
 *   loop.stop()         → runs the tasks already queued, then stops the loop
 * </pre>
 *
 * A task that throws is reported to the observability sink and the loop keeps
 * running. Once the loop is stopped (or before it is started) {@link #execute}
 * rejects tasks with {@link RejectedExecutionException}, so a caller waiting on
 * a task's outcome can fail it instead of waiting forever.
 */
public final class LinkEventLoop implements Executor
{
    private static final Logger log = LoggerFactory.getLogger(LinkEventLoop.class);

    private final String name;
    private final WallClock wallClock;
    private final MeshLinkObservabilitySink observabilitySink;

    private static final Runnable SHUTDOWN = () -> { };

    private final BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object submitLock = new Object();

    private volatile Thread loopThread;

    public LinkEventLoop(String name, WallClock wallClock, MeshLinkObservabilitySink observabilitySink) {
        this.name = Objects.requireNonNull(name, "name");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::runLoop, name);
            loopThread.setDaemon(true);
            loopThread.start();
        }
    }

    /**
     * Stops the loop thread. Tasks accepted before this call still run; later
     * ones are rejected. Blocks until the loop thread terminates (or 5 seconds
     * elapse, after which the thread is interrupted and what is left is dropped).
     * Called from a loop task, it returns at once and the loop ends after the
     * tasks queued so far.
     */
    public void stop() {
        synchronized (submitLock) {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            taskQueue.offer(SHUTDOWN);
        }

        Thread thread = loopThread;
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(5000);
            if (thread.isAlive()) {
                log.warn("{} did not drain within 5s; interrupting", name);
                thread.interrupt();
                thread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int dropped = taskQueue.size();
        taskQueue.clear();
        if (dropped > 0) {
            log.warn("{} stopped with {} queued task(s) dropped", name, dropped);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * {@code true} when called from the loop thread.
     */
    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Enqueues a task.
     *
     * @throws RejectedExecutionException if the loop is not running
     */
    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (submitLock) {
            if (!running.get()) {
                throw new RejectedExecutionException(name + " is not running");
            }
            taskQueue.offer(task);
        }
    }

    private void runLoop() {
        while (true) {
            Runnable task;
            try {
                task = taskQueue.take();
            } catch (InterruptedException e) {
                if (!running.get()) {
                    // Drain timed out in stop()
                    return;
                }
                log.debug("{} interrupted while running", name);
                continue;
            }

            if (task == SHUTDOWN) {
                return;
            }
            try {
                task.run();
            } catch (Exception e) {
                observabilitySink.onError(new MeshLinkErrorEvent(
                    wallClock.now(),
                    "Link task failed",
                    e
                ));
            }
        }
    }
}
