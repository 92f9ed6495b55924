package com.questrail.meshlink.internal.exec;

import com.questrail.meshlink.observability.MeshLinkErrorEvent;
import com.questrail.meshlink.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class LinkEventLoopTest {

    private RecordingObservabilitySink sink;
    private LinkEventLoop loop;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        loop = new LinkEventLoop("test-link", () -> Instant.EPOCH, sink);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    void tasksRunInSubmissionOrderOnLoopThread() throws InterruptedException {
        loop.start();
        List<Integer> order = new CopyOnWriteArrayList<>();
        AtomicBoolean onLoop = new AtomicBoolean(true);
        CountDownLatch done = new CountDownLatch(1);

        for (int i = 0; i < 50; i++) {
            int n = i;
            loop.execute(() -> {
                order.add(n);
                if (!loop.inLoop()) {
                    onLoop.set(false);
                }
            });
        }
        loop.execute(done::countDown);

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(50, order.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(i, order.get(i));
        }
        assertTrue(onLoop.get());
        assertFalse(loop.inLoop());
    }

    @Test
    void failingTaskIsReportedAndLoopContinues() throws InterruptedException {
        loop.start();
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() -> {
            throw new IllegalStateException("broken task");
        });
        loop.execute(done::countDown);

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(loop.isRunning());
        assertEquals(1, sink.eventsOfType(MeshLinkErrorEvent.class).size());
    }

    @Test
    void tasksAreRejectedWhileStopped() {
        assertThrows(RejectedExecutionException.class, () -> loop.execute(() -> { }));

        loop.start();
        loop.stop();

        assertThrows(RejectedExecutionException.class, () -> loop.execute(() -> { }));
    }

    @Test
    void stopRunsTasksAcceptedBeforeIt() throws InterruptedException {
        loop.start();
        CountDownLatch blocker = new CountDownLatch(1);
        List<Integer> ran = new CopyOnWriteArrayList<>();

        loop.execute(() -> {
            try {
                blocker.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        for (int i = 0; i < 5; i++) {
            int n = i;
            loop.execute(() -> ran.add(n));
        }
        blocker.countDown();
        loop.stop();

        assertEquals(List.of(0, 1, 2, 3, 4), ran);
        assertFalse(loop.isRunning());
    }

    @Test
    void stopFromLoopTaskLetsQueuedTasksFinish() throws InterruptedException {
        loop.start();
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() -> {
            try {
                go.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            loop.stop();
        });
        loop.execute(done::countDown);
        go.countDown();

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertThrows(RejectedExecutionException.class, () -> loop.execute(() -> { }));
    }

    @Test
    void startAndStopAreIdempotent() {
        loop.start();
        loop.start();
        assertTrue(loop.isRunning());

        loop.stop();
        loop.stop();
        assertFalse(loop.isRunning());
    }
}
