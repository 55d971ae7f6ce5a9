package io.heartbeat4j.worker;

import io.heartbeat4j.exception.WorkerPoolFullException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerPoolTest {

    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop();
        }
    }

    @Test
    void submitShouldRejectWhenQueueIsFull() throws Exception {
        pool = new WorkerPool(2);
        pool.start(1);
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        pool.submit(BackgroundJob.of("blocker", () -> {
            running.countDown();
            await(release);
        }));
        assertTrue(running.await(5, TimeUnit.SECONDS));

        pool.submit(BackgroundJob.of("queued-1", () -> { }));
        pool.submit(BackgroundJob.of("queued-2", () -> { }));
        WorkerPoolFullException ex = assertThrows(WorkerPoolFullException.class,
                () -> pool.submit(BackgroundJob.of("overflow", () -> { })));

        assertEquals("overflow", ex.getJobName());
        assertEquals(2, ex.getCapacity());
        assertEquals(0, pool.stats().remainingCapacity());
        release.countDown();
    }

    @Test
    void failingJobShouldNotKillWorker() throws Exception {
        pool = new WorkerPool(10);
        pool.start(1);
        CountDownLatch done = new CountDownLatch(1);

        pool.submit(BackgroundJob.of("panics", () -> {
            throw new IllegalStateException("boom");
        }));
        pool.submit(new BackgroundJob() {
            @Override
            public String name() {
                return "errors";
            }

            @Override
            public void execute() {
                throw new AssertionError("fatal");
            }
        });
        pool.submit(BackgroundJob.of("healthy", done::countDown));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.stop();
        WorkerPoolStats stats = pool.stats();
        assertEquals(1, stats.completed());
        assertEquals(2, stats.failed());
    }

    @Test
    void stopShouldDrainQueuedJobs() {
        pool = new WorkerPool(50);
        pool.start(2);
        AtomicInteger ran = new AtomicInteger();
        for (int i = 0; i < 20; i++) {
            pool.submit(BackgroundJob.of("job-" + i, () -> {
                sleep(10);
                ran.incrementAndGet();
            }));
        }

        pool.stop();

        assertEquals(20, ran.get());
        assertEquals(0, pool.stats().queued());
        assertEquals(0, pool.stats().workers());
    }

    @Test
    void stopShouldWaitForRoomWhenQueueIsFull() throws Exception {
        pool = new WorkerPool(2);
        pool.start(1);
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger();

        pool.submit(BackgroundJob.of("blocker", () -> {
            running.countDown();
            await(release);
            ran.incrementAndGet();
        }));
        assertTrue(running.await(5, TimeUnit.SECONDS));
        pool.submit(BackgroundJob.of("queued-1", ran::incrementAndGet));
        pool.submit(BackgroundJob.of("queued-2", ran::incrementAndGet));

        Thread stopper = new Thread(pool::stop, "stopper");
        stopper.start();
        stopper.join(300);
        assertTrue(stopper.isAlive());

        release.countDown();
        stopper.join(5_000);

        assertFalse(stopper.isAlive());
        assertEquals(3, ran.get());
        assertEquals(0, pool.stats().queued());
        assertEquals(0, pool.stats().workers());
    }

    @Test
    void idleWorkersShouldExitPromptlyOnStop() {
        pool = new WorkerPool(4);
        pool.start(3);

        long started = System.nanoTime();
        pool.stop();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(0, pool.stats().workers());
        assertTrue(elapsedMs < 1_000, "stop took " + elapsedMs + "ms");
    }

    @Test
    void submitShouldFailOutsideRunningState() {
        pool = new WorkerPool(1);
        assertThrows(IllegalStateException.class, () -> pool.submit(BackgroundJob.of("early", () -> { })));

        pool.start(1);
        pool.stop();

        assertThrows(IllegalStateException.class, () -> pool.submit(BackgroundJob.of("late", () -> { })));
    }

    @Test
    void constructorShouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
