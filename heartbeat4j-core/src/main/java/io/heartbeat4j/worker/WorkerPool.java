package io.heartbeat4j.worker;

import io.heartbeat4j.exception.WorkerPoolFullException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed group of worker threads consuming a bounded queue of {@link BackgroundJob}s.
 *
 * <ul>
 *   <li>{@link #submit(BackgroundJob)} never blocks; a full queue is rejected with
 *   {@link WorkerPoolFullException}.</li>
 *   <li>A job that throws (including {@link Error}s) is logged and counted; its worker keeps going.</li>
 *   <li>{@link #stop()} drains: queued jobs still run, then the workers exit. One stop signal per
 *   worker is queued behind the pending jobs, so idle workers block on the queue instead of polling.</li>
 * </ul>
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final BackgroundJob STOP_SIGNAL = BackgroundJob.of("heartbeat4j.stop", () -> { });

    private final int capacity;
    private final BlockingQueue<BackgroundJob> queue;

    private final Object stateLock = new Object();
    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean started = false;
    private volatile boolean stopping = false;

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public WorkerPool(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be a positive number");
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Spawn {@code workers} long-lived worker threads. Calling it again is a no-op.
     */
    public void start(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be a positive number");
        }
        synchronized (stateLock) {
            if (started) {
                return;
            }
            if (stopping) {
                throw new IllegalStateException("worker pool has been stopped");
            }
            for (int i = 1; i <= workers; i++) {
                Thread t = new Thread(this::workLoop);
                t.setName("heartbeat4j.worker-" + i);
                t.setDaemon(true);
                this.workers.add(t);
            }
            started = true;
            this.workers.forEach(Thread::start);
        }
        log.info("Worker pool started workers={} capacity={}", workers, capacity);
    }

    /**
     * Enqueue a job for asynchronous execution.
     *
     * @throws WorkerPoolFullException if the queue is at capacity
     * @throws IllegalStateException   if the pool is not running
     */
    public void submit(BackgroundJob job) {
        Objects.requireNonNull(job, "job must not be null");
        boolean accepted;
        synchronized (stateLock) {
            if (!started || stopping) {
                throw new IllegalStateException("worker pool is not running, rejected job: " + job.name());
            }
            accepted = queue.offer(job);
        }
        if (!accepted) {
            log.warn("Worker queue full, job rejected name={} capacity={}", job.name(), capacity);
            throw new WorkerPoolFullException(job.name(), capacity);
        }
        log.debug("Job queued name={} queued={}", job.name(), queue.size());
    }

    /**
     * Stop accepting jobs and block until every queued and in-flight job has finished.
     */
    public void stop() {
        List<Thread> toJoin;
        synchronized (stateLock) {
            if (!started || stopping) {
                stopping = true;
                return;
            }
            stopping = true;
            toJoin = new ArrayList<>(workers);
        }

        log.info("Worker pool stopping, draining queued={}", queue.size());
        try {
            // Blocks while the queue is full; workers are still draining it.
            for (int i = 0; i < toJoin.size(); i++) {
                queue.put(STOP_SIGNAL);
            }
            for (Thread t : toJoin) {
                t.join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining worker pool");
            return;
        }
        log.info("Worker pool stopped completed={} failed={}", completed.get(), failed.get());
    }

    public WorkerPoolStats stats() {
        int running;
        synchronized (stateLock) {
            running = (int) workers.stream().filter(Thread::isAlive).count();
        }
        return new WorkerPoolStats(running, queue.size(), queue.remainingCapacity(), completed.get(), failed.get());
    }

    private void workLoop() {
        while (true) {
            BackgroundJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            if (job == STOP_SIGNAL) {
                return;
            }
            run(job);
        }
    }

    private void run(BackgroundJob job) {
        log.debug("Job started name={} worker={}", job.name(), Thread.currentThread().getName());
        try {
            job.execute();
            completed.incrementAndGet();
            log.debug("Job finished name={}", job.name());
        } catch (Throwable t) {
            failed.incrementAndGet();
            log.error("Job failed name={} worker={} msg={}", job.name(), Thread.currentThread().getName(), t.getMessage(), t);
        }
    }
}
