package io.heartbeat4j.internal;

import io.heartbeat4j.core.CronEngine;
import io.heartbeat4j.core.CronHandle;
import io.heartbeat4j.utils.CronSchedule;
import io.heartbeat4j.utils.CronSpecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link CronEngine} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Each entry keeps exactly one pending delayed task. When it fires, the next occurrence is armed
 * first and the callback runs afterwards, so a slow callback never shifts the schedule. With more than
 * one thread, a callback can overlap its own next run; callers that need single-flight guard
 * themselves.
 */
public class ScheduledCronEngine implements CronEngine {
    private static final Logger log = LoggerFactory.getLogger(ScheduledCronEngine.class);

    private final ZoneId zone;
    private final int threads;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong ids = new AtomicLong();
    private final ConcurrentHashMap<Long, Entry> entries = new ConcurrentHashMap<>();

    private volatile ScheduledExecutorService executor;

    private static final class Entry {
        private final long id;
        private final String cronSpec;
        private final CronSchedule schedule;
        private final Runnable task;

        private volatile ScheduledFuture<?> future;
        private volatile Instant nextFireAt;

        private Entry(long id, String cronSpec, CronSchedule schedule, Runnable task) {
            this.id = id;
            this.cronSpec = cronSpec;
            this.schedule = schedule;
            this.task = task;
        }
    }

    public ScheduledCronEngine(ZoneId zone, int threads) {
        this(zone, threads, Clock.systemUTC());
    }

    public ScheduledCronEngine(ZoneId zone, int threads, Clock clock) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be a positive number");
        }
        this.zone = zone != null ? zone : ZoneId.systemDefault();
        this.threads = threads;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start firing entries. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setName("heartbeat4j.cron-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        for (Entry entry : entries.values()) {
            arm(entry, clock.instant());
        }
        log.info("Cron engine started zone={} threads={} entries={}", zone, threads, entries.size());
    }

    /**
     * Stop firing entries. Registered entries are kept and re-armed by the next {@link #start()}.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        ScheduledExecutorService current = executor;
        executor = null;
        for (Entry entry : entries.values()) {
            entry.future = null;
            entry.nextFireAt = null;
        }
        if (current != null) {
            current.shutdownNow();
            try {
                if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Cron engine threads did not terminate within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Cron engine stopped.");
    }

    @Override
    public void validate(String cronSpec) {
        CronSpecs.parse(cronSpec, zone);
    }

    @Override
    public CronHandle schedule(String cronSpec, Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        CronSchedule schedule = CronSpecs.parse(cronSpec, zone);

        Entry entry = new Entry(ids.incrementAndGet(), cronSpec, schedule, task);
        entries.put(entry.id, entry);
        if (started.get()) {
            arm(entry, clock.instant());
        }
        log.debug("Cron entry scheduled id={} spec={} nextFireAt={}", entry.id, cronSpec, entry.nextFireAt);
        return new CronHandle(entry.id, cronSpec);
    }

    @Override
    public void cancel(CronHandle handle) {
        if (handle == null) {
            return;
        }
        Entry entry = entries.remove(handle.id());
        if (entry == null) {
            return;
        }
        ScheduledFuture<?> future = entry.future;
        if (future != null) {
            future.cancel(false);
        }
        log.debug("Cron entry cancelled id={} spec={}", entry.id, entry.cronSpec);
    }

    @Override
    public Optional<Instant> nextFireTime(CronHandle handle) {
        if (handle == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(handle.id());
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.nextFireAt != null) {
            return Optional.of(entry.nextFireAt);
        }
        return Optional.ofNullable(entry.schedule.nextFireAfter(clock.instant()));
    }

    public int size() {
        return entries.size();
    }

    private void arm(Entry entry, Instant after) {
        ScheduledExecutorService current = executor;
        if (current == null || !entries.containsKey(entry.id)) {
            return;
        }

        Instant next = entry.schedule.nextFireAfter(after);
        if (next == null) {
            log.warn("Cron entry has no further fire time id={} spec={}", entry.id, entry.cronSpec);
            entry.nextFireAt = null;
            return;
        }

        long delayMs = Math.max(0, Duration.between(clock.instant(), next).toMillis());
        entry.nextFireAt = next;
        try {
            entry.future = current.schedule(() -> fire(entry), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // engine is stopping
            entry.future = null;
        }
    }

    private void fire(Entry entry) {
        if (!started.get() || !entries.containsKey(entry.id)) {
            return;
        }

        Instant scheduledAt = entry.nextFireAt;
        Instant now = clock.instant();
        arm(entry, scheduledAt != null && scheduledAt.isAfter(now) ? scheduledAt : now);

        try {
            entry.task.run();
        } catch (Exception e) {
            log.error("cron callback failed id={} spec={} msg={}", entry.id, entry.cronSpec, e.getMessage(), e);
        }
    }
}
