package io.heartbeat4j.internal;

import io.heartbeat4j.JobRegistry;
import io.heartbeat4j.TaskCallback;
import io.heartbeat4j.core.CronEngine;
import io.heartbeat4j.core.CronHandle;
import io.heartbeat4j.core.JobStore;
import io.heartbeat4j.core.LoadResult;
import io.heartbeat4j.core.PersistResult;
import io.heartbeat4j.core.ScheduledJob;
import io.heartbeat4j.core.TaskTypeRegistry;
import io.heartbeat4j.exception.InvalidCronSpecException;
import io.heartbeat4j.exception.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link JobRegistry} that keeps durable job rows in a {@link JobStore} and fires them through a
 * {@link CronEngine}.
 *
 * <p>Ordering rules:
 * <ul>
 *   <li>The row is written before the engine entry exists, so durable intent always precedes the
 *   runtime effect. A crash in between is healed by the next {@link #loadJobs()}.</li>
 *   <li>Cron syntax is validated before the write; an invalid spec is never persisted.</li>
 *   <li>At most one engine entry per job name; re-adding a name replaces the old entry.</li>
 * </ul>
 *
 * <p>The in-memory job map and the store are guarded by one read/write lock.
 */
public class CronJobRegistry implements JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(CronJobRegistry.class);

    private final JobStore jobStore;
    private final CronEngine cronEngine;
    private final TaskTypeRegistry taskTypes;
    private final Executor runNowExecutor;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, RegisteredJob> jobs = new HashMap<>();

    private record RegisteredJob(ScheduledJob job, CronHandle handle) {
    }

    public CronJobRegistry(JobStore jobStore, CronEngine cronEngine, TaskTypeRegistry taskTypes, Executor runNowExecutor) {
        this(jobStore, cronEngine, taskTypes, runNowExecutor, Clock.systemUTC());
    }

    public CronJobRegistry(JobStore jobStore,
                           CronEngine cronEngine,
                           TaskTypeRegistry taskTypes,
                           Executor runNowExecutor,
                           Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.cronEngine = Objects.requireNonNull(cronEngine, "cronEngine must not be null");
        this.taskTypes = Objects.requireNonNull(taskTypes, "taskTypes must not be null");
        this.runNowExecutor = Objects.requireNonNull(runNowExecutor, "runNowExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void start() {
        cronEngine.start();
    }

    @Override
    public void stop() {
        cronEngine.stop();
    }

    @Override
    public void registerTaskType(String taskType, TaskCallback callback) {
        taskTypes.register(taskType, callback);
        log.debug("Task type registered taskType={}", taskType);
    }

    @Override
    public void addJob(String name, String cronSpec, String taskType, String description) {
        requireText(name, "name");
        requireText(cronSpec, "cronSpec");
        taskTypes.getRequired(taskType);
        cronEngine.validate(cronSpec);

        lock.writeLock().lock();
        try {
            Optional<ScheduledJob> previousRow = jobStore.findByName(name);
            ScheduledJob job = new ScheduledJob(name, cronSpec, taskType, description, clock.instant());
            PersistResult persisted = jobStore.upsert(job);
            job = jobStore.findByName(name).orElse(job);

            RegisteredJob previous = jobs.remove(name);
            if (previous != null) {
                cronEngine.cancel(previous.handle());
            }

            CronHandle handle;
            try {
                handle = cronEngine.schedule(cronSpec, fireCallback(name, taskType));
            } catch (RuntimeException e) {
                rollback(name, previousRow, previous);
                throw e;
            }

            jobs.put(name, new RegisteredJob(job, handle));
            log.info("Job added name={} spec={} taskType={} created={} replaced={}",
                    name, cronSpec, taskType, persisted.created(), previous != null);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void rollback(String name, Optional<ScheduledJob> previousRow, RegisteredJob previous) {
        try {
            if (previousRow.isPresent()) {
                jobStore.upsert(previousRow.get());
            } else {
                jobStore.deleteByName(name);
            }
        } catch (RuntimeException storeEx) {
            log.error("Job rollback failed name={} msg={}", name, storeEx.getMessage(), storeEx);
        }

        if (previous != null) {
            ScheduledJob old = previous.job();
            try {
                CronHandle handle = cronEngine.schedule(old.cronSpec(), fireCallback(old.name(), old.taskType()));
                jobs.put(name, new RegisteredJob(old, handle));
            } catch (RuntimeException e) {
                log.error("Job re-registration failed name={} spec={} msg={}", name, old.cronSpec(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void removeJob(String name) {
        requireText(name, "name");

        lock.writeLock().lock();
        try {
            RegisteredJob registered = jobs.get(name);
            long deleted = jobStore.deleteByName(name);
            if (deleted == 0 && registered == null) {
                throw new JobNotFoundException(name);
            }

            if (registered != null) {
                cronEngine.cancel(registered.handle());
                jobs.remove(name);
            }
            log.info("Job removed name={} persisted={} scheduled={}", name, deleted > 0, registered != null);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Restore persisted jobs.
     *
     * <p>Rows are visited in {@link JobStore#findAll()} order (oldest first, then by name). The first
     * row seen for a task type wins; later rows with the same task type are deleted from the store.
     */
    @Override
    public LoadResult loadJobs() {
        lock.writeLock().lock();
        try {
            List<ScheduledJob> rows = jobStore.findAll();
            log.debug("Loading jobs rows={} taskTypes={}", rows.size(), taskTypes.taskTypes());
            Set<String> seenTaskTypes = new HashSet<>();
            int loaded = 0;
            int skipped = 0;
            int removed = 0;

            for (ScheduledJob row : rows) {
                if (!seenTaskTypes.add(row.taskType())) {
                    jobStore.deleteByName(row.name());
                    RegisteredJob stale = jobs.remove(row.name());
                    if (stale != null) {
                        cronEngine.cancel(stale.handle());
                    }
                    removed++;
                    log.warn("Duplicate taskType removed name={} taskType={}", row.name(), row.taskType());
                    continue;
                }

                if (!taskTypes.contains(row.taskType())) {
                    skipped++;
                    log.warn("Job skipped, no callback for taskType name={} taskType={}", row.name(), row.taskType());
                    continue;
                }

                CronHandle handle;
                try {
                    handle = cronEngine.schedule(row.cronSpec(), fireCallback(row.name(), row.taskType()));
                } catch (InvalidCronSpecException e) {
                    skipped++;
                    log.error("Job skipped, invalid cron spec name={} spec={} msg={}", row.name(), row.cronSpec(), e.getMessage());
                    continue;
                }

                RegisteredJob previous = jobs.put(row.name(), new RegisteredJob(row, handle));
                if (previous != null) {
                    cronEngine.cancel(previous.handle());
                }
                loaded++;
            }

            LoadResult result = new LoadResult(loaded, skipped, removed);
            log.info("Jobs loaded count={} skipped={} removedDuplicates={}", loaded, skipped, removed);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean ensureSystemJob(String name, String cronSpec, String taskType, String description) {
        lock.writeLock().lock();
        try {
            Optional<ScheduledJob> existing = jobStore.findAll().stream()
                    .filter(job -> job.taskType().equals(taskType))
                    .findFirst();
            if (existing.isPresent()) {
                log.debug("System job present taskType={} name={}", taskType, existing.get().name());
                return false;
            }
            addJob(name, cronSpec, taskType, description);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void runJobNow(String name) {
        ScheduledJob job;
        lock.readLock().lock();
        try {
            RegisteredJob registered = jobs.get(name);
            if (registered == null) {
                throw new JobNotFoundException(name);
            }
            job = registered.job();
        } finally {
            lock.readLock().unlock();
        }

        TaskCallback callback = taskTypes.getRequired(job.taskType());
        runNowExecutor.execute(() -> invoke(job.name(), job.taskType(), callback));
        log.info("Job triggered manually name={} taskType={}", job.name(), job.taskType());
    }

    @Override
    public List<ScheduledJob> listJobs() {
        lock.readLock().lock();
        try {
            List<ScheduledJob> snapshot = new ArrayList<>(jobs.size());
            for (RegisteredJob registered : jobs.values()) {
                snapshot.add(registered.job());
            }
            snapshot.sort(Comparator.comparing(ScheduledJob::name));
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Handle of the active engine entry for a job, if it is registered.
     */
    public Optional<CronHandle> handleOf(String name) {
        lock.readLock().lock();
        try {
            RegisteredJob registered = jobs.get(name);
            return registered == null ? Optional.empty() : Optional.of(registered.handle());
        } finally {
            lock.readLock().unlock();
        }
    }

    // The callback is resolved when the entry fires so that registerTaskType overwrites take effect.
    private Runnable fireCallback(String name, String taskType) {
        return () -> {
            Optional<TaskCallback> callback = taskTypes.find(taskType);
            if (callback.isEmpty()) {
                log.warn("Job fired without callback name={} taskType={}", name, taskType);
                return;
            }
            invoke(name, taskType, callback.get());
        };
    }

    private void invoke(String name, String taskType, TaskCallback callback) {
        log.debug("Job started name={} taskType={}", name, taskType);
        try {
            callback.run();
            log.debug("Job succeeded name={} taskType={}", name, taskType);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job interrupted name={} taskType={}", name, taskType);
        } catch (Exception e) {
            log.error("Job failed name={} taskType={} msg={}", name, taskType, e.getMessage(), e);
        }
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
