package io.heartbeat4j.internal;

import io.heartbeat4j.core.JobStore;
import io.heartbeat4j.core.PersistResult;
import io.heartbeat4j.core.ScheduledJob;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link JobStore}. Rows live as long as the instance, which makes it useful for tests
 * and for running without a database.
 */
public class InMemoryJobStore implements JobStore {

    static final Comparator<ScheduledJob> LOAD_ORDER = Comparator
            .comparing(ScheduledJob::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ScheduledJob::name);

    private final Map<String, ScheduledJob> rows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public PersistResult upsert(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        boolean[] created = new boolean[1];
        rows.compute(job.name(), (name, existing) -> {
            if (existing == null) {
                created[0] = true;
                Instant createdAt = job.createdAt() != null ? job.createdAt() : clock.instant();
                return job.withCreatedAt(createdAt);
            }
            return job.withCreatedAt(existing.createdAt());
        });
        return created[0] ? PersistResult.createdResult() : PersistResult.updatedResult();
    }

    @Override
    public Optional<ScheduledJob> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(name));
    }

    @Override
    public List<ScheduledJob> findAll() {
        List<ScheduledJob> all = new ArrayList<>(rows.values());
        all.sort(LOAD_ORDER);
        return all;
    }

    @Override
    public long deleteByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return rows.remove(name) != null ? 1 : 0;
    }
}
