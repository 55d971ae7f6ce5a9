package io.heartbeat4j.core;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of {@link ScheduledJob} rows, keyed by job name.
 */
public interface JobStore {

    /**
     * Insert or replace the row for {@code job.name()}.
     * {@code createdAt} of an existing row is preserved.
     */
    PersistResult upsert(ScheduledJob job);

    Optional<ScheduledJob> findByName(String name);

    /**
     * All rows ordered by createdAt ascending, then name ascending.
     */
    List<ScheduledJob> findAll();

    /**
     * @return deleted count (0 or 1)
     */
    long deleteByName(String name);
}
