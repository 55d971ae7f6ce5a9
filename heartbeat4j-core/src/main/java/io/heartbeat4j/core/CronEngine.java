package io.heartbeat4j.core;

import java.time.Instant;
import java.util.Optional;

/**
 * The cron-triggering primitive: runs callbacks on its own threads whenever a cron spec fires.
 */
public interface CronEngine {

    void start();

    void stop();

    /**
     * Check a spec without registering anything.
     *
     * @throws io.heartbeat4j.exception.InvalidCronSpecException if the spec is not valid
     */
    void validate(String cronSpec);

    /**
     * Register a callback. Entries added before {@link #start()} are armed on start.
     *
     * @throws io.heartbeat4j.exception.InvalidCronSpecException if the spec is not valid
     */
    CronHandle schedule(String cronSpec, Runnable task);

    /**
     * Remove an entry. Unknown or already-cancelled handles are ignored.
     */
    void cancel(CronHandle handle);

    Optional<Instant> nextFireTime(CronHandle handle);
}
