package io.heartbeat4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable definition of a named recurring job.
 * This is a pure data object; the cron engine handle is tracked by the registry.
 */
public record ScheduledJob(

        // identity
        String name,

        // scheduling
        String cronSpec,
        String taskType,

        // metadata
        String description,
        Instant createdAt
) {
    public ScheduledJob {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(cronSpec, "cronSpec must not be null");
        Objects.requireNonNull(taskType, "taskType must not be null");
    }

    public ScheduledJob withCreatedAt(Instant createdAt) {
        return new ScheduledJob(name, cronSpec, taskType, description, createdAt);
    }
}
