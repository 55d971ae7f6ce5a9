package io.heartbeat4j.core;

/**
 * Opaque reference to an entry registered with a {@link CronEngine}.
 * Valid only until the entry is cancelled.
 */
public record CronHandle(long id, String cronSpec) {
}
