package io.heartbeat4j.worker;

/**
 * Point-in-time view of a {@link WorkerPool}.
 *
 * completed : jobs whose execute() returned normally
 * failed    : jobs whose execute() threw
 */
public record WorkerPoolStats(
        int workers,
        int queued,
        int remainingCapacity,
        long completed,
        long failed
) {
}
