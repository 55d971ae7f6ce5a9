package io.heartbeat4j.core;

/**
 * Result of restoring persisted jobs at startup.
 *
 * loaded            : jobs registered with the cron engine
 * skipped           : rows kept in the store but not scheduled (missing callback, bad cron spec)
 * removedDuplicates : rows deleted because another row already claimed their task type
 */
public record LoadResult(
        int loaded,
        int skipped,
        int removedDuplicates
) {
}
