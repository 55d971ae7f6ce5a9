package io.heartbeat4j.notify;

/**
 * What {@link NotificationDispatcher#dispatch} did with a message.
 */
public enum DispatchOutcome {
    DROPPED_EMERGENCY,
    SUPPRESSED_DUPLICATE,
    DEFERRED_QUIET_HOURS,
    /** Handed to every registered notifier; delivery itself is asynchronous. */
    SENT
}
