package io.heartbeat4j.heartbeat;

public enum CycleOutcome {
    /** Another cycle was in flight; this trigger was dropped. */
    SKIPPED_BUSY,
    SENSE_FAILED,
    EMPTY_SNAPSHOT,
    THINK_FAILED,
    PATROLLED,
    PATROL_FAILED,
    EXECUTED,
    ACT_FAILED,
    /** The cycle deadline passed before the current phase finished. */
    TIMED_OUT,
    INTERRUPTED
}
