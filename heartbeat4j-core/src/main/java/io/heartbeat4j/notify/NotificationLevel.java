package io.heartbeat4j.notify;

public enum NotificationLevel {
    NORMAL,
    /** Delivered even inside quiet hours. */
    URGENT,
    /** Reserved; currently dropped without delivery. */
    EMERGENCY
}
