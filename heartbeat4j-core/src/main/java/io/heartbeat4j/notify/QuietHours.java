package io.heartbeat4j.notify;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Daily window during which non-urgent notifications are held back. The window is {@code [start, end)}
 * and wraps midnight when {@code start} is after {@code end}. Equal bounds mean no quiet hours.
 */
public final class QuietHours {

    public static final QuietHours DEFAULT = new QuietHours(LocalTime.of(23, 0), LocalTime.of(7, 0));

    private final LocalTime start;
    private final LocalTime end;

    public QuietHours(LocalTime start, LocalTime end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
    }

    public LocalTime start() {
        return start;
    }

    public LocalTime end() {
        return end;
    }

    public boolean contains(LocalTime time) {
        Objects.requireNonNull(time, "time must not be null");
        if (start.equals(end)) {
            return false;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        // wraps midnight
        return !time.isBefore(start) || time.isBefore(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
