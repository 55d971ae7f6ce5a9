package io.heartbeat4j.heartbeat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-cycle context handed to every {@link Brain} call. The deadline covers the whole
 * sense/think/act cycle, not a single phase.
 */
public final class CycleContext {

    private final long cycleId;
    private final Instant startedAt;
    private final Instant deadline;
    private final Clock clock;

    CycleContext(long cycleId, Clock clock, Duration budget) {
        this.cycleId = cycleId;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
        this.deadline = startedAt.plus(budget);
    }

    public long cycleId() {
        return cycleId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant deadline() {
        return deadline;
    }

    /**
     * Time left before the deadline; zero once it has passed.
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    @Override
    public String toString() {
        return "CycleContext{cycleId=" + cycleId + ", deadline=" + deadline + "}";
    }
}
