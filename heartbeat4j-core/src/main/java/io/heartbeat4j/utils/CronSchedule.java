package io.heartbeat4j.utils;

import org.quartz.CronExpression;

import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * A parsed cron spec. Usually one Quartz expression; a spec restricting both day-of-month and
 * day-of-week becomes two, and fires when either matches.
 */
public final class CronSchedule {

    private final String spec;
    private final List<CronExpression> expressions;

    CronSchedule(String spec, List<CronExpression> expressions) {
        this.spec = spec;
        this.expressions = List.copyOf(expressions);
    }

    public String spec() {
        return spec;
    }

    public List<CronExpression> expressions() {
        return expressions;
    }

    /**
     * Earliest occurrence strictly after {@code from} across all expressions.
     *
     * @return next fire time, or {@code null} if the schedule never fires again
     */
    public Instant nextFireAfter(Instant from) {
        Date after = Date.from(from);
        Instant earliest = null;
        for (CronExpression expression : expressions) {
            Date next = expression.getNextValidTimeAfter(after);
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return earliest;
    }

    @Override
    public String toString() {
        return spec;
    }
}
