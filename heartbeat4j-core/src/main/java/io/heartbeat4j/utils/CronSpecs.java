package io.heartbeat4j.utils;

import io.heartbeat4j.exception.InvalidCronSpecException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.TimeZone;

/**
 * Parses cron specs into {@link CronSchedule}s backed by Quartz {@link CronExpression}s.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field standard cron: "30 6 * * *" (minute hour day-of-month month day-of-week)</li>
 *   <li>6-field cron with leading seconds: "0 30 6 * * *"</li>
 *   <li>Native Quartz expressions (6 or 7 fields, using '?')</li>
 * </ul>
 * <p>
 * Standard cron counts day-of-week from 0 (Sunday) to 7 (Sunday again); numeric values are
 * rewritten to day names because Quartz counts from 1 (Sunday).
 * <p>
 * When both day-of-month and day-of-week are restricted, standard cron fires on days matching
 * either field. Quartz rejects that combination, so such a spec becomes two expressions.
 */
public final class CronSpecs {

    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    private CronSpecs() {
    }

    /**
     * Normalize cron specs to Quartz syntax:
     * - Accepts 5-field cron by prepending seconds "0".
     * - Accepts 6-field cron with seconds.
     * - Exactly one of day-of-month / day-of-week becomes '?' in each returned expression;
     *   a spec restricting both yields one expression per field.
     */
    public static List<String> normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return List.of(s);
    }

    private static List<String> toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("?".equals(dom) || "?".equals(dow)) {
            return List.of(String.join(" ", sec, min, hour, dom, month, dow));
        }

        if ("*".equals(dow)) {
            return List.of(String.join(" ", sec, min, hour, dom, month, "?"));
        }
        dow = toQuartzDayOfWeek(dow);
        if ("*".equals(dom)) {
            return List.of(String.join(" ", sec, min, hour, "?", month, dow));
        }

        return List.of(
                String.join(" ", sec, min, hour, dom, month, "?"),
                String.join(" ", sec, min, hour, "?", month, dow));
    }

    private static String toQuartzDayOfWeek(String field) {
        String[] items = field.split(",");
        for (int i = 0; i < items.length; i++) {
            String item = items[i];
            String step = "";
            int slash = item.indexOf('/');
            if (slash >= 0) {
                step = item.substring(slash);
                item = item.substring(0, slash);
            }
            int dash = item.indexOf('-');
            if (dash > 0) {
                item = dayName(item.substring(0, dash)) + "-" + dayName(item.substring(dash + 1));
            } else {
                item = dayName(item);
            }
            items[i] = item + step;
        }
        return String.join(",", items);
    }

    private static String dayName(String token) {
        if (token.matches("^[0-7]$")) {
            return DAY_NAMES[Integer.parseInt(token) % 7];
        }
        return token;
    }

    /**
     * Returns true if every expression the spec normalizes to is a valid Quartz {@link CronExpression}.
     */
    public static boolean isValid(String spec) {
        try {
            return normalizeCron(spec).stream().allMatch(CronExpression::isValidExpression);
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Parse a spec into a {@link CronSchedule} evaluated in {@code zone}.
     *
     * @throws InvalidCronSpecException if the spec is not valid cron syntax
     */
    public static CronSchedule parse(String spec, ZoneId zone) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidCronSpecException(String.valueOf(spec), "spec must not be blank");
        }
        TimeZone timeZone = TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault());
        List<CronExpression> expressions = new ArrayList<>();
        try {
            for (String normalized : normalizeCron(spec)) {
                CronExpression exp = new CronExpression(normalized);
                exp.setTimeZone(timeZone);
                expressions.add(exp);
            }
        } catch (ParseException | RuntimeException ex) {
            throw new InvalidCronSpecException(spec, ex);
        }
        return new CronSchedule(spec, expressions);
    }

    /**
     * Parse and compute the next occurrence strictly after {@code from} in one call.
     *
     * @return next fire time, or {@code null} if the spec never fires again
     */
    public static Instant nextFireAfter(String spec, ZoneId zone, Instant from) {
        return parse(spec, zone).nextFireAfter(from);
    }
}
