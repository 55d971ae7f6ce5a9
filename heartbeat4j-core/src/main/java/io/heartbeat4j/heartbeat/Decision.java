package io.heartbeat4j.heartbeat;

import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of {@link Brain#think}.
 *
 * <p>The decision service speaks a delimited string protocol, {@code SENTINEL[|reason]} or
 * {@code SENTINEL[:reason]}. {@link #parse(String)} is the only place that protocol is read;
 * unrecognised content is a no-op, never an error.
 */
public record Decision(Kind kind, String reason) {

    public enum Kind {
        NO_OP("NO_OP", "NOOP", "IDLE"),
        EXECUTE("EXECUTE"),
        SELF_TEST("SELF_TEST"),
        NOTIFY("NOTIFY");

        private final String[] sentinels;

        Kind(String... sentinels) {
            this.sentinels = sentinels;
        }

        private boolean matches(String token) {
            for (String sentinel : sentinels) {
                if (sentinel.equals(token)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final Decision NO_OP = new Decision(Kind.NO_OP, "");

    public Decision {
        Objects.requireNonNull(kind, "kind must not be null");
        reason = reason == null ? "" : reason;
    }

    public static Decision noOp() {
        return NO_OP;
    }

    public static Decision execute(String reason) {
        return new Decision(Kind.EXECUTE, reason);
    }

    public static Decision selfTest() {
        return new Decision(Kind.SELF_TEST, "");
    }

    public static Decision notify(String reason) {
        return new Decision(Kind.NOTIFY, reason);
    }

    public boolean isNoOp() {
        return kind == Kind.NO_OP;
    }

    /**
     * Parse the wire form of a decision. Never throws.
     */
    public static Decision parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NO_OP;
        }

        String s = raw.trim();
        int sep = indexOfSeparator(s);
        String head = (sep < 0 ? s : s.substring(0, sep)).trim().toUpperCase(Locale.ROOT);
        String reason = sep < 0 ? "" : s.substring(sep + 1).trim();

        for (Kind kind : Kind.values()) {
            if (kind.matches(head)) {
                return new Decision(kind, reason);
            }
        }
        return new Decision(Kind.NO_OP, s);
    }

    private static int indexOfSeparator(String s) {
        int pipe = s.indexOf('|');
        int colon = s.indexOf(':');
        if (pipe < 0) return colon;
        if (colon < 0) return pipe;
        return Math.min(pipe, colon);
    }

    /**
     * Wire form, the inverse of {@link #parse(String)}.
     */
    public String toWire() {
        String sentinel = kind.sentinels[0];
        return reason.isEmpty() ? sentinel : sentinel + "|" + reason;
    }
}
