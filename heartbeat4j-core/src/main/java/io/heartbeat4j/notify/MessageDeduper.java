package io.heartbeat4j.notify;

import org.apache.commons.codec.digest.DigestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Suppresses identical message bodies seen within a cooldown window. Messages are keyed by the MD5 hex
 * digest of their text; expired keys are purged on every accepted message.
 */
public class MessageDeduper {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(30);

    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, Instant> lastSent = new HashMap<>();

    public MessageDeduper(Duration cooldown, Clock clock) {
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Record the message and report whether it may be sent.
     *
     * @return false if the same text was accepted less than {@code cooldown} ago
     */
    public synchronized boolean tryAccept(String message) {
        String hash = hashOf(message);
        Instant now = clock.instant();

        Instant previous = lastSent.get(hash);
        if (previous != null && Duration.between(previous, now).compareTo(cooldown) < 0) {
            return false;
        }

        lastSent.put(hash, now);
        purgeExpired(now);
        return true;
    }

    public synchronized int size() {
        return lastSent.size();
    }

    public Duration cooldown() {
        return cooldown;
    }

    static String hashOf(String message) {
        return DigestUtils.md5Hex(message == null ? "" : message);
    }

    private void purgeExpired(Instant now) {
        Iterator<Map.Entry<String, Instant>> it = lastSent.entrySet().iterator();
        while (it.hasNext()) {
            if (Duration.between(it.next().getValue(), now).compareTo(cooldown) > 0) {
                it.remove();
            }
        }
    }
}
