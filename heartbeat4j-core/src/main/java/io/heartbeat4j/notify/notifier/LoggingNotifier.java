package io.heartbeat4j.notify.notifier;

import io.heartbeat4j.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the application log. Used when no other channel is configured.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    private static final int MAX_LENGTH = 2000;

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(String message) {
        log.info("[Notify] {}", truncate(message));
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > MAX_LENGTH ? s.substring(0, MAX_LENGTH) : s);
    }
}
