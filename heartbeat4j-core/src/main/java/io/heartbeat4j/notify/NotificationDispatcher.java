package io.heartbeat4j.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a message out to every registered {@link Notifier}.
 *
 * <p>Filters, in order: emergency drop, duplicate suppression ({@link MessageDeduper}), quiet hours
 * ({@link QuietHours}, bypassed by {@link NotificationLevel#URGENT}). A message that passes is handed to
 * each notifier on the send executor; {@link #dispatch} does not wait for delivery.
 */
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(15);

    private final List<Notifier> notifiers = new CopyOnWriteArrayList<>();
    private final MessageDeduper deduper;
    private final QuietHours quietHours;
    private final Duration sendTimeout;
    private final Executor sendExecutor;
    private final Clock clock;
    private final ZoneId zone;

    public NotificationDispatcher(MessageDeduper deduper,
                                  QuietHours quietHours,
                                  Duration sendTimeout,
                                  Executor sendExecutor,
                                  Clock clock,
                                  ZoneId zone) {
        this.deduper = Objects.requireNonNull(deduper, "deduper must not be null");
        this.quietHours = Objects.requireNonNull(quietHours, "quietHours must not be null");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout must not be null");
        if (sendTimeout.isZero() || sendTimeout.isNegative()) {
            throw new IllegalArgumentException("sendTimeout must be a positive duration");
        }
        this.sendExecutor = Objects.requireNonNull(sendExecutor, "sendExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = zone != null ? zone : ZoneId.systemDefault();
    }

    /**
     * Add a delivery channel. Channels cannot be removed.
     */
    public void register(Notifier notifier) {
        Objects.requireNonNull(notifier, "notifier must not be null");
        notifiers.add(notifier);
        log.info("Notifier registered name={} total={}", notifier.name(), notifiers.size());
    }

    public List<Notifier> notifiers() {
        return List.copyOf(notifiers);
    }

    public DispatchOutcome dispatch(NotificationLevel level, String message) {
        Objects.requireNonNull(level, "level must not be null");

        // TODO: route EMERGENCY to a dedicated escalation channel once one exists
        if (level == NotificationLevel.EMERGENCY) {
            log.warn("Emergency notification dropped, no escalation channel configured");
            return DispatchOutcome.DROPPED_EMERGENCY;
        }

        if (!deduper.tryAccept(message)) {
            log.info("Notification suppressed as duplicate level={} cooldown={}", level, deduper.cooldown());
            return DispatchOutcome.SUPPRESSED_DUPLICATE;
        }

        LocalTime localTime = LocalTime.ofInstant(clock.instant(), zone);
        if (level != NotificationLevel.URGENT && quietHours.contains(localTime)) {
            log.info("Quiet hours {}, notification held for later level={} time={}", quietHours, level, localTime);
            return DispatchOutcome.DEFERRED_QUIET_HOURS;
        }

        List<Notifier> targets = notifiers();
        if (targets.isEmpty()) {
            log.warn("No notifier registered, message not delivered level={}", level);
        }
        for (Notifier notifier : targets) {
            send(notifier, level, message);
        }
        return DispatchOutcome.SENT;
    }

    private void send(Notifier notifier, NotificationLevel level, String message) {
        CompletableFuture
                .runAsync(() -> {
                    try {
                        notifier.send(message);
                    } catch (Exception e) {
                        throw new CompletionException(e);
                    }
                }, sendExecutor)
                .orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, ex) -> {
                    if (ex == null) {
                        log.info("Notification sent channel={} level={}", notifier.name(), level);
                        return;
                    }
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        log.error("Notification timed out channel={} level={} timeoutMs={}",
                                notifier.name(), level, sendTimeout.toMillis());
                    } else {
                        log.error("Notification failed channel={} level={} msg={}",
                                notifier.name(), level, cause.getMessage(), cause);
                    }
                });
    }
}
