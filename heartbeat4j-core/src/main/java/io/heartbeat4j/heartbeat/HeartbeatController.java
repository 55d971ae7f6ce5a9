package io.heartbeat4j.heartbeat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the autonomous sense/think/act cycle with at most one cycle in flight.
 *
 * <p>Cycle:
 * <ol>
 *   <li>Claim the idle-to-thinking flag with compare-and-set; a busy controller drops the trigger.</li>
 *   <li>Sense: {@link Brain#collectEnv}. An empty snapshot ends the cycle.</li>
 *   <li>Think: {@link Brain#think}. Failures end the cycle; the next trigger is the retry.</li>
 *   <li>Act: {@link Brain#runPatrol} for a no-op decision, {@link Brain#executeDecision} otherwise.</li>
 * </ol>
 *
 * <p>One deadline ({@code cycleTimeout}) bounds all phases together. Each Brain call runs on the
 * brain executor and is awaited for the remaining budget, then interrupted. The flag is released and
 * the completion callback fires on every exit path, except that a Brain call which ignores the interrupt
 * keeps the flag held until it returns; triggers arriving meanwhile are dropped as busy.
 */
public class HeartbeatController implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatController.class);

    public static final Duration DEFAULT_CYCLE_TIMEOUT = Duration.ofMinutes(2);

    private final Brain brain;
    private final ExecutorService brainExecutor;
    private final boolean ownsExecutor;
    private final Duration cycleTimeout;
    private final Clock clock;

    private final AtomicBoolean thinking = new AtomicBoolean(false);
    private final AtomicLong cycleIds = new AtomicLong();

    private volatile Runnable onCycleComplete;

    // Set by the pulse thread when a timed-out Brain call is still running; that call releases the flag.
    private boolean releaseDeferred;

    public HeartbeatController(Brain brain, Duration cycleTimeout) {
        this(brain, newBrainExecutor(), true, cycleTimeout, Clock.systemDefaultZone());
    }

    public HeartbeatController(Brain brain, ExecutorService brainExecutor, Duration cycleTimeout, Clock clock) {
        this(brain, brainExecutor, false, cycleTimeout, clock);
    }

    private HeartbeatController(Brain brain,
                                ExecutorService brainExecutor,
                                boolean ownsExecutor,
                                Duration cycleTimeout,
                                Clock clock) {
        this.brain = Objects.requireNonNull(brain, "brain must not be null");
        this.brainExecutor = Objects.requireNonNull(brainExecutor, "brainExecutor must not be null");
        this.ownsExecutor = ownsExecutor;
        this.cycleTimeout = Objects.requireNonNull(cycleTimeout, "cycleTimeout must not be null");
        if (cycleTimeout.isZero() || cycleTimeout.isNegative()) {
            throw new IllegalArgumentException("cycleTimeout must be a positive duration");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    private static ExecutorService newBrainExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("heartbeat4j.brain-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Hook fired once at the end of every cycle that ran, whatever its outcome. Null clears it.
     */
    public void setOnCycleComplete(Runnable onCycleComplete) {
        this.onCycleComplete = onCycleComplete;
    }

    public boolean isThinking() {
        return thinking.get();
    }

    /**
     * Run one cycle on the calling thread, or return {@link CycleOutcome#SKIPPED_BUSY} immediately
     * if a cycle is already running.
     */
    public CycleOutcome pulse() {
        if (!thinking.compareAndSet(false, true)) {
            log.info("Heartbeat skipped, previous cycle still running");
            return CycleOutcome.SKIPPED_BUSY;
        }

        CycleContext ctx = new CycleContext(cycleIds.incrementAndGet(), clock, cycleTimeout);
        CycleOutcome outcome = null;
        releaseDeferred = false;
        try {
            log.debug("Heartbeat cycle started cycleId={} deadline={}", ctx.cycleId(), ctx.deadline());
            outcome = runCycle(ctx);
            return outcome;
        } finally {
            if (!releaseDeferred) {
                thinking.set(false);
            }
            log.info("Heartbeat cycle finished cycleId={} outcome={} elapsedMs={}",
                    ctx.cycleId(), outcome, Duration.between(ctx.startedAt(), clock.instant()).toMillis());
            fireCompletion(ctx);
        }
    }

    private CycleOutcome runCycle(CycleContext ctx) {
        // Sense
        String snapshot;
        try {
            snapshot = cycleCall(ctx, () -> brain.collectEnv(ctx));
        } catch (TimeoutException e) {
            log.warn("Heartbeat sense timed out cycleId={}", ctx.cycleId());
            return CycleOutcome.TIMED_OUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CycleOutcome.INTERRUPTED;
        } catch (Exception e) {
            log.error("Heartbeat sense failed cycleId={} msg={}", ctx.cycleId(), e.getMessage(), e);
            return CycleOutcome.SENSE_FAILED;
        }
        if (snapshot == null || snapshot.isBlank()) {
            log.debug("Heartbeat snapshot empty cycleId={}", ctx.cycleId());
            return CycleOutcome.EMPTY_SNAPSHOT;
        }

        // Think
        Decision decision;
        try {
            decision = cycleCall(ctx, () -> brain.think(ctx, snapshot));
        } catch (TimeoutException e) {
            log.warn("Heartbeat think timed out cycleId={}", ctx.cycleId());
            return CycleOutcome.TIMED_OUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CycleOutcome.INTERRUPTED;
        } catch (Exception e) {
            log.error("Heartbeat think failed cycleId={} msg={}", ctx.cycleId(), e.getMessage(), e);
            return CycleOutcome.THINK_FAILED;
        }
        if (decision == null) {
            decision = Decision.noOp();
        }
        log.info("Heartbeat decision cycleId={} kind={} reason={}", ctx.cycleId(), decision.kind(), decision.reason());

        // Act
        boolean patrol = decision.isNoOp();
        Decision chosen = decision;
        try {
            if (patrol) {
                cycleCall(ctx, () -> {
                    brain.runPatrol(ctx);
                    return null;
                });
                return CycleOutcome.PATROLLED;
            }
            cycleCall(ctx, () -> {
                brain.executeDecision(ctx, chosen);
                return null;
            });
            return CycleOutcome.EXECUTED;
        } catch (TimeoutException e) {
            log.warn("Heartbeat {} timed out cycleId={}", patrol ? "patrol" : "act", ctx.cycleId());
            return CycleOutcome.TIMED_OUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CycleOutcome.INTERRUPTED;
        } catch (Exception e) {
            if (patrol) {
                log.warn("Heartbeat patrol failed cycleId={} msg={}", ctx.cycleId(), e.getMessage(), e);
                return CycleOutcome.PATROL_FAILED;
            }
            log.error("Heartbeat act failed cycleId={} kind={} msg={}", ctx.cycleId(), chosen.kind(), e.getMessage(), e);
            return CycleOutcome.ACT_FAILED;
        }
    }

    /**
     * Ask the brain for the morning briefing under the same deadline rules as a cycle.
     * Does not take the single-flight flag.
     *
     * @return true if the briefing completed without error
     */
    public boolean generateMorningBriefing() {
        CycleContext ctx = new CycleContext(cycleIds.incrementAndGet(), clock, cycleTimeout);
        try {
            call(ctx, () -> {
                brain.generateMorningBriefing(ctx);
                return null;
            }, () -> log.warn("Morning briefing finished after its deadline cycleId={}", ctx.cycleId()));
            log.info("Morning briefing generated cycleId={}", ctx.cycleId());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Morning briefing interrupted cycleId={}", ctx.cycleId());
            return false;
        } catch (Exception e) {
            log.error("Morning briefing failed cycleId={} msg={}", ctx.cycleId(), e.getMessage(), e);
            return false;
        }
    }

    private <T> T cycleCall(CycleContext ctx, Callable<T> body) throws Exception {
        return call(ctx, body, () -> {
            thinking.set(false);
            log.warn("Heartbeat released after late Brain call cycleId={}", ctx.cycleId());
        });
    }

    private <T> T call(CycleContext ctx, Callable<T> body, Runnable onLateFinish) throws Exception {
        Duration remaining = ctx.remaining();
        if (remaining.isZero()) {
            throw new TimeoutException("cycle deadline passed");
        }

        BrainCall<T> brainCall = new BrainCall<>(body, onLateFinish);
        Future<T> future = brainExecutor.submit(brainCall);
        try {
            return future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            if (brainCall.abandon()) {
                log.warn("Brain call still running after cancel cycleId={}", ctx.cycleId());
                if (onLateFinish != null) {
                    releaseDeferred = true;
                }
            }
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    /**
     * Brain call wrapper that knows whether it is still running once the caller gives up on it.
     * A call abandoned while running runs {@code onLateFinish} when it finally returns.
     */
    private static final class BrainCall<T> implements Callable<T> {
        private static final int PENDING = 0;
        private static final int RUNNING = 1;
        private static final int DONE = 2;
        private static final int ABANDONED = 3;
        private static final int ABANDONED_RUNNING = 4;

        private final Callable<T> body;
        private final Runnable onLateFinish;
        private final AtomicInteger state = new AtomicInteger(PENDING);

        private BrainCall(Callable<T> body, Runnable onLateFinish) {
            this.body = body;
            this.onLateFinish = onLateFinish;
        }

        @Override
        public T call() throws Exception {
            if (!state.compareAndSet(PENDING, RUNNING)) {
                return null;
            }
            try {
                return body.call();
            } finally {
                if (!state.compareAndSet(RUNNING, DONE) && onLateFinish != null) {
                    onLateFinish.run();
                }
            }
        }

        /**
         * @return true if the body is still running and will run {@code onLateFinish} when it returns
         */
        private boolean abandon() {
            if (state.compareAndSet(PENDING, ABANDONED)) {
                return false;
            }
            return state.compareAndSet(RUNNING, ABANDONED_RUNNING);
        }
    }

    private void fireCompletion(CycleContext ctx) {
        Runnable hook = onCycleComplete;
        if (hook == null) {
            return;
        }
        try {
            hook.run();
        } catch (Exception e) {
            log.warn("Heartbeat completion callback failed cycleId={} msg={}", ctx.cycleId(), e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        brainExecutor.shutdownNow();
    }
}
