package io.heartbeat4j.config;

import io.heartbeat4j.core.ScheduledJob;
import io.heartbeat4j.core.TaskTypeRegistry;
import io.heartbeat4j.heartbeat.Brain;
import io.heartbeat4j.heartbeat.CycleContext;
import io.heartbeat4j.heartbeat.HeartbeatController;
import io.heartbeat4j.internal.CronJobRegistry;
import io.heartbeat4j.internal.InMemoryJobStore;
import io.heartbeat4j.internal.ScheduledCronEngine;
import io.heartbeat4j.worker.BackgroundJob;
import io.heartbeat4j.worker.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HeartbeatLifecycleTest {

    private final InMemoryJobStore store = new InMemoryJobStore();
    private final HeartbeatProperties props = new HeartbeatProperties();
    private Brain brain;
    private HeartbeatController controller;

    @BeforeEach
    void setUp() throws Exception {
        brain = mock(Brain.class);
        when(brain.collectEnv(any(CycleContext.class))).thenReturn("");
        controller = new HeartbeatController(brain, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        controller.close();
    }

    private CronJobRegistry newRegistry() {
        return new CronJobRegistry(store, new ScheduledCronEngine(ZoneOffset.UTC, 1), new TaskTypeRegistry(), Runnable::run);
    }

    @Test
    void startShouldCreateSystemJobsOnce() {
        CronJobRegistry registry = newRegistry();
        HeartbeatLifecycle lifecycle = new HeartbeatLifecycle(registry, new WorkerPool(4), controller, props);

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(registry.listJobs())
                .extracting(ScheduledJob::name)
                .containsExactly("daily_morning_briefing", "heartbeat");
        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();

        CronJobRegistry restartedRegistry = newRegistry();
        HeartbeatLifecycle restarted = new HeartbeatLifecycle(restartedRegistry, new WorkerPool(4), controller, props);
        restarted.start();

        assertThat(store.findAll()).hasSize(2);
        assertThat(restartedRegistry.listJobs()).hasSize(2);
        restarted.stop();
    }

    @Test
    void renamedBriefingJobShouldSatisfySystemJob() {
        CronJobRegistry setup = newRegistry();
        setup.registerTaskType(HeartbeatLifecycle.BRIEFING_TASK_TYPE, () -> { });
        setup.addJob("daily_briefing", "0 7 * * *", HeartbeatLifecycle.BRIEFING_TASK_TYPE, null);

        CronJobRegistry registry = newRegistry();
        HeartbeatLifecycle lifecycle = new HeartbeatLifecycle(registry, new WorkerPool(4), controller, props);
        lifecycle.start();

        assertThat(registry.listJobs())
                .extracting(ScheduledJob::name)
                .containsExactly("daily_briefing", "heartbeat");
        lifecycle.stop();
    }

    @Test
    void heartbeatTaskShouldPulseController() throws Exception {
        CronJobRegistry registry = newRegistry();
        HeartbeatLifecycle lifecycle = new HeartbeatLifecycle(registry, new WorkerPool(4), controller, props);
        lifecycle.start();

        registry.runJobNow(HeartbeatLifecycle.HEARTBEAT_JOB_NAME);
        registry.runJobNow(HeartbeatLifecycle.BRIEFING_JOB_NAME);
        lifecycle.stop();

        verify(brain, atLeastOnce()).collectEnv(any(CycleContext.class));
        verify(brain, atLeastOnce()).generateMorningBriefing(any(CycleContext.class));
    }

    @Test
    void disabledHeartbeatShouldOnlyScheduleBriefing() {
        props.getHeartbeat().setEnabled(false);
        CronJobRegistry registry = newRegistry();
        HeartbeatLifecycle lifecycle = new HeartbeatLifecycle(registry, new WorkerPool(4), controller, props);

        lifecycle.start();
        lifecycle.stop();

        assertThat(store.findAll())
                .extracting(ScheduledJob::name)
                .containsExactly("daily_morning_briefing");
    }

    @Test
    void withoutControllerNoSystemJobsAreCreated() {
        CronJobRegistry registry = newRegistry();
        HeartbeatLifecycle lifecycle = new HeartbeatLifecycle(registry, new WorkerPool(4), null, props);

        lifecycle.start();
        lifecycle.stop();

        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void stopShouldDrainWorkerPool() {
        WorkerPool pool = new WorkerPool(4);
        HeartbeatLifecycle lifecycle = new HeartbeatLifecycle(newRegistry(), pool, null, props);
        lifecycle.start();
        AtomicInteger ran = new AtomicInteger();
        for (int i = 0; i < 4; i++) {
            pool.submit(BackgroundJob.of("job-" + i, ran::incrementAndGet));
        }

        lifecycle.stop();

        assertThat(ran.get()).isEqualTo(4);
        assertThatThrownBy(() -> pool.submit(BackgroundJob.of("late", () -> { })))
                .isInstanceOf(IllegalStateException.class);
    }
}
