package io.heartbeat4j.config;

import io.heartbeat4j.JobRegistry;
import io.heartbeat4j.heartbeat.HeartbeatController;
import io.heartbeat4j.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler start/stop lifecycle with the Spring container lifecycle.
 *
 * <p>Start: worker pool, cron engine, built-in task types, persisted jobs, then the system jobs
 * (only when missing). Stop: cron engine first so nothing new fires, then the worker pool drains.
 */
public class HeartbeatLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatLifecycle.class);

    public static final String HEARTBEAT_TASK_TYPE = "heartbeat";
    public static final String HEARTBEAT_JOB_NAME = "heartbeat";
    public static final String BRIEFING_TASK_TYPE = "morning_briefing";
    public static final String BRIEFING_JOB_NAME = "daily_morning_briefing";

    private final JobRegistry jobRegistry;
    private final WorkerPool workerPool;
    private final HeartbeatController controller;
    private final HeartbeatProperties props;
    private volatile boolean running = false;

    public HeartbeatLifecycle(JobRegistry jobRegistry,
                              WorkerPool workerPool,
                              HeartbeatController controller,
                              HeartbeatProperties props) {
        this.jobRegistry = jobRegistry;
        this.workerPool = workerPool;
        this.controller = controller;
        this.props = props;
    }

    @Override
    public void start() {
        workerPool.start(props.getWorker().getWorkers());
        jobRegistry.start();

        if (controller != null) {
            jobRegistry.registerTaskType(HEARTBEAT_TASK_TYPE, controller::pulse);
            jobRegistry.registerTaskType(BRIEFING_TASK_TYPE, controller::generateMorningBriefing);
        }

        jobRegistry.loadJobs();

        if (controller != null) {
            if (props.getHeartbeat().isEnabled()) {
                jobRegistry.ensureSystemJob(HEARTBEAT_JOB_NAME, props.getHeartbeat().getCron(),
                        HEARTBEAT_TASK_TYPE, "Autonomous heartbeat cycle");
            }
            if (props.getBriefing().isEnabled()) {
                jobRegistry.ensureSystemJob(BRIEFING_JOB_NAME, props.getBriefing().getCron(),
                        BRIEFING_TASK_TYPE, "Daily morning briefing");
            }
        } else {
            log.info("No Brain bean found, heartbeat and briefing jobs are not scheduled");
        }
        running = true;
    }

    @Override
    public void stop() {
        jobRegistry.stop();
        workerPool.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
