package io.heartbeat4j;

import io.heartbeat4j.core.LoadResult;
import io.heartbeat4j.core.ScheduledJob;

import java.util.List;

/**
 * Main scheduling API: durable, named recurring jobs bound to task-type callbacks.
 *
 * <p>Typical usage:
 * <pre>{@code
 * registry.registerTaskType("morning_briefing", brain::briefing);
 * registry.start();
 * registry.loadJobs();
 * registry.ensureSystemJob("daily_briefing", "30 6 * * *", "morning_briefing", "06:30 briefing");
 * registry.runJobNow("daily_briefing");
 * registry.stop();
 * }</pre>
 */
public interface JobRegistry {
    void start();

    void stop();

    /**
     * Bind (or re-bind) a task type to a callback. Already scheduled jobs pick up the new callback
     * the next time they fire.
     */
    void registerTaskType(String taskType, TaskCallback callback);

    /**
     * Persist a job and register it with the cron engine, replacing any job with the same name.
     *
     * @throws io.heartbeat4j.exception.UnknownTaskTypeException if the task type has no callback
     * @throws io.heartbeat4j.exception.InvalidCronSpecException if the cron spec is not valid
     */
    void addJob(String name, String cronSpec, String taskType, String description);

    /**
     * @throws io.heartbeat4j.exception.JobNotFoundException if no job has this name
     */
    void removeJob(String name);

    /**
     * Restore persisted jobs. Call after every task type has been registered.
     */
    LoadResult loadJobs();

    /**
     * Add a job unless some persisted job already has the same task type (under any name).
     *
     * @return true if the job was added
     */
    boolean ensureSystemJob(String name, String cronSpec, String taskType, String description);

    /**
     * Run a job's callback once, asynchronously, outside its schedule.
     */
    void runJobNow(String name);

    List<ScheduledJob> listJobs();
}
