package io.heartbeat4j.exception;

import java.util.concurrent.RejectedExecutionException;

/**
 * Backpressure signal: the worker queue is at capacity and the job was not accepted.
 */
public class WorkerPoolFullException extends RejectedExecutionException {

    private final String jobName;
    private final int capacity;

    public WorkerPoolFullException(String jobName, int capacity) {
        super("Worker queue is full (capacity=" + capacity + "), rejected job: " + jobName);
        this.jobName = jobName;
        this.capacity = capacity;
    }

    public String getJobName() {
        return jobName;
    }

    public int getCapacity() {
        return capacity;
    }
}
