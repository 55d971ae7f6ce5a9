package io.heartbeat4j.exception;

import java.util.NoSuchElementException;

public class JobNotFoundException extends NoSuchElementException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("No scheduled job named: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
