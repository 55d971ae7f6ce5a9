package io.heartbeat4j.exception;

/**
 * Thrown when a job refers to a task type that has no registered callback.
 */
public class UnknownTaskTypeException extends IllegalArgumentException {

    private final String taskType;

    public UnknownTaskTypeException(String taskType) {
        super("No task callback registered for taskType: " + taskType);
        this.taskType = taskType;
    }

    public String getTaskType() {
        return taskType;
    }
}
