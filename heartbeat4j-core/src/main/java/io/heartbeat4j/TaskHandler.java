package io.heartbeat4j;

/**
 * A task callback that names its own task type, so containers can register it automatically.
 */
public interface TaskHandler extends TaskCallback {
    String taskType();
}
