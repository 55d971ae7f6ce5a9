package io.heartbeat4j;

/**
 * Zero-argument callback bound to a task type.
 */
@FunctionalInterface
public interface TaskCallback {
    void run() throws Exception;
}
