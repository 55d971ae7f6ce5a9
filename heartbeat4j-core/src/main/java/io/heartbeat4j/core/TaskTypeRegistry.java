package io.heartbeat4j.core;

import io.heartbeat4j.TaskCallback;
import io.heartbeat4j.TaskHandler;
import io.heartbeat4j.exception.UnknownTaskTypeException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public class TaskTypeRegistry {

    private final Map<String, TaskCallback> callbacksByType = new ConcurrentHashMap<>();

    public TaskTypeRegistry() {
    }

    public TaskTypeRegistry(List<? extends TaskHandler> handlers) {
        for (TaskHandler handler : handlers) {
            register(handler.taskType(), handler);
        }
    }

    /**
     * Bind a callback to a task type, replacing any previous binding.
     */
    public void register(String taskType, TaskCallback callback) {
        Objects.requireNonNull(taskType, "taskType must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
        if (taskType.isBlank()) {
            throw new IllegalArgumentException("taskType must not be blank");
        }
        callbacksByType.put(taskType, callback);
    }

    public Optional<TaskCallback> find(String taskType) {
        if (taskType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(callbacksByType.get(taskType));
    }

    public TaskCallback getRequired(String taskType) {
        return find(taskType).orElseThrow(() -> new UnknownTaskTypeException(taskType));
    }

    public boolean contains(String taskType) {
        return find(taskType).isPresent();
    }

    public Set<String> taskTypes() {
        return new TreeSet<>(callbacksByType.keySet());
    }
}
