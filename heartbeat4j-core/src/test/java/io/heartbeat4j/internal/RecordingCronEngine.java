package io.heartbeat4j.internal;

import io.heartbeat4j.core.CronEngine;
import io.heartbeat4j.core.CronHandle;
import io.heartbeat4j.utils.CronSpecs;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Test double that records entries instead of timing them. Entries fire only through {@link #fireAll()}.
 */
class RecordingCronEngine implements CronEngine {

    private final Map<Long, Runnable> entries = new LinkedHashMap<>();
    private final Map<Long, String> specs = new LinkedHashMap<>();
    private long nextId = 1;
    private boolean failNextSchedule = false;
    boolean started = false;

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void stop() {
        started = false;
    }

    @Override
    public void validate(String cronSpec) {
        CronSpecs.parse(cronSpec, ZoneOffset.UTC);
    }

    @Override
    public synchronized CronHandle schedule(String cronSpec, Runnable task) {
        validate(cronSpec);
        if (failNextSchedule) {
            failNextSchedule = false;
            throw new IllegalStateException("engine unavailable");
        }
        long id = nextId++;
        entries.put(id, task);
        specs.put(id, cronSpec);
        return new CronHandle(id, cronSpec);
    }

    @Override
    public synchronized void cancel(CronHandle handle) {
        entries.remove(handle.id());
        specs.remove(handle.id());
    }

    @Override
    public Optional<Instant> nextFireTime(CronHandle handle) {
        return Optional.empty();
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized boolean isActive(CronHandle handle) {
        return entries.containsKey(handle.id());
    }

    synchronized void failNextSchedule() {
        failNextSchedule = true;
    }

    void fireAll() {
        Runnable[] tasks;
        synchronized (this) {
            tasks = entries.values().toArray(new Runnable[0]);
        }
        for (Runnable task : tasks) {
            task.run();
        }
    }
}
