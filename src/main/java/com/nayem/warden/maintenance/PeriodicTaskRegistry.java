package com.nayem.warden.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the periodic tasks of one process.
 * <p>
 * Created once by the composition root and passed to whoever needs a task.
 * {@link #getOrCreate} checks, creates and registers under one guard, so
 * concurrent callers asking for the same name get the same instance and only
 * one loop is ever started for it.
 * </p>
 */
public class PeriodicTaskRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTaskRegistry.class);

    private final ReentrantLock guard = new ReentrantLock();
    private final Map<String, CoordinatedPeriodicTask> tasks = new LinkedHashMap<>();

    /**
     * Returns the task registered under {@code name}, creating it with
     * {@code factory} if absent.
     */
    public CoordinatedPeriodicTask getOrCreate(String name, Supplier<CoordinatedPeriodicTask> factory) {
        guard.lock();
        try {
            CoordinatedPeriodicTask task = tasks.get(name);
            if (task == null) {
                task = factory.get();
                tasks.put(name, task);
            }
            return task;
        } finally {
            guard.unlock();
        }
    }

    /**
     * Creates the task if needed and starts it.
     *
     * @return the single task registered under {@code name}
     */
    public CoordinatedPeriodicTask startTask(String name, Supplier<CoordinatedPeriodicTask> factory) {
        CoordinatedPeriodicTask task = getOrCreate(name, factory);
        task.start();
        return task;
    }

    public Optional<CoordinatedPeriodicTask> find(String name) {
        guard.lock();
        try {
            return Optional.ofNullable(tasks.get(name));
        } finally {
            guard.unlock();
        }
    }

    public List<TaskStatus> statuses() {
        return snapshot().stream().map(CoordinatedPeriodicTask::status).toList();
    }

    /**
     * Stops every task and releases its threads.
     */
    @Override
    public void close() {
        for (CoordinatedPeriodicTask task : snapshot()) {
            try {
                task.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close maintenance task {}: {}", task.getName(), e.getMessage());
            }
        }
    }

    private List<CoordinatedPeriodicTask> snapshot() {
        guard.lock();
        try {
            return new ArrayList<>(tasks.values());
        } finally {
            guard.unlock();
        }
    }
}
