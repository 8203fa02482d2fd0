package com.nayem.warden.maintenance;

/**
 * Lifecycle of a {@link CoordinatedPeriodicTask}:
 * {@code STOPPED -> STARTING -> SLEEPING <-> EXECUTING -> STOPPING -> STOPPED}.
 */
public enum TaskState {
    STOPPED,
    STARTING,
    SLEEPING,
    EXECUTING,
    STOPPING
}
