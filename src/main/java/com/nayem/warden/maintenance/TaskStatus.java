package com.nayem.warden.maintenance;

import java.time.Duration;

/**
 * Point-in-time view of a {@link CoordinatedPeriodicTask}, for admin queries.
 *
 * @param lastCycle most recent cycle report, or {@code null} if none ran yet
 */
public record TaskStatus(String name, TaskState state, boolean running, Duration interval,
        long completedCycles, CycleReport lastCycle) {
}
