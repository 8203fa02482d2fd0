package com.nayem.warden.maintenance;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one maintenance cycle.
 *
 * @param startedAt    when the cycle began
 * @param finishedAt   when the cycle ended
 * @param coordination how the coordination token attempt went
 * @param units        per-unit outcomes, in execution order; empty when skipped
 */
public record CycleReport(Instant startedAt, Instant finishedAt, Coordination coordination, List<UnitOutcome> units) {

    public enum Coordination {
        /** Token taken; units ran under it. */
        ACQUIRED,
        /** Another instance holds the token; no units ran. */
        SKIPPED,
        /** Token store failed; units ran without coordination. */
        DEGRADED
    }

    public CycleReport {
        units = List.copyOf(units);
    }

    public boolean skipped() {
        return coordination == Coordination.SKIPPED;
    }

    public long succeeded() {
        return units.stream().filter(UnitOutcome::isSuccess).count();
    }

    public long failed() {
        return units.size() - succeeded();
    }

    public int affected() {
        return units.stream().mapToInt(UnitOutcome::affected).sum();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
