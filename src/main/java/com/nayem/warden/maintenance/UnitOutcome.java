package com.nayem.warden.maintenance;

import java.time.Duration;

/**
 * Result of one maintenance unit within a cycle.
 *
 * @param unit     unit name
 * @param status   how the unit ended
 * @param affected records affected, 0 unless {@code SUCCEEDED}
 * @param error    failure message, or {@code null}
 * @param duration wall time spent waiting for the unit
 */
public record UnitOutcome(String unit, Status status, int affected, String error, Duration duration) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        CANCELLED
    }

    static UnitOutcome succeeded(String unit, int affected, Duration duration) {
        return new UnitOutcome(unit, Status.SUCCEEDED, affected, null, duration);
    }

    static UnitOutcome failed(String unit, Throwable error, Duration duration) {
        return new UnitOutcome(unit, Status.FAILED, 0, String.valueOf(error), duration);
    }

    static UnitOutcome timedOut(String unit, Duration duration) {
        return new UnitOutcome(unit, Status.TIMED_OUT, 0, "timed out", duration);
    }

    static UnitOutcome cancelled(String unit, Duration duration) {
        return new UnitOutcome(unit, Status.CANCELLED, 0, "cancelled", duration);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
