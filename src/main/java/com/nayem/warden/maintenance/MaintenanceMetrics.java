package com.nayem.warden.maintenance;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer meters for the maintenance loop.
 */
public class MaintenanceMetrics {

    private final MeterRegistry registry;
    private final Counter unitFailureCounter;
    private final Counter unitTimeoutCounter;
    private final Timer cycleTimer;

    public MaintenanceMetrics(MeterRegistry registry) {
        this.registry = registry;

        if (registry != null) {
            this.unitFailureCounter = Counter.builder("warden.maintenance.unit.failures")
                    .description("Maintenance units that threw")
                    .register(registry);

            this.unitTimeoutCounter = Counter.builder("warden.maintenance.unit.timeouts")
                    .description("Maintenance units cancelled after their timeout")
                    .register(registry);

            this.cycleTimer = Timer.builder("warden.maintenance.cycle.duration")
                    .description("Wall time of maintenance cycles that ran units")
                    .register(registry);
        } else {
            this.unitFailureCounter = null;
            this.unitTimeoutCounter = null;
            this.cycleTimer = null;
        }
    }

    public void recordCycle(CycleReport report) {
        if (registry == null) {
            return;
        }
        registry.counter("warden.maintenance.cycles",
                "outcome", report.coordination().name().toLowerCase()).increment();
        if (!report.skipped()) {
            cycleTimer.record(report.duration());
        }
    }

    public void recordUnitFailure() {
        if (unitFailureCounter != null) {
            unitFailureCounter.increment();
        }
    }

    public void recordUnitTimeout() {
        if (unitTimeoutCounter != null) {
            unitTimeoutCounter.increment();
        }
    }

    public static MaintenanceMetrics noOp() {
        return new MaintenanceMetrics(null);
    }
}
