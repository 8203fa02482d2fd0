package com.nayem.warden.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background loop that runs maintenance units at a fixed interval, at most once
 * per cycle across cooperating instances.
 * <p>
 * Each cycle tries the coordination token without waiting. If another instance
 * holds it the cycle is skipped; if the token store itself fails the cycle
 * proceeds uncoordinated, preferring redundant work over none. Units run one
 * after another, each on the unit executor under its own timeout, and a unit
 * that fails or hangs is recorded and left for the next cycle. The token is
 * released once every unit has finished or been abandoned.
 * </p>
 * <p>
 * {@link #start()} and {@link #stop()} are idempotent. {@code stop()} interrupts
 * the sleep or the unit in flight and waits for the loop to exit.
 * </p>
 */
public class CoordinatedPeriodicTask implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatedPeriodicTask.class);
    private static final AtomicInteger UNIT_THREAD_SEQ = new AtomicInteger();

    private final String name;
    private final Duration interval;
    private final Duration unitTimeout;
    private final Duration shutdownTimeout;
    private final String coordinationToken;
    private final CoordinationLock coordinationLock;
    private final List<MaintenanceUnit> units;
    private final MaintenanceMetrics metrics;
    private final Clock clock;
    private final ExecutorService unitExecutor;

    private final ReentrantLock lifecycle = new ReentrantLock();
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicLong completedCycles = new AtomicLong();

    private volatile TaskState state = TaskState.STOPPED;
    private volatile boolean running;
    private volatile CycleReport lastCycle;
    private Thread loopThread;
    private CompletableFuture<Void> loopExit;

    private CoordinatedPeriodicTask(Builder builder) {
        this.name = builder.name;
        this.interval = builder.interval;
        this.unitTimeout = builder.unitTimeout;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.coordinationToken = builder.coordinationToken;
        this.coordinationLock = builder.coordinationLock;
        this.units = List.copyOf(builder.units);
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.unitExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "warden-" + name + "-unit-" + UNIT_THREAD_SEQ.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the loop unless it is already running.
     *
     * @return true if this call started the loop
     */
    public boolean start() {
        lifecycle.lock();
        try {
            if (running) {
                log.debug("Maintenance task {} already running", name);
                return false;
            }
            state = TaskState.STARTING;
            running = true;
            CompletableFuture<Void> exit = new CompletableFuture<>();
            loopExit = exit;
            loopThread = new Thread(() -> loop(exit), "warden-" + name);
            loopThread.setDaemon(true);
            loopThread.start();
            log.info("Started maintenance task {} with interval {} and {} units", name, interval, units.size());
            return true;
        } finally {
            lifecycle.unlock();
        }
    }

    /**
     * Cancels the pending sleep or running unit and waits for the loop to
     * acknowledge, up to the shutdown timeout.
     */
    public StopResult stop() {
        lifecycle.lock();
        try {
            if (loopThread == null) {
                return StopResult.ALREADY_STOPPED;
            }
            running = false;
            state = TaskState.STOPPING;
            loopThread.interrupt();

            StopResult result;
            try {
                loopExit.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
                result = StopResult.STOPPED;
            } catch (TimeoutException e) {
                log.warn("Maintenance task {} did not stop within {}", name, shutdownTimeout);
                result = StopResult.TIMED_OUT;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = StopResult.TIMED_OUT;
            } catch (ExecutionException e) {
                // loopExit is only ever completed normally
                throw new IllegalStateException(e.getCause());
            }

            loopThread = null;
            state = TaskState.STOPPED;
            log.info("Stopped maintenance task {} ({})", name, result);
            return result;
        } finally {
            lifecycle.unlock();
        }
    }

    /**
     * Runs one cycle immediately on the calling thread. Waits for any cycle
     * already in progress.
     */
    public CycleReport runNow() throws InterruptedException {
        log.info("Maintenance task {} triggered on demand", name);
        return runCycle();
    }

    public TaskStatus status() {
        return new TaskStatus(name, state, running, interval, completedCycles.get(), lastCycle);
    }

    public boolean isRunning() {
        return running;
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        stop();
        unitExecutor.shutdownNow();
    }

    private void loop(CompletableFuture<Void> exit) {
        try {
            while (running) {
                state = TaskState.SLEEPING;
                TimeUnit.MILLISECONDS.sleep(interval.toMillis());
                if (!running) {
                    break;
                }
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    log.error("Unexpected error in maintenance task {}", name, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Maintenance task {} loop cancelled", name);
        } finally {
            exit.complete(null);
        }
    }

    CycleReport runCycle() throws InterruptedException {
        cycleLock.lockInterruptibly();
        try {
            state = TaskState.EXECUTING;
            Instant startedAt = clock.instant();

            Optional<CoordinationLease> lease;
            CycleReport.Coordination coordination;
            try {
                lease = coordinationLock.tryAcquire(coordinationToken);
                coordination = lease.isPresent() ? CycleReport.Coordination.ACQUIRED
                        : CycleReport.Coordination.SKIPPED;
            } catch (RuntimeException e) {
                log.warn("Could not reach coordination store for {}, running uncoordinated: {}",
                        name, e.getMessage());
                lease = Optional.empty();
                coordination = CycleReport.Coordination.DEGRADED;
            }

            if (coordination == CycleReport.Coordination.SKIPPED) {
                log.debug("Skipping maintenance cycle for {}, token held by another instance", name);
                return complete(new CycleReport(startedAt, clock.instant(), coordination, List.of()));
            }

            List<UnitOutcome> outcomes = new ArrayList<>(units.size());
            try {
                for (MaintenanceUnit unit : units) {
                    UnitOutcome outcome = runUnit(unit);
                    outcomes.add(outcome);
                    if (outcome.status() == UnitOutcome.Status.CANCELLED) {
                        break;
                    }
                }
            } finally {
                lease.ifPresent(this::release);
            }

            CycleReport report = complete(new CycleReport(startedAt, clock.instant(), coordination, outcomes));
            log.info("Maintenance cycle for {} finished: {} succeeded, {} failed, {} records affected",
                    name, report.succeeded(), report.failed(), report.affected());
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Maintenance cycle for " + name + " cancelled");
            }
            return report;
        } finally {
            // stop() may have moved the state to STOPPING meanwhile
            if (state == TaskState.EXECUTING) {
                state = running ? TaskState.SLEEPING : TaskState.STOPPED;
            }
            cycleLock.unlock();
        }
    }

    private UnitOutcome runUnit(MaintenanceUnit unit) {
        long start = System.nanoTime();
        Callable<Integer> work = unit::run;
        Future<Integer> future = unitExecutor.submit(work);
        try {
            int affected = future.get(unitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return UnitOutcome.succeeded(unit.name(), affected, elapsedSince(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordUnitTimeout();
            log.warn("Maintenance unit {} timed out after {}", unit.name(), unitTimeout);
            return UnitOutcome.timedOut(unit.name(), elapsedSince(start));
        } catch (ExecutionException e) {
            metrics.recordUnitFailure();
            log.warn("Maintenance unit {} failed", unit.name(), e.getCause());
            return UnitOutcome.failed(unit.name(), e.getCause(), elapsedSince(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.debug("Maintenance unit {} cancelled", unit.name());
            return UnitOutcome.cancelled(unit.name(), elapsedSince(start));
        }
    }

    private void release(CoordinationLease lease) {
        try {
            lease.close();
        } catch (RuntimeException e) {
            log.warn("Failed to release coordination token {}: {}", lease.token(), e.getMessage());
        }
    }

    private CycleReport complete(CycleReport report) {
        lastCycle = report;
        completedCycles.incrementAndGet();
        metrics.recordCycle(report);
        return report;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for {@link CoordinatedPeriodicTask}.
     * <p>
     * Only the interval is required; the other settings default to a 30 second
     * unit timeout, a 10 second shutdown timeout and no cross-instance
     * coordination.
     * </p>
     */
    public static class Builder {
        private final String name;
        private Duration interval;
        private Duration unitTimeout = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private String coordinationToken = "warden-maintenance";
        private CoordinationLock coordinationLock = new NoOpCoordinationLock();
        private final List<MaintenanceUnit> units = new ArrayList<>();
        private MaintenanceMetrics metrics = MaintenanceMetrics.noOp();
        private Clock clock = Clock.systemUTC();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Sets the interval in whole seconds.
         *
         * @throws IllegalArgumentException if not positive
         */
        public Builder intervalSeconds(long seconds) {
            if (seconds <= 0) {
                throw new IllegalArgumentException("interval must be positive, got " + seconds + "s");
            }
            return interval(Duration.ofSeconds(seconds));
        }

        public Builder interval(Duration interval) {
            if (interval == null || interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be positive, got " + interval);
            }
            this.interval = interval;
            return this;
        }

        public Builder unitTimeout(Duration unitTimeout) {
            this.unitTimeout = unitTimeout;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder coordination(CoordinationLock coordinationLock, String token) {
            this.coordinationLock = coordinationLock;
            this.coordinationToken = token;
            return this;
        }

        public Builder unit(MaintenanceUnit unit) {
            this.units.add(unit);
            return this;
        }

        public Builder units(List<? extends MaintenanceUnit> units) {
            this.units.addAll(units);
            return this;
        }

        public Builder metrics(MaintenanceMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CoordinatedPeriodicTask build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Task name is required");
            }
            if (interval == null) {
                throw new IllegalArgumentException("interval is required");
            }
            if (unitTimeout == null || unitTimeout.isZero() || unitTimeout.isNegative()) {
                throw new IllegalArgumentException("unitTimeout must be positive, got " + unitTimeout);
            }
            return new CoordinatedPeriodicTask(this);
        }
    }
}
