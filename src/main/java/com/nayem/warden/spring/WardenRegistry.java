package com.nayem.warden.spring;

import com.nayem.warden.maintenance.CoordinatedPeriodicTask;
import com.nayem.warden.maintenance.CycleReport;
import com.nayem.warden.maintenance.PeriodicTaskRegistry;
import com.nayem.warden.maintenance.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import java.util.List;
import java.util.Optional;

/**
 * Application-scoped handle on the background tasks started by
 * {@link WardenAutoConfiguration}. Exposes the operator surface (status and
 * run-now) and stops every loop when the context closes.
 */
public class WardenRegistry implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(WardenRegistry.class);

    public static final String MAINTENANCE_TASK = "maintenance";

    private final PeriodicTaskRegistry tasks;

    public WardenRegistry(PeriodicTaskRegistry tasks) {
        this.tasks = tasks;
    }

    public Optional<CoordinatedPeriodicTask> getMaintenanceTask() {
        return tasks.find(MAINTENANCE_TASK);
    }

    /**
     * Runs one maintenance cycle on the calling thread.
     *
     * @throws IllegalStateException if maintenance is not enabled
     */
    public CycleReport runMaintenanceNow() throws InterruptedException {
        CoordinatedPeriodicTask task = getMaintenanceTask()
                .orElseThrow(() -> new IllegalStateException("Maintenance is not enabled"));
        return task.runNow();
    }

    public List<TaskStatus> getStatuses() {
        return tasks.statuses();
    }

    public PeriodicTaskRegistry getTasks() {
        return tasks;
    }

    @Override
    public void destroy() {
        List<TaskStatus> statuses = tasks.statuses();
        log.info("WardenRegistry shutting down, stopping {} periodic tasks...", statuses.size());
        tasks.close();
    }
}
