package com.nayem.warden.maintenance;

/**
 * One independent piece of maintenance work run inside a cycle.
 * <p>
 * Each unit gets its own timeout and failure isolation: an exception or a
 * timeout here does not stop the other units of the cycle. Implementations
 * should acquire their own short-lived connection and respond to interruption.
 * </p>
 */
public interface MaintenanceUnit {

    /**
     * Name used in logs and cycle reports.
     */
    String name();

    /**
     * Performs the work.
     *
     * @return number of records affected
     */
    int run() throws Exception;
}
