package com.nayem.warden.maintenance;

/**
 * What {@link CoordinatedPeriodicTask#stop()} observed.
 */
public enum StopResult {
    /** The loop acknowledged cancellation and exited. */
    STOPPED,
    /** The task was not running. */
    ALREADY_STOPPED,
    /** The loop did not acknowledge within the shutdown timeout. */
    TIMED_OUT
}
