package io.hookcron.core;

/**
 * Lifecycle status of a job.
 *
 * <p>{@link #PAUSED} is reserved: nothing in the engine assigns it or acts on it.
 */
public enum JobStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    PAUSED
}
