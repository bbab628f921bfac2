package io.hookcron.core;

/**
 * Timing of a job: either {@link OneOffSchedule} or {@link RecurringSchedule}.
 */
public interface Schedule {

    /**
     * IANA time zone id, or null for the system default.
     */
    String timezone();

    JobKind kind();
}
