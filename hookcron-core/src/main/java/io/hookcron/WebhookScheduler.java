package io.hookcron;

import io.hookcron.core.Job;
import io.hookcron.core.JobRequest;

import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Supports two scheduling styles:
 * <ul>
 *   <li>One-off jobs (single HTTP call at a specific {@link java.time.Instant})</li>
 *   <li>Recurring jobs (cron expression, optional time zone and start time)</li>
 * </ul>
 */
public interface WebhookScheduler {

    /**
     * Load persisted jobs and arm them. Idempotent.
     */
    void start();

    /**
     * Disarm everything and stop the engine threads. Idempotent.
     */
    void stop();

    /**
     * Start a fluent definition of a job calling {@code url} with {@code method}.
     */
    JobBuilder job(String url, String method);

    /**
     * Persist a new job, then arm it.
     *
     * @return the stored job including its generated id
     */
    Job create(JobRequest request);

    /**
     * All jobs, newest first.
     */
    List<Job> list();

    Optional<Job> get(String id);

    /**
     * Disarm then delete.
     *
     * @return true if a job with this id existed
     */
    boolean remove(String id);

    /**
     * Disarm every job, then clear the store.
     */
    void removeAll();
}
