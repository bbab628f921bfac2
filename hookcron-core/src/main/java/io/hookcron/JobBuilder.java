package io.hookcron;

import io.hookcron.core.Job;
import io.hookcron.core.JobRequest;
import io.hookcron.core.RetryPolicy;

import java.time.Instant;
import java.util.Map;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): validates and returns an in-memory job request</li>
 *   <li>save(): build() + create (persist and arm)</li>
 * </ul>
 */
public interface JobBuilder {

    JobBuilder header(String name, String value);

    JobBuilder headers(Map<String, String> headers);

    JobBuilder queryParam(String name, Object value);

    JobBuilder queryParams(Map<String, Object> queryParams);

    /**
     * JSON-serializable request body.
     */
    JobBuilder payload(Object payload);

    /**
     * Set timezone used by the schedule. Null means system default.
     */
    JobBuilder timezone(String timezone);

    /**
     * Run once at the specified absolute time.
     */
    JobBuilder executeAt(Instant time);

    /**
     * Repeat on a cron expression (5-field, or Quartz 6/7-field).
     */
    JobBuilder cron(String cronExpression);

    /**
     * Do not fire a recurring job before this instant.
     */
    JobBuilder startTime(Instant startTime);

    JobBuilder retry(RetryPolicy retryPolicy);

    JobBuilder retry(int maxAttempts, Integer... retryableStatuses);

    JobRequest build();

    Job save();
}
