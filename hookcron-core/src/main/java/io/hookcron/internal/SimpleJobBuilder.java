package io.hookcron.internal;

import io.hookcron.JobBuilder;
import io.hookcron.core.Job;
import io.hookcron.core.JobRequest;
import io.hookcron.core.OneOffSchedule;
import io.hookcron.core.RecurringSchedule;
import io.hookcron.core.RetryPolicy;
import io.hookcron.core.Schedule;
import io.hookcron.core.Target;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by {@link DefaultWebhookScheduler}.
 */
public class SimpleJobBuilder implements JobBuilder {

    static final String DEFAULT_ONE_OFF_TIMEZONE = "UTC";

    private final Target target;
    private final Function<JobRequest, Job> persister;

    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, Object> queryParams = new LinkedHashMap<>();
    private Object payload;

    private String timezone;
    private Instant executeAt;
    private String cronExpression;
    private Instant startTime;

    private RetryPolicy retryPolicy = RetryPolicy.disabled();

    public SimpleJobBuilder(Target target, Function<JobRequest, Job> persister) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder header(String name, String value) {
        Objects.requireNonNull(name, "header name must not be null");
        if (name.isBlank()) throw new IllegalArgumentException("header name must not be blank");
        if (value == null) {
            headers.remove(name);
            return this;
        }
        headers.put(name, value);
        return this;
    }

    @Override
    public JobBuilder headers(Map<String, String> headers) {
        Objects.requireNonNull(headers, "headers must not be null");
        headers.forEach(this::header);
        return this;
    }

    @Override
    public JobBuilder queryParam(String name, Object value) {
        Objects.requireNonNull(name, "query parameter name must not be null");
        if (name.isBlank()) throw new IllegalArgumentException("query parameter name must not be blank");
        if (value == null) {
            queryParams.remove(name);
            return this;
        }
        queryParams.put(name, value);
        return this;
    }

    @Override
    public JobBuilder queryParams(Map<String, Object> queryParams) {
        Objects.requireNonNull(queryParams, "queryParams must not be null");
        queryParams.forEach(this::queryParam);
        return this;
    }

    @Override
    public JobBuilder payload(Object payload) {
        this.payload = payload;
        return this;
    }

    @Override
    public JobBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, ex);
        }
        this.timezone = timezone;
        return this;
    }

    @Override
    public JobBuilder executeAt(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.executeAt = time;
        return this;
    }

    @Override
    public JobBuilder cron(String cronExpression) {
        Objects.requireNonNull(cronExpression, "cronExpression must not be null");
        if (cronExpression.isBlank()) throw new IllegalArgumentException("cronExpression must not be blank");
        this.cronExpression = cronExpression.trim();
        return this;
    }

    @Override
    public JobBuilder startTime(Instant startTime) {
        Objects.requireNonNull(startTime, "startTime must not be null");
        this.startTime = startTime;
        return this;
    }

    @Override
    public JobBuilder retry(RetryPolicy retryPolicy) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        return this;
    }

    @Override
    public JobBuilder retry(int maxAttempts, Integer... retryableStatuses) {
        this.retryPolicy = new RetryPolicy(true, maxAttempts, new HashSet<>(Arrays.asList(retryableStatuses)));
        return this;
    }

    @Override
    public JobRequest build() {
        return new JobRequest(target, headers, queryParams, payload, buildSchedule(), retryPolicy);
    }

    @Override
    public Job save() {
        return persister.apply(build());
    }

    private Schedule buildSchedule() {
        boolean oneOff = executeAt != null;
        boolean recurring = cronExpression != null;

        if (oneOff && recurring) {
            throw new IllegalStateException("A job is either one-off (executeAt) or recurring (cron), not both");
        }
        if (recurring) {
            return new RecurringSchedule(cronExpression, timezone, startTime);
        }
        if (startTime != null) {
            throw new IllegalStateException("startTime only applies to recurring jobs");
        }
        if (oneOff) {
            return new OneOffSchedule(timezone != null ? timezone : DEFAULT_ONE_OFF_TIMEZONE, executeAt);
        }
        throw new IllegalStateException("Job must have a schedule: executeAt or cron");
    }
}
