package io.hookcron.core;

import io.hookcron.utils.CronSchedules;

import java.time.DateTimeException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, validated job definition produced by JobBuilder.build().
 * This is a pure data object with no persistence logic.
 */
public record JobRequest(
        Target target,
        Map<String, String> headers,
        Map<String, Object> queryParams,
        Object payload,
        Schedule schedule,
        RetryPolicy retryPolicy
) {

    public JobRequest {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");

        if (schedule.timezone() != null) {
            try {
                CronSchedules.zoneOf(schedule.timezone());
            } catch (DateTimeException ex) {
                throw new IllegalArgumentException("Invalid timezone: " + schedule.timezone(), ex);
            }
        }
        if (schedule instanceof RecurringSchedule recurring
                && (recurring.cronExpression() == null || recurring.cronExpression().isBlank())) {
            throw new IllegalArgumentException("recurring job requires a cron expression");
        }

        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        queryParams = queryParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        retryPolicy = retryPolicy == null ? RetryPolicy.disabled() : retryPolicy;
    }

    public JobKind kind() {
        return schedule.kind();
    }
}
