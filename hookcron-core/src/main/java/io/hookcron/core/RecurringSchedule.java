package io.hookcron.core;

import java.time.Instant;

/**
 * Cron-driven schedule.
 *
 * <ul>
 *   <li>cronExpression: 5-field or Quartz 6/7-field expression</li>
 *   <li>timezone: IANA time zone id used to evaluate the expression; null means system default</li>
 *   <li>startTime: no trigger fires before this instant; null means immediately</li>
 * </ul>
 */
public record RecurringSchedule(String cronExpression, String timezone, Instant startTime) implements Schedule {

    @Override
    public JobKind kind() {
        return JobKind.RECURRING;
    }
}
