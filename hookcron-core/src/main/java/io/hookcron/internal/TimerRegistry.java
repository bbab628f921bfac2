package io.hookcron.internal;

import io.hookcron.core.Job;
import io.hookcron.core.JobStatus;
import io.hookcron.core.OneOffSchedule;
import io.hookcron.core.RecurringSchedule;
import io.hookcron.utils.CronSchedules;
import org.quartz.CronExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Live one-off timers, retry timers and cron triggers, keyed by job id.
 *
 * <p>Every wait is capped at {@code maxTimerDelay}: a longer delay is reached through a chain of
 * intermediate wake-ups that only recompute the remaining delay and re-arm. Due timers invoke the
 * {@link FireListener}; the listener is always called outside the registry lock.
 *
 * <p>Arming never throws: scheduling errors are logged and leave the job un-armed.
 */
public class TimerRegistry {
    private static final Logger log = LoggerFactory.getLogger(TimerRegistry.class);

    /**
     * Callback invoked when a job is due.
     */
    @FunctionalInterface
    public interface FireListener {
        void fire(String jobId);
    }

    enum TimerKind {
        MAIN,
        RETRY
    }

    /**
     * Main timers and retry timers of the same job never share a key.
     */
    record TimerKey(String jobId, TimerKind kind, int attempt) {
        static TimerKey main(String jobId) {
            return new TimerKey(jobId, TimerKind.MAIN, 0);
        }

        static TimerKey retry(String jobId, int attempt) {
            return new TimerKey(jobId, TimerKind.RETRY, attempt);
        }
    }

    private final ScheduledThreadPoolExecutor timer;
    private final Clock clock;
    private final long maxTimerDelayMs;
    private final FireListener listener;

    private final Object lock = new Object();
    // guarded by lock
    private final Map<TimerKey, OneShotTimer> timers = new HashMap<>();
    private final Map<String, CronTrigger> crons = new HashMap<>();

    public TimerRegistry(Duration maxTimerDelay, Clock clock, FireListener listener) {
        Objects.requireNonNull(maxTimerDelay, "maxTimerDelay must not be null");
        if (maxTimerDelay.isZero() || maxTimerDelay.isNegative()) {
            throw new IllegalArgumentException("maxTimerDelay must be a positive duration");
        }
        this.maxTimerDelayMs = saturatedMillis(maxTimerDelay);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");

        this.timer = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setName("hookcron.timer");
            t.setDaemon(true);
            return t;
        });
        this.timer.setRemoveOnCancelPolicy(true);
    }

    /**
     * Arm the main timer of a one-off job, replacing any previous one.
     *
     * <p>A job already due (and still SCHEDULED) fires immediately on the calling thread.
     * Terminal jobs are not armed.
     */
    public void armOneOff(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        String id = job.getId();
        try {
            if (!(job.getSchedule() instanceof OneOffSchedule schedule)) {
                log.warn("hookcron one-off job has no one-off schedule id={}", id);
                return;
            }
            if (isSettled(job.getStatus())) {
                log.debug("hookcron one-off job not armed id={} status={}", id, job.getStatus());
                return;
            }

            Instant executeAt = schedule.executeAt();
            long delayMs = Math.max(0, saturatedMillis(Duration.between(clock.instant(), executeAt)));
            boolean fireNow = delayMs == 0 && job.getStatus() == JobStatus.SCHEDULED;

            synchronized (lock) {
                cancelTimer(TimerKey.main(id));
                if (!fireNow) {
                    OneShotTimer t = new OneShotTimer(TimerKey.main(id));
                    timers.put(t.key, t);
                    t.armFor(executeAt);
                }
            }

            if (fireNow) {
                log.info("hookcron one-off job is due; firing now id={}", id);
                listener.fire(id);
            } else if (delayMs > maxTimerDelayMs) {
                log.info("hookcron one-off job id={} due in {}ms; re-check in {}ms", id, delayMs, maxTimerDelayMs);
            } else {
                log.info("hookcron scheduled one-off job id={} to run in {}ms", id, delayMs);
            }
        } catch (RuntimeException e) {
            log.error("hookcron failed to arm one-off job id={} msg={}", id, e.getMessage(), e);
        }
    }

    /**
     * Register the cron trigger of a recurring job, replacing any previous one.
     */
    public void armRecurring(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        String id = job.getId();
        try {
            if (!(job.getSchedule() instanceof RecurringSchedule schedule)) {
                log.warn("hookcron recurring job has no recurring schedule id={}", id);
                return;
            }
            String cron = schedule.cronExpression();
            if (cron == null || cron.isBlank()) {
                log.warn("hookcron recurring job missing cron id={}", id);
                return;
            }
            if (job.getStatus() == JobStatus.FAILED || job.getStatus() == JobStatus.PAUSED) {
                log.debug("hookcron recurring job not armed id={} status={}", id, job.getStatus());
                return;
            }

            ZoneId zone = CronSchedules.zoneOf(schedule.timezone());
            CronExpression expression = CronSchedules.parse(cron, zone);

            Instant from = clock.instant();
            Instant startTime = schedule.startTime();
            if (startTime != null && startTime.isAfter(from)) {
                // nextFireTime is exclusive; keep an occurrence exactly at startTime
                from = startTime.minusMillis(1);
            }

            Instant first;
            synchronized (lock) {
                first = CronSchedules.nextFireTime(expression, from);
                if (first == null) {
                    log.warn("hookcron cron has no future occurrence id={} cron={}", id, cron);
                    return;
                }
                cancelCron(id);
                CronTrigger trigger = new CronTrigger(id, expression);
                crons.put(id, trigger);
                trigger.armFor(first);
            }
            log.info("hookcron scheduled recurring job id={} cron={} tz={} next={}", id, cron, zone, first);
        } catch (RuntimeException e) {
            log.error("hookcron failed to arm recurring job id={} msg={}", id, e.getMessage(), e);
        }
    }

    /**
     * Arm a one-shot retry timer for the attempt that just failed.
     *
     * @return false if the timer could not be armed (already logged)
     */
    public boolean armRetry(String jobId, int attempt, Duration delay) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        try {
            Instant dueAt = clock.instant().plus(delay);
            synchronized (lock) {
                TimerKey key = TimerKey.retry(jobId, attempt);
                cancelTimer(key);
                OneShotTimer t = new OneShotTimer(key);
                timers.put(key, t);
                t.armFor(dueAt);
            }
            return true;
        } catch (RuntimeException e) {
            log.error("hookcron failed to arm retry id={} attempt={} msg={}", jobId, attempt, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Cancel the main timer, every pending retry timer and the cron trigger of a job.
     * Safe to call when nothing is registered.
     */
    public void disarm(String jobId) {
        if (jobId == null) {
            return;
        }
        int cancelled = 0;
        synchronized (lock) {
            Iterator<Map.Entry<TimerKey, OneShotTimer>> it = timers.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<TimerKey, OneShotTimer> e = it.next();
                if (e.getKey().jobId().equals(jobId)) {
                    e.getValue().cancel();
                    it.remove();
                    cancelled++;
                }
            }
            if (cancelCron(jobId)) {
                cancelled++;
            }
        }
        log.debug("hookcron disarmed job id={} cancelled={}", jobId, cancelled);
    }

    /**
     * Cancel every live timer and trigger.
     */
    public void disarmAll() {
        int cancelled;
        synchronized (lock) {
            cancelled = timers.size() + crons.size();
            timers.values().forEach(OneShotTimer::cancel);
            crons.values().forEach(CronTrigger::cancel);
            timers.clear();
            crons.clear();
        }
        log.info("hookcron disarmed all jobs cancelled={}", cancelled);
    }

    /**
     * Disarm everything and stop the timer thread.
     */
    public void shutdown() {
        disarmAll();
        timer.shutdownNow();
    }

    public boolean isArmed(String jobId) {
        synchronized (lock) {
            if (crons.containsKey(jobId)) {
                return true;
            }
            for (TimerKey key : timers.keySet()) {
                if (key.jobId().equals(jobId)) {
                    return true;
                }
            }
            return false;
        }
    }

    public boolean hasRetryTimer(String jobId) {
        synchronized (lock) {
            for (TimerKey key : timers.keySet()) {
                if (key.kind() == TimerKind.RETRY && key.jobId().equals(jobId)) {
                    return true;
                }
            }
            return false;
        }
    }

    public int liveTimerCount() {
        synchronized (lock) {
            return timers.size() + crons.size();
        }
    }

    List<TimerKey> timerKeys() {
        synchronized (lock) {
            return new ArrayList<>(timers.keySet());
        }
    }

    // lock held
    private void cancelTimer(TimerKey key) {
        OneShotTimer previous = timers.remove(key);
        if (previous != null) {
            previous.cancel();
        }
    }

    // lock held
    private boolean cancelCron(String jobId) {
        CronTrigger previous = crons.remove(jobId);
        if (previous != null) {
            previous.cancel();
            return true;
        }
        return false;
    }

    private static boolean isSettled(JobStatus status) {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED || status == JobStatus.PAUSED;
    }

    private static long saturatedMillis(Duration d) {
        try {
            return d.toMillis();
        } catch (ArithmeticException e) {
            return d.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    /**
     * A wait towards {@code dueAt}, split into hops of at most {@code maxTimerDelay}.
     */
    private abstract class LiveTimer {
        // guarded by lock
        private ScheduledFuture<?> future;
        private boolean cancelled;
        protected Instant dueAt;

        // lock held
        void armFor(Instant dueAt) {
            this.dueAt = dueAt;
            scheduleHop();
        }

        // lock held
        private void scheduleHop() {
            long delayMs = Math.max(0, saturatedMillis(Duration.between(clock.instant(), dueAt)));
            if (delayMs > maxTimerDelayMs) {
                future = timer.schedule(this::wakeEarly, maxTimerDelayMs, TimeUnit.MILLISECONDS);
            } else {
                future = timer.schedule(this::wakeDue, delayMs, TimeUnit.MILLISECONDS);
            }
        }

        private void wakeEarly() {
            try {
                synchronized (lock) {
                    if (cancelled) {
                        return;
                    }
                    scheduleHop();
                }
            } catch (RuntimeException e) {
                log.error("hookcron failed to re-arm long timer msg={}", e.getMessage(), e);
            }
        }

        private void wakeDue() {
            try {
                onDue();
            } catch (RuntimeException e) {
                log.error("hookcron timer callback failed msg={}", e.getMessage(), e);
            }
        }

        // lock held
        boolean isCancelled() {
            return cancelled;
        }

        // lock held
        void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }

        abstract void onDue();
    }

    private final class OneShotTimer extends LiveTimer {
        private final TimerKey key;

        private OneShotTimer(TimerKey key) {
            this.key = key;
        }

        @Override
        void onDue() {
            synchronized (lock) {
                if (isCancelled() || !timers.remove(key, this)) {
                    return;
                }
            }
            log.debug("hookcron timer fired id={} kind={} attempt={}", key.jobId(), key.kind(), key.attempt());
            listener.fire(key.jobId());
        }
    }

    private final class CronTrigger extends LiveTimer {
        private final String jobId;
        private final CronExpression expression;

        private CronTrigger(String jobId, CronExpression expression) {
            this.jobId = jobId;
            this.expression = expression;
        }

        @Override
        void onDue() {
            synchronized (lock) {
                if (isCancelled() || crons.get(jobId) != this) {
                    return;
                }
                Instant now = clock.instant();
                Instant next = CronSchedules.nextFireTime(expression, now.isAfter(dueAt) ? now : dueAt);
                if (next == null) {
                    crons.remove(jobId);
                    log.info("hookcron cron has no further occurrence id={}", jobId);
                } else {
                    armFor(next);
                }
            }
            log.debug("hookcron cron fired id={}", jobId);
            listener.fire(jobId);
        }
    }
}
