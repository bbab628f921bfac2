package io.hookcron.internal;

import io.hookcron.JobBuilder;
import io.hookcron.JobStore;
import io.hookcron.WebhookDispatcher;
import io.hookcron.WebhookScheduler;
import io.hookcron.config.HookcronProperties;
import io.hookcron.core.Job;
import io.hookcron.core.JobRequest;
import io.hookcron.core.JobStatus;
import io.hookcron.core.Target;
import io.hookcron.utils.RetryBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebhookScheduler is a store-backed scheduler &amp; runner for HTTP jobs.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One-off jobs (run at a specific Instant)</li>
 *   <li>Recurring jobs (cron expression with optional time zone and start time)</li>
 *   <li>Exponential backoff with jitter on retryable failures</li>
 *   <li>Recovery of every persisted job on start</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.job("https://example.com/hooks/report", "POST")
 *          .header("Content-Type", "application/json")
 *          .payload(Map.of("report", "daily"))
 *          .cron("0 9 * * *")
 *          .timezone("Asia/Taipei")
 *          .retry(3, 502, 503)
 *          .save();
 *
 * scheduler.stop();
 * }</pre>
 *
 * <p>Assumes it is the only active scheduler over its {@link JobStore}.
 */
public class DefaultWebhookScheduler implements WebhookScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultWebhookScheduler.class);

    private static final Comparator<Job> NEWEST_FIRST =
            Comparator.comparing(Job::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                    .reversed();

    private final HookcronProperties props;
    private final JobStore jobStore;
    private final ExecutionQueue queue;
    private final TimerRegistry timers;
    private final JobExecutor executor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public DefaultWebhookScheduler(HookcronProperties props, JobStore jobStore, WebhookDispatcher dispatcher) {
        this(props, jobStore, dispatcher, Clock.systemUTC(),
                new RetryBackoff(Objects.requireNonNull(props, "props must not be null").getRetryBaseDelay()));
    }

    public DefaultWebhookScheduler(HookcronProperties props,
                                   JobStore jobStore,
                                   WebhookDispatcher dispatcher,
                                   Clock clock,
                                   RetryBackoff backoff) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        Objects.requireNonNull(props.getShutdownTimeout(), "hookcron.shutdownTimeout must not be null");

        this.queue = new ExecutionQueue(props.getMaxConcurrency());
        this.timers = new TimerRegistry(props.getMaxTimerDelay(), clock, this::fire);
        this.executor = new JobExecutor(jobStore, dispatcher, timers, backoff);
    }

    /**
     * Load every persisted job and arm it. Should be idempotent.
     */
    @Override
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("hookcron scheduler has been stopped and cannot be restarted");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("hookcron starting with maxConcurrency={}, requestTimeout={}, retryBaseDelay={}, maxTimerDelay={}",
                props.getMaxConcurrency(),
                props.getRequestTimeout(),
                props.getRetryBaseDelay(),
                props.getMaxTimerDelay());

        List<Job> jobs;
        try {
            jobs = jobStore.findAll();
        } catch (Exception e) {
            log.error("hookcron failed to load persisted jobs msg={}", e.getMessage(), e);
            return;
        }

        for (Job job : jobs) {
            if (job.getStatus() == JobStatus.RUNNING) {
                // nothing can be in flight in a fresh process
                job.setStatus(JobStatus.SCHEDULED);
                try {
                    job = jobStore.save(job);
                } catch (Exception e) {
                    log.error("hookcron failed to reset running job id={} msg={}", job.getId(), e.getMessage(), e);
                }
                log.warn("hookcron job was running when the previous process ended; reset to scheduled id={}",
                        job.getId());
            }
            arm(job);
        }
        log.info("hookcron started; recovered {} job(s)", jobs.size());
    }

    /**
     * Disarm everything and stop the engine threads. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("hookcron stopping...");
        timers.shutdown();
        queue.shutdown(props.getShutdownTimeout());
        started.set(false);
        log.info("hookcron stopped successfully.");
    }

    @Override
    public JobBuilder job(String url, String method) {
        return new SimpleJobBuilder(new Target(url, method), this::create);
    }

    @Override
    public Job create(JobRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        Job saved = jobStore.save(Job.fromRequest(request));
        log.info("hookcron job created id={} kind={}", saved.getId(), saved.getKind());
        arm(saved);
        return saved;
    }

    @Override
    public List<Job> list() {
        List<Job> jobs = new ArrayList<>(jobStore.findAll());
        jobs.sort(NEWEST_FIRST);
        return jobs;
    }

    @Override
    public Optional<Job> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return jobStore.findById(id);
    }

    @Override
    public boolean remove(String id) {
        Objects.requireNonNull(id, "id must not be null");

        boolean removed = executor.withJobLock(id, () -> {
            timers.disarm(id);
            if (jobStore.findById(id).isEmpty()) {
                return false;
            }
            jobStore.deleteById(id);
            return true;
        });
        if (removed) {
            log.info("hookcron job removed id={}", id);
        }
        return removed;
    }

    @Override
    public void removeAll() {
        executor.withAllJobsLocked(() -> {
            timers.disarmAll();
            jobStore.deleteAll();
        });
        log.info("hookcron all jobs removed");
    }

    TimerRegistry timerRegistry() {
        return timers;
    }

    ExecutionQueue executionQueue() {
        return queue;
    }

    JobExecutor jobExecutor() {
        return executor;
    }

    private void arm(Job job) {
        if (job.getKind() == null) {
            log.warn("hookcron job has no kind; not armed id={}", job.getId());
            return;
        }
        switch (job.getKind()) {
            case ONE_OFF -> timers.armOneOff(job);
            case RECURRING -> timers.armRecurring(job);
        }
    }

    private void fire(String jobId) {
        queue.submit(() -> executor.execute(jobId));
    }
}
