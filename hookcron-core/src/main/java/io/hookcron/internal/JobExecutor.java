package io.hookcron.internal;

import io.hookcron.JobStore;
import io.hookcron.WebhookDispatcher;
import io.hookcron.core.DispatchResult;
import io.hookcron.core.Job;
import io.hookcron.core.JobKind;
import io.hookcron.core.JobStatus;
import io.hookcron.utils.RetryBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Performs one execution attempt of a job and drives its state machine.
 *
 * <pre>
 * SCHEDULED --(fire)--> RUNNING
 * RUNNING --(success)--> COMPLETED (one-off) | SCHEDULED (recurring)
 * RUNNING --(failure, retry eligible)--> SCHEDULED + retry timer
 * RUNNING --(failure, not eligible)--> FAILED
 * </pre>
 *
 * <p>Nothing escapes {@link #execute(String)}: dispatch problems become the job's last error and
 * store or timer problems are logged.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);
    private static final int LOCK_STRIPES = 64;

    private final JobStore jobStore;
    private final WebhookDispatcher dispatcher;
    private final TimerRegistry timers;
    private final RetryBackoff backoff;

    // ids with an attempt in progress on some worker thread
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    // serialize store writes of a job with its removal
    private final ReentrantLock[] jobLocks = new ReentrantLock[LOCK_STRIPES];

    private record RetryPlan(String jobId, int attempt, Duration delay) {
    }

    public JobExecutor(JobStore jobStore, WebhookDispatcher dispatcher, TimerRegistry timers, RetryBackoff backoff) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.timers = Objects.requireNonNull(timers, "timers must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        for (int i = 0; i < LOCK_STRIPES; i++) {
            jobLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Run one attempt for {@code jobId}. A no-op when the job is missing, not SCHEDULED, or
     * already being executed.
     */
    public void execute(String jobId) {
        if (jobId == null) {
            return;
        }
        if (!inFlight.add(jobId)) {
            log.debug("hookcron job already in flight; ignoring trigger id={}", jobId);
            return;
        }

        RetryPlan retry = null;
        try {
            retry = attempt(jobId);
        } catch (Exception e) {
            log.error("hookcron job execution failed id={} msg={}", jobId, e.getMessage(), e);
        } finally {
            inFlight.remove(jobId);
        }

        // armed after the id is released so an early retry is not mistaken for a duplicate
        if (retry != null) {
            armRetry(retry);
        }
    }

    /**
     * Run {@code action} while no write-back of {@code jobId} can interleave with it.
     */
    <T> T withJobLock(String jobId, Supplier<T> action) {
        ReentrantLock lock = jobLocks[Math.floorMod(jobId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run {@code action} while no write-back of any job can interleave with it.
     */
    void withAllJobsLocked(Runnable action) {
        // always acquired in index order
        int held = 0;
        try {
            for (; held < LOCK_STRIPES; held++) {
                jobLocks[held].lock();
            }
            action.run();
        } finally {
            for (int i = held - 1; i >= 0; i--) {
                jobLocks[i].unlock();
            }
        }
    }

    boolean isInFlight(String jobId) {
        return inFlight.contains(jobId);
    }

    private RetryPlan attempt(String jobId) {
        Job job = withJobLock(jobId, () -> claim(jobId));
        if (job == null) {
            return null;
        }
        int attempt = job.getAttemptCount();

        log.info("hookcron executing job id={} attempt={} {} {}",
                jobId, attempt, job.getTarget().method(), job.getTarget().url());

        DispatchResult result = dispatch(job);
        return withJobLock(jobId, () -> settle(job, attempt, result));
    }

    // job lock held
    private Job claim(String jobId) {
        Optional<Job> found = jobStore.findById(jobId);
        if (found.isEmpty()) {
            log.debug("hookcron job not found; nothing to execute id={}", jobId);
            return null;
        }
        Job job = found.get();
        if (job.getStatus() != JobStatus.SCHEDULED) {
            log.debug("hookcron job not executable id={} status={}", jobId, job.getStatus());
            return null;
        }

        job.setStatus(JobStatus.RUNNING);
        job.setAttemptCount(job.getAttemptCount() + 1);
        return jobStore.save(job);
    }

    private DispatchResult dispatch(Job job) {
        try {
            DispatchResult result = dispatcher.dispatch(job);
            return result != null ? result : DispatchResult.transportError("dispatcher returned no result");
        } catch (Exception e) {
            log.warn("hookcron dispatcher threw id={} msg={}", job.getId(), e.getMessage());
            return DispatchResult.transportError(e.getMessage());
        }
    }

    // job lock held
    private RetryPlan settle(Job job, int attempt, DispatchResult result) {
        if (!stillExists(job.getId())) {
            return null;
        }
        if (result.success()) {
            job.setLastError(null);
            job.setAttemptCount(0);
            job.setStatus(job.getKind().statusAfterSuccess());
            persist(job);
            log.info("hookcron job succeeded id={} httpStatus={} status={}",
                    job.getId(), result.status(), job.getStatus());
            return null;
        }

        if (result.transportFailure()) {
            log.warn("hookcron job HTTP request failed id={} msg={}", job.getId(), result.error());
        }
        boolean retry = job.getRetryPolicy().allowsRetry(attempt, result);
        job.setLastError(result.failureMessage());
        job.setStatus(retry ? JobStatus.SCHEDULED : JobStatus.FAILED);
        persist(job);

        if (retry) {
            Duration delay = backoff.delayFor(attempt);
            log.info("hookcron retrying job id={} in {}ms (attempt {})", job.getId(), delay.toMillis(), attempt);
            return new RetryPlan(job.getId(), attempt, delay);
        }
        if (job.getKind() == JobKind.RECURRING) {
            timers.disarm(job.getId());
        }
        log.warn("hookcron job failed permanently id={} attempts={} lastError={}",
                job.getId(), attempt, job.getLastError());
        return null;
    }

    private void armRetry(RetryPlan retry) {
        withJobLock(retry.jobId(), () -> {
            // a removal may have landed between write-back and here
            if (stillExists(retry.jobId())
                    && !timers.armRetry(retry.jobId(), retry.attempt(), retry.delay())) {
                log.error("hookcron retry could not be armed; job stays scheduled without a timer id={}",
                        retry.jobId());
            }
            return null;
        });
    }

    /**
     * A job deleted while its call was in flight must not be written back.
     */
    private boolean stillExists(String jobId) {
        try {
            if (jobStore.findById(jobId).isPresent()) {
                return true;
            }
        } catch (Exception e) {
            log.error("hookcron failed to re-read job id={} msg={}", jobId, e.getMessage(), e);
            return false;
        }
        log.warn("hookcron job deleted while in flight; discarding result id={}", jobId);
        timers.disarm(jobId);
        return false;
    }

    private void persist(Job job) {
        try {
            jobStore.save(job);
        } catch (Exception e) {
            log.error("hookcron failed to persist job id={} status={} msg={}",
                    job.getId(), job.getStatus(), e.getMessage(), e);
        }
    }
}
