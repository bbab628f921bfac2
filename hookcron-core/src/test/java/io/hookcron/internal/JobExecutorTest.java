package io.hookcron.internal;

import io.hookcron.JobStore;
import io.hookcron.WebhookDispatcher;
import io.hookcron.core.DispatchResult;
import io.hookcron.core.Job;
import io.hookcron.core.JobStatus;
import io.hookcron.utils.RetryBackoff;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JobExecutorTest {

    private final List<String> fired = new CopyOnWriteArrayList<>();
    private InMemoryJobStore store;
    private TimerRegistry timers;
    private RetryBackoff backoff;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        // retries are armed an hour out so they never fire during a test
        timers = new TimerRegistry(Duration.ofDays(1), Clock.systemUTC(), fired::add);
        backoff = new RetryBackoff(Duration.ofMinutes(30));
    }

    @AfterEach
    void tearDown() {
        timers.shutdown();
    }

    private JobExecutor executor(WebhookDispatcher dispatcher) {
        return new JobExecutor(store, dispatcher, timers, backoff);
    }

    private Job saveOneOff() {
        return store.save(TestJobs.oneOff(null, Instant.now().plusSeconds(3600)));
    }

    @Test
    void successfulOneOffShouldComplete() {
        Job job = saveOneOff();
        RecordingDispatcher dispatcher = RecordingDispatcher.status(200);

        executor(dispatcher).execute(job.getId());

        Job after = store.require(job.getId());
        assertEquals(JobStatus.COMPLETED, after.getStatus());
        assertEquals(0, after.getAttemptCount());
        assertNull(after.getLastError());
        assertEquals(1, dispatcher.callCount());
        assertEquals(JobStatus.RUNNING, dispatcher.calls().get(0).getStatus());
        assertEquals(1, dispatcher.calls().get(0).getAttemptCount());
    }

    @Test
    void successfulRecurringShouldGoBackToScheduledAndResetAttempts() {
        Job job = TestJobs.recurring(null, "0 0 * * * ?");
        job.setAttemptCount(1);
        job.setLastError("status:500");
        job = store.save(job);

        executor(RecordingDispatcher.status(204)).execute(job.getId());

        Job after = store.require(job.getId());
        assertEquals(JobStatus.SCHEDULED, after.getStatus());
        assertEquals(0, after.getAttemptCount());
        assertNull(after.getLastError());
    }

    @Test
    void failureWithoutRetryShouldFailImmediately() {
        Job job = saveOneOff();

        executor(RecordingDispatcher.status(500)).execute(job.getId());

        Job after = store.require(job.getId());
        assertEquals(JobStatus.FAILED, after.getStatus());
        assertEquals(1, after.getAttemptCount());
        assertEquals("status:500", after.getLastError());
        assertFalse(timers.hasRetryTimer(job.getId()));
    }

    @Test
    void retryableStatusShouldArmRetryTimer() {
        Job job = TestJobs.oneOff(null, Instant.now().plusSeconds(3600));
        job.setRetryPolicy(TestJobs.retry(3, 503));
        job = store.save(job);

        executor(RecordingDispatcher.status(503)).execute(job.getId());

        Job after = store.require(job.getId());
        assertEquals(JobStatus.SCHEDULED, after.getStatus());
        assertEquals(1, after.getAttemptCount());
        assertEquals("status:503", after.getLastError());
        assertTrue(timers.timerKeys().contains(TimerRegistry.TimerKey.retry(job.getId(), 1)));
    }

    @Test
    void statusOutsideRetryListShouldFail() {
        Job job = TestJobs.oneOff(null, Instant.now().plusSeconds(3600));
        job.setRetryPolicy(TestJobs.retry(3, 503));
        job = store.save(job);

        executor(RecordingDispatcher.status(500)).execute(job.getId());

        Job after = store.require(job.getId());
        assertEquals(JobStatus.FAILED, after.getStatus());
        assertFalse(timers.hasRetryTimer(job.getId()));
    }

    @Test
    void transportErrorShouldAlwaysBeRetryable() {
        Job job = TestJobs.oneOff(null, Instant.now().plusSeconds(3600));
        job.setRetryPolicy(TestJobs.retry(3));
        job = store.save(job);

        executor(new RecordingDispatcher(DispatchResult.transportError("Connection refused"))).execute(job.getId());

        Job after = store.require(job.getId());
        assertEquals(JobStatus.SCHEDULED, after.getStatus());
        assertEquals("Connection refused", after.getLastError());
        assertTrue(timers.hasRetryTimer(job.getId()));
    }

    @Test
    void exhaustedAttemptsShouldFail() {
        Job job = TestJobs.oneOff(null, Instant.now().plusSeconds(3600));
        job.setRetryPolicy(TestJobs.retry(2, 503));
        job.setAttemptCount(1);
        job = store.save(job);

        executor(RecordingDispatcher.status(503)).execute(job.getId());

        Job after = store.require(job.getId());
        assertEquals(JobStatus.FAILED, after.getStatus());
        assertEquals(2, after.getAttemptCount());
        assertEquals("status:503", after.getLastError());
        assertFalse(timers.hasRetryTimer(job.getId()));
    }

    @Test
    void permanentlyFailedRecurringJobShouldBeDisarmed() {
        Job job = store.save(TestJobs.recurring(null, "0 0 * * * ?"));
        timers.armRecurring(job);
        assertTrue(timers.isArmed(job.getId()));

        executor(RecordingDispatcher.status(500)).execute(job.getId());

        assertEquals(JobStatus.FAILED, store.require(job.getId()).getStatus());
        assertFalse(timers.isArmed(job.getId()));
    }

    @Test
    void dispatcherExceptionShouldBeRecordedAsError() {
        Job job = saveOneOff();

        executor(j -> {
            throw new IllegalStateException("boom");
        }).execute(job.getId());

        Job after = store.require(job.getId());
        assertEquals(JobStatus.FAILED, after.getStatus());
        assertEquals("boom", after.getLastError());
    }

    @Test
    void jobThatIsNotScheduledShouldBeSkipped() {
        Job job = TestJobs.oneOff(null, Instant.now());
        job.setStatus(JobStatus.RUNNING);
        job = store.save(job);
        RecordingDispatcher dispatcher = RecordingDispatcher.status(200);

        executor(dispatcher).execute(job.getId());
        executor(dispatcher).execute("missing");

        assertEquals(0, dispatcher.callCount());
        assertEquals(JobStatus.RUNNING, store.require(job.getId()).getStatus());
    }

    @Test
    void concurrentTriggersShouldDispatchOnce() throws Exception {
        Job job = saveOneOff();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        JobExecutor executor = executor(j -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return DispatchResult.response(200);
        });

        Thread first = new Thread(() -> executor.execute(job.getId()));
        first.start();
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        assertTrue(executor.isInFlight(job.getId()));

        executor.execute(job.getId());
        release.countDown();
        first.join(5000);

        assertEquals(1, calls.get());
        assertEquals(JobStatus.COMPLETED, store.require(job.getId()).getStatus());
        assertFalse(executor.isInFlight(job.getId()));
    }

    @Test
    void jobDeletedWhileInFlightShouldNotBeWrittenBack() throws Exception {
        Job job = TestJobs.oneOff(null, Instant.now().plusSeconds(3600));
        job.setRetryPolicy(TestJobs.retry(5, 503));
        String id = store.save(job).getId();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        JobExecutor executor = executor(j -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return DispatchResult.response(503);
        });

        Thread worker = new Thread(() -> executor.execute(id));
        worker.start();
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        store.deleteById(id);
        release.countDown();
        worker.join(5000);

        assertTrue(store.findById(id).isEmpty());
        assertFalse(timers.isArmed(id));
    }

    @Test
    void deleteRightAfterFailureWriteShouldLeaveNoRetry() {
        InMemoryJobStore deletingStore = new InMemoryJobStore() {
            private boolean deleted;

            @Override
            public synchronized Job save(Job job) {
                Job saved = super.save(job);
                if (!deleted && job.getLastError() != null) {
                    // a removal landing just after the failure is written
                    deleted = true;
                    deleteById(saved.getId());
                }
                return saved;
            }
        };
        Job job = TestJobs.oneOff(null, Instant.now().plusSeconds(3600));
        job.setRetryPolicy(TestJobs.retry(5, 503));
        String id = deletingStore.save(job).getId();
        RecordingDispatcher dispatcher = RecordingDispatcher.status(503);

        new JobExecutor(deletingStore, dispatcher, timers, backoff).execute(id);

        assertEquals(1, dispatcher.callCount());
        assertTrue(deletingStore.findById(id).isEmpty());
        assertFalse(timers.hasRetryTimer(id));
        assertFalse(timers.isArmed(id));
    }

    @Test
    void failureShouldBeWrittenBackInOneSave() {
        AtomicInteger saves = new AtomicInteger();
        InMemoryJobStore countingStore = new InMemoryJobStore() {
            @Override
            public synchronized Job save(Job job) {
                saves.incrementAndGet();
                return super.save(job);
            }
        };
        Job job = TestJobs.oneOff(null, Instant.now().plusSeconds(3600));
        job.setRetryPolicy(TestJobs.retry(5, 503));
        String id = countingStore.save(job).getId();
        saves.set(0);

        new JobExecutor(countingStore, RecordingDispatcher.status(503), timers, backoff).execute(id);

        // RUNNING claim, then status and last error together
        assertEquals(2, saves.get());
        Job after = countingStore.require(id);
        assertEquals(JobStatus.SCHEDULED, after.getStatus());
        assertEquals("status:503", after.getLastError());
    }

    @Test
    void storeFailureShouldNotEscape() {
        Job job = TestJobs.oneOff("job-1", Instant.now());
        JobStore failingStore = mock(JobStore.class);
        when(failingStore.findById("job-1")).thenAnswer(inv -> Optional.of(job.copy()));
        when(failingStore.save(any(Job.class)))
                .thenAnswer(inv -> inv.getArgument(0))
                .thenThrow(new IllegalStateException("db down"));
        RecordingDispatcher dispatcher = RecordingDispatcher.status(200);
        JobExecutor executor = new JobExecutor(failingStore, dispatcher, timers, backoff);

        assertDoesNotThrow(() -> executor.execute("job-1"));
        assertEquals(1, dispatcher.callCount());
        assertFalse(executor.isInFlight("job-1"));
    }
}
