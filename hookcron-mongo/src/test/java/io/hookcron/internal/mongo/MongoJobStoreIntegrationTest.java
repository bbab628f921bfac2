package io.hookcron.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.hookcron.WebhookScheduler;
import io.hookcron.config.HookcronProperties;
import io.hookcron.core.DispatchResult;
import io.hookcron.core.Job;
import io.hookcron.core.JobKind;
import io.hookcron.core.JobStatus;
import io.hookcron.core.OneOffSchedule;
import io.hookcron.core.Target;
import io.hookcron.internal.DefaultWebhookScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;
    private WebhookScheduler scheduler;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "hookcron_test");
        mongoTemplate.dropCollection(JobDocument.class);
        jobStore = new MongoJobStore(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
        mongoTemplate.dropCollection(JobDocument.class);
    }

    @Test
    void saveShouldAssignIdAndTimestamps() {
        Job job = newJob(Instant.now().plusSeconds(60));

        Job saved = jobStore.save(job);

        assertNotNull(saved.getId());
        assertNotNull(saved.getCreatedAt());
        assertNotNull(saved.getUpdatedAt());

        Job found = jobStore.findById(saved.getId()).orElseThrow();
        assertEquals(saved.getCreatedAt().truncatedTo(ChronoUnit.MILLIS), found.getCreatedAt());
        assertEquals(JobStatus.SCHEDULED, found.getStatus());
        assertEquals(Map.of("X-Token", "abc"), found.getHeaders());
        assertEquals(Map.of("foo", "bar"), found.getPayload());
    }

    @Test
    void updateShouldKeepCreatedAt() throws Exception {
        Job saved = jobStore.save(newJob(Instant.now().plusSeconds(60)));
        Thread.sleep(10);

        saved.setStatus(JobStatus.FAILED);
        saved.setLastError("status:500");
        Job updated = jobStore.save(saved);

        Job found = jobStore.findById(saved.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, found.getStatus());
        assertEquals("status:500", found.getLastError());
        assertEquals(saved.getCreatedAt().truncatedTo(ChronoUnit.MILLIS), found.getCreatedAt());
        assertTrue(updated.getUpdatedAt().isAfter(updated.getCreatedAt()));
        assertEquals(1, mongoTemplate.count(new Query(), JobDocument.class));
    }

    @Test
    void deleteShouldRemoveDocuments() {
        Job a = jobStore.save(newJob(Instant.now().plusSeconds(60)));
        jobStore.save(newJob(Instant.now().plusSeconds(60)));

        jobStore.deleteById(a.getId());
        assertFalse(jobStore.findById(a.getId()).isPresent());
        assertEquals(1, jobStore.findAll().size());

        jobStore.deleteById("does-not-exist");
        jobStore.deleteAll();
        assertTrue(jobStore.findAll().isEmpty());
    }

    @Test
    void schedulerShouldRecoverAndRunJobsPersistedInMongo() throws Exception {
        Job interrupted = newJob(Instant.now().minusSeconds(5));
        interrupted.setStatus(JobStatus.RUNNING);
        String id = jobStore.save(interrupted).getId();

        AtomicInteger calls = new AtomicInteger();
        HookcronProperties props = new HookcronProperties();
        props.setShutdownTimeout(Duration.ofSeconds(2));
        scheduler = new DefaultWebhookScheduler(props, jobStore, job -> {
            calls.incrementAndGet();
            return DispatchResult.response(200);
        });
        scheduler.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS,
                () -> jobStore.findById(id).map(Job::getStatus).orElse(null) == JobStatus.COMPLETED));
        assertEquals(1, calls.get());

        Job created = scheduler.job("https://hooks.example.com/later", "POST")
                .executeAt(Instant.now().plusSeconds(3600))
                .save();
        List<Job> listed = scheduler.list();
        assertEquals(created.getId(), listed.get(0).getId());
        assertEquals(2, listed.size());
    }

    private static Job newJob(Instant executeAt) {
        Job job = new Job();
        job.setKind(JobKind.ONE_OFF);
        job.setTarget(new Target("https://hooks.example.com/ingest", "POST"));
        job.setHeaders(Map.of("X-Token", "abc"));
        job.setPayload(Map.of("foo", "bar"));
        job.setSchedule(new OneOffSchedule("UTC", executeAt));
        job.setStatus(JobStatus.SCHEDULED);
        return job;
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }
}
