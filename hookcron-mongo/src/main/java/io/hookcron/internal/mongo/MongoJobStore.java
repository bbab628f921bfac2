package io.hookcron.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hookcron.JobStore;
import io.hookcron.core.Job;
import io.hookcron.core.JobKind;
import io.hookcron.core.OneOffSchedule;
import io.hookcron.core.RecurringSchedule;
import io.hookcron.core.RetryPolicy;
import io.hookcron.core.Schedule;
import io.hookcron.core.Target;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Semantics:
 * <ul>
 *   <li>save with a null id inserts and lets MongoDB assign the id; otherwise the document is replaced</li>
 *   <li>createdAt is stamped on first save, updatedAt on every save</li>
 *   <li>payload and query parameters are normalised to plain JSON values with Jackson before storage</li>
 * </ul>
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<Job> findAll() {
        List<JobDocument> docs = mongoTemplate.findAll(JobDocument.class);
        List<Job> jobs = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            if (d != null) {
                jobs.add(toJob(d));
            }
        }
        return jobs;
    }

    @Override
    public Optional<Job> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class)).map(this::toJob);
    }

    /**
     * Insert (null id) or replace a job document.
     */
    @Override
    public Job save(Job job) {
        Objects.requireNonNull(job, "job must not be null");

        JobDocument doc = toDocument(job);
        Instant now = clock.instant();
        if (doc.getCreatedAt() == null) {
            doc.setCreatedAt(now);
        }
        doc.setUpdatedAt(now);

        return toJob(mongoTemplate.save(doc));
    }

    /**
     * Hard delete job by document id.
     */
    @Override
    public void deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        mongoTemplate.remove(q, JobDocument.class);
    }

    @Override
    public void deleteAll() {
        mongoTemplate.remove(new Query(), JobDocument.class);
    }

    JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.getId());
        doc.setKind(job.getKind());

        Target target = job.getTarget();
        if (target != null) {
            doc.setTargetUrl(target.url());
            doc.setTargetMethod(target.method());
        }

        doc.setHeaders(isEmpty(job.getHeaders()) ? null : new LinkedHashMap<>(job.getHeaders()));
        doc.setQueryParams(isEmpty(job.getQueryParams()) ? null :
                objectMapper.convertValue(job.getQueryParams(), new TypeReference<Map<String, Object>>() {
                }));
        doc.setPayload(job.getPayload() == null ? null : objectMapper.convertValue(job.getPayload(), Object.class));

        Schedule schedule = job.getSchedule();
        if (schedule instanceof OneOffSchedule oneOff) {
            doc.setTimezone(oneOff.timezone());
            doc.setExecuteAt(oneOff.executeAt());
        } else if (schedule instanceof RecurringSchedule recurring) {
            doc.setTimezone(recurring.timezone());
            doc.setCronExpression(recurring.cronExpression());
            doc.setStartTime(recurring.startTime());
        }

        RetryPolicy retry = job.getRetryPolicy();
        doc.setRetryEnabled(retry.enabled());
        doc.setMaxAttempts(retry.maxAttempts());
        doc.setRetryableStatuses(retry.retryableStatuses().isEmpty() ? null : new ArrayList<>(retry.retryableStatuses()));

        doc.setStatus(job.getStatus());
        doc.setAttemptCount(job.getAttemptCount());
        doc.setLastError(job.getLastError());
        doc.setCreatedAt(job.getCreatedAt());
        doc.setUpdatedAt(job.getUpdatedAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job)}.
     */
    Job toJob(JobDocument doc) {
        Job job = new Job();
        job.setId(doc.getId());
        job.setKind(doc.getKind());
        if (doc.getTargetUrl() != null && doc.getTargetMethod() != null) {
            job.setTarget(new Target(doc.getTargetUrl(), doc.getTargetMethod()));
        }
        job.setHeaders(doc.getHeaders());
        job.setQueryParams(doc.getQueryParams());
        job.setPayload(doc.getPayload());

        if (doc.getKind() == JobKind.ONE_OFF && doc.getExecuteAt() != null) {
            job.setSchedule(new OneOffSchedule(doc.getTimezone(), doc.getExecuteAt()));
        } else if (doc.getKind() == JobKind.RECURRING) {
            job.setSchedule(new RecurringSchedule(doc.getCronExpression(), doc.getTimezone(), doc.getStartTime()));
        }

        List<Integer> statuses = doc.getRetryableStatuses();
        job.setRetryPolicy(new RetryPolicy(
                doc.isRetryEnabled(),
                Math.max(0, doc.getMaxAttempts()),
                statuses == null ? null : new HashSet<>(statuses)
        ));

        job.setStatus(doc.getStatus());
        job.setAttemptCount(doc.getAttemptCount());
        job.setLastError(doc.getLastError());
        job.setCreatedAt(doc.getCreatedAt());
        job.setUpdatedAt(doc.getUpdatedAt());
        return job;
    }

    private static boolean isEmpty(Map<?, ?> m) {
        return m == null || m.isEmpty();
    }
}
