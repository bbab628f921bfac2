package io.hookcron.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scheduled webhook call and its lifecycle state.
 *
 * <p>Instances are mutable; stores hand out copies so that the engine can change a job and
 * {@code save} it back without sharing state between threads.
 */
public class Job {

    private String id;
    private JobKind kind;
    private Target target;
    private Map<String, String> headers;
    private Map<String, Object> queryParams;
    private Object payload;
    private Schedule schedule;
    private RetryPolicy retryPolicy = RetryPolicy.disabled();

    private JobStatus status = JobStatus.SCHEDULED;
    private int attemptCount;
    private String lastError;

    private Instant createdAt;
    private Instant updatedAt;

    public Job() {
    }

    /**
     * New, not yet persisted job for a validated request.
     */
    public static Job fromRequest(JobRequest request) {
        Job job = new Job();
        job.setKind(request.kind());
        job.setTarget(request.target());
        job.setHeaders(request.headers());
        job.setQueryParams(request.queryParams());
        job.setPayload(request.payload());
        job.setSchedule(request.schedule());
        job.setRetryPolicy(request.retryPolicy());
        job.setStatus(JobStatus.SCHEDULED);
        job.setAttemptCount(0);
        return job;
    }

    public Job copy() {
        Job c = new Job();
        c.id = id;
        c.kind = kind;
        c.target = target;
        c.headers = headers == null ? null : new LinkedHashMap<>(headers);
        c.queryParams = queryParams == null ? null : new LinkedHashMap<>(queryParams);
        c.payload = payload;
        c.schedule = schedule;
        c.retryPolicy = retryPolicy;
        c.status = status;
        c.attemptCount = attemptCount;
        c.lastError = lastError;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public JobKind getKind() {
        return kind;
    }

    public void setKind(JobKind kind) {
        this.kind = kind;
    }

    public Target getTarget() {
        return target;
    }

    public void setTarget(Target target) {
        this.target = target;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers;
    }

    public Map<String, Object> getQueryParams() {
        return queryParams;
    }

    public void setQueryParams(Map<String, Object> queryParams) {
        this.queryParams = queryParams;
    }

    public Object getPayload() {
        return payload;
    }

    public void setPayload(Object payload) {
        this.payload = payload;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public void setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy == null ? RetryPolicy.disabled() : retryPolicy;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", kind=" + kind + ", status=" + status + ", attemptCount=" + attemptCount + "}";
    }
}
