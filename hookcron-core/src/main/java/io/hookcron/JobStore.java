package io.hookcron;

import io.hookcron.core.Job;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of jobs.
 *
 * <p>Implementations return copies: a {@link Job} obtained from the store is owned by the caller
 * until it is handed back to {@link #save(Job)}.
 */
public interface JobStore {

    List<Job> findAll();

    Optional<Job> findById(String id);

    /**
     * Insert when the id is null (assigning one), update otherwise. Stamps createdAt/updatedAt.
     *
     * @return the stored job
     */
    Job save(Job job);

    void deleteById(String id);

    void deleteAll();
}
