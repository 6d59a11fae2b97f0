package com.postqueue.db;

import com.postqueue.core.Job;
import com.postqueue.core.JobNotFoundException;
import com.postqueue.core.JobSpec;
import com.postqueue.core.PersistenceException;
import com.postqueue.core.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of job rows. The scheduler engine reads and writes jobs only
 * through this interface.
 *
 * <p>Every method is assumed to be atomic on its own; the engine does no
 * optimistic locking on top of it.</p>
 */
public interface JobStore {

    /**
     * Load every job with {@code active = true}, oldest first. Used for
     * startup reconciliation.
     */
    List<Job> loadActiveJobs() throws PersistenceException;

    /**
     * Persist a new active job and assign its id.
     */
    Job create(JobSpec spec) throws PersistenceException;

    /**
     * @throws JobNotFoundException if no job has this id
     */
    Job get(String id) throws PersistenceException;

    Optional<Job> find(String id) throws PersistenceException;

    /**
     * List jobs, newest first.
     *
     * @param active only jobs with this active flag, or all jobs when null
     * @param target only jobs for this target, or all targets when null
     */
    List<Job> list(Boolean active, String target, int limit, int offset) throws PersistenceException;

    /**
     * Replace a job's schedule and mark it active.
     *
     * @return the updated job
     * @throws JobNotFoundException if no job has this id
     */
    Job updateSchedule(String id, Schedule schedule) throws PersistenceException;

    /**
     * Replace a job's schedule and, when {@code payload} is not null, its
     * payload in one statement, and mark it active.
     *
     * @return the updated job
     * @throws JobNotFoundException if no job has this id
     */
    Job updateSchedule(String id, Schedule schedule, String payload) throws PersistenceException;

    /**
     * @throws JobNotFoundException if no job has this id
     */
    Job updatePayload(String id, String payload) throws PersistenceException;

    /**
     * Set the active flag.
     *
     * @return true if the flag actually changed, false if it already had this value
     * @throws JobNotFoundException if no job has this id
     */
    boolean setActive(String id, boolean active) throws PersistenceException;

    void markExecuted(String id, Instant executedAt) throws PersistenceException;
}
