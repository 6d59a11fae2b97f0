package com.postqueue.db;

import com.postqueue.core.ExecutionRecord;
import com.postqueue.core.PersistenceException;

import java.time.Instant;
import java.util.List;

/**
 * Durable, append-only log of firing attempts.
 */
public interface HistoryRecorder {

    void append(ExecutionRecord record) throws PersistenceException;

    /**
     * Most recent records first.
     *
     * @param target only records for this target, or all targets when null
     */
    List<ExecutionRecord> recent(String target, int limit) throws PersistenceException;

    List<ExecutionRecord> forJob(String jobId, int limit) throws PersistenceException;

    /**
     * Failed attempts at or after {@code since}, most recent first.
     */
    List<ExecutionRecord> failuresSince(Instant since) throws PersistenceException;
}
