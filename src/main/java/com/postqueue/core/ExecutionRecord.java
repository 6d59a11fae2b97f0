package com.postqueue.core;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit entry for one firing attempt.
 *
 * <p>Exactly one record is written per firing, whether delivery succeeded or
 * failed. Records are never mutated after creation; callers monitoring job
 * health poll these rather than expect a push notification.</p>
 */
public final class ExecutionRecord {
    private final String id;
    private final String jobId;
    private final String target;
    private final Instant executedAt;
    private final boolean success;
    private final String errorMessage;
    private final String receiptId;

    public ExecutionRecord(String id, String jobId, String target, Instant executedAt,
                           boolean success, String errorMessage, String receiptId) {
        this.id = Objects.requireNonNull(id, "id");
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.target = target;
        this.executedAt = Objects.requireNonNull(executedAt, "executedAt");
        this.success = success;
        this.errorMessage = errorMessage;
        this.receiptId = receiptId;
    }

    public static ExecutionRecord success(Job job, Instant executedAt, DeliveryReceipt receipt) {
        return new ExecutionRecord(UUID.randomUUID().toString(), job.getId(), job.getTarget(),
            executedAt, true, null, receipt != null ? receipt.getMessageId() : null);
    }

    public static ExecutionRecord failure(Job job, Instant executedAt, String errorMessage) {
        return new ExecutionRecord(UUID.randomUUID().toString(), job.getId(), job.getTarget(),
            executedAt, false, errorMessage, null);
    }

    public String getId() { return id; }

    public String getJobId() { return jobId; }

    public String getTarget() { return target; }

    public Instant getExecutedAt() { return executedAt; }

    public boolean isSuccess() { return success; }

    public String getErrorMessage() { return errorMessage; }

    public String getReceiptId() { return receiptId; }

    @Override
    public String toString() {
        return "ExecutionRecord{jobId='" + jobId + "', executedAt=" + executedAt + ", success=" + success
            + (errorMessage != null ? ", error='" + errorMessage + "'" : "") + "}";
    }
}
