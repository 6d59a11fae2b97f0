package com.postqueue.engine;

import com.postqueue.core.ScheduleKind;

import java.time.Instant;

/**
 * Introspection view of one live trigger: which job it belongs to, what kind
 * of schedule it runs, and when it is next due.
 */
public final class ActiveJob {
    private final String jobId;
    private final ScheduleKind kind;
    private final Instant nextFireTime;

    public ActiveJob(String jobId, ScheduleKind kind, Instant nextFireTime) {
        this.jobId = jobId;
        this.kind = kind;
        this.nextFireTime = nextFireTime;
    }

    public String getJobId() { return jobId; }

    public ScheduleKind getKind() { return kind; }

    /** @return null when the trigger is firing or has no further ticks */
    public Instant getNextFireTime() { return nextFireTime; }

    @Override
    public String toString() {
        return "ActiveJob{" + jobId + ", " + kind + "}";
    }
}
