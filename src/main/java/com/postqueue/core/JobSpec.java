package com.postqueue.core;

import java.util.Objects;

/**
 * Everything a caller supplies to create a job. The store assigns the id and
 * audit timestamps.
 */
public final class JobSpec {
    private final String target;
    private final String payload;
    private final Schedule schedule;
    private final String createdBy;

    public JobSpec(String target, String payload, Schedule schedule, String createdBy) {
        this.target = target;
        this.payload = payload;
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.createdBy = createdBy;
    }

    public JobSpec(String target, String payload, Schedule schedule) {
        this(target, payload, schedule, null);
    }

    public String getTarget() { return target; }

    public String getPayload() { return payload; }

    public Schedule getSchedule() { return schedule; }

    public String getCreatedBy() { return createdBy; }

    @Override
    public String toString() {
        return "JobSpec{target='" + target + "', schedule=" + schedule + "}";
    }
}
