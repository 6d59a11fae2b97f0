package com.postqueue.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a scheduled job as persisted by the job store.
 *
 * <p>The scheduler never inspects {@link #getTarget()} or {@link #getPayload()};
 * both are handed to the dispatcher untouched when the job fires.</p>
 *
 * <p><b>Thread Safety:</b> snapshots are immutable. A trigger captures the
 * snapshot it was armed with, so a concurrent reschedule or edit never changes
 * what an in-flight firing delivers. Use {@link #toBuilder()} to derive a
 * modified copy.</p>
 *
 * @see Schedule
 */
public final class Job {
    private final String id;
    private final String target;
    private final String payload;
    private final Schedule schedule;
    private final boolean active;
    private final String createdBy;
    private final Instant lastExecuted;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.target = Objects.requireNonNull(builder.target, "target");
        this.payload = builder.payload;
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule");
        this.active = builder.active;
        this.createdBy = builder.createdBy;
        this.lastExecuted = builder.lastExecuted;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .target(target)
            .payload(payload)
            .schedule(schedule)
            .active(active)
            .createdBy(createdBy)
            .lastExecuted(lastExecuted)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public String getId() { return id; }

    public String getTarget() { return target; }

    public String getPayload() { return payload; }

    public Schedule getSchedule() { return schedule; }

    public ScheduleKind getKind() { return schedule.getKind(); }

    public boolean isActive() { return active; }

    public String getCreatedBy() { return createdBy; }

    /** @return time of the last firing attempt, or null if the job never fired */
    public Instant getLastExecuted() { return lastExecuted; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "Job{id='" + id + "', target='" + target + "', schedule=" + schedule + ", active=" + active + "}";
    }

    public static final class Builder {
        private String id;
        private String target;
        private String payload;
        private Schedule schedule;
        private boolean active = true;
        private String createdBy;
        private Instant lastExecuted;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(String id) { this.id = id; return this; }

        public Builder target(String target) { this.target = target; return this; }

        public Builder payload(String payload) { this.payload = payload; return this; }

        public Builder schedule(Schedule schedule) { this.schedule = schedule; return this; }

        public Builder active(boolean active) { this.active = active; return this; }

        public Builder createdBy(String createdBy) { this.createdBy = createdBy; return this; }

        public Builder lastExecuted(Instant lastExecuted) { this.lastExecuted = lastExecuted; return this; }

        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }

        public Job build() {
            return new Job(this);
        }
    }
}
