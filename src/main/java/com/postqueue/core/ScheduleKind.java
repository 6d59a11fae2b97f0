package com.postqueue.core;

/**
 * The two mutually exclusive ways a job can be scheduled.
 *
 * <p>The enum name is what gets persisted in the {@code schedule_kind} column,
 * the display name is what the control surface reports.</p>
 *
 * @see Schedule
 */
public enum ScheduleKind {
    ONE_TIME("one_time"),
    RECURRING("recurring");

    private final String displayName;

    ScheduleKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the wire name for this kind (e.g., "one_time").
     *
     * @return the display name
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether a job of this kind retires itself after its first firing.
     *
     * @return true for one-time schedules
     */
    public boolean isSelfRetiring() {
        return this == ONE_TIME;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
