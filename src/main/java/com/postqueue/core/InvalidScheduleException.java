package com.postqueue.core;

/**
 * Thrown when a schedule is rejected: a malformed cron expression, or a
 * one-time timestamp that is not in the future when the job is created or
 * rescheduled.
 *
 * <p>This is a caller error and is returned synchronously from
 * {@code add}/{@code reschedule}. A one-time timestamp that slips into the
 * past between validation and arming is not an error; the job simply fires
 * immediately.</p>
 */
public class InvalidScheduleException extends RuntimeException {

    private final String rejectedValue;

    public InvalidScheduleException(String message) {
        super(message);
        this.rejectedValue = null;
    }

    public InvalidScheduleException(String message, String rejectedValue) {
        super(message);
        this.rejectedValue = rejectedValue;
    }

    public InvalidScheduleException(String message, String rejectedValue, Throwable cause) {
        super(message, cause);
        this.rejectedValue = rejectedValue;
    }

    /**
     * Get the cron expression or timestamp that was rejected.
     *
     * @return the rejected value, or null if not available
     */
    public String getRejectedValue() {
        return rejectedValue;
    }
}
