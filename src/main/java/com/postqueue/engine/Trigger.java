package com.postqueue.engine;

import com.postqueue.core.InvalidScheduleException;
import com.postqueue.core.Schedule;

/**
 * Timer capability behind the trigger registry: arms a single-shot timer or a
 * cron trigger and hands back a handle that can later be disarmed.
 *
 * <p>Implementations must deliver firings on a thread other than the caller's,
 * so that arming never runs a delivery inline.</p>
 *
 * @see TimerTrigger
 */
public interface Trigger {

    /**
     * Arm a trigger for the schedule. A one-time schedule whose instant has
     * already passed fires as soon as possible instead of being dropped.
     *
     * @param schedule when to fire
     * @param listener what to call on each firing
     * @return the live handle
     * @throws InvalidScheduleException if a recurring schedule's cron expression is malformed
     */
    TriggerHandle arm(Schedule schedule, FireListener listener);

    /**
     * Release a handle. Idempotent. A firing already handed to the listener
     * is not interrupted.
     */
    void disarm(TriggerHandle handle);

    /**
     * Stop all timers and firing threads.
     */
    void shutdown();
}
