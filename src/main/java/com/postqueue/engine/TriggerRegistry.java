package com.postqueue.engine;

import com.postqueue.core.CronSchedules;
import com.postqueue.core.InvalidScheduleException;
import com.postqueue.core.Job;
import com.postqueue.core.ScheduleKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

/**
 * Live mapping from job id to its armed trigger.
 *
 * <p><b>Invariant:</b> at most one handle per job id. {@link #arm} refuses to
 * arm an id that is already armed; callers disarm first. This is what keeps a
 * rescheduled job from firing twice.</p>
 *
 * <p><b>Thread Safety:</b> every method is {@code synchronized} on the
 * registry. The lock is only held for map updates and timer registration,
 * never while a delivery runs, since {@link Trigger} implementations fire on
 * their own threads.</p>
 *
 * <p>The registry is never persisted. It is rebuilt from the job store on
 * every startup.</p>
 */
public class TriggerRegistry {
    private static final Logger logger = Logger.getLogger(TriggerRegistry.class.getName());

    private final Trigger trigger;
    private final Map<String, TriggerHandle> handles = new HashMap<>();

    public TriggerRegistry(Trigger trigger) {
        this.trigger = trigger;
    }

    /**
     * Arm a trigger for the job's schedule.
     *
     * <p>The callback receives the exact snapshot passed here, not whatever
     * the store holds when the trigger fires.</p>
     *
     * @param job snapshot to fire with
     * @param onFire called with the snapshot and the handle that fired
     * @return the new handle
     * @throws InvalidScheduleException if a recurring job's cron expression is malformed or its zone is not UTC
     * @throws IllegalStateException if the job is already armed
     */
    public synchronized TriggerHandle arm(Job job, BiConsumer<Job, TriggerHandle> onFire) {
        if (job.getKind() == ScheduleKind.RECURRING) {
            CronSchedules.executionTime(job.getSchedule().asRecurring());
        }
        if (handles.containsKey(job.getId())) {
            throw new IllegalStateException("Job " + job.getId() + " is already armed; disarm it first");
        }

        TriggerHandle handle = trigger.arm(job.getSchedule(), fired -> onFire.accept(job, fired));
        handles.put(job.getId(), handle);
        logger.info("Armed " + job.getKind() + " trigger for job " + job.getId() + " (" + job.getSchedule() + ")");
        return handle;
    }

    /**
     * Release the job's trigger if it has one. Idempotent.
     *
     * @return true if a live trigger was removed
     */
    public synchronized boolean disarm(String jobId) {
        TriggerHandle handle = handles.remove(jobId);
        if (handle == null) {
            return false;
        }
        trigger.disarm(handle);
        logger.info("Disarmed trigger for job " + jobId);
        return true;
    }

    /**
     * Release the job's trigger only if it is still {@code expected}. Used when
     * a one-time job retires after firing: if a reschedule already replaced the
     * handle, the replacement is left alone.
     *
     * @return true if {@code expected} was the live handle and has been removed
     */
    public synchronized boolean disarmIfCurrent(String jobId, TriggerHandle expected) {
        if (handles.get(jobId) != expected) {
            return false;
        }
        handles.remove(jobId);
        trigger.disarm(expected);
        return true;
    }

    /**
     * Replace the snapshot an armed job fires with. A one-time job whose
     * trigger already fired is left alone, so an edit never causes a second
     * delivery.
     *
     * @return true if the job was re-armed with {@code updated}
     */
    public synchronized boolean rearm(Job updated, BiConsumer<Job, TriggerHandle> onFire) {
        TriggerHandle current = handles.get(updated.getId());
        if (current == null) {
            return false;
        }
        if (current.getKind() == ScheduleKind.ONE_TIME && current.hasFired()) {
            return false;
        }
        disarm(updated.getId());
        arm(updated, onFire);
        return true;
    }

    public synchronized boolean isArmed(String jobId) {
        return handles.containsKey(jobId);
    }

    public synchronized TriggerHandle handleFor(String jobId) {
        return handles.get(jobId);
    }

    public synchronized int count() {
        return handles.size();
    }

    public synchronized List<ActiveJob> snapshot() {
        List<ActiveJob> active = new ArrayList<>(handles.size());
        for (Map.Entry<String, TriggerHandle> entry : handles.entrySet()) {
            TriggerHandle handle = entry.getValue();
            active.add(new ActiveJob(entry.getKey(), handle.getKind(), handle.getNextFireTime()));
        }
        return active;
    }

    /**
     * Release every trigger. Used on shutdown.
     *
     * @return how many triggers were released
     */
    public synchronized int disarmAll() {
        int released = handles.size();
        for (TriggerHandle handle : handles.values()) {
            trigger.disarm(handle);
        }
        handles.clear();
        return released;
    }

    Trigger getTrigger() {
        return trigger;
    }
}
