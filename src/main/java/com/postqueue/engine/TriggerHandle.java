package com.postqueue.engine;

import com.postqueue.core.Schedule;
import com.postqueue.core.ScheduleKind;

import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One armed timer or cron registration.
 *
 * <p>Identity matters: the registry compares handles by reference to tell the
 * trigger that fired apart from one that replaced it after a reschedule.</p>
 */
public final class TriggerHandle {
    private final Schedule schedule;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicInteger fireCount = new AtomicInteger();
    private volatile Future<?> pending;
    private volatile Instant nextFireTime;

    public TriggerHandle(Schedule schedule) {
        this.schedule = schedule;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public ScheduleKind getKind() {
        return schedule.getKind();
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * @return how many times this handle has been handed to its listener
     */
    public int getFireCount() {
        return fireCount.get();
    }

    public boolean hasFired() {
        return fireCount.get() > 0;
    }

    /**
     * @return the next instant this handle is due, or null if it will not fire again
     */
    public Instant getNextFireTime() {
        return nextFireTime;
    }

    void setNextFireTime(Instant nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    synchronized void setPending(Future<?> pending) {
        this.pending = pending;
        // lost a race with release(): the new timer must not survive
        if (released.get()) {
            pending.cancel(false);
        }
    }

    /**
     * Claim one firing. Serialized with {@link #release()} so a handle is
     * either released before it fires or counted as fired before it is released.
     *
     * @return false if the handle was already released
     */
    synchronized boolean beginFiring() {
        if (released.get()) {
            return false;
        }
        fireCount.incrementAndGet();
        return true;
    }

    /**
     * @return true if this call released the handle, false if it was already released
     */
    synchronized boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        Future<?> current = pending;
        if (current != null) {
            current.cancel(false);
        }
        nextFireTime = null;
        return true;
    }

    @Override
    public String toString() {
        return "TriggerHandle{" + schedule + ", fired=" + fireCount.get() + ", released=" + released.get() + "}";
    }
}
