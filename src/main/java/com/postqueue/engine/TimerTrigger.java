package com.postqueue.engine;

import com.cronutils.model.time.ExecutionTime;
import com.postqueue.core.CronSchedules;
import com.postqueue.core.Schedule;
import com.postqueue.core.ScheduleKind;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Trigger} built on a single timer thread plus a fixed pool of firing
 * threads.
 *
 * <p><b>Threading model:</b></p>
 * <ul>
 *   <li>One {@code trigger-timer} thread owns every pending timer. It never runs
 *       a delivery; it only hands due handles to the firing pool.</li>
 *   <li>{@code trigger-firing-N} threads run the listener. A slow delivery
 *       occupies one of these threads and nothing else.</li>
 * </ul>
 *
 * <p><b>Recurring schedules:</b> each cron tick arms the following tick from
 * the later of the tick's nominal time and the current time. A timer that
 * wakes a few milliseconds early does not repeat a tick, and a timer that wakes
 * late (a stalled JVM, a suspended host, a clock step) fires the late tick once
 * and skips the ticks that passed in between instead of firing them back to
 * back. Cron expressions are evaluated in UTC.</p>
 *
 * <p><b>Overdue one-time schedules</b> are armed with a zero delay, so they
 * fire on the next timer pass instead of being dropped.</p>
 */
public class TimerTrigger implements Trigger {
    private static final Logger logger = Logger.getLogger(TimerTrigger.class.getName());
    private static final int MAX_COUNTED_MISSES = 10_000;

    private final ScheduledExecutorService timer;
    private final ExecutorService firingPool;
    private final Clock clock;

    public TimerTrigger(int firingThreads) {
        this(firingThreads, Clock.systemUTC());
    }

    public TimerTrigger(int firingThreads, Clock clock) {
        if (firingThreads < 1) {
            throw new IllegalArgumentException("firingThreads must be at least 1");
        }
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(namedThreads("trigger-timer"));
        this.firingPool = Executors.newFixedThreadPool(firingThreads, namedThreads("trigger-firing"));
    }

    @Override
    public TriggerHandle arm(Schedule schedule, FireListener listener) {
        if (schedule.getKind() == ScheduleKind.ONE_TIME) {
            return armOneTime(schedule.asOneTime(), listener);
        }
        return armRecurring(schedule.asRecurring(), listener);
    }

    private TriggerHandle armOneTime(Schedule.OneTime schedule, FireListener listener) {
        TriggerHandle handle = new TriggerHandle(schedule);
        long delayMillis = Duration.between(clock.instant(), schedule.getAt()).toMillis();

        if (delayMillis <= 0) {
            logger.info("One-time schedule " + schedule.getAt() + " is past due, firing immediately");
            delayMillis = 0;
        }

        handle.setNextFireTime(schedule.getAt());
        handle.setPending(timer.schedule(() -> {
            handle.setNextFireTime(null);
            handOff(handle, listener);
        }, delayMillis, TimeUnit.MILLISECONDS));
        return handle;
    }

    private TriggerHandle armRecurring(Schedule.Recurring schedule, FireListener listener) {
        // Parse before creating the handle so a bad expression never leaves a half-armed trigger
        ExecutionTime executionTime = CronSchedules.executionTime(schedule);
        TriggerHandle handle = new TriggerHandle(schedule);
        scheduleNextTick(handle, executionTime, listener, clock.instant().atZone(schedule.getZone()));
        return handle;
    }

    private void scheduleNextTick(TriggerHandle handle, ExecutionTime executionTime,
                                  FireListener listener, ZonedDateTime after) {
        if (handle.isReleased()) {
            return;
        }

        Optional<ZonedDateTime> next = executionTime.nextExecution(after);
        if (next.isEmpty()) {
            logger.warning("Cron schedule " + handle.getSchedule() + " has no further ticks after " + after);
            handle.setNextFireTime(null);
            return;
        }

        ZonedDateTime tick = next.get();
        long delayMillis = Math.max(0, Duration.between(clock.instant(), tick.toInstant()).toMillis());
        handle.setNextFireTime(tick.toInstant());
        try {
            handle.setPending(timer.schedule(() -> {
                if (handle.isReleased()) {
                    return;
                }
                scheduleNextTick(handle, executionTime, listener, resumeAfter(handle, executionTime, tick));
                handOff(handle, listener);
            }, delayMillis, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Timer shut down; not arming next tick of " + handle.getSchedule(), e);
        }
    }

    // Ticks that passed while the timer was late are skipped, not replayed
    private ZonedDateTime resumeAfter(TriggerHandle handle, ExecutionTime executionTime, ZonedDateTime tick) {
        ZonedDateTime now = clock.instant().atZone(tick.getZone());
        if (!now.isAfter(tick)) {
            return tick;
        }
        int missed = countTicksBetween(executionTime, tick, now);
        if (missed > 0) {
            logger.warning("Timer for " + handle.getSchedule() + " woke late for tick " + tick.toInstant()
                + "; skipping " + (missed >= MAX_COUNTED_MISSES ? "at least " : "") + missed + " missed ticks");
        }
        return now;
    }

    private static int countTicksBetween(ExecutionTime executionTime, ZonedDateTime from, ZonedDateTime to) {
        int count = 0;
        ZonedDateTime cursor = from;
        while (count < MAX_COUNTED_MISSES) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(cursor);
            if (next.isEmpty() || next.get().isAfter(to)) {
                break;
            }
            cursor = next.get();
            count++;
        }
        return count;
    }

    // Moves a due handle off the timer thread onto the firing pool
    private void handOff(TriggerHandle handle, FireListener listener) {
        if (!handle.beginFiring()) {
            return;
        }
        try {
            firingPool.execute(() -> {
                try {
                    listener.onFire(handle);
                } catch (RuntimeException e) {
                    // listener errors must not kill the firing thread or stop other triggers
                    logger.log(Level.SEVERE, "Unhandled error while firing " + handle.getSchedule(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warning("Firing pool shut down; dropping firing of " + handle.getSchedule());
        }
    }

    @Override
    public void disarm(TriggerHandle handle) {
        if (handle != null) {
            handle.release();
        }
    }

    /**
     * Stop the timer immediately and give in-flight firings up to 30 seconds
     * to finish.
     */
    @Override
    public void shutdown() {
        timer.shutdownNow();
        firingPool.shutdown();
        try {
            if (!firingPool.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warning("Forcing shutdown of in-flight firings");
                firingPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            firingPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Trigger timer stopped");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
