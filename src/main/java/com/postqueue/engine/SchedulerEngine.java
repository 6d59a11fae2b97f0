package com.postqueue.engine;

import com.postqueue.core.CronSchedules;
import com.postqueue.core.InvalidScheduleException;
import com.postqueue.core.Job;
import com.postqueue.core.JobNotFoundException;
import com.postqueue.core.JobSpec;
import com.postqueue.core.PersistenceException;
import com.postqueue.core.Schedule;
import com.postqueue.core.ScheduleKind;
import com.postqueue.db.HistoryRecorder;
import com.postqueue.db.JobStore;
import com.postqueue.dispatch.Dispatcher;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The scheduling and dispatch engine: rebuilds triggers from the job store on
 * startup, and adds, cancels and reschedules jobs while they are live.
 *
 * <p><b>Key Responsibilities:</b></p>
 * <ul>
 *   <li>Reconcile on {@link #start()}: arm every active job, firing overdue
 *       one-time jobs immediately instead of skipping them</li>
 *   <li>Keep "job is active" and "job has a live trigger" in step across
 *       add, cancel, reschedule and one-time retirement</li>
 *   <li>Hand each firing to the {@link ExecutionOrchestrator}</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b></p>
 * <ul>
 *   <li>Mutations ({@code add}, {@code cancel}, {@code reschedule},
 *       {@code editPayload}, {@code update}), one-time retirement and reconciliation are
 *       serialized by a single mutation lock. A mutation that arrives while
 *       reconciliation runs waits for it to finish.</li>
 *   <li>Deliveries never run under that lock, so a slow dispatcher does not
 *       block mutations for other jobs.</li>
 *   <li>Cancelling a job does not abort a delivery already in progress; it
 *       only prevents future firings.</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * TriggerRegistry registry = new TriggerRegistry(new TimerTrigger(4));
 * SchedulerEngine engine = new SchedulerEngine(store, history, dispatcher, registry, Clock.systemUTC());
 * engine.start();
 *
 * Job job = engine.add(new JobSpec("announcements", "{\"content\":\"hello\"}",
 *     Schedule.recurring("0 9 * * 1")));
 * engine.reschedule(job.getId(), Schedule.oneTime(Instant.now().plusSeconds(3600)));
 * engine.cancel(job.getId());
 *
 * engine.shutdown();
 * }</pre>
 *
 * @see TriggerRegistry
 * @see ExecutionOrchestrator
 */
public class SchedulerEngine {
    private static final Logger logger = Logger.getLogger(SchedulerEngine.class.getName());

    private final JobStore store;
    private final TriggerRegistry registry;
    private final ExecutionOrchestrator orchestrator;
    private final Clock clock;
    private final ReentrantLock mutationLock = new ReentrantLock();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public SchedulerEngine(JobStore store, HistoryRecorder history, Dispatcher dispatcher,
                           TriggerRegistry registry, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.clock = clock;
        this.orchestrator = new ExecutionOrchestrator(dispatcher, history, store, clock, this::retireOneTime);
    }

    /**
     * Start the engine by reconciling live triggers against the job store.
     *
     * <p>Every job with {@code active = true} is armed. A one-time job whose
     * time has already passed fires immediately. A recurring job whose stored
     * cron expression no longer parses is deactivated so that it does not sit
     * active without a trigger. If the store cannot be read at all the engine
     * still starts, with no triggers, and the failure is logged.</p>
     *
     * @return the number of triggers armed
     */
    public int start() {
        if (!started.compareAndSet(false, true)) {
            logger.warning("Scheduler engine is already started");
            return registry.count();
        }

        mutationLock.lock();
        try {
            return reconcile();
        } finally {
            mutationLock.unlock();
        }
    }

    private int reconcile() {
        List<Job> activeJobs;
        try {
            activeJobs = store.loadActiveJobs();
        } catch (PersistenceException e) {
            logger.log(Level.SEVERE, "Failed to load active jobs; starting with no triggers", e);
            return 0;
        }

        Instant now = clock.instant();
        int armed = 0;
        int overdue = 0;
        for (Job job : activeJobs) {
            try {
                if (job.getKind() == ScheduleKind.ONE_TIME && !job.getSchedule().asOneTime().getAt().isAfter(now)) {
                    logger.info("Job " + job.getId() + " missed its time while the scheduler was down; firing now");
                    overdue++;
                }
                armJob(job);
                armed++;
            } catch (InvalidScheduleException e) {
                logger.log(Level.SEVERE, "Job " + job.getId() + " has an invalid schedule; deactivating it", e);
                deactivateQuietly(job.getId());
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to arm job " + job.getId() + " during reconciliation", e);
            }
        }

        logger.info("Reconciled " + armed + " of " + activeJobs.size() + " active jobs (" + overdue + " past due)");
        return armed;
    }

    /**
     * Create and arm a new job.
     *
     * @param spec target, payload and schedule
     * @return the persisted job with its assigned id
     * @throws InvalidScheduleException if the cron expression is malformed or the
     *         one-time instant is not in the future
     * @throws PersistenceException if the job could not be stored
     */
    public Job add(JobSpec spec) throws PersistenceException {
        requireRunning();
        if (spec.getTarget() == null || spec.getTarget().isBlank()) {
            throw new IllegalArgumentException("Job target must not be blank");
        }
        validateSchedule(spec.getSchedule());

        mutationLock.lock();
        try {
            Job job = store.create(spec);
            try {
                armJob(job);
            } catch (RuntimeException e) {
                // keep "active" honest if the timer refused the job
                deactivateQuietly(job.getId());
                throw e;
            }
            logger.info("Added job " + job.getId() + " for target " + job.getTarget() + " (" + job.getSchedule() + ")");
            return job;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Stop a job from firing again and mark it inactive. Idempotent.
     *
     * @return true if the job was live, false if it was already inactive
     * @throws JobNotFoundException if the job does not exist
     * @throws PersistenceException if the store could not be updated
     */
    public boolean cancel(String jobId) throws PersistenceException {
        requireRunning();

        mutationLock.lock();
        try {
            boolean disarmed = registry.disarm(jobId);
            boolean deactivated = store.setActive(jobId, false);
            if (disarmed || deactivated) {
                logger.info("Cancelled job " + jobId);
                return true;
            }
            logger.info("Job " + jobId + " was already inactive");
            return false;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Replace a job's schedule. The old trigger is released before the new
     * one is armed, so the two never coexist. Switching between one-time and
     * recurring is allowed, and an inactive job becomes active again.
     *
     * @return the updated job
     * @throws JobNotFoundException if the job does not exist
     * @throws InvalidScheduleException if the new schedule is rejected; the job is left untouched
     * @throws PersistenceException if the store could not be updated; the old trigger is restored
     */
    public Job reschedule(String jobId, Schedule newSchedule) throws PersistenceException {
        return update(jobId, newSchedule, null);
    }

    /**
     * Replace a job's schedule, its payload, or both, as one mutation. No
     * firing can observe the new schedule with the old payload or the other
     * way round, and a failure leaves both unchanged.
     *
     * <p>With only a payload this behaves like {@link #editPayload}; with a
     * schedule it behaves like {@link #reschedule}, delivering the new payload
     * from the first firing of the new trigger.</p>
     *
     * @param newSchedule the new schedule, or null to keep the current one
     * @param newPayload the new payload, or null to keep the current one
     * @return the updated job
     * @throws IllegalArgumentException if both arguments are null
     * @throws JobNotFoundException if the job does not exist
     * @throws InvalidScheduleException if the new schedule is rejected; the job is left untouched
     * @throws PersistenceException if the store could not be updated; the old trigger is restored
     */
    public Job update(String jobId, Schedule newSchedule, String newPayload) throws PersistenceException {
        if (newSchedule == null) {
            if (newPayload == null) {
                throw new IllegalArgumentException("Nothing to update: give a schedule or a payload");
            }
            return editPayload(jobId, newPayload);
        }
        requireRunning();
        validateSchedule(newSchedule);

        mutationLock.lock();
        try {
            Job existing = store.get(jobId);
            boolean wasArmed = registry.disarm(jobId);

            Job updated;
            try {
                updated = store.updateSchedule(jobId, newSchedule, newPayload);
            } catch (PersistenceException e) {
                if (wasArmed) {
                    armJob(existing);
                }
                throw e;
            }

            armJob(updated);
            logger.info("Rescheduled job " + jobId + " from " + existing.getSchedule() + " to " + newSchedule
                + (newPayload != null ? " with a new payload" : ""));
            return updated;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Change the content a job delivers. A live trigger is re-armed with the
     * new snapshot so the next firing picks it up; a one-time job that is
     * already firing still delivers the old content.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public Job editPayload(String jobId, String payload) throws PersistenceException {
        requireRunning();

        mutationLock.lock();
        try {
            Job updated = store.updatePayload(jobId, payload);
            if (registry.rearm(updated, orchestrator::fire)) {
                logger.info("Updated payload of job " + jobId + " and re-armed its trigger");
            }
            return updated;
        } finally {
            mutationLock.unlock();
        }
    }

    public Job get(String jobId) throws PersistenceException {
        return store.get(jobId);
    }

    public List<Job> list(Boolean active, String target, int limit, int offset) throws PersistenceException {
        return store.list(active, target, limit, offset);
    }

    /**
     * @return the number of live triggers
     */
    public int countActive() {
        return registry.count();
    }

    public boolean isArmed(String jobId) {
        return registry.isArmed(jobId);
    }

    /**
     * @return one entry per live trigger: job id and schedule kind
     */
    public List<ActiveJob> listActive() {
        return registry.snapshot();
    }

    /**
     * Release every trigger and stop the timer. Jobs stay active in the store
     * and are re-armed by the next {@link #start()}.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down scheduler engine...");

        mutationLock.lock();
        try {
            int released = registry.disarmAll();
            logger.info("Released " + released + " triggers");
        } finally {
            mutationLock.unlock();
        }
        registry.getTrigger().shutdown();
        logger.info("Scheduler engine shutdown complete");
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    ExecutionOrchestrator getOrchestrator() {
        return orchestrator;
    }

    // Called on a firing thread after a one-time job has been delivered (or failed to be)
    private void retireOneTime(Job job, TriggerHandle handle) {
        mutationLock.lock();
        try {
            if (!registry.disarmIfCurrent(job.getId(), handle)) {
                logger.fine("Job " + job.getId() + " was cancelled or rescheduled while firing; not retiring it");
                return;
            }
            try {
                store.setActive(job.getId(), false);
                logger.info("One-time job " + job.getId() + " retired");
            } catch (PersistenceException | RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to deactivate one-time job " + job.getId(), e);
            }
        } finally {
            mutationLock.unlock();
        }
    }

    private void armJob(Job job) {
        registry.arm(job, orchestrator::fire);
    }

    private void validateSchedule(Schedule schedule) {
        if (schedule == null) {
            throw new InvalidScheduleException("A schedule is required");
        }
        if (schedule.getKind() == ScheduleKind.ONE_TIME) {
            Instant at = schedule.asOneTime().getAt();
            if (!at.isAfter(clock.instant())) {
                throw new InvalidScheduleException("Scheduled time must be in the future", at.toString());
            }
        } else {
            CronSchedules.executionTime(schedule.asRecurring());
        }
    }

    private void deactivateQuietly(String jobId) {
        try {
            store.setActive(jobId, false);
        } catch (PersistenceException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to deactivate job " + jobId, e);
        }
    }

    private void requireRunning() {
        if (!started.get()) {
            throw new IllegalStateException("Scheduler engine has not been started");
        }
        if (stopped.get()) {
            throw new IllegalStateException("Scheduler engine has been shut down");
        }
    }
}
