package com.postqueue.engine;

import com.postqueue.core.DeliveryException;
import com.postqueue.core.DeliveryReceipt;
import com.postqueue.core.ExecutionRecord;
import com.postqueue.core.Job;
import com.postqueue.db.HistoryRecorder;
import com.postqueue.db.JobStore;
import com.postqueue.dispatch.Dispatcher;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one firing: deliver, record, update the job, retire one-time jobs.
 *
 * <p><b>Firing sequence:</b></p>
 * <ol>
 *   <li>Capture the firing time {@code t0}</li>
 *   <li>Call the dispatcher with the snapshot's target and payload</li>
 *   <li>Append an execution record, success or failure</li>
 *   <li>Set the job's {@code last_executed = t0}</li>
 *   <li>One-time jobs: hand off to the retirement hook, which deactivates the
 *       job and releases its trigger</li>
 * </ol>
 *
 * <p><b>Error Handling Strategy:</b> nothing escapes {@link #fire}. Delivery
 * failures become failed records and are not retried. Persistence failures are
 * logged, and each step still runs, so a history outage does not stop the job
 * update and a job update failure does not lose the history entry.</p>
 *
 * <p><b>Overlap:</b> the in-flight guard is per trigger handle. If a cron
 * handle is still firing when its next tick arrives, the tick is skipped and
 * logged. A handle armed by a reschedule is a different handle, so it fires
 * even while the released one is still delivering; a one-time handle only
 * fires once and must never be dropped.</p>
 *
 * @see SchedulerEngine
 */
public class ExecutionOrchestrator {
    private static final Logger logger = Logger.getLogger(ExecutionOrchestrator.class.getName());

    /**
     * Called after a one-time job fired, with the handle that fired it.
     */
    @FunctionalInterface
    public interface RetirementHook {
        void retire(Job job, TriggerHandle handle);
    }

    private final Dispatcher dispatcher;
    private final HistoryRecorder history;
    private final JobStore store;
    private final Clock clock;
    private final RetirementHook retirementHook;
    private final Set<TriggerHandle> inFlight = Collections.newSetFromMap(new ConcurrentHashMap<>());

    public ExecutionOrchestrator(Dispatcher dispatcher, HistoryRecorder history, JobStore store,
                                 Clock clock, RetirementHook retirementHook) {
        this.dispatcher = dispatcher;
        this.history = history;
        this.store = store;
        this.clock = clock;
        this.retirementHook = retirementHook;
    }

    /**
     * Fire a job once.
     *
     * @param job the snapshot the trigger was armed with
     * @param handle the handle that fired
     * @return the execution record written (or attempted), or null if the
     *         firing was skipped because the same handle was already in flight
     */
    public ExecutionRecord fire(Job job, TriggerHandle handle) {
        String jobId = job.getId();
        if (!inFlight.add(handle)) {
            logger.warning("Job " + jobId + " is still firing; skipping overlapping tick of " + handle);
            return null;
        }

        try {
            Instant firedAt = clock.instant();
            logger.info("Firing job " + jobId + " to target " + job.getTarget());

            ExecutionRecord record = deliver(job, firedAt);
            append(record);
            markExecuted(jobId, firedAt);

            if (job.getKind().isSelfRetiring()) {
                try {
                    retirementHook.retire(job, handle);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to retire one-time job " + jobId, e);
                }
            }
            return record;
        } finally {
            inFlight.remove(handle);
        }
    }

    public boolean isInFlight(TriggerHandle handle) {
        return inFlight.contains(handle);
    }

    private ExecutionRecord deliver(Job job, Instant firedAt) {
        try {
            DeliveryReceipt receipt = dispatcher.deliver(job.getTarget(), job.getPayload());
            logger.info("Delivered job " + job.getId() + " (receipt " + (receipt != null ? receipt.getMessageId() : "none") + ")");
            return ExecutionRecord.success(job, firedAt, receipt);
        } catch (DeliveryException e) {
            logger.warning("Delivery failed for job " + job.getId() + ": " + e.getMessage());
            return ExecutionRecord.failure(job, firedAt, e.getMessage());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Dispatcher error for job " + job.getId(), e);
            return ExecutionRecord.failure(job, firedAt, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void append(ExecutionRecord record) {
        try {
            history.append(record);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to record execution history: " + record, e);
        }
    }

    private void markExecuted(String jobId, Instant firedAt) {
        try {
            store.markExecuted(jobId, firedAt);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to update last execution time of job " + jobId, e);
        }
    }
}
