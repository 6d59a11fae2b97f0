package com.postqueue.app;

import com.postqueue.core.ExecutionRecord;
import com.postqueue.core.PersistenceException;
import com.postqueue.db.HistoryRecorder;
import com.postqueue.engine.SchedulerEngine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Summarizes scheduler health: how many triggers are live, how many webhook
 * targets are configured and how many deliveries failed recently.
 */
public class HealthService {
    private static final Logger logger = Logger.getLogger(HealthService.class.getName());

    private final SchedulerEngine engine;
    private final HistoryRecorder history;
    private final Clock clock;
    private final Duration failureWindow;
    private final int failureWarnThreshold;
    private final int webhooksActive;

    public HealthService(SchedulerEngine engine, HistoryRecorder history, Clock clock,
                         Duration failureWindow, int failureWarnThreshold, int webhooksActive) {
        this.engine = engine;
        this.history = history;
        this.clock = clock;
        this.failureWindow = failureWindow;
        this.failureWarnThreshold = failureWarnThreshold;
        this.webhooksActive = webhooksActive;
    }

    public HealthReport check() {
        Instant now = clock.instant();
        int activeTriggers = engine.countActive();

        try {
            List<ExecutionRecord> failures = history.failuresSince(now.minus(failureWindow));
            boolean warning = failures.size() > failureWarnThreshold;
            if (warning) {
                logger.warning("High failure rate: " + failures.size() + " failed deliveries in the last "
                    + failureWindow.toHours() + " hours");
            }
            return new HealthReport(true, activeTriggers, webhooksActive, failures.size(), warning, now, null);
        } catch (PersistenceException e) {
            logger.log(Level.SEVERE, "Health check could not read execution history", e);
            return new HealthReport(false, activeTriggers, webhooksActive, -1, true, now, e.getMessage());
        }
    }

    public static final class HealthReport {
        private final boolean healthy;
        private final int activeTriggers;
        private final int webhooksActive;
        private final int recentFailures;
        private final boolean warning;
        private final Instant lastCheck;
        private final String error;

        HealthReport(boolean healthy, int activeTriggers, int webhooksActive, int recentFailures,
                     boolean warning, Instant lastCheck, String error) {
            this.healthy = healthy;
            this.activeTriggers = activeTriggers;
            this.webhooksActive = webhooksActive;
            this.recentFailures = recentFailures;
            this.warning = warning;
            this.lastCheck = lastCheck;
            this.error = error;
        }

        public boolean isHealthy() { return healthy; }

        public int getActiveTriggers() { return activeTriggers; }

        public int getWebhooksActive() { return webhooksActive; }

        /** @return failures in the window, or -1 when history could not be read */
        public int getRecentFailures() { return recentFailures; }

        public boolean isWarning() { return warning; }

        public Instant getLastCheck() { return lastCheck; }

        public String getError() { return error; }
    }
}
