package com.postqueue.app;

import com.postqueue.db.Database;
import com.postqueue.db.HistoryRecorder;
import com.postqueue.db.JdbcHistoryRecorder;
import com.postqueue.db.JdbcJobStore;
import com.postqueue.db.JobStore;
import com.postqueue.dispatch.WebhookDispatcher;
import com.postqueue.engine.SchedulerEngine;
import com.postqueue.engine.TimerTrigger;
import com.postqueue.engine.TriggerRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Main application entry point for the post scheduler.
 * Initializes storage, reconciles triggers from the job store, and starts the
 * HTTP control surface.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static Database database;
    private static WebhookDispatcher dispatcher;
    private static SchedulerEngine engine;
    private static ControlServer controlServer;
    private static final CountDownLatch stopped = new CountDownLatch(1);

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Post Scheduler Starting ===");

        try {
            SchedulerConfig config = SchedulerConfig.load();
            Clock clock = Clock.systemUTC();

            // 1. Initialize Database
            initializeDatabase(config);

            JobStore store = new JdbcJobStore(database, clock);
            HistoryRecorder history = new JdbcHistoryRecorder(database);

            // 2. Reconcile triggers and start the engine
            initializeEngine(config, store, history, clock);

            // 3. Control surface
            HealthService healthService = new HealthService(engine, history, clock,
                Duration.ofHours(config.getFailureWindowHours()), config.getFailureWarnThreshold(),
                dispatcher.getWebhookCount());
            initializeControlServer(config, history, healthService, clock);

            // 4. Add shutdown hook for graceful shutdown
            addShutdownHook();

            logger.info("=== Post Scheduler is running ===");
            logger.info("Press Ctrl+C to stop");

            // Trigger threads are daemons; park the main thread until shutdown
            stopped.await();

        } catch (InterruptedException e) {
            logger.info("Main thread interrupted");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
        }
    }

    private static void configureLogging() {
        try (InputStream is = Main.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties; using JVM defaults", e);
        }
    }

    /**
     * Initialize the database and create schema.
     */
    private static void initializeDatabase(SchedulerConfig config) {
        try {
            logger.info("Initializing database...");
            database = new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword(),
                config.getDbPoolSize());
            database.initialize();
            logger.info("Database initialized successfully");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize database", e);
            throw new RuntimeException("Database initialization failed", e);
        }
    }

    /**
     * Build the engine and re-arm every active job from storage.
     */
    private static void initializeEngine(SchedulerConfig config, JobStore store, HistoryRecorder history,
                                         Clock clock) {
        logger.info("Initializing scheduler with " + config.getDispatchThreads() + " firing threads...");
        dispatcher = new WebhookDispatcher(config.getWebhooks(), config.getWebhookUsername(),
            config.getWebhookTimeout(), clock);
        logger.info(dispatcher.getWebhookCount() + " webhook targets configured: " + config.getWebhooks().keySet());

        TriggerRegistry registry = new TriggerRegistry(new TimerTrigger(config.getDispatchThreads(), clock));
        engine = new SchedulerEngine(store, history, dispatcher, registry, clock);

        int armed = engine.start();
        logger.info("Scheduler started with " + armed + " active triggers");
    }

    /**
     * Initialize and start the control HTTP server.
     */
    private static void initializeControlServer(SchedulerConfig config, HistoryRecorder history,
                                                HealthService healthService, Clock clock) {
        try {
            controlServer = new ControlServer(engine, history, healthService, clock, config.getControlPort());
            controlServer.start();
            logger.info("Control surface available at http://localhost:" + controlServer.getPort() + "/schedules");
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to start control server", e);
            throw new RuntimeException("Control server initialization failed", e);
        }
    }

    /**
     * Add a shutdown hook to gracefully stop all components.
     */
    private static void addShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received ===");

            if (controlServer != null) {
                try {
                    controlServer.stop();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error shutting down control server", e);
                }
            }

            if (engine != null) {
                try {
                    engine.shutdown();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error shutting down scheduler", e);
                }
            }

            if (database != null) {
                try {
                    logger.info("Closing database connections...");
                    database.close();
                    logger.info("Database closed");
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing database", e);
                }
            }

            stopped.countDown();
            logger.info("=== Post Scheduler Stopped ===");
        }, "Shutdown-Hook"));

        logger.info("Shutdown hook registered");
    }
}
