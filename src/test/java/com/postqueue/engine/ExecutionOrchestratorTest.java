package com.postqueue.engine;

import com.postqueue.core.ExecutionRecord;
import com.postqueue.core.Job;
import com.postqueue.core.JobSpec;
import com.postqueue.core.PersistenceException;
import com.postqueue.core.Schedule;
import com.postqueue.db.Database;
import com.postqueue.db.HistoryRecorder;
import com.postqueue.db.JdbcHistoryRecorder;
import com.postqueue.db.JdbcJobStore;
import com.postqueue.db.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutionOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-04-01T12:00:00Z");

    private Database database;
    private JdbcJobStore store;
    private JdbcHistoryRecorder history;
    private ScriptedDispatcher dispatcher;
    private MutableClock clock;
    private List<Job> retired;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.inMemory();
        clock = new MutableClock(NOW);
        store = new JdbcJobStore(database, clock);
        history = new JdbcHistoryRecorder(database);
        dispatcher = new ScriptedDispatcher();
        retired = new ArrayList<>();
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    private ExecutionOrchestrator orchestrator(HistoryRecorder recorder) {
        return new ExecutionOrchestrator(dispatcher, recorder, store, clock, (job, handle) -> retired.add(job));
    }

    @Test
    public void successfulFiringRecordsReceiptAndLastExecuted() throws Exception {
        Job job = store.create(new JobSpec("news", "hello", Schedule.recurring("* * * * *")));

        ExecutionRecord record = orchestrator(history).fire(job, new TriggerHandle(job.getSchedule()));

        assertTrue(record.isSuccess());
        assertEquals("msg-1", record.getReceiptId());
        assertEquals(NOW, record.getExecutedAt());
        assertEquals(1, history.forJob(job.getId(), 10).size());
        assertEquals(NOW, store.get(job.getId()).getLastExecuted());
        assertTrue(retired.isEmpty());
    }

    @Test
    public void deliveryFailureBecomesFailedRecord() throws Exception {
        Job job = store.create(new JobSpec("news", "hello", Schedule.recurring("* * * * *")));
        dispatcher.failNext("HTTP 404 unknown webhook");

        ExecutionRecord record = orchestrator(history).fire(job, new TriggerHandle(job.getSchedule()));

        assertFalse(record.isSuccess());
        assertEquals("HTTP 404 unknown webhook", record.getErrorMessage());
        assertNull(record.getReceiptId());
        assertEquals(NOW, store.get(job.getId()).getLastExecuted());
        assertTrue(store.get(job.getId()).isActive());
    }

    @Test
    public void unexpectedDispatcherErrorIsRecordedNotThrown() throws Exception {
        Job job = store.create(new JobSpec("news", "hello", Schedule.recurring("* * * * *")));
        dispatcher.crashNext(new IllegalStateException("boom"));

        ExecutionRecord record = orchestrator(history).fire(job, new TriggerHandle(job.getSchedule()));

        assertFalse(record.isSuccess());
        assertEquals("IllegalStateException: boom", record.getErrorMessage());
        assertEquals(1, history.recent(null, 10).size());
    }

    @Test
    public void historyOutageDoesNotStopJobUpdate() throws Exception {
        Job job = store.create(new JobSpec("news", "hello", Schedule.oneTime(NOW.plusSeconds(5))));
        HistoryRecorder broken = new HistoryRecorder() {
            @Override
            public void append(ExecutionRecord record) throws PersistenceException {
                throw new PersistenceException("history table locked");
            }

            @Override
            public List<ExecutionRecord> recent(String target, int limit) {
                return List.of();
            }

            @Override
            public List<ExecutionRecord> forJob(String jobId, int limit) {
                return List.of();
            }

            @Override
            public List<ExecutionRecord> failuresSince(Instant since) {
                return List.of();
            }
        };

        ExecutionRecord record = orchestrator(broken).fire(job, new TriggerHandle(job.getSchedule()));

        assertTrue(record.isSuccess());
        assertEquals(NOW, store.get(job.getId()).getLastExecuted());
        assertEquals(1, retired.size());
    }

    @Test
    public void oneTimeJobIsHandedToRetirement() throws Exception {
        Job job = store.create(new JobSpec("news", "once", Schedule.oneTime(NOW.plusSeconds(5))));

        orchestrator(history).fire(job, new TriggerHandle(job.getSchedule()));

        assertEquals(1, retired.size());
        assertEquals(job.getId(), retired.get(0).getId());
    }

    @Test
    public void overlappingTickOfSameHandleIsSkipped() throws Exception {
        Job job = store.create(new JobSpec("news", "slow", Schedule.recurring("* * * * *")));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutionOrchestrator orchestrator = new ExecutionOrchestrator((target, payload) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }, history, store, clock, (j, h) -> { });
        TriggerHandle handle = new TriggerHandle(job.getSchedule());

        Thread slow = new Thread(() -> orchestrator.fire(job, handle));
        slow.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(orchestrator.isInFlight(handle));
        assertNull(orchestrator.fire(job, handle));

        release.countDown();
        slow.join(5000);
        assertFalse(orchestrator.isInFlight(handle));
        assertEquals(1, history.forJob(job.getId(), 10).size());
    }

    @Test
    public void newHandleFiresWhileReleasedHandleIsStillDelivering() throws Exception {
        Job job = store.create(new JobSpec("news", "slow", Schedule.recurring("* * * * *")));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutionOrchestrator orchestrator = new ExecutionOrchestrator((target, payload) -> {
            if ("slow".equals(payload)) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return null;
        }, history, store, clock, (j, h) -> retired.add(j));
        TriggerHandle cronHandle = new TriggerHandle(job.getSchedule());

        Thread slow = new Thread(() -> orchestrator.fire(job, cronHandle));
        slow.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Job once = job.toBuilder()
            .schedule(Schedule.oneTime(NOW.plusSeconds(1)))
            .payload("now")
            .build();
        ExecutionRecord record = orchestrator.fire(once, new TriggerHandle(once.getSchedule()));

        assertNotNull(record);
        assertEquals(1, retired.size());

        release.countDown();
        slow.join(5000);
        assertEquals(2, history.forJob(job.getId(), 10).size());
    }
}
