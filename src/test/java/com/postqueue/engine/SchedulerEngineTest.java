package com.postqueue.engine;

import com.postqueue.core.DeliveryReceipt;
import com.postqueue.core.ExecutionRecord;
import com.postqueue.core.InvalidScheduleException;
import com.postqueue.core.Job;
import com.postqueue.core.JobNotFoundException;
import com.postqueue.core.JobSpec;
import com.postqueue.core.PersistenceException;
import com.postqueue.core.Schedule;
import com.postqueue.core.ScheduleKind;
import com.postqueue.db.Database;
import com.postqueue.db.JdbcHistoryRecorder;
import com.postqueue.db.JdbcJobStore;
import com.postqueue.db.TestDatabases;
import com.postqueue.dispatch.Dispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class SchedulerEngineTest {

    private static final Instant NOW = Instant.parse("2026-04-01T12:00:00Z");

    private Database database;
    private JdbcJobStore store;
    private JdbcHistoryRecorder history;
    private ScriptedDispatcher dispatcher;
    private MutableClock clock;
    private ManualTrigger trigger;
    private TriggerRegistry registry;
    private SchedulerEngine engine;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.inMemory();
        clock = new MutableClock(NOW);
        store = new JdbcJobStore(database, clock);
        history = new JdbcHistoryRecorder(database);
        dispatcher = new ScriptedDispatcher();
        trigger = new ManualTrigger();
        engine = newEngine(trigger, dispatcher);
        engine.start();
    }

    @AfterEach
    public void tearDown() {
        engine.shutdown();
        database.close();
    }

    private SchedulerEngine newEngine(ManualTrigger manualTrigger, Dispatcher dispatcher) {
        registry = new TriggerRegistry(manualTrigger);
        return new SchedulerEngine(store, history, dispatcher, registry, clock);
    }

    /** Simulates a process restart over the same database. */
    private ManualTrigger restart() {
        engine.shutdown();
        ManualTrigger restarted = new ManualTrigger();
        engine = newEngine(restarted, dispatcher);
        engine.start();
        return restarted;
    }

    private Job addRecurring(String payload) throws Exception {
        return engine.add(new JobSpec("news", payload, Schedule.recurring("*/5 * * * *"), "tester"));
    }

    private Job addOneTime(String payload, Duration fromNow) throws Exception {
        return engine.add(new JobSpec("news", payload, Schedule.oneTime(clock.instant().plus(fromNow)), "tester"));
    }

    @Test
    public void mutationsBeforeStartAreRejected() {
        SchedulerEngine notStarted = newEngine(new ManualTrigger(), dispatcher);

        assertThrows(IllegalStateException.class,
            () -> notStarted.add(new JobSpec("news", "x", Schedule.recurring("* * * * *"))));
        assertThrows(IllegalStateException.class, () -> notStarted.cancel("any"));
    }

    @Test
    public void addArmsExactlyOneTrigger() throws Exception {
        Job job = addRecurring("weekly digest");

        assertTrue(job.isActive());
        assertEquals(1, engine.countActive());
        assertTrue(engine.isArmed(job.getId()));

        List<ActiveJob> active = engine.listActive();
        assertEquals(1, active.size());
        assertEquals(job.getId(), active.get(0).getJobId());
        assertEquals(ScheduleKind.RECURRING, active.get(0).getKind());
    }

    @Test
    public void addRejectsInvalidSchedulesWithoutPersisting() throws Exception {
        assertThrows(InvalidScheduleException.class,
            () -> engine.add(new JobSpec("news", "x", Schedule.recurring("every tuesday"))));
        assertThrows(InvalidScheduleException.class,
            () -> engine.add(new JobSpec("news", "x", Schedule.oneTime(NOW.minusSeconds(1)))));
        assertThrows(IllegalArgumentException.class,
            () -> engine.add(new JobSpec(" ", "x", Schedule.recurring("* * * * *"))));

        assertTrue(store.list(null, null, 100, 0).isEmpty());
        assertEquals(0, engine.countActive());
    }

    @Test
    public void oneTimeJobFiresOnceThenRetires() throws Exception {
        Job job = addOneTime("launch day", Duration.ofMinutes(1));

        assertEquals(0, trigger.fireDue(clock.instant()));
        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, trigger.fireDue(clock.instant()));
        assertEquals(0, trigger.fireDue(clock.instant()));

        List<ExecutionRecord> records = history.forJob(job.getId(), 10);
        assertEquals(1, records.size());
        assertTrue(records.get(0).isSuccess());

        Job stored = store.get(job.getId());
        assertFalse(stored.isActive());
        assertEquals(clock.instant(), stored.getLastExecuted());
        assertEquals(0, engine.countActive());
    }

    @Test
    public void cancelIsIdempotentAndStopsFirings() throws Exception {
        Job job = addRecurring("status");
        assertEquals(1, trigger.fireDue(clock.instant()));

        assertTrue(engine.cancel(job.getId()));
        assertFalse(engine.cancel(job.getId()));

        assertFalse(store.get(job.getId()).isActive());
        assertEquals(0, engine.countActive());
        assertEquals(0, trigger.fireDue(clock.instant()));
        assertEquals(1, dispatcher.deliveryCount());
    }

    @Test
    public void cancelUnknownJobIsNotFound() {
        assertThrows(JobNotFoundException.class, () -> engine.cancel("no-such-job"));
    }

    @Test
    public void rescheduleFromCronToOneTimeYieldsSingleRecord() throws Exception {
        Job job = addRecurring("switching");

        Job updated = engine.reschedule(job.getId(), Schedule.oneTime(NOW.plus(Duration.ofHours(1))));

        assertEquals(ScheduleKind.ONE_TIME, updated.getKind());
        assertEquals(1, trigger.liveCount());
        assertEquals(0, trigger.fireDue(clock.instant()));

        clock.advance(Duration.ofHours(1));
        assertEquals(1, trigger.fireDue(clock.instant()));
        assertEquals(1, history.forJob(job.getId(), 10).size());
        assertFalse(store.get(job.getId()).isActive());
    }

    @Test
    public void repeatedReschedulesNeverLeaveTwoTriggers() throws Exception {
        Job job = addRecurring("busy");

        engine.reschedule(job.getId(), Schedule.recurring("0 * * * *"));
        engine.reschedule(job.getId(), Schedule.oneTime(NOW.plusSeconds(30)));
        engine.reschedule(job.getId(), Schedule.recurring("15 10 * * *"));

        assertEquals(1, trigger.liveCount());
        assertEquals(1, engine.countActive());
        assertEquals(Schedule.recurring("15 10 * * *"), store.get(job.getId()).getSchedule());
    }

    @Test
    public void invalidRescheduleLeavesJobUntouched() throws Exception {
        Job job = addRecurring("stable");
        TriggerHandle before = registry.handleFor(job.getId());

        assertThrows(InvalidScheduleException.class,
            () -> engine.reschedule(job.getId(), Schedule.oneTime(NOW.minusSeconds(60))));
        assertThrows(InvalidScheduleException.class,
            () -> engine.reschedule(job.getId(), Schedule.recurring("99 * * * *")));

        assertNotNull(before);
        assertSame(before, registry.handleFor(job.getId()));
        assertEquals(job.getSchedule(), store.get(job.getId()).getSchedule());
    }

    @Test
    public void rescheduleReactivatesCancelledJob() throws Exception {
        Job job = addRecurring("back again");
        engine.cancel(job.getId());

        Job updated = engine.reschedule(job.getId(), Schedule.recurring("0 8 * * *"));

        assertTrue(updated.isActive());
        assertTrue(engine.isArmed(job.getId()));
    }

    @Test
    public void rescheduleUnknownJobIsNotFound() {
        assertThrows(JobNotFoundException.class,
            () -> engine.reschedule("ghost", Schedule.recurring("* * * * *")));
        assertEquals(0, trigger.getArmCount());
    }

    @Test
    public void deliveryFailureKeepsRecurringJobActive() throws Exception {
        Job job = addRecurring("flaky");
        dispatcher.alwaysFail();

        trigger.fireDue(clock.instant());
        trigger.fireDue(clock.instant());

        List<ExecutionRecord> records = history.forJob(job.getId(), 10);
        assertEquals(2, records.size());
        assertTrue(records.stream().noneMatch(ExecutionRecord::isSuccess));
        assertTrue(store.get(job.getId()).isActive());
        assertTrue(engine.isArmed(job.getId()));
    }

    @Test
    public void editPayloadIsUsedByNextFiring() throws Exception {
        Job job = addRecurring("draft");

        engine.editPayload(job.getId(), "final");
        trigger.fireDue(clock.instant());

        assertEquals("final", dispatcher.getDeliveries().get(0).payload);
        assertEquals(1, trigger.liveCount());
    }

    @Test
    public void updateChangesScheduleAndPayloadTogether() throws Exception {
        Job job = addRecurring("draft");

        Job updated = engine.update(job.getId(), Schedule.oneTime(NOW.plusSeconds(30)), "final");

        assertEquals("final", updated.getPayload());
        assertEquals(ScheduleKind.ONE_TIME, updated.getKind());
        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, trigger.fireDue(clock.instant()));
        assertEquals(1, dispatcher.deliveryCount());
        assertEquals("final", dispatcher.getDeliveries().get(0).payload);
        assertFalse(store.get(job.getId()).isActive());
    }

    @Test
    public void failedUpdateKeepsOldScheduleAndPayload() throws Exception {
        JdbcJobStore failing = new JdbcJobStore(database, clock) {
            @Override
            public Job updateSchedule(String id, Schedule schedule, String payload) throws PersistenceException {
                throw new PersistenceException("disk full");
            }
        };
        engine.shutdown();
        trigger = new ManualTrigger();
        registry = new TriggerRegistry(trigger);
        engine = new SchedulerEngine(failing, history, dispatcher, registry, clock);
        engine.start();
        Job job = engine.add(new JobSpec("news", "draft", Schedule.recurring("*/5 * * * *"), "tester"));

        assertThrows(PersistenceException.class,
            () -> engine.update(job.getId(), Schedule.oneTime(NOW.plusSeconds(30)), "final"));

        Job stored = store.get(job.getId());
        assertEquals("draft", stored.getPayload());
        assertEquals(ScheduleKind.RECURRING, stored.getKind());
        assertTrue(engine.isArmed(job.getId()));
        trigger.fireDue(clock.instant());
        assertEquals("draft", dispatcher.getDeliveries().get(0).payload);
    }

    @Test
    public void updateWithNothingToChangeIsRejected() throws Exception {
        Job job = addRecurring("draft");

        assertThrows(IllegalArgumentException.class, () -> engine.update(job.getId(), null, null));
    }

    @Test
    public void restartRearmsEveryActiveJob() throws Exception {
        Job recurring = addRecurring("daily");
        Job oneTime = addOneTime("later", Duration.ofHours(2));
        Job cancelled = addRecurring("gone");
        engine.cancel(cancelled.getId());

        ManualTrigger restarted = restart();

        assertEquals(2, engine.countActive());
        assertTrue(engine.isArmed(recurring.getId()));
        assertTrue(engine.isArmed(oneTime.getId()));
        assertFalse(engine.isArmed(cancelled.getId()));
        assertEquals(2, restarted.liveCount());
    }

    @Test
    public void oneTimeJobMissedWhileDownFiresAfterRestart() throws Exception {
        Job job = addOneTime("missed", Duration.ofMinutes(5));

        engine.shutdown();
        clock.advance(Duration.ofHours(3));
        ManualTrigger restarted = new ManualTrigger();
        engine = newEngine(restarted, dispatcher);
        assertEquals(1, engine.start());

        assertEquals(1, restarted.fireDue(clock.instant()));
        assertEquals(1, history.forJob(job.getId(), 10).size());
        assertFalse(store.get(job.getId()).isActive());
    }

    @Test
    public void reconciliationDeactivatesUnparseableCron() throws Exception {
        Job good = addRecurring("fine");
        // bypass engine validation to simulate a row written by an older version
        Job broken = store.create(new JobSpec("news", "broken", Schedule.recurring("not cron")));

        restart();

        assertEquals(1, engine.countActive());
        assertTrue(engine.isArmed(good.getId()));
        assertFalse(store.get(broken.getId()).isActive());
    }

    @Test
    public void reconciliationDeactivatesNonUtcCron() throws Exception {
        Job broken = store.create(new JobSpec("news", "local time",
            Schedule.recurring("30 2 * * *", ZoneId.of("Europe/Paris"))));

        restart();

        assertEquals(0, engine.countActive());
        assertFalse(store.get(broken.getId()).isActive());
        assertThrows(InvalidScheduleException.class,
            () -> engine.reschedule(broken.getId(), Schedule.recurring("30 2 * * *", ZoneId.of("Europe/Paris"))));
    }

    @Test
    public void unreadableStoreStartsEmpty() throws Exception {
        addRecurring("unreachable");
        engine.shutdown();
        database.close();

        engine = newEngine(new ManualTrigger(), dispatcher);

        assertEquals(0, engine.start());
        assertEquals(0, engine.countActive());
    }

    @Test
    public void rescheduleDuringFiringWinsOverRetirement() throws Exception {
        AtomicReference<Runnable> duringDelivery = new AtomicReference<>();
        Dispatcher racing = (target, payload) -> {
            Runnable action = duringDelivery.getAndSet(null);
            if (action != null) {
                action.run();
            }
            return new DeliveryReceipt("racing", clock.instant());
        };
        engine.shutdown();
        trigger = new ManualTrigger();
        engine = newEngine(trigger, racing);
        engine.start();

        Job job = addOneTime("first", Duration.ofMinutes(1));
        duringDelivery.set(() -> {
            try {
                engine.reschedule(job.getId(), Schedule.oneTime(clock.instant().plus(Duration.ofDays(1))));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, trigger.fireDue(clock.instant()));

        Job stored = store.get(job.getId());
        assertTrue(stored.isActive());
        assertTrue(engine.isArmed(job.getId()));
        assertEquals(clock.instant().plus(Duration.ofDays(1)), stored.getSchedule().asOneTime().getAt());
    }

    @Test
    public void rescheduledOneTimeDueDuringRunningDeliveryStillFiresAndRetires() throws Exception {
        AtomicReference<Runnable> duringDelivery = new AtomicReference<>();
        Dispatcher racing = (target, payload) -> {
            Runnable action = duringDelivery.getAndSet(null);
            if (action != null) {
                action.run();
            }
            return new DeliveryReceipt("racing", clock.instant());
        };
        engine.shutdown();
        trigger = new ManualTrigger();
        engine = newEngine(trigger, racing);
        engine.start();

        Job job = addRecurring("every tick");
        duringDelivery.set(() -> {
            try {
                engine.reschedule(job.getId(), Schedule.oneTime(clock.instant().plusSeconds(1)));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
            clock.advance(Duration.ofSeconds(1));
            TriggerHandle oneTime = registry.handleFor(job.getId());
            assertTrue(trigger.fire(oneTime));
        });

        assertEquals(1, trigger.fireDue(clock.instant()));

        List<ExecutionRecord> records = history.forJob(job.getId(), 10);
        assertEquals(2, records.size());
        assertFalse(store.get(job.getId()).isActive());
        assertFalse(engine.isArmed(job.getId()));
        assertEquals(0, engine.countActive());
    }

    @Test
    public void shutdownReleasesTriggersAndRejectsFurtherMutations() throws Exception {
        Job job = addRecurring("stopping");

        engine.shutdown();

        assertEquals(0, engine.countActive());
        assertTrue(trigger.isShutdown());
        assertFalse(engine.isRunning());
        assertThrows(IllegalStateException.class, () -> engine.cancel(job.getId()));
        assertTrue(store.get(job.getId()).isActive());
    }
}
