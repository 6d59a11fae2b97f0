package com.postqueue.db;

import com.postqueue.core.Job;
import com.postqueue.core.JobNotFoundException;
import com.postqueue.core.JobSpec;
import com.postqueue.core.PersistenceException;
import com.postqueue.core.Schedule;
import com.postqueue.core.ScheduleKind;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * JDBC-backed job store over the {@code scheduled_jobs} table.
 * All methods use PreparedStatement and try-with-resources for safe resource management.
 */
public class JdbcJobStore implements JobStore {
    private static final Logger logger = Logger.getLogger(JdbcJobStore.class.getName());

    private final Database database;
    private final Clock clock;

    public JdbcJobStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public JdbcJobStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public List<Job> loadActiveJobs() throws PersistenceException {
        String sql = "SELECT * FROM scheduled_jobs WHERE active = TRUE ORDER BY created_at ASC";
        List<Job> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                jobs.add(mapResultSetToJob(rs));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load active jobs", e);
        }

        logger.fine("Loaded " + jobs.size() + " active jobs");
        return jobs;
    }

    @Override
    public Job create(JobSpec spec) throws PersistenceException {
        String sql = "INSERT INTO scheduled_jobs (id, target, payload, schedule_kind, run_at, cron_expression, "
            + "time_zone, active, created_by, last_executed, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, TRUE, ?, NULL, ?, ?)";

        Instant now = clock.instant();
        Job job = Job.builder()
            .id(UUID.randomUUID().toString())
            .target(spec.getTarget())
            .payload(spec.getPayload())
            .schedule(spec.getSchedule())
            .active(true)
            .createdBy(spec.getCreatedBy())
            .createdAt(now)
            .updatedAt(now)
            .build();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, job.getId());
            stmt.setString(2, job.getTarget());
            stmt.setString(3, job.getPayload());
            bindSchedule(stmt, 4, job.getSchedule());
            stmt.setString(8, job.getCreatedBy());
            stmt.setObject(9, toOffset(now));
            stmt.setObject(10, toOffset(now));

            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to create job for target " + spec.getTarget(), e);
        }

        logger.fine("Created job " + job.getId());
        return job;
    }

    @Override
    public Job get(String id) throws PersistenceException {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    public Optional<Job> find(String id) throws PersistenceException {
        String sql = "SELECT * FROM scheduled_jobs WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToJob(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read job " + id, e);
        }
        return Optional.empty();
    }

    @Override
    public List<Job> list(Boolean active, String target, int limit, int offset) throws PersistenceException {
        StringBuilder sql = new StringBuilder("SELECT * FROM scheduled_jobs WHERE 1 = 1");
        if (active != null) {
            sql.append(" AND active = ?");
        }
        if (target != null) {
            sql.append(" AND target = ?");
        }
        sql.append(" ORDER BY created_at DESC LIMIT ? OFFSET ?");

        List<Job> jobs = new ArrayList<>();
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {

            int index = 1;
            if (active != null) {
                stmt.setBoolean(index++, active);
            }
            if (target != null) {
                stmt.setString(index++, target);
            }
            stmt.setInt(index++, limit);
            stmt.setInt(index, offset);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapResultSetToJob(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list jobs", e);
        }
        return jobs;
    }

    @Override
    public Job updateSchedule(String id, Schedule schedule) throws PersistenceException {
        return updateSchedule(id, schedule, null);
    }

    @Override
    public Job updateSchedule(String id, Schedule schedule, String payload) throws PersistenceException {
        String sql = "UPDATE scheduled_jobs SET schedule_kind = ?, run_at = ?, cron_expression = ?, time_zone = ?, "
            + "payload = COALESCE(?, payload), active = TRUE, updated_at = ? WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            bindSchedule(stmt, 1, schedule);
            stmt.setString(5, payload);
            stmt.setObject(6, toOffset(clock.instant()));
            stmt.setString(7, id);

            requireRow(stmt.executeUpdate(), id);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update schedule of job " + id, e);
        }
        return get(id);
    }

    @Override
    public Job updatePayload(String id, String payload) throws PersistenceException {
        String sql = "UPDATE scheduled_jobs SET payload = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, payload);
            stmt.setObject(2, toOffset(clock.instant()));
            stmt.setString(3, id);

            requireRow(stmt.executeUpdate(), id);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update payload of job " + id, e);
        }
        return get(id);
    }

    @Override
    public boolean setActive(String id, boolean active) throws PersistenceException {
        // Matching on the opposite flag makes the update count tell us whether anything changed
        String sql = "UPDATE scheduled_jobs SET active = ?, updated_at = ? WHERE id = ? AND active = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setBoolean(1, active);
            stmt.setObject(2, toOffset(clock.instant()));
            stmt.setString(3, id);
            stmt.setBoolean(4, !active);

            if (stmt.executeUpdate() == 1) {
                return true;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to set active=" + active + " on job " + id, e);
        }

        get(id);
        return false;
    }

    @Override
    public void markExecuted(String id, Instant executedAt) throws PersistenceException {
        String sql = "UPDATE scheduled_jobs SET last_executed = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setObject(1, toOffset(executedAt));
            stmt.setObject(2, toOffset(clock.instant()));
            stmt.setString(3, id);

            if (stmt.executeUpdate() == 0) {
                logger.warning("markExecuted: no job found with ID " + id);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to record execution time of job " + id, e);
        }
    }

    // Binds schedule_kind, run_at, cron_expression, time_zone starting at the given index
    private void bindSchedule(PreparedStatement stmt, int index, Schedule schedule) throws SQLException {
        stmt.setString(index, schedule.getKind().name());
        if (schedule.getKind() == ScheduleKind.ONE_TIME) {
            stmt.setObject(index + 1, toOffset(schedule.asOneTime().getAt()));
            stmt.setNull(index + 2, Types.VARCHAR);
            stmt.setNull(index + 3, Types.VARCHAR);
        } else {
            Schedule.Recurring recurring = schedule.asRecurring();
            stmt.setNull(index + 1, Types.TIMESTAMP_WITH_TIMEZONE);
            stmt.setString(index + 2, recurring.getCronExpression());
            stmt.setString(index + 3, recurring.getZone().getId());
        }
    }

    private void requireRow(int rowsUpdated, String id) {
        if (rowsUpdated == 0) {
            throw new JobNotFoundException(id);
        }
    }

    private Job mapResultSetToJob(ResultSet rs) throws SQLException {
        ScheduleKind kind = ScheduleKind.valueOf(rs.getString("schedule_kind"));
        Schedule schedule;
        if (kind == ScheduleKind.ONE_TIME) {
            schedule = Schedule.oneTime(toInstant(rs.getObject("run_at", OffsetDateTime.class)));
        } else {
            String zone = rs.getString("time_zone");
            schedule = Schedule.recurring(rs.getString("cron_expression"),
                zone != null ? ZoneId.of(zone) : Schedule.DEFAULT_ZONE);
        }

        return Job.builder()
            .id(rs.getString("id"))
            .target(rs.getString("target"))
            .payload(rs.getString("payload"))
            .schedule(schedule)
            .active(rs.getBoolean("active"))
            .createdBy(rs.getString("created_by"))
            .lastExecuted(toInstant(rs.getObject("last_executed", OffsetDateTime.class)))
            .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
            .updatedAt(toInstant(rs.getObject("updated_at", OffsetDateTime.class)))
            .build();
    }

    static OffsetDateTime toOffset(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
