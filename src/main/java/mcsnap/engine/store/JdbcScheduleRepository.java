package mcsnap.engine.store;

import mcsnap.engine.error.NotFoundException;
import mcsnap.engine.error.StorageException;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.CronSchedule;
import mcsnap.engine.model.RetentionPolicy;
import mcsnap.engine.model.RunStatus;
import mcsnap.engine.model.Schedule;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ScheduleRepository.
 */
public class JdbcScheduleRepository implements ScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduleRepository.class);

    private final Database db;

    public JdbcScheduleRepository(Database db) {
        this.db = db;
    }

    @Override
    public void create(Schedule schedule) {
        String sql = """
                    INSERT INTO schedules (id, kind, server_name, name, cron_expression, enabled,
                                           retention_max_count, retention_max_age_days,
                                           last_run_at, last_run_status, last_run_message, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, schedule.id());
            ps.setString(2, schedule.kind().name());
            ps.setString(3, schedule.target().value());
            ps.setString(4, schedule.name());
            ps.setString(5, schedule.cron().expression());
            ps.setBoolean(6, schedule.enabled());
            setIntOrNull(ps, 7, schedule.retention().maxCount());
            setIntOrNull(ps, 8, schedule.retention().maxAgeDays());
            setTimestamp(ps, 9, schedule.lastRunAt());
            ps.setString(10, schedule.lastRunStatus() != null ? schedule.lastRunStatus().wire() : null);
            ps.setString(11, schedule.lastRunMessage());
            setTimestamp(ps, 12, schedule.createdAt() != null ? schedule.createdAt() : now);
            setTimestamp(ps, 13, schedule.updatedAt() != null ? schedule.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved schedule: {}", schedule.id());
        } catch (SQLException e) {
            throw new StorageException("Failed to save schedule: " + schedule.id(), e);
        }
    }

    @Override
    public List<Schedule> findAll() {
        return executeQuery("SELECT * FROM schedules ORDER BY created_at ASC, id ASC", null);
    }

    @Override
    public Optional<Schedule> findById(String id) {
        List<Schedule> rows = executeQuery("SELECT * FROM schedules WHERE id = ?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Schedule> findByTarget(String target) {
        return executeQuery("SELECT * FROM schedules WHERE server_name = ? ORDER BY created_at ASC, id ASC", target);
    }

    @Override
    public List<Schedule> findAllEnabled() {
        return executeQuery("SELECT * FROM schedules WHERE enabled = TRUE ORDER BY created_at ASC, id ASC", null);
    }

    @Override
    public void update(Schedule schedule) {
        String sql = """
                    UPDATE schedules
                    SET name = ?, cron_expression = ?, enabled = ?,
                        retention_max_count = ?, retention_max_age_days = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, schedule.name());
            ps.setString(2, schedule.cron().expression());
            ps.setBoolean(3, schedule.enabled());
            setIntOrNull(ps, 4, schedule.retention().maxCount());
            setIntOrNull(ps, 5, schedule.retention().maxAgeDays());
            setTimestamp(ps, 6, schedule.updatedAt() != null ? schedule.updatedAt() : Instant.now());
            ps.setString(7, schedule.id());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                throw NotFoundException.schedule(schedule.id());
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to update schedule: " + schedule.id(), e);
        }
    }

    @Override
    public boolean recordRun(String id, RunStatus status, String message) {
        String sql = """
                    UPDATE schedules
                    SET last_run_at = ?, last_run_status = ?, last_run_message = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setTimestamp(1, now);
            ps.setString(2, status.wire());
            ps.setString(3, truncate(message, 4096));
            ps.setTimestamp(4, now);
            ps.setString(5, id);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to record run for schedule: " + id, e);
        }
    }

    @Override
    public boolean delete(String id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM schedules WHERE id = ?")) {
            ps.setString(1, id);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete schedule: " + id, e);
        }
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }

    // --- Helpers ---

    private List<Schedule> executeQuery(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            if (param != null) {
                ps.setString(1, param);
            }
            List<Schedule> schedules = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    schedules.add(mapRow(rs));
                }
            }
            return schedules;
        } catch (SQLException e) {
            throw new StorageException("Failed to query schedules", e);
        }
    }

    private Schedule mapRow(ResultSet rs) throws SQLException {
        return Schedule.builder()
                .id(rs.getString("id"))
                .kind(ActionKind.valueOf(rs.getString("kind")))
                .target(TargetName.of(rs.getString("server_name")))
                .name(rs.getString("name"))
                .cron(CronSchedule.parse(rs.getString("cron_expression")))
                .enabled(rs.getBoolean("enabled"))
                .retention(new RetentionPolicy(getIntOrNull(rs, "retention_max_count"),
                        getIntOrNull(rs, "retention_max_age_days")))
                .lastRunAt(toInstant(rs.getTimestamp("last_run_at")))
                .lastRunStatus(RunStatus.fromWire(rs.getString("last_run_status")))
                .lastRunMessage(rs.getString("last_run_message"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static void setIntOrNull(PreparedStatement ps, int idx, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(idx, value);
        } else {
            ps.setNull(idx, Types.INTEGER);
        }
    }

    private static void setTimestamp(PreparedStatement ps, int idx, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(idx, Timestamp.from(instant));
        } else {
            ps.setNull(idx, Types.TIMESTAMP);
        }
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max)
            return s;
        return s.substring(0, max);
    }
}
