package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class JdbcTaskStore implements TaskStore {
    private static final String TASK_COLUMNS = "id,name,url,schedule,timeout_seconds,is_active";
    private static final String RUN_COLUMNS =
            "id,task_id,status,status_code,response_summary,error_message,duration_ms,started_at,completed_at";

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS scheduled_tasks (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              name TEXT NOT NULL,
              url TEXT NOT NULL,
              schedule TEXT NOT NULL,
              is_active INTEGER NOT NULL DEFAULT 1,
              timeout_seconds INTEGER NOT NULL DEFAULT 30,
              created_at INTEGER NOT NULL,
              updated_at INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS scheduled_task_runs (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              task_id INTEGER NOT NULL REFERENCES scheduled_tasks(id) ON DELETE CASCADE,
              status TEXT NOT NULL DEFAULT 'pending',
              status_code INTEGER,
              response_summary TEXT,
              error_message TEXT,
              duration_ms INTEGER,
              started_at INTEGER NOT NULL,
              completed_at INTEGER
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_task_runs_task_id ON scheduled_task_runs(task_id)",
            "CREATE INDEX IF NOT EXISTS idx_task_runs_started_at ON scheduled_task_runs(started_at)"
    );

    private final Database database;

    public JdbcTaskStore(@NotNull Database database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    @Override
    public void ensureSchema() throws StorageException {
        try (Connection c = database.getConnection(); Statement st = c.createStatement()) {
            for (String ddl : SCHEMA) {
                st.executeUpdate(ddl);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to create task tables", e);
        }
    }

    // ======== Tasks ========

    @Override
    public @NotNull List<ScheduledTask> listActiveTasks() throws StorageException {
        return queryTasks("SELECT " + TASK_COLUMNS + " FROM scheduled_tasks WHERE is_active=1 ORDER BY name");
    }

    @Override
    public @NotNull List<ScheduledTask> listTasks() throws StorageException {
        return queryTasks("SELECT " + TASK_COLUMNS + " FROM scheduled_tasks ORDER BY name");
    }

    private List<ScheduledTask> queryTasks(String sql) throws StorageException {
        List<ScheduledTask> out = new ArrayList<>();
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(mapTask(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list scheduled tasks", e);
        }
        return out;
    }

    @Override
    public @NotNull Optional<ScheduledTask> getTask(long id) throws StorageException {
        try (Connection c = database.getConnection()) {
            return findTask(c, id);
        } catch (SQLException e) {
            throw new StorageException("Failed to read scheduled task " + id, e);
        }
    }

    private Optional<ScheduledTask> findTask(Connection c, long id) throws SQLException {
        String sql = "SELECT " + TASK_COLUMNS + " FROM scheduled_tasks WHERE id=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public @NotNull ScheduledTask createTask(@NotNull String name, @NotNull String url, @NotNull String schedule,
                                             long timeoutSeconds, boolean active) throws StorageException {
        String sql = """
            INSERT INTO scheduled_tasks(name, url, schedule, is_active, timeout_seconds, created_at, updated_at)
            VALUES(?,?,?,?,?,?,?)
            """;
        long now = System.currentTimeMillis();
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setString(1, name);
            ps.setString(2, url);
            ps.setString(3, schedule);
            ps.setInt(4, active ? 1 : 0);
            ps.setLong(5, timeoutSeconds);
            ps.setLong(6, now);
            ps.setLong(7, now);
            ps.executeUpdate();

            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    return new ScheduledTask(rs.getLong(1), name, url, schedule, timeoutSeconds, active);
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to create scheduled task '" + name + "'", e);
        }
        throw new StorageException("Failed to obtain id of the new scheduled task");
    }

    @Override
    public @NotNull Optional<ScheduledTask> updateTask(long id, @NotNull String name, @NotNull String url,
                                                       @NotNull String schedule, long timeoutSeconds) throws StorageException {
        String sql = "UPDATE scheduled_tasks SET name=?, url=?, schedule=?, timeout_seconds=?, updated_at=? WHERE id=?";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setString(1, name);
            ps.setString(2, url);
            ps.setString(3, schedule);
            ps.setLong(4, timeoutSeconds);
            ps.setLong(5, System.currentTimeMillis());
            ps.setLong(6, id);
            if (ps.executeUpdate() == 0) return Optional.empty();
            return findTask(c, id);
        } catch (SQLException e) {
            throw new StorageException("Failed to update scheduled task " + id, e);
        }
    }

    @Override
    public @NotNull Optional<ScheduledTask> setTaskActive(long id, boolean active) throws StorageException {
        String sql = "UPDATE scheduled_tasks SET is_active=?, updated_at=? WHERE id=?";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setInt(1, active ? 1 : 0);
            ps.setLong(2, System.currentTimeMillis());
            ps.setLong(3, id);
            if (ps.executeUpdate() == 0) return Optional.empty();
            return findTask(c, id);
        } catch (SQLException e) {
            throw new StorageException("Failed to toggle scheduled task " + id, e);
        }
    }

    @Override
    public boolean deleteTask(long id) throws StorageException {
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM scheduled_tasks WHERE id=?")) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete scheduled task " + id, e);
        }
    }

    private static ScheduledTask mapTask(ResultSet rs) throws SQLException {
        return new ScheduledTask(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("url"),
                rs.getString("schedule"),
                rs.getLong("timeout_seconds"),
                rs.getInt("is_active") == 1
        );
    }

    // ======== Runs ========

    @Override
    public long createRun(long taskId, @NotNull Instant startedAt) throws StorageException {
        String sql = "INSERT INTO scheduled_task_runs(task_id, status, started_at) VALUES(?, 'pending', ?)";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setLong(1, taskId);
            ps.setLong(2, startedAt.toEpochMilli());
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to create run for task " + taskId, e);
        }
        throw new StorageException("Failed to obtain id of the new run for task " + taskId);
    }

    @Override
    public void finalizeRunSuccess(long runId, int statusCode, @NotNull String summary, long durationMs,
                                   @NotNull Instant completedAt) throws StorageException {
        String sql = """
            UPDATE scheduled_task_runs
            SET status='success', status_code=?, response_summary=?, duration_ms=?, completed_at=?
            WHERE id=? AND completed_at IS NULL
            """;
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setInt(1, statusCode);
            ps.setString(2, summary);
            ps.setLong(3, durationMs);
            ps.setLong(4, completedAt.toEpochMilli());
            ps.setLong(5, runId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to record success of run " + runId, e);
        }
    }

    @Override
    public void finalizeRunFailure(long runId, @NotNull String errorMessage, long durationMs,
                                   @NotNull Instant completedAt) throws StorageException {
        String sql = """
            UPDATE scheduled_task_runs
            SET status='failed', error_message=?, duration_ms=?, completed_at=?
            WHERE id=? AND completed_at IS NULL
            """;
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setString(1, errorMessage);
            ps.setLong(2, durationMs);
            ps.setLong(3, completedAt.toEpochMilli());
            ps.setLong(4, runId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to record failure of run " + runId, e);
        }
    }

    @Override
    public @NotNull Optional<TaskRun> getRun(long runId) throws StorageException {
        String sql = "SELECT " + RUN_COLUMNS + " FROM scheduled_task_runs WHERE id=?";
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRun(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read run " + runId, e);
        }
    }

    @Override
    public @NotNull List<TaskRun> listRuns(long taskId, int limit, int offset) throws StorageException {
        String sql = "SELECT " + RUN_COLUMNS + " FROM scheduled_task_runs WHERE task_id=? " +
                "ORDER BY started_at DESC, id DESC LIMIT ? OFFSET ?";
        List<TaskRun> out = new ArrayList<>();
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setLong(1, taskId);
            ps.setInt(2, limit);
            ps.setInt(3, offset);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(mapRun(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list runs of task " + taskId, e);
        }
        return out;
    }

    @Override
    public long countRuns(long taskId) throws StorageException {
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM scheduled_task_runs WHERE task_id=?")) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count runs of task " + taskId, e);
        }
    }

    @Override
    public int deleteRunsOlderThan(@NotNull Instant cutoff) throws StorageException {
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM scheduled_task_runs WHERE started_at < ?")) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setLong(1, cutoff.toEpochMilli());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to delete runs older than " + cutoff, e);
        }
    }

    private static TaskRun mapRun(ResultSet rs) throws SQLException {
        long completed = rs.getLong("completed_at");
        Instant completedAt = rs.wasNull() ? null : Instant.ofEpochMilli(completed);
        int code = rs.getInt("status_code");
        Integer statusCode = rs.wasNull() ? null : code;
        long duration = rs.getLong("duration_ms");
        Long durationMs = rs.wasNull() ? null : duration;
        return new TaskRun(
                rs.getLong("id"),
                rs.getLong("task_id"),
                TaskRun.Status.valueOf(rs.getString("status").toUpperCase(java.util.Locale.ROOT)),
                Instant.ofEpochMilli(rs.getLong("started_at")),
                completedAt,
                statusCode,
                rs.getString("response_summary"),
                rs.getString("error_message"),
                durationMs
        );
    }
}
