package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Optional;

public class JdbcOverrideStore implements OverrideStore {
    private final Database database;

    public JdbcOverrideStore(@NotNull Database database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    @Override
    public void ensureSchema() throws StorageException {
        String sql = """
            CREATE TABLE IF NOT EXISTS scheduler_overrides (
              source TEXT NOT NULL,
              name TEXT NOT NULL,
              override_schedule TEXT NOT NULL,
              updated_at INTEGER NOT NULL,
              PRIMARY KEY (source, name)
            )
            """;
        try (Connection c = database.getConnection(); Statement st = c.createStatement()) {
            st.executeUpdate(sql);
        } catch (SQLException e) {
            throw new StorageException("Failed to create scheduler_overrides table", e);
        }
    }

    @Override
    public @NotNull Optional<String> getOverride(@NotNull String source, @NotNull String name) throws StorageException {
        String sql = "SELECT override_schedule FROM scheduler_overrides WHERE source=? AND name=?";
        try (Connection c = database.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setString(1, source);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                String schedule = rs.getString(1);
                return (schedule == null || schedule.isBlank()) ? Optional.empty() : Optional.of(schedule);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read override for " + source + ":" + name, e);
        }
    }

    @Override
    public void upsertOverride(@NotNull String source, @NotNull String name, @NotNull String overrideSchedule) throws StorageException {
        String sql = """
            INSERT INTO scheduler_overrides (source, name, override_schedule, updated_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(source, name) DO UPDATE SET
              override_schedule = excluded.override_schedule,
              updated_at = excluded.updated_at
            """;
        try (Connection c = database.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setString(1, source);
            ps.setString(2, name);
            ps.setString(3, overrideSchedule);
            ps.setLong(4, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to save override for " + source + ":" + name, e);
        }
    }

    @Override
    public void deleteOverride(@NotNull String source, @NotNull String name) throws StorageException {
        String sql = "DELETE FROM scheduler_overrides WHERE source=? AND name=?";
        try (Connection c = database.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(Database.QUERY_TIMEOUT_SECONDS);
            ps.setString(1, source);
            ps.setString(2, name);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to delete override for " + source + ":" + name, e);
        }
    }
}
