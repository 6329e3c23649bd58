package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.base_exceptions.StorageException;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * JDBC connection source. A new connection is opened per operation; SQLite databases get
 * WAL journaling and foreign keys switched on.
 */
public final class Database {
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    /** Seconds a single statement may run before the driver aborts it. */
    static final int QUERY_TIMEOUT_SECONDS = 5;

    private final String url;
    private final boolean sqlite;

    public Database(@NotNull String url) {
        this.url = Objects.requireNonNull(url, "url");
        this.sqlite = url.startsWith(SQLITE_PREFIX);
    }

    public String getUrl() {
        return url;
    }

    public @NotNull Connection getConnection() throws StorageException {
        try {
            if (sqlite) ensureParentDir();
            Connection c = DriverManager.getConnection(url);
            if (sqlite) {
                try (Statement st = c.createStatement()) {
                    st.execute("PRAGMA journal_mode=WAL;");
                    st.execute("PRAGMA foreign_keys=ON;");
                    st.execute("PRAGMA busy_timeout=" + QUERY_TIMEOUT_SECONDS * 1000 + ";");
                } catch (SQLException e) {
                    c.close();
                    throw e;
                }
            }
            return c;
        } catch (SQLException e) {
            throw new StorageException("Failed to connect to " + url, e);
        }
    }

    private void ensureParentDir() throws StorageException {
        String file = url.substring(SQLITE_PREFIX.length());
        if (file.isEmpty() || file.startsWith(":memory:") || file.startsWith("file:")) return;
        Path parent = Path.of(file).toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory " + parent, e);
        }
    }
}
