package io.dropwatch.storage;

import io.dropwatch.config.DropWatchConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "dropwatch.schema.migration.v1";
    private final DropWatchConfig config;
    private final String jdbcUrl;

    public Database(DropWatchConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
            st.execute("PRAGMA foreign_keys=ON");
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.buildsRoot());
            Files.createDirectories(config.learningsRoot());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.reportsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS builds (
                        slug TEXT PRIMARY KEY,
                        title TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL,
                        status_reason TEXT,
                        lease_holder TEXT,
                        lease_expires_at_ms INTEGER NOT NULL DEFAULT 0,
                        lease_acquired_at_ms INTEGER,
                        circuit_open INTEGER NOT NULL DEFAULT 0,
                        circuit_open_until_ms INTEGER NOT NULL DEFAULT 0,
                        circuit_open_reason TEXT,
                        started_at_ms INTEGER,
                        last_progress_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        archived_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS waves (
                        slug TEXT NOT NULL,
                        wave TEXT NOT NULL,
                        position INTEGER NOT NULL,
                        PRIMARY KEY(slug, wave),
                        FOREIGN KEY(slug) REFERENCES builds(slug)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS drops (
                        slug TEXT NOT NULL,
                        drop_id TEXT NOT NULL,
                        wave TEXT NOT NULL,
                        wave_position INTEGER NOT NULL DEFAULT 0,
                        stream INTEGER NOT NULL DEFAULT 0,
                        stream_order INTEGER NOT NULL DEFAULT 0,
                        blocking INTEGER NOT NULL DEFAULT 1,
                        status TEXT NOT NULL,
                        failure_kind TEXT,
                        failure_reason TEXT,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        retry_note TEXT,
                        started_at_ms INTEGER,
                        worker_handle TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(slug, drop_id),
                        FOREIGN KEY(slug) REFERENCES builds(slug)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS drop_dependencies (
                        slug TEXT NOT NULL,
                        drop_id TEXT NOT NULL,
                        depends_on TEXT NOT NULL,
                        PRIMARY KEY(slug, drop_id, depends_on),
                        FOREIGN KEY(slug) REFERENCES builds(slug)
                    )
                    """);
            ensureDropColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS spawn_failures (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        slug TEXT NOT NULL,
                        drop_id TEXT,
                        reason TEXT NOT NULL,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS lease_conflicts (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        event_type TEXT NOT NULL,
                        slug TEXT NOT NULL,
                        drop_id TEXT,
                        requested_holder TEXT,
                        actual_holder TEXT,
                        actual_expires_at_ms INTEGER,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS recovery_actions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        slug TEXT NOT NULL,
                        drop_id TEXT NOT NULL,
                        rule TEXT NOT NULL,
                        action TEXT NOT NULL,
                        failure_kind TEXT,
                        reason TEXT NOT NULL,
                        holder TEXT,
                        applied INTEGER NOT NULL DEFAULT 0,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_builds_status ON builds(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_drops_slug_status ON drops(slug, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_spawn_failures_slug_time ON spawn_failures(slug, occurred_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_lease_conflicts_slug_time ON lease_conflicts(slug, occurred_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_recovery_actions_slug_time ON recovery_actions(slug, occurred_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureDropColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(drops)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("retry_note")) {
                st.execute("ALTER TABLE drops ADD COLUMN retry_note TEXT");
            }
            if (!columns.contains("wave_position")) {
                st.execute("ALTER TABLE drops ADD COLUMN wave_position INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_build_lease_indexes",
                "Index lease expiry and archived builds",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_builds_lease_expiry ON builds(lease_expires_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_builds_archived ON builds(archived_at_ms)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_drop_dependency_lookup",
                "Index reverse dependency lookups",
                List.of("CREATE INDEX IF NOT EXISTS idx_drop_dependencies_target ON drop_dependencies(slug, depends_on)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
