package io.dicehall.storage;

import io.dicehall.config.DiceHallConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * SQLite schema and connection factory. Every connection starts write transactions with
 * {@code BEGIN IMMEDIATE}, so a read-modify-write on a session row holds the database write lock
 * from its first statement until commit or rollback.
 */
public final class Database {
    private final DiceHallConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(DiceHallConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, config.busyTimeoutMs()));
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        this.connectionProperties = sqlite.toProperties();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.busRoot());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS game_sessions (
                        session_id TEXT PRIMARY KEY,
                        status TEXT NOT NULL,
                        archetype TEXT NOT NULL,
                        stake_amount INTEGER NOT NULL,
                        final_payout INTEGER NOT NULL DEFAULT 0,
                        state_json TEXT,
                        initiator_id TEXT NOT NULL,
                        initiator_name TEXT,
                        opponent_id TEXT,
                        opponent_name TEXT,
                        channel_ref TEXT,
                        worker_id TEXT,
                        turn_version INTEGER NOT NULL DEFAULT 0,
                        turn_deadline_ms INTEGER,
                        prompt_handle TEXT,
                        created_at_ms INTEGER NOT NULL,
                        claimed_at_ms INTEGER,
                        finalized_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS session_conflicts (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        event_type TEXT NOT NULL,
                        session_id TEXT,
                        worker_id TEXT,
                        expected_status TEXT,
                        expected_version INTEGER,
                        actual_status TEXT,
                        actual_worker_id TEXT,
                        actual_version INTEGER,
                        detail TEXT,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            // Terminal rows are frozen; an owned session never goes back to the claimable pool.
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_game_sessions_terminal_frozen
                    BEFORE UPDATE ON game_sessions
                    WHEN OLD.status NOT IN ('pending_claim', 'in_progress')
                    BEGIN
                        SELECT RAISE(ABORT, 'session is terminal');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_game_sessions_no_reopen
                    BEFORE UPDATE OF status ON game_sessions
                    WHEN OLD.status = 'in_progress' AND NEW.status = 'pending_claim'
                    BEGIN
                        SELECT RAISE(ABORT, 'session cannot return to pending_claim');
                    END
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_game_sessions_status_created ON game_sessions(status, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_game_sessions_status_deadline ON game_sessions(status, turn_deadline_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_session_conflicts_time ON session_conflicts(occurred_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_session_conflicts_session_time ON session_conflicts(session_id, occurred_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
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
