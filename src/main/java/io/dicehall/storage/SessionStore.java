package io.dicehall.storage;

import io.dicehall.model.NewSession;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row access for {@code game_sessions}. Methods taking a {@link Connection} join the caller's
 * transaction; use {@link #inTransaction} to open one. Every state transition is a conditional
 * update, so a lost race shows up as zero affected rows rather than a clobbered row.
 */
public final class SessionStore {
    private static final String SESSION_COLUMNS = """
            session_id,status,archetype,stake_amount,final_payout,state_json,
            initiator_id,initiator_name,opponent_id,opponent_name,channel_ref,
            worker_id,turn_version,turn_deadline_ms,prompt_handle,
            created_at_ms,claimed_at_ms,finalized_at_ms,updated_at_ms
            """;

    private final Database database;

    public SessionStore(Database database) {
        this.database = database;
    }

    @FunctionalInterface
    public interface TransactionWork<T> {
        T run(Connection c) throws Exception;
    }

    /**
     * Runs {@code work} in one IMMEDIATE transaction: commit on return, rollback on any exception.
     *
     * @throws StoreUnavailableException when the write lock stayed busy past the busy timeout
     */
    public <T> T inTransaction(String label, TransactionWork<T> work) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.run(c);
                // Commits without opening the next IMMEDIATE transaction, which could itself hit BUSY.
                c.setAutoCommit(true);
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            if (StoreUnavailableException.isTransient(e)) {
                throw new StoreUnavailableException("Store busy, cannot " + label, e);
            }
            throw new RuntimeException("Failed " + label, e);
        }
    }

    public boolean createPending(NewSession s, long nowMs) {
        String sql = """
                INSERT OR IGNORE INTO game_sessions(
                    session_id,status,archetype,stake_amount,final_payout,state_json,
                    initiator_id,initiator_name,opponent_id,opponent_name,channel_ref,
                    turn_version,created_at_ms,updated_at_ms
                ) VALUES(?,?,?,?,0,NULL,?,?,?,?,?,0,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, s.sessionId());
            ps.setString(2, SessionStatus.PENDING_CLAIM.dbValue());
            ps.setString(3, s.archetype());
            ps.setLong(4, s.stakeAmount());
            ps.setString(5, s.initiatorId());
            ps.setString(6, s.initiatorName());
            ps.setString(7, s.opponentId());
            ps.setString(8, s.opponentName());
            ps.setString(9, s.channelRef());
            ps.setLong(10, nowMs);
            ps.setLong(11, nowMs);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create session: " + s.sessionId(), e);
        }
    }

    /**
     * pending_claim to in_progress, bound to {@code workerId}, only if nobody got there first.
     * A lost race is recorded and reported, never thrown.
     */
    public ClaimGrant tryClaim(Connection c, String sessionId, String workerId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE game_sessions
                SET status=?,worker_id=?,claimed_at_ms=?,updated_at_ms=?
                WHERE session_id=? AND status=?
                """)) {
            ps.setString(1, SessionStatus.IN_PROGRESS.dbValue());
            ps.setString(2, workerId);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, sessionId);
            ps.setString(6, SessionStatus.PENDING_CLAIM.dbValue());
            if (ps.executeUpdate() == 0) {
                Optional<SessionRecord> actual = lockSession(c, sessionId);
                recordConflict(c, "claim_conflict", sessionId, workerId,
                        SessionStatus.PENDING_CLAIM, null, actual.orElse(null), null);
                return ClaimGrant.lost(actual.map(SessionRecord::status).orElse(null));
            }
        }
        return ClaimGrant.granted();
    }

    /**
     * Reads the row inside the caller's transaction. The IMMEDIATE transaction already holds the
     * write lock, so the row cannot change underneath until commit.
     */
    public Optional<SessionRecord> lockSession(Connection c, String sessionId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + SESSION_COLUMNS + " FROM game_sessions WHERE session_id=?")) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readSession(rs));
            }
        }
    }

    /**
     * Stores the next state and opens a new turn, fenced on the expected turn version.
     *
     * @return the new turn version, or -1 when the row moved on
     */
    public long writeTurn(Connection c, String sessionId, String stateJson, long expectedVersion,
                          long deadlineMs, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE game_sessions
                SET state_json=?,turn_version=turn_version+1,turn_deadline_ms=?,updated_at_ms=?
                WHERE session_id=? AND status=? AND turn_version=?
                """)) {
            ps.setString(1, stateJson);
            ps.setLong(2, deadlineMs);
            ps.setLong(3, nowMs);
            ps.setString(4, sessionId);
            ps.setString(5, SessionStatus.IN_PROGRESS.dbValue());
            ps.setLong(6, expectedVersion);
            if (ps.executeUpdate() == 0) {
                return -1L;
            }
            return expectedVersion + 1L;
        }
    }

    /**
     * Terminal status, payout and final state in one statement. Only an in_progress row qualifies.
     */
    public boolean writeTerminal(Connection c, String sessionId, SessionStatus status, long finalPayout,
                                 String stateJson, long nowMs) throws SQLException {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + status);
        }
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE game_sessions
                SET status=?,final_payout=?,state_json=COALESCE(?,state_json),
                    turn_version=turn_version+1,turn_deadline_ms=NULL,finalized_at_ms=?,updated_at_ms=?
                WHERE session_id=? AND status=?
                """)) {
            ps.setString(1, status.dbValue());
            ps.setLong(2, finalPayout);
            ps.setString(3, stateJson);
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            ps.setString(6, sessionId);
            ps.setString(7, SessionStatus.IN_PROGRESS.dbValue());
            return ps.executeUpdate() > 0;
        }
    }

    /**
     * Remembers the prompt for the given turn; ignored once the session has moved past that turn.
     */
    public boolean attachPromptHandle(String sessionId, long turnVersion, String handle, long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                UPDATE game_sessions SET prompt_handle=?,updated_at_ms=?
                WHERE session_id=? AND status=? AND turn_version=?
                """)) {
            ps.setString(1, handle);
            ps.setLong(2, nowMs);
            ps.setString(3, sessionId);
            ps.setString(4, SessionStatus.IN_PROGRESS.dbValue());
            ps.setLong(5, turnVersion);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to attach prompt handle: " + sessionId, e);
        }
    }

    public Optional<SessionRecord> getSession(String sessionId) {
        try (Connection c = database.openConnection()) {
            return lockSession(c, sessionId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read session: " + sessionId, e);
        }
    }

    /**
     * Oldest pending sessions first.
     */
    public List<SessionRecord> listClaimable(int limit) {
        return query("""
                SELECT %s FROM game_sessions
                WHERE status=?
                ORDER BY created_at_ms ASC, session_id ASC
                LIMIT ?
                """.formatted(SESSION_COLUMNS), SessionStatus.PENDING_CLAIM.dbValue(), Math.max(1, limit));
    }

    /**
     * In-progress sessions whose open turn expired before {@code cutoffMs}.
     */
    public List<SessionRecord> listOverdue(long cutoffMs, int limit) {
        return query("""
                SELECT %s FROM game_sessions
                WHERE status=? AND turn_deadline_ms IS NOT NULL AND turn_deadline_ms<?
                ORDER BY turn_deadline_ms ASC
                LIMIT ?
                """.formatted(SESSION_COLUMNS), SessionStatus.IN_PROGRESS.dbValue(), cutoffMs, Math.max(1, limit));
    }

    public List<SessionRecord> listSessions(String status, int limit, int offset) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        int safeOffset = Math.max(0, offset);
        if (status == null || status.isBlank()) {
            return query("""
                    SELECT %s FROM game_sessions
                    ORDER BY created_at_ms DESC, session_id DESC
                    LIMIT ? OFFSET ?
                    """.formatted(SESSION_COLUMNS), safeLimit, safeOffset);
        }
        return query("""
                SELECT %s FROM game_sessions
                WHERE status=?
                ORDER BY created_at_ms DESC, session_id DESC
                LIMIT ? OFFSET ?
                """.formatted(SESSION_COLUMNS), SessionStatus.fromDb(status).dbValue(), safeLimit, safeOffset);
    }

    public Map<String, Long> countByStatus() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (SessionStatus status : SessionStatus.values()) {
            out.put(status.dbValue(), 0L);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS c FROM game_sessions GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("status"), rs.getLong("c"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count sessions", e);
        }
    }

    public void recordConflict(Connection c,
                               String eventType,
                               String sessionId,
                               String workerId,
                               SessionStatus expectedStatus,
                               Long expectedVersion,
                               SessionRecord actual,
                               String detail) {
        String sql = """
                INSERT INTO session_conflicts(
                    event_type,session_id,worker_id,expected_status,expected_version,
                    actual_status,actual_worker_id,actual_version,detail,occurred_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, eventType);
            ps.setString(2, sessionId);
            ps.setString(3, workerId);
            ps.setString(4, expectedStatus == null ? null : expectedStatus.dbValue());
            if (expectedVersion == null) {
                ps.setObject(5, null);
            } else {
                ps.setLong(5, expectedVersion);
            }
            ps.setString(6, actual == null ? null : actual.status().dbValue());
            ps.setString(7, actual == null ? null : actual.workerId());
            if (actual == null) {
                ps.setObject(8, null);
            } else {
                ps.setLong(8, actual.turnVersion());
            }
            ps.setString(9, detail);
            ps.setLong(10, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record session conflict", e);
        }
    }

    public List<ConflictRow> listConflicts(int limit) {
        String sql = """
                SELECT id,event_type,session_id,worker_id,expected_status,expected_version,
                       actual_status,actual_worker_id,actual_version,detail,occurred_at_ms
                FROM session_conflicts
                ORDER BY occurred_at_ms DESC, id DESC
                LIMIT ?
                """;
        List<ConflictRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ConflictRow(
                            rs.getLong("id"),
                            rs.getString("event_type"),
                            rs.getString("session_id"),
                            rs.getString("worker_id"),
                            rs.getString("expected_status"),
                            nullableLong(rs, "expected_version"),
                            rs.getString("actual_status"),
                            rs.getString("actual_worker_id"),
                            nullableLong(rs, "actual_version"),
                            rs.getString("detail"),
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list session conflicts", e);
        }
    }

    private List<SessionRecord> query(String sql, Object... args) {
        List<SessionRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readSession(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query sessions", e);
        }
    }

    private SessionRecord readSession(ResultSet rs) throws SQLException {
        return new SessionRecord(
                rs.getString("session_id"),
                SessionStatus.fromDb(rs.getString("status")),
                rs.getString("archetype"),
                rs.getLong("stake_amount"),
                rs.getLong("final_payout"),
                rs.getString("state_json"),
                rs.getString("initiator_id"),
                rs.getString("initiator_name"),
                rs.getString("opponent_id"),
                rs.getString("opponent_name"),
                rs.getString("channel_ref"),
                rs.getString("worker_id"),
                rs.getLong("turn_version"),
                nullableLong(rs, "turn_deadline_ms"),
                rs.getString("prompt_handle"),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "claimed_at_ms"),
                nullableLong(rs, "finalized_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    public record ClaimGrant(boolean claimed, SessionStatus actualStatus) {
        public static ClaimGrant granted() {
            return new ClaimGrant(true, SessionStatus.IN_PROGRESS);
        }

        public static ClaimGrant lost(SessionStatus actualStatus) {
            return new ClaimGrant(false, actualStatus);
        }
    }

    public record ConflictRow(
            long id,
            String eventType,
            String sessionId,
            String workerId,
            String expectedStatus,
            Long expectedVersion,
            String actualStatus,
            String actualWorkerId,
            Long actualVersion,
            String detail,
            long occurredAtMs
    ) {
    }
}
