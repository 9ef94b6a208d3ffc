package io.dicehall.runtime;

import io.dicehall.bus.BusEvents;
import io.dicehall.bus.NotificationBus;
import io.dicehall.game.GameEngine;
import io.dicehall.game.GameEngineRegistry;
import io.dicehall.game.GameState;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.observability.SessionAuditLog;
import io.dicehall.prompt.PromptChannel;
import io.dicehall.storage.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Moves an in_progress session to its terminal status exactly once.
 *
 * <p>The database part ({@link #finalizeLocked}) runs inside a transaction that already holds the
 * session lock. The side effects ({@link #afterCommit}) run only once that transaction has
 * committed: timer cancel, prompt removal, completion broadcast, audit. A failed broadcast is
 * logged; the committed terminal row stands.
 */
public final class Finalizer {
    private static final Logger log = LoggerFactory.getLogger(Finalizer.class);

    private final SessionStore store;
    private final GameEngineRegistry engines;
    private final NotificationBus bus;
    private final PromptChannel prompts;
    private final TurnTimeoutManager timers;
    private final SessionAuditLog audit;
    private final String workerId;

    public Finalizer(SessionStore store,
                     GameEngineRegistry engines,
                     NotificationBus bus,
                     PromptChannel prompts,
                     TurnTimeoutManager timers,
                     SessionAuditLog audit,
                     String workerId) {
        this.store = store;
        this.engines = engines;
        this.bus = bus;
        this.prompts = prompts;
        this.timers = timers;
        this.audit = audit;
        this.workerId = workerId;
    }

    /**
     * Finalizes in a transaction of its own.
     *
     * @param expectedTurnVersion when non-null, the session must still be on this turn
     */
    public FinalizeOutcome finalizeSession(String sessionId, SessionStatus status, Long expectedTurnVersion, String reason) {
        FinalizeOutcome outcome = store.inTransaction("finalize session " + sessionId, c -> {
            Optional<SessionRecord> row = store.lockSession(c, sessionId);
            if (row.isEmpty()) {
                return FinalizeOutcome.skipped(sessionId, "unknown session");
            }
            SessionRecord session = row.get();
            if (session.status() != SessionStatus.IN_PROGRESS) {
                store.recordConflict(c, "finalize_conflict", sessionId, workerId,
                        SessionStatus.IN_PROGRESS, expectedTurnVersion, session, reason);
                return FinalizeOutcome.skipped(sessionId, "already " + session.status().dbValue());
            }
            if (expectedTurnVersion != null && session.turnVersion() != expectedTurnVersion) {
                store.recordConflict(c, "finalize_stale_version", sessionId, workerId,
                        SessionStatus.IN_PROGRESS, expectedTurnVersion, session, reason);
                return FinalizeOutcome.skipped(sessionId, "turn moved to " + session.turnVersion());
            }
            return finalizeLocked(c, session, decodeOrNull(session), status, reason);
        });
        if (outcome.applied()) {
            afterCommit(outcome);
        } else {
            log.debug("Finalize of {} as {} skipped: {}", sessionId, status.dbValue(), outcome.reason());
        }
        return outcome;
    }

    /**
     * Writes the terminal row inside the caller's transaction. A payout that cannot be computed
     * turns the outcome into {@code error} with zero payout instead of failing the transaction.
     */
    public FinalizeOutcome finalizeLocked(Connection c, SessionRecord session, GameState state,
                                          SessionStatus status, String reason) throws SQLException {
        SessionStatus effective = status;
        String effectiveReason = reason;
        long payout = 0L;
        String stateJson = null;
        Optional<GameEngine> engine = engines.findByTag(session.archetype());
        try {
            if (engine.isPresent() && state != null) {
                stateJson = engine.get().encodeState(state);
            }
            if (status != SessionStatus.ERROR && status != SessionStatus.COMPLETED_TIMEOUT) {
                if (engine.isEmpty()) {
                    throw new IllegalStateException("unknown archetype " + session.archetype());
                }
                if (state == null) {
                    throw new IllegalStateException("no readable state to settle");
                }
                payout = engine.get().payout(session, state, status);
                if (payout < 0L) {
                    throw new IllegalStateException("negative payout " + payout);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Payout for session {} as {} failed, settling as error: {}",
                    session.sessionId(), status.dbValue(), e.toString());
            effective = SessionStatus.ERROR;
            payout = 0L;
            effectiveReason = reason + "; " + e.getMessage();
        }
        if (!store.writeTerminal(c, session.sessionId(), effective, payout, stateJson, System.currentTimeMillis())) {
            store.recordConflict(c, "finalize_conflict", session.sessionId(), workerId,
                    SessionStatus.IN_PROGRESS, session.turnVersion(), session, effectiveReason);
            return FinalizeOutcome.skipped(session.sessionId(), "terminal write matched no row");
        }
        return FinalizeOutcome.applied(session, effective, payout, effectiveReason);
    }

    public void afterCommit(FinalizeOutcome outcome) {
        if (!outcome.applied()) {
            return;
        }
        timers.cancel(outcome.sessionId());
        if (outcome.promptHandle() != null) {
            try {
                prompts.deletePrompt(outcome.channelRef(), outcome.promptHandle());
            } catch (RuntimeException e) {
                log.warn("Failed to remove prompt {} for session {}: {}", outcome.promptHandle(), outcome.sessionId(), e.toString());
            }
        }
        try {
            bus.publish(BusEvents.SESSION_COMPLETED, BusEvents.encode(new BusEvents.SessionCompleted(
                    outcome.sessionId(),
                    outcome.status().dbValue(),
                    outcome.finalPayout(),
                    outcome.status().outcome()
            )));
        } catch (RuntimeException e) {
            log.warn("Completion of session {} committed but not broadcast: {}", outcome.sessionId(), e.toString());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", outcome.status().dbValue());
        details.put("final_payout", outcome.finalPayout());
        details.put("reason", outcome.reason());
        audit.logQuietly(SessionAuditLog.AuditEvent.of("session.finalize", outcome.sessionId(), "ok", details));
        log.info("Session {} finalized as {} paying {}", outcome.sessionId(), outcome.status().dbValue(), outcome.finalPayout());
    }

    private GameState decodeOrNull(SessionRecord session) {
        Optional<GameEngine> engine = engines.findByTag(session.archetype());
        if (engine.isEmpty() || session.stateJson() == null) {
            return null;
        }
        try {
            return engine.get().decodeState(session.stateJson());
        } catch (IllegalStateException e) {
            log.warn("Session {} has an unreadable state document: {}", session.sessionId(), e.getMessage());
            return null;
        }
    }

    public record FinalizeOutcome(
            boolean applied,
            String sessionId,
            SessionStatus status,
            long finalPayout,
            String reason,
            String channelRef,
            String promptHandle
    ) {
        static FinalizeOutcome applied(SessionRecord session, SessionStatus status, long payout, String reason) {
            return new FinalizeOutcome(true, session.sessionId(), status, payout, reason,
                    session.channelRef(), session.promptHandle());
        }

        static FinalizeOutcome skipped(String sessionId, String reason) {
            return new FinalizeOutcome(false, sessionId, null, 0L, reason, null, null);
        }
    }
}
