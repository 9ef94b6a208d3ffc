package io.dicehall.runtime;

import io.dicehall.config.GameSettings;
import io.dicehall.game.GameEngine;
import io.dicehall.game.GameEngineRegistry;
import io.dicehall.game.GameState;
import io.dicehall.game.TurnResult;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;
import io.dicehall.observability.SessionAuditLog;
import io.dicehall.prompt.CurrencyFormatter;
import io.dicehall.prompt.PromptChannel;
import io.dicehall.prompt.PromptView;
import io.dicehall.storage.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Handles the two inbound events for one worker: a session became claimable, a player acted.
 * Both handlers are idempotent and safe to call any number of times for the same event.
 */
public final class SessionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    private final SessionStore store;
    private final GameEngineRegistry engines;
    private final Finalizer finalizer;
    private final TurnTimeoutManager timers;
    private final StoreRetrier retrier;
    private final PromptChannel prompts;
    private final CurrencyFormatter currency;
    private final SessionAuditLog audit;
    private final GameSettings settings;
    private final String workerId;

    public SessionCoordinator(SessionStore store,
                              GameEngineRegistry engines,
                              Finalizer finalizer,
                              TurnTimeoutManager timers,
                              StoreRetrier retrier,
                              PromptChannel prompts,
                              CurrencyFormatter currency,
                              SessionAuditLog audit,
                              GameSettings settings,
                              String workerId) {
        this.store = store;
        this.engines = engines;
        this.finalizer = finalizer;
        this.timers = timers;
        this.retrier = retrier;
        this.prompts = prompts;
        this.currency = currency;
        this.audit = audit;
        this.settings = settings;
        this.workerId = workerId;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Claims the session and opens its first turn in the same transaction. Losing the claim race
     * is the normal case for all but one worker and returns quietly.
     */
    public ClaimOutcome onClaimable(String sessionId) {
        long now = System.currentTimeMillis();
        Step step = store.inTransaction("claim session " + sessionId, c -> {
            SessionStore.ClaimGrant grant = store.tryClaim(c, sessionId, workerId, now);
            if (!grant.claimed()) {
                return Step.lost(grant.actualStatus());
            }
            SessionRecord session = store.lockSession(c, sessionId)
                    .orElseThrow(() -> new IllegalStateException("claimed session vanished: " + sessionId));
            Optional<GameEngine> engine = engines.findByTag(session.archetype());
            if (engine.isEmpty()) {
                return Step.finalized(finalizer.finalizeLocked(c, session, null, SessionStatus.ERROR,
                        "unknown archetype " + session.archetype()));
            }
            GameState initial;
            try {
                initial = engine.get().initialState(session);
            } catch (RuntimeException e) {
                return Step.finalized(finalizer.finalizeLocked(c, session, null, SessionStatus.ERROR,
                        "cannot start: " + e.getMessage()));
            }
            return openNextTurn(c, session, engine.get(), initial, now);
        });
        switch (step.kind()) {
            case LOST:
                log.debug("Claim of {} lost, session is {}", sessionId, step.lostTo());
                return new ClaimOutcome(ClaimOutcome.Kind.LOST, sessionId, step.lostTo());
            case FINALIZED:
                finalizer.afterCommit(step.finalized());
                return new ClaimOutcome(ClaimOutcome.Kind.FAILED, sessionId, step.finalized().status());
            case OPENED:
                audit.logQuietly(SessionAuditLog.AuditEvent.of("session.claim", sessionId, "ok",
                        Map.of("archetype", step.session().archetype())));
                log.info("Claimed session {} ({})", sessionId, step.session().archetype());
                promptTurn(step);
                return new ClaimOutcome(ClaimOutcome.Kind.CLAIMED, sessionId, SessionStatus.IN_PROGRESS);
            default:
                log.warn("Claim of {} ended without a terminal write: {}", sessionId, step.reason());
                return new ClaimOutcome(ClaimOutcome.Kind.FAILED, sessionId, null);
        }
    }

    /**
     * Applies one player action. Only the owning worker acts; everyone else ignores the event.
     */
    public TurnOutcome onTurnSubmitted(TurnAction action) {
        String sessionId = action.sessionId();
        long now = System.currentTimeMillis();
        Step step = store.inTransaction("advance session " + sessionId, c -> {
            Optional<SessionRecord> row = store.lockSession(c, sessionId);
            if (row.isEmpty()) {
                return Step.ignored("unknown session");
            }
            SessionRecord session = row.get();
            if (!workerId.equals(session.workerId())) {
                return Step.ignored("not owned by " + workerId);
            }
            if (session.status() != SessionStatus.IN_PROGRESS) {
                return reject(c, session, action, "session is " + session.status().dbValue());
            }
            if (action.turnVersion() != session.turnVersion()) {
                return reject(c, session, action, "stale turn version " + action.turnVersion()
                        + ", current " + session.turnVersion());
            }
            Optional<GameEngine> engine = engines.findByTag(session.archetype());
            if (engine.isEmpty()) {
                timers.cancel(sessionId);
                return Step.finalized(finalizer.finalizeLocked(c, session, null, SessionStatus.ERROR,
                        "unknown archetype " + session.archetype()));
            }
            GameState state = null;
            TurnResult result;
            try {
                state = engine.get().decodeState(session.stateJson());
                result = engine.get().apply(session, state, action);
            } catch (RuntimeException e) {
                timers.cancel(sessionId);
                return Step.finalized(finalizer.finalizeLocked(c, session, state, SessionStatus.ERROR,
                        "turn failed: " + e.getMessage()));
            }
            if (result.isRejected()) {
                return reject(c, session, action, result.reason());
            }
            // The action is valid: the deadline no longer applies to this turn.
            timers.cancel(sessionId);
            if (result.kind() == TurnResult.Kind.TERMINAL) {
                return Step.finalized(finalizer.finalizeLocked(c, session, result.state(), result.terminalStatus(),
                        "turn " + action.kind().wireName()));
            }
            return openNextTurn(c, session, engine.get(), result.state(), now);
        });
        switch (step.kind()) {
            case IGNORED:
                log.debug("Turn for {} ignored: {}", sessionId, step.reason());
                return TurnOutcome.of(TurnOutcome.Kind.IGNORED, sessionId, null, step.reason());
            case REJECTED:
                audit.logQuietly(SessionAuditLog.AuditEvent.of("session.turn", sessionId, "rejected",
                        turnDetails(action, step.reason())));
                return TurnOutcome.of(TurnOutcome.Kind.REJECTED, sessionId, null, step.reason());
            case FINALIZED:
                finalizer.afterCommit(step.finalized());
                audit.logQuietly(SessionAuditLog.AuditEvent.of("session.turn", sessionId, "terminal",
                        turnDetails(action, step.finalized().status().dbValue())));
                return TurnOutcome.of(TurnOutcome.Kind.FINALIZED, sessionId, step.finalized().status(), step.finalized().reason());
            case OPENED:
                audit.logQuietly(SessionAuditLog.AuditEvent.of("session.turn", sessionId, "ok",
                        turnDetails(action, "turn " + step.session().turnVersion())));
                promptTurn(step);
                return TurnOutcome.of(TurnOutcome.Kind.ADVANCED, sessionId, SessionStatus.IN_PROGRESS, null);
            default:
                throw new IllegalStateException("unexpected turn step " + step.kind() + " for " + sessionId);
        }
    }

    /**
     * Timer expiry: settle as a timeout unless a newer turn or another finalize got there first.
     */
    public void onTurnTimeout(String sessionId, long turnVersion) {
        Finalizer.FinalizeOutcome outcome = finalizer.finalizeSession(
                sessionId, SessionStatus.COMPLETED_TIMEOUT, turnVersion, "turn " + turnVersion + " timed out");
        if (outcome.applied()) {
            log.info("Session {} timed out on turn {}", sessionId, turnVersion);
        }
    }

    private Step openNextTurn(Connection c, SessionRecord session, GameEngine engine, GameState state, long now)
            throws SQLException {
        long deadline = now + settings.turnTimeoutMs();
        long version = store.writeTurn(c, session.sessionId(), engine.encodeState(state), session.turnVersion(), deadline, now);
        if (version < 0L) {
            throw new IllegalStateException("session " + session.sessionId() + " changed while locked");
        }
        SessionRecord opened = store.lockSession(c, session.sessionId())
                .orElseThrow(() -> new IllegalStateException("session vanished: " + session.sessionId()));
        return Step.opened(opened, engine, state);
    }

    /**
     * Runs after commit: arm the deadline first so a failed prompt still times out.
     */
    private void promptTurn(Step step) {
        SessionRecord session = step.session();
        GameEngine engine = step.engine();
        GameState state = step.state();
        long version = session.turnVersion();
        long deadline = session.turnDeadlineMs() == null
                ? System.currentTimeMillis() + settings.turnTimeoutMs()
                : session.turnDeadlineMs();
        timers.arm(session.sessionId(), version, deadline,
                (id, turn) -> retrier.run("timeout of " + id, () -> onTurnTimeout(id, turn)));
        String actor = engine.actorToPlay(session, state);
        PromptView view = new PromptView(
                session.sessionId(),
                session.archetype(),
                actor,
                actor != null && actor.equals(session.opponentId()) ? session.opponentName() : session.initiatorName(),
                version,
                deadline,
                engine.allowedActions(state),
                currency.toDisplay(session.stakeAmount()),
                state
        );
        try {
            if (session.promptHandle() != null) {
                prompts.deletePrompt(session.channelRef(), session.promptHandle());
            }
            String handle = prompts.sendPrompt(session.channelRef(), view);
            store.attachPromptHandle(session.sessionId(), version, handle, System.currentTimeMillis());
        } catch (RuntimeException e) {
            log.warn("Prompt for session {} turn {} not delivered, deadline still applies: {}",
                    session.sessionId(), version, e.toString());
        }
    }

    private Step reject(Connection c, SessionRecord session, TurnAction action, String reason) {
        store.recordConflict(c, "turn_rejected", session.sessionId(), workerId,
                SessionStatus.IN_PROGRESS, action.turnVersion(), session,
                action.actorId() + " " + action.kind().wireName() + ": " + reason);
        log.debug("Turn for {} rejected: {}", session.sessionId(), reason);
        return Step.rejected(reason);
    }

    private static Map<String, Object> turnDetails(TurnAction action, String note) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actor_id", action.actorId());
        details.put("action", action.kind().wireName());
        details.put("roll_value", action.rollValue());
        details.put("turn_version", action.turnVersion());
        details.put("note", note);
        return details;
    }

    private record Step(
            StepKind kind,
            SessionRecord session,
            GameEngine engine,
            GameState state,
            Finalizer.FinalizeOutcome finalized,
            SessionStatus lostTo,
            String reason
    ) {
        static Step opened(SessionRecord session, GameEngine engine, GameState state) {
            return new Step(StepKind.OPENED, session, engine, state, null, null, null);
        }

        static Step finalized(Finalizer.FinalizeOutcome outcome) {
            if (!outcome.applied()) {
                return new Step(StepKind.IGNORED, null, null, null, null, null, outcome.reason());
            }
            return new Step(StepKind.FINALIZED, null, null, null, outcome, null, outcome.reason());
        }

        static Step lost(SessionStatus actual) {
            return new Step(StepKind.LOST, null, null, null, null, actual, null);
        }

        static Step rejected(String reason) {
            return new Step(StepKind.REJECTED, null, null, null, null, null, reason);
        }

        static Step ignored(String reason) {
            return new Step(StepKind.IGNORED, null, null, null, null, null, reason);
        }
    }

    private enum StepKind {
        OPENED,
        FINALIZED,
        LOST,
        REJECTED,
        IGNORED
    }

    public record ClaimOutcome(Kind kind, String sessionId, SessionStatus status) {
        public enum Kind {
            CLAIMED,
            LOST,
            FAILED
        }
    }

    public record TurnOutcome(Kind kind, String sessionId, SessionStatus status, String reason) {
        public enum Kind {
            ADVANCED,
            FINALIZED,
            REJECTED,
            IGNORED
        }

        static TurnOutcome of(Kind kind, String sessionId, SessionStatus status, String reason) {
            return new TurnOutcome(kind, sessionId, status, reason);
        }
    }
}
