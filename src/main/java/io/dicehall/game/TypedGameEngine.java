package io.dicehall.game;

import io.dicehall.config.GameSettings;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;
import io.dicehall.util.Jsons;

import java.util.List;

/**
 * Shared checks for every archetype: actor, offered action and roll range are validated
 * here before the archetype sees the action.
 */
public abstract class TypedGameEngine<S extends GameState> implements GameEngine {
    protected final GameSettings settings;
    private final Class<S> stateType;

    protected TypedGameEngine(GameSettings settings, Class<S> stateType) {
        this.settings = settings;
        this.stateType = stateType;
    }

    protected abstract S start(SessionRecord session);

    protected abstract TurnResult advance(SessionRecord session, S state, TurnAction action);

    protected abstract long winningPayout(SessionRecord session, S state, SessionStatus status);

    protected abstract String actor(SessionRecord session, S state);

    protected abstract List<TurnAction.ActionKind> offered(S state);

    @Override
    public final GameState initialState(SessionRecord session) {
        return start(session);
    }

    @Override
    public final TurnResult apply(SessionRecord session, GameState state, TurnAction action) {
        S typed = cast(state);
        if (action == null || action.kind() == null) {
            return TurnResult.rejected("missing action");
        }
        String expectedActor = actor(session, typed);
        if (expectedActor == null || !expectedActor.equals(action.actorId())) {
            return TurnResult.rejected("actor " + action.actorId() + " does not hold the turn");
        }
        if (!offered(typed).contains(action.kind())) {
            return TurnResult.rejected("action " + action.kind().wireName() + " not offered now");
        }
        if (action.kind() == TurnAction.ActionKind.ROLL
                && (action.rollValue() == null || !settings.isValidRoll(action.rollValue()))) {
            return TurnResult.rejected("roll out of range: " + action.rollValue());
        }
        return advance(session, typed, action);
    }

    @Override
    public final long payout(SessionRecord session, GameState state, SessionStatus status) {
        return switch (status) {
            case COMPLETED_LOSS, COMPLETED_TIMEOUT, COMPLETED_P2_WIN, ERROR -> 0L;
            case PENDING_CLAIM, IN_PROGRESS -> throw new IllegalArgumentException("not a terminal status: " + status);
            default -> winningPayout(session, cast(state), status);
        };
    }

    @Override
    public final String actorToPlay(SessionRecord session, GameState state) {
        return actor(session, cast(state));
    }

    @Override
    public final List<TurnAction.ActionKind> allowedActions(GameState state) {
        return offered(cast(state));
    }

    @Override
    public final GameState decodeState(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalStateException("Empty " + archetype().tag() + " state document");
        }
        try {
            return Jsons.fromJson(json, stateType);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed " + archetype().tag() + " state document", e);
        }
    }

    @Override
    public final String encodeState(GameState state) {
        return Jsons.toCompactJson(cast(state));
    }

    private S cast(GameState state) {
        if (!stateType.isInstance(state)) {
            throw new IllegalStateException("Expected " + stateType.getSimpleName() + " for "
                    + archetype().tag() + " but got " + (state == null ? "null" : state.getClass().getSimpleName()));
        }
        return stateType.cast(state);
    }
}
