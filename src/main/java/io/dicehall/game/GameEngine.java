package io.dicehall.game;

import io.dicehall.model.GameArchetype;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;

import java.util.List;

/**
 * Pure turn logic for one archetype. Implementations do no I/O and are deterministic
 * for a given rule set, state and action.
 */
public interface GameEngine {
    GameArchetype archetype();

    /**
     * @throws IllegalArgumentException when the session cannot be played under this archetype
     */
    GameState initialState(SessionRecord session);

    TurnResult apply(SessionRecord session, GameState state, TurnAction action);

    /**
     * Payout in the smallest currency unit for a session ending in {@code status}.
     */
    long payout(SessionRecord session, GameState state, SessionStatus status);

    String actorToPlay(SessionRecord session, GameState state);

    List<TurnAction.ActionKind> allowedActions(GameState state);

    /**
     * @throws IllegalStateException when the stored document does not decode to this archetype's state
     */
    GameState decodeState(String json);

    String encodeState(GameState state);
}
