package io.dicehall.game;

import io.dicehall.config.GameSettings;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

final class RoundProgressionEngineTest {
    private final SessionRecord session = GameFixtures.solo("round_progression", 1000L);

    @Test
    void winOnFinalRoundThreePaysStakePlusRoundMultiplier() {
        GameSettings.RoundRules threeRounds = new GameSettings.RoundRules(
                Map.of(1, 20L, 2, 50L, 3, 100L, 4, 200L, 5, 400L),
                3, 2, Set.of(1), Set.of(5, 6), Set.of(2, 3, 4), 50L);
        RoundProgressionEngine engine = new RoundProgressionEngine(GameSettings.defaults().withRounds(threeRounds));

        GameState state = engine.initialState(session);
        state = engine.apply(session, state, GameFixtures.roll("alice", 5)).state();
        state = engine.apply(session, state, GameFixtures.roll("alice", 3)).state();
        state = engine.apply(session, state, GameFixtures.roll("alice", 6)).state();
        Assertions.assertEquals(3, ((RoundProgressionState) state).round());

        TurnResult win = engine.apply(session, state, GameFixtures.roll("alice", 5));
        Assertions.assertEquals(SessionStatus.COMPLETED_WIN, win.terminalStatus());
        Assertions.assertEquals(2000L, engine.payout(session, win.state(), win.terminalStatus()));
    }

    @Test
    void cashOutAfterFailingFirstRoundPaysFixedFraction() {
        RoundProgressionEngine engine = new RoundProgressionEngine(GameSettings.defaults());
        GameState state = engine.initialState(session);
        state = engine.apply(session, state, GameFixtures.roll("alice", 2)).state();
        Assertions.assertEquals(List.of(TurnAction.ActionKind.ROLL), engine.allowedActions(state));
        state = engine.apply(session, state, GameFixtures.roll("alice", 4)).state();

        Assertions.assertEquals(RoundProgressionState.Phase.ROUND_FAILED_PENDING_CHOICE,
                ((RoundProgressionState) state).phase());
        Assertions.assertTrue(engine.apply(session, state, GameFixtures.roll("alice", 5)).isRejected());

        TurnResult cashOut = engine.apply(session, state, GameFixtures.cashOut("alice"));
        Assertions.assertEquals(SessionStatus.COMPLETED_CASHOUT, cashOut.terminalStatus());
        Assertions.assertEquals(500L, engine.payout(session, cashOut.state(), cashOut.terminalStatus()));
    }

    @Test
    void continueAfterFailedRoundMovesToNextRoundWithFreshShots() {
        RoundProgressionEngine engine = new RoundProgressionEngine(GameSettings.defaults());
        GameState state = engine.initialState(session);
        state = engine.apply(session, state, GameFixtures.roll("alice", 3)).state();
        state = engine.apply(session, state, GameFixtures.roll("alice", 3)).state();

        TurnResult next = engine.apply(session, state, GameFixtures.carryOn("alice"));
        RoundProgressionState moved = (RoundProgressionState) next.state();
        Assertions.assertEquals(TurnResult.Kind.ADVANCED, next.kind());
        Assertions.assertEquals(2, moved.round());
        Assertions.assertEquals(0, moved.shotsTaken());
        Assertions.assertEquals(RoundProgressionState.Phase.AWAITING_SHOT, moved.phase());
    }

    @Test
    void instantLossValueEndsSessionWithNoPayout() {
        RoundProgressionEngine engine = new RoundProgressionEngine(GameSettings.defaults());
        GameState state = engine.initialState(session);
        state = engine.apply(session, state, GameFixtures.roll("alice", 6)).state();
        TurnResult loss = engine.apply(session, state, GameFixtures.roll("alice", 1));

        Assertions.assertEquals(SessionStatus.COMPLETED_LOSS, loss.terminalStatus());
        Assertions.assertEquals(0L, engine.payout(session, loss.state(), loss.terminalStatus()));
    }

    @Test
    void phaseSurvivesStorageRoundTrip() {
        RoundProgressionEngine engine = new RoundProgressionEngine(GameSettings.defaults());
        GameState state = engine.initialState(session);
        state = engine.apply(session, state, GameFixtures.roll("alice", 2)).state();
        state = engine.apply(session, state, GameFixtures.roll("alice", 2)).state();

        String json = engine.encodeState(state);
        Assertions.assertTrue(json.contains("round_failed_pending_choice"), json);
        Assertions.assertEquals(state, engine.decodeState(json));
    }
}
