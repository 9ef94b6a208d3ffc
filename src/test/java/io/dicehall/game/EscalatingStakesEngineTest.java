package io.dicehall.game;

import io.dicehall.config.GameSettings;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class EscalatingStakesEngineTest {
    private final EscalatingStakesEngine engine = new EscalatingStakesEngine(GameSettings.defaults());
    private final SessionRecord session = GameFixtures.solo("escalating_stakes", 1000L);

    @Test
    void compoundsWithPerStepTruncationAndCashesOutAtRoundBoundary() {
        GameState state = engine.initialState(session);
        for (int i = 0; i < 4; i++) {
            TurnResult r = engine.apply(session, state, GameFixtures.roll("alice", 3));
            Assertions.assertEquals(TurnResult.Kind.ADVANCED, r.kind());
            state = r.state();
        }
        // 100 -> 110 -> 121 -> 133 -> 146
        Assertions.assertEquals(146L, ((EscalatingState) state).multiplier());
        Assertions.assertEquals(List.of(TurnAction.ActionKind.ROLL, TurnAction.ActionKind.CASH_OUT),
                engine.allowedActions(state));

        TurnResult done = engine.apply(session, state, GameFixtures.cashOut("alice"));
        Assertions.assertEquals(TurnResult.Kind.TERMINAL, done.kind());
        Assertions.assertEquals(SessionStatus.COMPLETED_CASHOUT, done.terminalStatus());
        Assertions.assertEquals(1460L, engine.payout(session, done.state(), done.terminalStatus()));
    }

    @Test
    void zeroFactorRollEndsAsLossAtThatPosition() {
        GameState state = engine.initialState(session);
        state = engine.apply(session, state, GameFixtures.roll("alice", 6)).state();
        TurnResult bust = engine.apply(session, state, GameFixtures.roll("alice", 1));

        Assertions.assertEquals(TurnResult.Kind.TERMINAL, bust.kind());
        Assertions.assertEquals(SessionStatus.COMPLETED_LOSS, bust.terminalStatus());
        Assertions.assertEquals(List.of(6, 1), ((EscalatingState) bust.state()).rolls());
        Assertions.assertEquals(0L, engine.payout(session, bust.state(), bust.terminalStatus()));
    }

    @Test
    void reachingTurnCapCashesOutAutomatically() {
        GameState state = engine.initialState(session);
        TurnResult last = null;
        for (int i = 0; i < 6; i++) {
            last = engine.apply(session, state, GameFixtures.roll("alice", 2));
            state = last.state();
        }
        Assertions.assertEquals(TurnResult.Kind.TERMINAL, last.kind());
        Assertions.assertEquals(SessionStatus.COMPLETED_CASHOUT, last.terminalStatus());
        // 90, 81, 72, 64, 57, 51
        Assertions.assertEquals(510L, engine.payout(session, state, SessionStatus.COMPLETED_CASHOUT));
    }

    @Test
    void rejectsCashOutBetweenBoundariesWrongActorAndOutOfRangeRoll() {
        GameState state = engine.initialState(session);
        state = engine.apply(session, state, GameFixtures.roll("alice", 4)).state();

        Assertions.assertTrue(engine.apply(session, state, GameFixtures.cashOut("alice")).isRejected());
        Assertions.assertTrue(engine.apply(session, state, GameFixtures.roll("mallory", 4)).isRejected());
        Assertions.assertTrue(engine.apply(session, state, GameFixtures.roll("alice", 7)).isRejected());
        Assertions.assertTrue(engine.apply(session, state, GameFixtures.roll("alice", 0)).isRejected());
    }

    @Test
    void timeoutPaysNothingAndStoredStateMustDecode() {
        GameState state = engine.initialState(session);
        Assertions.assertEquals(0L, engine.payout(session, state, SessionStatus.COMPLETED_TIMEOUT));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> engine.payout(session, state, SessionStatus.IN_PROGRESS));
        Assertions.assertThrows(IllegalStateException.class, () -> engine.decodeState("{not json"));
        Assertions.assertThrows(IllegalStateException.class, () -> engine.decodeState(" "));
    }
}
