package io.dicehall.game;

import io.dicehall.config.GameSettings;
import io.dicehall.model.GameArchetype;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;
import io.dicehall.util.Multipliers;

import java.util.List;

/**
 * Two actors. The initiator throws the full quota, then the opponent does. Payout is seen from the
 * initiator, who holds the stake: a win adds the tier bonus for the winning score, a push returns
 * the stake, a loss pays nothing.
 */
public final class DuelEngine extends TypedGameEngine<DuelState> {
    private static final List<TurnAction.ActionKind> ROLL_ONLY = List.of(TurnAction.ActionKind.ROLL);

    public DuelEngine(GameSettings settings) {
        super(settings, DuelState.class);
    }

    @Override
    public GameArchetype archetype() {
        return GameArchetype.DUEL;
    }

    @Override
    protected DuelState start(SessionRecord session) {
        if (!session.hasOpponent()) {
            throw new IllegalArgumentException("duel session " + session.sessionId() + " has no opponent");
        }
        if (session.opponentId().equals(session.initiatorId())) {
            throw new IllegalArgumentException("duel session " + session.sessionId() + " pits an actor against itself");
        }
        return DuelState.start();
    }

    @Override
    protected TurnResult advance(SessionRecord session, DuelState state, TurnAction action) {
        int quota = settings.duel().shotQuota();
        DuelState.Seat seat = state.currentTurn();
        int thrown = state.rollsOf(seat).size() + 1;
        DuelState.Seat nextTurn = seat;
        if (thrown >= quota && seat == DuelState.Seat.INITIATOR) {
            nextTurn = DuelState.Seat.OPPONENT;
        }
        DuelState next = state.withRoll(seat, action.rollValue(), nextTurn);
        if (next.initiatorRolls().size() >= quota && next.opponentRolls().size() >= quota) {
            return TurnResult.terminal(next, decide(next));
        }
        return TurnResult.advanced(next);
    }

    public int score(DuelState state, DuelState.Seat seat) {
        return settings.duel().score(state.rollsOf(seat));
    }

    private SessionStatus decide(DuelState state) {
        int p1 = score(state, DuelState.Seat.INITIATOR);
        int p2 = score(state, DuelState.Seat.OPPONENT);
        if (p1 > p2) {
            return SessionStatus.COMPLETED_P1_WIN;
        }
        if (p2 > p1) {
            return SessionStatus.COMPLETED_P2_WIN;
        }
        return SessionStatus.COMPLETED_PUSH;
    }

    @Override
    protected long winningPayout(SessionRecord session, DuelState state, SessionStatus status) {
        long stake = session.stakeAmount();
        return switch (status) {
            case COMPLETED_PUSH -> stake;
            case COMPLETED_P1_WIN -> Math.addExact(stake, Multipliers.applyToStake(
                    stake, settings.duel().tierFor(score(state, DuelState.Seat.INITIATOR))));
            default -> 0L;
        };
    }

    @Override
    protected String actor(SessionRecord session, DuelState state) {
        return state.currentTurn() == DuelState.Seat.INITIATOR ? session.initiatorId() : session.opponentId();
    }

    @Override
    protected List<TurnAction.ActionKind> offered(DuelState state) {
        return ROLL_ONLY;
    }
}
