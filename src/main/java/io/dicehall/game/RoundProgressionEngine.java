package io.dicehall.game;

import io.dicehall.config.GameSettings;
import io.dicehall.model.GameArchetype;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;
import io.dicehall.util.Multipliers;

import java.util.List;

/**
 * Single actor working through numbered rounds. Success values clear the round, instant-loss
 * values end the session, misses use up the round's shots. A failed round offers a choice:
 * cash out a fixed fraction of the stake or continue into the next round for free.
 */
public final class RoundProgressionEngine extends TypedGameEngine<RoundProgressionState> {
    private static final List<TurnAction.ActionKind> SHOOT = List.of(TurnAction.ActionKind.ROLL);
    private static final List<TurnAction.ActionKind> CHOOSE =
            List.of(TurnAction.ActionKind.CASH_OUT, TurnAction.ActionKind.CONTINUE);

    public RoundProgressionEngine(GameSettings settings) {
        super(settings, RoundProgressionState.class);
    }

    @Override
    public GameArchetype archetype() {
        return GameArchetype.ROUND_PROGRESSION;
    }

    @Override
    protected RoundProgressionState start(SessionRecord session) {
        return RoundProgressionState.start();
    }

    @Override
    protected TurnResult advance(SessionRecord session, RoundProgressionState state, TurnAction action) {
        GameSettings.RoundRules rules = settings.rounds();
        switch (action.kind()) {
            case CASH_OUT:
                return TurnResult.terminal(state, SessionStatus.COMPLETED_CASHOUT);
            case CONTINUE:
                // the final round has no successor, so it is replayed
                return TurnResult.advanced(state.enterRound(Math.min(state.round() + 1, rules.finalRound())));
            default:
                break;
        }
        int roll = action.rollValue();
        if (rules.instantLoss().contains(roll)) {
            return TurnResult.terminal(
                    state.recordRoll(roll, state.round(), state.shotsTaken() + 1, state.phase()),
                    SessionStatus.COMPLETED_LOSS
            );
        }
        if (rules.success().contains(roll)) {
            if (state.round() >= rules.finalRound()) {
                return TurnResult.terminal(
                        state.recordRoll(roll, state.round(), state.shotsTaken() + 1, state.phase()),
                        SessionStatus.COMPLETED_WIN
                );
            }
            return TurnResult.advanced(
                    state.recordRoll(roll, state.round() + 1, 0, RoundProgressionState.Phase.AWAITING_SHOT)
            );
        }
        int shots = state.shotsTaken() + 1;
        RoundProgressionState.Phase phase = shots >= rules.shotsPerRound()
                ? RoundProgressionState.Phase.ROUND_FAILED_PENDING_CHOICE
                : RoundProgressionState.Phase.AWAITING_SHOT;
        return TurnResult.advanced(state.recordRoll(roll, state.round(), shots, phase));
    }

    @Override
    protected long winningPayout(SessionRecord session, RoundProgressionState state, SessionStatus status) {
        GameSettings.RoundRules rules = settings.rounds();
        long stake = session.stakeAmount();
        return switch (status) {
            case COMPLETED_WIN -> Math.addExact(stake, Multipliers.applyToStake(stake, rules.multiplierFor(state.round())));
            case COMPLETED_CASHOUT -> Multipliers.applyToStake(stake, rules.cashoutFraction());
            default -> 0L;
        };
    }

    @Override
    protected String actor(SessionRecord session, RoundProgressionState state) {
        return session.initiatorId();
    }

    @Override
    protected List<TurnAction.ActionKind> offered(RoundProgressionState state) {
        return state.phase() == RoundProgressionState.Phase.ROUND_FAILED_PENDING_CHOICE ? CHOOSE : SHOOT;
    }
}
