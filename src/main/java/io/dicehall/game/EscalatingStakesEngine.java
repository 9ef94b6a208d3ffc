package io.dicehall.game;

import io.dicehall.config.GameSettings;
import io.dicehall.model.GameArchetype;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;
import io.dicehall.util.Multipliers;

import java.util.List;

/**
 * Single actor. Each roll compounds the running multiplier by the table factor, truncating to
 * hundredths at every step. A zero factor busts; reaching the turn cap cashes out automatically;
 * at each round boundary the player may cash out instead of rolling.
 */
public final class EscalatingStakesEngine extends TypedGameEngine<EscalatingState> {
    private static final List<TurnAction.ActionKind> ROLL_ONLY = List.of(TurnAction.ActionKind.ROLL);
    private static final List<TurnAction.ActionKind> ROLL_OR_CASH_OUT =
            List.of(TurnAction.ActionKind.ROLL, TurnAction.ActionKind.CASH_OUT);

    public EscalatingStakesEngine(GameSettings settings) {
        super(settings, EscalatingState.class);
    }

    @Override
    public GameArchetype archetype() {
        return GameArchetype.ESCALATING_STAKES;
    }

    @Override
    protected EscalatingState start(SessionRecord session) {
        return EscalatingState.start();
    }

    @Override
    protected TurnResult advance(SessionRecord session, EscalatingState state, TurnAction action) {
        GameSettings.EscalationRules rules = settings.escalation();
        if (action.kind() == TurnAction.ActionKind.CASH_OUT) {
            return TurnResult.terminal(state, SessionStatus.COMPLETED_CASHOUT);
        }
        int roll = action.rollValue();
        GameSettings.RollEffect effect = rules.effectFor(roll);
        if (effect.isBust()) {
            return TurnResult.terminal(state.withRoll(roll, state.multiplier(), effect.label()), SessionStatus.COMPLETED_LOSS);
        }
        EscalatingState next = state.withRoll(roll, Multipliers.compound(state.multiplier(), effect.factor()), effect.label());
        if (next.turnCount() >= rules.maxTurns()) {
            return TurnResult.terminal(next, SessionStatus.COMPLETED_CASHOUT);
        }
        return TurnResult.advanced(next);
    }

    @Override
    protected long winningPayout(SessionRecord session, EscalatingState state, SessionStatus status) {
        if (status != SessionStatus.COMPLETED_CASHOUT) {
            return 0L;
        }
        return Multipliers.applyToStake(session.stakeAmount(), state.multiplier());
    }

    @Override
    protected String actor(SessionRecord session, EscalatingState state) {
        return session.initiatorId();
    }

    @Override
    protected List<TurnAction.ActionKind> offered(EscalatingState state) {
        return settings.escalation().isRoundBoundary(state.turnCount()) ? ROLL_OR_CASH_OUT : ROLL_ONLY;
    }
}
