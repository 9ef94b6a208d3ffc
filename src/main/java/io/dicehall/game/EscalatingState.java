package io.dicehall.game;

import io.dicehall.util.Multipliers;

import java.util.ArrayList;
import java.util.List;

public record EscalatingState(List<Integer> rolls, long multiplier, int turnCount, String lastLabel) implements GameState {
    public EscalatingState {
        rolls = rolls == null ? List.of() : List.copyOf(rolls);
    }

    public static EscalatingState start() {
        return new EscalatingState(List.of(), Multipliers.ONE, 0, null);
    }

    EscalatingState withRoll(int roll, long nextMultiplier, String label) {
        List<Integer> next = new ArrayList<>(rolls);
        next.add(roll);
        return new EscalatingState(next, nextMultiplier, turnCount + 1, label);
    }
}
