package io.dicehall.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record RoundProgressionState(int round, int shotsTaken, Phase phase, List<Integer> rolls) implements GameState {
    public RoundProgressionState {
        rolls = rolls == null ? List.of() : List.copyOf(rolls);
        if (phase == null) {
            phase = Phase.AWAITING_SHOT;
        }
    }

    public enum Phase {
        @JsonProperty("awaiting_shot")
        AWAITING_SHOT,
        @JsonProperty("round_failed_pending_choice")
        ROUND_FAILED_PENDING_CHOICE
    }

    public static RoundProgressionState start() {
        return new RoundProgressionState(1, 0, Phase.AWAITING_SHOT, List.of());
    }

    RoundProgressionState recordRoll(int roll, int nextRound, int nextShots, Phase nextPhase) {
        List<Integer> next = new ArrayList<>(rolls);
        next.add(roll);
        return new RoundProgressionState(nextRound, nextShots, nextPhase, next);
    }

    RoundProgressionState enterRound(int nextRound) {
        return new RoundProgressionState(nextRound, 0, Phase.AWAITING_SHOT, rolls);
    }
}
