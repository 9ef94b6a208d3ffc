package io.dicehall.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record DuelState(List<Integer> initiatorRolls, List<Integer> opponentRolls, Seat currentTurn) implements GameState {
    public DuelState {
        initiatorRolls = initiatorRolls == null ? List.of() : List.copyOf(initiatorRolls);
        opponentRolls = opponentRolls == null ? List.of() : List.copyOf(opponentRolls);
        if (currentTurn == null) {
            currentTurn = Seat.INITIATOR;
        }
    }

    public enum Seat {
        @JsonProperty("initiator")
        INITIATOR,
        @JsonProperty("opponent")
        OPPONENT
    }

    public static DuelState start() {
        return new DuelState(List.of(), List.of(), Seat.INITIATOR);
    }

    public List<Integer> rollsOf(Seat seat) {
        return seat == Seat.INITIATOR ? initiatorRolls : opponentRolls;
    }

    DuelState withRoll(Seat seat, int roll, Seat nextTurn) {
        List<Integer> mine = new ArrayList<>(rollsOf(seat));
        mine.add(roll);
        return seat == Seat.INITIATOR
                ? new DuelState(mine, opponentRolls, nextTurn)
                : new DuelState(initiatorRolls, mine, nextTurn);
    }
}
