package io.dicehall.game;

import io.dicehall.model.SessionStatus;

public record TurnResult(Kind kind, GameState state, SessionStatus terminalStatus, String reason) {
    public enum Kind {
        ADVANCED,
        TERMINAL,
        REJECTED
    }

    public static TurnResult advanced(GameState state) {
        return new TurnResult(Kind.ADVANCED, state, null, null);
    }

    public static TurnResult terminal(GameState state, SessionStatus status) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("terminal result needs a terminal status, got " + status);
        }
        return new TurnResult(Kind.TERMINAL, state, status, null);
    }

    public static TurnResult rejected(String reason) {
        return new TurnResult(Kind.REJECTED, null, null, reason);
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }
}
