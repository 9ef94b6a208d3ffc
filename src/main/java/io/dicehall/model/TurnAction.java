package io.dicehall.model;

public record TurnAction(
        String sessionId,
        String actorId,
        ActionKind kind,
        Integer rollValue,
        long turnVersion
) {
    public enum ActionKind {
        ROLL,
        CASH_OUT,
        CONTINUE;

        public static ActionKind fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("Action must not be blank");
            }
            String normalized = raw.trim().replace('-', '_');
            for (ActionKind value : values()) {
                if (value.name().equalsIgnoreCase(normalized)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown action: " + raw);
        }

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static TurnAction roll(String sessionId, String actorId, int value, long turnVersion) {
        return new TurnAction(sessionId, actorId, ActionKind.ROLL, value, turnVersion);
    }

    public static TurnAction cashOut(String sessionId, String actorId, long turnVersion) {
        return new TurnAction(sessionId, actorId, ActionKind.CASH_OUT, null, turnVersion);
    }

    public static TurnAction continueRound(String sessionId, String actorId, long turnVersion) {
        return new TurnAction(sessionId, actorId, ActionKind.CONTINUE, null, turnVersion);
    }
}
