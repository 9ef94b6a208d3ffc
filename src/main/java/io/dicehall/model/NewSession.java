package io.dicehall.model;

/**
 * A session as handed over by the placement side, before any worker has seen it.
 */
public record NewSession(
        String sessionId,
        String archetype,
        long stakeAmount,
        String initiatorId,
        String initiatorName,
        String opponentId,
        String opponentName,
        String channelRef
) {
    public NewSession {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (archetype == null || archetype.isBlank()) {
            throw new IllegalArgumentException("archetype must not be blank");
        }
        if (stakeAmount <= 0L) {
            throw new IllegalArgumentException("stakeAmount must be positive");
        }
        if (initiatorId == null || initiatorId.isBlank()) {
            throw new IllegalArgumentException("initiatorId must not be blank");
        }
    }
}
