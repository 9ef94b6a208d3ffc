package io.dicehall.model;

public record SessionRecord(
        String sessionId,
        SessionStatus status,
        String archetype,
        long stakeAmount,
        long finalPayout,
        String stateJson,
        String initiatorId,
        String initiatorName,
        String opponentId,
        String opponentName,
        String channelRef,
        String workerId,
        long turnVersion,
        Long turnDeadlineMs,
        String promptHandle,
        long createdAtMs,
        Long claimedAtMs,
        Long finalizedAtMs,
        long updatedAtMs
) {
    public boolean hasOpponent() {
        return opponentId != null && !opponentId.isBlank();
    }

    public boolean isOwnedBy(String worker) {
        return status == SessionStatus.IN_PROGRESS && workerId != null && workerId.equals(worker);
    }
}
