package io.dicehall.bus;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dicehall.model.TurnAction;
import io.dicehall.util.Jsons;

public final class BusEvents {
    public static final String SESSION_CLAIMABLE = "session_claimable";
    public static final String TURN_SUBMITTED = "turn_submitted";
    public static final String SESSION_COMPLETED = "session_completed";

    private BusEvents() {
    }

    public static String encode(Object event) {
        return Jsons.toCompactJson(event);
    }

    public static <T> T decode(String payload, Class<T> type) {
        return Jsons.fromJson(payload, type);
    }

    public record SessionClaimable(@JsonProperty("session_id") String sessionId) {
    }

    public record TurnSubmitted(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("actor_id") String actorId,
            @JsonProperty("action") String action,
            @JsonProperty("roll_value") Integer rollValue,
            @JsonProperty("turn_version") long turnVersion
    ) {
        public static TurnSubmitted of(TurnAction action) {
            return new TurnSubmitted(
                    action.sessionId(),
                    action.actorId(),
                    action.kind().wireName(),
                    action.rollValue(),
                    action.turnVersion()
            );
        }

        public TurnAction toAction() {
            return new TurnAction(sessionId, actorId, TurnAction.ActionKind.fromString(action), rollValue, turnVersion);
        }
    }

    public record SessionCompleted(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("status") String status,
            @JsonProperty("final_payout") long finalPayout,
            @JsonProperty("outcome") String outcome
    ) {
    }
}
