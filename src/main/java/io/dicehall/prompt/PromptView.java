package io.dicehall.prompt;

import io.dicehall.game.GameState;
import io.dicehall.model.TurnAction;

import java.util.List;

/**
 * Snapshot handed to the prompt channel for one open turn. Rendering is the channel's business.
 */
public record PromptView(
        String sessionId,
        String archetype,
        String actorId,
        String actorName,
        long turnVersion,
        long deadlineMs,
        List<TurnAction.ActionKind> allowedActions,
        String stakeDisplay,
        GameState state
) {
}
