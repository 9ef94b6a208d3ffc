package io.dicehall.game;

/**
 * Archetype-specific state document stored in {@code game_sessions.state_json}.
 * Each archetype has exactly one record type; the archetype tag on the row selects it.
 */
public interface GameState {
}
