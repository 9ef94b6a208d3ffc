package io.dicehall.model;

import java.util.Optional;

public enum GameArchetype {
    ESCALATING_STAKES("escalating_stakes"),
    ROUND_PROGRESSION("round_progression"),
    DUEL("duel");

    private final String tag;

    GameArchetype(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Unknown tags are not an exception here: a stored session may carry a tag this build does not know.
     */
    public static Optional<GameArchetype> fromTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().replace('-', '_');
        for (GameArchetype value : values()) {
            if (value.tag.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
