package io.dicehall.game;

import io.dicehall.config.GameSettings;
import io.dicehall.model.GameArchetype;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class GameEngineRegistry {
    private final Map<GameArchetype, GameEngine> engines = new ConcurrentHashMap<>();

    public static GameEngineRegistry withDefaults(GameSettings settings) {
        GameEngineRegistry registry = new GameEngineRegistry();
        registry.register(new EscalatingStakesEngine(settings));
        registry.register(new RoundProgressionEngine(settings));
        registry.register(new DuelEngine(settings));
        return registry;
    }

    public void register(GameEngine engine) {
        engines.put(engine.archetype(), engine);
    }

    public Optional<GameEngine> find(GameArchetype archetype) {
        return Optional.ofNullable(engines.get(archetype));
    }

    /**
     * Resolves the raw tag stored on a session row; empty for tags this build does not know.
     */
    public Optional<GameEngine> findByTag(String tag) {
        return GameArchetype.fromTag(tag).flatMap(this::find);
    }

    public Collection<GameArchetype> archetypes() {
        return engines.keySet();
    }
}
