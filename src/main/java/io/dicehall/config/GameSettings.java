package io.dicehall.config;

import io.dicehall.util.Jsons;
import io.dicehall.util.Multipliers;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Timing knobs plus the per-archetype rule tables. Loaded once at startup from
 * {@code dicehall-settings.json}; every field is optional and falls back to the defaults.
 */
public record GameSettings(
        long turnTimeoutMs,
        long pollIntervalMs,
        int pollBatchSize,
        long overdueGraceMs,
        int rollMin,
        int rollMax,
        EscalationRules escalation,
        RoundRules rounds,
        DuelRules duel
) {
    public GameSettings {
        if (rollMin > rollMax) {
            throw new IllegalArgumentException("rollMin must not exceed rollMax");
        }
        escalation.validate(rollMin, rollMax);
        rounds.validate(rollMin, rollMax);
        duel.validate();
    }

    public boolean isValidRoll(int value) {
        return value >= rollMin && value <= rollMax;
    }

    public static GameSettings defaults() {
        Map<Integer, RollEffect> effects = new TreeMap<>();
        effects.put(1, new RollEffect("bust", 0L));
        effects.put(2, new RollEffect("wobble", 90L));
        effects.put(3, new RollEffect("steady", 110L));
        effects.put(4, new RollEffect("solid", 125L));
        effects.put(5, new RollEffect("strong", 150L));
        effects.put(6, new RollEffect("bullseye", 200L));

        Map<Integer, Long> roundMultipliers = new TreeMap<>();
        roundMultipliers.put(1, 20L);
        roundMultipliers.put(2, 50L);
        roundMultipliers.put(3, 100L);
        roundMultipliers.put(4, 200L);
        roundMultipliers.put(5, 400L);

        NavigableMap<Integer, Long> tiers = new TreeMap<>();
        tiers.put(0, 90L);
        tiers.put(13, 100L);
        tiers.put(16, 150L);

        return new GameSettings(
                DiceHallConfig.DEFAULT_TURN_TIMEOUT_MS,
                DiceHallConfig.DEFAULT_POLL_INTERVAL_MS,
                DiceHallConfig.DEFAULT_POLL_BATCH_SIZE,
                DiceHallConfig.DEFAULT_OVERDUE_GRACE_MS,
                1,
                6,
                new EscalationRules(effects, 6, 2),
                new RoundRules(roundMultipliers, 5, 2, Set.of(1), Set.of(5, 6), Set.of(2, 3, 4), 50L),
                new DuelRules(3, ScoringRule.SUM, 4, tiers)
        );
    }

    public static GameSettings load(Path file) {
        GameSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file: " + file, e);
        }
    }

    public GameSettings withTurnTimeoutMs(long value) {
        return new GameSettings(value, pollIntervalMs, pollBatchSize, overdueGraceMs, rollMin, rollMax, escalation, rounds, duel);
    }

    public GameSettings withPolling(long intervalMs, int batchSize, long graceMs) {
        return new GameSettings(turnTimeoutMs, intervalMs, batchSize, graceMs, rollMin, rollMax, escalation, rounds, duel);
    }

    public GameSettings withEscalation(EscalationRules value) {
        return new GameSettings(turnTimeoutMs, pollIntervalMs, pollBatchSize, overdueGraceMs, rollMin, rollMax, value, rounds, duel);
    }

    public GameSettings withRounds(RoundRules value) {
        return new GameSettings(turnTimeoutMs, pollIntervalMs, pollBatchSize, overdueGraceMs, rollMin, rollMax, escalation, value, duel);
    }

    public GameSettings withDuel(DuelRules value) {
        return new GameSettings(turnTimeoutMs, pollIntervalMs, pollBatchSize, overdueGraceMs, rollMin, rollMax, escalation, rounds, value);
    }

    static GameSettings fromFile(SettingsFile file, GameSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int rollMin = sanitizeInt(file.rollMin(), defaults.rollMin(), Integer.MIN_VALUE);
        int rollMax = sanitizeInt(file.rollMax(), defaults.rollMax(), rollMin);
        return new GameSettings(
                sanitizeLong(file.turnTimeoutMs(), defaults.turnTimeoutMs(), 100L),
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 50L),
                sanitizeInt(file.pollBatchSize(), defaults.pollBatchSize(), 1),
                sanitizeLong(file.overdueGraceMs(), defaults.overdueGraceMs(), 0L),
                rollMin,
                rollMax,
                EscalationRules.fromFile(file.escalation(), defaults.escalation()),
                RoundRules.fromFile(file.rounds(), defaults.rounds()),
                DuelRules.fromFile(file.duel(), defaults.duel())
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static Set<Integer> alphabet(int rollMin, int rollMax) {
        Set<Integer> out = new TreeSet<>();
        for (int v = rollMin; v <= rollMax; v++) {
            out.add(v);
        }
        return out;
    }

    public record RollEffect(String label, long factor) {
        public RollEffect {
            if (factor < 0L) {
                throw new IllegalArgumentException("factor must not be negative");
            }
            label = label == null || label.isBlank() ? "roll" : label.trim();
        }

        public boolean isBust() {
            return factor == 0L;
        }
    }

    /**
     * Escalating stakes. Factors are hundredths; a zero factor ends the session.
     */
    public record EscalationRules(Map<Integer, RollEffect> effects, int maxTurns, int roundSize) {
        public EscalationRules {
            effects = Collections.unmodifiableMap(new TreeMap<>(effects));
        }

        public RollEffect effectFor(int roll) {
            RollEffect effect = effects.get(roll);
            if (effect == null) {
                throw new IllegalArgumentException("No effect configured for roll " + roll);
            }
            return effect;
        }

        public boolean isRoundBoundary(int turnCount) {
            return turnCount > 0 && turnCount < maxTurns && turnCount % roundSize == 0;
        }

        void validate(int rollMin, int rollMax) {
            if (maxTurns < 1) {
                throw new IllegalArgumentException("escalation.maxTurns must be at least 1");
            }
            if (roundSize < 1) {
                throw new IllegalArgumentException("escalation.roundSize must be at least 1");
            }
            if (!effects.keySet().equals(alphabet(rollMin, rollMax))) {
                throw new IllegalArgumentException("escalation.effects must cover exactly the rolls "
                        + rollMin + ".." + rollMax);
            }
        }

        static EscalationRules fromFile(EscalationFile file, EscalationRules defaults) {
            if (file == null) {
                return defaults;
            }
            Map<Integer, RollEffect> effects = defaults.effects();
            if (file.effects() != null && !file.effects().isEmpty()) {
                Map<Integer, RollEffect> parsed = new TreeMap<>();
                for (Map.Entry<Integer, EffectFile> e : file.effects().entrySet()) {
                    EffectFile ef = e.getValue();
                    if (ef == null || ef.factor() == null) {
                        throw new IllegalArgumentException("escalation.effects." + e.getKey() + " needs a factor");
                    }
                    parsed.put(e.getKey(), new RollEffect(ef.label(), Multipliers.fromDecimal(ef.factor())));
                }
                effects = parsed;
            }
            return new EscalationRules(
                    effects,
                    sanitizeInt(file.maxTurns(), defaults.maxTurns(), 1),
                    sanitizeInt(file.roundSize(), defaults.roundSize(), 1)
            );
        }
    }

    /**
     * Round progression. Round multipliers and the cash-out fraction are hundredths.
     * Clearing {@code finalRound} wins; it defaults to the last numbered round.
     */
    public record RoundRules(
            Map<Integer, Long> roundMultipliers,
            int finalRound,
            int shotsPerRound,
            Set<Integer> instantLoss,
            Set<Integer> success,
            Set<Integer> miss,
            long cashoutFraction
    ) {
        public RoundRules {
            roundMultipliers = Collections.unmodifiableMap(new TreeMap<>(roundMultipliers));
            instantLoss = Set.copyOf(instantLoss);
            success = Set.copyOf(success);
            miss = Set.copyOf(miss);
        }

        public long multiplierFor(int round) {
            Long value = roundMultipliers.get(round);
            if (value == null) {
                throw new IllegalArgumentException("No multiplier configured for round " + round);
            }
            return value;
        }

        void validate(int rollMin, int rollMax) {
            if (roundMultipliers.isEmpty()) {
                throw new IllegalArgumentException("rounds.multipliers must not be empty");
            }
            long previous = -1L;
            for (int round = 1; round <= roundMultipliers.size(); round++) {
                Long value = roundMultipliers.get(round);
                if (value == null) {
                    throw new IllegalArgumentException("rounds.multipliers must be numbered 1.." + roundMultipliers.size());
                }
                if (value <= previous) {
                    throw new IllegalArgumentException("rounds.multipliers must increase with the round");
                }
                previous = value;
            }
            if (finalRound < 1 || finalRound > roundMultipliers.size()) {
                throw new IllegalArgumentException("rounds.finalRound must be within 1.." + roundMultipliers.size());
            }
            if (shotsPerRound < 1) {
                throw new IllegalArgumentException("rounds.shotsPerRound must be at least 1");
            }
            if (cashoutFraction < 0L) {
                throw new IllegalArgumentException("rounds.cashoutFraction must not be negative");
            }
            Set<Integer> seen = new HashSet<>();
            for (Set<Integer> part : List.of(instantLoss, success, miss)) {
                for (Integer v : part) {
                    if (!seen.add(v)) {
                        throw new IllegalArgumentException("rounds outcome classes overlap on roll " + v);
                    }
                }
            }
            if (!seen.equals(alphabet(rollMin, rollMax))) {
                throw new IllegalArgumentException("rounds outcome classes must cover exactly the rolls "
                        + rollMin + ".." + rollMax);
            }
        }

        static RoundRules fromFile(RoundsFile file, RoundRules defaults) {
            if (file == null) {
                return defaults;
            }
            Map<Integer, Long> multipliers = defaults.roundMultipliers();
            if (file.multipliers() != null && !file.multipliers().isEmpty()) {
                Map<Integer, Long> parsed = new TreeMap<>();
                for (Map.Entry<Integer, BigDecimal> e : file.multipliers().entrySet()) {
                    parsed.put(e.getKey(), Multipliers.fromDecimal(e.getValue()));
                }
                multipliers = parsed;
            }
            int finalRound = file.finalRound() == null
                    ? (file.multipliers() == null || file.multipliers().isEmpty() ? defaults.finalRound() : multipliers.size())
                    : file.finalRound();
            return new RoundRules(
                    multipliers,
                    finalRound,
                    sanitizeInt(file.shotsPerRound(), defaults.shotsPerRound(), 1),
                    file.instantLoss() == null ? defaults.instantLoss() : file.instantLoss(),
                    file.success() == null ? defaults.success() : file.success(),
                    file.miss() == null ? defaults.miss() : file.miss(),
                    file.cashoutFraction() == null ? defaults.cashoutFraction() : Multipliers.fromDecimal(file.cashoutFraction())
            );
        }
    }

    public enum ScoringRule {
        SUM,
        COUNT_AT_LEAST;

        public static ScoringRule fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                return SUM;
            }
            String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            for (ScoringRule value : values()) {
                if (value.name().equals(normalized)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown duel scoring rule: " + raw);
        }
    }

    /**
     * Duel. Tier keys are the minimum winning score for that payout multiplier (hundredths).
     */
    public record DuelRules(int shotQuota, ScoringRule scoring, int threshold, NavigableMap<Integer, Long> tiers) {
        public DuelRules {
            tiers = Collections.unmodifiableNavigableMap(new TreeMap<>(tiers));
        }

        public int score(List<Integer> rolls) {
            int total = 0;
            for (int roll : rolls) {
                total += switch (scoring) {
                    case SUM -> roll;
                    case COUNT_AT_LEAST -> roll >= threshold ? 1 : 0;
                };
            }
            return total;
        }

        public long tierFor(int score) {
            Map.Entry<Integer, Long> entry = tiers.floorEntry(score);
            return entry == null ? 0L : entry.getValue();
        }

        void validate() {
            if (shotQuota < 1) {
                throw new IllegalArgumentException("duel.shotQuota must be at least 1");
            }
            if (tiers.isEmpty()) {
                throw new IllegalArgumentException("duel.tiers must not be empty");
            }
        }

        static DuelRules fromFile(DuelFile file, DuelRules defaults) {
            if (file == null) {
                return defaults;
            }
            NavigableMap<Integer, Long> tiers = defaults.tiers();
            if (file.tiers() != null && !file.tiers().isEmpty()) {
                NavigableMap<Integer, Long> parsed = new TreeMap<>();
                for (Map.Entry<Integer, BigDecimal> e : file.tiers().entrySet()) {
                    parsed.put(e.getKey(), Multipliers.fromDecimal(e.getValue()));
                }
                tiers = parsed;
            }
            return new DuelRules(
                    sanitizeInt(file.shotQuota(), defaults.shotQuota(), 1),
                    file.scoring() == null ? defaults.scoring() : ScoringRule.fromString(file.scoring()),
                    file.threshold() == null ? defaults.threshold() : file.threshold(),
                    tiers
            );
        }
    }

    record SettingsFile(
            Long turnTimeoutMs,
            Long pollIntervalMs,
            Integer pollBatchSize,
            Long overdueGraceMs,
            Integer rollMin,
            Integer rollMax,
            EscalationFile escalation,
            RoundsFile rounds,
            DuelFile duel
    ) {
    }

    record EffectFile(String label, BigDecimal factor) {
    }

    record EscalationFile(Integer maxTurns, Integer roundSize, LinkedHashMap<Integer, EffectFile> effects) {
    }

    record RoundsFile(
            LinkedHashMap<Integer, BigDecimal> multipliers,
            Integer finalRound,
            Integer shotsPerRound,
            Set<Integer> instantLoss,
            Set<Integer> success,
            Set<Integer> miss,
            BigDecimal cashoutFraction
    ) {
    }

    record DuelFile(Integer shotQuota, String scoring, Integer threshold, LinkedHashMap<Integer, BigDecimal> tiers) {
    }
}
