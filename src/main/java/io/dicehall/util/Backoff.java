package io.dicehall.util;

import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private Backoff() {
    }

    /**
     * Doubling delay for the given 1-based attempt, capped at maxBackoffMs, plus 0..250ms jitter.
     */
    public static long computeBackoffMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long backoff = Math.max(1L, baseBackoffMs);
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return backoff + jitter;
    }
}
