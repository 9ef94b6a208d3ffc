package io.dicehall.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class DiceHallConfig {
    public static final String DEFAULT_WORKER_ID = "worker-local";
    public static final long DEFAULT_TURN_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 2_500L;
    public static final int DEFAULT_POLL_BATCH_SIZE = 5;
    public static final long DEFAULT_OVERDUE_GRACE_MS = 5_000L;
    public static final int DEFAULT_EVENT_POOL_CORE = 4;
    public static final int DEFAULT_EVENT_POOL_MAX = 8;
    public static final int DEFAULT_EVENT_QUEUE_CAPACITY = 1_000;
    public static final int DEFAULT_TIMER_THREADS = 2;
    public static final long DEFAULT_BUS_POLL_INTERVAL_MS = 100L;
    public static final long DEFAULT_SUBSCRIBER_STALE_MS = 30_000L;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_STORE_RETRY_ATTEMPTS = 5;
    public static final long DEFAULT_STORE_RETRY_BASE_MS = 250L;
    public static final long DEFAULT_STORE_RETRY_MAX_MS = 5_000L;

    private final Path rootDir;
    private final long busyTimeoutMs;

    public DiceHallConfig(Path rootDir) {
        this(rootDir, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public DiceHallConfig(Path rootDir, long busyTimeoutMs) {
        this.rootDir = rootDir;
        this.busyTimeoutMs = Math.max(0L, busyTimeoutMs);
    }

    public static DiceHallConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new DiceHallConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public DiceHallConfig withBusyTimeoutMs(long value) {
        return new DiceHallConfig(rootDir, value);
    }

    /**
     * How long a connection waits for another writer's lock before giving up with SQLITE_BUSY.
     */
    public long busyTimeoutMs() {
        return busyTimeoutMs;
    }

    public Path dbFile() {
        return rootDir.resolve("dicehall.db");
    }

    public Path busRoot() {
        return rootDir.resolve("bus");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    /**
     * One hash chain per worker, so concurrent workers never interleave rows of the same chain.
     */
    public Path auditFile(String workerId) {
        String safe = workerId == null || workerId.isBlank() ? DEFAULT_WORKER_ID : workerId.trim();
        return auditRoot().resolve(safe.replaceAll("[^A-Za-z0-9_.-]", "-") + ".audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve("dicehall-settings.json");
    }
}
