package io.dicehall.runtime;

import io.dicehall.bus.BusEvents;
import io.dicehall.bus.NotificationBus;
import io.dicehall.config.GameSettings;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.storage.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Liveness backstop for a bus that drops messages. Each tick re-announces the oldest
 * pending_claim sessions and settles in_progress sessions whose deadline passed without the
 * owner's timer firing, for instance because the owner crashed.
 */
public final class FallbackPoller implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FallbackPoller.class);

    private final SessionStore store;
    private final NotificationBus bus;
    private final Finalizer finalizer;
    private final GameSettings settings;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService scheduler;

    public FallbackPoller(SessionStore store, NotificationBus bus, Finalizer finalizer, GameSettings settings) {
        this.store = store;
        this.bus = bus;
        this.finalizer = finalizer;
        this.settings = settings;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "dicehall-fallback-poller");
                t.setDaemon(true);
                return t;
            });
            long interval = settings.pollIntervalMs();
            scheduler.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    public PollOutcome runOnce() {
        return runOnce(System.currentTimeMillis());
    }

    /**
     * One scan. A call that overlaps a scan already in progress returns immediately.
     */
    public PollOutcome runOnce(long nowMs) {
        if (!running.compareAndSet(false, true)) {
            return PollOutcome.overlapping();
        }
        try {
            int republished = 0;
            for (SessionRecord session : store.listClaimable(settings.pollBatchSize())) {
                try {
                    bus.publish(BusEvents.SESSION_CLAIMABLE,
                            BusEvents.encode(new BusEvents.SessionClaimable(session.sessionId())));
                    republished++;
                } catch (RuntimeException e) {
                    log.warn("Failed to re-announce session {}: {}", session.sessionId(), e.toString());
                }
            }
            int expired = 0;
            long cutoff = nowMs - settings.overdueGraceMs();
            for (SessionRecord session : store.listOverdue(cutoff, settings.pollBatchSize())) {
                try {
                    Finalizer.FinalizeOutcome outcome = finalizer.finalizeSession(
                            session.sessionId(),
                            SessionStatus.COMPLETED_TIMEOUT,
                            session.turnVersion(),
                            "turn " + session.turnVersion() + " overdue"
                    );
                    if (outcome.applied()) {
                        expired++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to expire overdue session {}: {}", session.sessionId(), e.toString());
                }
            }
            if (republished > 0 || expired > 0) {
                log.info("Poll re-announced {} pending and expired {} overdue sessions", republished, expired);
            }
            return new PollOutcome(false, republished, expired);
        } finally {
            running.set(false);
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
    }

    private void tick() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.warn("Poll tick failed: {}", e.toString());
        }
    }

    public record PollOutcome(boolean skipped, int republished, int expired) {
        static PollOutcome overlapping() {
            return new PollOutcome(true, 0, 0);
        }
    }
}
