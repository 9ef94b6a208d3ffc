package io.dicehall.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One cancellable deadline per session, addressed only by session id. Arming replaces whatever
 * timer the session had. Expiry hands {@code (sessionId, turnVersion)} to the handler on the
 * dispatch executor; the handler is expected to re-check the session under lock.
 */
public final class TurnTimeoutManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TurnTimeoutManager.class);

    @FunctionalInterface
    public interface TimeoutHandler {
        void onTimeout(String sessionId, long turnVersion);
    }

    private final ScheduledThreadPoolExecutor scheduler;
    private final Executor dispatch;
    private final ConcurrentMap<String, ArmedTimer> armed = new ConcurrentHashMap<>();

    public TurnTimeoutManager(int threads, Executor dispatch) {
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = new ScheduledThreadPoolExecutor(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "dicehall-turn-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.dispatch = dispatch;
    }

    public void arm(String sessionId, long turnVersion, long deadlineMs, TimeoutHandler handler) {
        ArmedTimer timer = new ArmedTimer(turnVersion);
        ArmedTimer previous = armed.put(sessionId, timer);
        if (previous != null) {
            previous.cancel();
        }
        long delayMs = Math.max(0L, deadlineMs - System.currentTimeMillis());
        try {
            timer.bind(scheduler.schedule(() -> fire(sessionId, timer, handler), delayMs, TimeUnit.MILLISECONDS));
            log.debug("Armed session {} turn {} in {}ms", sessionId, turnVersion, delayMs);
        } catch (RejectedExecutionException e) {
            armed.remove(sessionId, timer);
            log.warn("Timer for session {} not armed, scheduler is shut down", sessionId);
        }
    }

    /**
     * Best effort: a timer that already fired stays fired.
     *
     * @return true when a pending timer was removed
     */
    public boolean cancel(String sessionId) {
        ArmedTimer timer = armed.remove(sessionId);
        if (timer == null) {
            return false;
        }
        timer.cancel();
        return true;
    }

    public boolean isArmed(String sessionId) {
        return armed.containsKey(sessionId);
    }

    public Long armedVersion(String sessionId) {
        ArmedTimer timer = armed.get(sessionId);
        return timer == null ? null : timer.turnVersion();
    }

    public int armedCount() {
        return armed.size();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        armed.clear();
    }

    private void fire(String sessionId, ArmedTimer timer, TimeoutHandler handler) {
        if (timer.isCancelled() || !armed.remove(sessionId, timer)) {
            return;
        }
        try {
            dispatch.execute(() -> {
                try {
                    handler.onTimeout(sessionId, timer.turnVersion());
                } catch (RuntimeException e) {
                    log.warn("Timeout handling failed for session {} turn {}: {}", sessionId, timer.turnVersion(), e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Timeout for session {} dropped, dispatcher is shut down", sessionId);
        }
    }

    private static final class ArmedTimer {
        private final long turnVersion;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        ArmedTimer(long turnVersion) {
            this.turnVersion = turnVersion;
        }

        long turnVersion() {
            return turnVersion;
        }

        boolean isCancelled() {
            return cancelled.get();
        }

        void bind(ScheduledFuture<?> scheduled) {
            this.future = scheduled;
            if (cancelled.get()) {
                scheduled.cancel(false);
            }
        }

        void cancel() {
            cancelled.set(true);
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
