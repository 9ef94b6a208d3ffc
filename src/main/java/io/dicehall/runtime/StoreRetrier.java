package io.dicehall.runtime;

import io.dicehall.storage.StoreUnavailableException;
import io.dicehall.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs event work and re-dispatches it with exponential backoff while the store reports a busy
 * write lock. Any other failure is logged and counted once; the work is not repeated.
 */
public final class StoreRetrier implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreRetrier.class);

    private final Executor executor;
    private final ScheduledThreadPoolExecutor delays;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final AtomicLong retries = new AtomicLong(0L);
    private final AtomicLong failures = new AtomicLong(0L);

    public StoreRetrier(Executor executor, int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        this.executor = executor;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(1L, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
        this.delays = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "dicehall-store-retry");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * First attempt on the executor.
     */
    public void submit(String label, Runnable work) {
        execute(label, work, 1);
    }

    /**
     * First attempt on the calling thread; later attempts on the executor.
     */
    public void run(String label, Runnable work) {
        attempt(label, work, 1);
    }

    public long retries() {
        return retries.get();
    }

    public long failures() {
        return failures.get();
    }

    @Override
    public void close() {
        delays.shutdownNow();
    }

    private void execute(String label, Runnable work, int attempt) {
        try {
            executor.execute(() -> attempt(label, work, attempt));
        } catch (RejectedExecutionException e) {
            log.warn("{} dropped, worker is shutting down", label);
        }
    }

    private void attempt(String label, Runnable work, int attempt) {
        try {
            work.run();
        } catch (StoreUnavailableException e) {
            if (attempt >= maxAttempts) {
                failures.incrementAndGet();
                log.warn("{} gave up after {} attempts: {}", label, attempt, e.toString());
                return;
            }
            long delayMs = Backoff.computeBackoffMs(attempt, baseBackoffMs, maxBackoffMs);
            retries.incrementAndGet();
            log.info("{} found the store busy, attempt {} in {}ms", label, attempt + 1, delayMs);
            try {
                delays.schedule(() -> execute(label, work, attempt + 1), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                failures.incrementAndGet();
                log.warn("{} not retried, worker is shutting down", label);
            }
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.warn("{} failed: {}", label, e.toString());
        }
    }
}
