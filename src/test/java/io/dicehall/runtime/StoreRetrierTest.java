package io.dicehall.runtime;

import io.dicehall.storage.StoreUnavailableException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class StoreRetrierTest {

    @Test
    void busyStoreIsRetriedUntilTheWorkGoesThrough() throws Exception {
        try (StoreRetrier retrier = new StoreRetrier(Runnable::run, 5, 10L, 40L)) {
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch done = new CountDownLatch(1);
            retrier.submit("turn s1", () -> {
                if (calls.incrementAndGet() < 3) {
                    throw new StoreUnavailableException("busy", null);
                }
                done.countDown();
            });

            Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(3, calls.get());
            Assertions.assertEquals(2L, retrier.retries());
            Assertions.assertEquals(0L, retrier.failures());
        }
    }

    @Test
    void givesUpAfterTheLastAttempt() throws Exception {
        try (StoreRetrier retrier = new StoreRetrier(Runnable::run, 3, 10L, 20L)) {
            AtomicInteger calls = new AtomicInteger();
            retrier.run("timeout s1", () -> {
                calls.incrementAndGet();
                throw new StoreUnavailableException("busy", null);
            });

            RuntimeFixtures.await(() -> retrier.failures() == 1L, 5_000L);
            Assertions.assertEquals(3, calls.get());
            Assertions.assertEquals(2L, retrier.retries());
        }
    }

    @Test
    void otherFailuresAreNotRepeated() throws Exception {
        try (StoreRetrier retrier = new StoreRetrier(Runnable::run, 5, 10L, 40L)) {
            AtomicInteger calls = new AtomicInteger();
            retrier.submit("claim s1", () -> {
                calls.incrementAndGet();
                throw new IllegalStateException("malformed event");
            });

            Thread.sleep(100L);
            Assertions.assertEquals(1, calls.get());
            Assertions.assertEquals(0L, retrier.retries());
            Assertions.assertEquals(1L, retrier.failures());
        }
    }
}
