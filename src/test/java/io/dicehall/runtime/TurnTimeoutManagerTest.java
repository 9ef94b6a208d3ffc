package io.dicehall.runtime;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class TurnTimeoutManagerTest {

    @Test
    void firesOnceWithTheArmedTurnVersion() throws Exception {
        try (TurnTimeoutManager timers = new TurnTimeoutManager(1, Runnable::run)) {
            CountDownLatch fired = new CountDownLatch(1);
            List<String> calls = new CopyOnWriteArrayList<>();
            timers.arm("s1", 4L, System.currentTimeMillis() + 50L, (id, version) -> {
                calls.add(id + "@" + version);
                fired.countDown();
            });
            Assertions.assertTrue(timers.isArmed("s1"));
            Assertions.assertEquals(4L, timers.armedVersion("s1"));

            Assertions.assertTrue(fired.await(5, TimeUnit.SECONDS));
            Thread.sleep(100L);
            Assertions.assertEquals(List.of("s1@4"), calls);
            Assertions.assertFalse(timers.isArmed("s1"));
        }
    }

    @Test
    void rearmingReplacesThePreviousDeadline() throws Exception {
        try (TurnTimeoutManager timers = new TurnTimeoutManager(1, Runnable::run)) {
            CountDownLatch fired = new CountDownLatch(1);
            List<Long> versions = new CopyOnWriteArrayList<>();
            TurnTimeoutManager.TimeoutHandler handler = (id, version) -> {
                versions.add(version);
                fired.countDown();
            };
            long now = System.currentTimeMillis();
            timers.arm("s1", 1L, now + 50L, handler);
            timers.arm("s1", 2L, now + 150L, handler);
            Assertions.assertEquals(1, timers.armedCount());

            Assertions.assertTrue(fired.await(5, TimeUnit.SECONDS));
            Thread.sleep(150L);
            Assertions.assertEquals(List.of(2L), versions);
        }
    }

    @Test
    void cancelledTimerNeverFires() throws Exception {
        try (TurnTimeoutManager timers = new TurnTimeoutManager(1, Runnable::run)) {
            List<String> calls = new CopyOnWriteArrayList<>();
            timers.arm("s1", 1L, System.currentTimeMillis() + 100L, (id, version) -> calls.add(id));

            Assertions.assertTrue(timers.cancel("s1"));
            Assertions.assertFalse(timers.cancel("s1"));
            Thread.sleep(250L);
            Assertions.assertTrue(calls.isEmpty());
            Assertions.assertEquals(0, timers.armedCount());
        }
    }

    @Test
    void pastDeadlineFiresImmediately() throws Exception {
        try (TurnTimeoutManager timers = new TurnTimeoutManager(1, Runnable::run)) {
            CountDownLatch fired = new CountDownLatch(1);
            timers.arm("s1", 9L, System.currentTimeMillis() - 1_000L, (id, version) -> fired.countDown());
            Assertions.assertTrue(fired.await(5, TimeUnit.SECONDS));
        }
    }
}
