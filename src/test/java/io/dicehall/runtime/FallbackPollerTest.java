package io.dicehall.runtime;

import io.dicehall.bus.InMemoryNotificationBus;
import io.dicehall.config.DiceHallConfig;
import io.dicehall.config.GameSettings;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.storage.Database;
import io.dicehall.storage.SessionStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class FallbackPollerTest {

    @Test
    void droppedAnnouncementIsRecoveredByThePoller() throws Exception {
        Path root = Files.createTempDirectory("dicehall-poller-");
        GameSettings settings = GameSettings.defaults().withPolling(50L, 5, 0L);
        try (InMemoryNotificationBus bus = new InMemoryNotificationBus();
             DiceHallRuntime runtime = RuntimeFixtures.runtime(root, "w1", settings, bus, new RecordingPromptChannel())) {
            bus.setDeliveryEnabled(false);
            runtime.start();
            runtime.createSession(RuntimeFixtures.escalating("s1"));

            RuntimeFixtures.await(() -> bus.droppedCount() >= 2L, 5_000L);
            Assertions.assertEquals(SessionStatus.PENDING_CLAIM, runtime.getSession("s1").orElseThrow().status());

            bus.setDeliveryEnabled(true);
            RuntimeFixtures.awaitStatus(runtime, "s1", SessionStatus.IN_PROGRESS);
            Assertions.assertEquals("w1", runtime.getSession("s1").orElseThrow().workerId());
        } finally {
            RuntimeFixtures.deleteRecursively(root);
        }
    }

    @Test
    void overdueSessionOfACrashedOwnerIsExpired() throws Exception {
        Path root = Files.createTempDirectory("dicehall-poller-");
        GameSettings settings = GameSettings.defaults();
        try (InMemoryNotificationBus bus = new InMemoryNotificationBus()) {
            DiceHallRuntime owner = RuntimeFixtures.runtime(root, "w-owner", settings, bus, new RecordingPromptChannel());
            owner.createSession(RuntimeFixtures.escalating("s1"));
            owner.coordinator().onClaimable("s1");
            owner.close();

            try (DiceHallRuntime survivor = RuntimeFixtures.runtime(root, "w-survivor", settings, bus, new RecordingPromptChannel())) {
                SessionStore store = new SessionStore(new Database(DiceHallConfig.fromRoot(root.toString())));
                FallbackPoller poller = new FallbackPoller(store, bus, survivor.finalizer(), settings);
                long now = System.currentTimeMillis();

                Assertions.assertEquals(0, poller.runOnce(now).expired());
                FallbackPoller.PollOutcome late = poller.runOnce(now + settings.turnTimeoutMs() + settings.overdueGraceMs() + 1_000L);
                Assertions.assertEquals(1, late.expired());
                Assertions.assertEquals(0, poller.runOnce(now + 10 * settings.turnTimeoutMs()).expired());

                SessionRecord row = survivor.getSession("s1").orElseThrow();
                Assertions.assertEquals(SessionStatus.COMPLETED_TIMEOUT, row.status());
                Assertions.assertEquals(0L, row.finalPayout());
                Assertions.assertEquals("w-owner", row.workerId());
            }
        } finally {
            RuntimeFixtures.deleteRecursively(root);
        }
    }

    @Test
    void pendingSessionsAreReannouncedOldestFirstInBatches() throws Exception {
        Path root = Files.createTempDirectory("dicehall-poller-");
        GameSettings settings = GameSettings.defaults().withPolling(60_000L, 2, 0L);
        try (InMemoryNotificationBus bus = new InMemoryNotificationBus();
             DiceHallRuntime runtime = RuntimeFixtures.runtime(root, "w1", settings, bus, new RecordingPromptChannel())) {
            runtime.createSession(RuntimeFixtures.escalating("s1"));
            runtime.createSession(RuntimeFixtures.escalating("s2"));
            runtime.createSession(RuntimeFixtures.escalating("s3"));
            long before = bus.publishedCount();

            FallbackPoller.PollOutcome outcome = runtime.pollOnce();

            Assertions.assertFalse(outcome.skipped());
            Assertions.assertEquals(2, outcome.republished());
            Assertions.assertEquals(before + 2L, bus.publishedCount());
        } finally {
            RuntimeFixtures.deleteRecursively(root);
        }
    }
}
