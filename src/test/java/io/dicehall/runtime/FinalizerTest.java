package io.dicehall.runtime;

import io.dicehall.bus.BusEvents;
import io.dicehall.bus.InMemoryNotificationBus;
import io.dicehall.config.DiceHallConfig;
import io.dicehall.config.GameSettings;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class FinalizerTest {

    @Test
    void secondFinalizeIsANoOp() throws Exception {
        Path root = Files.createTempDirectory("dicehall-finalizer-");
        List<String> completions = new CopyOnWriteArrayList<>();
        RecordingPromptChannel prompts = new RecordingPromptChannel();
        try (InMemoryNotificationBus bus = new InMemoryNotificationBus();
             DiceHallRuntime runtime = RuntimeFixtures.runtime(root, "w1", GameSettings.defaults(), bus, prompts)) {
            bus.subscribe(BusEvents.SESSION_COMPLETED, completions::add);
            runtime.createSession(RuntimeFixtures.escalating("s1"));
            runtime.coordinator().onClaimable("s1");
            Finalizer finalizer = runtime.finalizer();

            Finalizer.FinalizeOutcome first = finalizer.finalizeSession("s1", SessionStatus.COMPLETED_CASHOUT, null, "operator");
            Finalizer.FinalizeOutcome second = finalizer.finalizeSession("s1", SessionStatus.COMPLETED_LOSS, null, "duplicate");

            Assertions.assertTrue(first.applied());
            Assertions.assertEquals(1_000L, first.finalPayout());
            Assertions.assertFalse(second.applied());
            SessionRecord row = runtime.getSession("s1").orElseThrow();
            Assertions.assertEquals(SessionStatus.COMPLETED_CASHOUT, row.status());
            Assertions.assertEquals(1_000L, row.finalPayout());
            Assertions.assertEquals(1, completions.size());
            Assertions.assertEquals(List.of("prompt-1"), prompts.deleted());
            Assertions.assertFalse(runtime.timers().isArmed("s1"));
            Assertions.assertTrue(runtime.listConflicts(10).stream()
                    .anyMatch(r -> "finalize_conflict".equals(r.eventType()) && "completed_cashout".equals(r.actualStatus())));
        } finally {
            RuntimeFixtures.deleteRecursively(root);
        }
    }

    @Test
    void finalizeForAnOlderTurnIsSkipped() throws Exception {
        Path root = Files.createTempDirectory("dicehall-finalizer-");
        try (InMemoryNotificationBus bus = new InMemoryNotificationBus();
             DiceHallRuntime runtime = RuntimeFixtures.runtime(root, "w1", GameSettings.defaults(), bus, new RecordingPromptChannel())) {
            runtime.createSession(RuntimeFixtures.escalating("s1"));
            runtime.coordinator().onClaimable("s1");

            Finalizer.FinalizeOutcome outcome = runtime.finalizer()
                    .finalizeSession("s1", SessionStatus.COMPLETED_TIMEOUT, 7L, "old timer");

            Assertions.assertFalse(outcome.applied());
            Assertions.assertEquals(SessionStatus.IN_PROGRESS, runtime.getSession("s1").orElseThrow().status());
            Assertions.assertTrue(runtime.timers().isArmed("s1"));
            Assertions.assertTrue(runtime.listConflicts(10).stream()
                    .anyMatch(r -> "finalize_stale_version".equals(r.eventType()) && Long.valueOf(7L).equals(r.expectedVersion())));
        } finally {
            RuntimeFixtures.deleteRecursively(root);
        }
    }

    @Test
    void unreadableStateSettlesAsErrorWithZeroPayout() throws Exception {
        Path root = Files.createTempDirectory("dicehall-finalizer-");
        try (InMemoryNotificationBus bus = new InMemoryNotificationBus();
             DiceHallRuntime runtime = RuntimeFixtures.runtime(root, "w1", GameSettings.defaults(), bus, new RecordingPromptChannel())) {
            runtime.createSession(RuntimeFixtures.escalating("s1"));
            runtime.coordinator().onClaimable("s1");
            Database database = new Database(DiceHallConfig.fromRoot(root.toString()));
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("UPDATE game_sessions SET state_json='{broken' WHERE session_id=?")) {
                ps.setString(1, "s1");
                ps.executeUpdate();
            }

            Finalizer.FinalizeOutcome outcome = runtime.finalizer()
                    .finalizeSession("s1", SessionStatus.COMPLETED_CASHOUT, null, "operator");

            Assertions.assertTrue(outcome.applied());
            Assertions.assertEquals(SessionStatus.ERROR, outcome.status());
            SessionRecord row = runtime.getSession("s1").orElseThrow();
            Assertions.assertEquals(SessionStatus.ERROR, row.status());
            Assertions.assertEquals(0L, row.finalPayout());
        } finally {
            RuntimeFixtures.deleteRecursively(root);
        }
    }
}
