package io.dicehall.cli;

import io.dicehall.config.DiceHallConfig;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.storage.Database;
import io.dicehall.storage.SessionStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class DiceHallCommandTest {

    @Test
    void submitStoresPendingSessionWithNormalizedArchetype() throws Exception {
        Path root = Files.createTempDirectory("dicehall-cli-");
        try {
            Assertions.assertEquals(0, run(root, "init"));
            Assertions.assertEquals(0, run(root, "submit", "--session-id", "s-cli", "--archetype", "Round-Progression",
                    "--stake", "2500", "--initiator", "alice", "--initiator-name", "Alice"));

            SessionStore store = new SessionStore(new Database(DiceHallConfig.fromRoot(root.toString())));
            SessionRecord row = store.getSession("s-cli").orElseThrow();
            Assertions.assertEquals(SessionStatus.PENDING_CLAIM, row.status());
            Assertions.assertEquals("round_progression", row.archetype());
            Assertions.assertEquals(2_500L, row.stakeAmount());
            Assertions.assertEquals("console", row.channelRef());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void actionsOnSessionsThatAreNotInProgressFail() throws Exception {
        Path root = Files.createTempDirectory("dicehall-cli-");
        try {
            run(root, "submit", "--session-id", "s-wait", "--archetype", "escalating_stakes",
                    "--stake", "100", "--initiator", "alice");

            Assertions.assertEquals(1, run(root, "roll", "--session", "s-wait", "--actor", "alice", "--value", "4"));
            Assertions.assertEquals(1, run(root, "cash-out", "--session", "missing", "--actor", "alice"));
            Assertions.assertEquals(1, run(root, "session", "missing"));
            Assertions.assertEquals(0, run(root, "session", "s-wait"));
            Assertions.assertEquals(0, run(root, "sessions", "--status", "pending_claim"));
            Assertions.assertEquals(0, run(root, "stats"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workerOnceClaimsWhatThePollerReannounces() throws Exception {
        Path root = Files.createTempDirectory("dicehall-cli-");
        try {
            run(root, "submit", "--session-id", "s-once", "--archetype", "duel", "--stake", "100",
                    "--initiator", "alice", "--opponent", "bob");

            Assertions.assertEquals(0, run(root, "worker", "--once", "--worker-id", "w-cli"));

            SessionStore store = new SessionStore(new Database(DiceHallConfig.fromRoot(root.toString())));
            SessionRecord row = store.getSession("s-once").orElseThrow();
            Assertions.assertEquals(SessionStatus.IN_PROGRESS, row.status());
            Assertions.assertEquals("w-cli", row.workerId());
            Assertions.assertEquals(0, run(root, "audit-tail", "--worker-id", "w-cli", "--verify"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pollSettlesOverdueSessionsUnderItsOwnAuditChain() throws Exception {
        Path root = Files.createTempDirectory("dicehall-cli-");
        try {
            run(root, "submit", "--session-id", "s-stuck", "--archetype", "escalating_stakes",
                    "--stake", "100", "--initiator", "alice");
            SessionStore store = new SessionStore(new Database(DiceHallConfig.fromRoot(root.toString())));
            long now = System.currentTimeMillis();
            store.inTransaction("strand session", c -> {
                store.tryClaim(c, "s-stuck", DiceHallConfig.DEFAULT_WORKER_ID, now - 120_000L);
                return store.writeTurn(c, "s-stuck", null, 0L, now - 60_000L, now - 120_000L);
            });

            Assertions.assertEquals(0, run(root, "poll"));

            Assertions.assertEquals(SessionStatus.COMPLETED_TIMEOUT, store.getSession("s-stuck").orElseThrow().status());
            Path auditRoot = root.resolve("audit");
            Assertions.assertFalse(Files.exists(auditRoot.resolve(DiceHallConfig.DEFAULT_WORKER_ID + ".audit.log")));
            String cliChain = "cli-" + ProcessHandle.current().pid();
            Assertions.assertTrue(Files.exists(auditRoot.resolve(cliChain + ".audit.log")));
            Assertions.assertEquals(0, run(root, "audit-tail", "--worker-id", cliChain, "--verify"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new DiceHallCommand()).execute(full);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
