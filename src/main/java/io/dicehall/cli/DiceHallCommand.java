package io.dicehall.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.dicehall.bus.FileNotificationBus;
import io.dicehall.config.DiceHallConfig;
import io.dicehall.model.GameArchetype;
import io.dicehall.model.NewSession;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.TurnAction;
import io.dicehall.observability.SessionAuditLog;
import io.dicehall.runtime.DiceHallRuntime;
import io.dicehall.runtime.FallbackPoller;
import io.dicehall.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "dicehall",
        mixinStandardHelpOptions = true,
        description = "DiceHall turn-based session coordinator CLI",
        subcommands = {
                DiceHallCommand.InitCommand.class,
                DiceHallCommand.SubmitCommand.class,
                DiceHallCommand.WorkerCommand.class,
                DiceHallCommand.RollCommand.class,
                DiceHallCommand.CashOutCommand.class,
                DiceHallCommand.ContinueCommand.class,
                DiceHallCommand.SessionCommand.class,
                DiceHallCommand.SessionsCommand.class,
                DiceHallCommand.ConflictsCommand.class,
                DiceHallCommand.PollCommand.class,
                DiceHallCommand.StatsCommand.class,
                DiceHallCommand.AuditTailCommand.class
        }
)
public final class DiceHallCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | worker | roll | cash-out | continue | session | sessions | conflicts | poll | stats | audit-tail");
    }

    DiceHallConfig config() {
        return DiceHallConfig.fromRoot(root);
    }

    /**
     * Identity of a one-shot command: its bus node and its own audit chain, apart from any worker's.
     */
    String cliIdentity() {
        return "cli-" + ProcessHandle.current().pid();
    }

    /**
     * Publishing-only bus for one-shot commands. It never subscribes, so it never receives.
     */
    FileNotificationBus clientBus() {
        return new FileNotificationBus(config(), cliIdentity());
    }

    DiceHallRuntime runtime(FileNotificationBus bus, String workerId) {
        DiceHallRuntime runtime = DiceHallRuntime.create(config(), bus, workerId);
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Override
        public Integer call() {
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime ignored = parent.runtime(bus, parent.cliIdentity())) {
                System.out.println("Initialized DiceHall at: " + parent.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "submit", description = "Create a pending session and announce it to workers")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Option(names = {"--session-id"}, description = "Session id; generated when omitted")
        String sessionId;

        @Option(names = {"--archetype"}, required = true,
                description = "escalating_stakes | round_progression | duel")
        String archetype;

        @Option(names = {"--stake"}, required = true, description = "Stake in smallest currency units")
        long stake;

        @Option(names = {"--initiator"}, required = true, description = "Initiating player id")
        String initiator;

        @Option(names = {"--initiator-name"}, description = "Initiating player display name")
        String initiatorName;

        @Option(names = {"--opponent"}, description = "Opponent player id (duel)")
        String opponent;

        @Option(names = {"--opponent-name"}, description = "Opponent display name")
        String opponentName;

        @Option(names = {"--channel"}, defaultValue = "console", description = "Destination for turn prompts")
        String channel;

        @Override
        public Integer call() {
            String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId.trim();
            // unknown tags are stored as given and settle as errors once claimed
            String tag = GameArchetype.fromTag(archetype).map(GameArchetype::tag).orElse(archetype);
            NewSession session = new NewSession(
                    id, tag, stake, initiator, initiatorName, opponent, opponentName, channel);
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime runtime = parent.runtime(bus, parent.cliIdentity())) {
                DiceHallRuntime.SubmitOutcome outcome = runtime.createSession(session);
                System.out.println(Jsons.toJson(outcome));
            }
            return 0;
        }
    }

    @Command(name = "worker", description = "Run a coordinator worker loop or a single poll")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Drain the bus and poll once, then exit")
        boolean once;

        @Option(names = {"--worker-id"}, defaultValue = DiceHallConfig.DEFAULT_WORKER_ID, description = "Worker identity")
        String workerId;

        @Option(names = {"--stats-interval-ms"}, defaultValue = "10000", description = "Stats print interval in ms")
        long statsIntervalMs;

        @Override
        public Integer call() throws Exception {
            FileNotificationBus bus = new FileNotificationBus(parent.config(), workerId);
            DiceHallRuntime runtime = parent.runtime(bus, workerId);
            try {
                runtime.start();
                if (once) {
                    // re-announce first so this node's own inbox holds the events it drains next
                    FallbackPoller.PollOutcome polled = runtime.pollOnce();
                    int delivered = bus.pollOnce();
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("workerId", runtime.workerId());
                    out.put("busEventsDispatched", delivered);
                    out.put("poll", polled);
                    System.out.println(Jsons.toJson(out));
                    return 0;
                }
                AtomicBoolean running = new AtomicBoolean(true);
                Thread main = Thread.currentThread();
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    running.set(false);
                    main.interrupt();
                }, "dicehall-shutdown-hook"));
                while (running.get()) {
                    System.out.println(Jsons.toJson(runtime.stats()));
                    try {
                        Thread.sleep(Math.max(100L, statsIntervalMs));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
                return 0;
            } finally {
                runtime.close();
                bus.close();
            }
        }
    }

    abstract static class TurnCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Option(names = {"--session"}, required = true, description = "Session id")
        String sessionId;

        @Option(names = {"--actor"}, required = true, description = "Acting player id")
        String actorId;

        abstract TurnAction.ActionKind kind();

        Integer rollValue() {
            return null;
        }

        @Override
        public Integer call() {
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime runtime = parent.runtime(bus, parent.cliIdentity())) {
                TurnAction action = runtime.submitTurn(sessionId, actorId, kind(), rollValue());
                System.out.println(Jsons.toJson(action));
                return 0;
            } catch (IllegalArgumentException | IllegalStateException e) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("error", e.getMessage());
                System.out.println(Jsons.toJson(out));
                return 1;
            }
        }
    }

    @Command(name = "roll", description = "Submit a die roll for the current turn")
    static final class RollCommand extends TurnCommand {
        @Option(names = {"--value"}, required = true, description = "Rolled value")
        int value;

        @Override
        TurnAction.ActionKind kind() {
            return TurnAction.ActionKind.ROLL;
        }

        @Override
        Integer rollValue() {
            return value;
        }
    }

    @Command(name = "cash-out", description = "Take the current payout and end the session")
    static final class CashOutCommand extends TurnCommand {
        @Override
        TurnAction.ActionKind kind() {
            return TurnAction.ActionKind.CASH_OUT;
        }
    }

    @Command(name = "continue", description = "Carry on after a failed round")
    static final class ContinueCommand extends TurnCommand {
        @Override
        TurnAction.ActionKind kind() {
            return TurnAction.ActionKind.CONTINUE;
        }
    }

    @Command(name = "session", description = "Show one session by id")
    static final class SessionCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime runtime = parent.runtime(bus, parent.cliIdentity())) {
                Optional<SessionRecord> session = runtime.getSession(sessionId);
                if (session.isEmpty()) {
                    System.out.println("{\"error\":\"session not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(session.get()));
                return 0;
            }
        }
    }

    @Command(name = "sessions", description = "List sessions with optional filters")
    static final class SessionsCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Option(names = {"--status"}, description = "Filter by session status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime runtime = parent.runtime(bus, parent.cliIdentity())) {
                List<SessionRecord> rows = runtime.listSessions(status, limit, offset);
                System.out.println(Jsons.toJson(rows));
            }
            return 0;
        }
    }

    @Command(name = "conflicts", description = "List recorded claim and finalize conflicts")
    static final class ConflictsCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime runtime = parent.runtime(bus, parent.cliIdentity())) {
                System.out.println(Jsons.toJson(runtime.listConflicts(limit)));
            }
            return 0;
        }
    }

    @Command(name = "poll", description = "Run one fallback poll: re-announce pending sessions and expire overdue turns")
    static final class PollCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Option(names = {"--worker-id"}, description = "Identity recorded for expiries; defaults to cli-<pid>")
        String workerId;

        @Override
        public Integer call() {
            String identity = workerId == null || workerId.isBlank() ? parent.cliIdentity() : workerId.trim();
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime runtime = parent.runtime(bus, identity)) {
                System.out.println(Jsons.toJson(runtime.pollOnce()));
            }
            return 0;
        }
    }

    @Command(name = "stats", description = "Show session counts by status")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Override
        public Integer call() {
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime runtime = parent.runtime(bus, parent.cliIdentity())) {
                System.out.println(Jsons.toJson(runtime.stats()));
            }
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows of one worker")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        DiceHallCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Option(names = {"--worker-id"}, defaultValue = DiceHallConfig.DEFAULT_WORKER_ID, description = "Worker whose audit chain to read")
        String workerId;

        @Option(names = {"--verify"}, defaultValue = "false", description = "Verify the hash chain instead of printing rows")
        boolean verify;

        @Override
        public Integer call() {
            try (FileNotificationBus bus = parent.clientBus();
                 DiceHallRuntime runtime = parent.runtime(bus, workerId)) {
                if (verify) {
                    SessionAuditLog.VerifyResult result = runtime.verifyAudit();
                    System.out.println(Jsons.toJson(result));
                    return result.valid() ? 0 : 2;
                }
                for (JsonNode row : runtime.auditTail(lines)) {
                    System.out.println(Jsons.toCompactJson(row));
                }
            }
            return 0;
        }
    }
}
