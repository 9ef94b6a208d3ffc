package io.dicehall.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.dicehall.bus.BusEvents;
import io.dicehall.bus.NotificationBus;
import io.dicehall.config.DiceHallConfig;
import io.dicehall.config.GameSettings;
import io.dicehall.game.GameEngineRegistry;
import io.dicehall.model.NewSession;
import io.dicehall.model.SessionRecord;
import io.dicehall.model.SessionStatus;
import io.dicehall.model.TurnAction;
import io.dicehall.observability.SessionAuditLog;
import io.dicehall.prompt.CurrencyFormatter;
import io.dicehall.prompt.DecimalCurrencyFormatter;
import io.dicehall.prompt.LoggingPromptChannel;
import io.dicehall.prompt.PromptChannel;
import io.dicehall.storage.Database;
import io.dicehall.storage.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One worker process: store, engines, timers, poller and bus subscriptions wired together.
 * The bus is supplied by the caller and is not closed here.
 */
public final class DiceHallRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiceHallRuntime.class);

    private final DiceHallConfig config;
    private final GameSettings settings;
    private final String workerId;
    private final Database database;
    private final SessionStore store;
    private final NotificationBus bus;
    private final ThreadPoolExecutor eventExecutor;
    private final TurnTimeoutManager timers;
    private final StoreRetrier retrier;
    private final SessionAuditLog audit;
    private final Finalizer finalizer;
    private final SessionCoordinator coordinator;
    private final FallbackPoller poller;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong claimEvents = new AtomicLong(0L);
    private final AtomicLong turnEvents = new AtomicLong(0L);

    public DiceHallRuntime(DiceHallConfig config,
                           GameSettings settings,
                           NotificationBus bus,
                           PromptChannel prompts,
                           CurrencyFormatter currency,
                           String workerId) {
        this.config = config;
        this.settings = settings;
        this.workerId = workerId == null || workerId.isBlank() ? DiceHallConfig.DEFAULT_WORKER_ID : workerId.trim();
        this.database = new Database(config);
        this.store = new SessionStore(database);
        this.bus = bus;
        AtomicInteger threadCounter = new AtomicInteger();
        this.eventExecutor = new ThreadPoolExecutor(
                DiceHallConfig.DEFAULT_EVENT_POOL_CORE,
                DiceHallConfig.DEFAULT_EVENT_POOL_MAX,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(DiceHallConfig.DEFAULT_EVENT_QUEUE_CAPACITY),
                r -> {
                    Thread t = new Thread(r, "dicehall-event-" + this.workerId + "-" + threadCounter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        this.timers = new TurnTimeoutManager(DiceHallConfig.DEFAULT_TIMER_THREADS, eventExecutor);
        this.retrier = new StoreRetrier(
                eventExecutor,
                DiceHallConfig.DEFAULT_STORE_RETRY_ATTEMPTS,
                DiceHallConfig.DEFAULT_STORE_RETRY_BASE_MS,
                DiceHallConfig.DEFAULT_STORE_RETRY_MAX_MS
        );
        this.audit = new SessionAuditLog(config.auditFile(this.workerId), this.workerId);
        GameEngineRegistry engines = GameEngineRegistry.withDefaults(settings);
        this.finalizer = new Finalizer(store, engines, bus, prompts, timers, audit, this.workerId);
        this.coordinator = new SessionCoordinator(store, engines, finalizer, timers, retrier, prompts, currency, audit, settings, this.workerId);
        this.poller = new FallbackPoller(store, bus, finalizer, settings);
    }

    /**
     * Runtime with the settings file under the data root, prompts written to the log and
     * amounts shown in SOL.
     */
    public static DiceHallRuntime create(DiceHallConfig config, NotificationBus bus, String workerId) {
        return new DiceHallRuntime(
                config,
                GameSettings.load(config.settingsFile()),
                bus,
                new LoggingPromptChannel(),
                DecimalCurrencyFormatter.lamports(),
                workerId
        );
    }

    public void init() {
        database.init();
    }

    /**
     * Subscribes to claim and turn events and starts the fallback poller.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        init();
        bus.subscribe(BusEvents.SESSION_CLAIMABLE, payload -> {
            claimEvents.incrementAndGet();
            retrier.submit("claim event on worker " + workerId, () -> {
                BusEvents.SessionClaimable event = BusEvents.decode(payload, BusEvents.SessionClaimable.class);
                coordinator.onClaimable(event.sessionId());
            });
        });
        bus.subscribe(BusEvents.TURN_SUBMITTED, payload -> {
            turnEvents.incrementAndGet();
            retrier.submit("turn event on worker " + workerId, () -> {
                BusEvents.TurnSubmitted event = BusEvents.decode(payload, BusEvents.TurnSubmitted.class);
                coordinator.onTurnSubmitted(event.toAction());
            });
        });
        poller.start();
        log.info("Worker {} started on {}", workerId, config.rootDir());
    }

    /**
     * Stores a new pending session and announces it. A lost announcement is recovered by the poller.
     */
    public SubmitOutcome createSession(NewSession session) {
        boolean created = store.createPending(session, System.currentTimeMillis());
        if (created) {
            publishQuietly(BusEvents.SESSION_CLAIMABLE, BusEvents.encode(new BusEvents.SessionClaimable(session.sessionId())));
        }
        SessionStatus status = store.getSession(session.sessionId())
                .map(SessionRecord::status)
                .orElse(SessionStatus.PENDING_CLAIM);
        return new SubmitOutcome(session.sessionId(), created, status.dbValue());
    }

    /**
     * Publishes a player action stamped with the session's current turn version.
     */
    public TurnAction submitTurn(String sessionId, String actorId, TurnAction.ActionKind kind, Integer rollValue) {
        SessionRecord session = store.getSession(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        if (session.status() != SessionStatus.IN_PROGRESS) {
            throw new IllegalStateException("Session " + sessionId + " is " + session.status().dbValue());
        }
        TurnAction action = new TurnAction(sessionId, actorId, kind, rollValue, session.turnVersion());
        bus.publish(BusEvents.TURN_SUBMITTED, BusEvents.encode(BusEvents.TurnSubmitted.of(action)));
        return action;
    }

    public FallbackPoller.PollOutcome pollOnce() {
        return poller.runOnce();
    }

    public Optional<SessionRecord> getSession(String sessionId) {
        return store.getSession(sessionId);
    }

    public List<SessionRecord> listSessions(String status, int limit, int offset) {
        return store.listSessions(status, limit, offset);
    }

    public List<SessionStore.ConflictRow> listConflicts(int limit) {
        return store.listConflicts(limit);
    }

    public List<JsonNode> auditTail(int lines) {
        return audit.tail(lines);
    }

    public SessionAuditLog.VerifyResult verifyAudit() {
        return audit.verify();
    }

    public StatsView stats() {
        return new StatsView(
                workerId,
                store.countByStatus(),
                timers.armedCount(),
                claimEvents.get(),
                turnEvents.get(),
                retrier.retries(),
                retrier.failures(),
                eventExecutor.getQueue().size()
        );
    }

    public String workerId() {
        return workerId;
    }

    public SessionCoordinator coordinator() {
        return coordinator;
    }

    public Finalizer finalizer() {
        return finalizer;
    }

    public TurnTimeoutManager timers() {
        return timers;
    }

    @Override
    public void close() {
        poller.close();
        retrier.close();
        eventExecutor.shutdown();
        try {
            if (!eventExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                eventExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            eventExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timers.close();
        log.info("Worker {} stopped", workerId);
    }

    private void publishQuietly(String channel, String payload) {
        try {
            bus.publish(channel, payload);
        } catch (RuntimeException e) {
            log.warn("Publish on {} failed, poller will retry: {}", channel, e.toString());
        }
    }

    public record SubmitOutcome(String sessionId, boolean created, String status) {
    }

    public record StatsView(
            String workerId,
            Map<String, Long> sessionsByStatus,
            int armedTimers,
            long claimEvents,
            long turnEvents,
            long storeRetries,
            long handlerFailures,
            int eventQueueDepth
    ) {
    }
}
