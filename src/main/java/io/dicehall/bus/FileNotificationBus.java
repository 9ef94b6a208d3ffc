package io.dicehall.bus;

import io.dicehall.config.DiceHallConfig;
import io.dicehall.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Cross-process bus over a shared directory. Each subscribing node owns
 * {@code bus/subscribers/<node>/<channel>/}; publishing copies the event into the inbox of every
 * node whose heartbeat is fresh. Each node drains its own inbox: read, delete, then dispatch.
 * Nodes that are down miss whatever is published meanwhile.
 */
public final class FileNotificationBus implements NotificationBus {
    private static final Logger log = LoggerFactory.getLogger(FileNotificationBus.class);
    private static final String HEARTBEAT_FILE = "heartbeat";
    private static final String EVENT_SUFFIX = ".event.json";
    private static final long MAX_POLL_BACKOFF_MS = 30_000L;

    private final Path subscribersRoot;
    private final String nodeId;
    private final long pollIntervalMs;
    private final long staleAfterMs;
    private final Map<String, List<Consumer<String>>> handlers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0L);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object pollLock = new Object();
    private ScheduledExecutorService poller;
    private int consecutiveFailures = 0;
    private long nextPollAtMs = 0L;

    public FileNotificationBus(DiceHallConfig config, String nodeId) {
        this(config, nodeId, DiceHallConfig.DEFAULT_BUS_POLL_INTERVAL_MS, DiceHallConfig.DEFAULT_SUBSCRIBER_STALE_MS);
    }

    public FileNotificationBus(DiceHallConfig config, String nodeId, long pollIntervalMs, long staleAfterMs) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
        this.subscribersRoot = config.busRoot().resolve("subscribers");
        this.nodeId = sanitize(nodeId);
        this.pollIntervalMs = Math.max(10L, pollIntervalMs);
        this.staleAfterMs = Math.max(this.pollIntervalMs * 2L, staleAfterMs);
    }

    @Override
    public void publish(String channel, String payload) {
        if (closed.get()) {
            throw new IllegalStateException("bus is closed");
        }
        String fileName = System.currentTimeMillis() + "_"
                + String.format("%012d", sequence.incrementAndGet()) + "_"
                + UUID.randomUUID().toString().substring(0, 8) + EVENT_SUFFIX;
        long freshAfter = System.currentTimeMillis() - staleAfterMs;
        for (Path nodeDir : listDirectories(subscribersRoot)) {
            Path inbox = nodeDir.resolve(sanitize(channel));
            if (!Files.isDirectory(inbox) || !isFresh(nodeDir.resolve(HEARTBEAT_FILE), freshAfter)) {
                continue;
            }
            try {
                Path tmp = inbox.resolve("." + fileName + ".tmp");
                Files.writeString(tmp, payload, StandardCharsets.UTF_8);
                Path target = inbox.resolve(fileName);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
                } catch (IOException atomicUnsupported) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                log.warn("Failed to deliver {} event to {}: {}", channel, nodeDir.getFileName(), e.toString());
            }
        }
    }

    @Override
    public void subscribe(String channel, Consumer<String> handler) {
        if (closed.get()) {
            throw new IllegalStateException("bus is closed");
        }
        try {
            Files.createDirectories(nodeDir().resolve(sanitize(channel)));
            touchHeartbeat();
        } catch (IOException e) {
            throw new RuntimeException("Failed to subscribe to channel: " + channel, e);
        }
        handlers.computeIfAbsent(sanitize(channel), key -> new CopyOnWriteArrayList<>()).add(handler);
        startPollerIfNeeded();
    }

    /**
     * Drains this node's inboxes once.
     *
     * @return number of events dispatched
     */
    public int pollOnce() {
        synchronized (pollLock) {
            long now = System.currentTimeMillis();
            if (now < nextPollAtMs) {
                return 0;
            }
            try {
                touchHeartbeat();
                int dispatched = 0;
                for (Map.Entry<String, List<Consumer<String>>> entry : handlers.entrySet()) {
                    dispatched += drainChannel(entry.getKey(), entry.getValue());
                }
                consecutiveFailures = 0;
                return dispatched;
            } catch (IOException e) {
                consecutiveFailures++;
                long delay = Backoff.computeBackoffMs(consecutiveFailures, pollIntervalMs, MAX_POLL_BACKOFF_MS);
                nextPollAtMs = now + delay;
                log.warn("Bus poll failed (attempt {}), backing off {}ms: {}", consecutiveFailures, delay, e.toString());
                return 0;
            }
        }
    }

    public String nodeId() {
        return nodeId;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (pollLock) {
            if (poller != null) {
                poller.shutdownNow();
            }
        }
        try {
            Files.deleteIfExists(nodeDir().resolve(HEARTBEAT_FILE));
        } catch (IOException e) {
            log.warn("Failed to remove heartbeat for {}: {}", nodeId, e.toString());
        }
    }

    private int drainChannel(String channel, List<Consumer<String>> channelHandlers) throws IOException {
        Path inbox = nodeDir().resolve(channel);
        int dispatched = 0;
        for (Path file : listEventFiles(inbox)) {
            String payload;
            try {
                payload = Files.readString(file, StandardCharsets.UTF_8);
                Files.delete(file);
            } catch (NoSuchFileException gone) {
                continue;
            }
            for (Consumer<String> handler : channelHandlers) {
                try {
                    handler.accept(payload);
                } catch (RuntimeException e) {
                    log.warn("Handler on channel {} failed: {}", channel, e.toString());
                }
            }
            dispatched++;
        }
        return dispatched;
    }

    private void startPollerIfNeeded() {
        synchronized (pollLock) {
            if (poller != null || closed.get()) {
                return;
            }
            poller = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "dicehall-bus-" + nodeId);
                t.setDaemon(true);
                return t;
            });
            poller.scheduleWithFixedDelay(this::pollSafely, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.warn("Bus poll loop error: {}", e.toString());
        }
    }

    private void touchHeartbeat() throws IOException {
        Path heartbeat = nodeDir().resolve(HEARTBEAT_FILE);
        Files.createDirectories(heartbeat.getParent());
        if (!Files.exists(heartbeat)) {
            Files.writeString(heartbeat, nodeId, StandardCharsets.UTF_8);
        }
        Files.setLastModifiedTime(heartbeat, FileTime.fromMillis(System.currentTimeMillis()));
    }

    private boolean isFresh(Path heartbeat, long freshAfterMs) {
        try {
            return Files.getLastModifiedTime(heartbeat).toMillis() >= freshAfterMs;
        } catch (IOException e) {
            return false;
        }
    }

    private Path nodeDir() {
        return subscribersRoot.resolve(nodeId);
    }

    private List<Path> listEventFiles(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + EVENT_SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private List<Path> listDirectories(Path dir) {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path path : stream) {
                out.add(path);
            }
        } catch (IOException e) {
            log.warn("Failed to list subscribers under {}: {}", dir, e.toString());
        }
        return out;
    }

    private static String sanitize(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        return sb.toString();
    }
}
