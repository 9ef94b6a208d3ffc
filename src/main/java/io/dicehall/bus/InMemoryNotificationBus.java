package io.dicehall.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Single-process bus. Handlers run on the publishing thread. Delivery can be switched off to
 * simulate an outage; events published meanwhile are dropped, not queued.
 */
public final class InMemoryNotificationBus implements NotificationBus {
    private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationBus.class);

    private final Map<String, List<Consumer<String>>> handlers = new ConcurrentHashMap<>();
    private final AtomicBoolean deliveryEnabled = new AtomicBoolean(true);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong published = new AtomicLong(0L);
    private final AtomicLong dropped = new AtomicLong(0L);

    @Override
    public void publish(String channel, String payload) {
        if (closed.get()) {
            throw new IllegalStateException("bus is closed");
        }
        published.incrementAndGet();
        if (!deliveryEnabled.get()) {
            dropped.incrementAndGet();
            return;
        }
        for (Consumer<String> handler : handlers.getOrDefault(channel, List.of())) {
            try {
                handler.accept(payload);
            } catch (RuntimeException e) {
                log.warn("Handler on channel {} failed: {}", channel, e.toString());
            }
        }
    }

    @Override
    public void subscribe(String channel, Consumer<String> handler) {
        handlers.computeIfAbsent(channel, key -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void setDeliveryEnabled(boolean enabled) {
        deliveryEnabled.set(enabled);
    }

    public long publishedCount() {
        return published.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        closed.set(true);
        handlers.clear();
    }
}
