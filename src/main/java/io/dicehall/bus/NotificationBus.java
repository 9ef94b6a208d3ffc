package io.dicehall.bus;

import java.util.function.Consumer;

/**
 * Broadcast publish/subscribe. Delivery is at most once and best effort: a subscriber that is
 * down when an event is published never sees it, and handlers must tolerate duplicates.
 */
public interface NotificationBus extends AutoCloseable {
    void publish(String channel, String payload);

    void subscribe(String channel, Consumer<String> handler);

    @Override
    void close();
}
