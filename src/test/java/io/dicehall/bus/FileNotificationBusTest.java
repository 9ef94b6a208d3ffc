package io.dicehall.bus;

import io.dicehall.config.DiceHallConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class FileNotificationBusTest {

    @Test
    void broadcastsToEveryLiveSubscriberInPublishOrder() throws Exception {
        Path root = Files.createTempDirectory("dicehall-filebus-");
        DiceHallConfig config = DiceHallConfig.fromRoot(root.toString());
        try (FileNotificationBus nodeA = new FileNotificationBus(config, "node-a", 20L, 30_000L);
             FileNotificationBus nodeB = new FileNotificationBus(config, "node-b", 20L, 30_000L);
             FileNotificationBus publisher = new FileNotificationBus(config, "cli-1")) {
            List<String> seenA = new CopyOnWriteArrayList<>();
            List<String> seenB = new CopyOnWriteArrayList<>();
            nodeA.subscribe(BusEvents.SESSION_CLAIMABLE, seenA::add);
            nodeB.subscribe(BusEvents.SESSION_CLAIMABLE, seenB::add);

            publisher.publish(BusEvents.SESSION_CLAIMABLE, "first");
            publisher.publish(BusEvents.SESSION_CLAIMABLE, "second");

            await(() -> seenA.size() == 2 && seenB.size() == 2, 5_000L);
            Assertions.assertEquals(List.of("first", "second"), seenA);
            Assertions.assertEquals(List.of("first", "second"), seenB);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void closedNodeNoLongerReceives() throws Exception {
        Path root = Files.createTempDirectory("dicehall-filebus-");
        DiceHallConfig config = DiceHallConfig.fromRoot(root.toString());
        try (FileNotificationBus publisher = new FileNotificationBus(config, "cli-1")) {
            FileNotificationBus gone = new FileNotificationBus(config, "node-gone", 20L, 30_000L);
            gone.subscribe(BusEvents.TURN_SUBMITTED, payload -> {
            });
            gone.close();

            publisher.publish(BusEvents.TURN_SUBMITTED, "late");

            Path inbox = config.busRoot().resolve("subscribers").resolve("node-gone").resolve(BusEvents.TURN_SUBMITTED);
            try (Stream<Path> files = Files.list(inbox)) {
                Assertions.assertEquals(0L, files.count());
            }
            Assertions.assertThrows(IllegalStateException.class, () -> gone.publish(BusEvents.TURN_SUBMITTED, "x"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingHandlerDoesNotStopDelivery() throws Exception {
        Path root = Files.createTempDirectory("dicehall-filebus-");
        DiceHallConfig config = DiceHallConfig.fromRoot(root.toString());
        try (FileNotificationBus node = new FileNotificationBus(config, "node-a", 20L, 30_000L);
             FileNotificationBus publisher = new FileNotificationBus(config, "cli-1")) {
            List<String> seen = new CopyOnWriteArrayList<>();
            node.subscribe(BusEvents.SESSION_COMPLETED, payload -> {
                if ("boom".equals(payload)) {
                    throw new IllegalStateException("handler failure");
                }
                seen.add(payload);
            });
            publisher.publish(BusEvents.SESSION_COMPLETED, "boom");
            publisher.publish(BusEvents.SESSION_COMPLETED, "ok");

            await(() -> seen.contains("ok"), 5_000L);
            Assertions.assertEquals(List.of("ok"), seen);
        } finally {
            deleteRecursively(root);
        }
    }

    private static void await(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("condition not met within " + timeoutMs + "ms");
            }
            Thread.sleep(20L);
        }
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
