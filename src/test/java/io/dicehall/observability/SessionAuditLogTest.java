package io.dicehall.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class SessionAuditLogTest {

    @Test
    void chainSurvivesReopenAndDetectsTampering() throws Exception {
        Path root = Files.createTempDirectory("dicehall-audit-");
        try {
            Path file = root.resolve("audit").resolve("w1.audit.log");
            SessionAuditLog first = new SessionAuditLog(file, "w1");
            first.log(SessionAuditLog.AuditEvent.of("session.claim", "s1", "ok", Map.of("archetype", "duel")));
            first.log(SessionAuditLog.AuditEvent.of("session.turn", "s1", "ok", Map.of("roll_value", 4)));

            SessionAuditLog reopened = new SessionAuditLog(file, "w1");
            reopened.log(SessionAuditLog.AuditEvent.of("session.finalize", "s1", "ok", null));

            SessionAuditLog.VerifyResult valid = reopened.verify();
            Assertions.assertTrue(valid.valid(), valid.problem());
            Assertions.assertEquals(3, valid.rowsChecked());

            List<JsonNode> tail = reopened.tail(2);
            Assertions.assertEquals(2, tail.size());
            Assertions.assertEquals("session.finalize", tail.get(1).path("action").asText());
            Assertions.assertEquals(tail.get(0).path("hash").asText(), tail.get(1).path("prev_hash").asText());

            String tampered = Files.readString(file, StandardCharsets.UTF_8).replace("\"roll_value\":4", "\"roll_value\":6");
            Files.writeString(file, tampered, StandardCharsets.UTF_8);
            SessionAuditLog.VerifyResult broken = reopened.verify();
            Assertions.assertFalse(broken.valid());
            Assertions.assertEquals(2, broken.rowsChecked());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void chainFileAppearsWithTheFirstRow() throws Exception {
        Path root = Files.createTempDirectory("dicehall-audit-");
        try {
            Path file = root.resolve("audit").resolve("reader.audit.log");
            SessionAuditLog reader = new SessionAuditLog(file, "reader");

            Assertions.assertFalse(Files.exists(file));
            Assertions.assertTrue(reader.verify().valid());
            Assertions.assertEquals(0, reader.verify().rowsChecked());
            Assertions.assertTrue(reader.tail(5).isEmpty());

            reader.log(SessionAuditLog.AuditEvent.of("session.finalize", "s1", "ok", null));
            Assertions.assertTrue(Files.exists(file));
            Assertions.assertEquals(1, reader.verify().rowsChecked());
        } finally {
            deleteRecursively(root);
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
