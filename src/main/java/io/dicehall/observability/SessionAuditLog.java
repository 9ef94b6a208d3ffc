package io.dicehall.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.dicehall.util.Hashing;
import io.dicehall.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines log of session lifecycle events. Each row carries the hash of the
 * previous row, so truncation or edits in the middle are detectable with {@link #verify()}.
 */
public final class SessionAuditLog {
    private static final Logger log = LoggerFactory.getLogger(SessionAuditLog.class);
    private final Path auditFile;
    private final String workerId;
    private String previousHash;

    public SessionAuditLog(Path auditFile, String workerId) {
        this.auditFile = auditFile;
        this.workerId = workerId;
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit directory: " + auditFile.getParent(), e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("worker_id", workerId);
        row.put("action", event.action());
        row.put("session_id", event.sessionId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    /**
     * Audit is a side record; a write failure is logged and never fails the caller's operation.
     */
    public void logQuietly(AuditEvent event) {
        try {
            log(event);
        } catch (RuntimeException e) {
            log.warn("Audit write failed for {} {}: {}", event.action(), event.sessionId(), e.toString());
        }
    }

    public List<JsonNode> tail(int lines) {
        int safe = Math.max(1, lines);
        try {
            List<String> all = readLines();
            List<JsonNode> out = new ArrayList<>();
            for (String line : all.subList(Math.max(0, all.size() - safe), all.size())) {
                if (!line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    /**
     * Re-hashes every row and checks the chain links.
     */
    @SuppressWarnings("unchecked")
    public VerifyResult verify() {
        String expectedPrev = "";
        int checked = 0;
        try {
            for (String line : readLines()) {
                if (line.isBlank()) {
                    continue;
                }
                checked++;
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    return new VerifyResult(false, checked, "prev_hash mismatch at row " + checked);
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    return new VerifyResult(false, checked, "hash mismatch at row " + checked);
                }
                expectedPrev = recomputed;
            }
            return new VerifyResult(true, checked, null);
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log", e);
        }
    }

    // The file appears with the first row; a worker that never wrote has an empty chain.
    private List<String> readLines() throws IOException {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : readLines()) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit chain head: " + auditFile, e);
        }
    }

    public record AuditEvent(String action, String sessionId, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String sessionId, String result, Map<String, Object> details) {
            return new AuditEvent(action, sessionId, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyResult(boolean valid, int rowsChecked, String problem) {
    }
}
