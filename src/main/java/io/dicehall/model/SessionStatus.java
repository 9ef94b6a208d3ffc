package io.dicehall.model;

public enum SessionStatus {
    PENDING_CLAIM("pending_claim", "pending"),
    IN_PROGRESS("in_progress", "pending"),
    COMPLETED_WIN("completed_win", "win"),
    COMPLETED_LOSS("completed_loss", "loss"),
    COMPLETED_CASHOUT("completed_cashout", "cashout"),
    COMPLETED_TIMEOUT("completed_timeout", "loss"),
    COMPLETED_P1_WIN("completed_p1_win", "win"),
    COMPLETED_P2_WIN("completed_p2_win", "loss"),
    COMPLETED_PUSH("completed_push", "push"),
    ERROR("error", "loss");

    private final String dbValue;
    private final String outcome;

    SessionStatus(String dbValue, String outcome) {
        this.dbValue = dbValue;
        this.outcome = outcome;
    }

    public String dbValue() {
        return dbValue;
    }

    /**
     * Player-facing result. Timeouts and forced errors read as a loss.
     */
    public String outcome() {
        return outcome;
    }

    public boolean isTerminal() {
        return this != PENDING_CLAIM && this != IN_PROGRESS;
    }

    public static SessionStatus fromDb(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Session status must not be blank");
        }
        for (SessionStatus value : values()) {
            if (value.dbValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + raw);
    }
}
