package com.z254.butterfly.triage.domain.model;

import java.util.Locale;

/**
 * Incident severity, ordered by rank (INFO = 1 ... CRITICAL = 5).
 */
public enum Severity {
    INFO(1),
    LOW(2),
    MEDIUM(3),
    HIGH(4),
    CRITICAL(5);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isHigherThan(Severity other) {
        return other == null || rank > other.rank;
    }

    /**
     * Returns the higher-ranked of two severities. Ties keep {@code this}.
     */
    public Severity max(Severity other) {
        return other != null && other.rank > rank ? other : this;
    }

    /**
     * Map a raw severity label from an alert source onto the closed severity set.
     * <p>
     * Source vocabularies differ ("FATAL", "ERROR", "WARNING", "DEBUG", ...), so the known
     * aliases are folded onto their tier and anything unrecognised falls back to {@link #INFO}.
     */
    public static Severity normalize(String raw) {
        if (raw == null) {
            return INFO;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "CRITICAL", "FATAL" -> CRITICAL;
            case "HIGH", "ERROR" -> HIGH;
            case "MEDIUM", "MED", "WARNING" -> MEDIUM;
            case "LOW", "SUCCESS" -> LOW;
            case "INFO", "DEBUG" -> INFO;
            default -> INFO;
        };
    }
}
