package io.dropwatch.control;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Process-wide switch gating the supervisory cycle.
 */
public enum ControlState {
    ACTIVE,
    PAUSED,
    STOPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ControlState parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Control state is required (active|paused|stopped)");
        }
        try {
            return ControlState.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown control state: " + raw + " (active|paused|stopped)");
        }
    }
}
