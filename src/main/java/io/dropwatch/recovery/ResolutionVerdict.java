package io.dropwatch.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reviewer answer to a needs-judgment drop.
 */
public enum ResolutionVerdict {
    /** The validator was wrong; the deposit stands and the drop completes. */
    ACCEPT,
    /** Try again with the same retry mechanics as an automatic retry. */
    RETRY,
    /** The work is unusable; the drop is dead and is never retried automatically. */
    REJECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResolutionVerdict parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Verdict is required (accept|retry|reject)");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown verdict: " + raw + " (accept|retry|reject)");
        }
    }
}
