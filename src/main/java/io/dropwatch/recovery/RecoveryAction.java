package io.dropwatch.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecoveryAction {
    AUTO_RETRY,
    ESCALATE,
    NEEDS_JUDGMENT,
    NONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
