package io.dropwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BuildStatus {
    ACTIVE,
    PAUSED,
    BLOCKED,
    COMPLETE,
    FAILED;

    public boolean terminal() {
        return this == COMPLETE || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
