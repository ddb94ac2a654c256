package io.dropwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DropStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    FAILED,
    DEAD;

    public boolean terminal() {
        return this == COMPLETE || this == FAILED || this == DEAD;
    }

    public boolean broken() {
        return this == FAILED || this == DEAD;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
