package io.dropwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a drop ended up {@code failed} or {@code dead}.
 */
public enum FailureKind {
    /** Worker could not be started. Infrastructure error. */
    SPAWN_ERROR,
    /** Deposit gate found critical markers in the artifacts. */
    CONTENT_REJECTED,
    /** Worker deposited {@code blocked}, {@code partial} or an unrecognised status. */
    WORKER_BLOCKED,
    /** Worker process is gone and left no deposit. */
    UNRESPONSIVE,
    /** Worker ran past the dead threshold without depositing. */
    DEAD_TIMEOUT,
    /** A reviewer rejected the drop through the judgment channel. */
    REVIEW_REJECTED;

    public boolean deadTimeout() {
        return this == UNRESPONSIVE || this == DEAD_TIMEOUT;
    }

    public boolean contentError() {
        return this == CONTENT_REJECTED || this == WORKER_BLOCKED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
