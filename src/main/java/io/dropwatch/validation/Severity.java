package io.dropwatch.validation;

public enum Severity {
    /** Rejects the deposit. */
    CRITICAL,
    /** Recorded only. */
    WARNING
}
