package io.dropwatch.recovery;

import io.dropwatch.config.SupervisorSettings;

/**
 * Tunables the recovery rules read. Kept apart from {@link SupervisorSettings} so the engine stays a
 * pure function of a snapshot and a clock reading.
 */
public record RecoveryPolicy(int maxRetries, long staleThresholdMs, long staleNoProgressMs) {
    public RecoveryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (staleThresholdMs <= 0 || staleNoProgressMs <= 0) {
            throw new IllegalArgumentException("stale thresholds must be positive");
        }
    }

    public static RecoveryPolicy from(SupervisorSettings settings) {
        return new RecoveryPolicy(settings.maxRetries(), settings.staleThresholdMs(), settings.staleNoProgressMs());
    }
}
