package io.dropwatch.config;

import io.dropwatch.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Per-deployment tunables for the supervisory cycle.
 *
 * <p>Loaded from {@code dropwatch-settings.json} under the data root. Every field in the file is
 * optional; absent fields fall back to {@link #defaults()} and numeric values are clamped to a sane
 * minimum.
 */
public record SupervisorSettings(
        int maxRetries,
        long staleThresholdMs,
        long staleNoProgressMs,
        long deadThresholdMs,
        long leaseTtlMs,
        int circuitThreshold,
        long circuitWindowMs,
        long circuitCooldownMs,
        long passTimeoutMs,
        List<String> workerCommand,
        List<String> validatorExtensions,
        List<String> extraCriticalPatterns,
        List<String> extraWarningPatterns
) {
    public static final List<String> DEFAULT_EXTENSIONS = List.of(".py", ".ts", ".js", ".java", ".md");

    public SupervisorSettings {
        workerCommand = workerCommand == null ? List.of() : List.copyOf(workerCommand);
        validatorExtensions = validatorExtensions == null ? DEFAULT_EXTENSIONS : List.copyOf(validatorExtensions);
        extraCriticalPatterns = extraCriticalPatterns == null ? List.of() : List.copyOf(extraCriticalPatterns);
        extraWarningPatterns = extraWarningPatterns == null ? List.of() : List.copyOf(extraWarningPatterns);
    }

    public static SupervisorSettings defaults() {
        return new SupervisorSettings(
                DropWatchConfig.DEFAULT_MAX_RETRIES,
                DropWatchConfig.DEFAULT_STALE_THRESHOLD_MS,
                DropWatchConfig.DEFAULT_STALE_NO_PROGRESS_MS,
                DropWatchConfig.DEFAULT_DEAD_THRESHOLD_MS,
                DropWatchConfig.DEFAULT_LEASE_TTL_MS,
                DropWatchConfig.DEFAULT_CIRCUIT_THRESHOLD,
                DropWatchConfig.DEFAULT_CIRCUIT_WINDOW_MS,
                DropWatchConfig.DEFAULT_CIRCUIT_COOLDOWN_MS,
                DropWatchConfig.DEFAULT_PASS_TIMEOUT_MS,
                List.of(),
                DEFAULT_EXTENSIONS,
                List.of(),
                List.of()
        );
    }

    public static SupervisorSettings load(Path file) {
        SupervisorSettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load supervisor settings: " + file, e);
        }
    }

    static SupervisorSettings fromFile(SettingsFile file, SupervisorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long staleThreshold = sanitizeLong(file.staleThresholdMs(), defaults.staleThresholdMs(), 1_000L);
        long noProgress = sanitizeLong(file.staleNoProgressMs(), defaults.staleNoProgressMs(), 1_000L);
        long leaseTtl = sanitizeLong(file.leaseTtlMs(), defaults.leaseTtlMs(), 1_000L);
        long passTimeout = sanitizeLong(file.passTimeoutMs(), defaults.passTimeoutMs(), 100L);
        if (passTimeout > leaseTtl) {
            passTimeout = leaseTtl;
        }
        return new SupervisorSettings(
                sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0),
                staleThreshold,
                noProgress,
                sanitizeLong(file.deadThresholdMs(), defaults.deadThresholdMs(), 1_000L),
                leaseTtl,
                sanitizeInt(file.circuitThreshold(), defaults.circuitThreshold(), 1),
                sanitizeLong(file.circuitWindowMs(), defaults.circuitWindowMs(), 1_000L),
                sanitizeLong(file.circuitCooldownMs(), defaults.circuitCooldownMs(), 1_000L),
                passTimeout,
                file.workerCommand() == null ? defaults.workerCommand() : file.workerCommand(),
                file.validatorExtensions() == null
                        ? defaults.validatorExtensions()
                        : normalizeExtensions(file.validatorExtensions()),
                file.extraCriticalPatterns() == null ? defaults.extraCriticalPatterns() : file.extraCriticalPatterns(),
                file.extraWarningPatterns() == null ? defaults.extraWarningPatterns() : file.extraWarningPatterns()
        );
    }

    public static List<String> normalizeExtensions(List<String> raw) {
        return raw.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .map(s -> s.startsWith(".") ? s : "." + s)
                .distinct()
                .toList();
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Integer maxRetries,
            Long staleThresholdMs,
            Long staleNoProgressMs,
            Long deadThresholdMs,
            Long leaseTtlMs,
            Integer circuitThreshold,
            Long circuitWindowMs,
            Long circuitCooldownMs,
            Long passTimeoutMs,
            List<String> workerCommand,
            List<String> validatorExtensions,
            List<String> extraCriticalPatterns,
            List<String> extraWarningPatterns
    ) {
    }
}
