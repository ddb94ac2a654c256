package io.dropwatch.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class DropWatchConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "dropwatch-settings.json";
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final long DEFAULT_STALE_THRESHOLD_MS = 4L * 60L * 60L * 1000L;
    public static final long DEFAULT_STALE_NO_PROGRESS_MS = 60L * 60L * 1000L;
    public static final long DEFAULT_DEAD_THRESHOLD_MS = 15L * 60L * 1000L;
    public static final long DEFAULT_LEASE_TTL_MS = 180_000L;
    public static final int DEFAULT_CIRCUIT_THRESHOLD = 3;
    public static final long DEFAULT_CIRCUIT_WINDOW_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_CIRCUIT_COOLDOWN_MS = 300_000L;
    public static final long DEFAULT_PASS_TIMEOUT_MS = 120_000L;

    private final Path rootDir;

    public DropWatchConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static DropWatchConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new DropWatchConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("dropwatch.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path controlFile() {
        return rootDir.resolve("control.json");
    }

    public Path buildsRoot() {
        return rootDir.resolve("builds");
    }

    public Path buildDir(String slug) {
        return buildsRoot().resolve(slug);
    }

    public Path depositsDir(String slug) {
        return buildDir(slug).resolve("deposits");
    }

    public Path depositFile(String slug, String dropId) {
        return depositsDir(slug).resolve(dropId + ".json");
    }

    public Path archivedDepositsDir(String slug) {
        return depositsDir(slug).resolve("archived");
    }

    public Path validationDir(String slug) {
        return buildDir(slug).resolve("validation");
    }

    public Path briefsDir(String slug) {
        return buildDir(slug).resolve("briefs");
    }

    public Path briefFile(String slug, String dropId) {
        return briefsDir(slug).resolve(dropId + ".md");
    }

    public Path workerLogsDir(String slug) {
        return buildDir(slug).resolve("logs");
    }

    public Path learningsRoot() {
        return rootDir.resolve("learnings");
    }

    public Path lessonLogFile() {
        return learningsRoot().resolve("system-learnings.jsonl");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditLogFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path reportsRoot() {
        return rootDir.resolve("reports");
    }

    /**
     * Artifact paths in deposits may be relative to the data root.
     */
    public Path resolveArtifact(String artifact) {
        Path path = Paths.get(artifact);
        return path.isAbsolute() ? path.normalize() : rootDir.resolve(path).normalize();
    }
}
