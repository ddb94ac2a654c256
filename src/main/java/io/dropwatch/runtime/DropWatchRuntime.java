package io.dropwatch.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwatch.circuit.SpawnCircuitBreaker;
import io.dropwatch.config.DropWatchConfig;
import io.dropwatch.config.SupervisorSettings;
import io.dropwatch.control.ControlPlane;
import io.dropwatch.control.ControlState;
import io.dropwatch.model.BuildSnapshot;
import io.dropwatch.model.BuildStatus;
import io.dropwatch.model.BuildView;
import io.dropwatch.model.Deposit;
import io.dropwatch.model.DropStatus;
import io.dropwatch.model.DropView;
import io.dropwatch.model.FailureKind;
import io.dropwatch.observability.AuditLogger;
import io.dropwatch.observability.LessonLog;
import io.dropwatch.plan.PlanDocument;
import io.dropwatch.plan.PlanLoader;
import io.dropwatch.recovery.RecoveryEngine;
import io.dropwatch.recovery.RecoveryExecutor;
import io.dropwatch.recovery.RecoveryPolicy;
import io.dropwatch.recovery.ResolutionVerdict;
import io.dropwatch.storage.BuildStore;
import io.dropwatch.storage.Database;
import io.dropwatch.util.Jsons;
import io.dropwatch.validation.ArtifactScanner;
import io.dropwatch.validation.DepositValidator;
import io.dropwatch.validation.ValidationReport;
import io.dropwatch.validation.ValidationRules;
import io.dropwatch.worker.DepositInbox;
import io.dropwatch.worker.ScriptWorkerPool;
import io.dropwatch.worker.WorkerPool;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Wires the supervisory components for one data root and exposes every operator operation.
 *
 * <p>Operator mutations take the same tick lease a cycle takes (holder {@code operator:<pid>:<ts>}), so
 * they never interleave with a running pass. A busy lease is reported as {@link IllegalStateException}.
 */
public final class DropWatchRuntime {
    private static final DateTimeFormatter REPORT_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final DropWatchConfig config;
    private final Clock clock;
    private final SupervisorSettings settings;
    private final Database database;
    private final BuildStore store;
    private final AuditLogger auditLogger;
    private final LessonLog lessons;
    private final DepositInbox inbox;
    private final DepositValidator validator;
    private final ControlPlane controlPlane;
    private final RecoveryEngine recoveryEngine;
    private final RecoveryExecutor recoveryExecutor;
    private final TickScheduler scheduler;

    public DropWatchRuntime(DropWatchConfig config) {
        this(config, Clock.systemUTC(), null, SupervisorSettings.load(config.settingsFile()));
    }

    public DropWatchRuntime(DropWatchConfig config, Clock clock, WorkerPool workerPool, SupervisorSettings settings) {
        this.config = config;
        this.clock = clock;
        this.settings = settings;
        this.database = new Database(config);
        this.store = new BuildStore(database);
        this.auditLogger = new AuditLogger(config.auditLogFile(), clock);
        this.lessons = new LessonLog(config.lessonLogFile());
        this.inbox = new DepositInbox(config, clock);
        ValidationRules rules = ValidationRules.defaults()
                .withExtras(settings.extraCriticalPatterns(), settings.extraWarningPatterns());
        this.validator = new DepositValidator(new ArtifactScanner(rules), settings.validatorExtensions(), config,
                store, lessons, auditLogger, clock);
        SpawnCircuitBreaker breaker = new SpawnCircuitBreaker(store, auditLogger,
                settings.circuitThreshold(), settings.circuitWindowMs(), settings.circuitCooldownMs());
        this.controlPlane = new ControlPlane(config.controlFile(), clock);
        this.recoveryExecutor = new RecoveryExecutor(store, inbox, auditLogger, clock);
        WorkerPool workers = workerPool != null
                ? workerPool
                : new ScriptWorkerPool(settings.workerCommand(), config, inbox);
        OrchestrationPass pass = new OrchestrationPass(store, workers, inbox, validator, breaker, auditLogger, config,
                settings.deadThresholdMs(), clock);
        this.recoveryEngine = new RecoveryEngine(RecoveryPolicy.from(settings));
        this.scheduler = new TickScheduler(controlPlane, store, pass, recoveryEngine, recoveryExecutor, auditLogger,
                settings.leaseTtlMs(), settings.passTimeoutMs(), clock);
    }

    public void init() {
        database.init();
    }

    public DropWatchConfig config() {
        return config;
    }

    public SupervisorSettings settings() {
        return settings;
    }

    public CreateOutcome createBuild(Path planFile) {
        return createBuild(PlanLoader.load(planFile));
    }

    public CreateOutcome createBuild(PlanDocument plan) {
        BuildView build = store.createBuild(plan, clock.millis());
        List<String> briefs = new ArrayList<>();
        for (PlanDocument.PlanDrop drop : plan.drops()) {
            if (drop.brief() == null || drop.brief().isBlank()) {
                continue;
            }
            Path file = config.briefFile(plan.slug(), drop.id());
            try {
                Files.createDirectories(file.getParent());
                Files.writeString(file, drop.brief(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new RuntimeException("Failed to write brief: " + file, e);
            }
            briefs.add(drop.id());
        }
        try {
            Files.createDirectories(config.depositsDir(plan.slug()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to create deposits directory for " + plan.slug(), e);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("drops", plan.drops().size());
        details.put("waves", List.copyOf(plan.waves().keySet()));
        auditLogger.log(AuditLogger.AuditEvent.of("build.create", "cli", plan.slug(), null, "created", details));
        return new CreateOutcome(build.slug(), build.status(), plan.drops().size(),
                List.copyOf(plan.waves().keySet()), briefs);
    }

    public List<BuildView> builds() {
        return store.listBuilds(null);
    }

    public BuildStatusView status(String slug) {
        BuildSnapshot snapshot = requireSnapshot(slug);
        return new BuildStatusView(
                snapshot.build(),
                snapshot.waves(),
                snapshot.activeWave().orElse(null),
                snapshot.readyDrops().stream().map(DropView::dropId).toList(),
                snapshot.drops()
        );
    }

    public TickScheduler.TickReport tick(String holderPrefix, boolean dryRun) {
        return scheduler.tick(holderPrefix, dryRun);
    }

    public ControlPlane.ControlSnapshot control() {
        return controlPlane.read();
    }

    public ControlPlane.ControlSnapshot control(ControlState state) {
        ControlPlane.ControlSnapshot snapshot = controlPlane.write(state);
        auditLogger.log(AuditLogger.AuditEvent.of("control.set", "cli", null, null, state.wireName(), Map.of()));
        return snapshot;
    }

    /**
     * Re-runs the gate checks on a drop's current deposit and writes a fresh report. Drop status is left
     * alone.
     */
    public ReportOutcome validate(String slug, String dropId) {
        requireDrop(slug, dropId);
        Deposit deposit = inbox.read(slug, dropId)
                .orElseThrow(() -> new IllegalArgumentException("No deposit for " + slug + "/" + dropId));
        ValidationReport report = validator.evaluate(slug, deposit);
        Path file = validator.writeReport(slug, report);
        return new ReportOutcome(report.passed(), report.toRow(), file.toString());
    }

    public ReportOutcome scan(Path root, Collection<String> extensions) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        Collection<String> exts = extensions == null || extensions.isEmpty()
                ? settings.validatorExtensions()
                : SupervisorSettings.normalizeExtensions(List.copyOf(extensions));
        ValidationReport report = validator.scan(root, exts);
        Map<String, Object> row = report.toRow();
        row.put("path", root.toAbsolutePath().normalize().toString());
        Path file = writeReport("scan_" + REPORT_STAMP.format(clock.instant()), row);
        return new ReportOutcome(report.passed(), row, file.toString());
    }

    /**
     * Evaluates every current deposit of a build without changing any drop.
     */
    public ReportOutcome auditBuild(String slug) {
        requireSnapshot(slug);
        int critical = 0;
        int warnings = 0;
        List<Map<String, Object>> reports = new ArrayList<>();
        for (Deposit deposit : inbox.list(slug)) {
            ValidationReport report = validator.evaluate(slug, deposit);
            critical += report.criticalCount();
            warnings += report.warningCount();
            Map<String, Object> row = report.toRow();
            row.put("claimed_status", deposit.status());
            reports.add(row);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("build_slug", slug);
        summary.put("timestamp", clock.instant().toString());
        summary.put("deposits_checked", reports.size());
        summary.put("critical_count", critical);
        summary.put("warning_count", warnings);
        summary.put("passed", critical == 0);
        summary.put("deposits", reports);
        Path file = writeReport(slug + "_audit_" + REPORT_STAMP.format(clock.instant()), summary);
        return new ReportOutcome(critical == 0, summary, file.toString());
    }

    public DropActionOutcome retry(String slug, String dropId, String reason) {
        DropView drop = requireDrop(slug, dropId);
        if (!drop.status().broken()) {
            throw new IllegalArgumentException("Drop " + dropId + " is " + drop.status().wireName()
                    + "; only failed or dead drops can be retried");
        }
        String note = "Operator requested a retry" + (reason == null || reason.isBlank() ? "." : ": " + reason);
        return withOperatorLease(slug, holder -> {
            BuildStore.DropTransition t = recoveryExecutor.retryDrop(slug, dropId, holder, note);
            boolean reactivated = t.isApplied() && reactivate(slug, holder, "Retry of " + dropId);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("note", note);
            details.put("outcome", t.outcome().name());
            auditLogger.log(AuditLogger.AuditEvent.of("drop.retry", holder, slug, dropId,
                    t.isApplied() ? "retried" : "not_applied", details));
            return new DropActionOutcome(slug, dropId, "retry", t.isApplied(), currentStatus(slug, dropId),
                    reactivated, t.isApplied() ? "Drop reset to pending" : "Retry not applied: " + t.outcome());
        });
    }

    /**
     * Resolution channel for needs-judgment drops, i.e. drops failed with a content error.
     */
    public DropActionOutcome resolve(String slug, String dropId, ResolutionVerdict verdict, String note) {
        DropView drop = requireDrop(slug, dropId);
        if (drop.status() != DropStatus.FAILED || drop.failureKind() == null || !drop.failureKind().contentError()) {
            throw new IllegalArgumentException("Drop " + dropId + " is not awaiting judgment (status "
                    + drop.status().wireName() + (drop.failureKind() == null ? "" : "/" + drop.failureKind().wireName())
                    + ")");
        }
        String reviewerNote = note == null || note.isBlank() ? null : note.trim();
        return withOperatorLease(slug, holder -> {
            long nowMs = clock.millis();
            BuildStore.DropTransition t = switch (verdict) {
                case ACCEPT -> store.markComplete(slug, dropId, holder, EnumSet.of(DropStatus.FAILED), nowMs);
                case RETRY -> recoveryExecutor.retryDrop(slug, dropId, holder,
                        "Reviewer requested another attempt" + (reviewerNote == null ? "." : ": " + reviewerNote));
                case REJECT -> store.markBroken(slug, dropId, holder, DropStatus.DEAD, FailureKind.REVIEW_REJECTED,
                        "Rejected by reviewer" + (reviewerNote == null ? "" : ": " + reviewerNote),
                        EnumSet.of(DropStatus.FAILED), nowMs);
            };
            boolean reactivated = t.isApplied() && verdict != ResolutionVerdict.REJECT
                    && reactivate(slug, holder, "Resolved " + dropId + " (" + verdict.wireName() + ")");

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("verdict", verdict.wireName());
            details.put("note", reviewerNote);
            details.put("previous_reason", drop.failureReason());
            details.put("outcome", t.outcome().name());
            auditLogger.log(AuditLogger.AuditEvent.of("drop.resolve", holder, slug, dropId,
                    t.isApplied() ? verdict.wireName() : "not_applied", details));
            if (t.isApplied()) {
                recordResolutionLesson(slug, dropId, verdict, details);
            }
            return new DropActionOutcome(slug, dropId, "resolve:" + verdict.wireName(), t.isApplied(),
                    currentStatus(slug, dropId), reactivated,
                    t.isApplied() ? "Verdict applied" : "Verdict not applied: " + t.outcome());
        });
    }

    public BuildActionOutcome resume(String slug) {
        return changeBuildStatus(slug, "resume", EnumSet.of(BuildStatus.BLOCKED, BuildStatus.PAUSED),
                BuildStatus.ACTIVE, "Resumed by operator");
    }

    public BuildActionOutcome pause(String slug) {
        return changeBuildStatus(slug, "pause", EnumSet.of(BuildStatus.ACTIVE), BuildStatus.PAUSED,
                "Paused by operator");
    }

    public BuildActionOutcome abandon(String slug, String reason) {
        String why = reason == null || reason.isBlank() ? "Abandoned by operator" : "Abandoned: " + reason;
        return changeBuildStatus(slug, "abandon",
                EnumSet.of(BuildStatus.ACTIVE, BuildStatus.PAUSED, BuildStatus.BLOCKED), BuildStatus.FAILED, why);
    }

    public List<JsonNode> lessons(int limit) {
        return lessons.tail(limit);
    }

    public List<BuildStore.RecoveryActionRow> recoveryLog(String slug, int limit) {
        requireSnapshot(slug);
        return store.listRecoveryActions(slug, limit);
    }

    public List<BuildStore.LeaseConflict> leaseConflicts(String slug, int limit) {
        requireSnapshot(slug);
        return store.listLeaseConflicts(slug, limit);
    }

    public List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    private BuildActionOutcome changeBuildStatus(String slug, String action, Set<BuildStatus> from, BuildStatus to,
                                                 String reason) {
        BuildView build = requireSnapshot(slug).build();
        if (!from.contains(build.status())) {
            throw new IllegalArgumentException("Cannot " + action + " build " + slug + " in status "
                    + build.status().wireName());
        }
        return withOperatorLease(slug, holder -> {
            boolean applied = store.setBuildStatus(slug, holder, from, to, reason, clock.millis());
            auditLogger.log(AuditLogger.AuditEvent.of("build." + action, holder, slug, null,
                    applied ? to.wireName() : "not_applied", Map.of("reason", reason)));
            BuildStatus now = store.getBuild(slug).map(BuildView::status).orElse(build.status());
            return new BuildActionOutcome(slug, action, applied, now, applied ? reason : "Status changed concurrently");
        });
    }

    /**
     * Sets a blocked build back to active, but only when the wave that blocked it can move again.
     */
    private boolean reactivate(String slug, String holder, String reason) {
        Optional<BuildSnapshot> snapshot = store.snapshot(slug);
        if (snapshot.isEmpty() || snapshot.get().build().status() != BuildStatus.BLOCKED) {
            return false;
        }
        if (!recoveryEngine.hasPathForward(snapshot.get())) {
            auditLogger.log(AuditLogger.AuditEvent.of("build.resume", holder, slug, null, "still_blocked",
                    Map.of("reason", reason)));
            return false;
        }
        boolean reactivated = store.setBuildStatus(slug, holder, EnumSet.of(BuildStatus.BLOCKED),
                BuildStatus.ACTIVE, reason, clock.millis());
        if (reactivated) {
            auditLogger.log(AuditLogger.AuditEvent.of("build.resume", holder, slug, null, "active",
                    Map.of("reason", reason)));
        }
        return reactivated;
    }

    private void recordResolutionLesson(String slug, String dropId, ResolutionVerdict verdict,
                                        Map<String, Object> details) {
        try {
            lessons.append(new LessonLog.Lesson(
                    clock.instant().toString(),
                    slug,
                    dropId,
                    LessonLog.CATEGORY_REVIEW,
                    "info",
                    "Reviewer verdict '" + verdict.wireName() + "' for drop " + dropId,
                    details,
                    verdict.wireName()
            ));
        } catch (RuntimeException e) {
            auditLogger.log(AuditLogger.AuditEvent.of("lesson.append_failed", "cli", slug, dropId, "error",
                    Map.of("error", String.valueOf(e.getMessage()))));
        }
    }

    private <T> T withOperatorLease(String slug, Function<String, T> action) {
        String holder = "operator:" + ProcessHandle.current().pid() + ":" + clock.millis();
        BuildStore.LeaseGrant grant = store.tryAcquireTickLease(slug, holder, settings.leaseTtlMs(), clock.millis());
        if (!grant.acquired()) {
            throw new IllegalStateException("Build " + slug + " is locked by " + grant.holder()
                    + "; retry after the current cycle");
        }
        try {
            return action.apply(holder);
        } finally {
            store.releaseTickLease(slug, holder);
        }
    }

    private Path writeReport(String name, Map<String, Object> body) {
        Path file = config.reportsRoot().resolve(name + ".json");
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, Jsons.toJson(body), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write report: " + file, e);
        }
        return file;
    }

    private BuildSnapshot requireSnapshot(String slug) {
        return store.snapshot(slug).orElseThrow(() -> new IllegalArgumentException("Build not found: " + slug));
    }

    private DropView requireDrop(String slug, String dropId) {
        return requireSnapshot(slug).drop(dropId)
                .orElseThrow(() -> new IllegalArgumentException("Drop not found: " + slug + "/" + dropId));
    }

    private DropStatus currentStatus(String slug, String dropId) {
        return store.getDrop(slug, dropId).map(DropView::status).orElse(null);
    }

    public record CreateOutcome(String slug, BuildStatus status, int drops, List<String> waves,
                                List<String> briefsWritten) {
    }

    public record BuildStatusView(
            BuildView build,
            Map<String, List<String>> waves,
            String activeWave,
            List<String> readyDrops,
            List<DropView> drops
    ) {
    }

    public record ReportOutcome(boolean passed, Map<String, Object> report, String reportFile) {
    }

    public record DropActionOutcome(
            String slug,
            String dropId,
            String action,
            boolean applied,
            DropStatus status,
            boolean buildReactivated,
            String message
    ) {
    }

    public record BuildActionOutcome(String slug, String action, boolean applied, BuildStatus status, String message) {
    }
}
