package io.dropwatch.validation;

import io.dropwatch.config.DropWatchConfig;
import io.dropwatch.model.Deposit;
import io.dropwatch.model.DropStatus;
import io.dropwatch.model.FailureKind;
import io.dropwatch.observability.AuditLogger;
import io.dropwatch.observability.LessonLog;
import io.dropwatch.storage.BuildStore;
import io.dropwatch.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deposit acceptance gate.
 *
 * <p>A deposit that claims completion is only accepted when none of its artifacts carries a critical
 * marker. A rejected drop is marked {@code failed} with {@link FailureKind#CONTENT_REJECTED}, never
 * {@code dead}, and a lesson is appended to the system-learnings log. The lesson append is
 * best-effort: if it fails the drop is still rejected and the failure is audited.
 */
public final class DepositValidator {
    private static final DateTimeFormatter REPORT_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS").withZone(ZoneOffset.UTC);

    private final ArtifactScanner scanner;
    private final Collection<String> extensions;
    private final DropWatchConfig config;
    private final BuildStore store;
    private final LessonLog lessons;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public DepositValidator(ArtifactScanner scanner, Collection<String> extensions, DropWatchConfig config,
                            BuildStore store, LessonLog lessons, AuditLogger auditLogger, Clock clock) {
        this.scanner = scanner;
        this.extensions = List.copyOf(extensions);
        this.config = config;
        this.store = store;
        this.lessons = lessons;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * Scans the deposit's artifacts without side effects. A directory artifact is walked like
     * {@link #scan}, each matching file reported under {@code <artifact>/<relative path>}.
     */
    public ValidationReport evaluate(String slug, Deposit deposit) {
        Map<String, FileFindings> scanned = new LinkedHashMap<>();
        int filesChecked = 0;
        for (String artifact : deposit.artifacts()) {
            Path path = config.resolveArtifact(artifact);
            if (!Files.exists(path)) {
                Finding missing = new Finding("missing_artifact", "Artifact does not exist", 0, artifact);
                scanned.put(artifact, new FileFindings(List.of(), List.of(missing), null));
                continue;
            }
            if (Files.isDirectory(path)) {
                String prefix = artifact.endsWith("/") ? artifact : artifact + "/";
                Map<String, FileFindings> nested = scanner.scanTree(path, extensions);
                nested.forEach((relative, findings) -> scanned.put(prefix + relative.replace('\\', '/'), findings));
                filesChecked += nested.size();
                continue;
            }
            filesChecked++;
            scanned.put(artifact, scanner.scanFile(path));
        }
        return ValidationReport.of(deposit.dropId(), slug, clock.instant().toString(), filesChecked, scanned);
    }

    /**
     * Evaluates the deposit of a running drop and moves the drop to {@code complete} or
     * {@code failed}. The report is written next to the deposit, one file per evaluation.
     */
    public GateOutcome gate(String slug, Deposit deposit, String holder) {
        ValidationReport report = evaluate(slug, deposit);
        Path reportFile = writeReport(slug, report);
        long nowMs = clock.millis();
        if (report.passed()) {
            BuildStore.DropTransition transition = store.markComplete(
                    slug, deposit.dropId(), holder, EnumSet.of(DropStatus.RUNNING), nowMs);
            audit(slug, deposit.dropId(), "accepted", report, reportFile, transition, null);
            return new GateOutcome(report, reportFile, transition, true, null);
        }

        String reason = rejectionReason(report);
        BuildStore.DropTransition transition = store.markBroken(
                slug, deposit.dropId(), holder, DropStatus.FAILED, FailureKind.CONTENT_REJECTED,
                reason, EnumSet.of(DropStatus.RUNNING), nowMs);
        boolean lessonRecorded = false;
        String lessonError = null;
        if (transition.isApplied()) {
            try {
                lessons.append(new LessonLog.Lesson(
                        report.timestamp(),
                        slug,
                        deposit.dropId(),
                        LessonLog.CATEGORY_STUB_CODE,
                        "critical",
                        "Drop " + deposit.dropId() + " produced code with " + report.criticalCount() + " critical issues",
                        report.toRow(),
                        LessonLog.RESOLUTION_PENDING
                ));
                lessonRecorded = true;
            } catch (RuntimeException e) {
                lessonError = e.getMessage();
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("lesson_log", lessons.file().toString());
                details.put("error", String.valueOf(e.getMessage()));
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "lesson.append_failed", "validator", slug, deposit.dropId(), "error", details));
            }
        }
        audit(slug, deposit.dropId(), "rejected", report, reportFile, transition, reason);
        return new GateOutcome(report, reportFile, transition, lessonRecorded, lessonError);
    }

    public ValidationReport scan(Path root, Collection<String> extensions) {
        Map<String, FileFindings> scanned = scanner.scanTree(root, extensions);
        return ValidationReport.of(null, null, clock.instant().toString(), scanned.size(), scanned);
    }

    public Path writeReport(String slug, ValidationReport report) {
        Path dir = config.validationDir(slug);
        String base = report.dropId() + "_" + REPORT_STAMP.format(Instant.parse(report.timestamp()));
        String json = Jsons.toJson(report.toRow());
        try {
            Files.createDirectories(dir);
            for (int attempt = 0; ; attempt++) {
                Path target = dir.resolve(attempt == 0 ? base + ".json" : base + "-" + attempt + ".json");
                try {
                    Files.writeString(target, json, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    return target;
                } catch (FileAlreadyExistsException ignored) {
                    // Same millisecond as an earlier report for this drop; try the next suffix.
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write validation report for " + slug + "/" + report.dropId(), e);
        }
    }

    private static String rejectionReason(ValidationReport report) {
        Finding first = report.issues().values().stream()
                .flatMap(f -> f.critical().stream())
                .findFirst()
                .orElse(null);
        String reason = "Deposit rejected: " + report.criticalCount() + " critical issue(s)";
        if (first != null) {
            reason += ", first: " + first.message() + " at line " + first.line();
        }
        return reason;
    }

    private void audit(String slug, String dropId, String result, ValidationReport report, Path reportFile,
                       BuildStore.DropTransition transition, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("critical_count", report.criticalCount());
        details.put("warning_count", report.warningCount());
        details.put("files_checked", report.filesChecked());
        details.put("report", reportFile.toString());
        details.put("transition", transition.outcome().name());
        if (reason != null) {
            details.put("reason", reason);
        }
        auditLogger.log(AuditLogger.AuditEvent.of("deposit.validate", "validator", slug, dropId, result, details));
    }

    public record GateOutcome(
            ValidationReport report,
            Path reportFile,
            BuildStore.DropTransition transition,
            boolean lessonRecorded,
            String lessonError
    ) {
        public boolean accepted() {
            return report.passed() && transition.isApplied();
        }
    }
}
