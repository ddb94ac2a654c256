package io.dropwatch.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwatch.config.DropWatchConfig;
import io.dropwatch.model.Deposit;
import io.dropwatch.model.DropStatus;
import io.dropwatch.model.DropView;
import io.dropwatch.model.FailureKind;
import io.dropwatch.observability.AuditLogger;
import io.dropwatch.observability.LessonLog;
import io.dropwatch.plan.PlanDocument;
import io.dropwatch.storage.BuildStore;
import io.dropwatch.storage.Database;
import io.dropwatch.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class DepositValidatorTest {
    private static final Instant NOW = Instant.parse("2026-10-01T10:00:00Z");
    private static final String HOLDER = "tick:validator-test";

    @Test
    void stubDepositFailsDropAndRecordsLesson() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-gate-reject-");
        try {
            Fixture f = fixture(root, root.resolve("learnings").resolve("lessons.jsonl"));
            writeArtifact(root, "work/add.py", "def add(a, b): pass  # TODO: implement\n");

            DepositValidator.GateOutcome outcome = f.validator.gate("calc",
                    new Deposit("D1.1", "complete", "added add()", List.of("work/add.py")), HOLDER);

            Assertions.assertFalse(outcome.accepted());
            Assertions.assertEquals(1, outcome.report().criticalCount());
            Assertions.assertEquals(0, outcome.report().warningCount());
            Assertions.assertTrue(outcome.lessonRecorded());
            Assertions.assertTrue(Files.isRegularFile(outcome.reportFile()));

            DropView drop = f.store.getDrop("calc", "D1.1").orElseThrow();
            Assertions.assertEquals(DropStatus.FAILED, drop.status());
            Assertions.assertEquals(FailureKind.CONTENT_REJECTED, drop.failureKind());
            Assertions.assertTrue(drop.failureReason().startsWith("Deposit rejected: 1 critical issue(s)"));

            List<JsonNode> lessons = f.lessons.tail(10);
            Assertions.assertEquals(1, lessons.size());
            Assertions.assertEquals("stub_code", lessons.get(0).path("category").asText());
            Assertions.assertEquals("pending", lessons.get(0).path("resolution").asText());
            Assertions.assertEquals(1, lessons.get(0).path("details").path("critical_count").asInt());

            JsonNode written = Jsons.mapper().readTree(outcome.reportFile().toFile());
            Assertions.assertFalse(written.path("passed").asBoolean());
            Assertions.assertTrue(written.path("issues").has("work/add.py"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanDepositCompletesDrop() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-gate-accept-");
        try {
            Fixture f = fixture(root, root.resolve("learnings").resolve("lessons.jsonl"));
            writeArtifact(root, "work/add.py", "def add(a, b):\n    return a + b\n");

            DepositValidator.GateOutcome outcome = f.validator.gate("calc",
                    new Deposit("D1.1", "complete", "added add()", List.of("work/add.py")), HOLDER);

            Assertions.assertTrue(outcome.accepted());
            Assertions.assertEquals(1, outcome.report().filesChecked());
            Assertions.assertTrue(outcome.report().issues().isEmpty());
            Assertions.assertEquals(DropStatus.COMPLETE, f.store.getDrop("calc", "D1.1").orElseThrow().status());
            Assertions.assertTrue(f.lessons.tail(10).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void directoryArtifactIsWalkedInsteadOfRejected() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-gate-directory-");
        try {
            Fixture f = fixture(root, root.resolve("learnings").resolve("lessons.jsonl"));
            writeArtifact(root, "work/pkg/add.py", "def add(a, b):\n    return a + b\n");
            writeArtifact(root, "work/pkg/notes.txt", "TODO: implement the docs\n");

            DepositValidator.GateOutcome outcome = f.validator.gate("calc",
                    new Deposit("D1.1", "complete", "package", List.of("work/pkg")), HOLDER);

            Assertions.assertTrue(outcome.accepted());
            Assertions.assertEquals(1, outcome.report().filesChecked());
            Assertions.assertEquals(0, outcome.report().criticalCount());
            Assertions.assertEquals(DropStatus.COMPLETE, f.store.getDrop("calc", "D1.1").orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stubInsideDirectoryArtifactIsReportedUnderItsPath() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-gate-directory-stub-");
        try {
            Fixture f = fixture(root, root.resolve("learnings").resolve("lessons.jsonl"));
            writeArtifact(root, "work/pkg/add.py", "def add(a, b):\n    return a + b\n");
            writeArtifact(root, "work/pkg/sub/mul.py", "def mul(a, b):\n    raise NotImplementedError\n");

            ValidationReport report = f.validator.evaluate("calc",
                    new Deposit("D1.1", "complete", "package", List.of("work/pkg/")));

            Assertions.assertFalse(report.passed());
            Assertions.assertEquals(2, report.filesChecked());
            Assertions.assertEquals(List.of("work/pkg/sub/mul.py"), List.copyOf(report.issues().keySet()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingArtifactIsOnlyAWarning() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-gate-missing-");
        try {
            Fixture f = fixture(root, root.resolve("learnings").resolve("lessons.jsonl"));

            ValidationReport report = f.validator.evaluate("calc",
                    new Deposit("D1.1", "complete", "", List.of("work/ghost.py")));

            Assertions.assertTrue(report.passed());
            Assertions.assertEquals(0, report.filesChecked());
            Assertions.assertEquals(1, report.warningCount());
            Assertions.assertEquals("missing_artifact",
                    report.issues().get("work/ghost.py").warnings().get(0).type());
            Assertions.assertEquals(DropStatus.RUNNING, f.store.getDrop("calc", "D1.1").orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lessonFailureStillFailsDropAndIsAudited() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-gate-lesson-");
        try {
            Path lessonFile = root.resolve("learnings").resolve("lessons.jsonl");
            Files.createDirectories(lessonFile);
            Fixture f = fixture(root, lessonFile);
            writeArtifact(root, "work/add.py", "STUB\n");

            DepositValidator.GateOutcome outcome = f.validator.gate("calc",
                    new Deposit("D1.1", "complete", "", List.of("work/add.py")), HOLDER);

            Assertions.assertFalse(outcome.accepted());
            Assertions.assertFalse(outcome.lessonRecorded());
            Assertions.assertNotNull(outcome.lessonError());
            Assertions.assertEquals(DropStatus.FAILED, f.store.getDrop("calc", "D1.1").orElseThrow().status());
            String audit = String.join("\n", f.audit.tail(20));
            Assertions.assertTrue(audit.contains("\"lesson.append_failed\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void repeatedReportsNeverOverwrite() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-gate-reports-");
        try {
            Fixture f = fixture(root, root.resolve("learnings").resolve("lessons.jsonl"));
            ValidationReport report = f.validator.evaluate("calc",
                    new Deposit("D1.1", "complete", "", List.of()));

            Path first = f.validator.writeReport("calc", report);
            Path second = f.validator.writeReport("calc", report);

            Assertions.assertNotEquals(first, second);
            Assertions.assertTrue(Files.isRegularFile(first));
            Assertions.assertTrue(Files.isRegularFile(second));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Fixture fixture(Path root, Path lessonFile) {
        DropWatchConfig config = DropWatchConfig.fromRoot(root.toString());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        Database db = new Database(config);
        db.init();
        BuildStore store = new BuildStore(db);
        store.createBuild(new PlanDocument("calc", "Calculator", List.of(
                new PlanDocument.PlanDrop("D1.1", 1, 1, "W1", true, List.of(), "")
        ), Map.of("W1", List.of("D1.1"))), NOW.toEpochMilli());
        Assertions.assertTrue(store.tryAcquireTickLease("calc", HOLDER, 180_000L, NOW.toEpochMilli()).acquired());
        Assertions.assertTrue(store.markRunning("calc", "D1.1", HOLDER, "pid:1", NOW.toEpochMilli()).isApplied());

        AuditLogger audit = new AuditLogger(config.auditLogFile(), clock);
        LessonLog lessons = new LessonLog(lessonFile);
        DepositValidator validator = new DepositValidator(
                new ArtifactScanner(ValidationRules.defaults()), List.of(".py"), config, store, lessons, audit, clock);
        return new Fixture(store, validator, lessons, audit);
    }

    private static void writeArtifact(Path root, String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private record Fixture(BuildStore store, DepositValidator validator, LessonLog lessons, AuditLogger audit) {
    }
}
