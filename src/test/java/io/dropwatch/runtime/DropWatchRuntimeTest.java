package io.dropwatch.runtime;

import io.dropwatch.model.BuildStatus;
import io.dropwatch.model.DropStatus;
import io.dropwatch.model.FailureKind;
import io.dropwatch.plan.PlanLoader;
import io.dropwatch.recovery.ResolutionVerdict;
import io.dropwatch.storage.BuildStore;
import io.dropwatch.storage.Database;
import io.dropwatch.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class DropWatchRuntimeTest {
    private static final long MINUTE = 60_000L;

    @Test
    void retryVerdictArchivesDepositAndReactivatesBuild() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-runtime-retry-");
        try {
            TickSchedulerTest.Harness h = rejectedBuild(root, "calc");

            DropWatchRuntime.DropActionOutcome outcome =
                    h.runtime().resolve("calc", "D1.1", ResolutionVerdict.RETRY, "implement add properly");

            Assertions.assertTrue(outcome.applied());
            Assertions.assertTrue(outcome.buildReactivated());
            Assertions.assertEquals(DropStatus.PENDING, outcome.status());
            Assertions.assertFalse(Files.exists(h.config().depositFile("calc", "D1.1")));
            try (Stream<Path> archived = Files.list(h.config().archivedDepositsDir("calc"))) {
                Assertions.assertEquals(1L, archived.count());
            }
            Assertions.assertEquals("Reviewer requested another attempt: implement add properly",
                    h.runtime().status("calc").drops().get(0).retryNote());
            Assertions.assertEquals(BuildStatus.ACTIVE, h.runtime().status("calc").build().status());
        } finally {
            TickSchedulerTest.deleteRecursively(root);
        }
    }

    @Test
    void rejectVerdictKeepsBuildBlocked() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-runtime-reject-");
        try {
            TickSchedulerTest.Harness h = rejectedBuild(root, "calc");

            DropWatchRuntime.DropActionOutcome outcome =
                    h.runtime().resolve("calc", "D1.1", ResolutionVerdict.REJECT, null);

            Assertions.assertTrue(outcome.applied());
            Assertions.assertFalse(outcome.buildReactivated());
            Assertions.assertEquals(DropStatus.DEAD, outcome.status());
            Assertions.assertEquals(FailureKind.REVIEW_REJECTED, h.runtime().status("calc").drops().get(0).failureKind());
            Assertions.assertEquals(BuildStatus.BLOCKED, h.runtime().status("calc").build().status());

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> h.runtime().resolve("calc", "D1.1", ResolutionVerdict.ACCEPT, null));

            DropWatchRuntime.DropActionOutcome retried = h.runtime().retry("calc", "D1.1", "second opinion");
            Assertions.assertTrue(retried.applied());
            Assertions.assertTrue(retried.buildReactivated());
        } finally {
            TickSchedulerTest.deleteRecursively(root);
        }
    }

    @Test
    void resolvingOneOfTwoStuckDropsLeavesBuildBlocked() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-runtime-still-blocked-");
        try {
            TickSchedulerTest.Harness h = TickSchedulerTest.harness(root, TickSchedulerTest.defaultSettings());
            h.runtime().createBuild(PlanLoader.parse(Jsons.mapper().readTree("""
                    {"slug": "calc", "drops": [{"id": "D1.1"}, {"id": "D2.1"}],
                     "waves": {"W1": ["D1.1", "D2.1"]}}
                    """)));
            h.runtime().tick("tick", false);
            TickSchedulerTest.writeArtifact(root, "work/add.py", "def add(a, b): pass  # TODO: implement\n");
            TickSchedulerTest.writeDeposit(h.config(), "calc", "D1.1", "complete", "work/add.py");
            TickSchedulerTest.writeDeposit(h.config(), "calc", "D2.1", "complete", "work/add.py");
            h.clock().advance(MINUTE);
            h.runtime().tick("tick", false);
            Assertions.assertEquals(BuildStatus.BLOCKED, h.runtime().status("calc").build().status());

            DropWatchRuntime.DropActionOutcome first =
                    h.runtime().resolve("calc", "D1.1", ResolutionVerdict.ACCEPT, "good enough");
            Assertions.assertTrue(first.applied());
            Assertions.assertFalse(first.buildReactivated());
            Assertions.assertEquals(BuildStatus.BLOCKED, h.runtime().status("calc").build().status());

            DropWatchRuntime.DropActionOutcome second =
                    h.runtime().resolve("calc", "D2.1", ResolutionVerdict.RETRY, null);
            Assertions.assertTrue(second.buildReactivated());
            Assertions.assertEquals(BuildStatus.ACTIVE, h.runtime().status("calc").build().status());
        } finally {
            TickSchedulerTest.deleteRecursively(root);
        }
    }

    @Test
    void buildLifecycleCommandsCheckCurrentStatus() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-runtime-lifecycle-");
        try {
            TickSchedulerTest.Harness h = TickSchedulerTest.harness(root, TickSchedulerTest.defaultSettings());
            TickSchedulerTest.createSingleDropBuild(h, "svc");

            Assertions.assertThrows(IllegalArgumentException.class, () -> h.runtime().resume("svc"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> h.runtime().retry("svc", "D1.1", null));

            Assertions.assertEquals(BuildStatus.PAUSED, h.runtime().pause("svc").status());
            Assertions.assertTrue(h.runtime().tick("tick", false).builds().isEmpty());
            Assertions.assertEquals(BuildStatus.ACTIVE, h.runtime().resume("svc").status());

            DropWatchRuntime.BuildActionOutcome abandoned = h.runtime().abandon("svc", "requirements changed");
            Assertions.assertTrue(abandoned.applied());
            Assertions.assertEquals(BuildStatus.FAILED, abandoned.status());
            Assertions.assertNotNull(h.runtime().status("svc").build().archivedAtMs());
            Assertions.assertThrows(IllegalArgumentException.class, () -> h.runtime().pause("svc"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> h.runtime().status("nope"));
        } finally {
            TickSchedulerTest.deleteRecursively(root);
        }
    }

    @Test
    void operatorActionsWaitForTickLease() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-runtime-lease-");
        try {
            TickSchedulerTest.Harness h = TickSchedulerTest.harness(root, TickSchedulerTest.defaultSettings());
            TickSchedulerTest.createSingleDropBuild(h, "svc");
            Database db = new Database(h.config());
            db.init();
            Assertions.assertTrue(new BuildStore(db)
                    .tryAcquireTickLease("svc", "tick:running", 180_000L, h.clock().millis()).acquired());

            Assertions.assertThrows(IllegalStateException.class, () -> h.runtime().pause("svc"));
            Assertions.assertEquals(BuildStatus.ACTIVE, h.runtime().status("svc").build().status());
        } finally {
            TickSchedulerTest.deleteRecursively(root);
        }
    }

    @Test
    void validateAndScanAreDiagnosticOnly() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-runtime-validate-");
        try {
            TickSchedulerTest.Harness h = TickSchedulerTest.harness(root, TickSchedulerTest.defaultSettings());
            TickSchedulerTest.createSingleDropBuild(h, "svc");
            h.runtime().tick("tick", false);
            TickSchedulerTest.writeArtifact(root, "work/svc.py", "def run():\n    ...\n");
            TickSchedulerTest.writeDeposit(h.config(), "svc", "D1.1", "complete", "work/svc.py");

            DropWatchRuntime.ReportOutcome validated = h.runtime().validate("svc", "D1.1");
            Assertions.assertFalse(validated.passed());
            Assertions.assertTrue(Files.isRegularFile(Path.of(validated.reportFile())));
            Assertions.assertEquals(DropStatus.RUNNING, h.runtime().status("svc").drops().get(0).status());

            DropWatchRuntime.ReportOutcome scanned = h.runtime().scan(root.resolve("work"), List.of("py"));
            Assertions.assertFalse(scanned.passed());
            Assertions.assertEquals(1, scanned.report().get("critical_count"));

            DropWatchRuntime.ReportOutcome audit = h.runtime().auditBuild("svc");
            Assertions.assertEquals(1, audit.report().get("deposits_checked"));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> h.runtime().scan(root.resolve("missing"), List.of()));
        } finally {
            TickSchedulerTest.deleteRecursively(root);
        }
    }

    private static TickSchedulerTest.Harness rejectedBuild(Path root, String slug) throws Exception {
        TickSchedulerTest.Harness h = TickSchedulerTest.harness(root, TickSchedulerTest.defaultSettings());
        TickSchedulerTest.createSingleDropBuild(h, slug);
        h.runtime().tick("tick", false);
        TickSchedulerTest.writeArtifact(root, "work/add.py", "def add(a, b): pass  # TODO: implement\n");
        TickSchedulerTest.writeDeposit(h.config(), slug, "D1.1", "complete", "work/add.py");
        h.clock().advance(MINUTE);
        h.runtime().tick("tick", false);
        Assertions.assertEquals(BuildStatus.BLOCKED, h.runtime().status(slug).build().status());
        return h;
    }
}
