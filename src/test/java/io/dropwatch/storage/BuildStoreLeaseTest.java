package io.dropwatch.storage;

import io.dropwatch.config.DropWatchConfig;
import io.dropwatch.model.BuildStatus;
import io.dropwatch.model.BuildView;
import io.dropwatch.model.DropStatus;
import io.dropwatch.model.DropView;
import io.dropwatch.model.FailureKind;
import io.dropwatch.plan.PlanDocument;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class BuildStoreLeaseTest {
    private static final long NOW = 1_760_000_000_000L;
    private static final long TTL = 180_000L;

    @Test
    void leaseIsExclusiveUntilExpiryThenTakenOver() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-lease-");
        try {
            BuildStore store = newStore(root);
            store.createBuild(plan("auth"), NOW);

            BuildStore.LeaseGrant first = store.tryAcquireTickLease("auth", "tick-a", TTL, NOW);
            Assertions.assertTrue(first.acquired());
            Assertions.assertNull(first.takenOverFrom());

            BuildStore.LeaseGrant busy = store.tryAcquireTickLease("auth", "tick-b", TTL, NOW + 1_000L);
            Assertions.assertFalse(busy.acquired());
            Assertions.assertEquals("tick-a", busy.holder());

            List<BuildStore.LeaseConflict> conflicts = store.listLeaseConflicts("auth", 10);
            Assertions.assertEquals(1, conflicts.size());
            Assertions.assertEquals("lease_busy", conflicts.get(0).eventType());
            Assertions.assertEquals("tick-b", conflicts.get(0).requestedHolder());
            Assertions.assertEquals("tick-a", conflicts.get(0).actualHolder());

            BuildStore.LeaseGrant takeover = store.tryAcquireTickLease("auth", "tick-b", TTL, NOW + TTL);
            Assertions.assertTrue(takeover.acquired());
            Assertions.assertEquals("tick-a", takeover.takenOverFrom());
            Assertions.assertEquals("tick-b", store.getBuild("auth").orElseThrow().lease().holder());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseOnlyClearsOwnLease() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-release-");
        try {
            BuildStore store = newStore(root);
            store.createBuild(plan("auth"), NOW);
            Assertions.assertTrue(store.tryAcquireTickLease("auth", "tick-a", TTL, NOW).acquired());

            Assertions.assertFalse(store.releaseTickLease("auth", "tick-b"));
            Assertions.assertEquals("tick-a", store.getBuild("auth").orElseThrow().lease().holder());

            Assertions.assertTrue(store.releaseTickLease("auth", "tick-a"));
            Assertions.assertNull(store.getBuild("auth").orElseThrow().lease().holder());
            Assertions.assertTrue(store.tryAcquireTickLease("auth", "tick-b", TTL, NOW + 1L).acquired());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleHolderWriteIsRejectedAndRecorded() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-stale-write-");
        try {
            BuildStore store = newStore(root);
            store.createBuild(plan("auth"), NOW);
            Assertions.assertTrue(store.tryAcquireTickLease("auth", "tick-a", TTL, NOW).acquired());
            Assertions.assertTrue(store.tryAcquireTickLease("auth", "tick-b", TTL, NOW + TTL + 1L).acquired());

            BuildStore.DropTransition stale = store.markRunning("auth", "D1.1", "tick-a", "pid:1", NOW + TTL + 2L);
            Assertions.assertEquals(BuildStore.TransitionOutcome.STALE_LEASE, stale.outcome());
            Assertions.assertFalse(stale.isApplied());
            Assertions.assertEquals(DropStatus.PENDING, store.getDrop("auth", "D1.1").orElseThrow().status());

            BuildStore.LeaseConflict conflict = store.listLeaseConflicts("auth", 10).get(0);
            Assertions.assertEquals("stale_write", conflict.eventType());
            Assertions.assertEquals("D1.1", conflict.dropId());
            Assertions.assertEquals("tick-a", conflict.requestedHolder());
            Assertions.assertEquals("tick-b", conflict.actualHolder());

            Assertions.assertFalse(store.setBuildStatus("auth", "tick-a", EnumSet.of(BuildStatus.ACTIVE),
                    BuildStatus.BLOCKED, "stale", NOW + TTL + 3L));
            Assertions.assertEquals(BuildStatus.ACTIVE, store.getBuild("auth").orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void transitionsRespectSourceStatusAndTrackProgress() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-transitions-");
        try {
            BuildStore store = newStore(root);
            store.createBuild(plan("auth"), NOW);
            Assertions.assertTrue(store.tryAcquireTickLease("auth", "tick-a", TTL, NOW).acquired());
            Assertions.assertNull(store.getBuild("auth").orElseThrow().startedAtMs());

            BuildStore.DropTransition wrong = store.markComplete(
                    "auth", "D1.1", "tick-a", EnumSet.of(DropStatus.RUNNING), NOW + 1L);
            Assertions.assertEquals(BuildStore.TransitionOutcome.WRONG_STATE, wrong.outcome());
            Assertions.assertEquals(DropStatus.PENDING, wrong.actual());

            BuildStore.DropTransition missing = store.markRunning("auth", "D9.9", "tick-a", "pid:1", NOW + 1L);
            Assertions.assertEquals(BuildStore.TransitionOutcome.NOT_FOUND, missing.outcome());

            Assertions.assertTrue(store.markRunning("auth", "D1.1", "tick-a", "pid:42", NOW + 10L).isApplied());
            BuildView started = store.getBuild("auth").orElseThrow();
            Assertions.assertEquals(NOW + 10L, started.startedAtMs());
            Assertions.assertEquals(NOW + 10L, started.lastProgressAtMs());

            Assertions.assertTrue(store.markBroken("auth", "D1.1", "tick-a", DropStatus.DEAD, FailureKind.DEAD_TIMEOUT,
                    "No deposit within 15 min", EnumSet.of(DropStatus.RUNNING), NOW + 20L).isApplied());
            Assertions.assertTrue(store.resetForRetry("auth", "D1.1", "tick-a", "try again", NOW + 30L).isApplied());

            DropView retried = store.getDrop("auth", "D1.1").orElseThrow();
            Assertions.assertEquals(DropStatus.PENDING, retried.status());
            Assertions.assertEquals(1, retried.retryCount());
            Assertions.assertEquals("try again", retried.retryNote());
            Assertions.assertNull(retried.failureKind());
            Assertions.assertEquals(NOW + 10L, store.getBuild("auth").orElseThrow().startedAtMs());
            Assertions.assertEquals(NOW + 30L, store.getBuild("auth").orElseThrow().lastProgressAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void terminalBuildStatusArchivesBuild() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-archive-");
        try {
            BuildStore store = newStore(root);
            store.createBuild(plan("auth"), NOW);
            Assertions.assertTrue(store.tryAcquireTickLease("auth", "tick-a", TTL, NOW).acquired());

            Assertions.assertTrue(store.setBuildStatus("auth", "tick-a", EnumSet.of(BuildStatus.ACTIVE),
                    BuildStatus.BLOCKED, "wave stuck", NOW + 1L));
            Assertions.assertNull(store.getBuild("auth").orElseThrow().archivedAtMs());

            Assertions.assertTrue(store.setBuildStatus("auth", "tick-a", EnumSet.of(BuildStatus.BLOCKED),
                    BuildStatus.COMPLETE, "done", NOW + 2L));
            BuildView done = store.getBuild("auth").orElseThrow();
            Assertions.assertEquals(BuildStatus.COMPLETE, done.status());
            Assertions.assertEquals(NOW + 2L, done.archivedAtMs());
            Assertions.assertTrue(store.listBuilds(BuildStatus.ACTIVE).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownBuildAndDuplicateCreateAreRejected() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-unknown-");
        try {
            BuildStore store = newStore(root);
            store.createBuild(plan("auth"), NOW);
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> store.tryAcquireTickLease("nope", "tick-a", TTL, NOW));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.createBuild(plan("auth"), NOW));
        } finally {
            deleteRecursively(root);
        }
    }

    private static BuildStore newStore(Path root) {
        Database db = new Database(DropWatchConfig.fromRoot(root.toString()));
        db.init();
        return new BuildStore(db);
    }

    private static PlanDocument plan(String slug) {
        Map<String, List<String>> waves = new LinkedHashMap<>();
        waves.put("W1", List.of("D1.1", "D1.2"));
        return new PlanDocument(slug, "Auth service", List.of(
                new PlanDocument.PlanDrop("D1.1", 1, 1, "W1", true, List.of(), "# D1.1"),
                new PlanDocument.PlanDrop("D1.2", 1, 2, "W1", true, List.of(), "# D1.2")
        ), waves);
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
}
