package io.dropwatch.runtime;

import io.dropwatch.circuit.SpawnCircuitBreaker;
import io.dropwatch.config.DropWatchConfig;
import io.dropwatch.model.BuildSnapshot;
import io.dropwatch.model.BuildStatus;
import io.dropwatch.model.Deposit;
import io.dropwatch.model.DropStatus;
import io.dropwatch.model.DropView;
import io.dropwatch.model.FailureKind;
import io.dropwatch.model.SpawnCircuit;
import io.dropwatch.observability.AuditLogger;
import io.dropwatch.storage.BuildStore;
import io.dropwatch.validation.DepositValidator;
import io.dropwatch.validation.ValidationReport;
import io.dropwatch.worker.DepositInbox;
import io.dropwatch.worker.PollResult;
import io.dropwatch.worker.SpawnRequest;
import io.dropwatch.worker.SpawnResult;
import io.dropwatch.worker.WorkerPool;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * One orchestration step for one build, run inside a held tick lease.
 *
 * <ol>
 *   <li>Poll running drops: consume deposits through the gate, mark vanished or overdue workers dead.</li>
 *   <li>Spawn ready drops while the spawn circuit allows it.</li>
 *   <li>Complete the build once every blocking drop is complete.</li>
 * </ol>
 *
 * Each step re-reads state and is safe to repeat, so a pass abandoned half way leaves valid state.
 * In dry-run mode nothing is written and no worker is started.
 */
public final class OrchestrationPass {
    private final BuildStore store;
    private final WorkerPool workers;
    private final DepositInbox inbox;
    private final DepositValidator validator;
    private final SpawnCircuitBreaker breaker;
    private final AuditLogger auditLogger;
    private final DropWatchConfig config;
    private final long deadThresholdMs;
    private final Clock clock;

    public OrchestrationPass(BuildStore store, WorkerPool workers, DepositInbox inbox, DepositValidator validator,
                             SpawnCircuitBreaker breaker, AuditLogger auditLogger, DropWatchConfig config,
                             long deadThresholdMs, Clock clock) {
        this.store = store;
        this.workers = workers;
        this.inbox = inbox;
        this.validator = validator;
        this.breaker = breaker;
        this.auditLogger = auditLogger;
        this.config = config;
        this.deadThresholdMs = deadThresholdMs;
        this.clock = clock;
    }

    public PassReport run(String slug, String holder, boolean dryRun) {
        BuildSnapshot snapshot = store.snapshot(slug)
                .orElseThrow(() -> new IllegalArgumentException("Build not found: " + slug));
        PassReport.Builder report = PassReport.builder(slug, dryRun);
        if (snapshot.build().status() != BuildStatus.ACTIVE) {
            return report.skipped("Build is " + snapshot.build().status().wireName());
        }

        for (DropView drop : snapshot.dropsWithStatus(DropStatus.RUNNING)) {
            checkCancelled();
            pollDrop(slug, drop, holder, dryRun, report);
            if (report.staleLease()) {
                return report.build();
            }
        }

        checkCancelled();
        spawnReady(store.snapshot(slug).orElseThrow(), holder, dryRun, report);
        if (report.staleLease()) {
            return report.build();
        }

        checkCancelled();
        BuildSnapshot after = store.snapshot(slug).orElseThrow();
        if (after.allBlockingComplete()) {
            if (dryRun) {
                report.event("*", "would_complete", "All blocking drops complete");
            } else if (store.setBuildStatus(slug, holder, EnumSet.of(BuildStatus.ACTIVE), BuildStatus.COMPLETE,
                    "All blocking drops complete", clock.millis())) {
                report.buildCompleted();
                auditLogger.log(AuditLogger.AuditEvent.of("build.complete", holder, slug, null, "complete",
                        Map.of("drops", after.drops().size())));
            } else {
                report.markStaleLease();
            }
        }
        return report.build();
    }

    private void pollDrop(String slug, DropView drop, String holder, boolean dryRun, PassReport.Builder report) {
        PollResult poll = workers.poll(slug, drop.dropId(), drop.workerHandle());
        long nowMs = clock.millis();
        switch (poll.state()) {
            case DEPOSITED -> consumeDeposit(slug, drop, poll.deposit(), holder, dryRun, report);
            case UNRESPONSIVE -> markDead(slug, drop, FailureKind.UNRESPONSIVE,
                    poll.detail() == null ? "Worker stopped responding" : poll.detail(), holder, dryRun, report);
            case RUNNING -> {
                if (drop.startedAtMs() != null && nowMs - drop.startedAtMs() > deadThresholdMs) {
                    markDead(slug, drop, FailureKind.DEAD_TIMEOUT,
                            "No deposit within " + (deadThresholdMs / 60_000L) + " min", holder, dryRun, report);
                } else {
                    report.event(drop.dropId(), "running",
                            poll.detail() == null ? drop.workerHandle() : poll.detail());
                }
            }
        }
    }

    private void consumeDeposit(String slug, DropView drop, Deposit deposit, String holder, boolean dryRun,
                                PassReport.Builder report) {
        if (deposit.claimsComplete()) {
            if (dryRun) {
                ValidationReport preview = validator.evaluate(slug, deposit);
                report.critical(preview.criticalCount());
                report.event(drop.dropId(), preview.passed() ? "would_accept" : "would_reject",
                        preview.criticalCount() + " critical, " + preview.warningCount() + " warning");
                return;
            }
            DepositValidator.GateOutcome gate = validator.gate(slug, deposit, holder);
            report.critical(gate.report().criticalCount());
            if (gate.transition().outcome() == BuildStore.TransitionOutcome.STALE_LEASE) {
                report.markStaleLease();
                return;
            }
            report.event(drop.dropId(), gate.accepted() ? "accepted" : "rejected",
                    gate.report().criticalCount() + " critical, " + gate.report().warningCount()
                            + " warning, report " + gate.reportFile().getFileName());
            if (gate.lessonError() != null) {
                report.event(drop.dropId(), "lesson_failed", gate.lessonError());
            }
            return;
        }

        String reason = deposit.claimsBlocked()
                ? "Worker reported " + deposit.status() + ": " + deposit.summary()
                : "Worker deposited unrecognised status '" + deposit.status() + "': " + deposit.summary();
        if (dryRun) {
            report.event(drop.dropId(), "would_fail", reason);
            return;
        }
        BuildStore.DropTransition t = store.markBroken(slug, drop.dropId(), holder, DropStatus.FAILED,
                FailureKind.WORKER_BLOCKED, reason, EnumSet.of(DropStatus.RUNNING), clock.millis());
        if (track(t, report)) {
            report.event(drop.dropId(), "worker_blocked", reason);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("claimed_status", deposit.status());
            details.put("reason", reason);
            auditLogger.log(AuditLogger.AuditEvent.of("drop.deposit", holder, slug, drop.dropId(), "worker_blocked", details));
        }
    }

    private void markDead(String slug, DropView drop, FailureKind kind, String reason, String holder, boolean dryRun,
                          PassReport.Builder report) {
        if (dryRun) {
            report.event(drop.dropId(), "would_mark_dead", reason);
            return;
        }
        BuildStore.DropTransition t = store.markBroken(slug, drop.dropId(), holder, DropStatus.DEAD, kind, reason,
                EnumSet.of(DropStatus.RUNNING), clock.millis());
        if (track(t, report)) {
            report.event(drop.dropId(), "dead", reason);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("failure_kind", kind.wireName());
            details.put("reason", reason);
            details.put("worker_handle", String.valueOf(drop.workerHandle()));
            auditLogger.log(AuditLogger.AuditEvent.of("drop.dead", holder, slug, drop.dropId(), kind.wireName(), details));
        }
    }

    private void spawnReady(BuildSnapshot snapshot, String holder, boolean dryRun, PassReport.Builder report) {
        String slug = snapshot.slug();
        for (DropView drop : snapshot.readyDrops()) {
            checkCancelled();
            long nowMs = clock.millis();
            SpawnCircuitBreaker.SpawnDecision decision = dryRun
                    ? breaker.peek(slug, nowMs)
                    : breaker.allowSpawn(slug, holder, nowMs);
            if (decision.staleLease()) {
                report.markStaleLease();
                return;
            }
            if (decision.blocked()) {
                report.circuitBlocked(decision.reason());
                return;
            }
            if (dryRun) {
                report.event(drop.dropId(), "would_spawn", "attempt " + (drop.retryCount() + 1));
                continue;
            }

            SpawnResult result = workers.spawn(new SpawnRequest(
                    slug,
                    drop.dropId(),
                    brief(slug, drop),
                    inbox.depositPath(slug, drop.dropId()),
                    drop.retryCount() + 1
            ));
            nowMs = clock.millis();
            if (result.success()) {
                BuildStore.DropTransition t = store.markRunning(slug, drop.dropId(), holder, result.workerHandle(), nowMs);
                if (!track(t, report)) {
                    return;
                }
                breaker.recordSpawnSuccess(slug, holder, nowMs);
                report.event(drop.dropId(), "spawned", result.workerHandle());
                auditLogger.log(AuditLogger.AuditEvent.of("drop.spawn", holder, slug, drop.dropId(), "spawned",
                        Map.of("worker_handle", String.valueOf(result.workerHandle()), "attempt", drop.retryCount() + 1)));
                continue;
            }

            String error = result.error() == null || result.error().isBlank() ? "spawn error" : result.error();
            BuildStore.DropTransition t = store.markBroken(slug, drop.dropId(), holder, DropStatus.FAILED,
                    FailureKind.SPAWN_ERROR, error, EnumSet.of(DropStatus.PENDING), nowMs);
            if (!track(t, report)) {
                return;
            }
            report.event(drop.dropId(), "spawn_failed", error);
            auditLogger.log(AuditLogger.AuditEvent.of("drop.spawn", holder, slug, drop.dropId(), "failed",
                    Map.of("error", error)));
            SpawnCircuit circuit = breaker.recordSpawnFailure(slug, drop.dropId(), holder, error, nowMs);
            if (circuit.blocksAt(nowMs)) {
                report.circuitBlocked(circuit.openReason());
                return;
            }
        }
    }

    /**
     * Brief file for the drop plus the retry note left by the previous attempt, if any.
     */
    String brief(String slug, DropView drop) {
        Path file = config.briefFile(slug, drop.dropId());
        String body;
        try {
            body = Files.isRegularFile(file)
                    ? Files.readString(file, StandardCharsets.UTF_8)
                    : "# " + drop.dropId() + "\n";
        } catch (IOException e) {
            throw new RuntimeException("Failed to read brief: " + file, e);
        }
        if (drop.retryNote() == null || drop.retryNote().isBlank()) {
            return body;
        }
        return body.stripTrailing() + "\n\n## Retry note\n\n" + drop.retryNote() + "\n";
    }

    private static boolean track(BuildStore.DropTransition t, PassReport.Builder report) {
        if (t.outcome() == BuildStore.TransitionOutcome.STALE_LEASE) {
            report.markStaleLease();
            return false;
        }
        if (!t.isApplied()) {
            report.event(t.dropId(), "skipped", "drop is " + (t.actual() == null ? "missing" : t.actual().wireName()));
            return false;
        }
        return true;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Orchestration pass cancelled");
        }
    }

    public record PassReport(
            String slug,
            boolean dryRun,
            boolean skipped,
            String message,
            List<DropEvent> events,
            int criticalIssues,
            String circuitBlockedReason,
            boolean buildCompleted,
            boolean staleLease
    ) {
        static Builder builder(String slug, boolean dryRun) {
            return new Builder(slug, dryRun);
        }

        static final class Builder {
            private final String slug;
            private final boolean dryRun;
            private final List<DropEvent> events = new ArrayList<>();
            private int critical;
            private String circuitReason;
            private boolean completed;
            private boolean stale;

            private Builder(String slug, boolean dryRun) {
                this.slug = slug;
                this.dryRun = dryRun;
            }

            void event(String dropId, String event, String detail) {
                events.add(new DropEvent(dropId, event, detail));
            }

            void critical(int count) {
                critical += count;
            }

            void circuitBlocked(String reason) {
                circuitReason = reason == null ? "spawn circuit open" : reason;
                event("*", "spawn_blocked", circuitReason);
            }

            void buildCompleted() {
                completed = true;
                event("*", "build_complete", "All blocking drops complete");
            }

            void markStaleLease() {
                stale = true;
            }

            boolean staleLease() {
                return stale;
            }

            PassReport skipped(String message) {
                return new PassReport(slug, dryRun, true, message, List.of(), 0, null, false, false);
            }

            PassReport build() {
                String message = stale ? "Tick lease lost during pass" : events.size() + " event(s)";
                return new PassReport(slug, dryRun, false, message, List.copyOf(events), critical, circuitReason,
                        completed, stale);
            }
        }
    }

    public record DropEvent(String dropId, String event, String detail) {
    }
}
