package io.dropwatch.runtime;

import io.dropwatch.control.ControlPlane;
import io.dropwatch.control.ControlState;
import io.dropwatch.model.BuildSnapshot;
import io.dropwatch.model.BuildStatus;
import io.dropwatch.model.BuildView;
import io.dropwatch.observability.AuditLogger;
import io.dropwatch.recovery.RecoveryAction;
import io.dropwatch.recovery.RecoveryDecision;
import io.dropwatch.recovery.RecoveryEngine;
import io.dropwatch.recovery.RecoveryExecutor;
import io.dropwatch.storage.BuildStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One supervisory cycle over every active build.
 *
 * <p>The control file is read first; {@code paused} and {@code stopped} exit without touching any build.
 * Otherwise builds are handled one after another: acquire the tick lease (skip the build when busy), run
 * the orchestration pass under a wall-clock timeout, run recovery against the post-pass state, release
 * the lease. A pass that times out is abandoned and its lease is left to expire. An exception from
 * one build is reported as {@link BuildOutcome#FAILED} and the remaining builds are still ticked.
 */
public final class TickScheduler {
    public static final int EXIT_OK = 0;
    public static final int EXIT_ATTENTION = 1;
    public static final int EXIT_STOPPED = 3;

    private final ControlPlane controlPlane;
    private final BuildStore store;
    private final OrchestrationPass pass;
    private final RecoveryEngine engine;
    private final RecoveryExecutor executor;
    private final AuditLogger auditLogger;
    private final long leaseTtlMs;
    private final long passTimeoutMs;
    private final Clock clock;

    public TickScheduler(ControlPlane controlPlane, BuildStore store, OrchestrationPass pass, RecoveryEngine engine,
                         RecoveryExecutor executor, AuditLogger auditLogger, long leaseTtlMs, long passTimeoutMs,
                         Clock clock) {
        this.controlPlane = controlPlane;
        this.store = store;
        this.pass = pass;
        this.engine = engine;
        this.executor = executor;
        this.auditLogger = auditLogger;
        this.leaseTtlMs = leaseTtlMs;
        this.passTimeoutMs = passTimeoutMs;
        this.clock = clock;
    }

    public TickReport tick(String holderPrefix, boolean dryRun) {
        String startedAt = clock.instant().toString();
        ControlState state = controlPlane.read().state();
        if (state == ControlState.STOPPED) {
            auditLogger.log(AuditLogger.AuditEvent.of("tick.stopped", "scheduler", null, null, "stopped", Map.of()));
            return new TickReport(state, startedAt, dryRun, List.of(), 0, 0, EXIT_STOPPED,
                    "Control state is stopped; scheduler may be torn down");
        }
        if (state == ControlState.PAUSED) {
            auditLogger.log(AuditLogger.AuditEvent.of("tick.paused", "scheduler", null, null, "paused", Map.of()));
            return new TickReport(state, startedAt, dryRun, List.of(), 0, 0, EXIT_OK, "Control state is paused; no-op");
        }

        List<BuildTickReport> builds = new ArrayList<>();
        for (BuildView build : store.listBuilds(BuildStatus.ACTIVE)) {
            builds.add(tickBuild(build.slug(), holderFor(holderPrefix), dryRun));
        }
        int critical = builds.stream().mapToInt(BuildTickReport::criticalIssues).sum();
        int escalations = builds.stream().mapToInt(BuildTickReport::escalations).sum();
        boolean failed = builds.stream().anyMatch(b -> b.outcome() == BuildOutcome.FAILED);
        int exitCode = critical == 0 && escalations == 0 && !failed ? EXIT_OK : EXIT_ATTENTION;
        String message = builds.size() + " active build(s), " + critical + " critical issue(s), "
                + escalations + " escalation(s)";
        return new TickReport(state, startedAt, dryRun, builds, critical, escalations, exitCode, message);
    }

    BuildTickReport tickBuild(String slug, String holder, boolean dryRun) {
        BuildStore.LeaseGrant grant;
        try {
            grant = store.tryAcquireTickLease(slug, holder, leaseTtlMs, clock.millis());
        } catch (RuntimeException e) {
            return failed(slug, holder, "Lease acquisition failed: ", e);
        }
        if (!grant.acquired()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("current_holder", String.valueOf(grant.holder()));
            details.put("expires_at_ms", grant.expiresAtMs());
            auditLogger.log(AuditLogger.AuditEvent.of("lease.busy", holder, slug, null, "skipped", details));
            return BuildTickReport.of(slug, BuildOutcome.LEASE_BUSY, holder,
                    "Lease held by " + grant.holder() + " until " + grant.expiresAtMs());
        }
        Map<String, Object> acquired = new LinkedHashMap<>();
        acquired.put("expires_at_ms", grant.expiresAtMs());
        if (grant.takenOverFrom() != null) {
            acquired.put("taken_over_from", grant.takenOverFrom());
        }
        auditLogger.log(AuditLogger.AuditEvent.of("lease.acquire", holder, slug, null, "acquired", acquired));

        boolean release = true;
        try {
            OrchestrationPass.PassReport passReport;
            try {
                passReport = runBounded(slug, holder, dryRun);
            } catch (TimeoutException e) {
                release = false;
                auditLogger.log(AuditLogger.AuditEvent.of("tick.timeout", holder, slug, null, "timed_out",
                        Map.of("pass_timeout_ms", passTimeoutMs)));
                return BuildTickReport.of(slug, BuildOutcome.TIMED_OUT, holder,
                        "Orchestration pass exceeded " + passTimeoutMs + " ms; abandoned for this cycle");
            } catch (ExecutionException e) {
                return failed(slug, holder, "Pass failed: ", e.getCause() == null ? e : e.getCause());
            }

            List<RecoveryDecision> decisions;
            List<RecoveryExecutor.AppliedDecision> applied;
            try {
                if (passReport.staleLease()
                        || (!dryRun && !store.renewTickLease(slug, holder, leaseTtlMs, clock.millis()))) {
                    release = false;
                    return new BuildTickReport(slug, BuildOutcome.STALE_LEASE, holder, passReport, List.of(),
                            List.of(), passReport.criticalIssues(), 0, "Tick lease lost; recovery skipped");
                }
                Optional<BuildSnapshot> after = store.snapshot(slug);
                decisions = after
                        .map(s -> engine.assess(s, clock.millis()))
                        .orElse(List.of());
                applied = dryRun
                        ? List.of()
                        : executor.apply(slug, decisions, holder);
            } catch (RuntimeException e) {
                return failed(slug, holder, "Recovery failed: ", e);
            }
            int escalations = (int) decisions.stream().filter(d -> d.action() == RecoveryAction.ESCALATE).count();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("events", passReport.events().size());
            details.put("critical", passReport.criticalIssues());
            details.put("decisions", decisions.size());
            details.put("escalations", escalations);
            details.put("dry_run", dryRun);
            auditLogger.log(AuditLogger.AuditEvent.of("tick.pass", holder, slug, null, "processed", details));
            return new BuildTickReport(slug, BuildOutcome.PROCESSED, holder, passReport, decisions, applied,
                    passReport.criticalIssues(), escalations, passReport.message());
        } finally {
            if (release) {
                release(slug, holder);
            }
        }
    }

    private void release(String slug, String holder) {
        String result;
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            result = store.releaseTickLease(slug, holder) ? "released" : "not_holder";
        } catch (RuntimeException e) {
            // Left to expire.
            result = "failed";
            details.put("error", String.valueOf(e.getMessage()));
        }
        auditLogger.log(AuditLogger.AuditEvent.of("lease.release", holder, slug, null, result, details));
    }

    private BuildTickReport failed(String slug, String holder, String prefix, Throwable cause) {
        auditLogger.log(AuditLogger.AuditEvent.of("tick.pass", holder, slug, null, "failed",
                Map.of("error", String.valueOf(cause.getMessage()))));
        return BuildTickReport.of(slug, BuildOutcome.FAILED, holder, prefix + cause.getMessage());
    }

    private OrchestrationPass.PassReport runBounded(String slug, String holder, boolean dryRun)
            throws TimeoutException, ExecutionException {
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "dropwatch-pass-" + slug);
            t.setDaemon(true);
            return t;
        });
        Future<OrchestrationPass.PassReport> future = worker.submit(() -> pass.run(slug, holder, dryRun));
        try {
            return future.get(passTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionException("Interrupted while waiting for orchestration pass", e);
        } finally {
            worker.shutdownNow();
        }
    }

    private String holderFor(String prefix) {
        String base = prefix == null || prefix.isBlank() ? "tick" : prefix.trim();
        return base + ":" + ProcessHandle.current().pid() + ":" + clock.millis();
    }

    public enum BuildOutcome { PROCESSED, LEASE_BUSY, TIMED_OUT, FAILED, STALE_LEASE }

    public record BuildTickReport(
            String slug,
            BuildOutcome outcome,
            String holder,
            OrchestrationPass.PassReport pass,
            List<RecoveryDecision> decisions,
            List<RecoveryExecutor.AppliedDecision> applied,
            int criticalIssues,
            int escalations,
            String message
    ) {
        static BuildTickReport of(String slug, BuildOutcome outcome, String holder, String message) {
            return new BuildTickReport(slug, outcome, holder, null, List.of(), List.of(), 0, 0, message);
        }
    }

    public record TickReport(
            ControlState controlState,
            String startedAt,
            boolean dryRun,
            List<BuildTickReport> builds,
            int criticalIssues,
            int escalations,
            int exitCode,
            String message
    ) {
    }
}
