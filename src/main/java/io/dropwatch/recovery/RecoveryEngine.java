package io.dropwatch.recovery;

import io.dropwatch.model.BuildSnapshot;
import io.dropwatch.model.BuildStatus;
import io.dropwatch.model.BuildView;
import io.dropwatch.model.DropStatus;
import io.dropwatch.model.DropView;
import io.dropwatch.model.FailureKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule table that turns a build snapshot into recovery decisions.
 *
 * <p>Per drop, first match wins:
 *
 * <ul>
 *   <li>R1: dead (timeout or unresponsive) with retries left, auto retry.</li>
 *   <li>R2: failed to spawn with retries left, auto retry.</li>
 *   <li>R3: content rejected by the deposit gate or worker-reported blocker, needs judgment.</li>
 *   <li>Anything else broken has exhausted its retries and is escalated on its own.</li>
 * </ul>
 *
 * <p>Build level: R4 blocks the build when every unfinished blocking drop of the active wave is stuck;
 * R5 escalates a build that has been running past the stale threshold without progress. R5 is only
 * checked when R4 did not fire.
 *
 * <p>The engine has no side effects; {@link RecoveryExecutor} applies what it returns.
 */
public final class RecoveryEngine {
    private final RecoveryPolicy policy;

    public RecoveryEngine(RecoveryPolicy policy) {
        this.policy = policy;
    }

    public List<RecoveryDecision> assess(BuildSnapshot snapshot, long nowMs) {
        BuildView build = snapshot.build();
        if (build.status() != BuildStatus.ACTIVE) {
            return List.of(RecoveryDecision.none(RecoveryDecision.BUILD_SCOPE,
                    "Build is " + build.status().wireName() + "; recovery skipped"));
        }
        List<RecoveryDecision> decisions = new ArrayList<>();
        for (DropView drop : snapshot.drops()) {
            if (drop.status().broken()) {
                decisions.add(assessDrop(drop));
            }
        }

        Optional<RecoveryDecision> blocked = waveBlocked(snapshot);
        if (blocked.isPresent()) {
            decisions.add(blocked.get());
        } else {
            stale(build, nowMs).ifPresent(decisions::add);
        }

        if (decisions.isEmpty()) {
            return List.of(RecoveryDecision.none(RecoveryDecision.BUILD_SCOPE, "No recovery needed"));
        }
        return List.copyOf(decisions);
    }

    RecoveryDecision assessDrop(DropView drop) {
        FailureKind kind = drop.failureKind();
        int retries = drop.retryCount();
        int max = policy.maxRetries();
        if (isDeadTimeout(drop) && retries < max) {
            String flavour = kind == FailureKind.UNRESPONSIVE ? "unresponsive" : "timeout";
            return RecoveryDecision.autoRetry(drop.dropId(), "R1",
                    "Dead (" + flavour + "), auto-retry " + (retries + 1) + "/" + max, kind, retries);
        }
        if (kind == FailureKind.SPAWN_ERROR && retries < max) {
            return RecoveryDecision.autoRetry(drop.dropId(), "R2",
                    "Spawn error, auto-retry " + (retries + 1) + "/" + max + ": " + orDefault(drop.failureReason(), "unknown"),
                    kind, retries);
        }
        if (kind != null && kind.contentError()) {
            return RecoveryDecision.needsJudgment(drop.dropId(),
                    orDefault(drop.failureReason(), "Deposit rejected"), kind, retries);
        }
        if (kind == FailureKind.REVIEW_REJECTED) {
            return new RecoveryDecision(drop.dropId(), RecoveryAction.NONE, "none",
                    "Rejected by reviewer; awaiting wave-level escalation", kind, retries, false);
        }
        if (kind == null && drop.status() == DropStatus.FAILED) {
            return RecoveryDecision.escalate(drop.dropId(), "R_unknown",
                    "Failed with no recorded cause: " + orDefault(drop.failureReason(), "no reason"), null, retries, false);
        }
        return RecoveryDecision.escalate(drop.dropId(), "R1/R2_exhausted",
                "Retries exhausted (" + retries + "/" + max + ")", kind, retries, false);
    }

    /**
     * True unless every unfinished blocking drop of the active wave is stuck. Does not look at the
     * build status, so it can be asked about a blocked build.
     */
    public boolean hasPathForward(BuildSnapshot snapshot) {
        return waveBlocked(snapshot).isEmpty();
    }

    Optional<RecoveryDecision> waveBlocked(BuildSnapshot snapshot) {
        Optional<String> wave = snapshot.activeWave();
        if (wave.isEmpty()) {
            return Optional.empty();
        }
        List<DropView> unfinished = snapshot.waveDrops(wave.get()).stream()
                .filter(DropView::blocking)
                .filter(d -> d.status() != DropStatus.COMPLETE)
                .toList();
        if (unfinished.isEmpty() || unfinished.stream().noneMatch(d -> d.status().broken())) {
            return Optional.empty();
        }
        Map<String, Boolean> memo = new HashMap<>();
        for (DropView d : unfinished) {
            if (!stuck(snapshot, d, memo, new HashSet<>())) {
                return Optional.empty();
            }
        }
        String listed = unfinished.stream()
                .map(d -> d.dropId() + " (" + d.status().wireName() + ")")
                .collect(Collectors.joining(", "));
        return Optional.of(RecoveryDecision.escalate(RecoveryDecision.BUILD_SCOPE, "R4",
                "Wave " + wave.get() + " has no automatic path forward: " + listed, null, 0, true));
    }

    Optional<RecoveryDecision> stale(BuildView build, long nowMs) {
        Long started = build.startedAtMs();
        if (started == null || nowMs - started <= policy.staleThresholdMs()) {
            return Optional.empty();
        }
        Long progress = build.lastProgressAtMs();
        if (progress != null && nowMs - progress <= policy.staleNoProgressMs()) {
            return Optional.empty();
        }
        return Optional.of(RecoveryDecision.escalate(RecoveryDecision.BUILD_SCOPE, "R5",
                "Build active >" + humanize(policy.staleThresholdMs()) + " with no progress in >"
                        + minutes(policy.staleNoProgressMs()),
                null, 0, false));
    }

    /**
     * A drop is stuck when nothing automatic will move it: broken and not eligible for R1/R2, or pending
     * behind a dependency or stream predecessor that is itself stuck.
     */
    private boolean stuck(BuildSnapshot snapshot, DropView drop, Map<String, Boolean> memo, Set<String> visiting) {
        Boolean known = memo.get(drop.dropId());
        if (known != null) {
            return known;
        }
        if (!visiting.add(drop.dropId())) {
            return false;
        }
        boolean result;
        if (drop.status().broken()) {
            result = !retryEligible(drop);
        } else if (drop.status() == DropStatus.PENDING) {
            result = false;
            for (String dep : drop.dependsOn()) {
                Optional<DropView> target = snapshot.drop(dep);
                if (target.isPresent() && stuck(snapshot, target.get(), memo, visiting)) {
                    result = true;
                    break;
                }
            }
            if (!result) {
                Optional<DropView> predecessor = snapshot.streamPredecessor(drop);
                result = predecessor.isPresent() && stuck(snapshot, predecessor.get(), memo, visiting);
            }
        } else {
            result = false;
        }
        visiting.remove(drop.dropId());
        memo.put(drop.dropId(), result);
        return result;
    }

    private boolean retryEligible(DropView drop) {
        if (drop.retryCount() >= policy.maxRetries()) {
            return false;
        }
        return isDeadTimeout(drop) || drop.failureKind() == FailureKind.SPAWN_ERROR;
    }

    private static boolean isDeadTimeout(DropView drop) {
        FailureKind kind = drop.failureKind();
        if (kind == null) {
            return drop.status() == DropStatus.DEAD;
        }
        return kind.deadTimeout();
    }

    static String humanize(long ms) {
        if (ms % 3_600_000L == 0) {
            return (ms / 3_600_000L) + "h";
        }
        if (ms % 60_000L == 0) {
            return (ms / 60_000L) + "min";
        }
        return (ms / 1000L) + "s";
    }

    static String minutes(long ms) {
        return ms % 60_000L == 0 ? (ms / 60_000L) + "min" : (ms / 1000L) + "s";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
