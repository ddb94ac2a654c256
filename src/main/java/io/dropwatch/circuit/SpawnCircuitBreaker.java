package io.dropwatch.circuit;

import io.dropwatch.model.BuildView;
import io.dropwatch.model.SpawnCircuit;
import io.dropwatch.observability.AuditLogger;
import io.dropwatch.storage.BuildStore;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-build fuse on worker spawns.
 *
 * <p>Failures are counted in a sliding window. Once the count reaches the threshold the circuit opens
 * until {@code now + cooldown}, always with an operator-visible reason. The breaker closes itself on the
 * first {@link #allowSpawn} call at or after {@code open_until}.
 */
public final class SpawnCircuitBreaker {
    private final BuildStore store;
    private final AuditLogger auditLogger;
    private final int threshold;
    private final long windowMs;
    private final long cooldownMs;

    public SpawnCircuitBreaker(BuildStore store, AuditLogger auditLogger, int threshold, long windowMs, long cooldownMs) {
        this.store = store;
        this.auditLogger = auditLogger;
        this.threshold = Math.max(1, threshold);
        this.windowMs = Math.max(1L, windowMs);
        this.cooldownMs = Math.max(1L, cooldownMs);
    }

    public SpawnDecision allowSpawn(String slug, String holder, long nowMs) {
        SpawnCircuit circuit = currentCircuit(slug);
        if (!circuit.open()) {
            return SpawnDecision.allow();
        }
        if (circuit.blocksAt(nowMs)) {
            return SpawnDecision.block(circuit.openReason(), circuit.openUntilMs());
        }
        if (!store.closeCircuit(slug, holder, nowMs)) {
            return SpawnDecision.leaseLost();
        }
        store.clearSpawnFailures(slug, holder, nowMs);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous_reason", circuit.openReason());
        details.put("open_until_ms", circuit.openUntilMs());
        auditLogger.log(AuditLogger.AuditEvent.of("circuit.close", holder, slug, null, "cooldown_elapsed", details));
        return SpawnDecision.allow();
    }

    /**
     * Read-only variant for dry runs: does not close an elapsed circuit.
     */
    public SpawnDecision peek(String slug, long nowMs) {
        SpawnCircuit circuit = currentCircuit(slug);
        if (circuit.blocksAt(nowMs)) {
            return SpawnDecision.block(circuit.openReason(), circuit.openUntilMs());
        }
        return SpawnDecision.allow();
    }

    public SpawnCircuit recordSpawnFailure(String slug, String dropId, String holder, String error, long nowMs) {
        if (!store.recordSpawnFailure(slug, dropId, holder, error, nowMs)) {
            return currentCircuit(slug);
        }
        int failures = store.countSpawnFailuresSince(slug, nowMs - windowMs);
        SpawnCircuit circuit = currentCircuit(slug);
        if (failures < threshold || circuit.blocksAt(nowMs)) {
            return circuit;
        }
        String reason = failures + " spawn failures within " + Duration.ofMillis(windowMs)
                + ", last: " + (error == null || error.isBlank() ? "unknown error" : error);
        long openUntil = nowMs + cooldownMs;
        if (store.openCircuit(slug, holder, openUntil, reason, nowMs)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("failures", failures);
            details.put("threshold", threshold);
            details.put("open_until_ms", openUntil);
            details.put("reason", reason);
            auditLogger.log(AuditLogger.AuditEvent.of("circuit.open", holder, slug, dropId, "open", details));
        }
        return currentCircuit(slug);
    }

    public void recordSpawnSuccess(String slug, String holder, long nowMs) {
        store.clearSpawnFailures(slug, holder, nowMs);
    }

    private SpawnCircuit currentCircuit(String slug) {
        return store.getBuild(slug)
                .map(BuildView::circuit)
                .orElseThrow(() -> new IllegalArgumentException("Build not found: " + slug));
    }

    public record SpawnDecision(boolean allowed, boolean staleLease, String reason, long openUntilMs) {
        public static SpawnDecision allow() {
            return new SpawnDecision(true, false, null, 0L);
        }

        public static SpawnDecision block(String reason, long openUntilMs) {
            return new SpawnDecision(false, false, reason, openUntilMs);
        }

        public static SpawnDecision leaseLost() {
            return new SpawnDecision(false, true, "tick lease lost", 0L);
        }

        public boolean blocked() {
            return !allowed && !staleLease;
        }
    }
}
