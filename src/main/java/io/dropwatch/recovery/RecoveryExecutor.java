package io.dropwatch.recovery;

import io.dropwatch.model.BuildStatus;
import io.dropwatch.model.FailureKind;
import io.dropwatch.observability.AuditLogger;
import io.dropwatch.storage.BuildStore;
import io.dropwatch.worker.DepositInbox;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Applies recovery decisions under a held tick lease and records each one.
 */
public final class RecoveryExecutor {
    public static final String DEAD_RETRY_NOTE = "Previous attempt died (no response within timeout). "
            + "Focus on completing the core requirement first. "
            + "If blocked, write a deposit with status 'blocked' immediately.";
    public static final String SPAWN_RETRY_NOTE = "Previous attempt failed during spawn (transient error). "
            + "This is likely a temporary issue. Proceed normally.";

    private final BuildStore store;
    private final DepositInbox inbox;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public RecoveryExecutor(BuildStore store, DepositInbox inbox, AuditLogger auditLogger, Clock clock) {
        this.store = store;
        this.inbox = inbox;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public List<AppliedDecision> apply(String slug, List<RecoveryDecision> decisions, String holder) {
        List<AppliedDecision> out = new ArrayList<>();
        for (RecoveryDecision decision : decisions) {
            AppliedDecision applied = applyOne(slug, decision, holder);
            store.recordRecoveryAction(new BuildStore.RecoveryActionRow(
                    slug,
                    decision.dropId(),
                    decision.rule(),
                    decision.action().wireName(),
                    decision.failureKind() == null ? null : decision.failureKind().name(),
                    decision.reason(),
                    holder,
                    applied.applied(),
                    clock.millis()
            ));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("rule", decision.rule());
            details.put("action", decision.action().wireName());
            details.put("reason", decision.reason());
            details.put("detail", applied.detail());
            auditLogger.log(AuditLogger.AuditEvent.of("recovery.action", holder, slug, decision.dropId(),
                    applied.applied() ? "applied" : "not_applied", details));
            out.add(applied);
        }
        return out;
    }

    /**
     * Archives the current deposit, then puts the drop back to {@code pending} with a note for the next
     * worker. Used by auto retry and by operator retries.
     */
    public BuildStore.DropTransition retryDrop(String slug, String dropId, String holder, String note) {
        Optional<Path> archived = inbox.archive(slug, dropId);
        BuildStore.DropTransition transition = store.resetForRetry(slug, dropId, holder, note, clock.millis());
        if (archived.isPresent()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("archived_to", archived.get().toString());
            details.put("outcome", transition.outcome().name());
            auditLogger.log(AuditLogger.AuditEvent.of("deposit.archive", holder, slug, dropId, "archived", details));
        }
        return transition;
    }

    private AppliedDecision applyOne(String slug, RecoveryDecision decision, String holder) {
        return switch (decision.action()) {
            case AUTO_RETRY -> {
                String note = decision.failureKind() == FailureKind.SPAWN_ERROR ? SPAWN_RETRY_NOTE : DEAD_RETRY_NOTE;
                BuildStore.DropTransition t = retryDrop(slug, decision.dropId(), holder, note);
                yield new AppliedDecision(decision, t.isApplied(),
                        "retry " + t.outcome().name().toLowerCase(Locale.ROOT));
            }
            case ESCALATE -> decision.blocksBuild()
                    ? blockBuild(slug, decision, holder)
                    : new AppliedDecision(decision, true, "escalated");
            case NEEDS_JUDGMENT -> new AppliedDecision(decision, true, "awaiting resolve");
            case NONE -> new AppliedDecision(decision, true, "no action");
        };
    }

    private AppliedDecision blockBuild(String slug, RecoveryDecision decision, String holder) {
        boolean blocked = store.setBuildStatus(slug, holder, EnumSet.of(BuildStatus.ACTIVE),
                BuildStatus.BLOCKED, decision.reason(), clock.millis());
        if (blocked) {
            auditLogger.log(AuditLogger.AuditEvent.of("build.blocked", holder, slug, null, decision.rule(),
                    Map.of("reason", decision.reason())));
        }
        return new AppliedDecision(decision, blocked, blocked ? "build blocked" : "build status unchanged");
    }

    public record AppliedDecision(RecoveryDecision decision, boolean applied, String detail) {
    }
}
