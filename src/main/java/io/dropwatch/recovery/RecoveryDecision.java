package io.dropwatch.recovery;

import io.dropwatch.model.FailureKind;

/**
 * One recovery verdict. {@code dropId} is {@code "*"} for build-level decisions.
 *
 * @param rule        rule id that produced the decision, e.g. {@code R1} or {@code R1/R2_exhausted}
 * @param blocksBuild true when applying the decision moves the build to {@code blocked}
 */
public record RecoveryDecision(
        String dropId,
        RecoveryAction action,
        String rule,
        String reason,
        FailureKind failureKind,
        int retryCount,
        boolean blocksBuild
) {
    public static final String BUILD_SCOPE = "*";

    public static RecoveryDecision autoRetry(String dropId, String rule, String reason, FailureKind kind, int retryCount) {
        return new RecoveryDecision(dropId, RecoveryAction.AUTO_RETRY, rule, reason, kind, retryCount, false);
    }

    public static RecoveryDecision needsJudgment(String dropId, String reason, FailureKind kind, int retryCount) {
        return new RecoveryDecision(dropId, RecoveryAction.NEEDS_JUDGMENT, "R3", reason, kind, retryCount, false);
    }

    public static RecoveryDecision escalate(String dropId, String rule, String reason, FailureKind kind,
                                            int retryCount, boolean blocksBuild) {
        return new RecoveryDecision(dropId, RecoveryAction.ESCALATE, rule, reason, kind, retryCount, blocksBuild);
    }

    public static RecoveryDecision none(String dropId, String reason) {
        return new RecoveryDecision(dropId, RecoveryAction.NONE, "none", reason, null, 0, false);
    }

    public boolean buildScoped() {
        return BUILD_SCOPE.equals(dropId);
    }
}
