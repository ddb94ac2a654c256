package io.dropwatch.model;

import java.util.List;

public record DropView(
        String buildSlug,
        String dropId,
        String wave,
        int stream,
        int order,
        boolean blocking,
        DropStatus status,
        FailureKind failureKind,
        String failureReason,
        int retryCount,
        String retryNote,
        Long startedAtMs,
        String workerHandle,
        List<String> dependsOn,
        long updatedAtMs
) {
    public DropView {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
