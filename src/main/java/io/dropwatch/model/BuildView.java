package io.dropwatch.model;

public record BuildView(
        String slug,
        String title,
        BuildStatus status,
        String statusReason,
        TickLease lease,
        SpawnCircuit circuit,
        Long startedAtMs,
        Long lastProgressAtMs,
        long createdAtMs,
        long updatedAtMs,
        Long archivedAtMs
) {
}
