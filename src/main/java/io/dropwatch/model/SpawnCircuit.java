package io.dropwatch.model;

public record SpawnCircuit(boolean open, long openUntilMs, String openReason) {
    public static SpawnCircuit closed() {
        return new SpawnCircuit(false, 0L, null);
    }

    public boolean blocksAt(long nowMs) {
        return open && nowMs < openUntilMs;
    }
}
