package io.dropwatch.worker;

public record SpawnResult(
        boolean success,
        String workerHandle,
        String error
) {
    public static SpawnResult ok(String workerHandle) {
        return new SpawnResult(true, workerHandle, null);
    }

    public static SpawnResult fail(String error) {
        return new SpawnResult(false, null, error);
    }
}
