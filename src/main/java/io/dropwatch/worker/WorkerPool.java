package io.dropwatch.worker;

/**
 * External worker capability. Implementations are swapped per deployment.
 */
public interface WorkerPool {
    SpawnResult spawn(SpawnRequest request);

    /**
     * A deposit that does not parse while its worker is still alive is reported as {@code RUNNING}:
     * the worker may still be writing it. Once the worker is gone it is reported as deposited.
     */
    PollResult poll(String buildSlug, String dropId, String workerHandle);
}
