package io.dropwatch.worker;

import java.nio.file.Path;

public record SpawnRequest(
        String buildSlug,
        String dropId,
        String brief,
        Path depositPath,
        int attempt
) {
}
