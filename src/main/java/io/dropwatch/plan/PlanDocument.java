package io.dropwatch.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated build plan. Waves are ordered; every drop belongs to exactly one wave.
 */
public record PlanDocument(String slug, String title, List<PlanDrop> drops, Map<String, List<String>> waves) {
    public PlanDocument {
        drops = List.copyOf(drops);
        LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
        waves.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        waves = Collections.unmodifiableMap(copy);
    }

    public record PlanDrop(
            String id,
            int stream,
            int order,
            String wave,
            boolean blocking,
            List<String> dependsOn,
            String brief
    ) {
        public PlanDrop {
            dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        }
    }
}
