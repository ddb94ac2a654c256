package io.dropwatch.plan;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwatch.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and validates plan JSON.
 *
 * <pre>
 * {"slug": "...", "title": "...",
 *  "drops": [{"id": "D1.1", "stream": 1, "order": 1, "wave": "W1", "blocking": true,
 *             "depends_on": ["D0.1"], "brief": "..."}],
 *  "waves": {"W1": ["D1.1"]}}
 * </pre>
 *
 * Every rejection is an {@link IllegalArgumentException} naming the offending drop.
 */
public final class PlanLoader {
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");
    private static final Pattern STREAM_ORDER_ID = Pattern.compile("D(\\d+)\\.(\\d+)");

    private PlanLoader() {
    }

    public static PlanDocument load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Plan file not found: " + file);
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Plan is not valid JSON: " + file + ": " + e.getMessage(), e);
        }
        return parse(root);
    }

    public static PlanDocument parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Plan must be a JSON object");
        }
        String slug = requireId(root.path("slug"), "slug");
        String title = root.path("title").asText("");
        JsonNode dropsNode = root.path("drops");
        if (!dropsNode.isArray() || dropsNode.isEmpty()) {
            throw new IllegalArgumentException("Plan needs a non-empty drops array");
        }

        List<RawDrop> raw = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        int index = 0;
        for (JsonNode node : dropsNode) {
            RawDrop drop = readDrop(node, index++);
            if (!ids.add(drop.id())) {
                throw new IllegalArgumentException("Duplicate drop id: " + drop.id());
            }
            raw.add(drop);
        }
        checkStreamOrders(raw);
        for (RawDrop drop : raw) {
            for (String dep : drop.dependsOn()) {
                if (!ids.contains(dep)) {
                    throw new IllegalArgumentException("Drop " + drop.id() + " depends on unknown drop " + dep);
                }
            }
        }
        checkAcyclic(raw);

        Map<String, List<String>> waves = root.has("waves") && !root.path("waves").isNull()
                ? explicitWaves(root.path("waves"), raw, ids)
                : derivedWaves(raw);

        Map<String, String> waveOf = new HashMap<>();
        waves.forEach((wave, members) -> members.forEach(m -> waveOf.put(m, wave)));
        checkWaveOrder(raw, waves, waveOf);
        List<PlanDocument.PlanDrop> drops = new ArrayList<>();
        for (RawDrop drop : raw) {
            drops.add(new PlanDocument.PlanDrop(drop.id(), drop.stream(), drop.order(), waveOf.get(drop.id()),
                    drop.blocking(), drop.dependsOn(), drop.brief()));
        }
        return new PlanDocument(slug, title, drops, waves);
    }

    private static RawDrop readDrop(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Drop #" + index + " must be an object");
        }
        String id = requireId(node.path("id"), "drop id");
        int stream = 0;
        int order = index;
        Matcher m = STREAM_ORDER_ID.matcher(id);
        if (m.matches()) {
            stream = Integer.parseInt(m.group(1));
            order = Integer.parseInt(m.group(2));
        }
        if (node.has("stream")) {
            stream = requireNonNegative(node.path("stream"), id, "stream");
        }
        if (node.has("order")) {
            order = requireNonNegative(node.path("order"), id, "order");
        }
        List<String> deps = new ArrayList<>();
        JsonNode depsNode = node.path("depends_on");
        if (!depsNode.isMissingNode() && !depsNode.isNull()) {
            if (!depsNode.isArray()) {
                throw new IllegalArgumentException("Drop " + id + ": depends_on must be an array");
            }
            for (JsonNode dep : depsNode) {
                String target = dep.asText("").trim();
                if (target.isEmpty()) {
                    throw new IllegalArgumentException("Drop " + id + ": blank dependency");
                }
                if (!deps.contains(target)) {
                    deps.add(target);
                }
            }
        }
        String wave = node.hasNonNull("wave") ? requireId(node.path("wave"), "wave of " + id) : null;
        boolean blocking = !node.has("blocking") || node.path("blocking").asBoolean(true);
        String brief = node.path("brief").asText("");
        return new RawDrop(id, stream, order, wave, blocking, deps, brief, index);
    }

    private static void checkStreamOrders(List<RawDrop> drops) {
        Map<Integer, Set<Integer>> seen = new HashMap<>();
        for (RawDrop d : drops) {
            if (d.stream() <= 0) {
                continue;
            }
            if (!seen.computeIfAbsent(d.stream(), k -> new HashSet<>()).add(d.order())) {
                throw new IllegalArgumentException("Drop " + d.id() + ": order " + d.order()
                        + " is used twice in stream " + d.stream());
            }
        }
    }

    private static void checkAcyclic(List<RawDrop> drops) {
        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (RawDrop d : drops) {
            indegree.put(d.id(), d.dependsOn().size());
            for (String dep : d.dependsOn()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(d.id());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        indegree.forEach((id, n) -> {
            if (n == 0) {
                ready.add(id);
            }
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            String id = ready.poll();
            visited++;
            for (String next : dependents.getOrDefault(id, List.of())) {
                if (indegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (visited < drops.size()) {
            Set<String> cyclic = new TreeSet<>();
            indegree.forEach((id, n) -> {
                if (n > 0) {
                    cyclic.add(id);
                }
            });
            throw new IllegalArgumentException("Dependency cycle among drops: " + String.join(", ", cyclic));
        }
    }

    /**
     * A drop may not wait on a drop of a later wave: the earlier wave could never clear.
     */
    private static void checkWaveOrder(List<RawDrop> drops, Map<String, List<String>> waves, Map<String, String> waveOf) {
        Map<String, Integer> position = new HashMap<>();
        for (String wave : waves.keySet()) {
            position.put(wave, position.size());
        }
        for (RawDrop d : drops) {
            int own = position.get(waveOf.get(d.id()));
            for (String dep : d.dependsOn()) {
                if (position.get(waveOf.get(dep)) > own) {
                    throw new IllegalArgumentException("Drop " + d.id() + " in wave " + waveOf.get(d.id())
                            + " depends on " + dep + " from later wave " + waveOf.get(dep));
                }
            }
            if (d.stream() <= 0) {
                continue;
            }
            for (RawDrop other : drops) {
                if (other.stream() == d.stream() && other.order() < d.order()
                        && position.get(waveOf.get(other.id())) > own) {
                    throw new IllegalArgumentException("Drop " + d.id() + " follows " + other.id()
                            + " in stream " + d.stream() + " but sits in an earlier wave");
                }
            }
        }
    }

    private static Map<String, List<String>> explicitWaves(JsonNode wavesNode, List<RawDrop> drops, Set<String> ids) {
        if (!wavesNode.isObject()) {
            throw new IllegalArgumentException("waves must be an object of wave name to drop ids");
        }
        Map<String, List<String>> waves = new LinkedHashMap<>();
        Map<String, String> assigned = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = wavesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String wave = entry.getKey();
            if (!SAFE_ID.matcher(wave).matches()) {
                throw new IllegalArgumentException("Invalid wave name: " + wave);
            }
            if (!entry.getValue().isArray()) {
                throw new IllegalArgumentException("Wave " + wave + " must list drop ids");
            }
            List<String> members = new ArrayList<>();
            for (JsonNode m : entry.getValue()) {
                String id = m.asText("");
                if (!ids.contains(id)) {
                    throw new IllegalArgumentException("Wave " + wave + " lists unknown drop " + id);
                }
                String previous = assigned.putIfAbsent(id, wave);
                if (previous != null) {
                    throw new IllegalArgumentException("Drop " + id + " is in both " + previous + " and " + wave);
                }
                members.add(id);
            }
            waves.put(wave, members);
        }
        for (RawDrop d : drops) {
            String listed = assigned.get(d.id());
            if (listed != null) {
                if (d.wave() != null && !d.wave().equals(listed)) {
                    throw new IllegalArgumentException("Drop " + d.id() + " declares wave " + d.wave()
                            + " but is listed in " + listed);
                }
                continue;
            }
            if (d.wave() == null) {
                throw new IllegalArgumentException("Drop " + d.id() + " is not assigned to any wave");
            }
            waves.computeIfAbsent(d.wave(), k -> new ArrayList<>()).add(d.id());
        }
        waves.values().removeIf(List::isEmpty);
        return waves;
    }

    /**
     * One wave per stream ({@code W<stream>}) unless a drop names its wave. Waves are ordered by the
     * lowest stream among their members, then by first appearance.
     */
    private static Map<String, List<String>> derivedWaves(List<RawDrop> drops) {
        Map<String, List<RawDrop>> grouped = new LinkedHashMap<>();
        for (RawDrop d : drops) {
            String wave = d.wave() != null ? d.wave() : "W" + d.stream();
            grouped.computeIfAbsent(wave, k -> new ArrayList<>()).add(d);
        }
        List<Map.Entry<String, List<RawDrop>>> entries = new ArrayList<>(grouped.entrySet());
        entries.sort(Comparator
                .comparingInt((Map.Entry<String, List<RawDrop>> e) ->
                        e.getValue().stream().mapToInt(d -> d.stream()).min().orElse(0))
                .thenComparingInt(e -> e.getValue().get(0).index()));
        Map<String, List<String>> waves = new LinkedHashMap<>();
        for (Map.Entry<String, List<RawDrop>> e : entries) {
            List<RawDrop> members = new ArrayList<>(e.getValue());
            members.sort(Comparator.comparingInt((RawDrop d) -> d.stream()).thenComparingInt(d -> d.order()));
            waves.put(e.getKey(), members.stream().map(d -> d.id()).toList());
        }
        return waves;
    }

    private static String requireId(JsonNode node, String what) {
        String value = node.isTextual() ? node.asText().trim() : "";
        if (!SAFE_ID.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + value
                    + "' (letters, digits, '.', '_' and '-' only)");
        }
        return value;
    }

    private static int requireNonNegative(JsonNode node, String dropId, String field) {
        if (!node.canConvertToInt() || node.asInt() < 0) {
            throw new IllegalArgumentException("Drop " + dropId + ": " + field + " must be a non-negative integer");
        }
        return node.asInt();
    }

    private record RawDrop(
            String id,
            int stream,
            int order,
            String wave,
            boolean blocking,
            List<String> dependsOn,
            String brief,
            int index
    ) {
    }
}
