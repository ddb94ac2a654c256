package io.dropwatch.plan;

import io.dropwatch.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class PlanLoaderTest {

    @Test
    void derivesStreamWavesFromDropIds() throws Exception {
        PlanDocument plan = parse("""
                {"slug": "auth", "title": "Auth",
                 "drops": [
                   {"id": "D2.1", "depends_on": ["D1.2"]},
                   {"id": "D1.2"},
                   {"id": "D1.1", "blocking": false, "brief": "schema"}
                 ]}
                """);

        Assertions.assertEquals("auth", plan.slug());
        Assertions.assertEquals(List.of("W1", "W2"), List.copyOf(plan.waves().keySet()));
        Assertions.assertEquals(List.of("D1.1", "D1.2"), plan.waves().get("W1"));
        Assertions.assertEquals(List.of("D2.1"), plan.waves().get("W2"));

        PlanDocument.PlanDrop first = plan.drops().stream().filter(d -> d.id().equals("D1.1")).findFirst().orElseThrow();
        Assertions.assertEquals(1, first.stream());
        Assertions.assertEquals(1, first.order());
        Assertions.assertFalse(first.blocking());
        Assertions.assertEquals("schema", first.brief());
        Assertions.assertEquals("W1", first.wave());
    }

    @Test
    void explicitWavesAreKeptInDeclaredOrder() throws Exception {
        PlanDocument plan = parse("""
                {"slug": "etl",
                 "drops": [
                   {"id": "extract"},
                   {"id": "load", "depends_on": ["extract", "extract"]},
                   {"id": "docs", "wave": "late"}
                 ],
                 "waves": {"early": ["extract"], "late": ["load"]}}
                """);

        Assertions.assertEquals(List.of("early", "late"), List.copyOf(plan.waves().keySet()));
        Assertions.assertEquals(List.of("load", "docs"), plan.waves().get("late"));
        PlanDocument.PlanDrop load = plan.drops().get(1);
        Assertions.assertEquals(List.of("extract"), load.dependsOn());
        Assertions.assertEquals(0, load.stream());
        Assertions.assertEquals(1, load.order());
    }

    @Test
    void rejectsInvalidPlans() {
        assertRejected("""
                {"slug": "x", "drops": [{"id": "D1.1"}, {"id": "D1.1"}]}
                """, "Duplicate drop id");
        assertRejected("""
                {"slug": "x", "drops": [{"id": "D1.1", "depends_on": ["D9.9"]}]}
                """, "unknown drop D9.9");
        assertRejected("""
                {"slug": "x", "drops": [{"id": "a", "depends_on": ["b"]}, {"id": "b", "depends_on": ["a"]}]}
                """, "Dependency cycle among drops: a, b");
        assertRejected("""
                {"slug": "x", "drops": [{"id": "a"}, {"id": "b"}], "waves": {"W1": ["a", "b"], "W2": ["b"]}}
                """, "is in both W1 and W2");
        assertRejected("""
                {"slug": "x", "drops": [{"id": "a", "depends_on": ["b"]}, {"id": "b"}],
                 "waves": {"W1": ["a"], "W2": ["b"]}}
                """, "from later wave W2");
        assertRejected("""
                {"slug": "x", "drops": [{"id": "a"}, {"id": "b"}], "waves": {"W1": ["a"]}}
                """, "not assigned to any wave");
        assertRejected("""
                {"slug": "../etc", "drops": [{"id": "a"}]}
                """, "Invalid slug");
        assertRejected("""
                {"slug": "x", "drops": []}
                """, "non-empty drops");
    }

    @Test
    void loadsPlanFromFile() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-plan-");
        try {
            Path file = root.resolve("plan.json");
            Files.writeString(file, "{\"slug\": \"svc\", \"drops\": [{\"id\": \"D1.1\"}]}", StandardCharsets.UTF_8);
            Assertions.assertEquals("svc", PlanLoader.load(file).slug());

            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> PlanLoader.load(file));
            Assertions.assertThrows(IllegalArgumentException.class, () -> PlanLoader.load(root.resolve("missing.json")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static PlanDocument parse(String json) throws IOException {
        return PlanLoader.parse(Jsons.mapper().readTree(json));
    }

    private static void assertRejected(String json, String fragment) {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () -> parse(json));
        Assertions.assertTrue(e.getMessage().contains(fragment), e.getMessage());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
