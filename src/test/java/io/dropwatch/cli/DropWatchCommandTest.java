package io.dropwatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwatch.Main;
import io.dropwatch.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class DropWatchCommandTest {

    @Test
    void createStatusAndControlRoundTrip() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-cli-");
        try {
            Path plan = root.resolve("plan.json");
            Files.writeString(plan, """
                    {"slug": "auth", "drops": [{"id": "D1.1", "brief": "Create schema"}, {"id": "D1.2"}]}
                    """, StandardCharsets.UTF_8);
            String dataRoot = root.resolve("data").toString();

            Run created = run("--root", dataRoot, "create", plan.toString());
            Assertions.assertEquals(0, created.exitCode());
            JsonNode outcome = Jsons.mapper().readTree(created.out());
            Assertions.assertEquals("auth", outcome.path("slug").asText());
            Assertions.assertEquals("active", outcome.path("status").asText());
            Assertions.assertTrue(Files.isRegularFile(root.resolve("data/builds/auth/briefs/D1.1.md")));

            Run status = run("--root", dataRoot, "status", "auth");
            Assertions.assertEquals(0, status.exitCode());
            JsonNode view = Jsons.mapper().readTree(status.out());
            Assertions.assertEquals("W1", view.path("activeWave").asText());
            Assertions.assertEquals("D1.1", view.path("readyDrops").get(0).asText());

            Assertions.assertEquals(0, run("--root", dataRoot, "control", "paused").exitCode());
            Run tick = run("--root", dataRoot, "tick");
            Assertions.assertEquals(0, tick.exitCode());
            Assertions.assertEquals("paused", Jsons.mapper().readTree(tick.out()).path("controlState").asText());

            Assertions.assertEquals(0, run("--root", dataRoot, "control", "stopped").exitCode());
            Assertions.assertEquals(3, run("--root", dataRoot, "tick").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void operatorMistakesPrintErrorAndExitOne() throws Exception {
        Path root = Files.createTempDirectory("dropwatch-test-cli-errors-");
        try {
            String dataRoot = root.toString();

            Run missing = run("--root", dataRoot, "status", "nope");
            Assertions.assertEquals(1, missing.exitCode());
            Assertions.assertEquals("Build not found: nope",
                    Jsons.mapper().readTree(missing.out()).path("error").asText());

            Assertions.assertEquals(1, run("--root", dataRoot, "control", "sleeping").exitCode());
            Assertions.assertEquals(1, run("--root", dataRoot, "create", root.resolve("none.json").toString()).exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Run run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = Main.newCommandLine().execute(args);
            return new Run(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Run(int exitCode, String out) {
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
