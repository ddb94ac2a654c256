package io.dropwatch.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwatch.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * System-learnings log: one JSON object per line, append-only, read later by humans or triage jobs.
 */
public final class LessonLog {
    public static final String CATEGORY_STUB_CODE = "stub_code";
    public static final String CATEGORY_REVIEW = "review";
    public static final String RESOLUTION_PENDING = "pending";

    private final Path file;

    public LessonLog(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public synchronized void append(Lesson lesson) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", lesson.timestamp());
        row.put("build_slug", lesson.buildSlug());
        row.put("drop_id", lesson.dropId());
        row.put("category", lesson.category());
        row.put("severity", lesson.severity());
        row.put("summary", lesson.summary());
        row.put("details", lesson.details());
        row.put("resolution", lesson.resolution());
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append lesson: " + file, e);
        }
    }

    public List<JsonNode> tail(int limit) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            List<JsonNode> out = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
            int from = Math.max(0, out.size() - Math.max(1, limit));
            return List.copyOf(out.subList(from, out.size()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read lessons: " + file, e);
        }
    }

    public record Lesson(
            String timestamp,
            String buildSlug,
            String dropId,
            String category,
            String severity,
            String summary,
            Object details,
            String resolution
    ) {
    }
}
