package io.dropwatch.control;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwatch.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The control file {@code {"state": "active|paused|stopped", "updated_at": "..."}}.
 *
 * <p>Nothing is cached: every {@link #read()} goes back to disk so an operator toggle applies to the
 * next cycle. A missing file reads as {@code active} and is created on first read.
 */
public final class ControlPlane {
    private final Path file;
    private final Clock clock;

    public ControlPlane(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    public ControlSnapshot read() {
        if (!Files.exists(file)) {
            return write(ControlState.ACTIVE);
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Control file is not valid JSON: " + file, e);
        }
        if (node == null || !node.path("state").isTextual()) {
            throw new IllegalStateException("Control file has no state: " + file);
        }
        ControlState state;
        try {
            state = ControlState.parse(node.path("state").asText());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Control file " + file + ": " + e.getMessage(), e);
        }
        return new ControlSnapshot(state, node.path("updated_at").asText(null));
    }

    public synchronized ControlSnapshot write(ControlState state) {
        String updatedAt = clock.instant().toString();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", state.wireName());
        body.put("updated_at", updatedAt);
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(body), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException atomicUnsupported) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write control file: " + file, e);
        }
        return new ControlSnapshot(state, updatedAt);
    }

    public record ControlSnapshot(ControlState state, String updatedAt) {
    }
}
