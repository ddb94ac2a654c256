package io.dropwatch.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.dropwatch.config.DropWatchConfig;
import io.dropwatch.model.Deposit;
import io.dropwatch.util.Jsons;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads worker deposits from {@code builds/<slug>/deposits/<drop>.json}. Deposits are never edited;
 * a retry moves the current one into {@code archived/}.
 */
public final class DepositInbox {
    public static final String MALFORMED_STATUS = Deposit.MALFORMED;
    private static final DateTimeFormatter ARCHIVE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final DropWatchConfig config;
    private final Clock clock;

    public DepositInbox(DropWatchConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public Path depositPath(String slug, String dropId) {
        return config.depositFile(slug, dropId);
    }

    public Optional<Deposit> read(String slug, String dropId) {
        Path file = depositPath(slug, dropId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(parse(file, dropId));
    }

    public List<Deposit> list(String slug) {
        Path dir = config.depositsDir(slug);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            List<Deposit> out = new ArrayList<>();
            for (Path file : files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList()) {
                String name = file.getFileName().toString();
                out.add(parse(file, name.substring(0, name.length() - ".json".length())));
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to list deposits: " + dir, e);
        }
    }

    /**
     * Moves the current deposit of a drop under {@code archived/}. Returns the archived path, or empty
     * when there was nothing to archive.
     */
    public Optional<Path> archive(String slug, String dropId) {
        Path source = depositPath(slug, dropId);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        Path dir = config.archivedDepositsDir(slug);
        String base = dropId + "_" + ARCHIVE_STAMP.format(clock.instant());
        try {
            Files.createDirectories(dir);
            for (int attempt = 0; ; attempt++) {
                Path target = dir.resolve(attempt == 0 ? base + ".json" : base + "-" + attempt + ".json");
                try {
                    Files.move(source, target);
                    return Optional.of(target);
                } catch (FileAlreadyExistsException ignored) {
                    // Archived twice within the same second; try the next suffix.
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to archive deposit " + slug + "/" + dropId, e);
        }
    }

    private Deposit parse(Path file, String dropId) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            return new Deposit(dropId, MALFORMED_STATUS, "Unreadable deposit: " + e.getMessage(), List.of());
        }
        if (node == null || !node.isObject()) {
            return new Deposit(dropId, MALFORMED_STATUS, "Deposit is not a JSON object", List.of());
        }
        List<String> artifacts = new ArrayList<>();
        for (JsonNode a : node.path("artifacts")) {
            if (a.isTextual() && !a.asText().isBlank()) {
                artifacts.add(a.asText());
            }
        }
        // The file name is authoritative for the drop id.
        return new Deposit(
                dropId,
                node.path("status").asText(""),
                node.path("summary").asText(""),
                artifacts
        );
    }
}
