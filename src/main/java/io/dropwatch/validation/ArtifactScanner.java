package io.dropwatch.validation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

public final class ArtifactScanner {
    private static final int EXCERPT_CHARS = 100;
    private static final Set<String> SKIP_DIRS = Set.of(".git", "node_modules", "__pycache__", "target");

    private final ValidationRules rules;

    public ArtifactScanner(ValidationRules rules) {
        this.rules = rules;
    }

    public FileFindings scanFile(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            Finding error = new Finding("read_error", "Could not read file: " + e.getMessage(), 0, "");
            return new FileFindings(List.of(error), List.of(), null);
        }
        return scanContent(file.getFileName().toString(), content);
    }

    public FileFindings scanContent(String fileName, String content) {
        List<String> lines = content.lines().toList();
        List<Finding> critical = new ArrayList<>();
        List<Finding> warnings = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            for (PatternRule rule : rules.critical()) {
                if (rule.matches(line)) {
                    critical.add(finding(rule, i + 1, line));
                }
            }
            for (PatternRule rule : rules.warnings()) {
                if (rule.matches(line)) {
                    warnings.add(finding(rule, i + 1, line));
                }
            }
        }
        return new FileFindings(critical, warnings, StructuralStats.analyze(fileName, lines));
    }

    /**
     * Every regular file under {@code root} whose extension is listed, in path order. Keys are
     * relative to {@code root}.
     */
    public Map<String, FileFindings> scanTree(Path root, Collection<String> extensions) {
        Map<String, FileFindings> out = new LinkedHashMap<>();
        if (Files.isRegularFile(root)) {
            out.put(root.getFileName().toString(), scanFile(root));
            return out;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> !inSkippedDir(root, p))
                    .filter(p -> hasExtension(p, extensions))
                    .sorted()
                    .toList();
            for (Path file : files) {
                out.put(root.relativize(file).toString(), scanFile(file));
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to scan directory: " + root, e);
        }
    }

    private static Finding finding(PatternRule rule, int lineNumber, String line) {
        String excerpt = line.strip();
        if (excerpt.length() > EXCERPT_CHARS) {
            excerpt = excerpt.substring(0, EXCERPT_CHARS);
        }
        return new Finding(rule.type(), rule.message(), lineNumber, excerpt);
    }

    private static boolean inSkippedDir(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            if (SKIP_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasExtension(Path file, Collection<String> extensions) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
