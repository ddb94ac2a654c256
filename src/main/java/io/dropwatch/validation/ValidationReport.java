package io.dropwatch.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one gate evaluation. Never mutated; re-validation produces a new report.
 *
 * <p>{@code issues} only lists artifacts that produced at least one finding.
 */
public record ValidationReport(
        String dropId,
        String buildSlug,
        String timestamp,
        int filesChecked,
        int criticalCount,
        int warningCount,
        Map<String, FileFindings> issues
) {
    public ValidationReport {
        issues = Collections.unmodifiableMap(new LinkedHashMap<>(issues));
    }

    public boolean passed() {
        return criticalCount == 0;
    }

    public static ValidationReport of(String dropId, String buildSlug, String timestamp, int filesChecked,
                                      Map<String, FileFindings> scanned) {
        int critical = 0;
        int warnings = 0;
        Map<String, FileFindings> offending = new LinkedHashMap<>();
        for (Map.Entry<String, FileFindings> e : scanned.entrySet()) {
            critical += e.getValue().critical().size();
            warnings += e.getValue().warnings().size();
            if (e.getValue().hasIssues()) {
                offending.put(e.getKey(), e.getValue());
            }
        }
        return new ValidationReport(dropId, buildSlug, timestamp, filesChecked, critical, warnings, offending);
    }

    public Map<String, Object> toRow() {
        Map<String, Object> files = new LinkedHashMap<>();
        issues.forEach((path, findings) -> files.put(path, findings.toRow()));
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("drop_id", dropId);
        row.put("build_slug", buildSlug);
        row.put("timestamp", timestamp);
        row.put("files_checked", filesChecked);
        row.put("critical_count", criticalCount);
        row.put("warning_count", warningCount);
        row.put("passed", passed());
        row.put("issues", files);
        return row;
    }
}
