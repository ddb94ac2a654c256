package io.dropwatch.validation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record FileFindings(List<Finding> critical, List<Finding> warnings, StructuralStats stats) {
    public FileFindings {
        critical = List.copyOf(critical);
        warnings = List.copyOf(warnings);
    }

    public boolean hasIssues() {
        return !critical.isEmpty() || !warnings.isEmpty();
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("critical", critical);
        row.put("warnings", warnings);
        if (stats != null) {
            row.put("stats", stats.toRow());
        }
        return row;
    }
}
