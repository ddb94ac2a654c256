package io.dropwatch.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered marker rules: every critical rule is tried on a line, then every warning rule.
 * A line can produce more than one finding.
 *
 * <p>Deployments extend the defaults through settings. An extra entry is either a bare regex or
 * {@code type=regex}.
 */
public final class ValidationRules {
    private final List<PatternRule> critical;
    private final List<PatternRule> warnings;

    private ValidationRules(List<PatternRule> critical, List<PatternRule> warnings) {
        this.critical = List.copyOf(critical);
        this.warnings = List.copyOf(warnings);
    }

    public static ValidationRules defaults() {
        List<PatternRule> critical = List.of(
                PatternRule.of("empty_pass", Severity.CRITICAL, "^\\s*pass\\s*$",
                        "Function body is just `pass`"),
                PatternRule.of("ellipsis_stub", Severity.CRITICAL, "^\\s*\\.\\.\\.\\s*$",
                        "Function body is just `...`"),
                PatternRule.of("not_implemented", Severity.CRITICAL,
                        "raise\\s+NotImplementedError|throw\\s+new\\s+(?:Error|UnsupportedOperationException)\\(\\s*[\"']not\\s+(?:yet\\s+)?implemented",
                        "Raises a not-implemented error"),
                PatternRule.of("todo_implement", Severity.CRITICAL, "TODO:\\s*implement",
                        "TODO: implement marker"),
                PatternRule.of("stub_marker", Severity.CRITICAL, "\\bSTUB\\b",
                        "STUB marker found"),
                PatternRule.of("fixme_critical", Severity.CRITICAL, "FIXME:\\s*critical",
                        "Critical FIXME")
        );
        List<PatternRule> warnings = List.of(
                PatternRule.of("todo_generic", Severity.WARNING, "TODO(?!:)", "TODO marker"),
                PatternRule.of("hack_marker", Severity.WARNING, "\\bHACK\\b", "HACK marker"),
                PatternRule.of("xxx_marker", Severity.WARNING, "XXX", "XXX marker"),
                PatternRule.of("fixme_generic", Severity.WARNING, "FIXME", "FIXME marker"),
                PatternRule.of("placeholder_comment", Severity.WARNING, "(?:#|//|/\\*).*placeholder",
                        "Placeholder comment")
        );
        return new ValidationRules(critical, warnings);
    }

    public ValidationRules withExtras(List<String> extraCritical, List<String> extraWarnings) {
        List<PatternRule> c = new ArrayList<>(critical);
        List<PatternRule> w = new ArrayList<>(warnings);
        for (String raw : extraCritical) {
            c.add(parse(raw, Severity.CRITICAL, "custom_critical"));
        }
        for (String raw : extraWarnings) {
            w.add(parse(raw, Severity.WARNING, "custom_warning"));
        }
        return new ValidationRules(c, w);
    }

    public List<PatternRule> critical() {
        return critical;
    }

    public List<PatternRule> warnings() {
        return warnings;
    }

    private static PatternRule parse(String raw, Severity severity, String fallbackType) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Validator pattern must not be blank");
        }
        String type = fallbackType;
        String regex = raw;
        int eq = raw.indexOf('=');
        if (eq > 0 && raw.substring(0, eq).matches("[a-z_][a-z0-9_]*")) {
            type = raw.substring(0, eq);
            regex = raw.substring(eq + 1);
        }
        return PatternRule.of(type, severity, regex, "Custom marker: " + type);
    }
}
