package io.dropwatch.validation;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One line-level marker. Patterns are matched case-insensitively anywhere in the line.
 */
public record PatternRule(String type, Severity severity, Pattern pattern, String message) {
    public static PatternRule of(String type, Severity severity, String regex, String message) {
        try {
            return new PatternRule(type, severity, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), message);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid validator pattern for " + type + ": " + regex, e);
        }
    }

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }
}
