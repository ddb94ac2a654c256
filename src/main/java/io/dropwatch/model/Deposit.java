package io.dropwatch.model;

import java.util.List;
import java.util.Locale;

/**
 * A worker's write-once claim for one drop.
 */
public record Deposit(String dropId, String status, String summary, List<String> artifacts) {
    public static final String MALFORMED = "malformed";

    public Deposit {
        status = status == null ? "" : status.trim().toLowerCase(Locale.ROOT);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public boolean claimsComplete() {
        return "complete".equals(status);
    }

    public boolean malformed() {
        return MALFORMED.equals(status);
    }

    public boolean claimsBlocked() {
        return "blocked".equals(status) || "partial".equals(status);
    }
}
