package io.dropwatch.model;

public record TickLease(String holder, long expiresAtMs) {
    public boolean heldAt(long nowMs) {
        return holder != null && expiresAtMs > nowMs;
    }

    public boolean heldBy(String candidate, long nowMs) {
        return heldAt(nowMs) && holder.equals(candidate);
    }
}
