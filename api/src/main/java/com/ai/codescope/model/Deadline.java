package com.ai.codescope.model;

import java.time.Duration;

/**
 * Point in time by which a request must finish its scans.
 */
public record Deadline(long expiresAtNanos) {

    public static Deadline after(Duration timeout) {
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    public static Deadline none() {
        return new Deadline(Long.MAX_VALUE);
    }

    public long remainingNanos() {
        if (expiresAtNanos == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, expiresAtNanos - System.nanoTime());
    }

    public boolean isExpired() {
        return remainingNanos() == 0;
    }
}
