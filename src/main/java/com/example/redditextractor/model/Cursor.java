package com.example.redditextractor.model;

import java.time.Instant;

/**
 * Position of the oldest post observed so far inside a window.
 */
public record Cursor(
        Instant timestamp,
        String id
) {
    public static Cursor of(SearchItem item) {
        return new Cursor(item.created(), item.id());
    }

    /**
     * Returns whichever cursor points further into the past. Ties on the timestamp keep {@code current}.
     */
    public static Cursor older(Cursor current, Cursor candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null || !candidate.timestamp().isBefore(current.timestamp())) {
            return current;
        }
        return candidate;
    }

    public boolean isNewerThan(Cursor other) {
        return timestamp.isAfter(other.timestamp());
    }
}
