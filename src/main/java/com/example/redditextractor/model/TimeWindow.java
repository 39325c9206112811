package com.example.redditextractor.model;

import java.time.Instant;

/**
 * Half-open search window {@code [start, end)} at position {@code index} of a job's plan.
 */
public record TimeWindow(
        int index,
        Instant start,
        Instant end
) {
    public TimeWindow {
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must be before end: " + start + " / " + end);
        }
    }

    /**
     * Returns true if the timestamp falls inside {@code [start, end)}.
     */
    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    /**
     * Newest inclusive search bound that still belongs to this window.
     */
    public Instant newestBound() {
        return end.minusSeconds(1);
    }

    @Override
    public String toString() {
        return "#" + index + " [" + start + ", " + end + ")";
    }
}
