package com.example.redditextractor;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

public enum WindowGranularity {
    MONTHLY,
    YEARLY;

    /**
     * Returns the first instant of the period following the one containing {@code time}.
     */
    ZonedDateTime nextBoundary(ZonedDateTime time) {
        ZonedDateTime dayStart = time.truncatedTo(ChronoUnit.DAYS);
        return switch (this) {
            case MONTHLY -> dayStart.withDayOfMonth(1).plusMonths(1);
            case YEARLY -> dayStart.withDayOfYear(1).plusYears(1);
        };
    }

    public static WindowGranularity parse(String value) {
        if (value == null || value.isBlank()) {
            return MONTHLY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("windowSize must be 'monthly' or 'yearly', got: " + value, ex);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
