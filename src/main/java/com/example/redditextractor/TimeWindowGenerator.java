package com.example.redditextractor;

import com.example.redditextractor.model.TimeWindow;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a job range into contiguous calendar windows (UTC). The last window is cut at the range end,
 * so the union of all windows is exactly {@code [start, end)}.
 */
public final class TimeWindowGenerator {

    private TimeWindowGenerator() {
    }

    public static List<TimeWindow> generate(Instant start, Instant end, WindowGranularity granularity) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
        List<TimeWindow> windows = new ArrayList<>();
        ZonedDateTime current = start.atZone(ZoneOffset.UTC);
        ZonedDateTime last = end.atZone(ZoneOffset.UTC);
        while (current.isBefore(last)) {
            ZonedDateTime next = granularity.nextBoundary(current);
            ZonedDateTime windowEnd = next.isBefore(last) ? next : last;
            windows.add(new TimeWindow(windows.size(), current.toInstant(), windowEnd.toInstant()));
            current = windowEnd;
        }
        return List.copyOf(windows);
    }

    public static List<TimeWindow> generate(ExtractionJob job) {
        return generate(job.start(), job.end(), job.granularity());
    }
}
