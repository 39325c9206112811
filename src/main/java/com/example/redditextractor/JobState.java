package com.example.redditextractor;

import com.example.redditextractor.model.Cursor;

import java.time.Instant;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Serializable checkpoint payload for resuming an extraction.
 */
public record JobState(
        String jobKey,
        String subreddit,
        String query,
        Instant start,
        Instant end,
        String granularity,
        JobStatus status,
        SortedSet<Integer> completedWindows,
        Integer currentWindow,
        Cursor cursor,
        long totalExported,
        Integer failedWindow,
        String failureMessage,
        Instant updatedAt
) {
    public JobState {
        completedWindows = completedWindows == null
                ? new TreeSet<>()
                : new TreeSet<>(completedWindows);
        status = status == null ? JobStatus.NOT_STARTED : status;
    }

    public static JobState initial(ExtractionJob job) {
        return new JobState(
                job.key(),
                job.subreddit(),
                job.query(),
                job.start(),
                job.end(),
                job.granularity().label(),
                JobStatus.NOT_STARTED,
                new TreeSet<>(),
                null,
                null,
                0L,
                null,
                null,
                Instant.now()
        );
    }

    public boolean isComplete(int windowIndex) {
        return completedWindows.contains(windowIndex);
    }

    public JobState withStatus(JobStatus newStatus) {
        return new JobState(jobKey, subreddit, query, start, end, granularity, newStatus, completedWindows,
                currentWindow, cursor, totalExported, failedWindow, failureMessage, Instant.now());
    }

    public JobState withCurrent(Integer window, Cursor newCursor) {
        return new JobState(jobKey, subreddit, query, start, end, granularity, status, completedWindows,
                window, newCursor, totalExported, failedWindow, failureMessage, Instant.now());
    }

    public JobState withCompleted(int windowIndex) {
        SortedSet<Integer> completed = new TreeSet<>(completedWindows);
        completed.add(windowIndex);
        return new JobState(jobKey, subreddit, query, start, end, granularity, status, completed,
                null, null, totalExported, failedWindow, failureMessage, Instant.now());
    }

    public JobState withTotalExported(long total) {
        return new JobState(jobKey, subreddit, query, start, end, granularity, status, completedWindows,
                currentWindow, cursor, total, failedWindow, failureMessage, Instant.now());
    }

    public JobState withFailure(Integer window, String message) {
        return new JobState(jobKey, subreddit, query, start, end, granularity, JobStatus.FAILED, completedWindows,
                currentWindow, cursor, totalExported, window, message, Instant.now());
    }

    public JobState clearFailure() {
        return new JobState(jobKey, subreddit, query, start, end, granularity, status, completedWindows,
                currentWindow, cursor, totalExported, null, null, Instant.now());
    }
}
