package com.example.redditextractor;

/**
 * Outcome of one {@link Extractor#run} call. A run stopped by a {@link ProcessingLimiter} reports
 * {@link JobStatus#RUNNING}.
 */
public record ExtractionResult(
        JobStatus status,
        int windowsTotal,
        int windowsSkipped,
        int windowsCompleted,
        long recordsAdded,
        long totalExported,
        Integer failedWindow,
        String message
) {
    public boolean finished() {
        return status == JobStatus.FINISHED;
    }

    public boolean failed() {
        return status == JobStatus.FAILED;
    }
}
