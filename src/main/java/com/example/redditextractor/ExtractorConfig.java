package com.example.redditextractor;

import com.example.redditextractor.reddit.RedditCredentials;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Immutable runtime settings for an extraction run. An empty {@code endDate} means "up to today", resolved
 * when the job is built.
 */
public record ExtractorConfig(
        String subreddit,
        String query,
        Optional<LocalDate> startDate,
        Optional<LocalDate> endDate,
        boolean fromBeginning,
        WindowGranularity windowSize,
        Path output,
        Path checkpointDirectory,
        Duration baseDelay,
        Duration maxDelay,
        int politenessInterval,
        int maxRetries,
        int batchSize,
        int maxItemsPerWindow,
        int commentDepth,
        Optional<Integer> maxBatches,
        RedditCredentials credentials,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
}
