package com.example.redditextractor;

public interface ProcessingLimiter {
    /**
     * Returns true if the run should stop after the given number of flushed batches.
     */
    boolean shouldStop(long flushedBatches);

    /**
     * Default limiter used in production runs (never stops early).
     */
    ProcessingLimiter NO_LIMIT = flushedBatches -> false;
}
