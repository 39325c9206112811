package com.example.redditextractor;

import java.nio.file.Path;

/**
 * Receives the export file and checkpoint after every flushed batch so they can be mirrored elsewhere.
 * Implementations must not block the extraction; {@link #close()} waits for queued work.
 */
@FunctionalInterface
public interface ArtifactSyncer extends AutoCloseable {
    /**
     * Schedules a copy of {@code artifact} in its current state.
     */
    void enqueue(Path artifact);

    /**
     * Schedules every artifact written by one checkpoint step, in order.
     */
    default void enqueueAll(Path... artifacts) {
        for (Path artifact : artifacts) {
            if (artifact != null) {
                enqueue(artifact);
            }
        }
    }

    @Override
    default void close() {
    }

    /**
     * Syncer used when no mirror is configured.
     */
    static ArtifactSyncer noop() {
        return artifact -> {
        };
    }
}
