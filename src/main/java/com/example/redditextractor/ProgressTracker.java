package com.example.redditextractor;

import com.example.redditextractor.model.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable progress of one job: completed windows, the window in progress and its cursor, and the
 * exported row count. Every mutation is written through {@link CheckpointManager} before returning.
 */
public final class ProgressTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);

    private final CheckpointManager checkpointManager;
    private JobState state;

    public ProgressTracker(CheckpointManager checkpointManager) {
        this.checkpointManager = checkpointManager;
    }

    /**
     * Checkpoint file used for a job inside a checkpoint directory.
     */
    public static Path checkpointFileFor(Path directory, ExtractionJob job) {
        return directory.resolve(job.key() + ".json");
    }

    /**
     * Finds the most recently updated unfinished checkpoint in {@code directory} for the same subreddit, query
     * and window size. With a non-null {@code start} only checkpoints starting there qualify.
     */
    public static Optional<JobState> findUnfinished(Path directory,
                                                    String subreddit,
                                                    String query,
                                                    WindowGranularity granularity,
                                                    Instant start) throws IOException {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(path -> path.getFileName().toString().endsWith(".json")).sorted().toList();
        }
        JobState latest = null;
        for (Path file : files) {
            Optional<JobState> loaded;
            try {
                loaded = new CheckpointManager(file).load();
            } catch (IOException ex) {
                LOGGER.warn("Skipping unreadable checkpoint {}: {}", file, ex.getMessage());
                continue;
            }
            if (loaded.isEmpty() || !continues(loaded.get(), subreddit, query, granularity, start)) {
                continue;
            }
            JobState state = loaded.get();
            if (latest == null || isLater(state.updatedAt(), latest.updatedAt())) {
                latest = state;
            }
        }
        return Optional.ofNullable(latest);
    }

    private static boolean continues(JobState state, String subreddit, String query, WindowGranularity granularity, Instant start) {
        return state.status() != JobStatus.FINISHED
                && state.start() != null
                && state.end() != null
                && subreddit.equalsIgnoreCase(state.subreddit())
                && query.equals(state.query())
                && granularity.label().equals(state.granularity())
                && (start == null || start.equals(state.start()));
    }

    private static boolean isLater(Instant candidate, Instant current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }

    /**
     * Loads the saved state for {@code job}, or a fresh state if none was saved yet.
     *
     * @throws IllegalStateException if the checkpoint file belongs to a different job
     */
    public JobState load(ExtractionJob job) throws IOException {
        Optional<JobState> saved = checkpointManager.load();
        if (saved.isPresent()) {
            JobState existing = saved.get();
            if (!job.key().equals(existing.jobKey())) {
                throw new IllegalStateException("Checkpoint " + checkpointManager.path()
                        + " belongs to job " + existing.jobKey() + ", not " + job.key());
            }
            LOGGER.info("Loaded checkpoint {}: status {}, {} windows complete, {} records exported",
                    checkpointManager.path(), existing.status(), existing.completedWindows().size(), existing.totalExported());
            state = existing;
        } else {
            state = JobState.initial(job);
        }
        return state;
    }

    public JobState state() {
        requireLoaded();
        return state;
    }

    public WindowStatus windowStatus(int windowIndex) {
        requireLoaded();
        if (state.isComplete(windowIndex)) {
            return WindowStatus.COMPLETE;
        }
        Integer current = state.currentWindow();
        return current != null && current == windowIndex ? WindowStatus.IN_PROGRESS : WindowStatus.PENDING;
    }

    /**
     * Cursor to resume {@code windowIndex} from, or null when the window has no partial progress.
     */
    public Cursor savedCursor(int windowIndex) {
        return windowStatus(windowIndex) == WindowStatus.IN_PROGRESS ? state.cursor() : null;
    }

    public void markRunning() throws IOException {
        requireLoaded();
        update(state.clearFailure().withStatus(JobStatus.RUNNING));
    }

    public void markWindowStarted(int windowIndex, Cursor cursor) throws IOException {
        requireLoaded();
        if (state.isComplete(windowIndex)) {
            throw new IllegalStateException("Window " + windowIndex + " is already complete");
        }
        Cursor resume = windowStatus(windowIndex) == WindowStatus.IN_PROGRESS
                ? Cursor.older(state.cursor(), cursor)
                : cursor;
        update(state.withCurrent(windowIndex, resume));
    }

    /**
     * Moves the window's cursor toward its older edge. A cursor newer than the saved one is ignored.
     */
    public void advanceCursor(int windowIndex, Cursor cursor) throws IOException {
        requireLoaded();
        if (windowStatus(windowIndex) != WindowStatus.IN_PROGRESS) {
            throw new IllegalStateException("Window " + windowIndex + " is not in progress");
        }
        Cursor saved = state.cursor();
        if (saved != null && cursor != null && cursor.isNewerThan(saved)) {
            LOGGER.debug("Ignoring cursor {} newer than saved {}", cursor, saved);
            return;
        }
        Cursor next = Cursor.older(saved, cursor);
        if (next != null && next.equals(saved)) {
            return;
        }
        update(state.withCurrent(windowIndex, next));
    }

    public void markWindowComplete(int windowIndex) throws IOException {
        requireLoaded();
        update(state.withCompleted(windowIndex));
    }

    public void recordCount(long delta) throws IOException {
        requireLoaded();
        if (delta == 0) {
            return;
        }
        update(state.withTotalExported(state.totalExported() + delta));
    }

    /**
     * Aligns the exported total with the rows of this job actually present in the export store.
     */
    public void reconcileTotal(long actualRows) throws IOException {
        requireLoaded();
        if (state.totalExported() != actualRows) {
            LOGGER.warn("Checkpoint records {} exported rows but the store holds {}; using the store's count.",
                    state.totalExported(), actualRows);
            update(state.withTotalExported(actualRows));
        }
    }

    public void markFinished() throws IOException {
        requireLoaded();
        update(state.withCurrent(null, null).withStatus(JobStatus.FINISHED));
    }

    public void markFailed(Integer windowIndex, String message) throws IOException {
        requireLoaded();
        update(state.withFailure(windowIndex, message));
    }

    /**
     * Deletes the checkpoint; the next {@link #load} starts over.
     */
    public void reset() throws IOException {
        if (checkpointManager.delete()) {
            LOGGER.info("Deleted checkpoint {}", checkpointManager.path());
        }
        state = null;
    }

    public Path path() {
        return checkpointManager.path();
    }

    private void update(JobState next) throws IOException {
        checkpointManager.save(next);
        state = next;
    }

    private void requireLoaded() {
        if (state == null) {
            throw new IllegalStateException("Job state not loaded");
        }
    }
}
