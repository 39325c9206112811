package com.example.redditextractor;

import com.example.redditextractor.model.Cursor;
import com.example.redditextractor.model.RedditPost;
import com.example.redditextractor.model.SearchItem;
import com.example.redditextractor.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Orchestrates an extraction: walks the window plan in order, skips completed windows, resumes the window
 * in progress from its saved cursor, drops posts already exported, and checkpoints after every flushed batch.
 * A crash loses at most the unflushed batch, which the next run fetches again.
 */
public final class Extractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(Extractor.class);

    private final RemoteSearchClient client;
    private final PostMapper mapper;
    private final IncrementalExporter exporter;
    private final ProgressTracker tracker;
    private final ArtifactSyncer syncer;
    private final int batchSize;
    private final ProcessingLimiter limiter;

    private long flushedBatches;
    private long recordsAdded;

    public Extractor(RemoteSearchClient client, IncrementalExporter exporter, ProgressTracker tracker, int batchSize) {
        this(client, exporter, tracker, batchSize, ArtifactSyncer.noop(), ProcessingLimiter.NO_LIMIT);
    }

    public Extractor(RemoteSearchClient client,
                     IncrementalExporter exporter,
                     ProgressTracker tracker,
                     int batchSize,
                     ArtifactSyncer syncer,
                     ProcessingLimiter limiter) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.client = client;
        this.mapper = new PostMapper(client);
        this.exporter = exporter;
        this.tracker = tracker;
        this.batchSize = batchSize;
        this.syncer = syncer;
        this.limiter = limiter;
    }

    /**
     * Runs or resumes {@code job}. Window-level failures end the run with {@link JobStatus#FAILED} and a
     * resumable checkpoint.
     *
     * @throws SearchException if the remote rejects the job outright (credentials, missing or private subreddit)
     */
    public ExtractionResult run(ExtractionJob job) throws SearchException, IOException, InterruptedException {
        List<TimeWindow> windows = TimeWindowGenerator.generate(job);
        JobState state = tracker.load(job);
        flushedBatches = 0;
        recordsAdded = 0;

        if (state.status() == JobStatus.FINISHED) {
            LOGGER.info("Job {} for r/{} already finished; nothing to do.", job.key(), job.subreddit());
            return result(JobStatus.FINISHED, windows.size(), windows.size(), 0, null, "already finished");
        }

        tracker.reconcileTotal(exporter.count(job::covers));
        Set<String> knownIds = new HashSet<>(exporter.existingIds());
        tracker.markRunning();

        LOGGER.info("Extracting {} {} windows for r/{} (query '{}', job {})",
                windows.size(), job.granularity().label(), job.subreddit(), job.query(), job.key());
        LOGGER.info("Date range: {} to {}", job.start(), job.end());

        int skipped = 0;
        int completed = 0;
        for (TimeWindow window : windows) {
            int index = window.index();
            if (tracker.windowStatus(index) == WindowStatus.COMPLETE) {
                skipped++;
                continue;
            }
            Cursor resume = tracker.savedCursor(index);
            tracker.markWindowStarted(index, resume);
            if (resume == null) {
                LOGGER.info("Window {}/{}: {} to {}", index + 1, windows.size(), window.start(), window.end());
            } else {
                LOGGER.info("Window {}/{}: {} to {}, resuming at {} (post {})",
                        index + 1, windows.size(), window.start(), window.end(), resume.timestamp(), resume.id());
            }

            boolean exhausted;
            try {
                exhausted = extractWindow(job, window, resume, knownIds);
            } catch (WindowFetchException ex) {
                String message = "Window " + (index + 1) + " (" + window.start() + " to " + window.end()
                        + ") failed; rerun to resume it: " + ex.getMessage();
                LOGGER.error(message, ex);
                tracker.markFailed(index, message);
                return result(JobStatus.FAILED, windows.size(), skipped, completed, index, message);
            } catch (SearchException ex) {
                LOGGER.error("Remote rejected the extraction of r/{}: {}", job.subreddit(), ex.getMessage());
                tracker.markFailed(index, ex.getMessage());
                throw ex;
            }
            if (!exhausted) {
                LOGGER.info("Run paused after {} batches; window {} stays in progress.", flushedBatches, index + 1);
                return result(JobStatus.RUNNING, windows.size(), skipped, completed, null, "paused");
            }
            tracker.markWindowComplete(index);
            completed++;
        }

        tracker.markFinished();
        LOGGER.info("Extraction complete! Added {} posts this run, {} in total, output at {}",
                recordsAdded, tracker.state().totalExported(), exporter.path());
        return result(JobStatus.FINISHED, windows.size(), skipped, completed, null, "finished");
    }

    /**
     * @return true when the window was enumerated to its end, false when the limiter stopped the run
     */
    private boolean extractWindow(ExtractionJob job, TimeWindow window, Cursor resume, Set<String> knownIds)
            throws WindowFetchException, SearchException, IOException, InterruptedException {
        WindowEnumeration enumeration = client.enumerateWindow(job.subreddit(), job.query(), window, resume);
        List<RedditPost> buffer = new ArrayList<>(batchSize);
        long windowAdded = recordsAdded;
        try {
            while (enumeration.hasNext()) {
                SearchItem item = enumeration.next();
                if (!knownIds.add(item.id())) {
                    continue;
                }
                RedditPost post = mapper.map(item);
                if (post == null) {
                    continue;
                }
                buffer.add(post);
                if (buffer.size() >= batchSize) {
                    flush(window, buffer, enumeration.cursor());
                    if (limiter.shouldStop(flushedBatches)) {
                        return false;
                    }
                }
            }
        } catch (WindowFetchException | SearchException ex) {
            try {
                flush(window, buffer, enumeration.cursor());
            } catch (IOException io) {
                ex.addSuppressed(io);
            }
            throw ex;
        }
        flush(window, buffer, enumeration.cursor());
        LOGGER.info("  Extracted {} posts from this window ({} checked in {} calls{})",
                recordsAdded - windowAdded, enumeration.itemsChecked(), enumeration.calls(),
                enumeration.capReached() ? ", safety limit reached" : "");
        return true;
    }

    private void flush(TimeWindow window, List<RedditPost> buffer, Cursor cursor) throws IOException {
        if (!buffer.isEmpty()) {
            int added = exporter.append(buffer);
            tracker.recordCount(added);
            recordsAdded += added;
            flushedBatches++;
            buffer.clear();
        }
        if (cursor != null) {
            tracker.advanceCursor(window.index(), cursor);
        }
        syncer.enqueueAll(exporter.path(), tracker.path());
    }

    private ExtractionResult result(JobStatus status, int total, int skipped, int completed, Integer failedWindow, String message) {
        return new ExtractionResult(status, total, skipped, completed, recordsAdded,
                tracker.state().totalExported(), failedWindow, message);
    }
}
