package com.example.redditextractor;

import com.example.redditextractor.model.RedditPost;
import com.example.redditextractor.model.SearchItem;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.redditextractor.FakeSubredditSearch.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractorTest {
    private static final ExtractionJob JOB = new ExtractionJob("test", "*",
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z"), WindowGranularity.MONTHLY);

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final List<Path> synced = new ArrayList<>();

    private static List<SearchItem> corpus() {
        List<SearchItem> items = new ArrayList<>();
        items.add(item("d0", Instant.parse("2023-12-31T22:00:00Z")));
        items.add(item("d1", Instant.parse("2023-12-15T00:00:00Z")));
        for (int i = 0; i < 12; i++) {
            items.add(item("j" + i, Instant.parse("2024-01-20T12:00:00Z").minus(Duration.ofHours(i))));
        }
        items.add(item("f0", Instant.parse("2024-02-10T00:00:00Z")));
        items.add(item("f1", Instant.parse("2024-02-05T00:00:00Z")));
        items.add(item("f2", Instant.parse("2024-02-01T00:00:00Z")));
        for (int i = 0; i < 7; i++) {
            // m2 and m3 share a second
            int hours = i <= 2 ? i : i - 1;
            items.add(item("m" + i, Instant.parse("2024-03-30T12:00:00Z").minus(Duration.ofHours(hours))));
        }
        items.add(item("a0", Instant.parse("2024-04-01T00:00:00Z")));
        items.add(item("a1", Instant.parse("2024-04-15T00:00:00Z")));
        return items;
    }

    private static Set<String> expectedIds() {
        return corpus().stream()
                .map(SearchItem::id)
                .filter(id -> id.startsWith("j") || id.startsWith("f") || id.startsWith("m"))
                .collect(Collectors.toSet());
    }

    private ExtractionResult runOnce(Path dir, FakeSubredditSearch search, ProcessingLimiter limiter) throws Exception {
        RateLimitHandler handler = new RateLimitHandler(Duration.ofMillis(10), Duration.ofMillis(100), 0, 1, sleeper);
        RemoteSearchClient client = new RemoteSearchClient(search, handler, 5, 1000);
        IncrementalExporter exporter = IncrementalExporter.open(output(dir));
        ProgressTracker tracker = new ProgressTracker(new CheckpointManager(checkpoint(dir)));
        return new Extractor(client, exporter, tracker, 3, synced::add, limiter).run(JOB);
    }

    private static Path output(Path dir) {
        return dir.resolve("posts.csv");
    }

    private static Path checkpoint(Path dir) {
        return ProgressTracker.checkpointFileFor(dir.resolve(".progress"), JOB);
    }

    private static JobState savedState(Path dir) throws Exception {
        return new CheckpointManager(checkpoint(dir)).load().orElseThrow();
    }

    private static List<String> storedRowIds(Path dir) throws Exception {
        return new CsvRowFormat().read(output(dir)).stream().map(RedditPost::id).toList();
    }

    private static void assertCompleteExport(Path dir) throws Exception {
        List<String> rows = storedRowIds(dir);
        assertEquals(expectedIds(), new HashSet<>(rows));
        assertEquals(rows.size(), new HashSet<>(rows).size(), "duplicate rows in export");
        JobState state = savedState(dir);
        assertEquals(JobStatus.FINISHED, state.status());
        assertEquals(Set.of(0, 1, 2), state.completedWindows());
        assertEquals(rows.size(), state.totalExported());
    }

    @Test
    void exportsEveryPostInRangeExactlyOnce() throws Exception {
        Path dir = Files.createTempDirectory("extractor");

        ExtractionResult result = runOnce(dir, new FakeSubredditSearch(5, corpus()), ProcessingLimiter.NO_LIMIT);

        assertTrue(result.finished());
        assertEquals(3, result.windowsTotal());
        assertEquals(3, result.windowsCompleted());
        assertEquals(22, result.recordsAdded());
        assertEquals(22, result.totalExported());
        assertCompleteExport(dir);
        assertTrue(synced.contains(output(dir).toAbsolutePath()));
        assertTrue(synced.contains(checkpoint(dir)));
    }

    @Test
    void resumingAfterAnyPauseMatchesAnUninterruptedRun() throws Exception {
        for (int pauseAfter = 1; pauseAfter <= 8; pauseAfter++) {
            Path dir = Files.createTempDirectory("extractor-pause");
            FakeSubredditSearch search = new FakeSubredditSearch(5, corpus());
            long limit = pauseAfter;

            ExtractionResult first = runOnce(dir, search, flushed -> flushed >= limit);
            if (!first.finished()) {
                assertEquals(JobStatus.RUNNING, first.status());
                assertEquals(first.totalExported(), storedRowIds(dir).size());
            }
            ExtractionResult second = runOnce(dir, search, ProcessingLimiter.NO_LIMIT);

            assertTrue(second.finished(), "pause after " + pauseAfter);
            assertCompleteExport(dir);
        }
    }

    @Test
    void repeatedPausesEventuallyFinish() throws Exception {
        Path dir = Files.createTempDirectory("extractor-repeat");
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus());

        ExtractionResult result = null;
        for (int run = 0; run < 30; run++) {
            result = runOnce(dir, search, flushed -> flushed >= 1);
            if (result.finished()) {
                break;
            }
        }

        assertTrue(result.finished());
        assertCompleteExport(dir);
    }

    @Test
    void resumesInsideTheWindowFromTheSavedCursor() throws Exception {
        Path dir = Files.createTempDirectory("extractor-cursor");
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus());

        runOnce(dir, search, flushed -> flushed >= 1);
        JobState paused = savedState(dir);
        assertEquals(Integer.valueOf(0), paused.currentWindow());
        assertEquals("j2", paused.cursor().id());
        assertEquals(3, paused.totalExported());

        search.searchBounds.clear();
        runOnce(dir, search, ProcessingLimiter.NO_LIMIT);

        assertEquals(paused.cursor().timestamp(), search.searchBounds.get(0));
        assertCompleteExport(dir);
    }

    @Test
    void lostCheckpointUpdateIsRepairedOnResume() throws Exception {
        Path dir = Files.createTempDirectory("extractor-stale");
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus());

        runOnce(dir, search, flushed -> flushed >= 1);
        byte[] staleCheckpoint = Files.readAllBytes(checkpoint(dir));
        runOnce(dir, search, flushed -> flushed >= 1);
        // The export kept the second batch but the checkpoint is from before it.
        Files.write(checkpoint(dir), staleCheckpoint);
        assertEquals(6, storedRowIds(dir).size());

        ExtractionResult result = runOnce(dir, search, ProcessingLimiter.NO_LIMIT);

        assertTrue(result.finished());
        assertEquals(16, result.recordsAdded());
        assertCompleteExport(dir);
    }

    @Test
    void rejectedJobLeavesNothingExported() throws Exception {
        Path dir = Files.createTempDirectory("extractor-rejected");
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus())
                .failNext(new SearchException(SearchException.Kind.NON_RETRYABLE, "HTTP 403 access denied"));

        SearchException ex = assertThrows(SearchException.class, () -> runOnce(dir, search, ProcessingLimiter.NO_LIMIT));

        assertEquals(SearchException.Kind.NON_RETRYABLE, ex.kind());
        JobState state = savedState(dir);
        assertEquals(JobStatus.FAILED, state.status());
        assertTrue(state.completedWindows().isEmpty());
        assertEquals(0, state.totalExported());
        assertFalse(Files.exists(output(dir)));
    }

    @Test
    void failedWindowIsResumedOnTheNextRun() throws Exception {
        Path dir = Files.createTempDirectory("extractor-failed");
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus())
                .failAfter(1, new SearchException(SearchException.Kind.TRANSIENT, "HTTP 502"));

        ExtractionResult failed = runOnce(dir, search, ProcessingLimiter.NO_LIMIT);

        assertTrue(failed.failed());
        assertEquals(Integer.valueOf(0), failed.failedWindow());
        JobState state = savedState(dir);
        assertEquals(JobStatus.FAILED, state.status());
        assertEquals(Integer.valueOf(0), state.failedWindow());
        assertEquals("j4", state.cursor().id());
        assertEquals(5, state.totalExported());

        search.heal();
        ExtractionResult resumed = runOnce(dir, search, ProcessingLimiter.NO_LIMIT);

        assertTrue(resumed.finished());
        assertCompleteExport(dir);
        assertNull(savedState(dir).failedWindow());
    }

    @Test
    void finishedJobMakesNoRemoteCalls() throws Exception {
        Path dir = Files.createTempDirectory("extractor-finished");
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus());
        runOnce(dir, search, ProcessingLimiter.NO_LIMIT);
        search.searchBounds.clear();

        ExtractionResult again = runOnce(dir, search, ProcessingLimiter.NO_LIMIT);

        assertTrue(again.finished());
        assertEquals(0, again.recordsAdded());
        assertEquals(3, again.windowsSkipped());
        assertTrue(search.searchBounds.isEmpty());
    }

    @Test
    void postIsKeptWhenItsCommentsCannotBeFetched() throws Exception {
        Path dir = Files.createTempDirectory("extractor-comments");
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus()).failCommentsOf("j5");

        runOnce(dir, search, ProcessingLimiter.NO_LIMIT);

        List<RedditPost> rows = new CsvRowFormat().read(output(dir));
        RedditPost broken = rows.stream().filter(post -> post.id().equals("j5")).findFirst().orElseThrow();
        RedditPost healthy = rows.stream().filter(post -> post.id().equals("j6")).findFirst().orElseThrow();
        assertEquals("", broken.textComments());
        assertEquals("commenter\ncomment on j6", healthy.textComments());
        assertEquals(22, rows.size());
    }

    @Test
    void sharedOutputCountsOnlyThisJobsRows() throws Exception {
        Path dir = Files.createTempDirectory("extractor-shared");
        RedditPost otherSubreddit = new RedditPost("x1", RedditPost.REDDIT_BASE + "/r/other/comments/x1/post_x1/",
                "Other", Instant.parse("2024-02-02T00:00:00Z"), "someone", 1, 0, "", "");
        RedditPost beforeRange = new RedditPost("o1", RedditPost.REDDIT_BASE + "/r/test/comments/o1/post_o1/",
                "Old", Instant.parse("2023-06-01T00:00:00Z"), "someone", 1, 0, "", "");
        new CsvRowFormat().write(List.of(otherSubreddit, beforeRange), output(dir));

        ExtractionResult result = runOnce(dir, new FakeSubredditSearch(5, corpus()), ProcessingLimiter.NO_LIMIT);

        assertTrue(result.finished());
        assertEquals(22, result.recordsAdded());
        assertEquals(22, result.totalExported());
        assertEquals(22, savedState(dir).totalExported());
        assertEquals(24, storedRowIds(dir).size());
    }
}
