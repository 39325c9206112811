package com.example.redditextractor;

import com.example.redditextractor.reddit.RedditSearchApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final LocalDate REDDIT_LAUNCH = LocalDate.of(2005, 6, 23);
    private static final String RESET_FLAG = "--reset";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_WINDOW_FAILED = 2;
    static final int EXIT_REJECTED = 3;

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // CLI contract: a JSON config file path, optionally followed by --reset.
        if (args.length < 1 || (args.length > 1 && !RESET_FLAG.equals(args[1]))) {
            LOGGER.error("Usage: java -jar reddit-extractor.jar <config.json> [{}]", RESET_FLAG);
            System.exit(EXIT_USAGE);
        }
        ExtractorConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
        } catch (IllegalArgumentException | IOException ex) {
            LOGGER.error("Invalid configuration {}: {}", args[0], ex.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }
        System.exit(run(config, args.length > 1));
    }

    static int run(ExtractorConfig config, boolean reset) throws IOException, InterruptedException {
        LOGGER.info("Subreddit: r/{}, query: {}, output: {}, window size: {}",
                config.subreddit(), config.query(), config.output(), config.windowSize().label());
        RateLimitHandler rateLimiter = new RateLimitHandler(
                config.baseDelay(), config.maxDelay(), config.politenessInterval(), config.maxRetries(), Sleeper.SYSTEM);
        RedditSearchApi api = new RedditSearchApi(config.credentials(), config.commentDepth(), Sleeper.SYSTEM);
        RemoteSearchClient client = new RemoteSearchClient(api, rateLimiter, config.maxItemsPerWindow());

        ExtractionJob job;
        try {
            job = resolveJob(config, client, LocalDate.now(ZoneOffset.UTC));
        } catch (SearchException ex) {
            LOGGER.error("Extraction aborted: {}", ex.getMessage());
            return EXIT_REJECTED;
        }

        ProgressTracker tracker = new ProgressTracker(
                new CheckpointManager(ProgressTracker.checkpointFileFor(config.checkpointDirectory(), job)));
        if (reset) {
            tracker.reset();
        }
        IncrementalExporter exporter = IncrementalExporter.open(config.output());
        ProcessingLimiter limiter = config.maxBatches()
                .map(max -> (ProcessingLimiter) flushed -> flushed >= max)
                .orElse(ProcessingLimiter.NO_LIMIT);

        try (ArtifactSyncer syncer = syncerFor(config, job)) {
            Extractor extractor = new Extractor(client, exporter, tracker, config.batchSize(), syncer, limiter);
            ExtractionResult result = extractor.run(job);
            LOGGER.info("Status {}: {} of {} windows done this run ({} already complete), {} posts added, {} total",
                    result.status(), result.windowsCompleted(), result.windowsTotal(), result.windowsSkipped(),
                    result.recordsAdded(), result.totalExported());
            return result.failed() ? EXIT_WINDOW_FAILED : EXIT_OK;
        } catch (SearchException ex) {
            LOGGER.error("Extraction aborted: {}", ex.getMessage());
            return EXIT_REJECTED;
        }
    }

    /**
     * The S3 mirror is opt-in; without it no background thread is started.
     */
    static ArtifactSyncer syncerFor(ExtractorConfig config, ExtractionJob job) {
        if (!config.s3SyncEnabled()) {
            return ArtifactSyncer.noop();
        }
        LOGGER.info("Mirroring export and checkpoint to s3://{}/{}", config.s3Bucket().orElseThrow(), config.s3Prefix().orElse(""));
        return new S3SyncService(config.s3Bucket().orElseThrow(), config.s3Prefix().orElse(""), config.s3Region(), job.key());
    }

    /**
     * Builds the job from the configured range. Without a start date the subreddit's creation day is used
     * (or ten years before the end date when {@code fromBeginning} is off).
     * <p>
     * Without an end date the range ends today, unless an unfinished checkpoint for the same subreddit, query
     * and window size exists; its range is reused so a paused job resumes under the same key on a later day.
     */
    static ExtractionJob resolveJob(ExtractorConfig config, RemoteSearchClient client, LocalDate today)
            throws SearchException, InterruptedException, IOException {
        if (config.endDate().isEmpty()) {
            Instant configuredStart = config.startDate()
                    .map(day -> day.atStartOfDay(ZoneOffset.UTC).toInstant())
                    .orElse(null);
            Optional<JobState> unfinished = ProgressTracker.findUnfinished(
                    config.checkpointDirectory(),
                    ExtractionJob.normalizeSubreddit(config.subreddit()),
                    ExtractionJob.normalizeQuery(config.query()),
                    config.windowSize(),
                    configuredStart);
            if (unfinished.isPresent()) {
                JobState state = unfinished.get();
                LOGGER.info("Continuing unfinished job {} over [{}, {})", state.jobKey(), state.start(), state.end());
                return new ExtractionJob(config.subreddit(), config.query(), state.start(), state.end(), config.windowSize());
            }
        }
        LocalDate end = config.endDate().orElse(today);
        LocalDate start = config.startDate().orElse(null);
        if (start == null && config.fromBeginning()) {
            start = creationDay(config.subreddit(), client);
        } else if (start == null) {
            start = end.minusYears(10);
        }
        return new ExtractionJob(
                config.subreddit(),
                config.query(),
                start.atStartOfDay(ZoneOffset.UTC).toInstant(),
                end.atStartOfDay(ZoneOffset.UTC).toInstant(),
                config.windowSize());
    }

    private static LocalDate creationDay(String subreddit, RemoteSearchClient client)
            throws SearchException, InterruptedException {
        Optional<Instant> created;
        try {
            created = client.subredditCreated(subreddit);
        } catch (SearchException ex) {
            if (ex.kind() == SearchException.Kind.NON_RETRYABLE) {
                throw ex;
            }
            LOGGER.error("Could not get subreddit creation date: {}", ex.getMessage());
            created = Optional.empty();
        }
        LocalDate day = created.map(instant -> instant.atZone(ZoneOffset.UTC).toLocalDate()).orElse(REDDIT_LAUNCH);
        LOGGER.info("r/{} history starts on {}", subreddit, day);
        return day;
    }
}
