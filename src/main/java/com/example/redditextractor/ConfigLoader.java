package com.example.redditextractor;

import com.example.redditextractor.reddit.RedditCredentials;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

public class ConfigLoader {
    private static final String DEFAULT_QUERY = "*";
    private static final String DEFAULT_OUTPUT = "reddit_data.xlsx";
    private static final double DEFAULT_BASE_DELAY_SECONDS = 2.0;
    private static final double DEFAULT_MAX_DELAY_SECONDS = 300.0;
    private static final int DEFAULT_POLITENESS_INTERVAL = 1;
    private static final int DEFAULT_MAX_RETRIES = 5;
    private static final int DEFAULT_BATCH_SIZE = 10;
    private static final int DEFAULT_COMMENT_DEPTH = 8;

    static final String ENV_CLIENT_ID = "REDDIT_CLIENT_ID";
    static final String ENV_CLIENT_SECRET = "REDDIT_CLIENT_SECRET";
    static final String ENV_USER_AGENT = "REDDIT_USER_AGENT";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    ConfigLoader(Map<String, String> environment) {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.environment = environment;
    }

    public ExtractorConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.subreddit == null || raw.subreddit.isBlank()) {
            throw new IllegalArgumentException("Config must include a subreddit.");
        }

        Optional<LocalDate> startDate = Optional.ofNullable(raw.startDate)
                .filter(value -> !value.isBlank())
                .map(value -> parseDate("startDate", value));
        Optional<LocalDate> endDate = Optional.ofNullable(raw.endDate)
                .filter(value -> !value.isBlank())
                .map(value -> parseDate("endDate", value));
        LocalDate effectiveEnd = endDate.orElseGet(() -> LocalDate.now(ZoneOffset.UTC));
        if (startDate.isPresent() && !startDate.get().isBefore(effectiveEnd)) {
            throw new IllegalArgumentException("startDate must be before endDate.");
        }
        boolean fromBeginning = raw.fromBeginning == null || raw.fromBeginning;

        Path output = Path.of(optionalString(raw.output, DEFAULT_OUTPUT));
        RowFormat.forPath(output);
        Path outputDirectory = output.toAbsolutePath().getParent();
        Path checkpointDirectory = Optional.ofNullable(raw.checkpointDirectory)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElse(outputDirectory.resolve(".progress"));

        double baseDelaySeconds = positiveOr(raw.baseDelaySeconds, DEFAULT_BASE_DELAY_SECONDS, "baseDelaySeconds");
        double maxDelaySeconds = positiveOr(raw.maxDelaySeconds, DEFAULT_MAX_DELAY_SECONDS, "maxDelaySeconds");
        if (maxDelaySeconds < baseDelaySeconds) {
            throw new IllegalArgumentException("maxDelaySeconds must not be smaller than baseDelaySeconds.");
        }
        int politenessInterval = raw.politenessInterval != null && raw.politenessInterval >= 0
                ? raw.politenessInterval
                : DEFAULT_POLITENESS_INTERVAL;
        int maxRetries = raw.maxRetries != null && raw.maxRetries >= 0
                ? raw.maxRetries
                : DEFAULT_MAX_RETRIES;
        int batchSize = raw.batchSize != null && raw.batchSize > 0
                ? raw.batchSize
                : DEFAULT_BATCH_SIZE;
        int maxItemsPerWindow = raw.maxItemsPerWindow != null && raw.maxItemsPerWindow > 0
                ? raw.maxItemsPerWindow
                : RemoteSearchClient.DEFAULT_MAX_ITEMS_PER_WINDOW;
        int commentDepth = raw.commentDepth != null && raw.commentDepth >= 0
                ? raw.commentDepth
                : DEFAULT_COMMENT_DEPTH;
        Optional<Integer> maxBatches = Optional.ofNullable(raw.maxBatches).filter(value -> value > 0);

        RedditCredentials credentials = new RedditCredentials(
                fromEnvironment(raw.clientId, ENV_CLIENT_ID),
                fromEnvironment(raw.clientSecret, ENV_CLIENT_SECRET),
                fromEnvironment(raw.userAgent, ENV_USER_AGENT));

        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3SyncEnabled is true.");
        }

        return new ExtractorConfig(
                raw.subreddit.trim(),
                optionalString(raw.query, DEFAULT_QUERY),
                startDate,
                endDate,
                fromBeginning,
                WindowGranularity.parse(raw.windowSize),
                output,
                checkpointDirectory,
                Duration.ofMillis((long) (baseDelaySeconds * 1000)),
                Duration.ofMillis((long) (maxDelaySeconds * 1000)),
                politenessInterval,
                maxRetries,
                batchSize,
                maxItemsPerWindow,
                commentDepth,
                maxBatches,
                credentials,
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private String fromEnvironment(String configured, String variable) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String value = environment.get(variable);
        return value == null || value.isBlank() ? null : value;
    }

    private static LocalDate parseDate(String key, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid " + key + " '" + value + "'. Use YYYY-MM-DD.", ex);
        }
    }

    private static double positiveOr(Double value, double fallback, String key) {
        if (value == null) {
            return fallback;
        }
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive.");
        }
        return value;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String subreddit;
        public String query;
        public String startDate;
        public String endDate;
        public Boolean fromBeginning;
        public String windowSize;
        public String output;
        public String checkpointDirectory;
        public Double baseDelaySeconds;
        public Double maxDelaySeconds;
        public Integer politenessInterval;
        public Integer maxRetries;
        public Integer batchSize;
        public Integer maxItemsPerWindow;
        public Integer commentDepth;
        public Integer maxBatches;
        public String clientId;
        public String clientSecret;
        public String userAgent;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
