package com.example.redditextractor;

import com.example.redditextractor.model.Cursor;
import com.example.redditextractor.model.SearchItem;
import com.example.redditextractor.model.TimeWindow;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Wraps {@link SubredditSearch} with rate limiting and retries, and enumerates a window past the page cap
 * by chaining calls with a shrinking upper bound.
 */
public final class RemoteSearchClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteSearchClient.class);
    public static final int DEFAULT_MAX_ITEMS_PER_WINDOW = 10_000;

    private final SubredditSearch search;
    private final RateLimitHandler rateLimiter;
    private final int pageCap;
    private final int maxItemsPerWindow;
    private final Retry retry;

    public RemoteSearchClient(SubredditSearch search, RateLimitHandler rateLimiter, int maxItemsPerWindow) {
        this(search, rateLimiter, SubredditSearch.PAGE_CAP, maxItemsPerWindow);
    }

    RemoteSearchClient(SubredditSearch search, RateLimitHandler rateLimiter, int pageCap, int maxItemsPerWindow) {
        if (pageCap <= 0 || maxItemsPerWindow <= 0) {
            throw new IllegalArgumentException("pageCap and maxItemsPerWindow must be positive");
        }
        this.search = search;
        this.rateLimiter = rateLimiter;
        this.pageCap = pageCap;
        this.maxItemsPerWindow = maxItemsPerWindow;
        this.retry = Retry.of("reddit-search", RetryConfig.<Object>custom()
                .maxAttempts(rateLimiter.maxRetries() + 1)
                .intervalBiFunction((attempts, outcome) -> rateLimiter.retryDelay(attempts - 1, retryAfter(outcome)).toMillis())
                .retryOnException(RemoteSearchClient::isRetryable)
                .build());
        this.retry.getEventPublisher().onRetry(event -> LOGGER.warn("Attempt {} failed: {}. Retrying in {} ms...",
                event.getNumberOfRetryAttempts(), messageOf(event.getLastThrowable()), event.getWaitInterval().toMillis()));
    }

    /**
     * Starts a lazy enumeration of {@code window}, newest first. With a {@code resumeCursor} the first call
     * is bounded by the cursor instead of the window's newest edge.
     */
    public WindowEnumeration enumerateWindow(String subreddit, String query, TimeWindow window, Cursor resumeCursor) {
        return new WindowEnumeration(this, subreddit, query, window, resumeCursor, pageCap, maxItemsPerWindow);
    }

    /**
     * A call chain ends when a page is empty or not full, or once it reaches items older than the window.
     */
    public static boolean chainExhausted(int pageSize, int pageCap, Instant oldest, Instant windowStart) {
        return pageSize == 0 || pageSize < pageCap || oldest.isBefore(windowStart);
    }

    /**
     * Upper bound for the next call. The bound is inclusive, so posts sharing the oldest second are seen twice
     * and dropped by id; a full page that does not move the bound steps one second back.
     */
    static Instant nextBound(Instant currentBound, Instant oldest) {
        if (oldest.isBefore(currentBound)) {
            return oldest;
        }
        return currentBound.minusSeconds(1);
    }

    List<SearchItem> fetchPage(String subreddit, String query, Instant before) throws SearchException, InterruptedException {
        return withRetries("search r/" + subreddit + " before " + before,
                () -> search.search(subreddit, query, before));
    }

    public String fetchComments(SearchItem item) throws SearchException, InterruptedException {
        return withRetries("comments of " + item.id(), () -> search.fetchComments(item));
    }

    public Optional<Instant> subredditCreated(String subreddit) throws SearchException, InterruptedException {
        return withRetries("about r/" + subreddit, () -> search.subredditCreated(subreddit));
    }

    /**
     * Retries rate-limited and transient failures with backoff; everything else, and the last retryable failure
     * once the budget is spent, is rethrown.
     */
    private <T> T withRetries(String description, RemoteCall<T> call) throws SearchException, InterruptedException {
        try {
            return retry.executeCallable(() -> {
                rateLimiter.beforeCall();
                return call.execute();
            });
        } catch (SearchException ex) {
            if (ex.isRetryable()) {
                LOGGER.error("Giving up on {} after {} attempts: {}", description, rateLimiter.maxRetries() + 1, ex.getMessage());
            }
            throw ex;
        } catch (InterruptedException | RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("Unexpected failure during " + description, ex);
        }
    }

    Retry retry() {
        return retry;
    }

    private static boolean isRetryable(Throwable failure) {
        return failure instanceof SearchException && ((SearchException) failure).isRetryable();
    }

    private static Duration retryAfter(Either<Throwable, Object> outcome) {
        if (outcome.isLeft() && outcome.getLeft() instanceof SearchException) {
            return ((SearchException) outcome.getLeft()).retryAfter();
        }
        return null;
    }

    private static String messageOf(Throwable failure) {
        return failure == null ? "unknown error" : failure.getMessage();
    }

    @FunctionalInterface
    private interface RemoteCall<T> {
        T execute() throws SearchException, InterruptedException;
    }
}
