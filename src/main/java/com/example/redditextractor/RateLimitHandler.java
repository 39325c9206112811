package com.example.redditextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Politeness delay before remote calls, and the retry policy applied after throttling or transient failures.
 * Retry delays are pure functions of the attempt number; only the politeness counter is stateful.
 */
public final class RateLimitHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(RateLimitHandler.class);
    private static final Duration MIN_DELAY = Duration.ofMillis(1);

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int politenessInterval;
    private final int maxRetries;
    private final Sleeper sleeper;
    private long requestCount;

    /**
     * @param politenessInterval sleep the base delay on every Nth call; 0 disables the politeness delay
     * @param maxRetries         retries allowed per call before a retryable failure escalates
     */
    public RateLimitHandler(Duration baseDelay, Duration maxDelay, int politenessInterval, int maxRetries, Sleeper sleeper) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be smaller than baseDelay");
        }
        if (politenessInterval < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("politenessInterval and maxRetries must not be negative");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.politenessInterval = politenessInterval;
        this.maxRetries = maxRetries;
        this.sleeper = sleeper;
    }

    public void beforeCall() throws InterruptedException {
        requestCount++;
        if (politenessInterval > 0 && requestCount % politenessInterval == 0) {
            LOGGER.debug("Politeness delay of {} ms before request {}", baseDelay.toMillis(), requestCount);
            sleeper.sleep(baseDelay);
        }
    }

    /**
     * {@code min(baseDelay * 2^attempt, maxDelay)}, never zero or negative.
     */
    public Duration backoffDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        Duration delay = maxDelay;
        // 2^62 ms already exceeds any sane maxDelay
        if (attempt < 62) {
            long factor = 1L << attempt;
            long baseMillis = baseDelay.toMillis();
            if (baseMillis <= Long.MAX_VALUE / factor) {
                Duration candidate = Duration.ofMillis(baseMillis * factor);
                if (candidate.compareTo(maxDelay) < 0) {
                    delay = candidate;
                }
            }
        }
        return delay.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : delay;
    }

    /**
     * Wait before retry number {@code attempt + 1}: the backoff, or a longer retry-after hint from the server,
     * never more than {@code maxDelay}.
     */
    public Duration retryDelay(int attempt, Duration retryAfter) {
        Duration delay = backoffDelay(attempt);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter.compareTo(maxDelay) > 0 ? maxDelay : retryAfter;
        }
        return delay;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public long requestCount() {
        return requestCount;
    }

    public Duration maxDelay() {
        return maxDelay;
    }
}
