package com.example.redditextractor;

import java.time.Duration;

/**
 * Failure signalled by the remote search. {@link Kind} decides whether the call is retried.
 */
public class SearchException extends Exception {

    public enum Kind {
        /** Throttled; retry the same call after backing off. */
        RATE_LIMITED,
        /** Network blip or server error; retry a bounded number of times. */
        TRANSIENT,
        /** Response did not have the expected shape. */
        MALFORMED,
        /** Bad credentials, private or missing subreddit. */
        NON_RETRYABLE
    }

    private final Kind kind;
    private final Duration retryAfter;

    public SearchException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public SearchException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public SearchException(Kind kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public static SearchException rateLimited(String message, Duration retryAfter) {
        return new SearchException(Kind.RATE_LIMITED, message, retryAfter, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Server hint for how long to wait, or null.
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    public boolean isRetryable() {
        return kind == Kind.RATE_LIMITED || kind == Kind.TRANSIENT;
    }
}
