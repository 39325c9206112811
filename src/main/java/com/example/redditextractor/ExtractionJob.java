package com.example.redditextractor;

import com.example.redditextractor.model.RedditPost;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Locale;

/**
 * Identity of one logical crawl. Re-running with the same parameters resolves to the same {@link #key()}.
 */
public record ExtractionJob(
        String subreddit,
        String query,
        Instant start,
        Instant end,
        WindowGranularity granularity
) {
    public ExtractionJob {
        if (subreddit == null || subreddit.isBlank()) {
            throw new IllegalArgumentException("subreddit is required");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("start " + start + " must be before end " + end);
        }
        subreddit = normalizeSubreddit(subreddit);
        query = normalizeQuery(query);
    }

    /**
     * Subreddit name without surrounding blanks or an {@code r/} prefix.
     */
    public static String normalizeSubreddit(String name) {
        String trimmed = name.trim();
        if (trimmed.startsWith("/r/")) {
            return trimmed.substring(3);
        }
        if (trimmed.startsWith("r/")) {
            return trimmed.substring(2);
        }
        return trimmed;
    }

    public static String normalizeQuery(String query) {
        return query == null || query.isBlank() ? "*" : query.trim();
    }

    /**
     * True if {@code post} belongs to this job: posted in {@code [start, end)} in this subreddit.
     */
    public boolean covers(RedditPost post) {
        if (post.date() == null || post.date().isBefore(start) || !post.date().isBefore(end)) {
            return false;
        }
        String postSubreddit = RedditPost.subredditFromUrl(post.url());
        return postSubreddit == null || postSubreddit.equalsIgnoreCase(subreddit);
    }

    public String key() {
        String identity = String.join("|",
                subreddit.toLowerCase(Locale.ROOT),
                query,
                start.toString(),
                end.toString(),
                granularity.label());
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = digest.digest(identity.getBytes(StandardCharsets.UTF_8));
        StringBuilder builder = new StringBuilder(16);
        for (int i = 0; i < 8; i++) {
            builder.append(String.format("%02x", hash[i]));
        }
        return builder.toString();
    }
}
