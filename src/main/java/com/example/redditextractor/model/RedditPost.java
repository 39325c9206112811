package com.example.redditextractor.model;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One exported row. Identity is the Reddit submission id, which is also recoverable from {@code url}.
 */
public record RedditPost(
        String id,
        String url,
        String title,
        Instant date,
        String user,
        long votes,
        long comments,
        String textOp,
        String textComments
) {
    public static final String DELETED_AUTHOR = "[deleted]";
    public static final String REDDIT_BASE = "https://www.reddit.com";

    private static final Pattern ID_IN_URL = Pattern.compile("/comments/([A-Za-z0-9]+)");
    private static final Pattern SUBREDDIT_IN_URL = Pattern.compile("/r/([A-Za-z0-9_]+)/comments/");

    /**
     * Extracts the submission id from a permalink or full post url, or returns null if none is present.
     */
    public static String idFromUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = ID_IN_URL.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Subreddit named in a post url, or null for urls without one.
     */
    public static String subredditFromUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = SUBREDDIT_IN_URL.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }

    public static String urlFor(String permalink) {
        if (permalink.startsWith("http")) {
            return permalink;
        }
        return REDDIT_BASE + (permalink.startsWith("/") ? permalink : "/" + permalink);
    }
}
