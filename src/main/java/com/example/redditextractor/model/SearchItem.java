package com.example.redditextractor.model;

import java.time.Instant;

/**
 * A submission as returned by the remote search, before its comments are fetched.
 * {@code author} is null when the account was deleted.
 */
public record SearchItem(
        String id,
        String permalink,
        String title,
        String selftext,
        String author,
        long score,
        long numComments,
        Instant created
) {
}
