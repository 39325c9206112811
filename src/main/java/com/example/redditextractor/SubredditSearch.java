package com.example.redditextractor;

import com.example.redditextractor.model.SearchItem;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Remote search capability. Results come newest first and are capped at {@link #PAGE_CAP} per call.
 */
public interface SubredditSearch {
    int PAGE_CAP = 1000;

    /**
     * Returns up to {@link #PAGE_CAP} submissions created at or before {@code before} (no bound when null).
     */
    List<SearchItem> search(String subreddit, String query, Instant before) throws SearchException, InterruptedException;

    /**
     * Returns the flattened comment text of a submission.
     */
    String fetchComments(SearchItem item) throws SearchException, InterruptedException;

    Optional<Instant> subredditCreated(String subreddit) throws SearchException, InterruptedException;
}
