package com.example.redditextractor;

import com.example.redditextractor.model.RedditPost;
import com.example.redditextractor.model.SearchItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns search results into export rows, fetching each post's comments on the way.
 */
public final class PostMapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(PostMapper.class);

    private final RemoteSearchClient client;

    public PostMapper(RemoteSearchClient client) {
        this.client = client;
    }

    /**
     * Returns the mapped post, or null when the item cannot be exported. A failed comment fetch leaves the
     * comment text empty instead of dropping the post.
     */
    public RedditPost map(SearchItem item) throws InterruptedException {
        if (item.id() == null || item.id().isBlank() || item.permalink() == null || item.created() == null) {
            LOGGER.warn("Skipping search result without id, permalink or creation time: {}", item);
            return null;
        }
        String comments = "";
        if (item.numComments() > 0) {
            try {
                comments = client.fetchComments(item);
            } catch (SearchException ex) {
                LOGGER.warn("Could not fetch comments of post {} ({}): {}", item.id(), ex.kind(), ex.getMessage());
            }
        }
        return new RedditPost(
                item.id(),
                RedditPost.urlFor(item.permalink()),
                item.title() == null ? "" : item.title(),
                item.created(),
                item.author() == null || item.author().isBlank() ? RedditPost.DELETED_AUTHOR : item.author(),
                item.score(),
                item.numComments(),
                item.selftext() == null ? "" : item.selftext(),
                comments
        );
    }
}
