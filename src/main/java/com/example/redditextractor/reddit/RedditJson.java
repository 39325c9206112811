package com.example.redditextractor.reddit;

import com.example.redditextractor.SearchException;
import com.example.redditextractor.model.SearchItem;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsing of Reddit's listing, thread and about payloads.
 */
final class RedditJson {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedditJson.class);
    private static final String LINK_KIND = "t3";
    private static final String COMMENT_KIND = "t1";

    /**
     * @param skipped link entries dropped because they lacked an id or creation time
     */
    record Listing(List<SearchItem> items, String after, int skipped) {
    }

    private RedditJson() {
    }

    /**
     * Reads a listing ({@code data.children[].data}); only link entries are returned. A malformed entry is
     * logged and skipped, a listing without {@code data.children} is rejected.
     */
    static Listing parseListing(JsonNode root) throws SearchException {
        JsonNode data = root.path("data");
        JsonNode children = data.path("children");
        if (!children.isArray()) {
            throw new SearchException(SearchException.Kind.MALFORMED, "Listing without data.children");
        }
        List<SearchItem> items = new ArrayList<>();
        int skipped = 0;
        for (JsonNode child : children) {
            if (!LINK_KIND.equals(child.path("kind").asText())) {
                continue;
            }
            try {
                items.add(parseLink(child.path("data")));
            } catch (SearchException ex) {
                LOGGER.warn("Skipping listing entry: {}", ex.getMessage());
                skipped++;
            }
        }
        JsonNode after = data.path("after");
        return new Listing(items, after.isTextual() && !after.asText().isEmpty() ? after.asText() : null, skipped);
    }

    static SearchItem parseLink(JsonNode data) throws SearchException {
        if (!data.hasNonNull("id") || !data.hasNonNull("created_utc")) {
            throw new SearchException(SearchException.Kind.MALFORMED, "Link without id or created_utc: " + data);
        }
        String author = data.path("author").asText(null);
        return new SearchItem(
                data.get("id").asText(),
                data.path("permalink").asText(null),
                data.path("title").asText(""),
                data.path("selftext").asText(""),
                author == null || author.isBlank() ? null : author,
                data.path("score").asLong(0),
                data.path("num_comments").asLong(0),
                Instant.ofEpochSecond((long) data.get("created_utc").asDouble())
        );
    }

    /**
     * Flattens the comment listing of a thread response ({@code [thread, comments]}) depth first.
     * Each comment becomes {@code author\nbody}; comments are separated by a blank line.
     */
    static String flattenComments(JsonNode root, int maxDepth) throws SearchException {
        if (!root.isArray() || root.size() < 2) {
            throw new SearchException(SearchException.Kind.MALFORMED, "Thread response is not a [thread, comments] array");
        }
        List<String> comments = new ArrayList<>();
        collectComments(root.get(1), 0, maxDepth, comments);
        return String.join("\n\n", comments);
    }

    private static void collectComments(JsonNode listing, int depth, int maxDepth, List<String> out) {
        if (depth > maxDepth || !listing.path("data").path("children").isArray()) {
            return;
        }
        for (JsonNode child : listing.path("data").path("children")) {
            // "more" stubs carry no body
            if (!COMMENT_KIND.equals(child.path("kind").asText())) {
                continue;
            }
            JsonNode data = child.path("data");
            String body = data.path("body").asText(null);
            if (body != null) {
                String author = data.path("author").asText("");
                out.add((author.isBlank() ? "[deleted]" : author) + "\n" + body);
            }
            JsonNode replies = data.path("replies");
            if (replies.isObject()) {
                collectComments(replies, depth + 1, maxDepth, out);
            }
        }
    }

    static Optional<Instant> parseCreated(JsonNode about) {
        JsonNode created = about.path("data").path("created_utc");
        if (!created.isNumber()) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochSecond((long) created.asDouble()));
    }

    static String parseAccessToken(JsonNode token) throws SearchException {
        JsonNode accessToken = token.path("access_token");
        if (!accessToken.isTextual()) {
            throw new SearchException(SearchException.Kind.NON_RETRYABLE,
                    "Token endpoint returned no access_token: " + token.path("error").asText("unknown error"));
        }
        return accessToken.asText();
    }
}
