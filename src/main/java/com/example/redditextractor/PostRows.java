package com.example.redditextractor;

import com.example.redditextractor.model.RedditPost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Column mapping shared by the row formats. Row identity comes from the url column.
 */
final class PostRows {
    private static final Logger LOGGER = LoggerFactory.getLogger(PostRows.class);

    private PostRows() {
    }

    static String[] toRow(RedditPost post) {
        return new String[]{
                post.url(),
                nullToEmpty(post.title()),
                post.date() == null ? "" : post.date().toString(),
                nullToEmpty(post.user()),
                Long.toString(post.votes()),
                Long.toString(post.comments()),
                nullToEmpty(post.textOp()),
                nullToEmpty(post.textComments())
        };
    }

    /**
     * Rebuilds a post from a stored row, or returns null if the row has no recognisable post url.
     */
    static RedditPost fromRow(String[] row) {
        if (row.length == 0) {
            return null;
        }
        String url = row[0];
        String id = RedditPost.idFromUrl(url);
        if (id == null) {
            LOGGER.warn("Ignoring stored row without a post url: {}", url);
            return null;
        }
        return new RedditPost(
                id,
                url,
                cell(row, 1),
                parseDate(cell(row, 2)),
                cell(row, 3),
                parseLong(cell(row, 4)),
                parseLong(cell(row, 5)),
                cell(row, 6),
                cell(row, 7)
        );
    }

    static boolean isHeader(String[] row) {
        return row.length > 0 && RowFormat.HEADERS.get(0).equals(row[0]);
    }

    private static String cell(String[] row, int index) {
        return index < row.length && row[index] != null ? row[index] : "";
    }

    private static Instant parseDate(String value) {
        if (value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            LOGGER.warn("Unparseable date '{}' in stored row", value);
            return null;
        }
    }

    private static long parseLong(String value) {
        if (value.isBlank()) {
            return 0L;
        }
        try {
            return (long) Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
