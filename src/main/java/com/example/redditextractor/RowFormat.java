package com.example.redditextractor;

import com.example.redditextractor.model.RedditPost;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Tabular file format of the export store. Implementations write the complete content in one pass.
 */
public interface RowFormat {
    List<String> HEADERS = List.of(
            "url", "title", "date", "user", "n_votes", "n_comments", "text_op", "text_comments");

    List<RedditPost> read(Path path) throws IOException;

    void write(List<RedditPost> posts, Path path) throws IOException;

    String extension();

    /**
     * Picks the format from the file extension ({@code .xlsx} or {@code .csv}).
     */
    static RowFormat forPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return new CsvRowFormat();
        }
        if (name.endsWith(".xlsx")) {
            return new XlsxRowFormat();
        }
        throw new IllegalArgumentException("Unsupported output format (use .xlsx or .csv): " + path);
    }
}
