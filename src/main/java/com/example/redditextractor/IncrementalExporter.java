package com.example.redditextractor;

import com.example.redditextractor.model.RedditPost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Append-only export store keyed by post id. Each append rewrites the full content into a temp file next
 * to the target and then swaps it in, so an interrupted write never damages rows saved earlier.
 */
public final class IncrementalExporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(IncrementalExporter.class);

    private final Path outputPath;
    private final Path tempPath;
    private final RowFormat format;
    private final Map<String, RedditPost> rows = new LinkedHashMap<>();

    public IncrementalExporter(Path outputPath, RowFormat format) {
        this.outputPath = outputPath.toAbsolutePath();
        this.format = format;
        this.tempPath = tempPathFor(this.outputPath, format);
    }

    /**
     * Opens the store at {@code outputPath}, loading rows saved by earlier runs.
     */
    public static IncrementalExporter open(Path outputPath) throws IOException {
        IncrementalExporter exporter = new IncrementalExporter(outputPath, RowFormat.forPath(outputPath));
        exporter.load();
        return exporter;
    }

    void load() throws IOException {
        if (Files.deleteIfExists(tempPath)) {
            LOGGER.warn("Removed leftover temp file {} from an interrupted write", tempPath);
        }
        rows.clear();
        if (!Files.exists(outputPath)) {
            return;
        }
        LOGGER.info("Loading existing data from {}", outputPath);
        int duplicates = 0;
        for (RedditPost post : format.read(outputPath)) {
            if (rows.putIfAbsent(post.id(), post) != null) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            LOGGER.warn("Dropped {} duplicate rows from {}", duplicates, outputPath);
        }
        LOGGER.info("Loaded {} existing posts", rows.size());
    }

    /**
     * Adds posts whose ids are not stored yet and persists the store.
     *
     * @return number of rows added
     */
    public synchronized int append(Collection<RedditPost> posts) throws IOException {
        List<String> added = new ArrayList<>();
        for (RedditPost post : posts) {
            if (rows.putIfAbsent(post.id(), post) == null) {
                added.add(post.id());
            }
        }
        if (added.isEmpty()) {
            return 0;
        }
        try {
            writeAtomically();
        } catch (IOException ex) {
            // Keep memory in line with disk so a retry re-appends the same posts.
            added.forEach(rows::remove);
            throw ex;
        }
        LOGGER.info("Saved {} posts to {} (+{})", rows.size(), outputPath, added.size());
        return added.size();
    }

    private void writeAtomically() throws IOException {
        Path parent = outputPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        format.write(new ArrayList<>(rows.values()), tempPath);
        CheckpointManager.moveIntoPlace(tempPath, outputPath);
    }

    public synchronized Set<String> existingIds() {
        return Set.copyOf(rows.keySet());
    }

    public synchronized boolean contains(String id) {
        return rows.containsKey(id);
    }

    public synchronized int size() {
        return rows.size();
    }

    /**
     * Number of stored rows matching {@code filter}; a store shared by several jobs holds rows of each.
     */
    public synchronized int count(Predicate<RedditPost> filter) {
        return (int) rows.values().stream().filter(filter).count();
    }

    public Path path() {
        return outputPath;
    }

    static Path tempPathFor(Path outputPath, RowFormat format) {
        String name = outputPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return outputPath.resolveSibling(base + ".tmp." + format.extension());
    }
}
