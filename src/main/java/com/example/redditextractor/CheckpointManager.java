package com.example.redditextractor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

public final class CheckpointManager {
    private final ObjectMapper mapper;
    private final Path checkpointPath;

    /**
     * Manages persistence of one job's checkpoint to a single JSON file.
     */
    public CheckpointManager(Path checkpointPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.checkpointPath = checkpointPath;
    }

    /**
     * Returns the last saved job state if the checkpoint file exists.
     */
    public Optional<JobState> load() throws IOException {
        if (!Files.exists(checkpointPath)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(checkpointPath)) {
            return Optional.of(mapper.readValue(reader, JobState.class));
        }
    }

    /**
     * Writes the state to a sibling temp file and moves it over the checkpoint, so readers only ever see
     * a complete file.
     */
    public void save(JobState state) throws IOException {
        Path parent = checkpointPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(checkpointPath.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
        moveIntoPlace(temp, checkpointPath);
    }

    /**
     * Removes the checkpoint so the next run starts from scratch.
     */
    public boolean delete() throws IOException {
        return Files.deleteIfExists(checkpointPath);
    }

    /**
     * Exposes the underlying checkpoint file path.
     */
    public Path path() {
        return checkpointPath;
    }

    static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
