package com.example.redditextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Mirrors the export file and checkpoint of a job to S3 under {@code <prefix>/<jobKey>/<file name>}.
 * Uploads run on a background thread; a path already waiting in the queue is not queued twice, so
 * frequent flushes collapse into one upload of the latest content.
 */
public final class S3SyncService implements ArtifactSyncer {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3SyncService.class);
    private static final Path POISON = Path.of("");

    private final BlockingQueue<Path> queue = new LinkedBlockingQueue<>();
    private final Set<Path> queued = ConcurrentHashMap.newKeySet();
    private final S3Client s3Client;
    private final Thread worker;
    private final String bucket;
    private final String keyPrefix;
    private volatile boolean closed;

    public S3SyncService(String bucket, String prefix, Optional<String> region, String jobKey) {
        this(region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build()), bucket, prefix, jobKey);
    }

    S3SyncService(S3Client s3Client, String bucket, String prefix, String jobKey) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        String normalized = prefix == null ? "" : prefix.replaceAll("/+$", "");
        this.keyPrefix = normalized.isEmpty() ? jobKey : normalized + "/" + jobKey;
        this.worker = new Thread(this::run, "s3-sync");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void enqueue(Path path) {
        if (closed) {
            LOGGER.warn("Skipping S3 sync for {} because the sync service is closed.", path);
            return;
        }
        Path normalized = path.toAbsolutePath().normalize();
        if (queued.add(normalized)) {
            queue.offer(normalized);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(POISON);
        try {
            worker.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for S3 sync worker to stop.", ex);
        } finally {
            s3Client.close();
        }
    }

    String keyFor(Path path) {
        return keyPrefix + "/" + path.getFileName();
    }

    private void run() {
        try {
            while (true) {
                Path path = queue.take();
                if (path == POISON) {
                    return;
                }
                queued.remove(path);
                upload(path);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("S3 sync worker interrupted; exiting.", ex);
        }
    }

    private void upload(Path path) {
        if (!Files.exists(path)) {
            LOGGER.debug("Nothing to upload at {}", path);
            return;
        }
        String key = keyFor(path);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();
            s3Client.putObject(request, RequestBody.fromFile(path));
            LOGGER.info("Uploaded {} to s3://{}/{}", path, bucket, key);
        } catch (Exception ex) {
            // The local copy stays authoritative; the next flush uploads again.
            LOGGER.warn("Failed to upload {} to S3", path, ex);
        }
    }
}
