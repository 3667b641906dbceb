package com.example.societyjobs.service.storage;

import com.example.societyjobs.config.JobEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Deletes blobs with bounded concurrency.
 * <p>
 * URLs are split into chunks of {@code maxConcurrentDeletes}. The deletes of one chunk run
 * concurrently and the whole chunk settles before the next one starts, so no more than
 * {@code maxConcurrentDeletes} calls are ever in flight. A short pause separates chunks.
 */
@Slf4j
@Service
public class BlobCleanupService {

    private final BlobDeletionTransport transport;
    private final ExecutorService blobDeleteExecutor;
    private final JobEngineProperties properties;

    public BlobCleanupService(BlobDeletionTransport transport,
                              @Qualifier("blobDeleteExecutor") ExecutorService blobDeleteExecutor,
                              JobEngineProperties properties) {
        this.transport = transport;
        this.blobDeleteExecutor = blobDeleteExecutor;
        this.properties = properties;
    }

    /**
     * Delete every URL once. Individual failures are collected, never thrown.
     */
    public BlobDeletionSummary deleteAll(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return BlobDeletionSummary.empty();
        }

        var chunkSize = properties.getCleanup().getMaxConcurrentDeletes();
        var pauseMs = properties.getCleanup().getChunkPauseMs();
        var deleted = 0;
        var errors = new ArrayList<String>();

        for (var start = 0; start < urls.size(); start += chunkSize) {
            var chunk = urls.subList(start, Math.min(start + chunkSize, urls.size()));

            var futures = chunk.stream()
                    .map(url -> CompletableFuture.supplyAsync(() -> transport.deleteBlob(url), blobDeleteExecutor)
                            .handle((ok, ex) -> describeFailure(url, ok, ex)))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            for (var future : futures) {
                var failure = future.join();
                if (failure == null) {
                    deleted++;
                } else {
                    errors.add(failure);
                }
            }

            var hasMore = start + chunkSize < urls.size();
            if (hasMore && pauseMs > 0 && !pause(pauseMs)) {
                for (var skipped : urls.subList(start + chunkSize, urls.size())) {
                    errors.add("blob " + skipped + ": interrupted before deletion");
                }
                break;
            }
        }

        log.info("Blob cleanup finished: {} attempted, {} deleted, {} failed", urls.size(), deleted, errors.size());
        return new BlobDeletionSummary(urls.size(), deleted, errors);
    }

    /**
     * @return null on success, otherwise an error line for the result
     */
    private String describeFailure(String url, Boolean ok, Throwable ex) {
        if (ex != null) {
            var cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Failed to delete blob {}: {}", url, cause.getMessage());
            return "blob " + url + ": " + cause.getMessage();
        }
        if (!Boolean.TRUE.equals(ok)) {
            log.warn("Blob {} was not deleted", url);
            return "blob " + url + ": not deleted";
        }
        return null;
    }

    private boolean pause(long pauseMs) {
        try {
            Thread.sleep(pauseMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Blob cleanup interrupted between chunks");
            return false;
        }
    }
}
