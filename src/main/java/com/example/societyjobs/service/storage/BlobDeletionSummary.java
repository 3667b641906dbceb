package com.example.societyjobs.service.storage;

import lombok.Value;

import java.util.List;

/**
 * Outcome of deleting a set of blobs
 */
@Value
public class BlobDeletionSummary {

    int attempted;
    int deleted;
    List<String> errors;

    public static BlobDeletionSummary empty() {
        return new BlobDeletionSummary(0, 0, List.of());
    }

    public int getFailed() {
        return attempted - deleted;
    }
}
