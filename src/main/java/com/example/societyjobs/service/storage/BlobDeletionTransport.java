package com.example.societyjobs.service.storage;

/**
 * Removes a stored blob identified by its public URL.
 */
public interface BlobDeletionTransport {

    /**
     * @param url public URL of the blob
     * @return true if the blob was deleted, false if the URL is unusable or the store refused
     * @throws RuntimeException if the store could not be reached
     */
    boolean deleteBlob(String url);
}
