package com.example.societyjobs.exception;

import java.util.function.Predicate;

/**
 * Resilience4j retry predicate for calls to the storage and notification services.
 * Transport failures and retryable HTTP statuses are retried; client errors are not.
 */
public class RetryableExternalFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ExternalServiceException external && external.isRetryable();
    }
}
