package com.example.societyjobs.exception;

import lombok.Getter;

/**
 * Failure talking to the storage or notification service.
 * Carries the HTTP status and body when the service answered with an error.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;

    public ExternalServiceException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        super(String.format("[%s] %s", serviceName, cause.getMessage()), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }

    /**
     * No status means the call never got an answer. 408 and 429 are the only client errors worth another attempt.
     */
    public boolean isRetryable() {
        return httpStatusCode == null || httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }
}
