package com.macrointel.ingest.exception;

/**
 * Provider rejected the call for request-rate reasons (HTTP 429). Retryable.
 */
public class RateLimitExceededException extends TransientFetchException {

    public RateLimitExceededException(String message) {
        super(message);
    }

    public RateLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "FETCH-002";
    }
}
