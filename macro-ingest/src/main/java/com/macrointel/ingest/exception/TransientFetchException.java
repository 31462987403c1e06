package com.macrointel.ingest.exception;

/**
 * Network failure, timeout or provider-side 5xx. Retried inside the adapter,
 * then surfaced to the orchestrator as a per-series failure.
 */
public class TransientFetchException extends MacroIngestException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "FETCH-001";
    }
}
