package com.macrointel.ingest.exception;

/**
 * Unknown series, malformed request or unusable response. Never retried.
 */
public class PermanentFetchException extends MacroIngestException {

    public PermanentFetchException(String message) {
        super(message);
    }

    public PermanentFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "FETCH-004";
    }
}
