package com.macrointel.ingest.exception;

import lombok.Getter;

/**
 * Base type for every failure raised inside the ingestion service.
 * Each subclass carries a stable error code so callers can branch on the
 * category of failure without inspecting messages.
 */
@Getter
public abstract class MacroIngestException extends RuntimeException {

    private final String errorCode;

    protected MacroIngestException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected MacroIngestException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
