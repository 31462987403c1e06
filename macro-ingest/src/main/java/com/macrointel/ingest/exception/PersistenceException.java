package com.macrointel.ingest.exception;

/**
 * Store write or read failure. Escalates the run status; never dropped silently.
 */
public class PersistenceException extends MacroIngestException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "STORE-001";
    }
}
