package com.macrointel.ingest.exception;

/**
 * Invalid catalog or alert configuration. Fatal: raised before any run starts.
 */
public class ConfigurationException extends MacroIngestException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "CFG-001";
    }
}
