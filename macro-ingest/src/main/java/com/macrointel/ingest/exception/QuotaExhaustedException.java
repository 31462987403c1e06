package com.macrointel.ingest.exception;

/**
 * Provider-side daily quota is used up. Not retried: nothing more can be fetched
 * from this provider until the quota resets, so the orchestrator re-routes the
 * remaining series of the source to its configured fallback.
 */
public class QuotaExhaustedException extends RateLimitExceededException {

    public QuotaExhaustedException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "FETCH-003";
    }
}
