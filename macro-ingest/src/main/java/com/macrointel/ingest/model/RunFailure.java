package com.macrointel.ingest.model;

/**
 * One sub-failure of a run. {@code scope} is a series id or a pipeline stage
 * ({@code dq}, {@code dq_persist}).
 */
public record RunFailure(String scope, String message) {

    public String render() {
        return scope + ": " + message;
    }
}
