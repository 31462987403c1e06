package com.macrointel.ingest.service;

public enum RunPhase {
    STARTED,
    FETCHING,
    PERSISTING,
    VALIDATING,
    FINALIZED
}
