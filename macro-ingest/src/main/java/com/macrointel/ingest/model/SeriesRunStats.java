package com.macrointel.ingest.model;

public record SeriesRunStats(int rowsFetched, int rowsWritten) {

    public static final SeriesRunStats EMPTY = new SeriesRunStats(0, 0);
}
