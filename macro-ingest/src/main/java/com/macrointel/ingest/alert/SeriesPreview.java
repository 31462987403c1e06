package com.macrointel.ingest.alert;

import java.util.List;

final class SeriesPreview {

    static final int MAX_LISTED = 5;

    private SeriesPreview() {
    }

    /** {@code "A, B, C, D, E and 3 more"} */
    static String of(List<String> seriesIds) {
        String head = String.join(", ", seriesIds.subList(0, Math.min(MAX_LISTED, seriesIds.size())));
        return seriesIds.size() > MAX_LISTED
                ? head + " and " + (seriesIds.size() - MAX_LISTED) + " more"
                : head;
    }
}
