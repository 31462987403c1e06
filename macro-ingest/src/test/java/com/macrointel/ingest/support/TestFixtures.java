package com.macrointel.ingest.support;

import com.macrointel.ingest.client.SeriesFetchClient;
import com.macrointel.ingest.client.SourceRouter;
import com.macrointel.ingest.model.DataPoint;
import com.macrointel.ingest.model.DataSource;
import com.macrointel.ingest.model.SeriesDefinition;

import java.lang.reflect.Method;
import java.time.LocalDate;
import java.util.List;

public final class TestFixtures {

    private TestFixtures() {
    }

    public static SeriesDefinition series(String seriesId, DataSource source) {
        return series(seriesId, source, "Monthly");
    }

    public static SeriesDefinition series(String seriesId, DataSource source, String frequency) {
        return SeriesDefinition.builder()
                .seriesId(seriesId)
                .source(source)
                .sourceSeriesId(seriesId)
                .fallbackSeriesId(seriesId)
                .frequency(frequency)
                .tier(1)
                .title(seriesId)
                .units("Percent")
                .seasonalAdjustment("SA")
                .build();
    }

    public static SeriesDefinition withFallback(String seriesId, DataSource source, String fallbackSeriesId) {
        return series(seriesId, source).toBuilder().fallbackSeriesId(fallbackSeriesId).build();
    }

    public static DataPoint point(String date, double value) {
        return new DataPoint(LocalDate.parse(date), value);
    }

    /** Builds a router and runs its post-construct step, as Spring would. */
    public static SourceRouter router(SeriesFetchClient... clients) {
        SourceRouter router = new SourceRouter(List.of(clients));
        try {
            Method initialize = SourceRouter.class.getDeclaredMethod("initialize");
            initialize.setAccessible(true);
            initialize.invoke(router);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot initialise router", e);
        }
        return router;
    }
}
