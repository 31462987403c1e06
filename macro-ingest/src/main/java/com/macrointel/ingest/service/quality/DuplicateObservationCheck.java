package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import com.macrointel.ingest.output.ObservationRepository;
import com.macrointel.ingest.output.ObservationRepository.DuplicateKey;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Any (series, date) key stored more than once breaks the store's key invariant.
 * One critical finding per affected series.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class DuplicateObservationCheck implements DataQualityCheck {

    public static final String DUPLICATE_OBSERVATIONS = "duplicate_observations";

    private static final int MAX_LISTED_DATES = 5;

    private final ObservationRepository observationRepository;

    @Override
    public String name() {
        return "duplicate_observations";
    }

    @Override
    public List<ValidationFinding> check(ValidationContext context) {
        Map<String, List<DuplicateKey>> bySeries = new LinkedHashMap<>();
        for (DuplicateKey key : observationRepository.queryDuplicates()) {
            bySeries.computeIfAbsent(key.seriesId(), k -> new ArrayList<>()).add(key);
        }

        List<ValidationFinding> findings = new ArrayList<>();
        bySeries.forEach((seriesId, keys) -> {
            int duplicateCount = keys.stream().mapToInt(DuplicateKey::count).sum();
            List<String> dates = keys.stream()
                    .limit(MAX_LISTED_DATES)
                    .map(k -> k.observationDate().toString())
                    .toList();
            findings.add(ValidationFinding.builder()
                    .severity(Severity.CRITICAL)
                    .code(DUPLICATE_OBSERVATIONS)
                    .message("Found duplicate observations (count=" + duplicateCount + ").")
                    .seriesId(seriesId)
                    .meta("duplicate_count", duplicateCount)
                    .meta("duplicate_keys", keys.size())
                    .meta("dates", dates)
                    .build());
        });
        return findings;
    }
}
