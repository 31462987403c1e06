package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.ValidationFinding;

import java.util.List;

/**
 * One independent data-quality concern evaluated after a run.
 * Implementations must not depend on each other's findings.
 */
public interface DataQualityCheck {

    String name();

    List<ValidationFinding> check(ValidationContext context);
}
