package com.macrointel.ingest.alert;

import com.macrointel.ingest.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

@Value
@Builder
public class Alert {

    String ruleName;
    Severity severity;
    String description;
    LocalDateTime timestamp;
    String details;
    Map<String, Object> metadata;
}
