package com.macrointel.ingest.alert;

import com.macrointel.ingest.model.Severity;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * A named condition with its own cooldown. The last-fired timestamp lives in memory
 * only, so a restart clears every cooldown.
 */
@Getter
public class AlertRule {

    private final String name;
    private final boolean enabled;
    private final Severity severity;
    private final String description;
    private final AlertCondition condition;
    private final Duration cooldown;
    private final Clock clock;

    private Instant lastFiredAt;

    public AlertRule(String name, boolean enabled, Severity severity, String description,
                     AlertCondition condition, double cooldownHours, Clock clock) {
        this.name = name;
        this.enabled = enabled;
        this.severity = severity;
        this.description = description == null ? "" : description;
        this.condition = condition;
        this.cooldown = Duration.ofSeconds(Math.round(cooldownHours * 3600));
        this.clock = clock;
    }

    public boolean isOnCooldown() {
        return lastFiredAt != null && clock.instant().isBefore(lastFiredAt.plus(cooldown));
    }

    /**
     * Evaluates the condition and, when it holds, records the firing time.
     * Disabled rules and rules inside their cooldown window never fire.
     */
    public Optional<Alert> evaluate(AlertContext context) {
        if (!enabled || isOnCooldown()) return Optional.empty();

        return condition.evaluate(context).map(trigger -> {
            lastFiredAt = clock.instant();
            return Alert.builder()
                    .ruleName(name)
                    .severity(severity)
                    .description(description)
                    .timestamp(LocalDateTime.now(clock))
                    .details(trigger.details())
                    .metadata(trigger.metadata())
                    .build();
        });
    }
}
