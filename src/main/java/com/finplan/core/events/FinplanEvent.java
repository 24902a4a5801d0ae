package com.finplan.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a scenario is projected.
 *
 * @param eventType  event type (e.g. "projection.started", "year.solved", "projection.completed")
 * @param scenarioId the scenario this event belongs to
 * @param year       the year this event relates to (nullable for scenario-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record FinplanEvent(
    String eventType,
    String scenarioId,
    Integer year,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PROJECTION_STARTED = "projection.started";
    public static final String YEAR_SOLVED = "year.solved";
    public static final String PROJECTION_COMPLETED = "projection.completed";
    public static final String PROJECTION_FAILED = "projection.failed";

    public static FinplanEvent of(String eventType, String scenarioId, Integer year, Map<String, Object> payload) {
        return new FinplanEvent(eventType, scenarioId, year, payload == null ? Map.of() : Map.copyOf(payload),
                Instant.now());
    }
}
