package com.measurestore.fact;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One recorded value of a metric for an entity during a period.
 */
public record Measurement(
    @JsonProperty("id") long id,
    @JsonProperty("entity_id") long entityId,
    @JsonProperty("metric_id") long metricId,
    @JsonProperty("period_id") long periodId,
    @JsonProperty("value") double value,
    @JsonProperty("source_id") Long sourceId,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("note") String note,
    @JsonProperty("created_at") Instant createdAt
) {

    public Measurement withoutSource() {
        return new Measurement(id, entityId, metricId, periodId, value, null, confidence, note, createdAt);
    }
}
