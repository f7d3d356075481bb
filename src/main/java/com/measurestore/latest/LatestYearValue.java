package com.measurestore.latest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The current year-kind value of one (entity, metric) pair.
 */
public record LatestYearValue(
    @JsonProperty("entity_id") long entityId,
    @JsonProperty("metric_id") long metricId,
    @JsonProperty("year") int year,
    @JsonProperty("value") double value,
    @JsonProperty("source_id") Long sourceId,
    @JsonProperty("measurement_id") long measurementId,
    @JsonProperty("created_at") Instant createdAt
) {}
