package com.measurestore.projection;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.measurestore.period.PeriodKind;
import com.measurestore.registry.EntityType;

import java.time.Instant;

/**
 * Denormalized, read-only view of one measurement with human-friendly labels.
 *
 * <p>{@code periodValue} is the ISO date, the year, or the time index as text, depending
 * on {@code periodKind}. Source fields are null when the measurement has no provenance.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FlatMeasurement(
    long measurementId,
    EntityType entityType,
    String entityName,
    String framework,
    String metricCode,
    String metricName,
    PeriodKind periodKind,
    String periodValue,
    double value,
    String unit,
    String sourceName,
    String sourceUrl,
    Double confidence,
    String note,
    Instant createdAt
) {}
