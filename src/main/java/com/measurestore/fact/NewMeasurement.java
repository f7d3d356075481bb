package com.measurestore.fact;

import java.time.Instant;

/**
 * A validated measurement waiting for its identifier.
 */
public record NewMeasurement(
    long entityId,
    long metricId,
    long periodId,
    double value,
    Long sourceId,
    Double confidence,
    String note,
    Instant createdAt
) {

    public Measurement withId(long id) {
        return new Measurement(id, entityId, metricId, periodId, value, sourceId, confidence, note, createdAt);
    }
}
