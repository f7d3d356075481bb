package com.measurestore.fact;

import java.util.Optional;

/**
 * Conjunctive filter over measurements. An empty component matches everything.
 */
public record MeasurementFilter(
    Optional<Long> entityId,
    Optional<Long> metricId,
    Optional<Long> periodId,
    Optional<Long> sourceId
) {

    public static MeasurementFilter all() {
        return new MeasurementFilter(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static MeasurementFilter of(Long entityId, Long metricId, Long periodId, Long sourceId) {
        return new MeasurementFilter(
            Optional.ofNullable(entityId),
            Optional.ofNullable(metricId),
            Optional.ofNullable(periodId),
            Optional.ofNullable(sourceId));
    }

    public MeasurementFilter withEntity(long id) {
        return new MeasurementFilter(Optional.of(id), metricId, periodId, sourceId);
    }

    public MeasurementFilter withMetric(long id) {
        return new MeasurementFilter(entityId, Optional.of(id), periodId, sourceId);
    }

    public boolean matches(Measurement m) {
        return entityId.map(id -> id == m.entityId()).orElse(true)
            && metricId.map(id -> id == m.metricId()).orElse(true)
            && periodId.map(id -> id == m.periodId()).orElse(true)
            && sourceId.map(id -> id.equals(m.sourceId())).orElse(true);
    }
}
