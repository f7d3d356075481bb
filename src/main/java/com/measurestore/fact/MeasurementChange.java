package com.measurestore.fact;

import com.measurestore.period.PeriodKind;

/**
 * Published after a committed mutation touching a measurement of (entity, metric).
 * {@code periodKind} is null when the period could no longer be read.
 */
public record MeasurementChange(
    Type type,
    long measurementId,
    long entityId,
    long metricId,
    PeriodKind periodKind
) {

    public enum Type {
        RECORDED,
        DELETED,
        SOURCE_DETACHED
    }
}
