package com.measurestore.contract;

/**
 * Thrown when a measurement already exists for the (entity, metric, period) triple.
 * Facts are never overwritten.
 */
public class DuplicateFactException extends RuntimeException {

    private final long entityId;
    private final long metricId;
    private final long periodId;

    public DuplicateFactException(long entityId, long metricId, long periodId) {
        super("measurement already exists for entity=" + entityId
            + ", metric=" + metricId + ", period=" + periodId);
        this.entityId = entityId;
        this.metricId = metricId;
        this.periodId = periodId;
    }

    public long getEntityId() {
        return entityId;
    }

    public long getMetricId() {
        return metricId;
    }

    public long getPeriodId() {
        return periodId;
    }
}
