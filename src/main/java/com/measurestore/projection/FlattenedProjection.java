package com.measurestore.projection;

import com.measurestore.fact.Measurement;
import com.measurestore.fact.MeasurementFilter;
import com.measurestore.fact.MeasurementOrder;
import com.measurestore.period.Period;
import com.measurestore.registry.Entity;
import com.measurestore.registry.Framework;
import com.measurestore.registry.Metric;
import com.measurestore.registry.Source;
import com.measurestore.store.MeasureStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Joins measurements with their entity, metric, framework, period and source.
 * Built from one consistent snapshot of the store per call; never written to.
 */
@Service
public class FlattenedProjection {

    private final MeasureStore store;

    public FlattenedProjection(MeasureStore store) {
        this.store = store;
    }

    public List<FlatMeasurement> flatten(MeasurementFilter filter, Optional<MeasurementOrder> order, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return store.readConsistent(() -> {
            List<Measurement> facts = store.queryMeasurements(filter);
            order.ifPresent(o -> facts.sort(o.comparator()));

            Map<Long, Entity> entities = new HashMap<>();
            Map<Long, Metric> metrics = new HashMap<>();
            Map<Long, Framework> frameworks = new HashMap<>();
            Map<Long, Period> periods = new HashMap<>();
            Map<Long, Source> sources = new HashMap<>();

            List<FlatMeasurement> rows = new ArrayList<>();
            for (Measurement m : facts) {
                if (rows.size() >= limit) {
                    break;
                }
                Entity entity = entities.computeIfAbsent(m.entityId(), id -> required(store.findEntity(id.longValue()), "entity", id));
                Metric metric = metrics.computeIfAbsent(m.metricId(), id -> required(store.findMetric(id.longValue()), "metric", id));
                Framework framework = frameworks.computeIfAbsent(metric.frameworkId(),
                    id -> required(store.findFramework(id.longValue()), "framework", id));
                Period period = periods.computeIfAbsent(m.periodId(), id -> required(store.findPeriod(id.longValue()), "period", id));
                Source source = m.sourceId() == null ? null
                    : sources.computeIfAbsent(m.sourceId(), id -> required(store.findSource(id.longValue()), "source", id));

                rows.add(new FlatMeasurement(
                    m.id(),
                    entity.type(),
                    entity.name(),
                    framework.name(),
                    metric.code(),
                    metric.name(),
                    period.kind(),
                    period.displayValue(),
                    m.value(),
                    metric.unit(),
                    source != null ? source.name() : null,
                    source != null ? source.url() : null,
                    m.confidence(),
                    m.note(),
                    m.createdAt()
                ));
            }
            return rows;
        });
    }

    public List<FlatMeasurement> flatten(MeasurementFilter filter) {
        return flatten(filter, Optional.empty(), Integer.MAX_VALUE);
    }

    private static <T> T required(Optional<T> row, String table, long id) {
        // the snapshot is consistent, so a dangling reference means the store itself is broken
        return row.orElseThrow(() -> new IllegalStateException(table + " " + id + " referenced by a measurement is missing"));
    }
}
