package com.measurestore.latest;

import com.measurestore.fact.FactStore;
import com.measurestore.fact.Measurement;
import com.measurestore.fact.MeasurementFilter;
import com.measurestore.period.Period;
import com.measurestore.period.YearPeriod;
import com.measurestore.store.MeasureStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * "Current value" snapshot over year-kind measurements.
 *
 * <p>For every (entity, metric) pair the winner is the fact with the greatest year; equal
 * years go to the latest {@code created_at}, then to the highest measurement id. The
 * result does not depend on insertion order. Without a cache every call recomputes from
 * the fact table.
 */
public class LatestValueMaterializer {

    private record Pair(long entityId, long metricId) {}

    static final Comparator<LatestYearValue> PRECEDENCE = Comparator
        .comparingInt(LatestYearValue::year)
        .thenComparing(LatestYearValue::createdAt)
        .thenComparingLong(LatestYearValue::measurementId);

    private static final Comparator<LatestYearValue> OUTPUT_ORDER = Comparator
        .comparingLong(LatestYearValue::entityId)
        .thenComparingLong(LatestYearValue::metricId);

    private final MeasureStore store;
    private final LatestYearCache cache;

    public LatestValueMaterializer(MeasureStore store) {
        this.store = store;
        this.cache = null;
    }

    /**
     * Builds a caching materializer that listens to {@code factStore} for invalidations.
     */
    public LatestValueMaterializer(MeasureStore store, FactStore factStore) {
        this.store = store;
        this.cache = new LatestYearCache();
        factStore.subscribe(cache::onChange);
    }

    public List<LatestYearValue> latestByYear(Optional<Long> entityId, Optional<Long> metricId) {
        if (cache == null) {
            return compute(entityId, metricId);
        }
        LatestYearCache.Key key = new LatestYearCache.Key(entityId, metricId);
        Optional<List<LatestYearValue>> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        long generation = cache.generation();
        List<LatestYearValue> computed = compute(entityId, metricId);
        cache.putIfCurrent(key, generation, computed);
        return computed;
    }

    public Optional<LatestYearValue> latestFor(long entityId, long metricId) {
        List<LatestYearValue> values = latestByYear(Optional.of(entityId), Optional.of(metricId));
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    boolean isCaching() {
        return cache != null;
    }

    private List<LatestYearValue> compute(Optional<Long> entityId, Optional<Long> metricId) {
        MeasurementFilter filter = new MeasurementFilter(entityId, metricId, Optional.empty(), Optional.empty());
        return store.readConsistent(() -> {
            Map<Long, Optional<Period>> periods = new HashMap<>();
            Map<Pair, LatestYearValue> best = new HashMap<>();
            for (Measurement m : store.queryMeasurements(filter)) {
                Optional<Period> period = periods.computeIfAbsent(m.periodId(), id -> store.findPeriod(id.longValue()));
                if (period.isEmpty() || !(period.get().value() instanceof YearPeriod year)) {
                    continue;
                }
                LatestYearValue candidate = new LatestYearValue(m.entityId(), m.metricId(), year.year(),
                    m.value(), m.sourceId(), m.id(), m.createdAt());
                best.merge(new Pair(m.entityId(), m.metricId()), candidate,
                    (current, challenger) -> PRECEDENCE.compare(challenger, current) > 0 ? challenger : current);
            }
            List<LatestYearValue> result = new ArrayList<>(best.values());
            result.sort(OUTPUT_ORDER);
            return List.copyOf(result);
        });
    }
}
