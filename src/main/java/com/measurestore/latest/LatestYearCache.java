package com.measurestore.latest;

import com.measurestore.fact.MeasurementChange;
import com.measurestore.period.PeriodKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Memoizes {@link LatestValueMaterializer} results per (entity filter, metric filter).
 *
 * <p>A change to a year-kind fact of (entity, metric) drops every entry whose filters
 * cover that pair. Results computed while an invalidation happened are discarded instead
 * of stored, tracked with a generation counter.
 */
class LatestYearCache {

    private static final Logger log = LoggerFactory.getLogger(LatestYearCache.class);

    record Key(Optional<Long> entityId, Optional<Long> metricId) {

        boolean covers(long entity, long metric) {
            return entityId.map(e -> e == entity).orElse(true)
                && metricId.map(m -> m == metric).orElse(true);
        }
    }

    private final Map<Key, List<LatestYearValue>> entries = new HashMap<>();
    private long generation;

    synchronized Optional<List<LatestYearValue>> get(Key key) {
        List<LatestYearValue> hit = entries.get(key);
        if (hit != null) {
            log.debug("Latest-by-year cache hit for {}", key);
        }
        return Optional.ofNullable(hit);
    }

    synchronized long generation() {
        return generation;
    }

    synchronized void putIfCurrent(Key key, long computedAt, List<LatestYearValue> values) {
        if (computedAt == generation) {
            entries.put(key, values);
        }
    }

    synchronized void onChange(MeasurementChange change) {
        if (change.periodKind() != null && change.periodKind() != PeriodKind.YEAR) {
            return;
        }
        generation++;
        int before = entries.size();
        entries.keySet().removeIf(k -> k.covers(change.entityId(), change.metricId()));
        log.debug("Invalidated {} latest-by-year entr(ies) for entity={} metric={}",
            before - entries.size(), change.entityId(), change.metricId());
    }

    synchronized int size() {
        return entries.size();
    }
}
