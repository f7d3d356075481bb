package com.measurestore.fact;

import com.measurestore.contract.DuplicateFactException;
import com.measurestore.contract.InputRules;
import com.measurestore.contract.ReferentialIntegrityException;
import com.measurestore.period.Period;
import com.measurestore.period.PeriodKind;
import com.measurestore.store.MeasureStore;
import com.measurestore.store.UniqueKeyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Records and removes measurements.
 *
 * <p>Facts are strictly unique per (entity, metric, period): a second record for the same
 * triple fails with {@link DuplicateFactException} and leaves the first value untouched.
 * Listeners registered through {@link #subscribe} hear about every change while the write
 * is still exclusive, so no reader observes the new state before they have run. Listeners
 * must therefore be quick and must not wait on other threads that use the store.
 */
@Service
public class FactStore {

    private static final Logger log = LoggerFactory.getLogger(FactStore.class);

    private final MeasureStore store;
    private final InputRules rules;
    private final Clock clock;
    private final ConcurrentHashMap<String, Consumer<MeasurementChange>> subscribers = new ConcurrentHashMap<>();

    public FactStore(MeasureStore store, InputRules rules, Clock clock) {
        this.store = store;
        this.rules = rules;
        this.clock = clock;
    }

    public Measurement recordMeasurement(long entityId, long metricId, long periodId, double value,
                                         Long sourceId, Double confidence, String note) {
        rules.requireFinite(value, "value");
        rules.requireUnitInterval(confidence, "confidence");
        store.findEntity(entityId).orElseThrow(() -> ReferentialIntegrityException.missing("entity", entityId));
        store.findMetric(metricId).orElseThrow(() -> ReferentialIntegrityException.missing("metric", metricId));
        Period period = store.findPeriod(periodId)
            .orElseThrow(() -> ReferentialIntegrityException.missing("period", periodId));
        if (sourceId != null) {
            store.findSource(sourceId).orElseThrow(() -> ReferentialIntegrityException.missing("source", sourceId));
        }

        NewMeasurement draft = new NewMeasurement(entityId, metricId, periodId, value,
            sourceId, confidence, rules.optionalText(note), Instant.now(clock));
        return store.writeConsistent(() -> {
            Measurement recorded;
            try {
                recorded = store.insertMeasurement(draft);
            } catch (UniqueKeyConflictException ex) {
                throw new DuplicateFactException(entityId, metricId, periodId);
            }
            log.info("Recorded measurement id={} entity={} metric={} period={} value={}",
                recorded.id(), entityId, metricId, periodId, value);
            notifySubscribers(List.of(change(MeasurementChange.Type.RECORDED, recorded, period.kind())));
            return recorded;
        });
    }

    public Optional<Measurement> findMeasurement(long id) {
        return store.findMeasurement(id);
    }

    public List<Measurement> query(MeasurementFilter filter, Optional<MeasurementOrder> order, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<Measurement> matches = store.queryMeasurements(filter);
        order.ifPresent(o -> matches.sort(o.comparator()));
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
    }

    public List<Measurement> query(MeasurementFilter filter) {
        return query(filter, Optional.empty(), Integer.MAX_VALUE);
    }

    /**
     * Deletes the entity together with every measurement recorded for it. Irrevocable.
     *
     * @return number of measurements removed by the cascade
     */
    public int deleteEntity(long entityId) {
        return store.writeConsistent(() -> {
            List<Measurement> removed = store.deleteEntity(entityId);
            log.info("Deleted entity id={} cascading {} measurement(s)", entityId, removed.size());
            notifySubscribers(changes(MeasurementChange.Type.DELETED, removed));
            return removed.size();
        });
    }

    /**
     * Fails with {@link ReferentialIntegrityException} while any measurement uses the metric.
     */
    public void deleteMetric(long metricId) {
        store.deleteMetric(metricId);
        log.info("Deleted metric id={}", metricId);
    }

    /**
     * Fails with {@link ReferentialIntegrityException} while any measurement uses the period.
     */
    public void deletePeriod(long periodId) {
        store.deletePeriod(periodId);
        log.info("Deleted period id={}", periodId);
    }

    /**
     * Removes the source; measurements citing it keep their values and lose the reference.
     *
     * @return number of measurements detached
     */
    public int deleteSource(long sourceId) {
        return store.writeConsistent(() -> {
            List<Measurement> detached = store.deleteSource(sourceId);
            log.info("Deleted source id={} detaching {} measurement(s)", sourceId, detached.size());
            notifySubscribers(changes(MeasurementChange.Type.SOURCE_DETACHED, detached));
            return detached.size();
        });
    }

    public String subscribe(Consumer<MeasurementChange> listener) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, listener);
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }

    /**
     * Period kinds are looked up after the mutation; a period missing by then yields a change
     * with a null kind.
     */
    private List<MeasurementChange> changes(MeasurementChange.Type type, List<Measurement> affected) {
        Map<Long, PeriodKind> kinds = new HashMap<>();
        for (Measurement m : affected) {
            kinds.computeIfAbsent(m.periodId(), id -> store.findPeriod(id).map(Period::kind).orElse(null));
        }
        return affected.stream()
            .map(m -> change(type, m, kinds.get(m.periodId())))
            .collect(Collectors.toList());
    }

    private static MeasurementChange change(MeasurementChange.Type type, Measurement m, PeriodKind kind) {
        return new MeasurementChange(type, m.id(), m.entityId(), m.metricId(), kind);
    }

    private void notifySubscribers(List<MeasurementChange> changes) {
        if (changes.isEmpty()) {
            return;
        }
        subscribers.values().forEach(listener -> changes.forEach(change -> {
            try {
                listener.accept(change);
            } catch (Exception ex) {
                log.warn("Change listener failed for measurement={}: {}", change.measurementId(), ex.getMessage());
            }
        }));
    }
}
