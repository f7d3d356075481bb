package com.measurestore.store;

import com.measurestore.contract.ReferentialIntegrityException;
import com.measurestore.fact.Measurement;
import com.measurestore.fact.MeasurementFilter;
import com.measurestore.fact.NewMeasurement;
import com.measurestore.period.Period;
import com.measurestore.period.PeriodValue;
import com.measurestore.registry.Entity;
import com.measurestore.registry.EntityType;
import com.measurestore.registry.Framework;
import com.measurestore.registry.Metric;
import com.measurestore.registry.MetricDirection;
import com.measurestore.registry.Source;
import com.measurestore.tag.Tag;
import com.measurestore.tag.TagKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Heap-resident {@link MeasureStore}. One read-write lock covers every table, so each
 * mutation (including cascades) is a single serialized unit and readers never observe a
 * half-applied delete.
 */
@Component
public class InMemoryMeasureStore implements MeasureStore {

    private record EntityKey(EntityType type, String name) {}

    private record MetricKey(long frameworkId, String value) {}

    private record FactKey(long entityId, long metricId, long periodId) {}

    private record TagKey(TagKind kind, String name) {}

    private record TagLink(long ownerId, long tagId) {}

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicLong entitySeq = new AtomicLong(0);
    private final AtomicLong frameworkSeq = new AtomicLong(0);
    private final AtomicLong metricSeq = new AtomicLong(0);
    private final AtomicLong sourceSeq = new AtomicLong(0);
    private final AtomicLong periodSeq = new AtomicLong(0);
    private final AtomicLong measurementSeq = new AtomicLong(0);
    private final AtomicLong tagSeq = new AtomicLong(0);

    private final Map<Long, Entity> entities = new LinkedHashMap<>();
    private final Map<EntityKey, Long> entityKeys = new HashMap<>();

    private final Map<Long, Framework> frameworks = new LinkedHashMap<>();
    private final Map<String, Long> frameworkKeys = new HashMap<>();

    private final Map<Long, Metric> metrics = new LinkedHashMap<>();
    private final Map<MetricKey, Long> metricCodeKeys = new HashMap<>();
    private final Map<MetricKey, Long> metricNameKeys = new HashMap<>();

    private final Map<Long, Source> sources = new LinkedHashMap<>();
    private final Map<String, Long> sourceKeys = new HashMap<>();

    private final Map<Long, Period> periods = new LinkedHashMap<>();
    private final Map<PeriodValue, Long> periodKeys = new HashMap<>();

    private final Map<Long, Measurement> measurements = new LinkedHashMap<>();
    private final Map<FactKey, Long> factKeys = new HashMap<>();

    private final Map<Long, Tag> tags = new LinkedHashMap<>();
    private final Map<TagKey, Long> tagKeys = new HashMap<>();
    private final Set<TagLink> entityTags = new LinkedHashSet<>();
    private final Set<TagLink> metricTags = new LinkedHashSet<>();

    @Override
    public <T> T readConsistent(Supplier<T> work) {
        return read(work);
    }

    @Override
    public <T> T writeConsistent(Supplier<T> work) {
        return write(work);
    }

    // ---- entities ----

    @Override
    public Entity insertEntity(EntityType type, String name, String iso2, String iso3, Instant createdAt) {
        return write(() -> {
            EntityKey key = new EntityKey(type, name);
            Long existing = entityKeys.get(key);
            if (existing != null) {
                throw new UniqueKeyConflictException("entities(entity_type, name)", key, existing);
            }
            Entity entity = new Entity(entitySeq.incrementAndGet(), type, name, iso2, iso3, createdAt);
            entities.put(entity.id(), entity);
            entityKeys.put(key, entity.id());
            return entity;
        });
    }

    @Override
    public Optional<Entity> findEntity(long id) {
        return read(() -> Optional.ofNullable(entities.get(id)));
    }

    @Override
    public Optional<Entity> findEntity(EntityType type, String name) {
        return read(() -> Optional.ofNullable(entityKeys.get(new EntityKey(type, name))).map(entities::get));
    }

    @Override
    public List<Entity> listEntities() {
        return read(() -> new ArrayList<>(entities.values()));
    }

    @Override
    public List<Measurement> deleteEntity(long id) {
        return write(() -> {
            Entity entity = entities.get(id);
            if (entity == null) {
                throw ReferentialIntegrityException.missing("entity", id);
            }
            List<Measurement> removed = measurements.values().stream()
                .filter(m -> m.entityId() == id)
                .collect(Collectors.toCollection(ArrayList::new));
            removed.forEach(this::removeMeasurement);
            entityTags.removeIf(link -> link.ownerId() == id);
            entities.remove(id);
            entityKeys.remove(new EntityKey(entity.type(), entity.name()));
            return removed;
        });
    }

    // ---- frameworks ----

    @Override
    public Framework insertFramework(String name, String description) {
        return write(() -> {
            Long existing = frameworkKeys.get(name);
            if (existing != null) {
                throw new UniqueKeyConflictException("frameworks(name)", name, existing);
            }
            Framework framework = new Framework(frameworkSeq.incrementAndGet(), name, description);
            frameworks.put(framework.id(), framework);
            frameworkKeys.put(name, framework.id());
            return framework;
        });
    }

    @Override
    public Optional<Framework> findFramework(long id) {
        return read(() -> Optional.ofNullable(frameworks.get(id)));
    }

    @Override
    public Optional<Framework> findFramework(String name) {
        return read(() -> Optional.ofNullable(frameworkKeys.get(name)).map(frameworks::get));
    }

    @Override
    public List<Framework> listFrameworks() {
        return read(() -> new ArrayList<>(frameworks.values()));
    }

    @Override
    public void deleteFramework(long id) {
        write(() -> {
            Framework framework = frameworks.get(id);
            if (framework == null) {
                throw ReferentialIntegrityException.missing("framework", id);
            }
            long dependents = metrics.values().stream().filter(m -> m.frameworkId() == id).count();
            if (dependents > 0) {
                throw ReferentialIntegrityException.restricted("framework", id, dependents, "metrics");
            }
            frameworks.remove(id);
            frameworkKeys.remove(framework.name());
            return null;
        });
    }

    // ---- metrics ----

    @Override
    public Metric insertMetric(long frameworkId, String code, String name, String unit,
                               MetricDirection direction, String description) {
        return write(() -> {
            if (!frameworks.containsKey(frameworkId)) {
                throw ReferentialIntegrityException.missing("framework", frameworkId);
            }
            MetricKey codeKey = code == null ? null : new MetricKey(frameworkId, code);
            MetricKey nameKey = new MetricKey(frameworkId, name);
            if (codeKey != null && metricCodeKeys.containsKey(codeKey)) {
                throw new UniqueKeyConflictException("metrics(framework_id, code)", codeKey, metricCodeKeys.get(codeKey));
            }
            if (metricNameKeys.containsKey(nameKey)) {
                throw new UniqueKeyConflictException("metrics(framework_id, name)", nameKey, metricNameKeys.get(nameKey));
            }
            Metric metric = new Metric(metricSeq.incrementAndGet(), frameworkId, code, name, unit, direction, description);
            metrics.put(metric.id(), metric);
            if (codeKey != null) {
                metricCodeKeys.put(codeKey, metric.id());
            }
            metricNameKeys.put(nameKey, metric.id());
            return metric;
        });
    }

    @Override
    public Optional<Metric> findMetric(long id) {
        return read(() -> Optional.ofNullable(metrics.get(id)));
    }

    @Override
    public Optional<Metric> findMetricByCode(long frameworkId, String code) {
        return read(() -> Optional.ofNullable(metricCodeKeys.get(new MetricKey(frameworkId, code))).map(metrics::get));
    }

    @Override
    public Optional<Metric> findMetricByName(long frameworkId, String name) {
        return read(() -> Optional.ofNullable(metricNameKeys.get(new MetricKey(frameworkId, name))).map(metrics::get));
    }

    @Override
    public List<Metric> listMetrics(Optional<Long> frameworkId) {
        return read(() -> metrics.values().stream()
            .filter(m -> frameworkId.map(f -> f == m.frameworkId()).orElse(true))
            .collect(Collectors.toCollection(ArrayList::new)));
    }

    @Override
    public void deleteMetric(long id) {
        write(() -> {
            Metric metric = metrics.get(id);
            if (metric == null) {
                throw ReferentialIntegrityException.missing("metric", id);
            }
            long dependents = measurements.values().stream().filter(m -> m.metricId() == id).count();
            if (dependents > 0) {
                throw ReferentialIntegrityException.restricted("metric", id, dependents, "measurements");
            }
            metricTags.removeIf(link -> link.ownerId() == id);
            metrics.remove(id);
            if (metric.code() != null) {
                metricCodeKeys.remove(new MetricKey(metric.frameworkId(), metric.code()));
            }
            metricNameKeys.remove(new MetricKey(metric.frameworkId(), metric.name()));
            return null;
        });
    }

    // ---- sources ----

    @Override
    public Source insertSource(String name, String url, String license, Instant retrievedAt, String note) {
        return write(() -> {
            Long existing = sourceKeys.get(name);
            if (existing != null) {
                throw new UniqueKeyConflictException("sources(name)", name, existing);
            }
            Source source = new Source(sourceSeq.incrementAndGet(), name, url, license, retrievedAt, note);
            sources.put(source.id(), source);
            sourceKeys.put(name, source.id());
            return source;
        });
    }

    @Override
    public Optional<Source> findSource(long id) {
        return read(() -> Optional.ofNullable(sources.get(id)));
    }

    @Override
    public Optional<Source> findSource(String name) {
        return read(() -> Optional.ofNullable(sourceKeys.get(name)).map(sources::get));
    }

    @Override
    public List<Source> listSources() {
        return read(() -> new ArrayList<>(sources.values()));
    }

    @Override
    public List<Measurement> deleteSource(long id) {
        return write(() -> {
            Source source = sources.get(id);
            if (source == null) {
                throw ReferentialIntegrityException.missing("source", id);
            }
            List<Measurement> detached = measurements.values().stream()
                .filter(m -> m.sourceId() != null && m.sourceId() == id)
                .collect(Collectors.toCollection(ArrayList::new));
            detached.forEach(m -> measurements.put(m.id(), m.withoutSource()));
            sources.remove(id);
            sourceKeys.remove(source.name());
            return detached;
        });
    }

    // ---- periods ----

    @Override
    public Period insertPeriod(PeriodValue value) {
        return write(() -> {
            Long existing = periodKeys.get(value);
            if (existing != null) {
                throw new UniqueKeyConflictException("periods(kind, value)", value, existing);
            }
            Period period = new Period(periodSeq.incrementAndGet(), value);
            periods.put(period.id(), period);
            periodKeys.put(value, period.id());
            return period;
        });
    }

    @Override
    public Optional<Period> findPeriod(long id) {
        return read(() -> Optional.ofNullable(periods.get(id)));
    }

    @Override
    public Optional<Period> findPeriod(PeriodValue value) {
        return read(() -> Optional.ofNullable(periodKeys.get(value)).map(periods::get));
    }

    @Override
    public void deletePeriod(long id) {
        write(() -> {
            Period period = periods.get(id);
            if (period == null) {
                throw ReferentialIntegrityException.missing("period", id);
            }
            long dependents = measurements.values().stream().filter(m -> m.periodId() == id).count();
            if (dependents > 0) {
                throw ReferentialIntegrityException.restricted("period", id, dependents, "measurements");
            }
            periods.remove(id);
            periodKeys.remove(period.value());
            return null;
        });
    }

    // ---- measurements ----

    @Override
    public Measurement insertMeasurement(NewMeasurement draft) {
        return write(() -> {
            requireRow(entities, draft.entityId(), "entity");
            requireRow(metrics, draft.metricId(), "metric");
            requireRow(periods, draft.periodId(), "period");
            if (draft.sourceId() != null) {
                requireRow(sources, draft.sourceId(), "source");
            }
            FactKey key = new FactKey(draft.entityId(), draft.metricId(), draft.periodId());
            Long existing = factKeys.get(key);
            if (existing != null) {
                throw new UniqueKeyConflictException("measurements(entity_id, metric_id, period_id)", key, existing);
            }
            Measurement measurement = draft.withId(measurementSeq.incrementAndGet());
            measurements.put(measurement.id(), measurement);
            factKeys.put(key, measurement.id());
            return measurement;
        });
    }

    @Override
    public Optional<Measurement> findMeasurement(long id) {
        return read(() -> Optional.ofNullable(measurements.get(id)));
    }

    @Override
    public List<Measurement> queryMeasurements(MeasurementFilter filter) {
        return read(() -> measurements.values().stream()
            .filter(filter::matches)
            .collect(Collectors.toCollection(ArrayList::new)));
    }

    // ---- tags ----

    @Override
    public Tag insertTag(TagKind kind, String name) {
        return write(() -> {
            TagKey key = new TagKey(kind, name);
            Long existing = tagKeys.get(key);
            if (existing != null) {
                throw new UniqueKeyConflictException("tags(kind, name)", key, existing);
            }
            Tag tag = new Tag(tagSeq.incrementAndGet(), kind, name);
            tags.put(tag.id(), tag);
            tagKeys.put(key, tag.id());
            return tag;
        });
    }

    @Override
    public Optional<Tag> findTag(long id) {
        return read(() -> Optional.ofNullable(tags.get(id)));
    }

    @Override
    public Optional<Tag> findTag(TagKind kind, String name) {
        return read(() -> Optional.ofNullable(tagKeys.get(new TagKey(kind, name))).map(tags::get));
    }

    @Override
    public boolean linkEntityTag(long entityId, long tagId) {
        return write(() -> {
            requireRow(entities, entityId, "entity");
            requireRow(tags, tagId, "tag");
            return entityTags.add(new TagLink(entityId, tagId));
        });
    }

    @Override
    public boolean linkMetricTag(long metricId, long tagId) {
        return write(() -> {
            requireRow(metrics, metricId, "metric");
            requireRow(tags, tagId, "tag");
            return metricTags.add(new TagLink(metricId, tagId));
        });
    }

    @Override
    public List<Tag> tagsOfEntity(long entityId) {
        return read(() -> linkedTags(entityTags, entityId));
    }

    @Override
    public List<Tag> tagsOfMetric(long metricId) {
        return read(() -> linkedTags(metricTags, metricId));
    }

    @Override
    public List<Entity> entitiesWithTag(long tagId) {
        return read(() -> entityTags.stream()
            .filter(link -> link.tagId() == tagId)
            .map(link -> entities.get(link.ownerId()))
            .collect(Collectors.toCollection(ArrayList::new)));
    }

    @Override
    public List<Metric> metricsWithTag(long tagId) {
        return read(() -> metricTags.stream()
            .filter(link -> link.tagId() == tagId)
            .map(link -> metrics.get(link.ownerId()))
            .collect(Collectors.toCollection(ArrayList::new)));
    }

    @Override
    public int deleteTag(long tagId) {
        return write(() -> {
            Tag tag = tags.get(tagId);
            if (tag == null) {
                throw ReferentialIntegrityException.missing("tag", tagId);
            }
            int before = entityTags.size() + metricTags.size();
            entityTags.removeIf(link -> link.tagId() == tagId);
            metricTags.removeIf(link -> link.tagId() == tagId);
            tags.remove(tagId);
            tagKeys.remove(new TagKey(tag.kind(), tag.name()));
            return before - entityTags.size() - metricTags.size();
        });
    }

    // ---- internals ----

    private List<Tag> linkedTags(Set<TagLink> links, long ownerId) {
        return links.stream()
            .filter(link -> link.ownerId() == ownerId)
            .map(link -> tags.get(link.tagId()))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    private void removeMeasurement(Measurement m) {
        measurements.remove(m.id());
        factKeys.remove(new FactKey(m.entityId(), m.metricId(), m.periodId()));
    }

    private static void requireRow(Map<Long, ?> table, long id, String name) {
        if (!table.containsKey(id)) {
            throw ReferentialIntegrityException.missing(name, id);
        }
    }

    private <T> T read(Supplier<T> work) {
        return locked(lock.readLock(), work);
    }

    private <T> T write(Supplier<T> work) {
        return locked(lock.writeLock(), work);
    }

    private static <T> T locked(Lock l, Supplier<T> work) {
        l.lock();
        try {
            return work.get();
        } finally {
            l.unlock();
        }
    }
}
