package com.measurestore.store;

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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Transactional row storage for dimensions, periods and measurements.
 *
 * <p>Every mutating call is atomic: it either applies completely or throws before any row
 * changes. Inserts throw {@link UniqueKeyConflictException} on natural-key collisions and
 * {@link com.measurestore.contract.ReferentialIntegrityException} when a referenced row is
 * missing. Restricted deletes throw the latter while dependents exist.
 */
public interface MeasureStore {

    /**
     * Runs {@code work} against a consistent snapshot; no mutation interleaves with it.
     */
    <T> T readConsistent(Supplier<T> work);

    /**
     * Runs {@code work} with exclusive access: mutations and reads made inside it, and any
     * side effects it triggers, complete before another reader sees the store. Must not be
     * called from inside {@link #readConsistent}.
     */
    <T> T writeConsistent(Supplier<T> work);

    // ---- entities ----

    Entity insertEntity(EntityType type, String name, String iso2, String iso3, Instant createdAt);

    Optional<Entity> findEntity(long id);

    Optional<Entity> findEntity(EntityType type, String name);

    List<Entity> listEntities();

    /**
     * Deletes the entity, its measurements and its tag links.
     *
     * @return the measurements removed by the cascade
     */
    List<Measurement> deleteEntity(long id);

    // ---- frameworks ----

    Framework insertFramework(String name, String description);

    Optional<Framework> findFramework(long id);

    Optional<Framework> findFramework(String name);

    List<Framework> listFrameworks();

    void deleteFramework(long id);

    // ---- metrics ----

    Metric insertMetric(long frameworkId, String code, String name, String unit,
                        MetricDirection direction, String description);

    Optional<Metric> findMetric(long id);

    Optional<Metric> findMetricByCode(long frameworkId, String code);

    Optional<Metric> findMetricByName(long frameworkId, String name);

    List<Metric> listMetrics(Optional<Long> frameworkId);

    void deleteMetric(long id);

    // ---- sources ----

    Source insertSource(String name, String url, String license, Instant retrievedAt, String note);

    Optional<Source> findSource(long id);

    Optional<Source> findSource(String name);

    List<Source> listSources();

    /**
     * Deletes the source and clears it from every measurement that cited it.
     *
     * @return the measurements as they were before their source was cleared
     */
    List<Measurement> deleteSource(long id);

    // ---- periods ----

    Period insertPeriod(PeriodValue value);

    Optional<Period> findPeriod(long id);

    Optional<Period> findPeriod(PeriodValue value);

    void deletePeriod(long id);

    // ---- measurements ----

    Measurement insertMeasurement(NewMeasurement measurement);

    Optional<Measurement> findMeasurement(long id);

    List<Measurement> queryMeasurements(MeasurementFilter filter);

    // ---- tags ----

    Tag insertTag(TagKind kind, String name);

    Optional<Tag> findTag(long id);

    Optional<Tag> findTag(TagKind kind, String name);

    /**
     * @return false when the link already existed
     */
    boolean linkEntityTag(long entityId, long tagId);

    boolean linkMetricTag(long metricId, long tagId);

    List<Tag> tagsOfEntity(long entityId);

    List<Tag> tagsOfMetric(long metricId);

    List<Entity> entitiesWithTag(long tagId);

    List<Metric> metricsWithTag(long tagId);

    /**
     * @return number of entity and metric links removed with the tag
     */
    int deleteTag(long tagId);
}
