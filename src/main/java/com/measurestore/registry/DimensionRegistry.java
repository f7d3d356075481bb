package com.measurestore.registry;

import com.measurestore.contract.ConstraintViolationException;
import com.measurestore.contract.InputRules;
import com.measurestore.store.MeasureStore;
import com.measurestore.store.UniqueKeyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * Idempotent get-or-create and lookup for entities, frameworks, metrics and sources.
 *
 * <p>Each get-or-create looks the natural key up first and inserts on a miss. When two
 * callers miss at the same time the loser's insert fails with
 * {@link UniqueKeyConflictException}; it then re-reads and returns the winner's row, so no
 * natural key is ever stored twice.
 */
@Service
public class DimensionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DimensionRegistry.class);

    private final MeasureStore store;
    private final InputRules rules;
    private final Clock clock;

    public DimensionRegistry(MeasureStore store, InputRules rules, Clock clock) {
        this.store = store;
        this.rules = rules;
        this.clock = clock;
    }

    // ---- entities ----

    public Entity getOrCreateEntity(EntityType type, String name, String iso2, String iso3) {
        if (type == null) {
            throw new ConstraintViolationException("entity_type is required");
        }
        rules.requireName(name, "entity name");
        String code2 = rules.requireCodeLength(rules.optionalText(iso2), 2, "iso2");
        String code3 = rules.requireCodeLength(rules.optionalText(iso3), 3, "iso3");

        return insertOrFind(
            () -> store.findEntity(type, name),
            () -> {
                Entity created = store.insertEntity(type, name, code2, code3, Instant.now(clock));
                log.info("Registered entity id={} type={} name={}", created.id(), type.getValue(), name);
                return created;
            },
            store::findEntity);
    }

    public Optional<Entity> findEntity(long id) {
        return store.findEntity(id);
    }

    public Optional<Entity> findEntity(EntityType type, String name) {
        return store.findEntity(type, name);
    }

    public List<Entity> listEntities() {
        return store.listEntities();
    }

    // ---- frameworks ----

    public Framework getOrCreateFramework(String name, String description) {
        rules.requireName(name, "framework name");
        String desc = rules.optionalText(description);
        return insertOrFind(
            () -> store.findFramework(name),
            () -> {
                Framework created = store.insertFramework(name, desc);
                log.info("Registered framework id={} name={}", created.id(), name);
                return created;
            },
            store::findFramework);
    }

    public Optional<Framework> findFramework(long id) {
        return store.findFramework(id);
    }

    public Optional<Framework> findFramework(String name) {
        return store.findFramework(name);
    }

    public List<Framework> listFrameworks() {
        return store.listFrameworks();
    }

    /**
     * Fails with {@link com.measurestore.contract.ReferentialIntegrityException} while any
     * metric belongs to the framework.
     */
    public void deleteFramework(long id) {
        store.deleteFramework(id);
        log.info("Deleted framework id={}", id);
    }

    // ---- metrics ----

    /**
     * Resolves a metric inside {@code frameworkName}, creating the framework on demand.
     * The metric is identified by its code when one is given, by its name otherwise.
     * A new code whose name is already used by another metric of the framework is rejected.
     */
    public Metric getOrCreateMetric(String frameworkName, String code, String name, String unit,
                                    Integer direction, String description) {
        rules.requireName(frameworkName, "framework name");
        rules.requireName(name, "metric name");
        MetricDirection dir = MetricDirection.fromCode(direction);
        String metricCode = rules.optionalText(code);

        Framework framework = getOrCreateFramework(frameworkName, null);
        long frameworkId = framework.id();
        Supplier<Optional<Metric>> lookup = metricCode != null
            ? () -> store.findMetricByCode(frameworkId, metricCode)
            : () -> store.findMetricByName(frameworkId, name);

        Optional<Metric> existing = lookup.get();
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            Metric created = store.insertMetric(frameworkId, metricCode, name,
                rules.optionalText(unit), dir, rules.optionalText(description));
            log.info("Registered metric id={} framework={} code={} name={}",
                created.id(), frameworkName, metricCode, name);
            return created;
        } catch (UniqueKeyConflictException ex) {
            return lookup.get().orElseThrow(() -> new ConstraintViolationException(
                "metric name '" + name + "' is already used by another metric in framework '" + frameworkName + "'"));
        }
    }

    public Optional<Metric> findMetric(long id) {
        return store.findMetric(id);
    }

    public Optional<Metric> findMetric(String frameworkName, String code) {
        return store.findFramework(frameworkName)
            .flatMap(f -> store.findMetricByCode(f.id(), code));
    }

    public Optional<Metric> findMetricByName(String frameworkName, String name) {
        return store.findFramework(frameworkName)
            .flatMap(f -> store.findMetricByName(f.id(), name));
    }

    public List<Metric> listMetrics(Optional<Long> frameworkId) {
        return store.listMetrics(frameworkId);
    }

    // ---- sources ----

    /**
     * Sources are keyed by name; the optional provenance fields are taken from the call
     * that first registers the name.
     */
    public Source getOrCreateSource(String name, String url, String license, Instant retrievedAt, String note) {
        rules.requireName(name, "source name");
        return insertOrFind(
            () -> store.findSource(name),
            () -> {
                Source created = store.insertSource(name, rules.optionalText(url),
                    rules.optionalText(license), retrievedAt, rules.optionalText(note));
                log.info("Registered source id={} name={}", created.id(), name);
                return created;
            },
            store::findSource);
    }

    public Optional<Source> findSource(long id) {
        return store.findSource(id);
    }

    public Optional<Source> findSource(String name) {
        return store.findSource(name);
    }

    public List<Source> listSources() {
        return store.listSources();
    }

    private <T> T insertOrFind(Supplier<Optional<T>> lookup,
                               Supplier<T> insert,
                               LongFunction<Optional<T>> byId) {
        Optional<T> existing = lookup.get();
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return insert.get();
        } catch (UniqueKeyConflictException ex) {
            log.debug("Lost insert race on {}, re-reading id={}", ex.getIndex(), ex.getExistingId());
            return byId.apply(ex.getExistingId())
                .orElseThrow(() -> new IllegalStateException(
                    "row vanished after unique-key conflict on " + ex.getIndex()));
        }
    }
}
