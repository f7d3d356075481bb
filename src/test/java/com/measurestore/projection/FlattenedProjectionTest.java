package com.measurestore.projection;

import com.measurestore.TestClock;
import com.measurestore.contract.InputRules;
import com.measurestore.fact.FactStore;
import com.measurestore.fact.Measurement;
import com.measurestore.fact.MeasurementFilter;
import com.measurestore.fact.MeasurementOrder;
import com.measurestore.period.PeriodKind;
import com.measurestore.period.PeriodResolver;
import com.measurestore.registry.DimensionRegistry;
import com.measurestore.registry.Entity;
import com.measurestore.registry.EntityType;
import com.measurestore.registry.Metric;
import com.measurestore.registry.Source;
import com.measurestore.store.InMemoryMeasureStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FlattenedProjectionTest {

    private DimensionRegistry registry;
    private PeriodResolver periods;
    private FactStore facts;
    private FlattenedProjection projection;

    private Entity usa;
    private Metric metric;

    @BeforeEach
    void setUp() {
        InMemoryMeasureStore store = new InMemoryMeasureStore();
        InputRules rules = new InputRules();
        TestClock clock = TestClock.startingAt("2024-01-01T00:00:00Z");
        registry = new DimensionRegistry(store, rules, clock);
        periods = new PeriodResolver(store);
        facts = new FactStore(store, rules, clock);
        projection = new FlattenedProjection(store);

        usa = registry.getOrCreateEntity(EntityType.COUNTRY, "United States", "US", "USA");
        metric = registry.getOrCreateMetric("SDG", "13.2.1", "Climate policy integration (demo)", "index", 1, null);
    }

    @Test
    void row_carriesHumanReadableLabels() {
        Source source = registry.getOrCreateSource("Internal demo", "https://example.org/demo", null, null, null);
        long periodId = periods.resolvePeriod(PeriodKind.YEAR, null, 2024, null).id();
        Measurement m = facts.recordMeasurement(usa.id(), metric.id(), periodId, 0.62, source.id(), 0.80,
            "Demo measurement for illustration only.");

        List<FlatMeasurement> rows = projection.flatten(MeasurementFilter.all());

        assertEquals(1, rows.size());
        FlatMeasurement row = rows.get(0);
        assertEquals(m.id(), row.measurementId());
        assertEquals(EntityType.COUNTRY, row.entityType());
        assertEquals("United States", row.entityName());
        assertEquals("SDG", row.framework());
        assertEquals("13.2.1", row.metricCode());
        assertEquals("Climate policy integration (demo)", row.metricName());
        assertEquals(PeriodKind.YEAR, row.periodKind());
        assertEquals("2024", row.periodValue());
        assertEquals(0.62, row.value());
        assertEquals("index", row.unit());
        assertEquals("Internal demo", row.sourceName());
        assertEquals("https://example.org/demo", row.sourceUrl());
        assertEquals(0.80, row.confidence());
        assertEquals(m.createdAt(), row.createdAt());
    }

    @Test
    void periodValue_isRenderedPerKind() {
        facts.recordMeasurement(usa.id(), metric.id(),
            periods.resolvePeriod(PeriodKind.DATE, "2024-12-31", null, null).id(), 1, null, null, null);
        facts.recordMeasurement(usa.id(), metric.id(),
            periods.resolvePeriod(PeriodKind.TIME, null, null, 2.0).id(), 2, null, null, null);

        List<FlatMeasurement> rows = projection.flatten(MeasurementFilter.all(), Optional.of(MeasurementOrder.ID_ASC), 10);

        assertEquals(List.of("2024-12-31", "2.0"), rows.stream().map(FlatMeasurement::periodValue).toList());
        assertEquals(List.of(PeriodKind.DATE, PeriodKind.TIME), rows.stream().map(FlatMeasurement::periodKind).toList());
    }

    @Test
    void detachedSource_leavesSourceColumnsEmpty() {
        Source source = registry.getOrCreateSource("UNFCCC", "https://unfccc.int/", null, null, null);
        facts.recordMeasurement(usa.id(), metric.id(),
            periods.resolvePeriod(PeriodKind.YEAR, null, 2024, null).id(), 1, source.id(), null, null);
        facts.deleteSource(source.id());

        FlatMeasurement row = projection.flatten(MeasurementFilter.all()).get(0);

        assertNull(row.sourceName());
        assertNull(row.sourceUrl());
    }

    @Test
    void limit_andFilter_areHonoured() {
        for (int year = 2020; year < 2025; year++) {
            facts.recordMeasurement(usa.id(), metric.id(),
                periods.resolvePeriod(PeriodKind.YEAR, null, year, null).id(), year, null, null, null);
        }
        Entity other = registry.getOrCreateEntity(EntityType.PROJECT, "Content Catalyst Suite", null, null);
        facts.recordMeasurement(other.id(), metric.id(),
            periods.resolvePeriod(PeriodKind.YEAR, null, 2020, null).id(), 1, null, null, null);

        assertEquals(3, projection.flatten(MeasurementFilter.all(), Optional.empty(), 3).size());
        List<FlatMeasurement> projectRows = projection.flatten(MeasurementFilter.all().withEntity(other.id()));
        assertEquals(1, projectRows.size());
        assertEquals(EntityType.PROJECT, projectRows.get(0).entityType());
        assertTrue(projection.flatten(MeasurementFilter.all(), Optional.empty(), 0).isEmpty());
    }
}
