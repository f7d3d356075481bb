package com.measurestore.latest;

import com.measurestore.TestClock;
import com.measurestore.contract.InputRules;
import com.measurestore.fact.FactStore;
import com.measurestore.fact.Measurement;
import com.measurestore.period.Period;
import com.measurestore.period.PeriodKind;
import com.measurestore.period.PeriodResolver;
import com.measurestore.registry.DimensionRegistry;
import com.measurestore.registry.Entity;
import com.measurestore.registry.EntityType;
import com.measurestore.registry.Metric;
import com.measurestore.registry.Source;
import com.measurestore.store.InMemoryMeasureStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LatestValueMaterializerTest {

    private InMemoryMeasureStore store;
    private TestClock clock;
    private DimensionRegistry registry;
    private PeriodResolver periods;
    private FactStore facts;

    private Entity france;
    private Entity usa;
    private Metric sdg;

    @BeforeEach
    void setUp() {
        store = new InMemoryMeasureStore();
        InputRules rules = new InputRules();
        clock = TestClock.startingAt("2024-01-01T00:00:00Z");
        registry = new DimensionRegistry(store, rules, clock);
        periods = new PeriodResolver(store);
        facts = new FactStore(store, rules, clock);

        france = registry.getOrCreateEntity(EntityType.COUNTRY, "France", "FR", "FRA");
        usa = registry.getOrCreateEntity(EntityType.COUNTRY, "United States", "US", "USA");
        sdg = registry.getOrCreateMetric("SDG", "13.2.1", "Climate policy integration", "index", 1, null);
    }

    private Measurement record(Entity entity, Metric metric, Period period, double value) {
        Measurement m = facts.recordMeasurement(entity.id(), metric.id(), period.id(), value, null, null, null);
        clock.advance(Duration.ofMinutes(1));
        return m;
    }

    private Period year(int y) {
        return periods.resolvePeriod(PeriodKind.YEAR, null, y, null);
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        private LatestValueMaterializer latest;

        @BeforeEach
        void setUp() {
            latest = new LatestValueMaterializer(store);
        }

        @Test
        void outOfOrderInsertion_stillPicksGreatestYear() {
            record(france, sdg, year(2022), 0.22);
            Measurement newest = record(france, sdg, year(2024), 0.24);
            record(france, sdg, year(2020), 0.20);

            LatestYearValue value = latest.latestFor(france.id(), sdg.id()).orElseThrow();

            assertEquals(2024, value.year());
            assertEquals(0.24, value.value());
            assertEquals(newest.id(), value.measurementId());
        }

        @Test
        void nonYearPeriods_areIgnored() {
            record(france, sdg, year(2021), 0.21);
            record(france, sdg, periods.resolvePeriod(PeriodKind.DATE, "2030-01-01", null, null), 0.99);
            record(france, sdg, periods.resolvePeriod(PeriodKind.TIME, null, null, 5000.0), 0.98);

            assertEquals(2021, latest.latestFor(france.id(), sdg.id()).orElseThrow().year());
        }

        @Test
        void pairWithOnlyDateFacts_hasNoLatestValue() {
            record(usa, sdg, periods.resolvePeriod(PeriodKind.DATE, "2024-12-31", null, null), 1);
            assertTrue(latest.latestFor(usa.id(), sdg.id()).isEmpty());
        }

        @Test
        void onePerPair_orderedByEntityThenMetric() {
            Metric esg = registry.getOrCreateMetric("ESG", "E1", "Emissions", "tCO2e", -1, null);
            record(usa, sdg, year(2023), 3);
            record(france, esg, year(2023), 2);
            record(france, sdg, year(2023), 1);
            record(france, sdg, year(2019), 0);

            List<LatestYearValue> all = latest.latestByYear(Optional.empty(), Optional.empty());

            assertEquals(3, all.size());
            assertEquals(List.of(france.id(), france.id(), usa.id()), all.stream().map(LatestYearValue::entityId).toList());
            assertEquals(List.of(sdg.id(), esg.id(), sdg.id()), all.stream().map(LatestYearValue::metricId).toList());
        }

        @Test
        void filters_restrictThePairs() {
            record(usa, sdg, year(2023), 3);
            record(france, sdg, year(2023), 1);

            List<LatestYearValue> onlyUsa = latest.latestByYear(Optional.of(usa.id()), Optional.empty());
            assertEquals(1, onlyUsa.size());
            assertEquals(3.0, onlyUsa.get(0).value());
            assertEquals(2, latest.latestByYear(Optional.empty(), Optional.of(sdg.id())).size());
        }

        @Test
        void sourceOfWinningFact_isReported() {
            Source source = registry.getOrCreateSource("UNFCCC", null, null, null, null);
            facts.recordMeasurement(france.id(), sdg.id(), year(2024).id(), 0.62, source.id(), 0.8, null);
            assertEquals(source.id(), latest.latestFor(france.id(), sdg.id()).orElseThrow().sourceId());
        }
    }

    @Nested
    @DisplayName("Tie-break precedence")
    class Precedence {

        @Test
        void equalYears_preferLaterCreation_thenHigherId() {
            Instant t = Instant.parse("2024-01-01T00:00:00Z");
            LatestYearValue older = new LatestYearValue(1, 1, 2024, 1, null, 5, t);
            LatestYearValue newer = new LatestYearValue(1, 1, 2024, 2, null, 3, t.plusSeconds(1));
            LatestYearValue sameInstantHigherId = new LatestYearValue(1, 1, 2024, 3, null, 6, t);

            assertTrue(LatestValueMaterializer.PRECEDENCE.compare(newer, older) > 0);
            assertTrue(LatestValueMaterializer.PRECEDENCE.compare(sameInstantHigherId, older) > 0);
        }

        @Test
        void greaterYear_beatsLaterCreation() {
            Instant t = Instant.parse("2024-01-01T00:00:00Z");
            LatestYearValue y2024 = new LatestYearValue(1, 1, 2024, 1, null, 1, t);
            LatestYearValue y2020Later = new LatestYearValue(1, 1, 2020, 1, null, 2, t.plusSeconds(3600));

            assertTrue(LatestValueMaterializer.PRECEDENCE.compare(y2024, y2020Later) > 0);
        }
    }

    @Nested
    @DisplayName("Invalidation-aware cache")
    class Caching {

        private LatestValueMaterializer latest;

        @BeforeEach
        void setUp() {
            latest = new LatestValueMaterializer(store, facts);
        }

        @Test
        void newerYear_isVisibleAfterInsert() {
            record(france, sdg, year(2022), 0.22);
            assertEquals(2022, latest.latestFor(france.id(), sdg.id()).orElseThrow().year());

            record(france, sdg, year(2024), 0.24);
            assertEquals(2024, latest.latestFor(france.id(), sdg.id()).orElseThrow().year());
        }

        @Test
        void entityDelete_dropsCachedPair() {
            record(france, sdg, year(2022), 0.22);
            record(usa, sdg, year(2022), 0.5);
            assertEquals(2, latest.latestByYear(Optional.empty(), Optional.empty()).size());

            facts.deleteEntity(france.id());

            List<LatestYearValue> after = latest.latestByYear(Optional.empty(), Optional.empty());
            assertEquals(1, after.size());
            assertEquals(usa.id(), after.get(0).entityId());
        }

        @Test
        void sourceDelete_refreshesReportedSource() {
            Source source = registry.getOrCreateSource("UNFCCC", null, null, null, null);
            facts.recordMeasurement(france.id(), sdg.id(), year(2024).id(), 0.62, source.id(), null, null);
            assertEquals(source.id(), latest.latestFor(france.id(), sdg.id()).orElseThrow().sourceId());

            facts.deleteSource(source.id());

            assertNull(latest.latestFor(france.id(), sdg.id()).orElseThrow().sourceId());
        }

        @Test
        void dateFact_doesNotEvictYearEntries() {
            record(france, sdg, year(2022), 0.22);
            latest.latestByYear(Optional.empty(), Optional.empty());
            assertTrue(latest.isCaching());

            List<LatestYearValue> before = latest.latestByYear(Optional.empty(), Optional.empty());
            record(france, sdg, periods.resolvePeriod(PeriodKind.DATE, "2025-01-01", null, null), 9);
            List<LatestYearValue> after = latest.latestByYear(Optional.empty(), Optional.empty());

            assertSame(before, after);
        }

        @Test
        void otherPairsChange_keepsUnrelatedEntry() {
            record(france, sdg, year(2022), 0.22);
            List<LatestYearValue> franceOnly = latest.latestByYear(Optional.of(france.id()), Optional.empty());

            record(usa, sdg, year(2023), 0.5);

            assertSame(franceOnly, latest.latestByYear(Optional.of(france.id()), Optional.empty()));
            assertEquals(2, latest.latestByYear(Optional.empty(), Optional.empty()).size());
        }
    }
}
