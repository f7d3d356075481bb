package com.measurestore.registry;

import com.measurestore.TestClock;
import com.measurestore.contract.ConstraintViolationException;
import com.measurestore.contract.InputRules;
import com.measurestore.contract.ReferentialIntegrityException;
import com.measurestore.store.InMemoryMeasureStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DimensionRegistryTest {

    private InMemoryMeasureStore store;
    private DimensionRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryMeasureStore();
        registry = new DimensionRegistry(store, new InputRules(), TestClock.startingAt("2024-01-01T00:00:00Z"));
    }

    @Nested
    @DisplayName("Entities")
    class Entities {

        @Test
        void getOrCreate_twice_returnsSameRow() {
            Entity first = registry.getOrCreateEntity(EntityType.COUNTRY, "France", null, "FRA");
            Entity second = registry.getOrCreateEntity(EntityType.COUNTRY, "France", null, "FRA");
            assertEquals(first.id(), second.id());
            assertEquals(1, registry.listEntities().size());
        }

        @Test
        void sameName_differentType_isDifferentEntity() {
            Entity country = registry.getOrCreateEntity(EntityType.COUNTRY, "Georgia", "GE", "GEO");
            Entity project = registry.getOrCreateEntity(EntityType.PROJECT, "Georgia", null, null);
            assertNotEquals(country.id(), project.id());
        }

        @Test
        void isoCodes_mustHaveExactLength() {
            assertThrows(ConstraintViolationException.class,
                () -> registry.getOrCreateEntity(EntityType.COUNTRY, "France", "FRA", null));
            assertThrows(ConstraintViolationException.class,
                () -> registry.getOrCreateEntity(EntityType.COUNTRY, "France", null, "FR"));
            assertTrue(registry.listEntities().isEmpty());
        }

        @Test
        void blankName_isRejected() {
            assertThrows(ConstraintViolationException.class,
                () -> registry.getOrCreateEntity(EntityType.OTHER, "  ", null, null));
        }

        @Test
        void unknownType_isRejected() {
            ConstraintViolationException ex = assertThrows(ConstraintViolationException.class,
                () -> EntityType.fromValue("planet"));
            assertTrue(ex.getMessage().contains("planet"));
        }

        @Test
        void lookupByNaturalKey() {
            Entity created = registry.getOrCreateEntity(EntityType.ORGANIZATION, "Catalyst Demo Co", null, null);
            assertEquals(Optional.of(created), registry.findEntity(EntityType.ORGANIZATION, "Catalyst Demo Co"));
            assertTrue(registry.findEntity(EntityType.PROJECT, "Catalyst Demo Co").isEmpty());
        }
    }

    @Nested
    @DisplayName("Frameworks and metrics")
    class Metrics {

        @Test
        void metric_createsFrameworkOnDemand() {
            Metric metric = registry.getOrCreateMetric("Demo", "X.1", "Test Metric", null, null, null);
            Framework framework = registry.findFramework("Demo").orElseThrow();
            assertEquals(framework.id(), metric.frameworkId());
            assertEquals(MetricDirection.NEUTRAL, metric.direction());
        }

        @Test
        void metric_getOrCreate_isIdempotentOnCode() {
            Metric first = registry.getOrCreateMetric("SDG", "13.2.1", "Climate policy integration", "index", 1, null);
            Metric second = registry.getOrCreateMetric("SDG", "13.2.1", "Climate policy integration", "index", 1, null);
            assertEquals(first.id(), second.id());
            assertEquals(MetricDirection.HIGHER_IS_BETTER, first.direction());
            assertEquals(Optional.of(first), registry.findMetric("SDG", "13.2.1"));
        }

        @Test
        void metric_withoutCode_isIdentifiedByName() {
            Metric first = registry.getOrCreateMetric("ESG", null, "Scope 1 emissions", "tCO2e", -1, null);
            Metric second = registry.getOrCreateMetric("ESG", null, "Scope 1 emissions", "tCO2e", -1, null);
            assertEquals(first.id(), second.id());
            assertEquals(Optional.of(first), registry.findMetricByName("ESG", "Scope 1 emissions"));
        }

        @Test
        void sameCode_inDifferentFrameworks_isAllowed() {
            Metric a = registry.getOrCreateMetric("SDG", "1.1", "Poverty", null, null, null);
            Metric b = registry.getOrCreateMetric("ESG", "1.1", "Poverty", null, null, null);
            assertNotEquals(a.id(), b.id());
        }

        @Test
        void newCode_reusingAnotherMetricsName_isRejected() {
            registry.getOrCreateMetric("SDG", "13.2.1", "Climate policy", null, null, null);
            assertThrows(ConstraintViolationException.class,
                () -> registry.getOrCreateMetric("SDG", "13.2.2", "Climate policy", null, null, null));
            assertEquals(1, registry.listMetrics(Optional.empty()).size());
        }

        @Test
        void direction_outsideClosedSet_isRejected() {
            assertThrows(ConstraintViolationException.class,
                () -> registry.getOrCreateMetric("SDG", "X", "Bad", null, 2, null));
            assertTrue(registry.findFramework("SDG").isEmpty(),
                "validation must run before the framework is created");
        }

        @Test
        void framework_delete_isRestrictedWhileMetricsExist() {
            Metric metric = registry.getOrCreateMetric("Resilience", "DPR", "Deliberate practice ratio", null, null, null);
            assertThrows(ReferentialIntegrityException.class,
                () -> registry.deleteFramework(metric.frameworkId()));
            assertTrue(registry.findFramework("Resilience").isPresent());
        }

        @Test
        void emptyFramework_canBeDeleted() {
            Framework framework = registry.getOrCreateFramework("NarrativeRisk", "Narrative / event-driven risk scoring");
            registry.deleteFramework(framework.id());
            assertTrue(registry.findFramework("NarrativeRisk").isEmpty());
        }

        @Test
        void listMetrics_filtersByFramework() {
            Metric sdg = registry.getOrCreateMetric("SDG", "13.2.1", "Climate policy", null, null, null);
            registry.getOrCreateMetric("ESG", "E1", "Emissions", null, null, null);
            assertEquals(List.of(sdg), registry.listMetrics(Optional.of(sdg.frameworkId())));
        }
    }

    @Nested
    @DisplayName("Sources")
    class Sources {

        @Test
        void source_isKeyedByName() {
            Source first = registry.getOrCreateSource("UNFCCC", "https://unfccc.int/", null,
                Instant.parse("2024-06-01T00:00:00Z"), "UN Framework Convention on Climate Change");
            Source second = registry.getOrCreateSource("UNFCCC", null, null, null, null);
            assertEquals(first, second);
            assertEquals("https://unfccc.int/", second.url());
        }

        @Test
        void blankOptionalFields_areStoredAsAbsent() {
            Source source = registry.getOrCreateSource("Internal demo", " ", "", null, null);
            assertNull(source.url());
            assertNull(source.license());
        }
    }

    @Nested
    @DisplayName("Insert races")
    class Races {

        @Test
        void lostInsertRace_returnsWinnersRow() {
            // lookup misses once, as if another caller inserted right after it
            InMemoryMeasureStore racing = new InMemoryMeasureStore() {
                private boolean missed;

                @Override
                public Optional<Entity> findEntity(EntityType type, String name) {
                    if (!missed) {
                        missed = true;
                        return Optional.empty();
                    }
                    return super.findEntity(type, name);
                }
            };
            Entity winner = racing.insertEntity(EntityType.DATASET, "WDI", null, null, Instant.EPOCH);
            DimensionRegistry racingRegistry = new DimensionRegistry(racing, new InputRules(),
                TestClock.startingAt("2024-01-01T00:00:00Z"));

            Entity result = racingRegistry.getOrCreateEntity(EntityType.DATASET, "WDI", null, null);

            assertEquals(winner.id(), result.id());
            assertEquals(1, racing.listEntities().size());
        }

        @Test
        void concurrentGetOrCreate_yieldsOneRow() throws Exception {
            int callers = 16;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Entity>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    Callable<Entity> call = () -> {
                        start.await();
                        return registry.getOrCreateEntity(EntityType.COUNTRY, "Kenya", "KE", "KEN");
                    };
                    futures.add(pool.submit(call));
                }
                start.countDown();
                Set<Long> ids = new HashSet<>();
                for (Future<Entity> f : futures) {
                    ids.add(f.get(10, TimeUnit.SECONDS).id());
                }
                assertEquals(1, ids.size());
                assertEquals(1, registry.listEntities().size());
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
