package com.measurestore.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.measurestore.fact.FactStore;
import com.measurestore.registry.DimensionRegistry;
import com.measurestore.registry.Entity;
import com.measurestore.registry.EntityType;
import com.measurestore.registry.Framework;
import com.measurestore.registry.Metric;
import com.measurestore.registry.Source;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Get-or-create, lookup and delete for entities, frameworks, metrics and sources.
 * POST is idempotent on the natural key and returns the existing row on repeat.
 */
@RestController
@RequestMapping("/v1")
public class DimensionController {

    public record EntityRequest(
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("name") String name,
        @JsonProperty("iso2") String iso2,
        @JsonProperty("iso3") String iso3
    ) {}

    public record FrameworkRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {}

    public record MetricRequest(
        @JsonProperty("framework") String framework,
        @JsonProperty("code") String code,
        @JsonProperty("name") String name,
        @JsonProperty("unit") String unit,
        @JsonProperty("direction") Integer direction,
        @JsonProperty("description") String description
    ) {}

    public record SourceRequest(
        @JsonProperty("name") String name,
        @JsonProperty("url") String url,
        @JsonProperty("license") String license,
        @JsonProperty("retrieved_at") Instant retrievedAt,
        @JsonProperty("note") String note
    ) {}

    private final DimensionRegistry registry;
    private final FactStore factStore;

    public DimensionController(DimensionRegistry registry, FactStore factStore) {
        this.registry = registry;
        this.factStore = factStore;
    }

    // ---- entities ----

    @PostMapping("/entities")
    public Entity entity(@RequestBody EntityRequest request) {
        return registry.getOrCreateEntity(EntityType.fromValue(request.entityType()),
            request.name(), request.iso2(), request.iso3());
    }

    @GetMapping("/entities")
    public List<Entity> entities() {
        return registry.listEntities();
    }

    @GetMapping("/entities/{id}")
    public ResponseEntity<Entity> entity(@PathVariable long id) {
        return registry.findEntity(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/entities/{id}")
    public Map<String, Object> deleteEntity(@PathVariable long id) {
        int cascaded = factStore.deleteEntity(id);
        return Map.of("status", "deleted", "entity_id", id, "deleted_measurements", cascaded);
    }

    // ---- frameworks ----

    @PostMapping("/frameworks")
    public Framework framework(@RequestBody FrameworkRequest request) {
        return registry.getOrCreateFramework(request.name(), request.description());
    }

    @GetMapping("/frameworks")
    public List<Framework> frameworks() {
        return registry.listFrameworks();
    }

    @DeleteMapping("/frameworks/{id}")
    public Map<String, Object> deleteFramework(@PathVariable long id) {
        registry.deleteFramework(id);
        return Map.of("status", "deleted", "framework_id", id);
    }

    // ---- metrics ----

    @PostMapping("/metrics")
    public Metric metric(@RequestBody MetricRequest request) {
        return registry.getOrCreateMetric(request.framework(), request.code(), request.name(),
            request.unit(), request.direction(), request.description());
    }

    @GetMapping("/metrics")
    public List<Metric> metrics(@RequestParam(required = false) Long frameworkId) {
        return registry.listMetrics(Optional.ofNullable(frameworkId));
    }

    @GetMapping("/metrics/{id}")
    public ResponseEntity<Metric> metric(@PathVariable long id) {
        return registry.findMetric(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/metrics/{id}")
    public Map<String, Object> deleteMetric(@PathVariable long id) {
        factStore.deleteMetric(id);
        return Map.of("status", "deleted", "metric_id", id);
    }

    // ---- sources ----

    @PostMapping("/sources")
    public Source source(@RequestBody SourceRequest request) {
        return registry.getOrCreateSource(request.name(), request.url(), request.license(),
            request.retrievedAt(), request.note());
    }

    @GetMapping("/sources")
    public List<Source> sources() {
        return registry.listSources();
    }

    @DeleteMapping("/sources/{id}")
    public Map<String, Object> deleteSource(@PathVariable long id) {
        int detached = factStore.deleteSource(id);
        return Map.of("status", "deleted", "source_id", id, "detached_measurements", detached);
    }
}
