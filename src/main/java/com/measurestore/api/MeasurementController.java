package com.measurestore.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.measurestore.fact.FactStore;
import com.measurestore.fact.Measurement;
import com.measurestore.fact.MeasurementFilter;
import com.measurestore.fact.MeasurementOrder;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/v1/measurements")
public class MeasurementController {

    public record MeasurementRequest(
        @JsonProperty("entity_id") Long entityId,
        @JsonProperty("metric_id") Long metricId,
        @JsonProperty("period_id") Long periodId,
        @JsonProperty("value") Double value,
        @JsonProperty("source_id") Long sourceId,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("note") String note
    ) {}

    private final FactStore factStore;
    private final QueryLimits limits;

    public MeasurementController(FactStore factStore, QueryLimits limits) {
        this.factStore = factStore;
        this.limits = limits;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Measurement record(@RequestBody MeasurementRequest request) {
        return factStore.recordMeasurement(
            required(request.entityId(), "entity_id"),
            required(request.metricId(), "metric_id"),
            required(request.periodId(), "period_id"),
            required(request.value(), "value"),
            request.sourceId(),
            request.confidence(),
            request.note());
    }

    @GetMapping
    public List<Measurement> query(@RequestParam(required = false) Long entityId,
                                   @RequestParam(required = false) Long metricId,
                                   @RequestParam(required = false) Long periodId,
                                   @RequestParam(required = false) Long sourceId,
                                   @RequestParam(required = false) String order,
                                   @RequestParam(required = false) Integer limit) {
        return factStore.query(
            MeasurementFilter.of(entityId, metricId, periodId, sourceId),
            Optional.ofNullable(order).map(MeasurementOrder::fromValue),
            limits.clamp(limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Measurement> measurement(@PathVariable long id) {
        return factStore.findMeasurement(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
