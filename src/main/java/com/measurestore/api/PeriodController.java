package com.measurestore.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.measurestore.fact.FactStore;
import com.measurestore.period.Period;
import com.measurestore.period.PeriodKind;
import com.measurestore.period.PeriodResolver;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/v1/periods")
public class PeriodController {

    public record PeriodRequest(
        @JsonProperty("kind") String kind,
        @JsonProperty("date_value") String dateValue,
        @JsonProperty("year_value") Integer yearValue,
        @JsonProperty("time_value") Double timeValue
    ) {}

    private final PeriodResolver resolver;
    private final FactStore factStore;

    public PeriodController(PeriodResolver resolver, FactStore factStore) {
        this.resolver = resolver;
        this.factStore = factStore;
    }

    @PostMapping
    public Period resolve(@RequestBody PeriodRequest request) {
        return resolver.resolvePeriod(PeriodKind.fromValue(request.kind()),
            request.dateValue(), request.yearValue(), request.timeValue());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Period> period(@PathVariable long id) {
        return resolver.findPeriod(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable long id) {
        factStore.deletePeriod(id);
        return Map.of("status", "deleted", "period_id", id);
    }
}
