package com.measurestore.api;

import com.measurestore.fact.MeasurementFilter;
import com.measurestore.fact.MeasurementOrder;
import com.measurestore.latest.LatestValueMaterializer;
import com.measurestore.latest.LatestYearValue;
import com.measurestore.projection.FlatMeasurement;
import com.measurestore.projection.FlattenedProjection;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Read-only derived views.
 *
 * GET /v1/views/latest-by-year
 * GET /v1/views/flat
 */
@RestController
@RequestMapping("/v1/views")
public class ViewController {

    private final LatestValueMaterializer latest;
    private final FlattenedProjection flat;
    private final QueryLimits limits;

    public ViewController(LatestValueMaterializer latest, FlattenedProjection flat, QueryLimits limits) {
        this.latest = latest;
        this.flat = flat;
        this.limits = limits;
    }

    @GetMapping("/latest-by-year")
    public List<LatestYearValue> latestByYear(@RequestParam(required = false) Long entityId,
                                              @RequestParam(required = false) Long metricId) {
        return latest.latestByYear(Optional.ofNullable(entityId), Optional.ofNullable(metricId));
    }

    @GetMapping("/flat")
    public List<FlatMeasurement> flat(@RequestParam(required = false) Long entityId,
                                      @RequestParam(required = false) Long metricId,
                                      @RequestParam(required = false) Long periodId,
                                      @RequestParam(required = false) Long sourceId,
                                      @RequestParam(required = false) String order,
                                      @RequestParam(required = false) Integer limit) {
        return flat.flatten(
            MeasurementFilter.of(entityId, metricId, periodId, sourceId),
            Optional.ofNullable(order).map(MeasurementOrder::fromValue),
            limits.clamp(limit));
    }
}
