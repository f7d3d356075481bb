package com.measurestore.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A measurable concept scoped to exactly one framework.
 */
public record Metric(
    @JsonProperty("id") long id,
    @JsonProperty("framework_id") long frameworkId,
    @JsonProperty("code") String code,
    @JsonProperty("name") String name,
    @JsonProperty("unit") String unit,
    @JsonProperty("direction") MetricDirection direction,
    @JsonProperty("description") String description
) {}
