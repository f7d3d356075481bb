package com.measurestore.tag;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Classification label (cause, topic, ESG pillar, ...) attachable to entities and metrics.
 */
public record Tag(
    @JsonProperty("id") long id,
    @JsonProperty("kind") TagKind kind,
    @JsonProperty("name") String name
) {}
