package com.measurestore.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Provenance of a measurement.
 */
public record Source(
    @JsonProperty("id") long id,
    @JsonProperty("name") String name,
    @JsonProperty("url") String url,
    @JsonProperty("license") String license,
    @JsonProperty("retrieved_at") Instant retrievedAt,
    @JsonProperty("note") String note
) {}
