package com.measurestore.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Unit of analysis: a country, organization, project, persona and so on.
 */
public record Entity(
    @JsonProperty("id") long id,
    @JsonProperty("entity_type") EntityType type,
    @JsonProperty("name") String name,
    @JsonProperty("iso2") String iso2,
    @JsonProperty("iso3") String iso3,
    @JsonProperty("created_at") Instant createdAt
) {}
