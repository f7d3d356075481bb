package com.measurestore.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Framework(
    @JsonProperty("id") long id,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description
) {}
