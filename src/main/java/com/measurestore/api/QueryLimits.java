package com.measurestore.api;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Page-size bounds for list endpoints.
 */
@Component
public class QueryLimits {

    private final int defaultLimit;
    private final int maxLimit;

    public QueryLimits(@Value("${measurestore.query.default-limit:100}") int defaultLimit,
                       @Value("${measurestore.query.max-limit:1000}") int maxLimit) {
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    public int clamp(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }
}
