package com.measurestore;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MeasureStoreConfiguration {

    /**
     * Source of created_at timestamps for entities and measurements.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
