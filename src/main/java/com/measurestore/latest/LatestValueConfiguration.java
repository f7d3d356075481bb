package com.measurestore.latest;

import com.measurestore.fact.FactStore;
import com.measurestore.store.MeasureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LatestValueConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LatestValueConfiguration.class);

    /**
     * Recompute-per-call by default; {@code measurestore.latest.cache-enabled=true} adds a
     * cache invalidated by fact-store change notifications.
     */
    @Bean
    public LatestValueMaterializer latestValueMaterializer(
            MeasureStore store,
            FactStore factStore,
            @Value("${measurestore.latest.cache-enabled:false}") boolean cacheEnabled) {
        log.info("Latest-by-year materializer cache enabled={}", cacheEnabled);
        return cacheEnabled
            ? new LatestValueMaterializer(store, factStore)
            : new LatestValueMaterializer(store);
    }
}
