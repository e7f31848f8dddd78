package com.kreasipositif.ledgerimporter.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j bulkhead configuration.
 *
 * <p>A single <b>SemaphoreBulkhead</b> caps concurrent calls to the external market-data
 * providers. Rate-limited free tiers (Alpha Vantage, RapidAPI) reject bursts, so a refresh
 * storm is cut off locally instead of being forwarded.
 *
 * <p>Values come from {@code application.yml} under {@code resilience4j.bulkhead.*}.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    @Value("${resilience4j.bulkhead.instances.marketDataBulkhead.max-concurrent-calls:4}")
    private int marketDataMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.marketDataBulkhead.max-wait-duration:250ms}")
    private Duration marketDataMaxWait;

    // ─── Beans ───────────────────────────────────────────────────────────────

    @Bean("marketDataBulkhead")
    public Bulkhead marketDataBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(marketDataMaxConcurrent)
                .maxWaitDuration(marketDataMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("marketDataBulkhead", cfg);
        log.info("SemaphoreBulkhead 'marketDataBulkhead' created, maxConcurrent={}, maxWait={}",
                marketDataMaxConcurrent, marketDataMaxWait);
        return bh;
    }

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }
}
