package com.flagship.split_ledger.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.split_ledger.fx.RateCache;
import com.flagship.split_ledger.fx.StaticRateTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core wiring: clock, JSON mapper and the rate-resolution collaborators.
 *
 * The rate cache is a single explicit object injected into the resolver,
 * so tests can hand the resolver a fresh or pre-seeded instance.
 */
@Configuration
@EnableConfigurationProperties(FxProperties.class)
@Slf4j
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Mapper for API bodies and outbox payloads: java.time support, ISO-8601 dates.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public RateCache rateCache(Clock clock, FxProperties properties) {
        return new RateCache(clock, properties.cacheTtl());
    }

    @Bean
    public StaticRateTable staticRateTable(FxProperties properties) {
        StaticRateTable table = StaticRateTable.from(properties.staticTable());
        log.info("Static fallback rate table loaded: version={}, pairs={}", table.version(), table.size());
        return table;
    }

    /**
     * Bounded pool for rate-source queries so a hung query can be abandoned
     * without blocking the caller past its layer timeout.
     */
    @Bean(name = "rateLookupExecutor", destroyMethod = "shutdownNow")
    public ExecutorService rateLookupExecutor(@Value("${split-ledger.fx.lookup-threads:4}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "rate-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
