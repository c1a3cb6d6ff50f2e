package com.quotagate.config;

import com.quotagate.algorithms.FixedWindowQuotaGate;
import com.quotagate.core.BucketFormat;
import com.quotagate.core.QuotaConfig;
import com.quotagate.core.QuotaGate;
import com.quotagate.storage.CounterStore;
import com.quotagate.storage.InMemoryCounterStore;
import com.quotagate.storage.RedisCounterStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Spring configuration for quota gate components
 */
@Slf4j
@Configuration
public class QuotaGateConfig {

    @Value("${storage.type:redis}")
    private String storageType;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.timeout-ms:2000}")
    private int redisTimeoutMs;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.database:0}")
    private int redisDatabase;

    @Value("${quota.requests-per-minute:60}")
    private long requestsPerMinute;

    @Value("${quota.tokens-per-minute:100000}")
    private long tokensPerMinute;

    @Value("${quota.requests-per-day:1000}")
    private long requestsPerDay;

    @Value("${quota.key-prefix:" + QuotaConfig.DEFAULT_KEY_PREFIX + "}")
    private String keyPrefix;

    @Value("${quota.bucket-format:epoch_index}")
    private String bucketFormat;

    @Value("${quota.zone:UTC}")
    private String zone;

    @Bean
    public CounterStore counterStore(Clock clock) {
        if ("memory".equalsIgnoreCase(storageType)) {
            log.warn("Using in-memory counter store: quotas are not shared across instances");
            return new InMemoryCounterStore(clock);
        }
        if (!"redis".equalsIgnoreCase(storageType)) {
            throw new IllegalArgumentException("Unknown storage.type: " + storageType);
        }
        log.info("Initializing Redis counter store at {}:{}", redisHost, redisPort);
        return new RedisCounterStore(redisHost, redisPort, redisTimeoutMs, redisPassword, redisDatabase);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * UTC clock shared by the gate and the in-memory store
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public QuotaConfig quotaConfig() {
        QuotaConfig config = QuotaConfig.builder()
                .requestsPerMinute(requestsPerMinute)
                .tokensPerMinute(tokensPerMinute)
                .requestsPerDay(requestsPerDay)
                .keyPrefix(keyPrefix)
                .bucketFormat(BucketFormat.valueOf(bucketFormat.trim().toUpperCase(Locale.ROOT)))
                .zone(ZoneId.of(zone))
                .build();
        config.validate();
        return config;
    }

    @Bean
    public QuotaGate quotaGate(
            CounterStore counterStore,
            QuotaConfig quotaConfig,
            MeterRegistry meterRegistry,
            Clock clock) {

        return new FixedWindowQuotaGate(counterStore, quotaConfig, meterRegistry, clock);
    }
}
