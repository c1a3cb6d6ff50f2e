package com.quotagate.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Process-local counter store.
 *
 * Same contract as the Redis store, but only coordinates callers inside one JVM.
 * Useful for single-instance deployments and as a fake in tests. Entries expire
 * after their own TTL measured on the supplied clock.
 */
@Slf4j
public class InMemoryCounterStore implements CounterStore {

    private final Cache<String, StoredCounter> counters;

    public InMemoryCounterStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCounterStore(Clock clock) {
        this.counters = Caffeine.newBuilder()
                .expireAfter(new TtlExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
        log.info("In-memory counter store initialized");
    }

    @Override
    public Map<String, String> batchGet(List<String> keys) {
        Map<String, String> found = new HashMap<>();
        counters.getAllPresent(keys)
                .forEach((key, counter) -> found.put(key, String.valueOf(counter.getValue())));
        return found;
    }

    @Override
    public void batchIncrementAndExpire(List<CounterIncrement> increments) {
        for (CounterIncrement increment : increments) {
            // compute() sees an expired entry as absent, so a stale bucket restarts at delta
            counters.asMap().compute(increment.getKey(), (key, existing) -> new StoredCounter(
                    existing == null ? increment.getDelta() : existing.getValue() + increment.getDelta(),
                    increment.getTtl()));
        }
    }

    @Override
    public void delete(List<String> keys) {
        counters.invalidateAll(keys);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Value
    private static class StoredCounter {
        long value;
        Duration ttl;
    }

    /**
     * Every write replaces the expiration with the entry's TTL; reads leave it alone
     */
    private static class TtlExpiry implements Expiry<String, StoredCounter> {

        @Override
        public long expireAfterCreate(String key, StoredCounter counter, long currentTime) {
            return counter.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, StoredCounter counter, long currentTime, long currentDuration) {
            return counter.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, StoredCounter counter, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
