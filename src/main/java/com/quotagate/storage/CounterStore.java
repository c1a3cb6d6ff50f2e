package com.quotagate.storage;

import java.util.List;
import java.util.Map;

/**
 * Shared counter store (Redis, in-memory, etc.)
 * The store serializes individual commands; callers rely on that and nothing more.
 *
 * Every operation fails with {@link StoreUnavailableException} when the round trip
 * cannot be completed. An absent key is never an error.
 */
public interface CounterStore {

    /**
     * Read several counters in one round trip.
     *
     * @param keys counter keys
     * @return raw stored values; absent or expired keys are missing from the map
     */
    Map<String, String> batchGet(List<String> keys);

    /**
     * Increment several counters and refresh their expirations in one round trip.
     * An absent counter is created at its delta.
     * The operations need not be atomic with respect to each other.
     */
    void batchIncrementAndExpire(List<CounterIncrement> increments);

    /**
     * Delete keys. Succeeds for keys that do not exist.
     */
    void delete(List<String> keys);

    /**
     * Health check
     */
    boolean isAvailable();
}
