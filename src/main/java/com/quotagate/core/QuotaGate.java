package com.quotagate.core;

/**
 * Multi-tier quota check shared by every process using the same key prefix.
 * Implementations keep all mutable state in the external counter store and
 * are safe for unrestricted concurrent use.
 */
public interface QuotaGate {

    /**
     * Decide whether a unit of work costing {@code tokenCost} tokens may proceed
     * in the current minute and day windows, and record its cost if so.
     * A rejection is a normal result, not an exception.
     *
     * @param tokenCost non-negative token cost of the work about to be attempted
     * @return the decision with the current counters and reset durations
     * @throws com.quotagate.storage.StoreUnavailableException if the store could not be
     *         read or written; quota status is then unknown
     * @throws java.util.concurrent.CancellationException if the calling thread was
     *         interrupted before a store round trip
     */
    CheckResult checkAndIncrement(long tokenCost);

    /**
     * Read the counters of the current windows without changing them.
     */
    CheckResult getCurrentUsage();

    /**
     * Delete the counters of the current windows. Older windows expire on their own.
     * Mainly for tests and admin overrides.
     */
    void reset();
}
