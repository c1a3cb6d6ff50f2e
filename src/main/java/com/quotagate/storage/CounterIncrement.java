package com.quotagate.storage;

import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * One increment within a batched write: add {@code delta} to {@code key}
 * and set its time-to-live to {@code ttl}.
 */
@Value
public class CounterIncrement {

    @NonNull
    String key;

    long delta;

    @NonNull
    Duration ttl;

    public static CounterIncrement of(String key, long delta, Duration ttl) {
        return new CounterIncrement(key, delta, ttl);
    }
}
