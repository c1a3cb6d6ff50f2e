package com.quotagate.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Ceilings and key layout for a quota gate.
 * Immutable and shared read-only by every call.
 */
@Value
@Builder
public class QuotaConfig {

    public static final String DEFAULT_KEY_PREFIX = "gemini:ratelimit";

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration DAY = Duration.ofDays(1);

    /**
     * Maximum admitted requests per calendar minute
     */
    long requestsPerMinute;

    /**
     * Maximum tokens consumed per calendar minute
     */
    long tokensPerMinute;

    /**
     * Maximum admitted requests per calendar day
     */
    long requestsPerDay;

    /**
     * Namespace shared by every process enforcing the same quota
     */
    @Builder.Default
    String keyPrefix = DEFAULT_KEY_PREFIX;

    @Builder.Default
    BucketFormat bucketFormat = BucketFormat.EPOCH_INDEX;

    /**
     * Zone in which minutes and days are truncated
     */
    @Builder.Default
    ZoneId zone = ZoneOffset.UTC;

    /**
     * Expiration refreshed on both minute counters after every admitted call.
     * At least twice the window so late writers and skewed clocks still land.
     */
    @Builder.Default
    Duration minuteKeyTtl = Duration.ofMinutes(2);

    @Builder.Default
    Duration dayKeyTtl = Duration.ofHours(25);

    public void validate() {
        if (requestsPerMinute < 0) {
            throw new IllegalArgumentException("requestsPerMinute cannot be negative");
        }
        if (tokensPerMinute < 0) {
            throw new IllegalArgumentException("tokensPerMinute cannot be negative");
        }
        if (requestsPerDay < 0) {
            throw new IllegalArgumentException("requestsPerDay cannot be negative");
        }
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("keyPrefix must not be blank");
        }
        if (bucketFormat == null || zone == null) {
            throw new IllegalArgumentException("bucketFormat and zone are required");
        }
        if (minuteKeyTtl == null || minuteKeyTtl.compareTo(MINUTE.multipliedBy(2)) < 0) {
            throw new IllegalArgumentException("minuteKeyTtl must be at least two minutes");
        }
        if (dayKeyTtl == null || dayKeyTtl.compareTo(DAY) <= 0) {
            throw new IllegalArgumentException("dayKeyTtl must be longer than one day");
        }
    }

    /**
     * Quick factory using the default key layout
     */
    public static QuotaConfig of(long requestsPerMinute, long tokensPerMinute, long requestsPerDay) {
        return QuotaConfig.builder()
                .requestsPerMinute(requestsPerMinute)
                .tokensPerMinute(tokensPerMinute)
                .requestsPerDay(requestsPerDay)
                .build();
    }
}
