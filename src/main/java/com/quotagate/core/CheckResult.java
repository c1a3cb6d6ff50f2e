package com.quotagate.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of a quota check or a usage read. Never persisted.
 *
 * Counters are post-increment when the call was admitted and the values read
 * from the store otherwise. A reset duration of {@link Duration#ZERO} means it
 * was not populated for this outcome.
 */
@Value
@Builder
public class CheckResult {

    /**
     * False both for rejections and for usage reads, which assert no decision
     */
    boolean allowed;

    long currentRequests;

    long currentTokens;

    long currentDayRequests;

    @Builder.Default
    Duration resetMinute = Duration.ZERO;

    @Builder.Default
    Duration resetDay = Duration.ZERO;

    /**
     * Which ceiling was hit, with observed and limit values. Null unless rejected.
     */
    String rejectionReason;

    QuotaCeiling exceededCeiling;

    /**
     * How long a rejected caller should wait before the violated window rolls over
     */
    public Duration getRetryAfter() {
        if (exceededCeiling == null) {
            return Duration.ZERO;
        }
        return exceededCeiling.isMinuteWindow() ? resetMinute : resetDay;
    }
}
