package com.quotagate.algorithms;

import com.quotagate.core.QuotaConfig;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Counter keys and rollover times of the minute and day windows containing one instant.
 *
 * Key layout, shared with every deployment using the same store:
 * <pre>
 *   {prefix}:minute:{minute-bucket}
 *   {prefix}:tokens:minute:{minute-bucket}
 *   {prefix}:day:{day-bucket}
 * </pre>
 */
@Value
public class QuotaWindows {

    String minuteRequestsKey;

    String minuteTokensKey;

    String dayRequestsKey;

    /**
     * Time left until the next minute boundary
     */
    Duration untilMinuteReset;

    /**
     * Time left until the next day boundary
     */
    Duration untilDayReset;

    public static QuotaWindows at(Instant now, QuotaConfig config) {
        ZonedDateTime local = now.atZone(config.getZone());
        ZonedDateTime minuteStart = local.truncatedTo(ChronoUnit.MINUTES);
        ZonedDateTime dayStart = local.truncatedTo(ChronoUnit.DAYS);

        String minuteBucket = config.getBucketFormat().minuteBucket(minuteStart);
        String dayBucket = config.getBucketFormat().dayBucket(dayStart);
        String prefix = config.getKeyPrefix();

        return new QuotaWindows(
                prefix + ":minute:" + minuteBucket,
                prefix + ":tokens:minute:" + minuteBucket,
                prefix + ":day:" + dayBucket,
                Duration.between(now, minuteStart.plusMinutes(1).toInstant()),
                Duration.between(now, dayStart.plusDays(1).toInstant()));
    }

    /**
     * All three keys, in read order: minute requests, minute tokens, day requests
     */
    public List<String> keys() {
        return List.of(minuteRequestsKey, minuteTokensKey, dayRequestsKey);
    }
}
