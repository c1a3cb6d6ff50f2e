package com.quotagate.core;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Renders the start of a minute or day window as the bucket part of a counter key.
 * Both formats grow lexically in step with time, so a later window never reuses
 * an earlier window's key.
 */
public enum BucketFormat {

    /**
     * Minutes since the epoch and days since the epoch.
     * Eight and five digits respectively until well past the year 2100.
     */
    EPOCH_INDEX {
        @Override
        public String minuteBucket(ZonedDateTime minuteStart) {
            return Long.toString(Math.floorDiv(minuteStart.toEpochSecond(), 60L));
        }

        @Override
        public String dayBucket(ZonedDateTime dayStart) {
            return Long.toString(dayStart.toLocalDate().toEpochDay());
        }
    },

    /**
     * {@code yyyy-MM-dd:HH:mm} and {@code yyyy-MM-dd}, matching keys written by
     * older deployments that share the store. Use a zone without DST transitions,
     * otherwise the repeated autumn hour maps onto the same minute buckets.
     */
    CALENDAR {
        @Override
        public String minuteBucket(ZonedDateTime minuteStart) {
            return Patterns.MINUTE.format(minuteStart);
        }

        @Override
        public String dayBucket(ZonedDateTime dayStart) {
            return Patterns.DAY.format(dayStart);
        }
    };

    public abstract String minuteBucket(ZonedDateTime minuteStart);

    public abstract String dayBucket(ZonedDateTime dayStart);

    private static final class Patterns {
        static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyyy-MM-dd:HH:mm");
        static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    }
}
