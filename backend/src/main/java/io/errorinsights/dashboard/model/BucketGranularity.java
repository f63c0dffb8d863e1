package io.errorinsights.dashboard.model;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

public enum BucketGranularity {

    DAY {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            return time.toLocalDate().atStartOfDay(time.getZone());
        }

        @Override
        public ZonedDateTime next(ZonedDateTime bucketStart) {
            return bucketStart.toLocalDate().plusDays(1).atStartOfDay(bucketStart.getZone());
        }
    },
    HOUR {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            return time.truncatedTo(ChronoUnit.HOURS);
        }

        @Override
        public ZonedDateTime next(ZonedDateTime bucketStart) {
            return bucketStart.plusHours(1);
        }
    },
    HALF_HOUR {
        @Override
        public ZonedDateTime truncate(ZonedDateTime time) {
            ZonedDateTime hour = time.truncatedTo(ChronoUnit.HOURS);
            return time.getMinute() < 30 ? hour : hour.plusMinutes(30);
        }

        @Override
        public ZonedDateTime next(ZonedDateTime bucketStart) {
            return bucketStart.plusMinutes(30);
        }
    };

    /** Start of the bucket containing {@code time}. */
    public abstract ZonedDateTime truncate(ZonedDateTime time);

    /** Start of the bucket following the one starting at {@code bucketStart}. */
    public abstract ZonedDateTime next(ZonedDateTime bucketStart);
}
