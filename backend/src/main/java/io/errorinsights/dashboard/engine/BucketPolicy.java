package io.errorinsights.dashboard.engine;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.model.BucketGranularity;
import io.errorinsights.dashboard.model.TimeWindow;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Picks the trend bucket size from the length of the requested window and lays out the bucket starts.
 */
@Component
public class BucketPolicy {

    private final ZoneId zone;
    private final Duration dayThreshold;
    private final Duration halfHourThreshold;
    private final int maxBuckets;

    public BucketPolicy(QueryEngineProperties properties) {
        this.zone = properties.zoneId();
        this.dayThreshold = properties.getDayThreshold();
        this.halfHourThreshold = properties.getHalfHourThreshold();
        this.maxBuckets = properties.getMaxBuckets();
    }

    public BucketGranularity granularityFor(TimeWindow window) {
        Duration span = window.span();
        if (span.compareTo(dayThreshold) > 0) {
            return BucketGranularity.DAY;
        }
        if (span.compareTo(halfHourThreshold) > 0) {
            return BucketGranularity.HOUR;
        }
        return BucketGranularity.HALF_HOUR;
    }

    /**
     * Number of buckets covering the window, counting at most {@code maxBuckets + 1}.
     */
    public int bucketCount(TimeWindow window) {
        BucketGranularity granularity = granularityFor(window);
        ZonedDateTime cursor = granularity.truncate(window.from().atZone(zone));
        ZonedDateTime last = granularity.truncate(window.to().atZone(zone));
        int count = 0;
        while (!cursor.isAfter(last) && count <= maxBuckets) {
            count++;
            cursor = granularity.next(cursor);
        }
        return count;
    }

    public void checkBucketCount(TimeWindow window) {
        if (bucketCount(window) > maxBuckets) {
            throw QueryException.invalidArgument("Time window " + window.from() + " .. " + window.to()
                    + " needs more than " + maxBuckets + " " + granularityFor(window) + " buckets");
        }
    }

    /**
     * Contiguous bucket starts from the bucket holding {@code window.from()} to the one holding {@code window.to()}.
     */
    public List<ZonedDateTime> bucketStarts(TimeWindow window) {
        BucketGranularity granularity = granularityFor(window);
        ZonedDateTime cursor = granularity.truncate(window.from().atZone(zone));
        ZonedDateTime last = granularity.truncate(window.to().atZone(zone));
        List<ZonedDateTime> starts = new ArrayList<>();
        while (!cursor.isAfter(last)) {
            starts.add(cursor);
            cursor = granularity.next(cursor);
        }
        return starts;
    }

    public ZoneId zone() {
        return zone;
    }
}
