package io.errorinsights.dashboard.config;

import java.time.Duration;
import java.time.ZoneId;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.query")
public class QueryEngineProperties {

    private int defaultPageSize = 100;

    private int maxPageSize = 1000;

    /** Label used for groups and breakdown entries whose field value is missing. */
    private String missingLabel = "N/A";

    /** Zone used for calendar dates in requests and for trend bucket boundaries. */
    private String zone = "UTC";

    /** Windows longer than this are bucketed per day. */
    private Duration dayThreshold = Duration.ofHours(48);

    /** Windows longer than this (and not longer than the day threshold) are bucketed per hour, shorter ones per half hour. */
    private Duration halfHourThreshold = Duration.ofHours(12);

    private int maxBuckets = 5000;

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
