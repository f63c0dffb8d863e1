package io.errorinsights.dashboard.engine;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.model.BucketGranularity;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.model.LogRecord;
import io.errorinsights.dashboard.model.TimeWindow;
import io.errorinsights.dashboard.model.TrendPoint;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the zero-filled, chronologically ordered trend series for a window.
 */
@Slf4j
@Component
public class TimeBucketingStage {

    private final BucketPolicy policy;
    private final String missingLabel;

    public TimeBucketingStage(BucketPolicy policy, QueryEngineProperties properties) {
        this.policy = policy;
        this.missingLabel = properties.getMissingLabel();
    }

    public List<TrendPoint> bucketTrend(List<LogRecord> records, TimeWindow window, LogField breakdownField) {
        BucketGranularity granularity = policy.granularityFor(window);
        Map<Instant, Tally> tallies = new LinkedHashMap<>();
        for (ZonedDateTime start : policy.bucketStarts(window)) {
            tallies.put(start.toInstant(), new Tally());
        }

        for (LogRecord record : records) {
            Instant timestamp = record.logDateTime();
            if (!window.contains(timestamp)) {
                continue;
            }
            Instant bucket = granularity.truncate(timestamp.atZone(policy.zone())).toInstant();
            Tally tally = tallies.get(bucket);
            if (tally == null) {
                log.debug("No bucket {} for record {}", bucket, record.id());
                continue;
            }
            tally.add(breakdownField == null ? null : breakdownField.textOr(record, missingLabel));
        }

        log.debug("Bucketed {} records into {} {} buckets", records.size(), tallies.size(), granularity);
        return tallies.entrySet().stream()
                .map(entry -> new TrendPoint(entry.getKey(), entry.getValue().count, entry.getValue().breakdown))
                .toList();
    }

    private static final class Tally {
        private long count;
        private final Map<String, Long> breakdown = new LinkedHashMap<>();

        void add(String breakdownKey) {
            count++;
            if (breakdownKey != null) {
                breakdown.merge(breakdownKey, 1L, Long::sum);
            }
        }
    }
}
