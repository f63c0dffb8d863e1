package io.errorinsights.dashboard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.engine.QueryException;
import io.errorinsights.dashboard.model.TimeWindow;
import io.errorinsights.dashboard.service.dto.LogsQueryRequest.TimeRange;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimeWindowResolverTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    private TimeWindowResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TimeWindowResolver(Clock.fixed(NOW, ZoneOffset.UTC), new QueryEngineProperties());
    }

    @Test
    void intervalEndsNow() {
        TimeWindow window = resolver.resolve(null, "7 days").orElseThrow();

        assertThat(window.from()).isEqualTo(Instant.parse("2024-05-03T12:00:00Z"));
        assertThat(window.to()).isEqualTo(NOW);
    }

    @Test
    void acceptsShortUnits() {
        assertThat(resolver.resolve(null, "3h").orElseThrow().from()).isEqualTo(Instant.parse("2024-05-10T09:00:00Z"));
        assertThat(resolver.resolve(null, "1 month").orElseThrow().from()).isEqualTo(Instant.parse("2024-04-10T12:00:00Z"));
    }

    @Test
    void calendarDatesCoverWholeDays() {
        TimeWindow window = resolver.resolve(new TimeRange("2024-05-01", "2024-05-03"), null).orElseThrow();

        assertThat(window.from()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
        assertThat(window.to()).isEqualTo(Instant.parse("2024-05-03T23:59:59.999999999Z"));
    }

    @Test
    void missingEndMeansNow() {
        TimeWindow window = resolver.resolve(new TimeRange("2024-05-09T08:00:00Z", null), null).orElseThrow();

        assertThat(window.to()).isEqualTo(NOW);
    }

    @Test
    void noWindowWhenNothingGiven() {
        assertThat(resolver.resolve(null, null)).isEmpty();
        assertThat(resolver.resolve(new TimeRange(" ", ""), " ")).isEmpty();
    }

    @Test
    void rejectsBadInput() {
        assertThatThrownBy(() -> resolver.resolve(new TimeRange("2024-05-01", null), "7 days"))
                .isInstanceOf(QueryException.class);
        assertThatThrownBy(() -> resolver.resolve(null, "seven days")).isInstanceOf(QueryException.class);
        assertThatThrownBy(() -> resolver.resolve(null, "0 days")).isInstanceOf(QueryException.class);
        assertThatThrownBy(() -> resolver.resolve(null, "5 fortnights")).isInstanceOf(QueryException.class);
        assertThatThrownBy(() -> resolver.resolve(new TimeRange("2024-05-05", "2024-05-01"), null))
                .isInstanceOf(QueryException.class);
        assertThatThrownBy(() -> resolver.resolve(new TimeRange("yesterday", null), null))
                .isInstanceOf(QueryException.class);
        assertThatThrownBy(() -> resolver.resolve(new TimeRange(null, "2024-05-01"), null))
                .isInstanceOf(QueryException.class);
    }
}
