package io.errorinsights.dashboard.service;

import io.errorinsights.dashboard.config.QueryEngineProperties;
import io.errorinsights.dashboard.engine.QueryException;
import io.errorinsights.dashboard.model.TimeWindow;
import io.errorinsights.dashboard.service.dto.LogsQueryRequest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns either a relative interval ("7 days") or an explicit from/to pair into an inclusive window.
 * Calendar dates are widened to whole days in the configured zone.
 */
@Component
public class TimeWindowResolver {

    private static final Pattern INTERVAL = Pattern.compile("^(\\d+)\\s*([a-z]+)$");

    private final Clock clock;
    private final ZoneId zone;

    public TimeWindowResolver(Clock clock, QueryEngineProperties properties) {
        this.clock = clock;
        this.zone = properties.zoneId();
    }

    public Optional<TimeWindow> resolve(LogsQueryRequest.TimeRange range, String interval) {
        boolean hasRange = range != null && (StringUtils.hasText(range.from()) || StringUtils.hasText(range.to()));
        boolean hasInterval = StringUtils.hasText(interval);
        if (hasRange && hasInterval) {
            throw QueryException.invalidArgument("Specify either timeWindow or interval, not both");
        }
        if (hasInterval) {
            return Optional.of(fromInterval(interval));
        }
        if (hasRange) {
            return Optional.of(fromRange(range));
        }
        return Optional.empty();
    }

    TimeWindow fromInterval(String interval) {
        Matcher matcher = INTERVAL.matcher(interval.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw QueryException.invalidArgument("Malformed interval '" + interval + "'");
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw QueryException.invalidArgument("Malformed interval '" + interval + "'", e);
        }
        if (amount <= 0) {
            throw QueryException.invalidArgument("Interval must be positive: '" + interval + "'");
        }
        ZonedDateTime now = clock.instant().atZone(zone);
        ZonedDateTime start;
        try {
            start = switch (matcher.group(2)) {
                case "minute", "minutes", "min", "mins" -> now.minusMinutes(amount);
                case "hour", "hours", "h" -> now.minusHours(amount);
                case "day", "days", "d" -> now.minusDays(amount);
                case "week", "weeks", "w" -> now.minusWeeks(amount);
                case "month", "months", "mon", "mons" -> now.minusMonths(amount);
                default -> throw QueryException.invalidArgument("Unknown interval unit in '" + interval + "'");
            };
        } catch (DateTimeException | ArithmeticException e) {
            throw QueryException.invalidArgument("Interval '" + interval + "' is out of range", e);
        }
        return new TimeWindow(start.toInstant(), now.toInstant());
    }

    TimeWindow fromRange(LogsQueryRequest.TimeRange range) {
        if (!StringUtils.hasText(range.from())) {
            throw QueryException.invalidArgument("timeWindow.from is required when timeWindow is given");
        }
        Instant from = parse(range.from(), false);
        Instant to = StringUtils.hasText(range.to()) ? parse(range.to(), true) : clock.instant();
        if (from.isAfter(to)) {
            throw QueryException.invalidArgument("timeWindow.from " + range.from() + " is after timeWindow.to " + range.to());
        }
        return new TimeWindow(from, to);
    }

    private Instant parse(String value, boolean endOfDay) {
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time, try the local forms below
        }
        try {
            return LocalDateTime.parse(text).atZone(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            // not a local date-time either
        }
        try {
            LocalDate date = LocalDate.parse(text);
            return endOfDay
                    ? date.atTime(LocalTime.MAX).atZone(zone).toInstant()
                    : date.atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw QueryException.invalidArgument("Unparsable timestamp '" + value + "'", e);
        }
    }
}
