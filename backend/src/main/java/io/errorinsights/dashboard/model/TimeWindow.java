package io.errorinsights.dashboard.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive time range {@code [from, to]}.
 */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after its end " + to);
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(from) && !instant.isAfter(to);
    }

    public Duration span() {
        return Duration.between(from, to);
    }
}
