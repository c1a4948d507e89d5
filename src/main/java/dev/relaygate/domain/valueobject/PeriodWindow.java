package dev.relaygate.domain.valueobject;

import java.time.Duration;
import java.time.Instant;

/** Half-open time window [start, end). */
public record PeriodWindow(Instant start, Instant end) {

    public boolean contains(Instant t) {
        return !t.isBefore(start) && t.isBefore(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }
}
