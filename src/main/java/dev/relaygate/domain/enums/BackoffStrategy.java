package dev.relaygate.domain.enums;

import java.time.Duration;

/**
 * Delay between retry attempts of a queued job. {@code attempt} is 1-based:
 * the delay before the second attempt is {@code delayFor(1, ...)}.
 */
public enum BackoffStrategy {
    FIXED, LINEAR, EXPONENTIAL;

    public Duration delayFor(int attempt, Duration base, Duration max) {
        int n = Math.max(1, attempt);
        long baseMillis = base.toMillis();
        long millis = switch (this) {
            case FIXED -> baseMillis;
            case LINEAR -> baseMillis * n;
            case EXPONENTIAL -> n >= 31 ? Long.MAX_VALUE : baseMillis * (1L << (n - 1));
        };
        if (millis < 0 || millis > max.toMillis()) return max;
        return Duration.ofMillis(millis);
    }
}
