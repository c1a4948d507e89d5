package dev.relaygate.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Budget period. All calendar arithmetic is done in UTC.
 */
public enum BudgetPeriod {
    DAILY, WEEKLY, MONTHLY, QUARTERLY, ANNUAL, CUSTOM;

    /** End of the period that starts at {@code start}; CUSTOM has no implied end. */
    public Instant endAfter(Instant start) {
        ZonedDateTime s = start.atZone(ZoneOffset.UTC);
        return switch (this) {
            case DAILY -> s.plusDays(1).toInstant();
            case WEEKLY -> s.plusDays(7).toInstant();
            case MONTHLY -> s.plusMonths(1).toInstant();
            case QUARTERLY -> s.plusMonths(3).toInstant();
            case ANNUAL -> s.plusYears(1).toInstant();
            case CUSTOM -> throw new IllegalStateException("Custom periods have no implied end date");
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BudgetPeriod fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(v -> v.wireName().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid period: " + value));
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(BudgetPeriod::wireName).toList();
    }
}
