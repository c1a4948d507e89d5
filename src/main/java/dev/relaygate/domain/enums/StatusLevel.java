package dev.relaygate.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Budget health derived from percent used. */
public enum StatusLevel {
    NORMAL, WARNING, CRITICAL, EXCEEDED;

    public static StatusLevel of(double percentUsed, double warningPercent, double criticalPercent) {
        if (percentUsed >= 100.0) return EXCEEDED;
        if (percentUsed >= criticalPercent) return CRITICAL;
        if (percentUsed >= warningPercent) return WARNING;
        return NORMAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
