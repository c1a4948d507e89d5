package dev.relaygate.steering;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum ConditionOperator {
    EQUALS, NOT_EQUALS,
    CONTAINS, NOT_CONTAINS,
    REGEX,
    GT, LT, GTE, LTE,
    IN, NOT_IN,
    EXISTS, NOT_EXISTS;

    /** Operators that are decided by the field alone. */
    public boolean requiresValue() {
        return this != EXISTS && this != NOT_EXISTS;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConditionOperator fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(v -> v.wireName().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition operator: " + value));
    }
}
