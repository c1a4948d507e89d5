package dev.relaygate.steering;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How a rule combines its conditions. Empty AND is true, empty OR is false. */
public enum Combinator {
    AND, OR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Combinator fromWire(String value) {
        if (value == null || value.isBlank()) return AND;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "and" -> AND;
            case "or" -> OR;
            default -> throw new IllegalArgumentException("Unknown rule operator: " + value);
        };
    }
}
