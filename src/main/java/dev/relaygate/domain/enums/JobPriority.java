package dev.relaygate.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/** Queue priority. Lower level is dequeued first. */
public enum JobPriority {
    HIGH(1), NORMAL(2), LOW(3);

    private final int level;
    JobPriority(int level) { this.level = level; }

    public int level() { return level; }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobPriority fromWire(Object value) {
        if (value == null) return NORMAL;
        if (value instanceof Number n) {
            return Arrays.stream(values()).filter(p -> p.level == n.intValue()).findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Invalid priority: " + value));
        }
        return Arrays.stream(values())
                .filter(p -> p.wireName().equalsIgnoreCase(value.toString().trim())
                        || String.valueOf(p.level).equals(value.toString().trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid priority: " + value));
    }
}
