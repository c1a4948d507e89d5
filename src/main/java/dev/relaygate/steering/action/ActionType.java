package dev.relaygate.steering.action;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ActionType {
    ROUTE, REJECT, TRANSFORM, INJECT, LOG;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Empty for types this build does not know; those are kept as {@link UnsupportedAction}. */
    public static Optional<ActionType> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.wireName().equalsIgnoreCase(value.trim())).findFirst();
    }
}
