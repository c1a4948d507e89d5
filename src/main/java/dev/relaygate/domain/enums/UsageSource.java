package dev.relaygate.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

public enum UsageSource {
    GATEWAY_INTERNAL("gateway-internal"),
    EXTERNAL_CALLER("external-caller"),
    MANUAL("manual");

    private final String wireName;
    UsageSource(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static UsageSource fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(v -> v.wireName.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid usage source: " + value));
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(UsageSource::wireName).toList();
    }
}
