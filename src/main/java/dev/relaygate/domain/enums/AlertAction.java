package dev.relaygate.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** What a budget alert asks the gateway to do once its threshold is crossed. */
public enum AlertAction {
    NOTIFY("notify"),
    RESTRICT_MODELS("restrict-models"),
    REQUIRE_APPROVAL("require-approval"),
    BLOCK_ALL("block-all"),
    AUTO_DOWNGRADE("auto-downgrade");

    private final String wireName;
    AlertAction(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static AlertAction fromWire(String value) {
        return Arrays.stream(values())
                .filter(v -> v.wireName.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid alert action: " + value));
    }
}
