package dev.relaygate.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Organizational level a budget applies to. Rank encodes containment:
 * organization ⊇ team ⊇ user/project.
 */
public enum ScopeType {
    ORGANIZATION(0), TEAM(1), USER(2), PROJECT(2);

    private final int rank;
    ScopeType(int rank) { this.rank = rank; }

    public boolean canParent(ScopeType child) {
        return this.rank < child.rank;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScopeType fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(v -> v.wireName().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid scope type: " + value));
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(ScopeType::wireName).toList();
    }
}
