package dev.relaygate.domain.valueobject;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Final provider/model for one request and how it was chosen. Not persisted.
 *
 * @param prompt    the prompt after steering transforms
 * @param budgetId  budget the call will be charged to, or null when none applies
 * @param reasoning one entry per pipeline stage that influenced the choice
 */
public record RoutingDecision(String provider, String model, BigDecimal estimatedCost, List<String> reasoning,
                              UUID budgetId, String prompt, List<String> matchedRules) {

    public RoutingDecision {
        reasoning = List.copyOf(reasoning);
        matchedRules = matchedRules == null ? List.of() : List.copyOf(matchedRules);
    }

    public String reasoningText() {
        return String.join("; ", reasoning);
    }
}
