package dev.relaygate.domain.valueobject;

import dev.relaygate.domain.enums.AlertAction;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of checking an estimated spend against a budget and all its ancestors.
 *
 * <p>{@code wouldExceed} is true when any level's limit would be crossed.
 * {@code allowed} is additionally false when the target budget's highest crossed
 * alert asks to block or to require approval. {@code remaining} is the tightest
 * headroom along the lineage.
 */
public record ConstraintCheck(UUID budgetId, boolean allowed, BigDecimal remaining, boolean wouldExceed,
                              BigDecimal estimatedCost, String currency, String reason,
                              List<AlertAction> suggestedActions,
                              List<HierarchyViolation> hierarchyViolations) {

    public record HierarchyViolation(UUID budgetId, String name, BigDecimal limit, BigDecimal consumed,
                                     BigDecimal requested) {}

    public List<UUID> violatingBudgetIds() {
        return hierarchyViolations.stream().map(HierarchyViolation::budgetId).toList();
    }
}
