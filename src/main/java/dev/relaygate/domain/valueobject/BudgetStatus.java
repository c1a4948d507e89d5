package dev.relaygate.domain.valueobject;

import dev.relaygate.domain.enums.StatusLevel;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Derived view of a budget for its current period. {@code consumed} includes
 * every descendant budget's usage; {@code remaining} goes negative on overshoot.
 */
public record BudgetStatus(UUID budgetId, String currency, BigDecimal consumed, BigDecimal limit,
                           BigDecimal remaining, double percentUsed, StatusLevel level,
                           Instant periodStart, Instant periodEnd, long daysRemaining,
                           BigDecimal burnRate, BigDecimal projectedTotal,
                           List<BudgetAlert> triggeredAlerts, Instant computedAt) {
}
