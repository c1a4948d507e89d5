package dev.relaygate.dto.request;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Create/update body for a budget. Every field is optional at the binding level;
 * the registry decides which are required so it can answer with a {@code required} hint.
 * Enum-valued fields stay strings for the same reason ({@code validTypes}, {@code validPeriods}).
 * Dates accept an ISO instant or a plain ISO date (midnight UTC).
 */
public record BudgetRequest(
        String name,
        String description,
        String scopeType,
        String scopeId,
        BigDecimal amount,
        String currency,
        String period,
        String startDate,
        String endDate,
        Boolean recurring,
        List<AlertRequest> alerts,
        List<String> tags,
        UUID parentBudgetId
) {
    public record AlertRequest(Double threshold, List<String> actions) {}
}
