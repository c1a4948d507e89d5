package dev.relaygate.dto.response;

import dev.relaygate.domain.entity.Budget;
import dev.relaygate.domain.enums.BudgetPeriod;
import dev.relaygate.domain.enums.ScopeType;
import dev.relaygate.domain.valueobject.BudgetAlert;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record BudgetResponse(
        UUID id, String name, String description, ScopeType scopeType, String scopeId,
        BigDecimal amount, String currency, BudgetPeriod period, Instant startDate, Instant endDate,
        boolean recurring, List<BudgetAlert> alerts, List<String> tags, String createdBy,
        UUID parentBudgetId, boolean active, Long version, Instant createdAt, Instant updatedAt
) {
    public static BudgetResponse from(Budget b) {
        return new BudgetResponse(b.getId(), b.getName(), b.getDescription(), b.getScopeType(), b.getScopeId(),
                b.getAmount(), b.getCurrency(), b.getPeriod(), b.getStartDate(), b.getEndDate(), b.isRecurring(),
                b.getAlerts(), b.getTags(), b.getCreatedBy(), b.getParentBudgetId(), b.isActive(), b.getVersion(),
                b.getCreatedAt(), b.getUpdatedAt());
    }
}
