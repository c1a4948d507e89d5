package dev.relaygate.domain.valueobject;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record UsageSummary(UUID budgetId, BigDecimal totalAmount, String currency, long recordCount,
                           BigDecimal averagePerDay, Map<String, BigDecimal> bySource,
                           Instant startDate, Instant endDate) {
}
