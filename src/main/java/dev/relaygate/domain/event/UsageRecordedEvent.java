package dev.relaygate.domain.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published inside the usage-write transaction. {@code lineage} is the debited
 * budget and all its ancestors, root first; their cached statuses go stale.
 */
public record UsageRecordedEvent(
        UUID usageRecordId,
        UUID budgetId,
        List<UUID> lineage,
        BigDecimal amount,
        Instant occurredAt
) {
    public UsageRecordedEvent {
        if (budgetId == null) throw new IllegalArgumentException("budgetId required");
        lineage = lineage == null ? List.of(budgetId) : List.copyOf(lineage);
        if (occurredAt == null) occurredAt = Instant.now();
    }
}
