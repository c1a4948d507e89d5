package dev.relaygate.dto.response;

import dev.relaygate.domain.entity.UsageRecord;
import dev.relaygate.domain.enums.UsageSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record UsageRecordResponse(UUID id, UUID budgetId, BigDecimal amount, String currency, UsageSource source,
                                  String description, String requestId, String provider, String model,
                                  Instant timestamp) {

    public static UsageRecordResponse from(UsageRecord r) {
        return new UsageRecordResponse(r.getId(), r.getBudgetId(), r.getAmount(), r.getCurrency(), r.getSource(),
                r.getDescription(), r.getRequestId(), r.getProvider(), r.getModel(), r.getTimestamp());
    }
}
