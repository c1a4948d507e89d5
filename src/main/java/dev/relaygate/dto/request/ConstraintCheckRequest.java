package dev.relaygate.dto.request;

import java.math.BigDecimal;

public record ConstraintCheckRequest(BigDecimal estimatedCost) {
}
