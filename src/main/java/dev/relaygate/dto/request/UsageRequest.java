package dev.relaygate.dto.request;

import java.math.BigDecimal;

/** Body of a usage write. Source and timestamp stay strings so bad values get a hint, not a parse error. */
public record UsageRequest(BigDecimal amount, String currency, String source, String timestamp,
                           String description, String requestId, String provider, String model) {
}
