package dev.relaygate.infrastructure.ai;

import dev.relaygate.domain.enums.ProviderStatus;

public record ProviderHealth(String provider, long requests, long errors, double errorRate,
                             double averageLatencyMs, String circuitState, double healthScore,
                             ProviderStatus status) {
}
