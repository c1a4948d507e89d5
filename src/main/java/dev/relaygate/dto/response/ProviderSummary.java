package dev.relaygate.dto.response;

import dev.relaygate.infrastructure.ai.ModelSpec;
import dev.relaygate.infrastructure.ai.ProviderHealth;

import java.util.List;

public record ProviderSummary(String name, boolean available, String fallback, ProviderHealth health,
                              List<ModelSpec> models) {
}
