package dev.relaygate.cache;

import dev.relaygate.domain.valueobject.ProviderResponse;

public record CacheHit(ProviderResponse response, double similarity, String storedPrompt) {
}
