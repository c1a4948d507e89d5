package dev.relaygate.domain.valueobject;

import java.time.Duration;

public record ProviderResponse(String content, String provider, String model,
                               long promptTokens, long completionTokens, Duration latency) {

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
