package dev.relaygate.infrastructure.ai;

import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.domain.valueobject.ProviderResponse;

/**
 * A single upstream provider. Implementations translate every failure into
 * {@link dev.relaygate.exception.ProviderException} with the retryable flag set
 * for transient causes.
 */
public interface ProviderClient {

    String provider();

    ProviderResponse call(String model, AiRequest request);
}
