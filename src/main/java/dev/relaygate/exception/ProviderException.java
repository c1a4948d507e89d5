package dev.relaygate.exception;

import org.springframework.http.HttpStatus;

/**
 * Upstream provider failure. {@code retryable} marks transient failures
 * (network, timeout, 5xx, 429) that the dispatcher may retry.
 */
public class ProviderException extends GatewayException {

    private final String provider;
    private final boolean retryable;

    public ProviderException(String provider, String message, boolean retryable, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "provider-error", "Provider Error", message, cause);
        this.provider = provider;
        this.retryable = retryable;
        property("provider", provider);
        property("retryable", retryable);
    }

    public ProviderException(String provider, String message, boolean retryable) {
        this(provider, message, retryable, null);
    }

    public String getProvider() {
        return provider;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
