package dev.relaygate.infrastructure.ai;

import dev.relaygate.domain.valueobject.AiRequest;
import dev.relaygate.domain.valueobject.ProviderResponse;
import dev.relaygate.exception.ProviderException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.time.Instant;

/**
 * Calls one provider through its Spring AI {@link ChatModel}, guarded by that
 * provider's circuit breaker.
 *
 * <p>Failure classification for the dispatcher's retry:
 * <ul>
 *   <li>retryable: open breaker, network errors and timeouts, 5xx, 429 (also when wrapped in a
 *       {@link NonTransientAiException}), {@link TransientAiException}</li>
 *   <li>not retryable: other 4xx, {@link NonTransientAiException}, anything unexpected</li>
 * </ul>
 */
public class ChatModelProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelProviderClient.class);

    private final String provider;
    private final ChatModel chatModel;
    private final ProviderHealthTracker health;
    private final Integer maxOutputTokens;

    public ChatModelProviderClient(String provider, ChatModel chatModel, ProviderHealthTracker health,
                                   Integer maxOutputTokens) {
        this.provider = provider;
        this.chatModel = chatModel;
        this.health = health;
        this.maxOutputTokens = maxOutputTokens;
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public ProviderResponse call(String model, AiRequest request) {
        CircuitBreaker breaker = health.breakerFor(provider);
        Instant start = Instant.now();
        try {
            ChatResponse response = breaker.executeSupplier(() -> chatModel.call(prompt(model, request)));
            Duration latency = Duration.between(start, Instant.now());
            health.recordSuccess(provider, latency);
            log.debug("{}/{} answered in {}ms", provider, model, latency.toMillis());
            return toResponse(model, response, latency);
        } catch (RuntimeException e) {
            Duration latency = Duration.between(start, Instant.now());
            if (!(e instanceof CallNotPermittedException) && !ProviderHealthTracker.isCallerError(e))
                health.recordFailure(provider, latency);
            throw classify(model, e);
        }
    }

    // ── Internal ───────────────────────────────────────────────────

    private Prompt prompt(String model, AiRequest request) {
        ChatOptions.Builder options = ChatOptions.builder().model(model);
        if (maxOutputTokens != null) options.maxTokens(maxOutputTokens);
        return new Prompt(request.prompt(), options.build());
    }

    private ProviderResponse toResponse(String model, ChatResponse response, Duration latency) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null)
            throw new ProviderException(provider, "%s returned an empty response".formatted(provider), true);
        long promptTokens = 0;
        long completionTokens = 0;
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage != null) {
            Number p = usage.getPromptTokens();
            Number c = usage.getCompletionTokens();
            promptTokens = p != null ? p.longValue() : 0;
            completionTokens = c != null ? c.longValue() : 0;
        }
        String content = response.getResult().getOutput().getText();
        return new ProviderResponse(content != null ? content : "", provider, model,
                promptTokens, completionTokens, latency);
    }

    private ProviderException classify(String model, RuntimeException e) {
        if (e instanceof ProviderException pe) return pe;
        if (e instanceof CallNotPermittedException)
            return new ProviderException(provider, "Circuit breaker open for " + provider, true, e);
        if (e instanceof TransientAiException || e instanceof ResourceAccessException
                || e instanceof HttpServerErrorException)
            return new ProviderException(provider, "%s/%s failed: %s".formatted(provider, model, e.getMessage()), true, e);
        if (e instanceof HttpClientErrorException http)
            return new ProviderException(provider, "%s/%s rejected the request: %s".formatted(provider, model,
                    http.getStatusCode()), http.getStatusCode().value() == 429, e);
        // Spring AI reports every 4xx as non-transient; its message starts with the status code
        if (e instanceof NonTransientAiException)
            return new ProviderException(provider, "%s/%s rejected the request: %s".formatted(provider, model,
                    e.getMessage()), e.getMessage() != null && e.getMessage().startsWith("429"), e);
        log.error("Unexpected failure calling {}/{}", provider, model, e);
        return new ProviderException(provider, "%s/%s failed unexpectedly".formatted(provider, model), false, e);
    }
}
