package dev.relaygate.config;

import dev.relaygate.domain.enums.BackoffStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Gateway tuning. Unset values fall back to the selected {@link GatewayPreset};
 * the resolved values are range-checked here so a bad config fails startup
 * instead of the first request.
 */
@ConfigurationProperties(prefix = "relaygate")
public record GatewayProperties(GatewayPreset preset, Cache cache, Queue queue,
                                Alerts alerts, Breaker circuitBreaker, RateLimit rateLimit,
                                int batchConcurrency) {

    public GatewayProperties {
        if (preset == null) preset = GatewayPreset.DEVELOPMENT;
        cache = Cache.resolve(cache, preset);
        queue = Queue.resolve(queue, preset);
        alerts = Alerts.resolve(alerts, preset);
        circuitBreaker = Breaker.resolve(circuitBreaker, preset);
        rateLimit = RateLimit.resolve(rateLimit, preset);
        if (batchConcurrency <= 0) batchConcurrency = 5;
    }

    /** Internal error detail is only rendered to callers in development. */
    public boolean exposeErrorDetails() {
        return preset == GatewayPreset.DEVELOPMENT;
    }

    public record Cache(Boolean enabled, Double similarityThreshold, Integer maxSize, Duration ttl,
                        Integer embeddingMemoSize, Duration cleanupInterval) {

        static Cache resolve(Cache c, GatewayPreset preset) {
            GatewayPreset.CacheDefaults d = preset.cache();
            Cache source = c != null ? c : new Cache(null, null, null, null, null, null);
            Cache resolved = new Cache(
                    source.enabled != null ? source.enabled : Boolean.TRUE,
                    source.similarityThreshold != null ? source.similarityThreshold : d.similarityThreshold(),
                    source.maxSize != null ? source.maxSize : d.maxSize(),
                    source.ttl != null ? source.ttl : d.ttl(),
                    source.embeddingMemoSize != null ? source.embeddingMemoSize : 1000,
                    source.cleanupInterval != null ? source.cleanupInterval : Duration.ofMinutes(5));
            if (resolved.similarityThreshold < 0 || resolved.similarityThreshold > 1)
                throw new IllegalArgumentException(
                        "relaygate.cache.similarity-threshold must be within [0,1] but was " + resolved.similarityThreshold);
            if (resolved.maxSize <= 0)
                throw new IllegalArgumentException("relaygate.cache.max-size must be positive");
            if (resolved.ttl.isNegative() || resolved.ttl.isZero())
                throw new IllegalArgumentException("relaygate.cache.ttl must be positive");
            return resolved;
        }
    }

    public record Queue(Integer maxSize, Map<String, Integer> concurrency, Duration timeout,
                       Integer maxAttempts, BackoffStrategy backoff, Duration retryDelay,
                       Duration maxRetryDelay) {

        static Queue resolve(Queue q, GatewayPreset preset) {
            GatewayPreset.QueueDefaults d = preset.queue();
            Queue source = q != null ? q : new Queue(null, null, null, null, null, null, null);
            Map<String, Integer> concurrency = new HashMap<>(d.concurrency());
            if (source.concurrency != null) concurrency.putAll(source.concurrency);
            Queue resolved = new Queue(
                    source.maxSize != null ? source.maxSize : d.maxSize(),
                    Map.copyOf(concurrency),
                    source.timeout != null ? source.timeout : d.timeout(),
                    source.maxAttempts != null ? source.maxAttempts : d.maxAttempts(),
                    source.backoff != null ? source.backoff : BackoffStrategy.EXPONENTIAL,
                    source.retryDelay != null ? source.retryDelay : d.retryDelay(),
                    source.maxRetryDelay != null ? source.maxRetryDelay : d.maxRetryDelay());
            if (resolved.maxSize <= 0)
                throw new IllegalArgumentException("relaygate.queue.max-size must be positive");
            if (resolved.maxAttempts < 1)
                throw new IllegalArgumentException("relaygate.queue.max-attempts must be at least 1");
            resolved.concurrency.forEach((provider, workers) -> {
                if (workers == null || workers < 1)
                    throw new IllegalArgumentException("relaygate.queue.concurrency." + provider + " must be at least 1");
            });
            if (resolved.retryDelay.compareTo(resolved.maxRetryDelay) > 0)
                throw new IllegalArgumentException("relaygate.queue.retry-delay must not exceed max-retry-delay");
            return resolved;
        }

        public int concurrencyFor(String provider) {
            return concurrency.getOrDefault(provider, 1);
        }
    }

    public record Alerts(Double errorRate, Double budgetWarningPercent, Double budgetCriticalPercent) {

        static Alerts resolve(Alerts a, GatewayPreset preset) {
            Alerts source = a != null ? a : new Alerts(null, null, null);
            Alerts resolved = new Alerts(
                    source.errorRate != null ? source.errorRate : preset.alertErrorRate(),
                    source.budgetWarningPercent != null ? source.budgetWarningPercent : 80.0,
                    source.budgetCriticalPercent != null ? source.budgetCriticalPercent : 95.0);
            if (resolved.errorRate < 0 || resolved.errorRate > 1)
                throw new IllegalArgumentException("relaygate.alerts.error-rate must be within [0,1]");
            if (resolved.budgetWarningPercent >= resolved.budgetCriticalPercent)
                throw new IllegalArgumentException("relaygate.alerts.budget-warning-percent must be below budget-critical-percent");
            return resolved;
        }
    }

    public record Breaker(Integer failureThreshold, Duration recoveryTimeout, Integer successThreshold) {

        static Breaker resolve(Breaker b, GatewayPreset preset) {
            Breaker source = b != null ? b : new Breaker(null, null, null);
            Breaker resolved = new Breaker(
                    source.failureThreshold != null ? source.failureThreshold : preset.breakerFailureThreshold(),
                    source.recoveryTimeout != null ? source.recoveryTimeout : preset.breakerRecovery(),
                    source.successThreshold != null ? source.successThreshold : 3);
            if (resolved.failureThreshold < 1 || resolved.successThreshold < 1)
                throw new IllegalArgumentException("relaygate.circuit-breaker thresholds must be at least 1");
            return resolved;
        }
    }

    public record RateLimit(Integer requestsPerMinute) {

        static RateLimit resolve(RateLimit r, GatewayPreset preset) {
            int rpm = r != null && r.requestsPerMinute != null ? r.requestsPerMinute : preset.requestsPerMinute();
            if (rpm <= 0)
                throw new IllegalArgumentException("relaygate.rate-limit.requests-per-minute must be positive");
            return new RateLimit(rpm);
        }
    }
}
