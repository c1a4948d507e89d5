package dev.relaygate.config;

import java.time.Duration;
import java.util.Map;

/**
 * Deployment presets. Each one supplies the defaults for every tunable in
 * {@link GatewayProperties}; explicit properties still win.
 *
 * DEVELOPMENT = laptop scale | PRODUCTION = single region | ENTERPRISE = 200+ workers per provider
 */
public enum GatewayPreset {

    DEVELOPMENT(
            new CacheDefaults(0.8, 100, Duration.ofMinutes(30)),
            new QueueDefaults(1_000, Map.of("openai", 3, "anthropic", 2, "ollama", 1),
                    Duration.ofSeconds(30), 2, Duration.ofSeconds(1), Duration.ofSeconds(10)),
            0.10, 5, Duration.ofSeconds(30), 100),

    PRODUCTION(
            new CacheDefaults(0.85, 10_000, Duration.ofHours(1)),
            new QueueDefaults(50_000, Map.of("openai", 50, "anthropic", 30, "ollama", 20),
                    Duration.ofSeconds(60), 3, Duration.ofSeconds(2), Duration.ofSeconds(30)),
            0.05, 10, Duration.ofSeconds(60), 1_000),

    ENTERPRISE(
            new CacheDefaults(0.9, 100_000, Duration.ofHours(2)),
            new QueueDefaults(500_000, Map.of("openai", 200, "anthropic", 150, "ollama", 100),
                    Duration.ofSeconds(120), 5, Duration.ofSeconds(5), Duration.ofSeconds(60)),
            0.02, 20, Duration.ofSeconds(120), 10_000);

    private final CacheDefaults cache;
    private final QueueDefaults queue;
    private final double alertErrorRate;
    private final int breakerFailureThreshold;
    private final Duration breakerRecovery;
    private final int requestsPerMinute;

    GatewayPreset(CacheDefaults cache, QueueDefaults queue, double alertErrorRate,
                  int breakerFailureThreshold, Duration breakerRecovery, int requestsPerMinute) {
        this.cache = cache;
        this.queue = queue;
        this.alertErrorRate = alertErrorRate;
        this.breakerFailureThreshold = breakerFailureThreshold;
        this.breakerRecovery = breakerRecovery;
        this.requestsPerMinute = requestsPerMinute;
    }

    public CacheDefaults cache() { return cache; }
    public QueueDefaults queue() { return queue; }
    public double alertErrorRate() { return alertErrorRate; }
    public int breakerFailureThreshold() { return breakerFailureThreshold; }
    public Duration breakerRecovery() { return breakerRecovery; }
    public int requestsPerMinute() { return requestsPerMinute; }

    public record CacheDefaults(double similarityThreshold, int maxSize, Duration ttl) {}

    public record QueueDefaults(int maxSize, Map<String, Integer> concurrency, Duration timeout,
                                int maxAttempts, Duration retryDelay, Duration maxRetryDelay) {}
}
