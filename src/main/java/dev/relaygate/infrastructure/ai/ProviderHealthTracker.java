package dev.relaygate.infrastructure.ai;

import dev.relaygate.config.GatewayProperties;
import dev.relaygate.domain.enums.ProviderStatus;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider outcome statistics and circuit breakers.
 *
 * <p>Latency is an exponential moving average (alpha 0.1). The error rate covers the
 * last {@code 2 x failure-threshold} calls that are younger than the breaker's recovery
 * timeout, so a provider that stopped receiving traffic after a bad spell becomes
 * routable again once its failures age out. Health score is {@code 1 - errorRate},
 * forced to 0 while the provider's breaker is open.
 * Status: unhealthy above 50% errors, degraded above the preset's alert rate.
 *
 * <p>Requests the provider refused because of the caller (4xx other than 429) say
 * nothing about the provider and are counted neither here nor by the breaker.
 */
@Component
public class ProviderHealthTracker {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthTracker.class);
    private static final double LATENCY_ALPHA = 0.1;
    private static final double UNHEALTHY_ERROR_RATE = 0.5;

    private final ConcurrentHashMap<String, Stats> stats = new ConcurrentHashMap<>();
    private final CircuitBreakerRegistry breakers;
    private final CircuitBreakerConfig breakerConfig;
    private final MeterRegistry meterRegistry;
    private final double degradedErrorRate;
    private final int windowSize;
    private final Duration windowAge;
    private final Clock clock;

    public ProviderHealthTracker(CircuitBreakerRegistry breakers, GatewayProperties properties,
                                 MeterRegistry meterRegistry, Clock clock) {
        this.breakers = breakers;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.degradedErrorRate = properties.alerts().errorRate();
        GatewayProperties.Breaker b = properties.circuitBreaker();
        this.windowSize = b.failureThreshold() * 2;
        this.windowAge = b.recoveryTimeout();
        this.breakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .minimumNumberOfCalls(b.failureThreshold())
                .slidingWindowSize(windowSize)
                .waitDurationInOpenState(b.recoveryTimeout())
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .permittedNumberOfCallsInHalfOpenState(b.successThreshold())
                .ignoreException(ProviderHealthTracker::isCallerError)
                .build();
    }

    /** A rejection caused by the request itself rather than by the provider. */
    public static boolean isCallerError(Throwable e) {
        if (e instanceof HttpClientErrorException http) return http.getStatusCode().value() != 429;
        if (e instanceof NonTransientAiException)
            return e.getMessage() == null || !e.getMessage().startsWith("429");
        return false;
    }

    public CircuitBreaker breakerFor(String provider) {
        return breakers.circuitBreaker("provider-" + provider, breakerConfig);
    }

    public void recordSuccess(String provider, Duration latency) {
        statsFor(provider).record(clock.instant(), latency, false, windowSize);
        timer(provider, "success").record(latency);
    }

    public void recordFailure(String provider, Duration latency) {
        statsFor(provider).record(clock.instant(), latency, true, windowSize);
        timer(provider, "error").record(latency);
        Counter.builder("relaygate.provider.errors").tag("provider", provider).register(meterRegistry).increment();
    }

    public ProviderHealth health(String provider) {
        Stats s = statsFor(provider);
        CircuitBreaker.State state = breakerFor(provider).getState();
        double errorRate;
        long requests;
        long errors;
        double latency;
        synchronized (s) {
            requests = s.requests;
            errors = s.errors;
            errorRate = s.recentErrorRate(clock.instant().minus(windowAge));
            latency = s.averageLatencyMs;
        }
        boolean open = state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN;
        double score = open ? 0.0 : 1.0 - errorRate;
        ProviderStatus status = open || errorRate > UNHEALTHY_ERROR_RATE ? ProviderStatus.UNHEALTHY
                : errorRate > degradedErrorRate ? ProviderStatus.DEGRADED
                : ProviderStatus.HEALTHY;
        return new ProviderHealth(provider, requests, errors, errorRate, latency, state.name(), score, status);
    }

    public void reset(String provider) {
        stats.remove(provider);
        breakerFor(provider).reset();
        log.info("Reset health statistics for provider {}", provider);
    }

    // ── Internal ───────────────────────────────────────────────────

    private Stats statsFor(String provider) {
        return stats.computeIfAbsent(provider, p -> new Stats());
    }

    private Timer timer(String provider, String outcome) {
        return Timer.builder("relaygate.provider.latency")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    private record Outcome(Instant at, boolean failed) {}

    private static final class Stats {
        private final Deque<Outcome> recent = new ArrayDeque<>();
        private long requests;
        private long errors;
        private double averageLatencyMs;

        synchronized void record(Instant at, Duration latency, boolean failed, int windowSize) {
            double sample = latency.toNanos() / 1_000_000.0;
            averageLatencyMs = requests == 0 ? sample : LATENCY_ALPHA * sample + (1 - LATENCY_ALPHA) * averageLatencyMs;
            requests++;
            if (failed) errors++;
            recent.addLast(new Outcome(at, failed));
            while (recent.size() > windowSize) recent.removeFirst();
        }

        synchronized double recentErrorRate(Instant since) {
            while (!recent.isEmpty() && recent.peekFirst().at().isBefore(since)) recent.removeFirst();
            if (recent.isEmpty()) return 0.0;
            long failed = recent.stream().filter(Outcome::failed).count();
            return (double) failed / recent.size();
        }
    }
}
