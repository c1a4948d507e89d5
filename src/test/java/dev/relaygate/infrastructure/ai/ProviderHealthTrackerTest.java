package dev.relaygate.infrastructure.ai;

import dev.relaygate.config.RoutingProperties;
import dev.relaygate.domain.enums.OptimizationStrategy;
import dev.relaygate.domain.enums.ProviderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderHealthTrackerTest {

    private static final Duration LATENCY = Duration.ofMillis(40);

    private MutableClock clock;
    private ProviderHealthTracker health;
    private CostOptimizer optimizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-15T12:00:00Z"));
        health = RoutingFixtures.healthTracker(clock);
        RoutingProperties routing = RoutingFixtures.routing(OptimizationStrategy.BALANCED);
        optimizer = new CostOptimizer(new ProviderCatalog(routing), health,
                RoutingFixtures.clients("openai", "anthropic"), routing);
    }

    @Test
    @DisplayName("a provider that failed is routed again once its failures age out")
    void recoversAfterFailuresAgeOut() {
        health.recordFailure("anthropic", LATENCY);

        assertThat(health.health("anthropic").status()).isEqualTo(ProviderStatus.UNHEALTHY);
        assertThat(optimizer.rank("chat", "hello", null))
                .extracting(s -> s.model().provider())
                .containsOnly("openai");

        // development preset: 30s recovery timeout
        clock.advance(Duration.ofSeconds(31));

        ProviderHealth recovered = health.health("anthropic");
        assertThat(recovered.status()).isEqualTo(ProviderStatus.HEALTHY);
        assertThat(recovered.errorRate()).isZero();
        assertThat(recovered.errors()).isEqualTo(1);
        assertThat(optimizer.rank("chat", "hello", null))
                .extracting(s -> s.model().provider())
                .contains("anthropic");
    }

    @Test
    @DisplayName("the error rate only covers the most recent calls")
    void rateIsWindowed() {
        for (int i = 0; i < 5; i++) health.recordFailure("openai", LATENCY);
        // window is twice the development failure threshold of 5
        for (int i = 0; i < 10; i++) health.recordSuccess("openai", LATENCY);

        ProviderHealth h = health.health("openai");
        assertThat(h.errorRate()).isZero();
        assertThat(h.requests()).isEqualTo(15);
        assertThat(h.status()).isEqualTo(ProviderStatus.HEALTHY);
    }

    @Test
    @DisplayName("a mixed window is degraded above the alert rate and unhealthy above half")
    void statusBands() {
        health.recordFailure("openai", LATENCY);
        for (int i = 0; i < 3; i++) health.recordSuccess("openai", LATENCY);

        assertThat(health.health("openai").errorRate()).isEqualTo(0.25);
        assertThat(health.health("openai").status()).isEqualTo(ProviderStatus.DEGRADED);

        for (int i = 0; i < 3; i++) health.recordFailure("openai", LATENCY);

        assertThat(health.health("openai").status()).isEqualTo(ProviderStatus.UNHEALTHY);
    }

    @Test
    @DisplayName("only 4xx rejections other than 429 are the caller's fault")
    void callerErrors() {
        assertThat(ProviderHealthTracker.isCallerError(new NonTransientAiException("400 - invalid request"))).isTrue();
        assertThat(ProviderHealthTracker.isCallerError(new NonTransientAiException("429 - slow down"))).isFalse();
        assertThat(ProviderHealthTracker.isCallerError(new TransientAiException("503 - unavailable"))).isFalse();
        assertThat(ProviderHealthTracker.isCallerError(new IllegalStateException("boom"))).isFalse();
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
