package dev.relaygate.config;

import io.github.resilience4j.common.ratelimiter.configuration.RateLimiterConfigCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Cross-cutting beans that depend on the resolved {@link GatewayProperties}.
 */
@Configuration
public class GatewayConfig {

    public static final String RATE_LIMITER = "gateway";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** The preset's requests-per-minute becomes the inbound rate limit for chat and batch. */
    @Bean
    public RateLimiterConfigCustomizer gatewayRateLimiterCustomizer(GatewayProperties properties) {
        return RateLimiterConfigCustomizer.of(RATE_LIMITER, builder -> builder
                .limitForPeriod(properties.rateLimit().requestsPerMinute())
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO));
    }
}
