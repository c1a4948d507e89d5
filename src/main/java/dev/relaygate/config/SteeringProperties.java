package dev.relaygate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Steering rule set storage. The file is watched by polling its modification
 * time; {@code defaultProvider} seeds the built-in rule set when no file exists.
 */
@ConfigurationProperties(prefix = "relaygate.steering")
public record SteeringProperties(Path rulesFile, Duration pollInterval, String defaultProvider,
                                 String defaultModel) {
    public SteeringProperties {
        if (rulesFile == null) rulesFile = Path.of("config", "steering-rules.yaml");
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero())
            pollInterval = Duration.ofSeconds(5);
        if (defaultProvider == null || defaultProvider.isBlank()) defaultProvider = "openai";
        if (defaultModel == null || defaultModel.isBlank()) defaultModel = "gpt-3.5-turbo";
    }
}
