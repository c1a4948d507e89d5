package dev.relaygate.config;

import dev.relaygate.domain.enums.ModelSpeed;
import dev.relaygate.domain.enums.OptimizationStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider catalog and optimizer settings.
 *
 * <pre>
 * relaygate.routing:
 *   strategy: balanced
 *   providers:
 *     openai:
 *       chat-model-bean: openAiChatModel
 *       fallback: anthropic
 *       models:
 *         - { name: gpt-4, cost-per-1k-tokens: 0.03, accuracy: 0.95, speed: slow, capabilities: [chat, code] }
 * </pre>
 */
@ConfigurationProperties(prefix = "relaygate.routing")
public record RoutingProperties(OptimizationStrategy strategy, Double healthThreshold,
                                BigDecimal defaultCostPer1kTokens, String defaultCapability,
                                Integer maxOutputTokens, Map<String, Provider> providers) {

    public RoutingProperties {
        if (strategy == null) strategy = OptimizationStrategy.BALANCED;
        if (healthThreshold == null) healthThreshold = 0.5;
        if (defaultCostPer1kTokens == null) defaultCostPer1kTokens = new BigDecimal("0.002");
        if (defaultCapability == null) defaultCapability = "chat";
        providers = providers == null ? Map.of() : new LinkedHashMap<>(providers);
        if (maxOutputTokens != null && maxOutputTokens < 1)
            throw new IllegalArgumentException("relaygate.routing.max-output-tokens must be positive");
        if (healthThreshold < 0 || healthThreshold > 1)
            throw new IllegalArgumentException("relaygate.routing.health-threshold must be within [0,1]");
    }

    public record Provider(Boolean enabled, String chatModelBean, String fallback, List<Model> models) {
        public Provider {
            if (enabled == null) enabled = Boolean.TRUE;
            models = models == null ? List.of() : List.copyOf(models);
        }
    }

    public record Model(String name, BigDecimal costPer1kTokens, Double accuracy, ModelSpeed speed,
                        List<String> capabilities) {
        public Model {
            if (name == null || name.isBlank())
                throw new IllegalArgumentException("relaygate.routing model entries need a name");
            if (costPer1kTokens == null) costPer1kTokens = BigDecimal.ZERO;
            if (accuracy == null) accuracy = 0.8;
            if (speed == null) speed = ModelSpeed.MEDIUM;
            capabilities = capabilities == null ? List.of("chat") : List.copyOf(capabilities);
            if (costPer1kTokens.signum() < 0)
                throw new IllegalArgumentException("relaygate.routing cost-per-1k-tokens must not be negative");
            if (accuracy < 0 || accuracy > 1)
                throw new IllegalArgumentException("relaygate.routing accuracy must be within [0,1]");
        }
    }
}
