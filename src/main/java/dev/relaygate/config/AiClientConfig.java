package dev.relaygate.config;

import dev.relaygate.infrastructure.ai.ChatModelProviderClient;
import dev.relaygate.infrastructure.ai.ProviderClient;
import dev.relaygate.infrastructure.ai.ProviderClientRegistry;
import dev.relaygate.infrastructure.ai.ProviderHealthTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds each configured provider to the Spring AI {@link ChatModel} bean that serves it.
 * A provider whose bean is missing stays in the catalog but is reported unavailable.
 */
@Configuration
public class AiClientConfig {

    private static final Logger log = LoggerFactory.getLogger(AiClientConfig.class);

    private static final Map<String, String> DEFAULT_BEANS = Map.of(
            "openai", "openAiChatModel",
            "anthropic", "anthropicChatModel",
            "ollama", "ollamaChatModel");

    @Bean
    public ProviderClientRegistry providerClientRegistry(RoutingProperties routing,
                                                         Map<String, ChatModel> chatModels,
                                                         ProviderHealthTracker health) {
        Map<String, ProviderClient> clients = new LinkedHashMap<>();
        routing.providers().forEach((name, provider) -> {
            if (!provider.enabled()) return;
            String beanName = provider.chatModelBean() != null ? provider.chatModelBean()
                    : DEFAULT_BEANS.getOrDefault(name, name + "ChatModel");
            ChatModel model = chatModels.get(beanName);
            if (model == null) {
                log.warn("Provider {} is configured but no ChatModel bean named {} exists", name, beanName);
                return;
            }
            clients.put(name, new ChatModelProviderClient(name, model, health, routing.maxOutputTokens()));
            log.info("Provider {} bound to {}", name, beanName);
        });
        return new ProviderClientRegistry(clients);
    }
}
