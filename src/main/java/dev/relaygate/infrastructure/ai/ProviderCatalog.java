package dev.relaygate.infrastructure.ai;

import dev.relaygate.config.RoutingProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the configured providers and their models. Disabled providers are left out.
 */
@Component
public class ProviderCatalog {

    private final Map<String, List<ModelSpec>> models = new LinkedHashMap<>();
    private final Map<String, String> fallbacks = new LinkedHashMap<>();
    private final BigDecimal defaultPrice;

    public ProviderCatalog(RoutingProperties properties) {
        this.defaultPrice = properties.defaultCostPer1kTokens();
        properties.providers().forEach((name, provider) -> {
            if (!provider.enabled()) return;
            List<ModelSpec> specs = new ArrayList<>();
            for (RoutingProperties.Model m : provider.models()) {
                specs.add(new ModelSpec(name, m.name(), m.costPer1kTokens(), m.accuracy(), m.speed(), m.capabilities()));
            }
            models.put(name, List.copyOf(specs));
            if (provider.fallback() != null) fallbacks.put(name, provider.fallback());
        });
    }

    public Set<String> providers() {
        return Collections.unmodifiableSet(models.keySet());
    }

    public boolean hasProvider(String provider) {
        return models.containsKey(provider);
    }

    public List<ModelSpec> models(String provider) {
        return models.getOrDefault(provider, List.of());
    }

    public Optional<ModelSpec> model(String provider, String model) {
        return models(provider).stream().filter(m -> m.name().equals(model)).findFirst();
    }

    /** First configured model of the provider. */
    public Optional<ModelSpec> defaultModel(String provider) {
        return models(provider).stream().findFirst();
    }

    public Optional<String> fallback(String provider) {
        return Optional.ofNullable(fallbacks.get(provider));
    }

    public List<ModelSpec> modelsWithCapability(String capability) {
        return models.values().stream().flatMap(List::stream).filter(m -> m.supports(capability)).toList();
    }

    /** Unknown models are priced at the configured default. */
    public BigDecimal pricePer1k(String provider, String model) {
        return model(provider, model).map(ModelSpec::costPer1kTokens).orElse(defaultPrice);
    }
}
