package dev.relaygate.service;

import dev.relaygate.dto.response.ProviderSummary;
import dev.relaygate.infrastructure.ai.ProviderCatalog;
import dev.relaygate.infrastructure.ai.ProviderClientRegistry;
import dev.relaygate.infrastructure.ai.ProviderHealthTracker;
import org.springframework.stereotype.Service;

import java.util.List;

/** Catalog, reachability and live health of every configured provider. */
@Service
public class ProviderOverviewService {

    private final ProviderCatalog catalog;
    private final ProviderClientRegistry clients;
    private final ProviderHealthTracker health;

    public ProviderOverviewService(ProviderCatalog catalog, ProviderClientRegistry clients,
                                   ProviderHealthTracker health) {
        this.catalog = catalog;
        this.clients = clients;
        this.health = health;
    }

    public List<ProviderSummary> listProviders() {
        return catalog.providers().stream()
                .map(name -> new ProviderSummary(name, clients.isAvailable(name),
                        catalog.fallback(name).orElse(null), health.health(name), catalog.models(name)))
                .toList();
    }
}
