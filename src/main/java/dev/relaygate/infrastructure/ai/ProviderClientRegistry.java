package dev.relaygate.infrastructure.ai;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Provider clients that are actually reachable, keyed by provider name. */
public class ProviderClientRegistry {

    private final Map<String, ProviderClient> clients;

    public ProviderClientRegistry(Map<String, ProviderClient> clients) {
        this.clients = Collections.unmodifiableMap(new LinkedHashMap<>(clients));
    }

    public Optional<ProviderClient> find(String provider) {
        return Optional.ofNullable(provider).map(clients::get);
    }

    public boolean isAvailable(String provider) {
        return provider != null && clients.containsKey(provider);
    }

    public Set<String> providers() {
        return clients.keySet();
    }
}
