package tech.yump.credstore.provider;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ordered, fixed set of providers supplied by configuration. Immutable after construction.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, Provider> providers;

    public ProviderRegistry(Collection<String> providerIds) {
        if (providerIds == null || providerIds.isEmpty()) {
            throw new IllegalArgumentException("At least one provider id is required.");
        }
        Map<String, Provider> byId = new LinkedHashMap<>();
        for (String id : providerIds) {
            if (byId.putIfAbsent(id, new Provider(id)) != null) {
                throw new IllegalArgumentException("Duplicate provider id: " + id);
            }
        }
        this.providers = byId;
        log.info("Provider registry initialized with {} providers: {}", byId.size(), byId.keySet());
    }

    public List<Provider> all() {
        return List.copyOf(providers.values());
    }

    public Optional<Provider> find(String id) {
        return Optional.ofNullable(providers.get(id));
    }

    /**
     * @throws UnknownProviderException if the id is not configured.
     */
    public Provider require(String id) {
        return find(id).orElseThrow(() -> new UnknownProviderException(id));
    }

    public boolean contains(Provider provider) {
        return provider != null && providers.containsKey(provider.id());
    }

    /**
     * @return the storage keys of all configured providers, in configuration order.
     */
    public List<String> storageKeys() {
        return providers.values().stream().map(Provider::storageKey).toList();
    }
}
