package com.example.EV_Charging_Platform.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves adapters by provider name. Registration order is kept for iteration.
 */
public class ProviderRegistry {

    private final Map<String, ProviderAdapter> adaptersByName;

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        Map<String, ProviderAdapter> registry = new LinkedHashMap<>();
        for (ProviderAdapter adapter : adapters) {
            if (adapter == null || adapter.name() == null) {
                throw new IllegalStateException("Provider adapter list contains an unnamed adapter");
            }
            ProviderAdapter existing = registry.putIfAbsent(adapter.name(), adapter);
            if (existing != null) {
                throw new IllegalStateException("Duplicate adapter for provider=" + adapter.name()
                        + ". Existing=" + existing.getClass().getName()
                        + ", new=" + adapter.getClass().getName());
            }
        }
        this.adaptersByName = Collections.unmodifiableMap(registry);
    }

    public Optional<ProviderAdapter> find(String provider) {
        return Optional.ofNullable(adaptersByName.get(provider));
    }

    public ProviderAdapter getRequired(String provider) {
        ProviderAdapter adapter = adaptersByName.get(provider);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for provider=" + provider);
        }
        return adapter;
    }

    public Collection<ProviderAdapter> all() {
        return adaptersByName.values();
    }

    public int size() {
        return adaptersByName.size();
    }
}
