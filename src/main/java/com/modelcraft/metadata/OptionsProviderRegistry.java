package com.modelcraft.metadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named {@link OptionsProvider}s, looked up while entity metadata is loaded.
 */
public class OptionsProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(OptionsProviderRegistry.class);

    private final Map<String, OptionsProvider> providers = new LinkedHashMap<>();

    public OptionsProviderRegistry(List<OptionsProvider> providers) {
        providers.forEach(this::register);
    }

    public OptionsProviderRegistry() {
        this(List.of());
    }

    public void register(OptionsProvider provider) {
        var previous = providers.put(provider.name(), provider);
        if (previous != null) {
            log.warn("Options provider '{}' replaced ({} -> {})",
                provider.name(), previous.getClass().getName(), provider.getClass().getName());
        }
    }

    public Optional<OptionsProvider> find(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public List<String> names() {
        return List.copyOf(providers.keySet());
    }
}
