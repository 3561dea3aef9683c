package com.intention.provider;

import com.intention.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up provider adapters by name.
 */
@Slf4j
@Service
public class ProviderRegistry {

    private final Map<String, ProviderAdapter> providers = new LinkedHashMap<>();

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            providers.put(adapter.getName(), adapter);
        }
        log.info("Initialized ProviderRegistry with {} providers: {} (enabled: {})",
                providers.size(), providers.keySet(), enabledNames());
    }

    /**
     * @throws ProviderException (fatal) when the provider is unknown or disabled
     */
    public ProviderAdapter require(String name) {
        ProviderAdapter adapter = providers.get(name);
        if (adapter == null) {
            throw ProviderException.fatal(name, "Unknown provider: " + name + ". Enabled providers: " + enabledNames());
        }
        if (!adapter.isEnabled()) {
            throw ProviderException.fatal(name, "Provider '" + name + "' is not enabled");
        }
        return adapter;
    }

    public List<ProviderAdapter> getProviders() {
        return List.copyOf(providers.values());
    }

    public List<String> enabledNames() {
        return providers.values().stream()
                .filter(ProviderAdapter::isEnabled)
                .map(ProviderAdapter::getName)
                .toList();
    }
}
