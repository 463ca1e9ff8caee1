package com.janus.service;

import com.janus.exception.ConfigurationException;
import com.janus.provider.ProviderAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the adapter serving a model. Adapters are consulted in their declared order
 * (explicit providers, then aliases, then pass-through) and the first enabled match wins.
 */
@Slf4j
@Service
public class AdapterRouter {

    private final List<ProviderAdapter> adapters;

    public AdapterRouter(List<ProviderAdapter> adapters) {
        this.adapters = adapters;
        log.info("Initialized AdapterRouter with {} adapters: {}",
                adapters.size(),
                adapters.stream().map(ProviderAdapter::getName).toList());
    }

    /**
     * @throws ConfigurationException when every candidate is disabled
     */
    public ProviderAdapter selectAdapter(String model) {
        ProviderAdapter adapter = adapters.stream()
                .filter(ProviderAdapter::isEnabled)
                .filter(a -> a.supports(model))
                .findFirst()
                .orElse(null);

        if (adapter == null) {
            log.error("No enabled adapter found for model: {}", model);
            throw new ConfigurationException("No provider available for model: " + model
                    + ". Enabled adapters: " + adapters.stream()
                    .filter(ProviderAdapter::isEnabled)
                    .map(ProviderAdapter::getName)
                    .toList());
        }

        log.info("Routing model '{}' to adapter '{}'", model, adapter.getName());
        return adapter;
    }

    public List<ProviderAdapter> getAdapters() {
        return adapters;
    }
}
