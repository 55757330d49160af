package com.geochat.routing.config;

import com.geochat.routing.exception.DomainConfigException;
import com.geochat.routing.model.DomainConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reloads the domain configuration and the field inventory together. Both documents are
 * read and validated before either is published, so a rejected reload changes nothing.
 */
@Service
@Slf4j
public class ConfigReloadService {

    private final RoutingProperties properties;
    private final DomainConfigLoader configLoader;
    private final FieldInventoryLoader fieldInventoryLoader;

    public ConfigReloadService(RoutingProperties properties,
                               DomainConfigLoader configLoader,
                               FieldInventoryLoader fieldInventoryLoader) {
        this.properties = properties;
        this.configLoader = configLoader;
        this.fieldInventoryLoader = fieldInventoryLoader;
    }

    public DomainConfig reload() {
        DomainConfig nextConfig;
        FieldInventoryLoader.Inventory nextInventory;
        try {
            nextConfig = configLoader.load(properties.getConfigLocation());
            nextInventory = fieldInventoryLoader.loadInventory();
        } catch (DomainConfigException e) {
            log.warn("⚠️  Reload rejected, keeping configuration v{}: {}",
                    configLoader.isLoaded() ? configLoader.current().getVersion() : "-", e.getMessage());
            throw e;
        }
        // two reference swaps; a query that started before them keeps its own snapshot
        configLoader.activate(nextConfig);
        fieldInventoryLoader.activate(nextInventory);
        return nextConfig;
    }
}
