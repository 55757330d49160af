package com.geochat.routing.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geochat.routing.exception.DomainConfigException;
import com.geochat.routing.service.FieldInventory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads field-inventory.json: record counts per data field, shared across endpoints or
 * scoped to one. A field counts as present when its count is positive.
 * A missing inventory file leaves every field unavailable rather than failing startup.
 */
@Component
@Slf4j
public class FieldInventoryLoader implements FieldInventory {

    private final RoutingProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<Inventory> inventory = new AtomicReference<>(new Inventory());

    public FieldInventoryLoader(RoutingProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void load() {
        Resource resource = resourceLoader.getResource(properties.getFieldInventoryLocation());
        if (!resource.exists()) {
            log.warn("⚠️  Field inventory {} not found; every endpoint will report zero coverage",
                    properties.getFieldInventoryLocation());
            return;
        }
        inventory.set(read(resource));
    }

    /**
     * Re-reads the inventory and swaps it in; the previous inventory stays on failure.
     */
    public void reload() {
        activate(loadInventory());
    }

    /**
     * Reads the inventory at the configured location without publishing it.
     */
    Inventory loadInventory() {
        Resource resource = resourceLoader.getResource(properties.getFieldInventoryLocation());
        if (!resource.exists()) {
            throw new DomainConfigException("Field inventory not found: " + properties.getFieldInventoryLocation());
        }
        return read(resource);
    }

    void activate(Inventory next) {
        inventory.set(next);
    }

    @Override
    public boolean hasField(String endpointId, String fieldName) {
        Inventory current = inventory.get();
        Map<String, Long> scoped = current.getEndpointFields().getOrDefault(endpointId, Collections.emptyMap());
        Long count = scoped.containsKey(fieldName) ? scoped.get(fieldName) : current.getSharedFields().get(fieldName);
        return count != null && count > 0;
    }

    private Inventory read(Resource resource) {
        try (InputStream is = resource.getInputStream()) {
            Inventory loaded = objectMapper.readValue(is, Inventory.class);
            if (loaded.getSharedFields() == null) {
                loaded.setSharedFields(new HashMap<>());
            }
            if (loaded.getEndpointFields() == null) {
                loaded.setEndpointFields(new HashMap<>());
            }
            log.info("✅ Loaded field inventory: {} shared fields, {} endpoint-specific groups",
                    loaded.getSharedFields().size(), loaded.getEndpointFields().size());
            return loaded;
        } catch (Exception e) {
            log.error("❌ Error loading field inventory {}: {}", resource.getDescription(), e.getMessage(), e);
            throw new DomainConfigException("Cannot load field inventory: " + e.getMessage(), e);
        }
    }

    @Data
    @NoArgsConstructor
    static class Inventory {
        @JsonProperty("shared_fields")
        private Map<String, Long> sharedFields = new HashMap<>();

        @JsonProperty("endpoint_fields")
        private Map<String, Map<String, Long>> endpointFields = new HashMap<>();
    }
}
