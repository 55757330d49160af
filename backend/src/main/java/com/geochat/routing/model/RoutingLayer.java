package com.geochat.routing.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline layers in execution order.
 */
public enum RoutingLayer {
    VALIDATION("validation"),
    INTENT_CLASSIFICATION("intent_classification"),
    DOMAIN_ADAPTATION("domain_adaptation"),
    SEMANTIC_ENHANCEMENT("semantic_enhancement"),
    CONTEXT_ENHANCEMENT("context_enhancement"),
    CONFIDENCE_MANAGEMENT("confidence_management");

    private final String layerName;

    RoutingLayer(String layerName) {
        this.layerName = layerName;
    }

    @JsonValue
    public String getLayerName() {
        return layerName;
    }
}
