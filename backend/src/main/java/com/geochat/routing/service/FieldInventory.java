package com.geochat.routing.service;

/**
 * Read-only view of which data fields are currently populated for each endpoint.
 * Supplied by the data layer; the router never writes to it.
 */
public interface FieldInventory {

    /**
     * @return true when {@code fieldName} exists and is non-empty for {@code endpointId}
     */
    boolean hasField(String endpointId, String fieldName);
}
