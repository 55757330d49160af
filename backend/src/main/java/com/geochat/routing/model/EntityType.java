package com.geochat.routing.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EntityType {
    BRAND("brand"),
    PLACE("place");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
