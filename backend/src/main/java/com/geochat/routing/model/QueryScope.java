package com.geochat.routing.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryScope {
    IN_SCOPE("in_scope"),
    OUT_OF_SCOPE("out_of_scope");

    private final String value;

    QueryScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
