package com.geochat.routing.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseType {
    ROUTED("routed"),
    CLARIFY("clarify"),
    REJECTED("rejected");

    private final String value;

    ResponseType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
