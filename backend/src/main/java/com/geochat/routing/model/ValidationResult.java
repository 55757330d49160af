package com.geochat.routing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {

    QueryScope scope;

    double confidence;

    @Singular
    List<String> reasons;

    /**
     * Where to go instead, set when an off-topic pattern fired.
     */
    String redirectMessage;

    @Singular
    List<String> suggestions;

    public boolean isInScope() {
        return scope == QueryScope.IN_SCOPE;
    }
}
