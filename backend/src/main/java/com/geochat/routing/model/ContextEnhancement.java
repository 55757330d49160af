package com.geochat.routing.model;

import lombok.Value;

@Value
public class ContextEnhancement {

    String endpointId;

    /**
     * Fraction of required fields present in the live inventory.
     */
    double coverageScore;

    double contextualBoost;

    FieldRequirements fieldRequirements;

    public boolean hasNoCoverage() {
        return !fieldRequirements.getRequired().isEmpty() && coverageScore == 0.0;
    }

    public boolean isFullyCovered() {
        return fieldRequirements.getMissing().isEmpty();
    }
}
