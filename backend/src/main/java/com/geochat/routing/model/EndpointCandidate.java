package com.geochat.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Intent-classifier output for one endpoint.
 */
@Value
@Builder(toBuilder = true)
public class EndpointCandidate {

    String endpointId;

    double rawScore;

    /**
     * Attainable maximum used to normalise {@link #rawScore}.
     */
    double maxScore;

    @Singular
    List<String> matchedTerms;

    @Singular
    List<String> matchedEntities;

    int matchedCategories;

    int priorityRank;

    String reasoning;

    public double getNormalizedScore() {
        if (maxScore <= 0) {
            return 0.0;
        }
        return Math.min(1.0, rawScore / maxScore);
    }
}
