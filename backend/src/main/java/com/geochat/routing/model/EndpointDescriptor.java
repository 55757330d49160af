package com.geochat.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * One downstream analysis pipeline. Immutable for the lifetime of the
 * configuration snapshot that created it.
 */
@Value
@Builder
public class EndpointDescriptor {

    String id;

    String displayName;

    String description;

    @Singular
    List<BoostTerm> boostTerms;

    /**
     * Phrasing that argues against this endpoint; each match subtracts a fixed weight.
     */
    @Singular
    List<BoostTerm> penaltyTerms;

    double minConfidence;

    int priorityRank;

    /**
     * Comparison-style endpoints earn the relational-context bonus.
     */
    boolean comparative;

    @Singular
    Set<EntityType> entityTypes;

    @Singular
    Set<String> requiredFields;

    @Singular
    List<String> exampleQueries;
}
