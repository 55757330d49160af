package com.geochat.routing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of routing one query. References endpoints by id only, so a result stays
 * valid after the configuration that produced it is replaced.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoutingResult {

    public static final String EARLY_EXIT_VALIDATION_REJECTED = "validation_rejected";
    public static final String EARLY_EXIT_NO_CANDIDATES = "no_candidates";
    public static final String EARLY_EXIT_SEMANTIC_UNAVAILABLE = "semantic_unavailable";

    /**
     * Endpoint id to hand to the analysis service; null when nothing was routed.
     */
    String endpoint;

    double confidence;

    boolean success;

    ValidationResult validation;

    @Singular("layerExecuted")
    List<RoutingLayer> layersExecuted;

    String earlyExit;

    @Singular("reason")
    List<String> reasoning;

    @Singular
    List<Alternative> alternatives;

    UserResponse userResponse;

    /**
     * Entities recognised in the query, for the chat layer's context display.
     */
    @Singular
    List<RecognizedEntity> matchedEntities;
}
