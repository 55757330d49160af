package com.geochat.routing.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Similarity per candidate endpoint id, each in [0,1].
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityResponse {
    private Map<String, Double> scores;
}
